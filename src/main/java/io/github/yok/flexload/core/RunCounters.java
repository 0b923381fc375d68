package io.github.yok.flexload.core;

import java.time.Duration;
import java.util.List;
import lombok.Getter;

/**
 * Mutable counters of one run. Turned into an immutable {@link RunSummary} once at the end.
 */
@Getter
public class RunCounters {

    // Rows of batches whose INSERT completed
    private long processedRows;

    // Rows whose every value was null
    private long emptyRows;

    // Source records that could not be parsed
    private long skippedRows;

    // Values that could not be coerced and were loaded as null
    private long coercionWarnings;

    public void addProcessedRows(long count) {
        processedRows += count;
    }

    public void incrementEmptyRows() {
        emptyRows++;
    }

    public void addSkippedRows(long count) {
        skippedRows += count;
    }

    public void incrementCoercionWarnings() {
        coercionWarnings++;
    }

    /**
     * Finalizes the counters.
     *
     * @param inputFile base name of the source file
     * @param tableName destination table
     * @param sheetName sheet read, or {@code null}
     * @param missingColumns configured headers absent from the source
     * @param duration run duration
     * @return summary
     */
    public RunSummary toSummary(String inputFile, String tableName, String sheetName,
            List<String> missingColumns, Duration duration) {
        return new RunSummary(inputFile, tableName, sheetName, processedRows, emptyRows,
                skippedRows, coercionWarnings, missingColumns, duration);
    }
}
