package io.github.yok.flexload.core;

import com.google.common.collect.ImmutableList;
import java.time.Duration;
import java.util.List;
import java.util.Locale;
import lombok.Getter;
import lombok.ToString;

/**
 * Outcome of a successful run.
 *
 * <p>
 * {@code totalRows = processedRows + emptyRows + skippedRows}. {@code processedRows} counts rows
 * confirmed in the destination and is reported as {@code validRows}.
 * </p>
 */
@Getter
@ToString
public final class RunSummary {

    private final String inputFile;
    private final String tableName;
    private final String sheetName;
    private final long processedRows;
    private final long emptyRows;
    private final long skippedRows;
    private final long coercionWarnings;
    private final ImmutableList<String> missingColumns;
    private final Duration duration;

    RunSummary(String inputFile, String tableName, String sheetName, long processedRows,
            long emptyRows, long skippedRows, long coercionWarnings, List<String> missingColumns,
            Duration duration) {
        this.inputFile = inputFile;
        this.tableName = tableName;
        this.sheetName = sheetName;
        this.processedRows = processedRows;
        this.emptyRows = emptyRows;
        this.skippedRows = skippedRows;
        this.coercionWarnings = coercionWarnings;
        this.missingColumns = ImmutableList.copyOf(missingColumns);
        this.duration = duration;
    }

    public long getTotalRows() {
        return processedRows + emptyRows + skippedRows;
    }

    public long getValidRows() {
        return processedRows;
    }

    /**
     * Returns the duration in seconds with two decimals (e.g. {@code 12.34}).
     *
     * @return formatted seconds
     */
    public String getDurationSeconds() {
        return String.format(Locale.ROOT, "%.2f", duration.toMillis() / 1000.0);
    }
}
