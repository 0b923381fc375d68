package io.github.yok.flexload.parser;

import io.github.yok.flexload.exception.SourceReadException;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;
import org.apache.commons.io.input.BOMInputStream;

/**
 * Delimited-text source read with Apache Commons CSV.
 *
 * <p>
 * UTF-8 with an optional byte order mark, comma separated, double-quote quoting. Values are
 * trimmed, empty lines are ignored and records may have any number of fields. A record the parser
 * cannot read is skipped with a warning; more than {@value #MAX_CONSECUTIVE_FAILURES}
 * consecutive failures abort the read. A quote left open until the end of the file makes the
 * parser fail on that record, so the lines it swallowed are reported as one skipped record.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public class CsvTabularSource implements TabularSource {

    static final int MAX_CONSECUTIVE_FAILURES = 100;

    private static final CSVFormat FORMAT = CSVFormat.DEFAULT.builder().setTrim(true)
            .setIgnoreSurroundingSpaces(true).setIgnoreEmptyLines(true).setTrailingData(true)
            .get();

    private final Path file;
    private final CSVParser parser;
    private final Iterator<CSVRecord> records;
    private SourceRow next;
    private long skippedRows;

    /**
     * Opens a CSV file.
     *
     * @param file CSV file
     * @throws SourceReadException if the file cannot be opened
     */
    public CsvTabularSource(Path file) throws SourceReadException {
        this.file = file;
        try {
            Reader reader = new InputStreamReader(BOMInputStream.builder()
                    .setInputStream(Files.newInputStream(file)).get(), StandardCharsets.UTF_8);
            this.parser = FORMAT.parse(reader);
        } catch (IOException e) {
            throw new SourceReadException("Failed to open CSV file: " + file, e);
        }
        this.records = parser.iterator();
    }

    @Override
    public boolean hasNext() {
        if (next == null) {
            next = advance();
        }
        return next != null;
    }

    @Override
    public SourceRow next() {
        if (!hasNext()) {
            throw new NoSuchElementException();
        }
        SourceRow row = next;
        next = null;
        return row;
    }

    private SourceRow advance() {
        int failures = 0;
        while (true) {
            long startLine = parser.getCurrentLineNumber() + 1;
            try {
                if (!records.hasNext()) {
                    return null;
                }
                CSVRecord record = records.next();
                List<SourceCell> cells = new ArrayList<>(record.size());
                for (String value : record) {
                    cells.add(new TextCell(value));
                }
                return new SourceRow(record.getRecordNumber(), cells);
            } catch (UncheckedIOException | IllegalStateException e) {
                failures++;
                skippedRows++;
                log.warn("Skipping unparsable CSV record at lines {}-{} of {}: {}", startLine,
                        Math.max(startLine, parser.getCurrentLineNumber()), file.getFileName(),
                        e.getMessage());
                if (failures > MAX_CONSECUTIVE_FAILURES) {
                    throw new UncheckedIOException(new IOException(
                            "Too many consecutive unparsable records in " + file.getFileName()
                                    + " (last near line " + parser.getCurrentLineNumber() + ")",
                            e));
                }
            }
        }
    }

    @Override
    public long getSkippedRows() {
        return skippedRows;
    }

    @Override
    public String describe() {
        return String.valueOf(file.getFileName());
    }

    @Override
    public void close() throws IOException {
        parser.close();
    }
}
