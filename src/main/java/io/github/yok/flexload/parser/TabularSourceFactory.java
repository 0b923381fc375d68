package io.github.yok.flexload.parser;

import io.github.yok.flexload.exception.SourceReadException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.io.FilenameUtils;
import org.springframework.stereotype.Component;

/**
 * Opens the {@link TabularSource} matching a file's extension.
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
@Component
public class TabularSourceFactory {

    /**
     * Opens a source file.
     *
     * @param file source file
     * @param sheetName sheet for spreadsheet sources; ignored for CSV
     * @return open source; the caller closes it
     * @throws SourceReadException if the file is missing, unsupported or cannot be opened
     */
    public TabularSource open(Path file, String sheetName) throws SourceReadException {
        if (file == null || !Files.isRegularFile(file)) {
            throw new SourceReadException("Input file not found: " + file);
        }
        String extension = FilenameUtils.getExtension(file.getFileName().toString());
        SourceFormat format = SourceFormat.fromExtension(extension);
        if (format == null) {
            throw new SourceReadException("Unsupported file type '" + extension + "': " + file
                    + " (supported: csv, xlsx, xls)");
        }
        log.info("Opening {} source: {}", format.name().toLowerCase(Locale.ROOT), file);
        switch (format) {
            case CSV:
                return new CsvTabularSource(file);
            case SPREADSHEET:
            default:
                return new SpreadsheetTabularSource(file, sheetName);
        }
    }
}
