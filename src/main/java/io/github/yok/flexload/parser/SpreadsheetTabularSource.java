package io.github.yok.flexload.parser;

import io.github.yok.flexload.exception.SourceReadException;
import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.NoSuchElementException;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.apache.poi.ss.usermodel.Cell;
import org.apache.poi.ss.usermodel.CellType;
import org.apache.poi.ss.usermodel.DateUtil;
import org.apache.poi.ss.usermodel.Hyperlink;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.ss.usermodel.WorkbookFactory;

/**
 * Spreadsheet source (xlsx / xls) read with Apache POI.
 *
 * <p>
 * Rows are returned from the first to the last physical row of the selected sheet; a missing row
 * in between yields a row of absent cells. Data rows are cut or padded to the width of the header
 * row. Formula cells yield their cached result and cells carrying a hyperlink address become
 * {@link HyperlinkCell}.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public class SpreadsheetTabularSource implements TabularSource {

    private final Path file;
    private final Workbook workbook;
    private final Sheet sheet;
    private final int lastRow;
    private int currentRow;
    private int width = -1;

    /**
     * Opens a workbook and selects a sheet.
     *
     * @param file spreadsheet file
     * @param sheetName sheet to read; {@code null} or blank selects the first sheet
     * @throws SourceReadException if the file cannot be opened or the sheet does not exist
     */
    public SpreadsheetTabularSource(Path file, String sheetName) throws SourceReadException {
        this.file = file;
        try {
            this.workbook = WorkbookFactory.create(file.toFile(), null, true);
        } catch (IOException | RuntimeException e) {
            throw new SourceReadException("Failed to open spreadsheet: " + file, e);
        }
        if (workbook.getNumberOfSheets() == 0) {
            closeQuietly();
            throw new SourceReadException("Spreadsheet has no sheets: " + file);
        }
        if (StringUtils.isBlank(sheetName)) {
            this.sheet = workbook.getSheetAt(0);
        } else {
            this.sheet = workbook.getSheet(sheetName);
            if (sheet == null) {
                List<String> names = new ArrayList<>();
                workbook.sheetIterator().forEachRemaining(s -> names.add(s.getSheetName()));
                closeQuietly();
                throw new SourceReadException("Sheet '" + sheetName + "' not found in "
                        + file.getFileName() + ". Available sheets: " + names);
            }
        }
        if (sheet.getPhysicalNumberOfRows() == 0) {
            this.currentRow = 0;
            this.lastRow = -1;
        } else {
            this.currentRow = sheet.getFirstRowNum();
            this.lastRow = sheet.getLastRowNum();
        }
        log.debug("Opened sheet '{}' of {}: rows {}..{}", sheet.getSheetName(),
                file.getFileName(), currentRow, lastRow);
    }

    @Override
    public boolean hasNext() {
        return currentRow <= lastRow;
    }

    @Override
    public SourceRow next() {
        if (!hasNext()) {
            throw new NoSuchElementException();
        }
        Row row = sheet.getRow(currentRow);
        if (width < 0) {
            width = row == null ? 0 : Math.max(row.getLastCellNum(), 0);
        }
        List<SourceCell> cells = new ArrayList<>(width);
        for (int i = 0; i < width; i++) {
            Cell cell =
                    row == null ? null : row.getCell(i, Row.MissingCellPolicy.RETURN_BLANK_AS_NULL);
            cells.add(toSourceCell(cell));
        }
        currentRow++;
        return new SourceRow(currentRow, cells);
    }

    static SourceCell toSourceCell(Cell cell) {
        if (cell == null) {
            return new TextCell(null);
        }
        SourceCell display = displayCell(cell);
        Hyperlink link = cell.getHyperlink();
        if (link != null && StringUtils.isNotBlank(link.getAddress())) {
            return new HyperlinkCell(display, link.getAddress());
        }
        return display;
    }

    private static SourceCell displayCell(Cell cell) {
        CellType type = cell.getCellType();
        if (type == CellType.FORMULA) {
            type = cell.getCachedFormulaResultType();
        }
        switch (type) {
            case STRING:
                return new TextCell(cell.getStringCellValue());
            case NUMERIC:
                if (DateUtil.isCellDateFormatted(cell)) {
                    return new DateCell(DateUtil.getLocalDateTime(cell.getNumericCellValue(),
                            false, true));
                }
                return new NumericCell(cell.getNumericCellValue());
            case BOOLEAN:
                return new TextCell(String.valueOf(cell.getBooleanCellValue()));
            case BLANK:
            case ERROR:
            default:
                return new TextCell(null);
        }
    }

    @Override
    public long getSkippedRows() {
        return 0;
    }

    @Override
    public String describe() {
        return file.getFileName() + " [" + sheet.getSheetName() + "]";
    }

    @Override
    public String getSheetName() {
        return sheet.getSheetName();
    }

    @Override
    public void close() throws IOException {
        workbook.close();
    }

    private void closeQuietly() {
        try {
            workbook.close();
        } catch (IOException e) {
            log.warn("Failed to close workbook {}: {}", file.getFileName(), e.getMessage());
        }
    }
}
