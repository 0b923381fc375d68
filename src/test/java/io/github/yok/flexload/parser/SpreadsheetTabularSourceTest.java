package io.github.yok.flexload.parser;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import io.github.yok.flexload.exception.SourceReadException;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import org.apache.poi.common.usermodel.HyperlinkType;
import org.apache.poi.ss.usermodel.Cell;
import org.apache.poi.ss.usermodel.CellStyle;
import org.apache.poi.ss.usermodel.Hyperlink;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class SpreadsheetTabularSourceTest {

    @TempDir
    Path tempDir;

    private Path workbook;

    @BeforeEach
    void setup() throws Exception {
        workbook = tempDir.resolve("report.xlsx");
        try (XSSFWorkbook wb = new XSSFWorkbook()) {
            Sheet summary = wb.createSheet("Summary");
            summary.createRow(0).createCell(0).setCellValue("ignored");

            Sheet data = wb.createSheet("Data");
            Row header = data.createRow(0);
            header.createCell(0).setCellValue("Name");
            header.createCell(1).setCellValue("Score");
            header.createCell(2).setCellValue("Evidence");
            header.createCell(3).setCellValue("Total");

            Row first = data.createRow(1);
            first.createCell(0).setCellValue("Alice");
            first.createCell(1).setCellValue(12.0);
            Cell link = first.createCell(2);
            link.setCellValue("open");
            Hyperlink hyperlink = wb.getCreationHelper().createHyperlink(HyperlinkType.URL);
            hyperlink.setAddress("https://example.com/evidence/1");
            link.setHyperlink(hyperlink);
            Cell formula = first.createCell(3);
            formula.setCellFormula("B2*2");
            wb.getCreationHelper().createFormulaEvaluator().evaluateFormulaCell(formula);
            first.createCell(5).setCellValue("beyond header");

            // row index 2 left out on purpose
            Row third = data.createRow(3);
            third.createCell(0).setCellValue(true);

            try (OutputStream out = Files.newOutputStream(workbook)) {
                wb.write(out);
            }
        }
    }

    private static List<SourceRow> readAll(TabularSource source) {
        List<SourceRow> rows = new ArrayList<>();
        while (source.hasNext()) {
            rows.add(source.next());
        }
        return rows;
    }

    @Test
    void next_正常ケース_シート名を指定する_指定シートの全行が見出し幅で返ること() throws Exception {
        try (SpreadsheetTabularSource source = new SpreadsheetTabularSource(workbook, "Data")) {
            List<SourceRow> rows = readAll(source);

            assertEquals(4, rows.size());
            assertEquals(Arrays.asList("Name", "Score", "Evidence", "Total"), rows.get(0).texts());

            SourceRow first = rows.get(1);
            assertEquals(4, first.getCells().size());
            assertEquals("Alice", first.cell(0).value(true));
            assertEquals(12.0, first.cell(1).value(true));
            assertEquals("https://example.com/evidence/1", first.cell(2).value(true));
            assertEquals("open", first.cell(2).value(false));
            assertEquals(24.0, first.cell(3).value(false));

            assertTrue(rows.get(2).cell(0).isBlank());
            assertEquals("true", rows.get(3).cell(0).value(false));
            assertEquals("Data", source.getSheetName());
            assertEquals("report.xlsx [Data]", source.describe());
        }
    }

    @Test
    void next_正常ケース_シート名未指定_先頭シートが読まれること() throws Exception {
        try (SpreadsheetTabularSource source = new SpreadsheetTabularSource(workbook, null)) {
            assertEquals("Summary", source.getSheetName());
            assertEquals(Arrays.asList("ignored"), source.next().texts());
            assertFalse(source.hasNext());
        }
    }

    @Test
    void constructor_異常ケース_存在しないシートを指定する_利用可能なシート名を含む例外が送出されること() {
        SourceReadException ex = assertThrows(SourceReadException.class,
                () -> new SpreadsheetTabularSource(workbook, "Nope"));
        assertTrue(ex.getMessage().contains("[Summary, Data]"));
    }

    @Test
    void constructor_異常ケース_壊れたファイルを指定する_SourceReadExceptionが送出されること()
            throws Exception {
        Path broken = tempDir.resolve("broken.xlsx");
        Files.write(broken, new byte[] {1, 2, 3, 4});
        assertThrows(SourceReadException.class, () -> new SpreadsheetTabularSource(broken, null));
    }

    @Test
    void toSourceCell_正常ケース_nullを指定する_値なしセルが返ること() {
        assertNull(SpreadsheetTabularSource.toSourceCell(null).value(true));
    }

    @Test
    void toSourceCell_正常ケース_日付書式の数値セル_日時の値が返ること() throws Exception {
        try (XSSFWorkbook wb = new XSSFWorkbook()) {
            CellStyle style = wb.createCellStyle();
            style.setDataFormat(wb.createDataFormat().getFormat("yyyy-mm-dd hh:mm"));
            Cell cell = wb.createSheet("Data").createRow(0).createCell(0);
            cell.setCellValue(LocalDateTime.of(2025, 2, 5, 19, 20));
            cell.setCellStyle(style);

            SourceCell sourceCell = SpreadsheetTabularSource.toSourceCell(cell);

            assertTrue(sourceCell instanceof DateCell);
            assertEquals(LocalDateTime.of(2025, 2, 5, 19, 20), sourceCell.value(false));
            assertFalse(sourceCell.isBlank());
        }
    }

    @Test
    void toSourceCell_正常ケース_標準書式の数値セル_数値のまま返ること() throws Exception {
        try (XSSFWorkbook wb = new XSSFWorkbook()) {
            Cell cell = wb.createSheet("Data").createRow(0).createCell(0);
            cell.setCellValue(45693.5);

            assertEquals(45693.5, SpreadsheetTabularSource.toSourceCell(cell).value(false));
        }
    }
}
