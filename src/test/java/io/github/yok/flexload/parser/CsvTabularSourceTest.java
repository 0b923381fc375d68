package io.github.yok.flexload.parser;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import io.github.yok.flexload.exception.SourceReadException;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.NoSuchElementException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class CsvTabularSourceTest {

    @TempDir
    Path tempDir;

    private Path write(String content) throws IOException {
        Path file = tempDir.resolve("data.csv");
        Files.write(file, content.getBytes(StandardCharsets.UTF_8));
        return file;
    }

    private static List<SourceRow> readAll(TabularSource source) {
        List<SourceRow> rows = new ArrayList<>();
        while (source.hasNext()) {
            rows.add(source.next());
        }
        return rows;
    }

    @Test
    void next_正常ケース_BOM付きファイルを指定する_先頭見出しにBOMが含まれないこと() throws Exception {
        Path file = write("\uFEFFName,Score\nAlice,10\n");
        try (CsvTabularSource source = new CsvTabularSource(file)) {
            List<SourceRow> rows = readAll(source);
            assertEquals(2, rows.size());
            assertEquals(Arrays.asList("Name", "Score"), rows.get(0).texts());
            assertEquals("Alice", rows.get(1).cell(0).value(true));
            assertEquals(0, source.getSkippedRows());
        }
    }

    @Test
    void next_正常ケース_引用符と前後空白と空行を含む_トリムされ空行が無視されること() throws Exception {
        Path file = write("A,B\n  x  , \"he said \"\"hi\"\"\" \n\n\"multi\nline\",y\n");
        try (CsvTabularSource source = new CsvTabularSource(file)) {
            List<SourceRow> rows = readAll(source);
            assertEquals(3, rows.size());
            assertEquals("x", rows.get(1).cell(0).value(false));
            assertEquals("he said \"hi\"", rows.get(1).cell(1).value(false));
            assertEquals("multi\nline", rows.get(2).cell(0).value(false));
        }
    }

    @Test
    void next_正常ケース_列数が不揃いな行を含む_短い行の不足列は値なしになること() throws Exception {
        Path file = write("A,B,C\n1\n1,2,3,4\n");
        try (CsvTabularSource source = new CsvTabularSource(file)) {
            List<SourceRow> rows = readAll(source);
            assertEquals(3, rows.size());
            assertNull(rows.get(1).cell(2).value(false));
            assertTrue(rows.get(1).cell(2).isBlank());
            assertEquals(4, rows.get(2).getCells().size());
        }
    }

    @Test
    void next_異常ケース_閉じられていない引用符を含む_読み込み不能な行として数えられること()
            throws Exception {
        Path file = write("A,B\nx,y\n1,\"abc\n2,def\n3,ghi\n");
        try (CsvTabularSource source = new CsvTabularSource(file)) {
            List<SourceRow> rows = readAll(source);
            assertEquals(2, rows.size());
            assertEquals(Arrays.asList("x", "y"), rows.get(1).texts());
            assertEquals(1, source.getSkippedRows());
        }
    }

    @Test
    void next_異常ケース_読み切った後に呼び出す_NoSuchElementExceptionが送出されること()
            throws Exception {
        Path file = write("A\n");
        try (CsvTabularSource source = new CsvTabularSource(file)) {
            source.next();
            assertFalse(source.hasNext());
            assertThrows(NoSuchElementException.class, source::next);
        }
    }

    @Test
    void constructor_異常ケース_存在しないファイルを指定する_SourceReadExceptionが送出されること() {
        assertThrows(SourceReadException.class,
                () -> new CsvTabularSource(tempDir.resolve("missing.csv")));
    }

    @Test
    void describe_正常ケース_ファイル名が返ること() throws Exception {
        Path file = write("A\n");
        try (CsvTabularSource source = new CsvTabularSource(file)) {
            assertEquals("data.csv", source.describe());
            assertNull(source.getSheetName());
        }
    }
}
