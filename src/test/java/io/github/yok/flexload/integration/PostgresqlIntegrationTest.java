package io.github.yok.flexload.integration;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import io.github.yok.flexload.config.ColumnSpec;
import io.github.yok.flexload.config.ConnectionConfig;
import io.github.yok.flexload.config.LoadConfig;
import io.github.yok.flexload.config.TableConfigLoader;
import io.github.yok.flexload.core.FieldType;
import io.github.yok.flexload.core.LoadRequest;
import io.github.yok.flexload.core.ProgressListener;
import io.github.yok.flexload.core.RunSummary;
import io.github.yok.flexload.core.SchemaResolver;
import io.github.yok.flexload.core.TableLoader;
import io.github.yok.flexload.db.ConnectionProvider;
import io.github.yok.flexload.db.TableName;
import io.github.yok.flexload.db.postgresql.PostgresqlDialect;
import io.github.yok.flexload.exception.BatchInsertException;
import io.github.yok.flexload.parser.TabularSourceFactory;
import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.Statement;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.util.Arrays;
import java.util.List;
import org.apache.commons.lang3.StringUtils;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;
import org.testcontainers.postgresql.PostgreSQLContainer;

/**
 * Integration tests for {@link TableLoader} against a PostgreSQL container.
 */
@Testcontainers(disabledWithoutDocker = true)
public class PostgresqlIntegrationTest {

    @TempDir
    public Path tempDir;

    @Container
    private static final PostgreSQLContainer postgres = createPostgres();

    private static PostgreSQLContainer createPostgres() {
        PostgreSQLContainer container = new PostgreSQLContainer("postgres:16-alpine");
        container.withDatabaseName("testdb").withUsername("test").withPassword("test");
        return container;
    }

    private Connection connection;
    private TableLoader loader;

    @BeforeEach
    public void setup() throws Exception {
        ConnectionConfig config = new ConnectionConfig();
        config.setUrl(postgres.getJdbcUrl());
        config.setUser(postgres.getUsername());
        config.setPassword(postgres.getPassword());
        connection = new ConnectionProvider(config).open();
        try (Statement st = connection.createStatement()) {
            st.execute("DROP SCHEMA IF EXISTS it CASCADE");
            st.execute("CREATE SCHEMA it");
        }
        loader = new TableLoader(new TabularSourceFactory(), new TableConfigLoader(),
                new SchemaResolver(new LoadConfig()), new PostgresqlDialect(63),
                ProgressListener.NONE, 1000);
    }

    @AfterEach
    public void teardown() throws Exception {
        connection.close();
    }

    private Path csv(String name, String content) throws Exception {
        Path file = tempDir.resolve(name);
        Files.write(file, content.getBytes(StandardCharsets.UTF_8));
        return file;
    }

    private static LoadRequest request(Path file, String table, boolean truncate,
            List<ColumnSpec> columns) {
        LoadRequest request = new LoadRequest();
        request.setInputFile(file);
        request.setDestination(TableName.parse(table));
        request.setColumns(columns);
        request.setTimezone(ZoneId.of("UTC"));
        request.setTruncate(truncate);
        return request;
    }

    private static List<ColumnSpec> scoreColumns() {
        ColumnSpec id = ColumnSpec.of("ID", FieldType.NUMBER);
        id.setNotNull(true);
        return Arrays.asList(id, ColumnSpec.of("Name", FieldType.STRING),
                ColumnSpec.of("Score", FieldType.NUMBER));
    }

    private static List<ColumnSpec> keyedScoreColumns() {
        ColumnSpec id = ColumnSpec.of("ID", FieldType.NUMBER);
        id.setPrimary(true);
        ColumnSpec name = ColumnSpec.of("Name", FieldType.STRING);
        name.setNeedIndex(true);
        return Arrays.asList(id, name, ColumnSpec.of("Score", FieldType.NUMBER));
    }

    private long count(String sql) throws Exception {
        try (Statement st = connection.createStatement(); ResultSet rs = st.executeQuery(sql)) {
            assertTrue(rs.next());
            return rs.getLong(1);
        }
    }

    private boolean exists(String schema, String table) throws Exception {
        return count("SELECT COUNT(*) FROM information_schema.tables WHERE table_schema = '"
                + schema + "' AND table_name = '" + table + "'") > 0;
    }

    private long indexCount(String schema, String table) throws Exception {
        return count("SELECT COUNT(*) FROM pg_indexes WHERE schemaname = '" + schema
                + "' AND tablename = '" + table + "'");
    }

    @Test
    public void execute_正常ケース_置換モードで2回ロードする_行数が変わらずステージングが残らないこと()
            throws Exception {
        Path file = csv("scores.csv", "ID,Name,Score\n1,alice,10.5\n2,bob,\n3,carol,7\n");

        RunSummary first = loader.execute(connection,
                request(file, "it.scores", true, keyedScoreColumns()));
        RunSummary second = loader.execute(connection,
                request(file, "it.scores", true, keyedScoreColumns()));

        assertEquals(3, first.getValidRows());
        assertEquals(3, second.getValidRows());
        assertEquals(3, count("SELECT COUNT(*) FROM it.scores"));
        assertFalse(exists("it", "scores_tmp"));
        assertEquals(2, indexCount("it", "scores"));
        try (Statement st = connection.createStatement();
                ResultSet rs = st.executeQuery("SELECT name, score FROM it.scores ORDER BY id")) {
            assertTrue(rs.next());
            assertEquals("alice", rs.getString("name"));
            assertEquals(0, new BigDecimal("10.5").compareTo(rs.getBigDecimal("score")));
            assertTrue(rs.next());
            assertNull(rs.getBigDecimal("score"));
        }
    }

    @Test
    public void execute_正常ケース_マージモードでロードする_既存行に追記されること() throws Exception {
        Path file = csv("scores.csv", "ID,Name,Score\n1,alice,10\n2,bob,20\n");

        loader.execute(connection, request(file, "it.scores", false, scoreColumns()));
        assertTrue(exists("it", "scores"));
        loader.execute(connection, request(file, "it.scores", false, scoreColumns()));

        assertEquals(4, count("SELECT COUNT(*) FROM it.scores"));
        assertEquals(2, count("SELECT COUNT(*) FROM it.scores WHERE id = 1"));
        assertFalse(exists("it", "scores_tmp"));
    }

    @Test
    public void execute_正常ケース_主キーと索引列を持つ表へマージを2回行う_両方の行が追記されること()
            throws Exception {
        Path first = csv("first.csv", "ID,Name,Score\n1,alice,10\n2,bob,20\n");
        Path second = csv("second.csv", "ID,Name,Score\n3,carol,30\n");

        loader.execute(connection, request(first, "it.scores", false, keyedScoreColumns()));
        loader.execute(connection, request(second, "it.scores", false, keyedScoreColumns()));

        assertEquals(3, count("SELECT COUNT(*) FROM it.scores"));
        assertEquals(1, count("SELECT COUNT(*) FROM it.scores WHERE id = 3"));
        assertEquals(2, indexCount("it", "scores"));
        assertFalse(exists("it", "scores_tmp"));
    }

    @Test
    public void execute_正常ケース_識別子上限長のテーブルへマージする_既存行が残り追記されること()
            throws Exception {
        String table = "scores_" + StringUtils.repeat('x', 56);
        try (Statement st = connection.createStatement()) {
            st.execute("CREATE TABLE it." + table + " (id NUMERIC, name TEXT, score NUMERIC)");
            st.execute("INSERT INTO it." + table + " VALUES (100, 'kept', 1)");
        }
        Path file = csv("scores.csv", "ID,Name,Score\n1,alice,10\n");

        loader.execute(connection, request(file, "it." + table, false, keyedScoreColumns()));

        assertEquals(2, count("SELECT COUNT(*) FROM it." + table));
        assertEquals(1, count("SELECT COUNT(*) FROM it." + table + " WHERE name = 'kept'"));
        assertEquals(1, count("SELECT COUNT(*) FROM information_schema.tables"
                + " WHERE table_schema = 'it'"));
    }

    @Test
    public void execute_正常ケース_識別子上限を超える同名見出し_上限以内の別々の列に格納されること()
            throws Exception {
        String header = StringUtils.repeat('Q', 70);
        Path file = csv("wide.csv", header + "," + header + "\nleft,right\n");

        loader.execute(connection, request(file, "it.wide", true, null));

        String first = StringUtils.repeat('q', 63);
        String second = StringUtils.repeat('q', 61) + "_2";
        try (Statement st = connection.createStatement(); ResultSet rs = st.executeQuery(
                "SELECT " + first + ", " + second + " FROM it.wide")) {
            assertTrue(rs.next());
            assertEquals("left", rs.getString(1));
            assertEquals("right", rs.getString(2));
        }
    }

    @Test
    public void execute_異常ケース_バッチ投入が失敗する_既存テーブルが変更されないこと() throws Exception {
        try (Statement st = connection.createStatement()) {
            st.execute("CREATE TABLE it.scores (id NUMERIC, name TEXT, score NUMERIC)");
            st.execute("INSERT INTO it.scores VALUES (100, 'kept', 1)");
        }
        ColumnSpec id = ColumnSpec.of("ID", FieldType.NUMBER);
        id.setPrimary(true);
        List<ColumnSpec> columns = Arrays.asList(id, ColumnSpec.of("Name", FieldType.STRING),
                ColumnSpec.of("Score", FieldType.NUMBER));
        Path file = csv("dup.csv", "ID,Name,Score\n1,a,1\n1,b,2\n");
        LoadRequest request = request(file, "it.scores", true, columns);
        request.setBatchSize(1);

        BatchInsertException ex =
                assertThrows(BatchInsertException.class, () -> loader.execute(connection, request));

        assertEquals(1, ex.getBatchIndex());
        assertEquals(1, count("SELECT COUNT(*) FROM it.scores"));
        assertEquals(1, count("SELECT COUNT(*) FROM it.scores WHERE name = 'kept'"));
    }

    @Test
    public void execute_正常ケース_空行とタイムゾーン付き日時を含む_空行が除外されUTCで格納されること()
            throws Exception {
        Path file = csv("events.csv", "Event,At,Amount\nopen,2025-02-05 19:20,\n,,\n");
        List<ColumnSpec> columns = Arrays.asList(ColumnSpec.of("Event", FieldType.STRING),
                ColumnSpec.of("At", FieldType.TIMESTAMP),
                ColumnSpec.of("Amount", FieldType.NUMBER));
        LoadRequest request = request(file, "it.events", true, columns);
        request.setTimezone(ZoneId.of("Asia/Kolkata"));

        RunSummary summary = loader.execute(connection, request);

        assertEquals(2, summary.getTotalRows());
        assertEquals(1, summary.getValidRows());
        assertEquals(1, summary.getEmptyRows());
        try (Statement st = connection.createStatement();
                ResultSet rs = st.executeQuery("SELECT event, at, amount FROM it.events")) {
            assertTrue(rs.next());
            assertEquals("open", rs.getString("event"));
            assertEquals(LocalDateTime.of(2025, 2, 5, 13, 50),
                    rs.getObject("at", LocalDateTime.class));
            assertNull(rs.getBigDecimal("amount"));
            assertFalse(rs.next());
        }
    }

    @Test
    public void execute_正常ケース_列設定なし_ヘッダから列が導出されること() throws Exception {
        Path file = csv("people.csv", "Full Name,Full Name,Age\nAda,Lovelace,36\n");

        RunSummary summary = loader.execute(connection, request(file, "it.people", true, null));

        assertEquals(1, summary.getValidRows());
        try (Statement st = connection.createStatement(); ResultSet rs = st.executeQuery(
                "SELECT full_name, full_name_2, age FROM it.people")) {
            assertTrue(rs.next());
            assertEquals("Ada", rs.getString("full_name"));
            assertEquals("Lovelace", rs.getString("full_name_2"));
            assertEquals("36", rs.getString("age"));
        }
    }
}
