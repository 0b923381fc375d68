package io.github.yok.flexload.db.postgresql;

import io.github.yok.flexload.core.ResolvedColumn;
import io.github.yok.flexload.db.SqlDialect;
import io.github.yok.flexload.db.TableName;
import io.github.yok.flexload.util.Identifiers;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.codec.digest.DigestUtils;

/**
 * PostgreSQL implementation of {@link SqlDialect}.
 *
 * <p>
 * Identifiers are quoted with double quotes. Generated index and constraint names longer than the
 * identifier limit are cut and suffixed with the first 8 hex digits of the SHA-1 of the full name,
 * so two long names differing only at the end stay distinct. Staging table names are shortened
 * the same way, keeping the {@code _tmp} suffix.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public class PostgresqlDialect implements SqlDialect {

    // Wire protocol limit on bind parameters per statement
    static final int MAX_BIND_PARAMETERS = 65535;

    private static final int HASH_LENGTH = 8;

    private static final String TABLE_EXISTS_SQL = "SELECT 1 FROM information_schema.tables"
            + " WHERE table_schema = ? AND table_name = ?";

    private final int maxIdentifierLength;

    /**
     * Creates a dialect.
     *
     * @param maxIdentifierLength identifier length limit ({@code NAMEDATALEN - 1}, normally 63)
     */
    public PostgresqlDialect(int maxIdentifierLength) {
        this.maxIdentifierLength = maxIdentifierLength;
    }

    /**
     * Quotes an identifier with double quotes, doubling embedded double quotes.
     *
     * @param identifier identifier
     * @return "identifier"
     */
    @Override
    public String quoteIdentifier(String identifier) {
        return "\"" + identifier.replace("\"", "\"\"") + "\"";
    }

    @Override
    public String qualify(TableName table) {
        return quoteIdentifier(table.getSchema()) + "." + quoteIdentifier(table.getTable());
    }

    @Override
    public int getMaxBindParameters() {
        return MAX_BIND_PARAMETERS;
    }

    @Override
    public TableName stagingTable(TableName destination) {
        String table = destination.getTable();
        if (table.length() > maxIdentifierLength
                || destination.getSchema().length() > maxIdentifierLength) {
            throw new IllegalArgumentException("Table name " + destination
                    + " exceeds the identifier limit of " + maxIdentifierLength + " characters");
        }
        String staging = table + TableName.STAGING_SUFFIX;
        if (staging.length() > maxIdentifierLength) {
            String hash = DigestUtils.sha1Hex(table).substring(0, HASH_LENGTH);
            staging = table.substring(0, maxIdentifierLength - HASH_LENGTH - 1
                    - TableName.STAGING_SUFFIX.length()) + "_" + hash + TableName.STAGING_SUFFIX;
            log.debug("Staging table name shortened: {} -> {}", table, staging);
        }
        return destination.withTable(staging);
    }

    @Override
    public String indexName(String runId, String column, String table) {
        return limitLength(Identifiers.sanitize("idx_" + runId + "_" + column + "_" + table));
    }

    @Override
    public String primaryKeyName(String runId, String table) {
        return limitLength(Identifiers.sanitize("pk_" + runId + "_" + table));
    }

    String limitLength(String name) {
        if (name.length() <= maxIdentifierLength) {
            return name;
        }
        String hash = DigestUtils.sha1Hex(name).substring(0, HASH_LENGTH);
        String shortened = name.substring(0, maxIdentifierLength - HASH_LENGTH - 1) + "_" + hash;
        log.debug("Identifier shortened: {} -> {}", name, shortened);
        return shortened;
    }

    @Override
    public String dropTableIfExistsSql(TableName table) {
        return "DROP TABLE IF EXISTS " + qualify(table);
    }

    @Override
    public String dropTableSql(TableName table) {
        return "DROP TABLE " + qualify(table);
    }

    @Override
    public String createTableSql(TableName table, List<ResolvedColumn> columns,
            String primaryKeyName) {
        List<String> defs = new ArrayList<>();
        List<String> keys = new ArrayList<>();
        for (ResolvedColumn c : columns) {
            String def = quoteIdentifier(c.getSqlColumn()) + " " + c.getFieldType().getSqlType();
            if (c.isNotNull()) {
                def += " NOT NULL";
            }
            defs.add(def);
            if (c.isPrimary()) {
                keys.add(quoteIdentifier(c.getSqlColumn()));
            }
        }
        if (!keys.isEmpty()) {
            defs.add("CONSTRAINT " + quoteIdentifier(primaryKeyName) + " PRIMARY KEY ("
                    + String.join(", ", keys) + ")");
        }
        return "CREATE TABLE " + qualify(table) + " (" + String.join(", ", defs) + ")";
    }

    @Override
    public String createIndexSql(String indexName, TableName table, String column) {
        return "CREATE INDEX " + quoteIdentifier(indexName) + " ON " + qualify(table) + " ("
                + quoteIdentifier(column) + ")";
    }

    @Override
    public String insertValuesSql(TableName table, List<String> columns, int rowCount) {
        String cols = columns.stream().map(this::quoteIdentifier).collect(Collectors.joining(", "));
        String group = "(" + String.join(", ", Collections.nCopies(columns.size(), "?")) + ")";
        return "INSERT INTO " + qualify(table) + " (" + cols + ") VALUES "
                + String.join(", ", Collections.nCopies(rowCount, group));
    }

    @Override
    public String renameTableSql(TableName from, TableName to) {
        return "ALTER TABLE " + qualify(from) + " RENAME TO " + quoteIdentifier(to.getTable());
    }

    @Override
    public String createTableLikeSql(TableName table, TableName template) {
        return "CREATE TABLE " + qualify(table) + " (LIKE " + qualify(template)
                + " INCLUDING ALL)";
    }

    @Override
    public String insertSelectAllSql(TableName target, TableName source) {
        return "INSERT INTO " + qualify(target) + " SELECT * FROM " + qualify(source);
    }

    @Override
    public boolean tableExists(Connection connection, TableName table) throws SQLException {
        try (PreparedStatement ps = connection.prepareStatement(TABLE_EXISTS_SQL)) {
            ps.setString(1, table.getSchema());
            ps.setString(2, table.getTable());
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next();
            }
        }
    }
}
