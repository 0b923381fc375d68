package io.github.yok.flexload.db;

import java.util.Locale;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import org.apache.commons.lang3.StringUtils;

/**
 * Schema-qualified table name. Both parts are lower-cased.
 *
 * <p>
 * A bare {@code table} means {@code public.table}. The staging table of {@code schema.table} is
 * {@code schema.table_tmp}, shortened by {@link SqlDialect#stagingTable(TableName)} when it would
 * exceed the identifier limit.
 * </p>
 */
@Getter
@EqualsAndHashCode
public final class TableName {

    public static final String DEFAULT_SCHEMA = "public";

    public static final String STAGING_SUFFIX = "_tmp";

    private final String schema;
    private final String table;

    private TableName(String schema, String table) {
        this.schema = schema;
        this.table = table;
    }

    /**
     * Parses {@code schema.table} or {@code table}.
     *
     * @param qualified table name as given by the user
     * @return parsed name
     * @throws IllegalArgumentException if the name is blank or has more than two parts
     */
    public static TableName parse(String qualified) {
        if (StringUtils.isBlank(qualified)) {
            throw new IllegalArgumentException("Table name is required (schema.table)");
        }
        String[] parts = qualified.trim().split("\\.", -1);
        if (parts.length > 2) {
            throw new IllegalArgumentException("Invalid table name: " + qualified);
        }
        String schema = parts.length == 2 ? parts[0].trim() : DEFAULT_SCHEMA;
        String table = parts[parts.length - 1].trim();
        if (schema.isEmpty() || table.isEmpty()) {
            throw new IllegalArgumentException("Invalid table name: " + qualified);
        }
        return new TableName(schema.toLowerCase(Locale.ROOT), table.toLowerCase(Locale.ROOT));
    }

    /**
     * Returns a table with the same schema and another table part.
     *
     * @param otherTable table part, used as given
     * @return table in the same schema
     */
    public TableName withTable(String otherTable) {
        return new TableName(schema, otherTable);
    }

    @Override
    public String toString() {
        return schema + "." + table;
    }
}
