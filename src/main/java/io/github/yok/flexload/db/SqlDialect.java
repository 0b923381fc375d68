package io.github.yok.flexload.db;

import io.github.yok.flexload.core.ResolvedColumn;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.List;

/**
 * SQL grammar used by the staging, bulk insert and promote phases.
 */
public interface SqlDialect {

    /**
     * Quotes identifier in dialect style.
     *
     * @param identifier identifier
     * @return quoted identifier
     */
    String quoteIdentifier(String identifier);

    /**
     * Returns the quoted, schema-qualified name of a table.
     *
     * @param table table name
     * @return qualified name
     */
    String qualify(TableName table);

    /**
     * Returns the maximum number of bind parameters one statement may carry.
     *
     * @return parameter limit
     */
    int getMaxBindParameters();

    /**
     * Returns the staging table of a destination: {@code schema.table_tmp}, with the table part
     * shortened so that the name fits the identifier limit and never equals the destination.
     *
     * @param destination destination table
     * @return staging table
     * @throws IllegalArgumentException if the destination name itself exceeds the identifier
     *         limit
     */
    TableName stagingTable(TableName destination);

    /**
     * Builds the name of an index created in a run.
     *
     * @param runId run identifier (start timestamp and random suffix)
     * @param column indexed column
     * @param table destination table (unqualified)
     * @return sanitized index name within the identifier length limit
     */
    String indexName(String runId, String column, String table);

    /**
     * Builds the name of the primary key constraint created in a run.
     *
     * @param runId run identifier (start timestamp and random suffix)
     * @param table destination table (unqualified)
     * @return sanitized constraint name within the identifier length limit
     */
    String primaryKeyName(String runId, String table);

    /**
     * Returns DROP TABLE IF EXISTS SQL.
     *
     * @param table table to drop
     * @return SQL
     */
    String dropTableIfExistsSql(TableName table);

    /**
     * Returns DROP TABLE SQL.
     *
     * @param table table to drop
     * @return SQL
     */
    String dropTableSql(TableName table);

    /**
     * Returns CREATE TABLE SQL with one column per resolved column and, when any column is
     * primary, a table-level primary key constraint.
     *
     * @param table table to create
     * @param columns resolved columns in order
     * @param primaryKeyName constraint name used when primary key columns exist
     * @return SQL
     */
    String createTableSql(TableName table, List<ResolvedColumn> columns, String primaryKeyName);

    /**
     * Returns CREATE INDEX SQL.
     *
     * @param indexName index name
     * @param table indexed table
     * @param column indexed column
     * @return SQL
     */
    String createIndexSql(String indexName, TableName table, String column);

    /**
     * Returns a multi-row INSERT with one placeholder per value.
     *
     * @param table target table
     * @param columns target columns in order
     * @param rowCount number of value groups
     * @return SQL
     */
    String insertValuesSql(TableName table, List<String> columns, int rowCount);

    /**
     * Returns SQL renaming a table within its schema.
     *
     * @param from table to rename
     * @param to new name; only the table part is used
     * @return SQL
     */
    String renameTableSql(TableName from, TableName to);

    /**
     * Returns SQL creating a table with the structure of another table (columns, defaults,
     * constraints and indexes).
     *
     * @param table table to create
     * @param template table to copy the structure from
     * @return SQL
     */
    String createTableLikeSql(TableName table, TableName template);

    /**
     * Returns SQL appending all rows of one table to another.
     *
     * @param target table receiving the rows
     * @param source table providing the rows
     * @return SQL
     */
    String insertSelectAllSql(TableName target, TableName source);

    /**
     * Returns whether a table exists.
     *
     * @param connection JDBC connection
     * @param table table to look up
     * @return {@code true} if the table exists
     * @throws SQLException if the lookup fails
     */
    boolean tableExists(Connection connection, TableName table) throws SQLException;
}
