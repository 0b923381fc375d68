package io.github.yok.flexload.core;

import io.github.yok.flexload.db.SqlDialect;
import io.github.yok.flexload.db.TableName;
import io.github.yok.flexload.exception.TransactionException;
import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;
import lombok.extern.slf4j.Slf4j;

/**
 * Creates the staging table and promotes it into the destination, each in one transaction.
 *
 * <ul>
 * <li>Stage: drop any leftover staging table, create it, create its indexes.</li>
 * <li>Promote, replace mode: drop the destination and rename the staging table to it.</li>
 * <li>Promote, merge mode: create the destination like the staging table if it does not exist,
 * append all staged rows, drop the staging table.</li>
 * </ul>
 *
 * <p>
 * A failing phase is rolled back and reported as {@link TransactionException}; the connection's
 * auto-commit mode is restored afterwards.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public class SwapManager {

    private final SqlDialect dialect;

    public SwapManager(SqlDialect dialect) {
        this.dialect = dialect;
    }

    /**
     * Creates an empty staging table for {@code destination}.
     *
     * @param connection JDBC connection
     * @param destination destination table
     * @param schema resolved schema
     * @param runId run identifier used in index and constraint names
     * @throws TransactionException if any statement fails
     */
    public void stage(Connection connection, TableName destination, ResolvedSchema schema,
            String runId) throws TransactionException {
        TableName staging = dialect.stagingTable(destination);
        inTransaction(connection, LoadPhase.STAGE, destination, st -> {
            execute(st, dialect.dropTableIfExistsSql(staging));
            execute(st, dialect.createTableSql(staging, schema.getColumns(),
                    dialect.primaryKeyName(runId, destination.getTable())));
            for (ResolvedColumn column : schema.getColumns()) {
                if (column.isNeedIndex()) {
                    String index = dialect.indexName(runId, column.getSqlColumn(),
                            destination.getTable());
                    execute(st, dialect.createIndexSql(index, staging, column.getSqlColumn()));
                }
            }
        });
        log.info("[{}] STAGE | staging table {} created ({} columns)", destination, staging,
                schema.size());
    }

    /**
     * Moves the staged rows into the destination.
     *
     * @param connection JDBC connection
     * @param destination destination table
     * @param truncate {@code true} to replace the destination, {@code false} to merge into it
     * @throws TransactionException if any statement fails; the destination is unchanged
     */
    public void promote(Connection connection, TableName destination, boolean truncate)
            throws TransactionException {
        TableName staging = dialect.stagingTable(destination);
        inTransaction(connection, LoadPhase.PROMOTE, destination, st -> {
            if (truncate) {
                execute(st, dialect.dropTableIfExistsSql(destination));
                execute(st, dialect.renameTableSql(staging, destination));
            } else {
                if (!dialect.tableExists(connection, destination)) {
                    log.info("[{}] PROMOTE | destination does not exist, creating it",
                            destination);
                    execute(st, dialect.createTableLikeSql(destination, staging));
                }
                execute(st, dialect.insertSelectAllSql(destination, staging));
                execute(st, dialect.dropTableSql(staging));
            }
        });
        log.info("[{}] PROMOTE | {} completed", destination, truncate ? "replace" : "merge");
    }

    private void inTransaction(Connection connection, LoadPhase phase, TableName destination,
            StatementWork work) throws TransactionException {
        boolean autoCommit;
        try {
            autoCommit = connection.getAutoCommit();
            connection.setAutoCommit(false);
        } catch (SQLException e) {
            throw new TransactionException(phase.name(),
                    "Failed to begin " + phase + " transaction for " + destination, e);
        }
        try (Statement st = connection.createStatement()) {
            work.run(st);
            connection.commit();
        } catch (SQLException e) {
            try {
                connection.rollback();
                log.warn("[{}] {} | transaction rolled back due to error.", destination, phase);
            } catch (SQLException rollbackEx) {
                log.warn("[{}] {} | rollback failed: {}", destination, phase,
                        rollbackEx.getMessage(), rollbackEx);
            }
            throw new TransactionException(phase.name(),
                    phase + " failed for " + destination + ": " + e.getMessage(), e);
        } finally {
            try {
                connection.setAutoCommit(autoCommit);
            } catch (SQLException e) {
                log.warn("[{}] {} | failed to restore auto-commit: {}", destination, phase,
                        e.getMessage());
            }
        }
    }

    private static void execute(Statement st, String sql) throws SQLException {
        log.debug("SQL: {}", sql);
        st.execute(sql);
    }

    @FunctionalInterface
    private interface StatementWork {
        void run(Statement statement) throws SQLException;
    }
}
