package io.github.yok.flexload.core;

import com.google.common.collect.Lists;
import io.github.yok.flexload.db.SqlDialect;
import io.github.yok.flexload.db.TableName;
import io.github.yok.flexload.exception.BatchInsertException;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import lombok.extern.slf4j.Slf4j;

/**
 * Bulk-inserts rows into the staging table.
 *
 * <p>
 * Rows whose every value is {@code null} are dropped and counted as empty. The remaining rows are
 * split into contiguous batches; each batch is one multi-row INSERT committed on its own. The
 * first failing batch aborts the load, and rows of earlier batches stay in the staging table.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public class BatchLoader {

    private final SqlDialect dialect;
    private final ProgressListener listener;

    public BatchLoader(SqlDialect dialect, ProgressListener listener) {
        this.dialect = dialect;
        this.listener = listener;
    }

    /**
     * Loads rows into the staging table.
     *
     * @param connection connection in auto-commit mode
     * @param staging staging table
     * @param schema resolved schema
     * @param rows rows aligned with {@code schema}
     * @param batchSize requested rows per statement
     * @param counters run counters; empty and processed rows are added
     * @return rows inserted
     * @throws BatchInsertException if a batch fails
     */
    public long load(Connection connection, TableName staging, ResolvedSchema schema,
            List<Row> rows, int batchSize, RunCounters counters) throws BatchInsertException {
        List<Row> loadable = new ArrayList<>(rows.size());
        for (Row row : rows) {
            if (row.isEmpty()) {
                counters.incrementEmptyRows();
            } else {
                loadable.add(row);
            }
        }
        if (loadable.isEmpty()) {
            log.info("[{}] LOAD | no rows to insert", staging);
            return 0;
        }

        int effectiveSize = effectiveBatchSize(batchSize, schema.size());
        List<List<Row>> batches = Lists.partition(loadable, effectiveSize);
        List<String> columns = schema.getSqlColumns();
        String fullBatchSql = dialect.insertValuesSql(staging, columns, effectiveSize);

        long inserted = 0;
        for (int i = 0; i < batches.size(); i++) {
            List<Row> batch = batches.get(i);
            String sql = batch.size() == effectiveSize ? fullBatchSql
                    : dialect.insertValuesSql(staging, columns, batch.size());
            try (PreparedStatement ps = connection.prepareStatement(sql)) {
                bind(ps, schema, batch);
                ps.executeUpdate();
            } catch (SQLException e) {
                throw new BatchInsertException("Batch " + (i + 1) + "/" + batches.size()
                        + " failed inserting into " + staging + ": " + e.getMessage(), i,
                        batch.size(), e);
            }
            inserted += batch.size();
            counters.addProcessedRows(batch.size());
            listener.batchInserted(i + 1, batches.size(), inserted);
        }
        log.info("[{}] LOAD | {} rows inserted in {} batches", staging, inserted, batches.size());
        return inserted;
    }

    int effectiveBatchSize(int batchSize, int columnCount) {
        int limit = Math.max(1, dialect.getMaxBindParameters() / Math.max(1, columnCount));
        if (batchSize > limit) {
            log.warn("Batch size {} x {} columns exceeds the bind parameter limit {}; using {}",
                    batchSize, columnCount, dialect.getMaxBindParameters(), limit);
            return limit;
        }
        return batchSize;
    }

    private static void bind(PreparedStatement ps, ResolvedSchema schema, List<Row> batch)
            throws SQLException {
        List<ResolvedColumn> columns = schema.getColumns();
        int index = 1;
        for (Row row : batch) {
            for (int c = 0; c < columns.size(); c++) {
                columns.get(c).getFieldType().bind(ps, index++, row.get(c));
            }
        }
    }
}
