package io.github.yok.flexload.core;

import io.github.yok.flexload.config.ColumnOverride;
import io.github.yok.flexload.config.ColumnSpec;
import io.github.yok.flexload.config.TableConfigLoader;
import io.github.yok.flexload.db.SqlDialect;
import io.github.yok.flexload.db.TableName;
import io.github.yok.flexload.exception.SourceReadException;
import io.github.yok.flexload.exception.TableLoadException;
import io.github.yok.flexload.parser.TabularSource;
import io.github.yok.flexload.parser.TabularSourceFactory;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.sql.Connection;
import java.time.Duration;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.io.FilenameUtils;

/**
 * Runs one load: read the source, resolve the schema, coerce every row, then stage, load and
 * promote.
 *
 * <p>
 * The steps run strictly in sequence on the calling thread. All source rows are held in memory
 * before the database is touched. The source is always closed; the connection is owned by the
 * caller.
 * </p>
 *
 * <ul>
 * <li>Source problems raise {@link SourceReadException} before any SQL is executed.</li>
 * <li>A failed batch raises {@link io.github.yok.flexload.exception.BatchInsertException}; the
 * destination is not touched.</li>
 * <li>A failed Stage or Promote raises
 * {@link io.github.yok.flexload.exception.TransactionException} after rollback.</li>
 * </ul>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public class TableLoader {

    static final DateTimeFormatter RUN_TIMESTAMP =
            DateTimeFormatter.ofPattern("yyyyMMddHHmmssSSS");

    // Hex digits of a random UUID appended to the run timestamp
    private static final int RUN_ID_RANDOM_LENGTH = 6;

    private final TabularSourceFactory sourceFactory;
    private final TableConfigLoader configLoader;
    private final SchemaResolver schemaResolver;
    private final SqlDialect dialect;
    private final SwapManager swapManager;
    private final BatchLoader batchLoader;
    private final ProgressListener listener;
    private final int progressInterval;

    /**
     * Creates a loader.
     *
     * @param sourceFactory opens source files
     * @param configLoader derives column configurations from header rows
     * @param schemaResolver resolves the destination schema
     * @param dialect SQL dialect of the destination database
     * @param listener progress listener
     * @param progressInterval rows between {@link ProgressListener#rowsRead(long)} calls
     */
    public TableLoader(TabularSourceFactory sourceFactory, TableConfigLoader configLoader,
            SchemaResolver schemaResolver, SqlDialect dialect, ProgressListener listener,
            int progressInterval) {
        this.sourceFactory = sourceFactory;
        this.configLoader = configLoader;
        this.schemaResolver = schemaResolver;
        this.dialect = dialect;
        this.swapManager = new SwapManager(dialect);
        this.batchLoader = new BatchLoader(dialect, listener);
        this.listener = listener;
        this.progressInterval = progressInterval;
    }

    /**
     * Executes a run.
     *
     * @param connection open connection in auto-commit mode
     * @param request run parameters
     * @return summary of the run
     * @throws TableLoadException if the run fails
     */
    public RunSummary execute(Connection connection, LoadRequest request)
            throws TableLoadException {
        long started = System.nanoTime();
        String runId = newRunId();
        TableName destination = request.getDestination();
        TableName staging;
        try {
            staging = dialect.stagingTable(destination);
        } catch (IllegalArgumentException e) {
            throw new TableLoadException(e.getMessage(), e);
        }
        String inputName = FilenameUtils.getName(request.getInputFile().toString());
        RunCounters counters = new RunCounters();

        log.info("[{}] Run started | file={} mode={} batchSize={} timezone={}", destination,
                inputName, request.isTruncate() ? "replace" : "merge", request.getBatchSize(),
                request.getTimezone());

        listener.phaseStarted(LoadPhase.READ);
        SourceData data = read(request, counters);
        log.info("[{}] READ | {} data rows read from {}", destination, data.rows.size(),
                data.description);

        boolean anyData = false;
        for (Row row : data.rows) {
            if (!row.isEmpty()) {
                anyData = true;
                break;
            }
        }
        if (!anyData) {
            throw new SourceReadException("No valid data found in " + inputName);
        }

        listener.phaseStarted(LoadPhase.STAGE);
        swapManager.stage(connection, destination, data.schema, runId);

        listener.phaseStarted(LoadPhase.LOAD);
        batchLoader.load(connection, staging, data.schema, data.rows,
                request.getBatchSize(), counters);

        listener.phaseStarted(LoadPhase.PROMOTE);
        swapManager.promote(connection, destination, request.isTruncate());

        RunSummary summary = counters.toSummary(inputName, destination.toString(),
                data.sheetName, data.schema.getMissingHeaders(),
                Duration.ofNanos(System.nanoTime() - started));
        log.info("[{}] Run finished | total={} valid={} empty={} skipped={} ({}s)", destination,
                summary.getTotalRows(), summary.getValidRows(), summary.getEmptyRows(),
                summary.getSkippedRows(), summary.getDurationSeconds());
        return summary;
    }

    /**
     * Returns a run identifier: the start time to the millisecond plus a random suffix. Index and
     * constraint names of the staging table embed it.
     *
     * @return run identifier such as {@code 20250205192000123_1a2b3c}
     */
    static String newRunId() {
        return LocalDateTime.now().format(RUN_TIMESTAMP) + "_"
                + UUID.randomUUID().toString().substring(0, RUN_ID_RANDOM_LENGTH);
    }

    private SourceData read(LoadRequest request, RunCounters counters) throws SourceReadException {
        SourceData data = new SourceData();
        try (TabularSource source =
                sourceFactory.open(request.getInputFile(), request.getSheetName())) {
            data.description = source.describe();
            data.sheetName = source.getSheetName();
            if (!source.hasNext()) {
                throw new SourceReadException("Input file is empty: " + request.getInputFile());
            }
            List<String> header = source.next().texts();

            List<ColumnSpec> specs = request.getColumns();
            Map<String, ColumnOverride> overrides = request.getOverrides();
            if (specs == null) {
                specs = configLoader.deriveFromHeaders(header, overrides);
                // already applied while deriving
                overrides = Collections.emptyMap();
            }
            data.schema = schemaResolver.resolve(header, specs, overrides);

            ValueTransformer transformer = new ValueTransformer(counters);
            while (source.hasNext()) {
                data.rows.add(transformer.transformRow(source.next(), data.schema,
                        request.getTimezone()));
                if (data.rows.size() % progressInterval == 0) {
                    listener.rowsRead(data.rows.size());
                }
            }
            counters.addSkippedRows(source.getSkippedRows());
        } catch (UncheckedIOException e) {
            throw new SourceReadException(
                    "Failed to read " + request.getInputFile() + ": " + e.getMessage(), e);
        } catch (IOException e) {
            throw new SourceReadException("Failed to close " + request.getInputFile(), e);
        }
        return data;
    }

    private static final class SourceData {
        private ResolvedSchema schema;
        private final List<Row> rows = new ArrayList<>();
        private String description;
        private String sheetName;
    }
}
