package io.github.yok.flexload;

import io.github.yok.flexload.config.ColumnOverride;
import io.github.yok.flexload.config.ColumnSpec;
import io.github.yok.flexload.config.ConnectionConfig;
import io.github.yok.flexload.config.LoadConfig;
import io.github.yok.flexload.config.TableConfigLoader;
import io.github.yok.flexload.core.LoadNotifier;
import io.github.yok.flexload.core.LoadRequest;
import io.github.yok.flexload.core.LoggingProgressListener;
import io.github.yok.flexload.core.RunSummary;
import io.github.yok.flexload.core.SchemaResolver;
import io.github.yok.flexload.core.TableLoader;
import io.github.yok.flexload.db.ConnectionProvider;
import io.github.yok.flexload.db.SqlDialectFactory;
import io.github.yok.flexload.db.TableName;
import io.github.yok.flexload.parser.TabularSourceFactory;
import io.github.yok.flexload.util.ErrorHandler;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.sql.Connection;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.io.FilenameUtils;
import org.apache.commons.lang3.StringUtils;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

/**
 * Provides the application entry point.
 *
 * <p>
 * Parses the command-line options, then loads one input file into one table with
 * {@link TableLoader}.
 * </p>
 *
 * <p>
 * Argument specification:
 * </p>
 * <ul>
 * <li>{@code --input-file}/{@code -i path}: CSV or Excel file to load (required)</li>
 * <li>{@code --table}/{@code -t schema.table}: destination table; a bare name means
 * {@code public} (required)</li>
 * <li>{@code --table-config}/{@code -c path}: column configuration JSON; when omitted, columns are
 * derived from the header row</li>
 * <li>{@code --overrides}/{@code -o path}: per-header overrides JSON</li>
 * <li>{@code --timezone}/{@code -z zone}: zone of the timestamps in the file (required)</li>
 * <li>{@code --batch-size}/{@code -b n}: rows per insert statement</li>
 * <li>{@code --truncate}: replace the destination instead of merging into it</li>
 * <li>{@code --sheet-name}/{@code -s name}: sheet to read from an Excel file</li>
 * </ul>
 *
 * <p>
 * Options that are not given fall back to the {@code load} section of {@code application.yml}
 * ({@link LoadConfig}). Unknown arguments are logged and ignored. A failed run is reported to the
 * {@link LoadNotifier} and ends the process with exit code 1.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
@SpringBootApplication
@EnableConfigurationProperties({ConnectionConfig.class, LoadConfig.class})
@RequiredArgsConstructor
public class Main implements CommandLineRunner, ExitCodeGenerator {

    private final LoadConfig loadConfig;
    private final ConnectionProvider connectionProvider;
    private final SqlDialectFactory dialectFactory;
    private final TableConfigLoader configLoader;
    private final TabularSourceFactory sourceFactory;
    private final SchemaResolver schemaResolver;
    private final LoadNotifier notifier;

    private int exitCode;

    /**
     * Bootstraps the application.
     *
     * @param args command-line arguments
     */
    public static void main(String[] args) {
        SpringApplication app = new SpringApplication(Main.class);
        app.setAddCommandLineProperties(false);
        int code = SpringApplication.exit(app.run(args));
        if (code != 0) {
            System.exit(code);
        }
    }

    /**
     * Entry point invoked after Spring Boot starts.
     *
     * @param args command-line arguments array
     */
    @Override
    public void run(String... args) {
        log.info("Application started. Args: {}", Arrays.toString(args));

        String inputFile = null;
        String table = null;
        for (int i = 0; i < args.length; i++) {
            switch (args[i]) {
                case "--input-file":
                case "-i":
                    inputFile = (i + 1 < args.length ? args[++i] : null);
                    break;
                case "--table":
                case "-t":
                    table = (i + 1 < args.length ? args[++i] : null);
                    break;
                case "--table-config":
                case "-c":
                    loadConfig.setColumnConfig(i + 1 < args.length ? args[++i] : null);
                    break;
                case "--overrides":
                case "-o":
                    loadConfig.setOverridesConfig(i + 1 < args.length ? args[++i] : null);
                    break;
                case "--timezone":
                case "-z":
                    loadConfig.setTimezone(i + 1 < args.length ? args[++i] : null);
                    break;
                case "--batch-size":
                case "-b":
                    if (i + 1 < args.length) {
                        String value = args[++i];
                        try {
                            loadConfig.setBatchSize(Integer.parseInt(value.trim()));
                        } catch (NumberFormatException e) {
                            fail("Invalid --batch-size: " + value, null);
                            return;
                        }
                    }
                    break;
                case "--truncate":
                    loadConfig.setTruncate(true);
                    break;
                case "--sheet-name":
                case "-s":
                    loadConfig.setSheetName(i + 1 < args.length ? args[++i] : null);
                    break;
                default:
                    log.warn("Unknown argument: {}", args[i]);
            }
        }

        if (StringUtils.isBlank(inputFile)) {
            fail("Input file is required (--input-file).", null);
            return;
        }
        if (StringUtils.isBlank(table)) {
            fail("Destination table is required (--table).", null);
            return;
        }

        String inputName = FilenameUtils.getName(inputFile);
        try {
            loadConfig.validate();
            LoadRequest request = buildRequest(Paths.get(inputFile), TableName.parse(table));
            log.info("Starting load. File [{}], Table [{}]", inputName, request.getDestination());

            try (Connection connection = connectionProvider.open()) {
                TableLoader loader = new TableLoader(sourceFactory, configLoader, schemaResolver,
                        dialectFactory.create(connection),
                        new LoggingProgressListener(request.getDestination().toString()),
                        loadConfig.getProgressInterval());
                RunSummary summary = loader.execute(connection, request);
                notifier.notifySuccess(summary);
            }
            log.info("Load completed. File [{}], Table [{}]", inputName, table);
        } catch (Exception e) {
            notifier.notifyFailure(inputName, table, e);
            fail("Fatal error: " + e.getMessage(), e);
        }
    }

    LoadRequest buildRequest(Path inputFile, TableName destination) {
        List<ColumnSpec> columns = null;
        if (StringUtils.isNotBlank(loadConfig.getColumnConfig())) {
            columns = configLoader.loadColumns(Paths.get(loadConfig.getColumnConfig()));
        }
        Map<String, ColumnOverride> overrides = configLoader.loadOverrides(
                StringUtils.isNotBlank(loadConfig.getOverridesConfig())
                        ? Paths.get(loadConfig.getOverridesConfig())
                        : null);

        LoadRequest request = new LoadRequest();
        request.setInputFile(inputFile);
        request.setDestination(destination);
        request.setColumns(columns);
        request.setOverrides(overrides);
        request.setTimezone(loadConfig.getZoneId());
        request.setBatchSize(loadConfig.getBatchSize());
        request.setTruncate(loadConfig.isTruncate());
        request.setSheetName(StringUtils.trimToNull(loadConfig.getSheetName()));
        return request;
    }

    private void fail(String message, Exception cause) {
        exitCode = 1;
        if (cause == null) {
            ErrorHandler.errorAndExit(message);
        } else {
            ErrorHandler.errorAndExit(message, cause);
        }
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }
}
