package io.github.yok.flexload.config;

import java.time.DateTimeException;
import java.time.ZoneId;
import lombok.Data;
import org.apache.commons.lang3.StringUtils;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Configuration class that binds the {@code load} section in {@code application.yml}.
 *
 * <p>
 * Every property can be overridden per run from the command line (see
 * {@link io.github.yok.flexload.Main}).
 * </p>
 *
 * <ul>
 * <li>{@code load.column-config}: JSON array of column definitions; when omitted, the columns are
 * derived from the source header row</li>
 * <li>{@code load.overrides-config}: optional JSON object of per-header overrides</li>
 * <li>{@code load.timezone}: zone used to interpret timestamps (required)</li>
 * <li>{@code load.batch-size}: rows per bulk insert (default 5000)</li>
 * <li>{@code load.truncate}: {@code true} replaces the destination, {@code false} merges into it
 * (default)</li>
 * <li>{@code load.sheet-name}: spreadsheet sheet to read (default: first sheet)</li>
 * <li>{@code load.max-identifier-length}: identifier length limit of the database (default 63)</li>
 * <li>{@code load.progress-interval}: rows between progress log lines (default 10000)</li>
 * </ul>
 *
 * @author Yasuharu.Okawauchi
 */
@Component
@ConfigurationProperties(prefix = "load")
@Data
public class LoadConfig {

    public static final int DEFAULT_BATCH_SIZE = 5000;

    // Path of the column configuration JSON
    private String columnConfig;

    // Path of the per-header overrides JSON
    private String overridesConfig;

    // Zone ID for timestamp interpretation (e.g., Asia/Kolkata)
    private String timezone;

    // Rows per bulk insert statement
    private int batchSize = DEFAULT_BATCH_SIZE;

    // Replace (true) or merge (false) the destination table
    private boolean truncate = false;

    // Sheet name for spreadsheet sources
    private String sheetName;

    // Maximum identifier length of the target database
    private int maxIdentifierLength = 63;

    // Rows between progress log lines
    private int progressInterval = 10000;

    /**
     * Returns the configured time zone.
     *
     * @return zone ID
     * @throws IllegalStateException if the time zone is missing or unknown
     */
    public ZoneId getZoneId() {
        if (StringUtils.isBlank(timezone)) {
            throw new IllegalStateException(
                    "timezone is not configured. Please set 'load.timezone' or pass --timezone.");
        }
        try {
            return ZoneId.of(timezone.trim());
        } catch (DateTimeException e) {
            throw new IllegalStateException("Unknown timezone: " + timezone, e);
        }
    }

    /**
     * Validates the numeric settings and the time zone.
     *
     * @throws IllegalStateException if any setting is out of range
     */
    public void validate() {
        if (batchSize <= 0) {
            throw new IllegalStateException("load.batch-size must be positive: " + batchSize);
        }
        if (maxIdentifierLength < 16) {
            throw new IllegalStateException(
                    "load.max-identifier-length is too small: " + maxIdentifierLength);
        }
        if (progressInterval <= 0) {
            throw new IllegalStateException(
                    "load.progress-interval must be positive: " + progressInterval);
        }
        getZoneId();
    }
}
