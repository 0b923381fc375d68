package io.github.yok.flexload.core;

import io.github.yok.flexload.config.ColumnOverride;
import io.github.yok.flexload.config.ColumnSpec;
import io.github.yok.flexload.config.LoadConfig;
import io.github.yok.flexload.db.TableName;
import java.nio.file.Path;
import java.time.ZoneId;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import lombok.Data;

/**
 * Parameters of one run.
 */
@Data
public class LoadRequest {

    // Source file (csv, xlsx, xls)
    private Path inputFile;

    // Destination table
    private TableName destination;

    // Configured columns; null derives them from the header row
    private List<ColumnSpec> columns;

    // Per-header overrides
    private Map<String, ColumnOverride> overrides = Collections.emptyMap();

    // Zone in which local date/times are interpreted
    private ZoneId timezone;

    private int batchSize = LoadConfig.DEFAULT_BATCH_SIZE;

    // Replace (true) or merge (false)
    private boolean truncate;

    // Spreadsheet sheet; null selects the first sheet
    private String sheetName;
}
