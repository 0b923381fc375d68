package io.github.yok.flexload.config;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.yok.flexload.core.FieldType;
import io.github.yok.flexload.util.Identifiers;
import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Component;

/**
 * Reads the column configuration and the optional per-header overrides from JSON.
 *
 * <p>
 * Both files are validated when they are read: unknown properties, an unknown
 * {@code fieldType} or a column without {@code header} fail with an
 * {@link IllegalArgumentException} naming the file.
 * </p>
 *
 * <p>
 * When no column configuration is given, {@link #deriveFromHeaders(List, Map)} builds one from
 * the source header row.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
@Component
public class TableConfigLoader {

    private final ObjectMapper mapper =
            new ObjectMapper().enable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
                    .enable(DeserializationFeature.FAIL_ON_NULL_FOR_PRIMITIVES);

    /**
     * Reads a JSON array of {@link ColumnSpec}.
     *
     * @param file column configuration file
     * @return configured columns in file order (unmodifiable)
     * @throws IllegalArgumentException if the file is missing, unreadable or invalid
     */
    public List<ColumnSpec> loadColumns(Path file) {
        if (file == null || !Files.isRegularFile(file)) {
            throw new IllegalArgumentException("Table config file not found: " + file);
        }
        List<ColumnSpec> columns;
        try (Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            columns = mapper.readValue(reader, new TypeReference<List<ColumnSpec>>() {});
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException(
                    "Invalid table config " + file + ": " + e.getOriginalMessage(), e);
        } catch (IOException e) {
            throw new IllegalArgumentException("Failed to read table config: " + file, e);
        }
        if (columns == null || columns.isEmpty()) {
            throw new IllegalArgumentException("Table config defines no columns: " + file);
        }
        for (int i = 0; i < columns.size(); i++) {
            ColumnSpec spec = columns.get(i);
            if (spec == null || StringUtils.isBlank(spec.getHeader())) {
                throw new IllegalArgumentException(
                        "Table config " + file + ": column #" + (i + 1) + " has no header");
            }
            if (spec.getFieldType() == null) {
                spec.setFieldType(FieldType.STRING);
            }
        }
        log.info("Loaded table configuration: {} columns from {}", columns.size(),
                file.getFileName());
        return Collections.unmodifiableList(columns);
    }

    /**
     * Reads the optional overrides object ({@code header text → partial column definition}).
     *
     * @param file overrides file; {@code null} or a missing file yields an empty map
     * @return overrides keyed by header text (unmodifiable, file order)
     * @throws IllegalArgumentException if the file exists but is unreadable or invalid
     */
    public Map<String, ColumnOverride> loadOverrides(Path file) {
        if (file == null || !Files.exists(file)) {
            if (file != null) {
                log.info("Overrides file not found, no overrides applied: {}", file);
            }
            return Collections.emptyMap();
        }
        Map<String, ColumnOverride> overrides;
        try (Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            overrides = mapper.readValue(reader,
                    new TypeReference<LinkedHashMap<String, ColumnOverride>>() {});
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException(
                    "Invalid overrides config " + file + ": " + e.getOriginalMessage(), e);
        } catch (IOException e) {
            throw new IllegalArgumentException("Failed to read overrides config: " + file, e);
        }
        if (overrides == null) {
            return Collections.emptyMap();
        }
        log.info("Loaded {} column overrides from {}", overrides.size(), file.getFileName());
        return Collections.unmodifiableMap(overrides);
    }

    /**
     * Builds a column configuration from a header row.
     *
     * <p>
     * Every non-blank header becomes a {@link FieldType#STRING} column that prefers hyperlink
     * targets. The second and later occurrences of a header {@code H} are named {@code H 2},
     * {@code H 3}, ... Overrides are applied by that (possibly numbered) header text.
     * </p>
     *
     * @param headerRow raw header cells
     * @param overrides overrides keyed by header text; may be empty
     * @return derived column definitions in header order (unmodifiable)
     */
    public List<ColumnSpec> deriveFromHeaders(List<String> headerRow,
            Map<String, ColumnOverride> overrides) {
        Map<String, Integer> seen = new HashMap<>();
        List<ColumnSpec> derived = new ArrayList<>();
        for (String raw : headerRow) {
            String header = Identifiers.normalizeWhitespace(raw);
            if (StringUtils.isEmpty(header)) {
                continue;
            }
            int occurrence = seen.merge(header, 1, Integer::sum);
            String name = occurrence == 1 ? header : header + " " + occurrence;

            ColumnSpec spec = ColumnSpec.of(header, FieldType.STRING);
            spec.setSqlColumn(Identifiers.sanitize(name));
            spec.setHyperlink(Boolean.TRUE);

            ColumnOverride override = overrides.get(name);
            derived.add(override != null ? override.applyTo(spec) : spec);
        }
        log.info("Derived table configuration from header row: {} columns", derived.size());
        return Collections.unmodifiableList(derived);
    }
}
