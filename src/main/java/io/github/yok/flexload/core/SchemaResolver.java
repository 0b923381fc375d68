package io.github.yok.flexload.core;

import io.github.yok.flexload.config.ColumnOverride;
import io.github.yok.flexload.config.ColumnSpec;
import io.github.yok.flexload.config.LoadConfig;
import io.github.yok.flexload.util.Identifiers;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Component;

/**
 * Maps the configured columns onto an actual header row.
 *
 * <p>
 * Headers are compared after whitespace normalization. Configured columns keep their
 * configuration order. When a header occurs several times in the source, the k-th configured
 * column with that header takes the k-th occurrence; a header configured once but present n times
 * yields n columns. Skipped columns consume their occurrence without producing a column.
 * Destination identifiers longer than {@code load.max-identifier-length} are truncated first;
 * duplicates are then numbered {@code name_2}, {@code name_3}, ... in first-seen order, cutting
 * the name further when the suffix would not fit.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SchemaResolver {

    private final LoadConfig loadConfig;

    /**
     * Resolves the destination schema.
     *
     * @param headerRow raw header row of the source
     * @param specs configured columns in configuration order
     * @param overrides per-header overrides; may be empty
     * @return resolved schema
     * @throws IllegalStateException if no configured column matches the header row
     */
    public ResolvedSchema resolve(List<String> headerRow, List<ColumnSpec> specs,
            Map<String, ColumnOverride> overrides) {
        Map<String, List<Integer>> occurrences = new HashMap<>();
        for (int i = 0; i < headerRow.size(); i++) {
            String header = Identifiers.normalizeWhitespace(headerRow.get(i));
            if (StringUtils.isNotEmpty(header)) {
                occurrences.computeIfAbsent(header, k -> new ArrayList<>()).add(i);
            }
        }

        List<ColumnSpec> merged = new ArrayList<>(specs.size());
        Map<String, Integer> configuredCount = new HashMap<>();
        for (ColumnSpec spec : specs) {
            String header = Identifiers.normalizeWhitespace(spec.getHeader());
            ColumnOverride override = overrides.get(spec.getHeader());
            if (override == null) {
                override = overrides.get(header);
            }
            merged.add(override != null ? override.applyTo(spec) : spec);
            configuredCount.merge(header, 1, Integer::sum);
        }

        List<ColumnSpec> candidates = new ArrayList<>();
        List<Integer> positions = new ArrayList<>();
        List<String> missing = new ArrayList<>();
        Map<String, Integer> consumed = new HashMap<>();
        for (ColumnSpec spec : merged) {
            String header = Identifiers.normalizeWhitespace(spec.getHeader());
            List<Integer> found = occurrences.getOrDefault(header, Collections.emptyList());
            List<Integer> taken;
            if (configuredCount.get(header) == 1 && found.size() > 1) {
                taken = found;
            } else {
                int k = consumed.getOrDefault(header, 0);
                if (k >= found.size()) {
                    log.warn("Configured column not found in source, skipped: '{}'", header);
                    missing.add(header);
                    continue;
                }
                consumed.put(header, k + 1);
                taken = Collections.singletonList(found.get(k));
            }
            if (spec.isSkip()) {
                continue;
            }
            for (Integer position : taken) {
                candidates.add(spec);
                positions.add(position);
            }
        }

        if (candidates.isEmpty()) {
            throw new IllegalStateException(
                    "No configured column matches the source header row: " + headerRow);
        }

        List<String> names = uniqueNames(candidates, positions);
        List<ResolvedColumn> columns = new ArrayList<>(candidates.size());
        for (int i = 0; i < candidates.size(); i++) {
            ColumnSpec spec = candidates.get(i);
            columns.add(new ResolvedColumn(Identifiers.normalizeWhitespace(spec.getHeader()),
                    positions.get(i), names.get(i), spec.getFieldType(), spec.isPrimary(),
                    spec.isNotNull(), spec.isNeedIndex(), spec.prefersHyperlink()));
        }
        log.info("Resolved {} destination columns ({} configured headers missing)",
                columns.size(), missing.size());
        return new ResolvedSchema(columns, missing);
    }

    private List<String> uniqueNames(List<ColumnSpec> candidates, List<Integer> positions) {
        int maxLength = loadConfig.getMaxIdentifierLength();
        List<String> bare = new ArrayList<>(candidates.size());
        for (int i = 0; i < candidates.size(); i++) {
            String name = candidates.get(i).resolveSqlColumn();
            // Header without letters or digits
            if (name.isEmpty()) {
                name = "column_" + (positions.get(i) + 1);
            }
            if (name.length() > maxLength) {
                log.warn("Column name longer than {} characters, truncated: '{}'", maxLength,
                        name);
                name = name.substring(0, maxLength);
            }
            bare.add(name);
        }
        Set<String> reserved = new HashSet<>(bare);
        Set<String> used = new HashSet<>();
        List<String> names = new ArrayList<>(bare.size());
        for (String name : bare) {
            String unique = name;
            int n = 2;
            while (used.contains(unique)) {
                do {
                    String suffix = "_" + n++;
                    unique = StringUtils.left(name, maxLength - suffix.length()) + suffix;
                } while (reserved.contains(unique));
            }
            used.add(unique);
            names.add(unique);
        }
        return names;
    }
}
