package io.github.yok.flexload.config;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.github.yok.flexload.core.FieldType;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Partial column definition applied on top of a {@link ColumnSpec} with the same header.
 *
 * <p>
 * Every field is optional; only fields that are set replace the base value.
 * </p>
 *
 * <pre>
 * {
 *   "Sent At": { "fieldType": "timestamp" },
 *   "Remarks": { "skip": true }
 * }
 * </pre>
 */
@Data
@NoArgsConstructor
public class ColumnOverride {

    private String sqlColumn;
    private FieldType fieldType;
    private Boolean primary;
    private Boolean notNull;
    private Boolean skip;
    private Boolean needIndex;

    @JsonProperty("isHyperlink")
    private Boolean hyperlink;

    /**
     * Returns a copy of {@code base} with every field set on this override replacing the base
     * value. {@code base} itself is not modified.
     *
     * @param base column definition to merge into
     * @return merged copy
     */
    public ColumnSpec applyTo(ColumnSpec base) {
        ColumnSpec merged = base.copy();
        if (sqlColumn != null) {
            merged.setSqlColumn(sqlColumn);
        }
        if (fieldType != null) {
            merged.setFieldType(fieldType);
        }
        if (primary != null) {
            merged.setPrimary(primary);
        }
        if (notNull != null) {
            merged.setNotNull(notNull);
        }
        if (skip != null) {
            merged.setSkip(skip);
        }
        if (needIndex != null) {
            merged.setNeedIndex(needIndex);
        }
        if (hyperlink != null) {
            merged.setHyperlink(hyperlink);
        }
        return merged;
    }
}
