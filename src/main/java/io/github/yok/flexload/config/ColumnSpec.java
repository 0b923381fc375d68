package io.github.yok.flexload.config;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.github.yok.flexload.core.FieldType;
import io.github.yok.flexload.util.Identifiers;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.apache.commons.lang3.StringUtils;

/**
 * One configured destination column, as read from the column configuration JSON.
 *
 * <pre>
 * [
 *   { "header": "Submission Number", "sqlColumn": "submission_number", "primary": true },
 *   { "header": "Sent At", "fieldType": "timestamp", "needIndex": true },
 *   { "header": "Evidence", "isHyperlink": false }
 * ]
 * </pre>
 *
 * <p>
 * Unknown properties are rejected when the file is read.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Data
@NoArgsConstructor
public class ColumnSpec {

    // Expected source header text (required)
    private String header;

    // Destination identifier; defaults to the sanitized header
    private String sqlColumn;

    // Destination field type
    private FieldType fieldType = FieldType.STRING;

    // Part of the primary key
    private boolean primary;

    // NOT NULL constraint
    private boolean notNull;

    // Excluded from the destination
    private boolean skip;

    // Indexed in the destination
    private boolean needIndex;

    // Spreadsheet only: prefer the link target over the display text; null means "not set"
    @JsonProperty("isHyperlink")
    private Boolean hyperlink;

    /**
     * Creates a column with the given header and type and all flags off.
     *
     * @param header source header text
     * @param fieldType destination field type
     * @return new column definition
     */
    public static ColumnSpec of(String header, FieldType fieldType) {
        ColumnSpec spec = new ColumnSpec();
        spec.setHeader(header);
        spec.setFieldType(fieldType);
        return spec;
    }

    /**
     * Returns a field-by-field copy.
     *
     * @return copy of this definition
     */
    public ColumnSpec copy() {
        ColumnSpec c = new ColumnSpec();
        c.header = header;
        c.sqlColumn = sqlColumn;
        c.fieldType = fieldType;
        c.primary = primary;
        c.notNull = notNull;
        c.skip = skip;
        c.needIndex = needIndex;
        c.hyperlink = hyperlink;
        return c;
    }

    /**
     * Returns the destination identifier: {@link #sqlColumn} when set, the sanitized header
     * otherwise.
     *
     * @return destination identifier before duplicate disambiguation
     */
    public String resolveSqlColumn() {
        return StringUtils.isNotBlank(sqlColumn) ? sqlColumn.trim()
                : Identifiers.sanitize(header);
    }

    /**
     * Returns whether hyperlink targets are preferred. Only an explicit {@code false} disables
     * them.
     *
     * @return {@code true} unless {@code isHyperlink} is explicitly {@code false}
     */
    public boolean prefersHyperlink() {
        return !Boolean.FALSE.equals(hyperlink);
    }
}
