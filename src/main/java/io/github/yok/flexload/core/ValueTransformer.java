package io.github.yok.flexload.core;

import io.github.yok.flexload.parser.SourceRow;
import io.github.yok.flexload.util.Identifiers;
import java.time.DateTimeException;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.List;
import lombok.extern.slf4j.Slf4j;

/**
 * Coerces raw cell values into typed values.
 *
 * <p>
 * Text is whitespace-normalized first; an absent value, {@code ""} and {@code "-"} become
 * {@code null} for every type. A value that cannot be coerced also becomes {@code null}: the
 * failure is logged and counted as a coercion warning, and the row is kept.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public class ValueTransformer {

    private static final String DASH = "-";

    private final RunCounters counters;

    public ValueTransformer(RunCounters counters) {
        this.counters = counters;
    }

    /**
     * Coerces one raw value. Never throws for bad input.
     *
     * @param raw {@link String}, {@link Number}, {@link java.time.LocalDateTime} or {@code null}
     * @param fieldType destination type
     * @param zone zone in which local date/times are interpreted
     * @return typed value or {@code null}
     */
    public Object transform(Object raw, FieldType fieldType, ZoneId zone) {
        if (raw == null) {
            return null;
        }
        Object value = raw;
        if (raw instanceof String) {
            String text = Identifiers.normalizeWhitespace((String) raw);
            if (text.isEmpty() || DASH.equals(text)) {
                return null;
            }
            value = text;
        }
        try {
            return fieldType.coerce(value, zone);
        } catch (IllegalArgumentException | DateTimeException | ArithmeticException e) {
            counters.incrementCoercionWarnings();
            log.warn("Invalid {} value '{}', loaded as NULL: {}", fieldType.getValue(), raw,
                    e.getMessage());
            return null;
        }
    }

    /**
     * Builds the typed row of a source row.
     *
     * @param source source row
     * @param schema resolved schema
     * @param zone zone in which local date/times are interpreted
     * @return row aligned with {@code schema}
     */
    public Row transformRow(SourceRow source, ResolvedSchema schema, ZoneId zone) {
        List<Object> values = new ArrayList<>(schema.size());
        for (ResolvedColumn column : schema.getColumns()) {
            Object raw = source.cell(column.getSourceIndex()).value(column.isPreferHyperlink());
            values.add(transform(raw, column.getFieldType(), zone));
        }
        return new Row(values);
    }
}
