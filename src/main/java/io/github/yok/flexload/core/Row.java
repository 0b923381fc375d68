package io.github.yok.flexload.core;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import lombok.EqualsAndHashCode;
import lombok.ToString;

/**
 * Typed values of one source row, aligned with the columns of a {@link ResolvedSchema}.
 *
 * <p>
 * Values are {@code null}, {@link String}, {@link java.math.BigDecimal} or
 * {@link java.time.Instant}.
 * </p>
 */
@ToString
@EqualsAndHashCode
public final class Row {

    private final List<Object> values;

    public Row(List<Object> values) {
        this.values = Collections.unmodifiableList(new ArrayList<>(values));
    }

    public Object get(int index) {
        return values.get(index);
    }

    public int size() {
        return values.size();
    }

    public List<Object> getValues() {
        return values;
    }

    /**
     * Returns whether every value is {@code null}.
     *
     * @return {@code true} for an empty row
     */
    public boolean isEmpty() {
        for (Object v : values) {
            if (v != null) {
                return false;
            }
        }
        return true;
    }
}
