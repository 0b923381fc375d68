package io.github.yok.flexload.core;

import com.google.common.collect.ImmutableList;
import java.util.List;
import lombok.Getter;
import lombok.ToString;

/**
 * Ordered destination columns of one run, plus the configured headers that were not found in the
 * source. Destination identifiers are unique.
 */
@Getter
@ToString
public final class ResolvedSchema {

    private final ImmutableList<ResolvedColumn> columns;
    private final ImmutableList<String> missingHeaders;

    /**
     * Creates a schema.
     *
     * @param columns resolved columns in destination order
     * @param missingHeaders configured headers absent from the source
     */
    public ResolvedSchema(List<ResolvedColumn> columns, List<String> missingHeaders) {
        this.columns = ImmutableList.copyOf(columns);
        this.missingHeaders = ImmutableList.copyOf(missingHeaders);
    }

    public int size() {
        return columns.size();
    }

    /**
     * Returns the destination identifiers in column order.
     *
     * @return identifiers
     */
    public List<String> getSqlColumns() {
        ImmutableList.Builder<String> names = ImmutableList.builder();
        for (ResolvedColumn c : columns) {
            names.add(c.getSqlColumn());
        }
        return names.build();
    }
}
