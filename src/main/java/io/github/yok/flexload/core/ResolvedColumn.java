package io.github.yok.flexload.core;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

/**
 * One destination column bound to a source column position.
 */
@Getter
@ToString
@AllArgsConstructor
public final class ResolvedColumn {

    // Normalized source header the column was matched on
    private final String header;

    // Zero-based position of the source column
    private final int sourceIndex;

    // Destination identifier, unique within the schema
    private final String sqlColumn;

    private final FieldType fieldType;
    private final boolean primary;
    private final boolean notNull;
    private final boolean needIndex;
    private final boolean preferHyperlink;
}
