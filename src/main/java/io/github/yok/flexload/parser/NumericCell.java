package io.github.yok.flexload.parser;

import lombok.EqualsAndHashCode;
import lombok.ToString;

/**
 * Spreadsheet numeric cell. Date-formatted cells are read as {@link DateCell} instead.
 */
@ToString
@EqualsAndHashCode
public final class NumericCell implements SourceCell {

    private final double number;

    /**
     * Creates a numeric cell.
     *
     * @param number cell value
     */
    public NumericCell(double number) {
        this.number = number;
    }

    @Override
    public Object value(boolean preferHyperlink) {
        return number;
    }

    @Override
    public boolean isBlank() {
        return false;
    }
}
