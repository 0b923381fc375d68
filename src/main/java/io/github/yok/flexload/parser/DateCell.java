package io.github.yok.flexload.parser;

import java.time.LocalDateTime;
import lombok.EqualsAndHashCode;
import lombok.ToString;

/**
 * Spreadsheet cell whose number format is a date or time format.
 *
 * <p>
 * The date serial is converted to a local date/time in the 1900 date system, rounded to the
 * second. The value carries no zone; the destination type decides how it is stored.
 * </p>
 */
@ToString
@EqualsAndHashCode
public final class DateCell implements SourceCell {

    private final LocalDateTime dateTime;

    /**
     * Creates a date cell.
     *
     * @param dateTime local date/time shown by the cell
     */
    public DateCell(LocalDateTime dateTime) {
        this.dateTime = dateTime;
    }

    @Override
    public Object value(boolean preferHyperlink) {
        return dateTime;
    }

    @Override
    public boolean isBlank() {
        return false;
    }
}
