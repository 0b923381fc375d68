package io.github.yok.flexload.parser;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import lombok.Getter;
import lombok.ToString;

/**
 * One physical row of a source, cells aligned by column position.
 */
@Getter
@ToString
public final class SourceRow {

    private static final SourceCell ABSENT = new TextCell(null);

    // One-based line (CSV) or row (spreadsheet) number, for logs
    private final long number;

    private final List<SourceCell> cells;

    /**
     * Creates a row.
     *
     * @param number one-based line or row number
     * @param cells cells in column order
     */
    public SourceRow(long number, List<SourceCell> cells) {
        this.number = number;
        this.cells = Collections.unmodifiableList(cells);
    }

    /**
     * Returns the cell at a column position. Positions past the end of a short row yield an absent
     * cell.
     *
     * @param index zero-based column position
     * @return cell, never {@code null}
     */
    public SourceCell cell(int index) {
        return index >= 0 && index < cells.size() ? cells.get(index) : ABSENT;
    }

    /**
     * Returns the display text of every cell, as used for header rows.
     *
     * @return cell texts in column order; absent cells are {@code null}
     */
    public List<String> texts() {
        String[] texts = new String[cells.size()];
        for (int i = 0; i < texts.length; i++) {
            Object v = cells.get(i).value(false);
            texts[i] = v == null ? null : v instanceof Double ? formatNumber((Double) v)
                    : String.valueOf(v);
        }
        return Arrays.asList(texts);
    }

    private static String formatNumber(double d) {
        return d == Math.rint(d) && !Double.isInfinite(d) ? String.valueOf((long) d)
                : String.valueOf(d);
    }
}
