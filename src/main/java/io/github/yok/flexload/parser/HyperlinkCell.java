package io.github.yok.flexload.parser;

import lombok.EqualsAndHashCode;
import lombok.ToString;

/**
 * Spreadsheet cell that carries a hyperlink target in addition to its display value.
 */
@ToString
@EqualsAndHashCode
public final class HyperlinkCell implements SourceCell {

    private final SourceCell display;
    private final String target;

    /**
     * Creates a hyperlink cell.
     *
     * @param display cell holding the display value
     * @param target link address
     */
    public HyperlinkCell(SourceCell display, String target) {
        this.display = display;
        this.target = target;
    }

    @Override
    public Object value(boolean preferHyperlink) {
        return preferHyperlink ? target : display.value(false);
    }

    @Override
    public boolean isBlank() {
        return display.isBlank() && (target == null || target.trim().isEmpty());
    }
}
