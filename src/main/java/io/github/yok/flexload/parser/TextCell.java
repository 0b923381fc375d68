package io.github.yok.flexload.parser;

import lombok.EqualsAndHashCode;
import lombok.ToString;
import org.apache.commons.lang3.StringUtils;

/**
 * Plain text cell.
 */
@ToString
@EqualsAndHashCode
public final class TextCell implements SourceCell {

    private final String text;

    /**
     * Creates a text cell.
     *
     * @param text cell text; may be {@code null}
     */
    public TextCell(String text) {
        this.text = text;
    }

    @Override
    public Object value(boolean preferHyperlink) {
        return text;
    }

    @Override
    public boolean isBlank() {
        return StringUtils.isBlank(text);
    }
}
