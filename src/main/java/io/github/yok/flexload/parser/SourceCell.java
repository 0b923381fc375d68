package io.github.yok.flexload.parser;

/**
 * One raw cell of a source row.
 *
 * <p>
 * Implementations differ in what they can offer: plain cells hold a single value, hyperlink cells
 * hold a display value and a link target. Callers ask for a value and state whether a link target
 * is preferred; plain cells ignore that preference.
 * </p>
 */
public interface SourceCell {

    /**
     * Returns the raw value of this cell.
     *
     * @param preferHyperlink {@code true} to receive the link target when the cell carries one
     * @return {@link String}, {@link Number}, {@link java.time.LocalDateTime}, or {@code null}
     *         for an absent value
     */
    Object value(boolean preferHyperlink);

    /**
     * Returns whether the cell holds no visible content.
     *
     * @return {@code true} for an absent or whitespace-only value
     */
    boolean isBlank();
}
