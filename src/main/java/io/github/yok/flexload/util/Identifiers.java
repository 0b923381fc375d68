package io.github.yok.flexload.util;

import java.util.Locale;
import java.util.regex.Pattern;
import lombok.Generated;

/**
 * Utility for normalizing header text and deriving SQL identifiers from it.
 *
 * @author Yasuharu.Okawauchi
 */
public final class Identifiers {

    private static final Pattern WHITESPACE_RUN = Pattern.compile("\\s+");
    private static final Pattern NON_ALNUM_RUN = Pattern.compile("[^a-z0-9]+");
    private static final Pattern EDGE_UNDERSCORES = Pattern.compile("^_+|_+$");
    private static final Pattern UNDERSCORE_RUN = Pattern.compile("_+");

    /**
     * Prevents instantiation of this utility class.
     */
    @Generated
    private Identifiers() {
        throw new AssertionError("No io.github.yok.flexload.util.Identifiers instances for you!");
    }

    /**
     * Collapses every run of whitespace (including line breaks) into one space and trims.
     *
     * @param text text to normalize; may be {@code null}
     * @return normalized text, or {@code null} if {@code text} is {@code null}
     */
    public static String normalizeWhitespace(String text) {
        if (text == null) {
            return null;
        }
        return WHITESPACE_RUN.matcher(text).replaceAll(" ").trim();
    }

    /**
     * Derives a lower-case identifier from free text.
     *
     * <p>
     * Every run of characters outside {@code [a-z0-9]} becomes an underscore, leading and trailing
     * underscores are removed and consecutive underscores are collapsed. For example
     * {@code "Stage 1 Date"} becomes {@code stage_1_date}.
     * </p>
     *
     * @param text header text
     * @return sanitized identifier; empty when {@code text} holds no letters or digits
     */
    public static String sanitize(String text) {
        if (text == null) {
            return "";
        }
        String s = NON_ALNUM_RUN.matcher(text.toLowerCase(Locale.ROOT)).replaceAll("_");
        s = EDGE_UNDERSCORES.matcher(s).replaceAll("");
        return UNDERSCORE_RUN.matcher(s).replaceAll("_");
    }
}
