package io.github.yok.flexload.parser;

import java.util.Arrays;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;
import lombok.Getter;

/**
 * Enumeration of supported source file formats.
 *
 * <p>
 * Each format defines the file extensions recognized as belonging to it, so that
 * {@link TabularSourceFactory} does not hardcode string comparisons.
 * </p>
 */
@Getter
public enum SourceFormat {

    // Comma-separated values
    CSV("csv"),

    // Excel workbook (OOXML and legacy binary)
    SPREADSHEET("xlsx", "xls");

    // Valid extensions for this format (lowercase)
    private final Set<String> extensions;

    SourceFormat(String... exts) {
        this.extensions = Arrays.stream(exts).map(e -> e.toLowerCase(Locale.ROOT))
                .collect(Collectors.toSet());
    }

    /**
     * Determines whether the given file extension belongs to this format.
     *
     * @param ext file extension to check (case-insensitive, without dot)
     * @return {@code true} if the extension matches this format
     */
    public boolean matches(String ext) {
        return ext != null && extensions.contains(ext.toLowerCase(Locale.ROOT));
    }

    /**
     * Resolves the format of a file extension.
     *
     * @param ext file extension without dot
     * @return matching format, or {@code null} if the extension is not supported
     */
    public static SourceFormat fromExtension(String ext) {
        for (SourceFormat f : values()) {
            if (f.matches(ext)) {
                return f;
            }
        }
        return null;
    }
}
