package com.boqregistry.common;

import java.text.Normalizer;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Text normalization for keyword matching: diacritics removed (ř→r, č→c, ů→u), lowercase, single spaces.
 * Pure functions; null is treated as empty text.
 */
public final class TextNormalizer {

    private static final Pattern COMBINING_MARKS = Pattern.compile("\\p{M}+");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private TextNormalizer() {
    }

    /**
     * Strip diacritics, lowercase and collapse whitespace.
     */
    public static String normalize(String text) {
        return collapse(stripDiacritics(text).toLowerCase(Locale.ROOT));
    }

    /**
     * Key form of a catalog code: diacritics removed, whitespace collapsed and trimmed. Case is kept.
     */
    public static String normalizeCode(String code) {
        return collapse(stripDiacritics(code));
    }

    /**
     * Unit of measure in comparable form; superscripts are folded so "m³" equals "m3".
     */
    public static String normalizeUnit(String unit) {
        return normalize(unit).replace('³', '3').replace('²', '2');
    }

    /**
     * Concatenate description fields and normalize the result.
     */
    public static String normalizeAll(String... parts) {
        StringBuilder sb = new StringBuilder();
        for (String part : parts) {
            if (part != null && !part.isBlank()) {
                if (sb.length() > 0) {
                    sb.append(' ');
                }
                sb.append(part);
            }
        }
        return normalize(sb.toString());
    }

    public static boolean isBlank(String text) {
        return text == null || text.isBlank();
    }

    private static String stripDiacritics(String text) {
        if (text == null || text.isEmpty()) {
            return "";
        }
        String decomposed = Normalizer.normalize(text, Normalizer.Form.NFD);
        return COMBINING_MARKS.matcher(decomposed).replaceAll("");
    }

    private static String collapse(String text) {
        return WHITESPACE.matcher(text).replaceAll(" ").strip();
    }
}
