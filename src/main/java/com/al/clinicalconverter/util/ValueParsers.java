package com.al.clinicalconverter.util;

/**
 * Lenient numeric readers for free-text clinical fields.
 *
 * @author FHIR Transformer Team
 * @since 2.0.0
 */
public final class ValueParsers {

    private ValueParsers() {
        throw new UnsupportedOperationException("Utility class - do not instantiate");
    }

    /**
     * Parses a whole number, or returns null when the text is not one
     * (e.g. ".5", "81mg", empty).
     */
    public static Integer parseInteger(String value) {
        if (value == null) {
            return null;
        }
        String trimmed = value.trim();
        if (trimmed.isEmpty()) {
            return null;
        }
        try {
            return Integer.parseInt(trimmed);
        } catch (NumberFormatException e) {
            return null;
        }
    }

    /**
     * Like {@link #parseInteger(String)} but also rejects negative counts.
     */
    public static Integer parseQuantity(String value) {
        Integer parsed = parseInteger(value);
        return parsed != null && parsed >= 0 ? parsed : null;
    }

    /**
     * First non-empty value, or empty string.
     */
    public static String firstNonEmpty(String... values) {
        for (String value : values) {
            if (value != null && !value.isEmpty()) {
                return value;
            }
        }
        return "";
    }
}
