package com.al.clinicalconverter.util;

import java.util.Locale;
import java.util.Optional;

/**
 * Lenient reader for the leading {@code YYYYMMDD} of an HL7 date/time value.
 *
 * <p>
 * Accepts any value of at least 8 characters whose first 8 are digits, with
 * year in [1900, 2100], month in [1, 12] and day in [1, 31]. Days are not
 * checked against the month length. Anything else is "no date", never an
 * error.
 *
 * <pre>
 * parseHl7Date("20150202")       = Optional[2015-02-02]
 * parseHl7Date("20150202111146") = Optional[2015-02-02]
 * parseHl7Date("abcd1234")       = Optional.empty
 * parseHl7Date("9999")           = Optional.empty
 * </pre>
 *
 * @author FHIR Transformer Team
 * @since 2.0.0
 */
public final class Hl7DateUtil {

    private static final int MIN_YEAR = 1900;
    private static final int MAX_YEAR = 2100;

    private Hl7DateUtil() {
        throw new UnsupportedOperationException("Utility class - do not instantiate");
    }

    /**
     * Converts the date part of an HL7 value to ISO {@code YYYY-MM-DD}.
     *
     * @param hl7Date HL7 date or date/time (e.g. "20260116" or "20260116120000")
     * @return the ISO date, or empty when the value is not a plausible date
     */
    public static Optional<String> parseHl7Date(String hl7Date) {
        if (hl7Date == null || hl7Date.length() < 8) {
            return Optional.empty();
        }

        String year = hl7Date.substring(0, 4);
        String month = hl7Date.substring(4, 6);
        String day = hl7Date.substring(6, 8);
        if (!isDigits(year) || !isDigits(month) || !isDigits(day)) {
            return Optional.empty();
        }

        int y = Integer.parseInt(year);
        int m = Integer.parseInt(month);
        int d = Integer.parseInt(day);
        if (y < MIN_YEAR || y > MAX_YEAR || m < 1 || m > 12 || d < 1 || d > 31) {
            return Optional.empty();
        }
        return Optional.of(String.format(Locale.ROOT, "%04d-%02d-%02d", y, m, d));
    }

    private static boolean isDigits(String s) {
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            if (c < '0' || c > '9') {
                return false;
            }
        }
        return !s.isEmpty();
    }
}
