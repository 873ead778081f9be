package com.lulcplatform.common.model;

import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Lenient conversion of loader cells into typed values.
 *
 * <p>Cells arrive as whatever the JSON source held: numbers, numeric strings with
 * units ({@code "80.3%"}, {@code "30 m"}) or free-text sentinels such as
 * {@code "Not informed"}. Sentinels and unparseable text resolve to {@code null}
 * (missing), never to zero.
 */
public final class CellValues {

    private static final Set<String> MISSING_SENTINELS = Set.of(
        "not informed", "incomplete", "n/a", "na", "not available", "-", "none", "null", "unknown");

    private static final Pattern NON_NUMERIC = Pattern.compile("[^0-9.\\-]");

    private CellValues() {}

    /**
     * @return the numeric value of the cell, or {@code null} when it is absent,
     *         a sentinel, non-finite or cannot be parsed
     */
    public static Double toDouble(Object cell) {
        if (cell == null) return null;
        if (cell instanceof Number number) {
            double value = number.doubleValue();
            return Double.isFinite(value) ? value : null;
        }
        String text = cell.toString().trim();
        if (text.isEmpty() || isMissingSentinel(text)) return null;

        String digits = NON_NUMERIC.matcher(text).replaceAll("");
        if (digits.isEmpty() || digits.equals(".") || digits.equals("-")) return null;
        try {
            double value = Double.parseDouble(digits);
            return Double.isFinite(value) ? value : null;
        } catch (NumberFormatException e) {
            return null;
        }
    }

    /** Same as {@link #toDouble(Object)} but also treats zero and negatives as missing. */
    public static Double toPositiveDouble(Object cell) {
        Double value = toDouble(cell);
        return value != null && value > 0 ? value : null;
    }

    /** Trimmed text of the cell, or {@code null} for absent and blank cells. */
    public static String toText(Object cell) {
        if (cell == null) return null;
        String text = cell.toString().trim();
        return text.isEmpty() ? null : text;
    }

    public static boolean isMissingSentinel(String text) {
        return text != null && MISSING_SENTINELS.contains(text.trim().toLowerCase(Locale.ROOT));
    }
}
