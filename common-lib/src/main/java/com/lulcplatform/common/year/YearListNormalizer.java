package com.lulcplatform.common.year;

import java.util.ArrayList;
import java.util.List;
import java.util.TreeSet;
import java.util.regex.Pattern;

/**
 * Decodes heterogeneous {@code available_years} values into an ascending,
 * duplicate-free list of years.
 *
 * <p>Accepted encodings:
 * <ul>
 *   <li>a list of integers (numbers or digit-only strings),</li>
 *   <li>an inclusive range string {@code "start-end"} (exactly one dash, no comma),</li>
 *   <li>a comma or whitespace separated string {@code "2015, 2016 2017"}.</li>
 * </ul>
 *
 * <p>Never throws. Every discarded token or rejected range is recorded as a note
 * on the returned {@link YearListResult}; the list itself is simply shorter (or empty).
 */
public final class YearListNormalizer {

    private static final Pattern SEPARATORS = Pattern.compile("[\\s,]+");

    /** Inclusive bounds a range end must fall in before it is expanded. */
    static final int MIN_RANGE_YEAR = 1000;
    static final int MAX_RANGE_YEAR = 9999;

    private YearListNormalizer() {}

    public static YearListResult normalize(Object rawValue) {
        return normalize(RawYearList.of(rawValue));
    }

    public static YearListResult normalize(RawYearList raw) {
        List<String> notes = new ArrayList<>();
        TreeSet<Integer> years = new TreeSet<>();

        if (raw instanceof RawYearList.Explicit explicit) {
            for (Object value : explicit.values()) {
                Integer year = toYear(value);
                if (year == null) {
                    notes.add("discarded year value '" + value + "'");
                } else {
                    years.add(year);
                }
            }
        } else if (raw instanceof RawYearList.Encoded encoded) {
            String text = encoded.text().trim();
            if (isRange(text)) {
                expandRange(text, years, notes);
            } else {
                for (String token : SEPARATORS.split(text)) {
                    if (token.isEmpty()) continue;
                    Integer year = parseInt(token);
                    if (year == null) {
                        notes.add("discarded year token '" + token + "'");
                    } else {
                        years.add(year);
                    }
                }
            }
        } else if (raw instanceof RawYearList.Absent absent) {
            notes.add(absent.reason());
        }

        return new YearListResult(new ArrayList<>(years), notes);
    }

    // ── Helpers ────────────────────────────────────────────────────

    static boolean isRange(String text) {
        return text.indexOf(',') < 0
            && text.indexOf('-') >= 0
            && text.indexOf('-') == text.lastIndexOf('-');
    }

    private static void expandRange(String text, TreeSet<Integer> years, List<String> notes) {
        int dash = text.indexOf('-');
        Integer start = parseInt(text.substring(0, dash));
        Integer end = parseInt(text.substring(dash + 1));
        if (start == null || end == null) {
            notes.add("unparseable year range '" + text + "'");
            return;
        }
        if (start > end) {
            notes.add("inverted year range '" + text + "'");
            return;
        }
        if (start < MIN_RANGE_YEAR || end > MAX_RANGE_YEAR) {
            notes.add("year range '" + text + "' outside " + MIN_RANGE_YEAR + "-" + MAX_RANGE_YEAR);
            return;
        }
        for (int year = start; year <= end; year++) {
            years.add(year);
        }
    }

    private static Integer toYear(Object value) {
        if (value instanceof Integer i) return i;
        if (value instanceof Long l) {
            return l >= Integer.MIN_VALUE && l <= Integer.MAX_VALUE ? l.intValue() : null;
        }
        if (value instanceof Number n) {
            double d = n.doubleValue();
            boolean integral = d == Math.rint(d) && Double.isFinite(d);
            return integral && d >= Integer.MIN_VALUE && d <= Integer.MAX_VALUE ? (int) d : null;
        }
        return value == null ? null : parseInt(value.toString());
    }

    private static Integer parseInt(String token) {
        String trimmed = token.trim();
        if (trimmed.isEmpty()) return null;
        for (int i = 0; i < trimmed.length(); i++) {
            if (!Character.isDigit(trimmed.charAt(i))) return null;
        }
        try {
            return Integer.parseInt(trimmed);
        } catch (NumberFormatException e) {
            return null;
        }
    }
}
