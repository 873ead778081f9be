package com.lulcplatform.common.year;

import java.util.List;

/**
 * The two source encodings of an initiative's {@code available_years} field,
 * resolved once from the untyped loader value. Everything downstream of
 * {@link YearListNormalizer} only sees the canonical ascending integer list.
 */
public interface RawYearList {

    /** An already-structured list, e.g. {@code [2015, 2016, "2017"]}. */
    record Explicit(List<?> values) implements RawYearList {}

    /** A textual encoding, e.g. {@code "2015-2019"} or {@code "2015, 2016, 2017"}. */
    record Encoded(String text) implements RawYearList {}

    /** No year field, or a value of an unsupported type. */
    record Absent(String reason) implements RawYearList {}

    static RawYearList of(Object value) {
        if (value == null) {
            return new Absent("no available_years field");
        }
        if (value instanceof List<?> list) {
            return new Explicit(list);
        }
        if (value instanceof CharSequence text) {
            return new Encoded(text.toString());
        }
        if (value instanceof Number number) {
            return new Explicit(List.of(number));
        }
        return new Absent("unsupported available_years type " + value.getClass().getSimpleName());
    }
}
