package com.lulcplatform.common.year;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class YearListNormalizerTest {

    // ── Explicit lists ─────────────────────────────────────────────────────

    @Nested
    @DisplayName("explicit lists")
    class ExplicitListTests {

        @Test
        @DisplayName("unsorted list with duplicates → sorted, deduplicated")
        void sortsAndDeduplicates() {
            YearListResult result = YearListNormalizer.normalize(List.of(2019, 2015, 2017, 2015));
            assertEquals(List.of(2015, 2017, 2019), result.years());
            assertTrue(result.notes().isEmpty());
        }

        @Test
        @DisplayName("digit strings and integral doubles are accepted")
        void mixedTypes() {
            YearListResult result = YearListNormalizer.normalize(List.of("2016", 2018.0, 2017L));
            assertEquals(List.of(2016, 2017, 2018), result.years());
        }

        @Test
        @DisplayName("longs and doubles outside the int range are discarded, not truncated")
        void outOfIntRange() {
            YearListResult result = YearListNormalizer.normalize(List.of(4294969311L, 1e12, 2016L));
            assertEquals(List.of(2016), result.years());
            assertEquals(2, result.notes().size());
        }

        @Test
        @DisplayName("bad items are discarded with a note, the rest survive")
        void discardsBadItems() {
            YearListResult result = YearListNormalizer.normalize(Arrays.asList(2015, "abc", null, 2016.5, 2020));
            assertEquals(List.of(2015, 2020), result.years());
            assertEquals(3, result.notes().size());
        }
    }

    // ── Encoded strings ────────────────────────────────────────────────────

    @Nested
    @DisplayName("encoded strings")
    class EncodedStringTests {

        @Test
        @DisplayName("\"2015-2019\" expands to an inclusive range")
        void range() {
            assertEquals(List.of(2015, 2016, 2017, 2018, 2019),
                YearListNormalizer.normalize("2015-2019").years());
        }

        @Test
        @DisplayName("range with spaces around the dash")
        void rangeWithSpaces() {
            assertEquals(List.of(2000, 2001, 2002),
                YearListNormalizer.normalize(" 2000 - 2002 ").years());
        }

        @Test
        @DisplayName("range with an unparseable end → empty with a note")
        void brokenRange() {
            YearListResult result = YearListNormalizer.normalize("2015-present");
            assertTrue(result.isEmpty());
            assertFalse(result.notes().isEmpty());
        }

        @Test
        @DisplayName("range ending at Integer.MAX_VALUE → empty with a note, returns promptly")
        void unboundedRange() {
            YearListResult result = assertTimeoutPreemptively(Duration.ofSeconds(5),
                () -> YearListNormalizer.normalize("2015-2147483647"));
            assertTrue(result.isEmpty());
            assertEquals(1, result.notes().size());
        }

        @Test
        @DisplayName("range outside the plausible year window → empty")
        void implausibleRange() {
            assertTrue(YearListNormalizer.normalize("1990-99999999").isEmpty());
            assertTrue(YearListNormalizer.normalize("0-2000").isEmpty());
            assertEquals(List.of(1000, 1001), YearListNormalizer.normalize("1000-1001").years());
        }

        @Test
        @DisplayName("inverted range → empty")
        void invertedRange() {
            assertTrue(YearListNormalizer.normalize("2020-2015").isEmpty());
        }

        @Test
        @DisplayName("comma list is split, trimmed and sorted")
        void commaList() {
            assertEquals(List.of(2015, 2016, 2017),
                YearListNormalizer.normalize("2017, 2015,2016").years());
        }

        @Test
        @DisplayName("comma list keeps good tokens and drops bad ones")
        void commaListWithBadTokens() {
            YearListResult result = YearListNormalizer.normalize("2015, n/a, 2018, 20x9");
            assertEquals(List.of(2015, 2018), result.years());
            assertEquals(2, result.notes().size());
        }

        @Test
        @DisplayName("a dash inside a comma list is not a range")
        void dashInCommaList() {
            assertEquals(List.of(2019), YearListNormalizer.normalize("2015-2017, 2019").years());
        }

        @Test
        @DisplayName("single year string")
        void singleYear() {
            assertEquals(List.of(2021), YearListNormalizer.normalize("2021").years());
        }
    }

    // ── Absent / unsupported ───────────────────────────────────────────────

    @Nested
    @DisplayName("absent and unsupported values")
    class AbsentTests {

        @Test
        @DisplayName("null → empty with a note, never throws")
        void nullValue() {
            YearListResult result = YearListNormalizer.normalize((Object) null);
            assertTrue(result.isEmpty());
            assertEquals(1, result.notes().size());
        }

        @Test
        @DisplayName("unsupported type → empty")
        void unsupportedType() {
            assertTrue(YearListNormalizer.normalize(new Object()).isEmpty());
        }

        @Test
        @DisplayName("RawYearList.of resolves each encoding")
        void tagging() {
            assertInstanceOf(RawYearList.Explicit.class, RawYearList.of(List.of(2015)));
            assertInstanceOf(RawYearList.Encoded.class, RawYearList.of("2015-2016"));
            assertInstanceOf(RawYearList.Absent.class, RawYearList.of(null));
        }
    }

    @Test
    @DisplayName("output is always strictly ascending")
    void strictlyAscending() {
        List<Object> inputs = List.of("2010, 2005, 2005, 2007", List.of(3, 1, 2, 2), "1999-2001", "x, 5, 4");
        for (Object input : inputs) {
            List<Integer> years = YearListNormalizer.normalize(input).years();
            for (int i = 0; i + 1 < years.size(); i++) {
                assertTrue(years.get(i) < years.get(i + 1), "not strictly ascending for " + input);
            }
        }
    }
}
