package com.lulcplatform.common.calendar;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Month;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class CalendarAggregatorTest {

    private static Map<String, Object> entry(String region, String state, Map<String, Object> months) {
        Map<String, Object> record = new LinkedHashMap<>();
        record.put("region", region);
        record.put("state_code", state);
        record.put("state_name", state);
        record.put("calendar", months);
        return record;
    }

    private static Map<String, Object> rawCalendar() {
        Map<String, Object> raw = new LinkedHashMap<>();
        raw.put("Soy", List.of(
            entry("South", "PR", Map.of("January", "PH", "February", "H", "March", "")),
            entry("Midwest", "MT", Map.of("Oct", "P", "Nov", "p"))));
        raw.put("Corn", List.of(
            entry("South", "RS", Map.of("January", "P/H", "Smarch", "P"))));
        return raw;
    }

    // ── Counting rules ─────────────────────────────────────────────────────

    @Nested
    @DisplayName("counting rules")
    class CountingTests {

        @Test
        @DisplayName("PH counts once in planting, once in harvest, once in distinct")
        void combinedCode() {
            Map<String, Object> raw = Map.of("Soy",
                List.of(entry("South", "PR", Map.of("January", "PH"))));
            CalendarAggregation aggregation = CalendarAggregator.aggregate(CropCalendar.fromRaw(raw).crops());

            assertEquals(1, aggregation.intensity().planting().get("South", Month.JANUARY));
            assertEquals(1, aggregation.intensity().harvest().get("South", Month.JANUARY));
            assertEquals(2, aggregation.intensity().total().get("South", Month.JANUARY));
            assertEquals(1, aggregation.distinct().get("South", Month.JANUARY));
        }

        @Test
        @DisplayName("national view sums all crops per region and month")
        void nationalView() {
            CalendarAggregation aggregation = CalendarAggregator.aggregate(CropCalendar.fromRaw(rawCalendar()).crops());

            assertEquals(List.of("South", "Midwest"), aggregation.regions());
            assertEquals(2, aggregation.intensity().planting().get("South", Month.JANUARY));
            assertEquals(2, aggregation.distinct().get("South", Month.JANUARY));
            assertEquals(1, aggregation.intensity().harvest().get("South", Month.FEBRUARY));
            assertEquals(0, aggregation.distinct().get("South", Month.MARCH));
            assertEquals(2, aggregation.intensity().planting().regionTotal("Midwest"));
            assertEquals(2, aggregation.intensity().harvest().monthTotal(Month.JANUARY));
        }

        @Test
        @DisplayName("distinct never exceeds planting + harvest")
        void distinctBound() {
            CalendarAggregation aggregation = CalendarAggregator.aggregate(CropCalendar.fromRaw(rawCalendar()).crops());
            for (String region : aggregation.regions()) {
                for (Month month : Month.values()) {
                    assertTrue(aggregation.distinct().get(region, month)
                        <= aggregation.intensity().total().get(region, month));
                }
            }
        }

        @Test
        @DisplayName("unknown month keys are skipped with a note")
        void unknownMonth() {
            CalendarAggregation aggregation = CalendarAggregator.aggregate(CropCalendar.fromRaw(rawCalendar()).crops());
            assertTrue(aggregation.notes().stream().anyMatch(n -> n.contains("Smarch")));
        }

        @Test
        @DisplayName("crops per region and monthly activity tallies")
        void supplementaryViews() {
            CalendarAggregation aggregation = CalendarAggregator.aggregate(CropCalendar.fromRaw(rawCalendar()).crops());

            assertEquals(2, aggregation.cropsPerRegion().get("South"));
            assertEquals(1, aggregation.cropsPerRegion().get("Midwest"));
            assertEquals(2, aggregation.monthlyActivities().get("January").get(ActivityType.PLANTING_AND_HARVEST));
            assertEquals(1, aggregation.monthlyActivities().get("October").get(ActivityType.PLANTING));
        }
    }

    // ── Crop filter ────────────────────────────────────────────────────────

    @Nested
    @DisplayName("crop filter")
    class FilterTests {

        @Test
        @DisplayName("single crop restricts regions and counts")
        void singleCrop() {
            CalendarAggregation aggregation = CalendarAggregator.aggregate(
                CropCalendar.fromRaw(rawCalendar()).crops(), "Corn");

            assertEquals("Corn", aggregation.crop());
            assertEquals(List.of("South"), aggregation.regions());
            assertEquals(1, aggregation.intensity().planting().total());
        }

        @Test
        @DisplayName("unknown crop → empty matrices with a note")
        void unknownCrop() {
            CalendarAggregation aggregation = CalendarAggregator.aggregate(
                CropCalendar.fromRaw(rawCalendar()).crops(), "Coffee");

            assertTrue(aggregation.regions().isEmpty());
            assertEquals(0, aggregation.distinct().total());
            assertFalse(aggregation.notes().isEmpty());
        }
    }

    // ── Parsing ────────────────────────────────────────────────────────────

    @Nested
    @DisplayName("parsing")
    class ParsingTests {

        @Test
        @DisplayName("activity codes")
        void activityCodes() {
            assertEquals(ActivityType.PLANTING_AND_HARVEST, ActivityCode.parse("P/H").type());
            assertEquals(ActivityType.HARVEST, ActivityCode.parse(" h ").type());
            assertEquals(ActivityType.NONE, ActivityCode.parse("").type());
            assertEquals(ActivityType.NONE, ActivityCode.parse("X").type());
            assertEquals(2, ActivityCode.parse("PH").intensity());
        }

        @Test
        @DisplayName("month keys accept full names and abbreviations")
        void monthKeys() {
            assertEquals(Month.SEPTEMBER, CalendarMonths.parse("september"));
            assertEquals(Month.SEPTEMBER, CalendarMonths.parse("Sep"));
            assertNull(CalendarMonths.parse("Se"));
            assertNull(CalendarMonths.parse("Smarch"));
        }

        @Test
        @DisplayName("non-list crops and non-object entries are noted, blank region is Unknown")
        void malformedSource() {
            Map<String, Object> raw = new LinkedHashMap<>();
            raw.put("Soy", "not a list");
            raw.put("Rice", List.of("junk", entry(" ", "AC", Map.of("May", "P"))));
            CropCalendar calendar = CropCalendar.fromRaw(raw);

            assertEquals(List.of("Rice"), List.copyOf(calendar.crops().keySet()));
            assertEquals(CalendarEntry.UNKNOWN_REGION, calendar.crops().get("Rice").get(0).region());
            assertEquals(2, calendar.notes().size());
        }
    }

    // ── Validation ─────────────────────────────────────────────────────────

    @Nested
    @DisplayName("validation")
    class ValidationTests {

        @Test
        @DisplayName("counts crops, states, regions and empty cells")
        void report() {
            CalendarValidation validation = CalendarValidator.validate(rawCalendar());

            assertTrue(validation.hasCropCalendar());
            assertEquals(2, validation.totalCrops());
            assertEquals(3, validation.totalStates());
            assertEquals(2, validation.totalRegions());
            assertEquals(7, validation.totalEntries());
            assertEquals(100.0 / 7, validation.missingDataPercentage(), 1e-9);
            assertEquals(100.0, validation.missingDataPercentage() + validation.dataCompleteness(), 1e-9);
        }

        @Test
        @DisplayName("absent section is reported, not thrown")
        void absent() {
            CalendarValidation validation = CalendarValidator.validate(null);
            assertFalse(validation.hasCropCalendar());
            assertEquals(1, validation.issues().size());
        }
    }
}
