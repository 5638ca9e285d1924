package com.airwatch.pipeline.forecast;

import com.airwatch.core.aqi.AqiCategory;
import com.airwatch.core.model.DayPoint;
import com.airwatch.core.model.ForecastDayEntry;
import com.airwatch.core.model.Pollutant;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ForecastAlignerTest {
    private static final LocalDate D0 = LocalDate.parse("2026-03-02");

    private final ForecastAligner aligner = new ForecastAligner();

    @Test
    void singlePollutantWeekLeavesOtherPollutantsEmpty() {
        List<DayPoint> pm25 = new ArrayList<>();
        for (int i = 0; i < 7; i++) {
            pm25.add(new DayPoint(D0.plusDays(i), 10.0 + i, 5.0, 20.0));
        }

        List<ForecastDayEntry> days = aligner.align(Map.of(Pollutant.PM25, pm25), D0);

        assertEquals(7, days.size());
        for (int i = 0; i < 7; i++) {
            ForecastDayEntry day = days.get(i);
            assertEquals(D0.plusDays(i), day.date());
            assertTrue(day.range(Pollutant.PM25).isPresent());
            assertFalse(day.range(Pollutant.PM10).isPresent());
            assertFalse(day.range(Pollutant.O3).isPresent());
        }
        assertEquals(10.0, days.get(0).range(Pollutant.PM25).orElseThrow().avg());
    }

    @Test
    void mergesSeriesByDateInAscendingOrder() {
        Map<Pollutant, List<DayPoint>> series = Map.of(
                Pollutant.PM25, List.of(new DayPoint(D0.plusDays(1), 30.0, 20.0, 40.0)),
                Pollutant.O3, List.of(
                        new DayPoint(D0.plusDays(2), 40.0, 30.0, 50.0),
                        new DayPoint(D0, 35.0, 30.0, 45.0)
                )
        );

        List<ForecastDayEntry> days = aligner.align(series, D0);

        assertEquals(List.of(D0, D0.plusDays(1), D0.plusDays(2)), days.stream().map(ForecastDayEntry::date).toList());
        assertTrue(days.get(0).range(Pollutant.O3).isPresent());
        assertFalse(days.get(0).range(Pollutant.PM25).isPresent());
    }

    @Test
    void dropsDaysBeforeWindowAndCapsAtMaxDays() {
        List<DayPoint> pm10 = new ArrayList<>();
        for (int i = -2; i < 10; i++) {
            pm10.add(new DayPoint(D0.plusDays(i), 20.0, null, null));
        }

        List<ForecastDayEntry> days = aligner.align(Map.of(Pollutant.PM10, pm10), D0, 5);

        assertEquals(5, days.size());
        assertEquals(D0, days.get(0).date());
        assertEquals(D0.plusDays(4), days.get(4).date());
    }

    @Test
    void representativeIndexFollowsPriorityOrder() {
        Map<Pollutant, List<DayPoint>> series = Map.of(
                Pollutant.PM25, List.of(new DayPoint(D0, 70.0, null, null)),
                Pollutant.PM10, List.of(new DayPoint(D0, 1.0, null, null), new DayPoint(D0.plusDays(1), 40.0, null, null))
        );

        List<ForecastDayEntry> days = aligner.align(series, D0);

        assertEquals(158, days.get(0).aqi());
        assertEquals(AqiCategory.UNHEALTHY, days.get(0).category());
        assertEquals(112, days.get(1).aqi());
        assertEquals(AqiCategory.UNHEALTHY_FOR_SENSITIVE_GROUPS, days.get(1).category());
    }

    @Test
    void dayWithoutAnyAverageIsClassifiedAsZero() {
        List<ForecastDayEntry> days = aligner.align(
                Map.of(Pollutant.O3, List.of(new DayPoint(D0, null, 3.0, 9.0))),
                D0
        );

        assertEquals(1, days.size());
        assertEquals(0, days.get(0).aqi());
        assertEquals(AqiCategory.GOOD, days.get(0).category());
        assertEquals("#00E400", days.get(0).color());
    }

    @Test
    void emptyInputYieldsEmptyForecast() {
        assertTrue(aligner.align(Map.of(), D0).isEmpty());
        assertTrue(aligner.align(null, D0).isEmpty());
        assertTrue(aligner.align(Map.of(Pollutant.PM25, List.of(new DayPoint(D0, 5.0, null, null))), D0, 0).isEmpty());
    }

    @Test
    void rejectsNegativeMaxDays() {
        assertThrows(IllegalArgumentException.class, () -> aligner.align(Map.of(), D0, -1));
    }
}
