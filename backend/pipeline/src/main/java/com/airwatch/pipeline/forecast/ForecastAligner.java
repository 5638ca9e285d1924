package com.airwatch.pipeline.forecast;

import com.airwatch.core.aqi.AqiAssessment;
import com.airwatch.core.aqi.AqiClassifier;
import com.airwatch.core.model.DayPoint;
import com.airwatch.core.model.ForecastDayEntry;
import com.airwatch.core.model.Pollutant;
import com.airwatch.core.model.PollutantRange;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.Objects;
import java.util.TreeMap;

public final class ForecastAligner {
    public static final int DEFAULT_MAX_DAYS = 7;
    public static final List<Pollutant> DEFAULT_PRIORITY = List.of(Pollutant.PM25, Pollutant.PM10, Pollutant.O3);

    private final List<Pollutant> priority;

    public ForecastAligner() {
        this(DEFAULT_PRIORITY);
    }

    public ForecastAligner(List<Pollutant> priority) {
        this.priority = List.copyOf(priority);
    }

    public List<ForecastDayEntry> align(Map<Pollutant, List<DayPoint>> series, LocalDate windowStart) {
        return align(series, windowStart, DEFAULT_MAX_DAYS);
    }

    public List<ForecastDayEntry> align(Map<Pollutant, List<DayPoint>> series, LocalDate windowStart, int maxDays) {
        Objects.requireNonNull(windowStart, "windowStart is required");
        if (maxDays < 0) {
            throw new IllegalArgumentException("maxDays must not be negative");
        }
        if (series == null || series.isEmpty() || maxDays == 0) {
            return List.of();
        }

        NavigableMap<LocalDate, Map<Pollutant, PollutantRange>> byDate = new TreeMap<>();
        series.forEach((pollutant, points) -> {
            if (pollutant == null || points == null) {
                return;
            }
            for (DayPoint point : points) {
                byDate.computeIfAbsent(point.date(), ignored -> new EnumMap<>(Pollutant.class))
                        .put(pollutant, point.toRange());
            }
        });

        List<ForecastDayEntry> days = new ArrayList<>();
        for (Map.Entry<LocalDate, Map<Pollutant, PollutantRange>> day : byDate.tailMap(windowStart, true).entrySet()) {
            if (days.size() == maxDays) {
                break;
            }
            AqiAssessment assessment = AqiClassifier.classify(representativeIndex(day.getValue()));
            days.add(new ForecastDayEntry(
                    day.getKey(),
                    day.getValue(),
                    assessment.index(),
                    assessment.category(),
                    assessment.color()
            ));
        }
        return days;
    }

    private int representativeIndex(Map<Pollutant, PollutantRange> ranges) {
        for (Pollutant pollutant : priority) {
            PollutantRange range = ranges.get(pollutant);
            if (range != null && range.avg() != null) {
                return AqiClassifier.concentrationToIndex(range.avg());
            }
        }
        return 0;
    }
}
