package com.airwatch.core.model;

import com.airwatch.core.aqi.AqiCategory;

import java.time.LocalDate;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

public record ForecastDayEntry(
        LocalDate date,
        Map<Pollutant, PollutantRange> ranges,
        int aqi,
        AqiCategory category,
        String color
) {
    public ForecastDayEntry {
        Objects.requireNonNull(date, "date is required");
        Objects.requireNonNull(category, "category is required");
        EnumMap<Pollutant, PollutantRange> copy = new EnumMap<>(Pollutant.class);
        if (ranges != null) {
            copy.putAll(ranges);
        }
        ranges = Collections.unmodifiableMap(copy);
    }

    public Optional<PollutantRange> range(Pollutant pollutant) {
        return Optional.ofNullable(ranges.get(pollutant));
    }
}
