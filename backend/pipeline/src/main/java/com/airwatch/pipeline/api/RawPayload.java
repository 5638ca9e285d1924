package com.airwatch.pipeline.api;

import com.airwatch.core.model.DayPoint;
import com.airwatch.core.model.Pollutant;

import java.time.Instant;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

public record RawPayload(
        Instant observedAt,
        Integer aqi,
        String dominantPollutant,
        Map<Pollutant, Double> concentrations,
        Map<Pollutant, List<DayPoint>> forecast
) {
    public RawPayload {
        EnumMap<Pollutant, Double> concentrationCopy = new EnumMap<>(Pollutant.class);
        if (concentrations != null) {
            concentrations.forEach((pollutant, value) -> {
                if (value != null) {
                    concentrationCopy.put(pollutant, value);
                }
            });
        }
        EnumMap<Pollutant, List<DayPoint>> forecastCopy = new EnumMap<>(Pollutant.class);
        if (forecast != null) {
            forecast.forEach((pollutant, days) -> {
                if (days != null && !days.isEmpty()) {
                    forecastCopy.put(pollutant, List.copyOf(days));
                }
            });
        }
        concentrations = Collections.unmodifiableMap(concentrationCopy);
        forecast = Collections.unmodifiableMap(forecastCopy);
    }

    public boolean hasForecast() {
        return !forecast.isEmpty();
    }
}
