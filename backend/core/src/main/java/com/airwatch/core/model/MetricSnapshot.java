package com.airwatch.core.model;

import java.time.Instant;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

public record MetricSnapshot(
        String target,
        Instant timestamp,
        int aqi,
        String dominantPollutant,
        Map<Pollutant, Double> concentrations
) {
    public MetricSnapshot {
        Objects.requireNonNull(target, "target is required");
        Objects.requireNonNull(timestamp, "timestamp is required");
        if (aqi < 0) {
            throw new IllegalArgumentException("aqi must be non-negative");
        }
        EnumMap<Pollutant, Double> copy = new EnumMap<>(Pollutant.class);
        if (concentrations != null) {
            concentrations.forEach((pollutant, value) -> {
                if (pollutant != null && value != null) {
                    copy.put(pollutant, value);
                }
            });
        }
        concentrations = Collections.unmodifiableMap(copy);
    }

    public Optional<Double> concentration(Pollutant pollutant) {
        return Optional.ofNullable(concentrations.get(pollutant));
    }
}
