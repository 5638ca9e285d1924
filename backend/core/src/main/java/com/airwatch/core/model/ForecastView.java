package com.airwatch.core.model;

import java.time.Instant;
import java.util.List;

public record ForecastView(String target, String displayName, List<ForecastDayEntry> days, Instant retrievedAt) {
    public ForecastView {
        days = days == null ? List.of() : List.copyOf(days);
    }
}
