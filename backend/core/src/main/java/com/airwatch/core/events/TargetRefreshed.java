package com.airwatch.core.events;

import java.time.Instant;

public record TargetRefreshed(
        Instant timestamp,
        String target,
        int aqi,
        String category,
        boolean persisted,
        int forecastDays
) implements Event {
    @Override
    public String type() {
        return "TargetRefreshed";
    }
}
