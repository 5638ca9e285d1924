package com.airwatch.core.events;

import java.time.Instant;

public record RefreshCycleCompleted(
        Instant timestamp,
        long cycle,
        int successes,
        int failures,
        long durationMillis
) implements Event {
    @Override
    public String type() {
        return "RefreshCycleCompleted";
    }
}
