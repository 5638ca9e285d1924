package com.airwatch.core.events;

import java.time.Instant;

public record RefreshCycleStarted(Instant timestamp, long cycle, int targetCount) implements Event {
    @Override
    public String type() {
        return "RefreshCycleStarted";
    }
}
