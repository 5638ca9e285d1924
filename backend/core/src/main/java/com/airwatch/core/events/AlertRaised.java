package com.airwatch.core.events;

import java.time.Instant;
import java.util.Map;

public record AlertRaised(
        Instant timestamp,
        String category,
        String message,
        Map<String, Object> details
) implements Event {
    public AlertRaised {
        details = details == null ? Map.of() : Map.copyOf(details);
    }

    @Override
    public String type() {
        return "AlertRaised";
    }
}
