package com.airwatch.service.read;

import com.airwatch.core.model.TimelineEntry;

import java.util.List;

public record TimelineView(String target, String displayName, String period, List<TimelineEntry> days) {
    public TimelineView {
        days = days == null ? List.of() : List.copyOf(days);
    }
}
