package com.airwatch.service.read;

import com.airwatch.core.model.ForecastDayEntry;
import com.airwatch.core.model.LiveView;

import java.time.Instant;
import java.util.List;

public record CompleteView(LiveView live, List<ForecastDayEntry> forecast, Instant retrievedAt) {
    public CompleteView {
        forecast = forecast == null ? List.of() : List.copyOf(forecast);
    }
}
