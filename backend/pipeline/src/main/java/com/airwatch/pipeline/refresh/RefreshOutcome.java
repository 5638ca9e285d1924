package com.airwatch.pipeline.refresh;

import com.airwatch.core.model.ForecastView;
import com.airwatch.core.model.LiveView;

import java.util.Optional;

public record RefreshOutcome(String target, LiveView live, ForecastView forecast, boolean persisted) {
    public Optional<ForecastView> forecastView() {
        return Optional.ofNullable(forecast);
    }
}
