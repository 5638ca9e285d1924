package com.airwatch.service.read;

import com.airwatch.core.cache.TtlCache;
import com.airwatch.core.model.ForecastDayEntry;
import com.airwatch.core.model.ForecastView;
import com.airwatch.core.model.LiveView;
import com.airwatch.core.model.MetricSnapshot;
import com.airwatch.core.model.TimelineEntry;
import com.airwatch.pipeline.api.SnapshotStore;
import com.airwatch.pipeline.api.Target;
import com.airwatch.pipeline.api.TargetRegistry;
import com.airwatch.pipeline.error.DataUnavailableException;
import com.airwatch.pipeline.refresh.CacheNamespaces;
import com.airwatch.pipeline.refresh.RefreshOutcome;
import com.airwatch.pipeline.timeline.TimelineBuilder;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;

public final class AirQualityReadService {
    private static final Logger LOGGER = Logger.getLogger(AirQualityReadService.class.getName());

    private final TargetRegistry registry;
    private final TtlCache cache;
    private final OnDemandRefresh refresh;
    private final SnapshotStore store;
    private final TimelineBuilder timelineBuilder;
    private final Clock clock;
    private final Duration liveTtl;
    private final Duration forecastTtl;
    private final int timelineDays;

    public AirQualityReadService(
            TargetRegistry registry,
            TtlCache cache,
            OnDemandRefresh refresh,
            SnapshotStore store,
            TimelineBuilder timelineBuilder,
            Clock clock,
            Duration liveTtl,
            Duration forecastTtl,
            int timelineDays
    ) {
        this.registry = Objects.requireNonNull(registry, "registry is required");
        this.cache = Objects.requireNonNull(cache, "cache is required");
        this.refresh = Objects.requireNonNull(refresh, "refresh is required");
        this.store = Objects.requireNonNull(store, "store is required");
        this.timelineBuilder = Objects.requireNonNull(timelineBuilder, "timelineBuilder is required");
        this.clock = Objects.requireNonNull(clock, "clock is required");
        this.liveTtl = Objects.requireNonNull(liveTtl, "liveTtl is required");
        this.forecastTtl = Objects.requireNonNull(forecastTtl, "forecastTtl is required");
        this.timelineDays = timelineDays;
    }

    public LiveView getLiveView(String targetId) {
        Target target = registry.require(targetId);
        Optional<LiveView> cached = cache.get(CacheNamespaces.LIVE, target.id(), liveTtl);
        if (cached.isPresent()) {
            return cached.get();
        }

        try {
            RefreshOutcome outcome = refresh.refresh(target.id());
            return cache.get(CacheNamespaces.LIVE, target.id(), liveTtl).orElse(outcome.live());
        } catch (RuntimeException e) {
            return latestStored(target, e);
        }
    }

    private LiveView latestStored(Target target, RuntimeException refreshFailure) {
        LOGGER.log(Level.WARNING, "Live refresh failed for " + target.id() + ", trying stored history", refreshFailure);
        Optional<MetricSnapshot> stored;
        try {
            stored = store.latest(target.id());
        } catch (RuntimeException storeFailure) {
            refreshFailure.addSuppressed(storeFailure);
            stored = Optional.empty();
        }
        return stored
                .map(snapshot -> LiveView.from(snapshot, target.displayName()))
                .orElseThrow(() -> new DataUnavailableException(target.id(), "live", refreshFailure));
    }

    public ForecastView getForecastView(String targetId) {
        Target target = registry.require(targetId);
        Optional<ForecastView> cached = cache.get(CacheNamespaces.FORECAST, target.id(), forecastTtl);
        if (cached.isPresent()) {
            return cached.get();
        }

        RefreshOutcome outcome;
        try {
            outcome = refresh.refresh(target.id());
        } catch (RuntimeException e) {
            throw new DataUnavailableException(target.id(), "forecast", e);
        }
        return cache.get(CacheNamespaces.FORECAST, target.id(), forecastTtl)
                .or(outcome::forecastView)
                .orElseThrow(() -> new DataUnavailableException(target.id(), "forecast"));
    }

    public CompleteView getCompleteView(String targetId) {
        LiveView live = getLiveView(targetId);
        List<ForecastDayEntry> forecast;
        try {
            forecast = getForecastView(targetId).days();
        } catch (DataUnavailableException e) {
            LOGGER.info("No forecast for " + live.target() + ": " + e.getMessage());
            forecast = List.of();
        }
        return new CompleteView(live, forecast, clock.instant());
    }

    public TimelineView getTimeline(String targetId) {
        Target target = registry.require(targetId);
        List<TimelineEntry> days = timelineBuilder.build(target.id(), timelineDays);
        return new TimelineView(target.id(), target.displayName(), "Last " + timelineDays + " days", days);
    }
}
