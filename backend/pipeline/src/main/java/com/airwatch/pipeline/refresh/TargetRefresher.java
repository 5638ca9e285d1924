package com.airwatch.pipeline.refresh;

import com.airwatch.core.cache.TtlCache;
import com.airwatch.core.model.ForecastDayEntry;
import com.airwatch.core.model.ForecastView;
import com.airwatch.core.model.LiveView;
import com.airwatch.core.model.MetricSnapshot;
import com.airwatch.pipeline.api.AirQualitySource;
import com.airwatch.pipeline.api.RawPayload;
import com.airwatch.pipeline.api.SnapshotStore;
import com.airwatch.pipeline.api.Target;
import com.airwatch.pipeline.api.TargetRegistry;
import com.airwatch.pipeline.error.WriteFailureException;
import com.airwatch.pipeline.forecast.ForecastAligner;
import com.airwatch.pipeline.guard.PersistenceGuard;

import java.time.Clock;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;

public final class TargetRefresher {
    private static final Logger LOGGER = Logger.getLogger(TargetRefresher.class.getName());

    private final TargetRegistry registry;
    private final AirQualitySource source;
    private final SnapshotStore store;
    private final PersistenceGuard guard;
    private final ForecastAligner aligner;
    private final TtlCache cache;
    private final SnapshotAssembler assembler;
    private final Clock clock;
    private final int forecastDays;

    public TargetRefresher(
            TargetRegistry registry,
            AirQualitySource source,
            SnapshotStore store,
            PersistenceGuard guard,
            ForecastAligner aligner,
            TtlCache cache,
            Clock clock,
            int forecastDays
    ) {
        this.registry = Objects.requireNonNull(registry, "registry is required");
        this.source = Objects.requireNonNull(source, "source is required");
        this.store = Objects.requireNonNull(store, "store is required");
        this.guard = Objects.requireNonNull(guard, "guard is required");
        this.aligner = Objects.requireNonNull(aligner, "aligner is required");
        this.cache = Objects.requireNonNull(cache, "cache is required");
        this.clock = Objects.requireNonNull(clock, "clock is required");
        this.assembler = new SnapshotAssembler(clock);
        this.forecastDays = forecastDays;
    }

    public RefreshOutcome refresh(String targetId) {
        Target target = registry.require(targetId);

        RawPayload payload = source.fetch(target.id());
        MetricSnapshot snapshot = assembler.assemble(target.id(), payload);
        boolean persisted = persistIfChanged(snapshot);
        ForecastView forecast = alignForecast(target, payload);

        LiveView live = LiveView.from(snapshot, target.displayName());
        cache.set(CacheNamespaces.LIVE, target.id(), live);
        if (forecast != null) {
            cache.set(CacheNamespaces.FORECAST, target.id(), forecast);
        }
        return new RefreshOutcome(target.id(), live, forecast, persisted);
    }

    private boolean persistIfChanged(MetricSnapshot snapshot) {
        Optional<MetricSnapshot> last;
        try {
            last = store.latest(snapshot.target());
        } catch (RuntimeException e) {
            LOGGER.log(Level.WARNING, "Latest snapshot lookup failed for " + snapshot.target() + ", writing unconditionally", e);
            last = Optional.empty();
        }
        if (!guard.shouldWrite(snapshot.target(), snapshot.aqi(), snapshot.timestamp(), last)) {
            return false;
        }
        try {
            store.append(snapshot);
        } catch (WriteFailureException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new WriteFailureException(snapshot.target(), "snapshot append failed", e);
        }
        return true;
    }

    private ForecastView alignForecast(Target target, RawPayload payload) {
        if (!payload.hasForecast()) {
            return null;
        }
        LocalDate today = LocalDate.ofInstant(clock.instant(), ZoneOffset.UTC);
        List<ForecastDayEntry> days = aligner.align(payload.forecast(), today, forecastDays);
        if (days.isEmpty()) {
            return null;
        }
        return new ForecastView(target.id(), target.displayName(), days, clock.instant());
    }
}
