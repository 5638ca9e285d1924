package com.airwatch.service.read;

import com.airwatch.core.model.LiveView;
import com.airwatch.pipeline.api.TargetRegistry;
import com.airwatch.pipeline.refresh.RefreshOutcome;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

public final class CityComparisonService {
    public static final String NO_DATA_CATEGORY = "No Data";
    public static final String NO_DATA_COLOR = "#CCCCCC";

    private static final Logger LOGGER = Logger.getLogger(CityComparisonService.class.getName());

    private final TargetRegistry registry;
    private final OnDemandRefresh refresh;
    private final Clock clock;

    public CityComparisonService(TargetRegistry registry, OnDemandRefresh refresh, Clock clock) {
        this.registry = Objects.requireNonNull(registry, "registry is required");
        this.refresh = Objects.requireNonNull(refresh, "refresh is required");
        this.clock = Objects.requireNonNull(clock, "clock is required");
    }

    public Comparison compare(String targetsParameter) {
        if (targetsParameter == null || targetsParameter.isBlank()) {
            return compare(registry.all().isEmpty() ? List.of() : List.of(registry.all().get(0).id()));
        }
        return compare(Arrays.asList(targetsParameter.split(",")));
    }

    public Comparison compare(List<String> targets) {
        Map<String, String> unique = new LinkedHashMap<>();
        for (String target : targets) {
            if (target != null && !target.isBlank()) {
                unique.putIfAbsent(target.trim().toLowerCase(Locale.ROOT), target.trim());
            }
        }

        List<Entry> entries = new ArrayList<>();
        for (String target : unique.values()) {
            try {
                RefreshOutcome outcome = refresh.refresh(target);
                LiveView live = outcome.live();
                entries.add(new Entry(
                        live.target(),
                        live.aqi(),
                        live.category().label(),
                        live.color(),
                        live.dominantPollutant(),
                        live.timestamp(),
                        null
                ));
            } catch (RuntimeException e) {
                LOGGER.log(Level.WARNING, "Comparison refresh failed for " + target, e);
                entries.add(new Entry(target, null, NO_DATA_CATEGORY, NO_DATA_COLOR, null, null, e.getMessage()));
            }
        }
        return new Comparison(entries, clock.instant());
    }

    public record Entry(
            String target,
            Integer aqi,
            String category,
            String color,
            String dominantPollutant,
            Instant timestamp,
            String error
    ) {
        public boolean hasData() {
            return error == null;
        }
    }

    public record Comparison(List<Entry> entries, Instant comparedAt) {
        public Comparison {
            entries = List.copyOf(entries);
        }

        public int total() {
            return entries.size();
        }
    }
}
