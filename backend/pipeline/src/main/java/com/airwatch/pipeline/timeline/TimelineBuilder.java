package com.airwatch.pipeline.timeline;

import com.airwatch.core.aqi.AqiAssessment;
import com.airwatch.core.aqi.AqiClassifier;
import com.airwatch.core.model.MetricSnapshot;
import com.airwatch.core.model.TimelineEntry;
import com.airwatch.pipeline.api.SnapshotStore;

import java.time.Clock;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.time.format.TextStyle;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;

public final class TimelineBuilder {
    public static final int DEFAULT_WINDOW_DAYS = 7;
    public static final int DEFAULT_SEED_INDEX = 75;

    private static final Logger LOGGER = Logger.getLogger(TimelineBuilder.class.getName());

    private final SnapshotStore store;
    private final CurrentIndexLookup currentIndexLookup;
    private final Clock clock;

    public TimelineBuilder(SnapshotStore store, CurrentIndexLookup currentIndexLookup, Clock clock) {
        this.store = Objects.requireNonNull(store, "store is required");
        this.currentIndexLookup = Objects.requireNonNull(currentIndexLookup, "currentIndexLookup is required");
        this.clock = Objects.requireNonNull(clock, "clock is required");
    }

    public List<TimelineEntry> build(String target) {
        return build(target, DEFAULT_WINDOW_DAYS);
    }

    public List<TimelineEntry> build(String target, int windowDays) {
        if (windowDays < 1) {
            throw new IllegalArgumentException("windowDays must be at least 1");
        }
        LocalDate today = LocalDate.ofInstant(clock.instant(), ZoneOffset.UTC);
        LocalDate start = today.minusDays(windowDays - 1L);

        int lastKnown = seedIndex(target, start);
        Map<LocalDate, List<Integer>> samplesByDay = samplesByDay(target, start, today);

        List<TimelineEntry> entries = new ArrayList<>(windowDays);
        for (LocalDate date = start; !date.isAfter(today); date = date.plusDays(1)) {
            List<Integer> samples = samplesByDay.get(date);
            if (samples != null && !samples.isEmpty()) {
                lastKnown = mean(samples);
            }
            AqiAssessment assessment = AqiClassifier.classify(lastKnown);
            entries.add(new TimelineEntry(
                    date,
                    date.getDayOfWeek().getDisplayName(TextStyle.FULL, Locale.ENGLISH),
                    date.getDayOfWeek().getDisplayName(TextStyle.SHORT, Locale.ENGLISH),
                    assessment.index(),
                    assessment.category(),
                    assessment.color()
            ));
        }
        return entries;
    }

    int seedIndex(String target, LocalDate windowStart) {
        try {
            Optional<MetricSnapshot> before = store.latestBefore(target, windowStart.atStartOfDay().toInstant(ZoneOffset.UTC));
            if (before.isPresent()) {
                return before.get().aqi();
            }
        } catch (RuntimeException e) {
            LOGGER.log(Level.WARNING, "History lookup before " + windowStart + " failed for " + target, e);
        }

        try {
            return Math.max(0, currentIndexLookup.currentIndex(target));
        } catch (RuntimeException e) {
            LOGGER.log(Level.WARNING, "Live index lookup failed for " + target + ", using default seed", e);
        }
        return DEFAULT_SEED_INDEX;
    }

    private Map<LocalDate, List<Integer>> samplesByDay(String target, LocalDate from, LocalDate to) {
        List<MetricSnapshot> snapshots;
        try {
            snapshots = store.range(target, from, to);
        } catch (RuntimeException e) {
            LOGGER.log(Level.WARNING, "History range read failed for " + target + ", treating window as empty", e);
            return Map.of();
        }
        Map<LocalDate, List<Integer>> byDay = new HashMap<>();
        for (MetricSnapshot snapshot : snapshots) {
            LocalDate day = LocalDate.ofInstant(snapshot.timestamp(), ZoneOffset.UTC);
            if (day.isBefore(from) || day.isAfter(to)) {
                continue;
            }
            byDay.computeIfAbsent(day, ignored -> new ArrayList<>()).add(snapshot.aqi());
        }
        return byDay;
    }

    private static int mean(List<Integer> values) {
        double sum = 0;
        for (int value : values) {
            sum += value;
        }
        return (int) AqiClassifier.roundHalfAwayFromZero(sum / values.size());
    }
}
