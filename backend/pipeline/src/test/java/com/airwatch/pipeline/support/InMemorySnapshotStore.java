package com.airwatch.pipeline.support;

import com.airwatch.core.model.MetricSnapshot;
import com.airwatch.pipeline.api.SnapshotStore;

import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;

public class InMemorySnapshotStore implements SnapshotStore {
    private final List<MetricSnapshot> snapshots = new CopyOnWriteArrayList<>();
    private volatile RuntimeException readFailure;
    private volatile RuntimeException writeFailure;

    public void failReadsWith(RuntimeException failure) {
        this.readFailure = failure;
    }

    public void failWritesWith(RuntimeException failure) {
        this.writeFailure = failure;
    }

    public List<MetricSnapshot> all() {
        return List.copyOf(snapshots);
    }

    @Override
    public Optional<MetricSnapshot> latest(String target) {
        checkRead();
        return forTarget(target).stream().max(Comparator.comparing(MetricSnapshot::timestamp));
    }

    @Override
    public Optional<MetricSnapshot> latestBefore(String target, Instant cutoff) {
        checkRead();
        return forTarget(target).stream()
                .filter(snapshot -> snapshot.timestamp().isBefore(cutoff))
                .max(Comparator.comparing(MetricSnapshot::timestamp));
    }

    @Override
    public List<MetricSnapshot> range(String target, LocalDate from, LocalDate to) {
        checkRead();
        List<MetricSnapshot> result = new ArrayList<>();
        for (MetricSnapshot snapshot : forTarget(target)) {
            LocalDate day = LocalDate.ofInstant(snapshot.timestamp(), ZoneOffset.UTC);
            if (!day.isBefore(from) && !day.isAfter(to)) {
                result.add(snapshot);
            }
        }
        result.sort(Comparator.comparing(MetricSnapshot::timestamp));
        return result;
    }

    @Override
    public void append(MetricSnapshot snapshot) {
        if (writeFailure != null) {
            throw writeFailure;
        }
        snapshots.add(snapshot);
    }

    private List<MetricSnapshot> forTarget(String target) {
        List<MetricSnapshot> result = new ArrayList<>();
        for (MetricSnapshot snapshot : snapshots) {
            if (snapshot.target().equalsIgnoreCase(target)) {
                result.add(snapshot);
            }
        }
        return result;
    }

    private void checkRead() {
        if (readFailure != null) {
            throw readFailure;
        }
    }
}
