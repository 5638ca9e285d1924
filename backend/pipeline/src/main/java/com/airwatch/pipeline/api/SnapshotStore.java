package com.airwatch.pipeline.api;

import com.airwatch.core.model.MetricSnapshot;

import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

public interface SnapshotStore {
    Optional<MetricSnapshot> latest(String target);

    Optional<MetricSnapshot> latestBefore(String target, Instant cutoff);

    List<MetricSnapshot> range(String target, LocalDate from, LocalDate to);

    void append(MetricSnapshot snapshot);
}
