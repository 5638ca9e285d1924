package com.airwatch.service.store;

import com.airwatch.core.model.MetricSnapshot;
import com.airwatch.core.util.JsonUtils;
import com.airwatch.pipeline.api.SnapshotStore;
import com.airwatch.pipeline.error.WriteFailureException;
import com.fasterxml.jackson.core.JsonProcessingException;

import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Predicate;

public class JsonlSnapshotStore implements SnapshotStore {
    private final Path file;
    private final ReentrantLock lock = new ReentrantLock();

    public JsonlSnapshotStore(Path file) {
        this.file = file;
    }

    @Override
    public void append(MetricSnapshot snapshot) {
        String line;
        try {
            line = JsonUtils.objectMapper().writeValueAsString(snapshot);
        } catch (JsonProcessingException e) {
            throw new WriteFailureException(snapshot.target(), "snapshot could not be encoded", e);
        }
        lock.lock();
        try {
            Path parent = file.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            try (BufferedWriter writer = Files.newBufferedWriter(
                    file,
                    StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE,
                    StandardOpenOption.APPEND
            )) {
                writer.write(line);
                writer.newLine();
            }
        } catch (IOException e) {
            throw new WriteFailureException(snapshot.target(), "failed appending snapshot to " + file, e);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public Optional<MetricSnapshot> latest(String target) {
        return scan(target, snapshot -> true).stream().max(Comparator.comparing(MetricSnapshot::timestamp));
    }

    @Override
    public Optional<MetricSnapshot> latestBefore(String target, Instant cutoff) {
        return scan(target, snapshot -> snapshot.timestamp().isBefore(cutoff)).stream()
                .max(Comparator.comparing(MetricSnapshot::timestamp));
    }

    @Override
    public List<MetricSnapshot> range(String target, LocalDate from, LocalDate to) {
        List<MetricSnapshot> matches = scan(target, snapshot -> {
            LocalDate day = LocalDate.ofInstant(snapshot.timestamp(), ZoneOffset.UTC);
            return !day.isBefore(from) && !day.isAfter(to);
        });
        matches.sort(Comparator.comparing(MetricSnapshot::timestamp));
        return matches;
    }

    private List<MetricSnapshot> scan(String target, Predicate<MetricSnapshot> filter) {
        lock.lock();
        try {
            if (!Files.exists(file)) {
                return new ArrayList<>();
            }
            List<MetricSnapshot> matches = new ArrayList<>();
            int lineNumber = 0;
            for (String line : Files.readAllLines(file, StandardCharsets.UTF_8)) {
                lineNumber++;
                if (line.isBlank()) {
                    continue;
                }
                MetricSnapshot snapshot;
                try {
                    snapshot = JsonUtils.objectMapper().readValue(line, MetricSnapshot.class);
                } catch (JsonProcessingException | RuntimeException decodeError) {
                    throw new IllegalStateException("Invalid snapshot at line " + lineNumber, decodeError);
                }
                if (snapshot.target().equalsIgnoreCase(target.trim()) && filter.test(snapshot)) {
                    matches.add(snapshot);
                }
            }
            return matches;
        } catch (IOException e) {
            throw new IllegalStateException("Failed reading snapshots from " + file, e);
        } finally {
            lock.unlock();
        }
    }
}
