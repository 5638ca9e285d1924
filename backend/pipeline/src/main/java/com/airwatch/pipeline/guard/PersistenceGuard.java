package com.airwatch.pipeline.guard;

import com.airwatch.core.model.MetricSnapshot;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Logger;

public final class PersistenceGuard {
    public static final Duration DEFAULT_DEDUP_WINDOW = Duration.ofMinutes(5);

    private static final Logger LOGGER = Logger.getLogger(PersistenceGuard.class.getName());

    private final Clock clock;
    private final Duration dedupWindow;

    public PersistenceGuard(Clock clock) {
        this(clock, DEFAULT_DEDUP_WINDOW);
    }

    public PersistenceGuard(Clock clock, Duration dedupWindow) {
        this.clock = Objects.requireNonNull(clock, "clock is required");
        this.dedupWindow = Objects.requireNonNull(dedupWindow, "dedupWindow is required");
        if (dedupWindow.isNegative()) {
            throw new IllegalArgumentException("dedupWindow must not be negative");
        }
    }

    public boolean shouldWrite(String target, int candidateIndex, Optional<MetricSnapshot> lastPersisted) {
        return shouldWrite(target, candidateIndex, clock.instant(), lastPersisted);
    }

    public boolean shouldWrite(
            String target,
            int candidateIndex,
            Instant candidateTime,
            Optional<MetricSnapshot> lastPersisted
    ) {
        if (lastPersisted.isEmpty()) {
            return true;
        }
        MetricSnapshot last = lastPersisted.get();
        boolean recent = Duration.between(last.timestamp(), candidateTime).compareTo(dedupWindow) < 0;
        boolean unchanged = candidateIndex == last.aqi();
        if (recent && unchanged) {
            LOGGER.fine(() -> "Skipping snapshot for " + target + ": index " + candidateIndex
                    + " unchanged since " + last.timestamp());
            return false;
        }
        return true;
    }

    public Duration dedupWindow() {
        return dedupWindow;
    }
}
