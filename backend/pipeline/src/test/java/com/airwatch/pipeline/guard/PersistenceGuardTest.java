package com.airwatch.pipeline.guard;

import com.airwatch.core.model.MetricSnapshot;
import com.airwatch.pipeline.support.MutableClock;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class PersistenceGuardTest {
    private static final Instant T0 = Instant.parse("2026-03-08T10:00:00Z");

    private final MutableClock clock = new MutableClock(T0, ZoneOffset.UTC);
    private final PersistenceGuard guard = new PersistenceGuard(clock);
    private final Optional<MetricSnapshot> last = Optional.of(new MetricSnapshot("Sarajevo", T0, 50, "PM2.5", Map.of()));

    @Test
    void writesWhenNothingPersistedYet() {
        assertTrue(guard.shouldWrite("Sarajevo", 50, Optional.empty()));
    }

    @Test
    void skipsUnchangedIndexInsideWindow() {
        clock.advance(Duration.ofMinutes(2));

        assertFalse(guard.shouldWrite("Sarajevo", 50, last));
    }

    @Test
    void writesChangedIndexInsideWindow() {
        clock.advance(Duration.ofMinutes(2));

        assertTrue(guard.shouldWrite("Sarajevo", 51, last));
    }

    @Test
    void writesUnchangedIndexOnceWindowElapsed() {
        clock.advance(Duration.ofMinutes(10));

        assertTrue(guard.shouldWrite("Sarajevo", 50, last));
    }

    @Test
    void windowBoundaryCountsAsElapsed() {
        assertTrue(guard.shouldWrite("Sarajevo", 50, T0.plus(Duration.ofMinutes(5)), last));
        assertFalse(guard.shouldWrite("Sarajevo", 50, T0.plus(Duration.ofMinutes(5)).minusMillis(1), last));
    }

    @Test
    void honoursCustomWindow() {
        PersistenceGuard strict = new PersistenceGuard(clock, Duration.ofMinutes(30));
        clock.advance(Duration.ofMinutes(10));

        assertEquals(Duration.ofMinutes(30), strict.dedupWindow());
        assertFalse(strict.shouldWrite("Sarajevo", 50, last));
    }

    @Test
    void rejectsNegativeWindow() {
        assertThrows(IllegalArgumentException.class, () -> new PersistenceGuard(clock, Duration.ofMinutes(-1)));
    }
}
