package com.airwatch.pipeline.refresh;

import com.airwatch.core.model.MetricSnapshot;
import com.airwatch.core.model.Pollutant;
import com.airwatch.pipeline.api.RawPayload;
import com.airwatch.pipeline.error.MalformedPayloadException;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class SnapshotAssemblerTest {
    private static final Instant NOW = Instant.parse("2026-03-08T12:00:00Z");

    private final SnapshotAssembler assembler = new SnapshotAssembler(Clock.fixed(NOW, ZoneOffset.UTC));

    @Test
    void keepsReportedIndexAndNormalizesPollutantName() {
        Instant observed = Instant.parse("2026-03-08T11:00:00Z");
        RawPayload payload = new RawPayload(observed, 87, "pm25", Map.of(Pollutant.PM25, 28.4, Pollutant.O3, 12.0), Map.of());

        MetricSnapshot snapshot = assembler.assemble("Tuzla", payload);

        assertEquals("Tuzla", snapshot.target());
        assertEquals(observed, snapshot.timestamp());
        assertEquals(87, snapshot.aqi());
        assertEquals("PM2.5", snapshot.dominantPollutant());
        assertEquals(28.4, snapshot.concentration(Pollutant.PM25).orElseThrow());
    }

    @Test
    void derivesIndexFromConcentrationWhenIndexMissing() {
        RawPayload payload = new RawPayload(null, null, null, Map.of(Pollutant.PM25, 70.0), Map.of());

        MetricSnapshot snapshot = assembler.assemble("Tuzla", payload);

        assertEquals(158, snapshot.aqi());
        assertEquals("PM2.5", snapshot.dominantPollutant());
        assertEquals(NOW, snapshot.timestamp());
    }

    @Test
    void unknownDominantPollutantIsLabelledUnknown() {
        RawPayload payload = new RawPayload(NOW, 20, "xyz", Map.of(), Map.of());

        assertEquals("Unknown", assembler.assemble("Tuzla", payload).dominantPollutant());
    }

    @Test
    void rejectsPayloadWithoutIndexOrConcentrations() {
        RawPayload payload = new RawPayload(NOW, null, "pm25", Map.of(Pollutant.NO2, 15.0), Map.of());

        assertThrows(MalformedPayloadException.class, () -> assembler.assemble("Tuzla", payload));
        assertThrows(MalformedPayloadException.class, () -> assembler.assemble("Tuzla", null));
    }
}
