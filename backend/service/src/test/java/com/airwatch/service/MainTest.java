package com.airwatch.service;

import com.airwatch.pipeline.error.DataUnavailableException;
import com.airwatch.service.config.AirWatchConfig;
import com.airwatch.service.runtime.RefreshResult;
import com.airwatch.service.runtime.SchedulerState;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.net.http.HttpClient;
import java.nio.file.Path;
import java.time.Clock;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.LogRecord;
import java.util.logging.Logger;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class MainTest {
    @TempDir
    Path tempDir;

    @Test
    void wiresDefaultTargetsWithoutTokenIntoFailingButIsolatedCycle() {
        AirWatchConfig config = new AirWatchConfig(
                null, null, null, null, null, null, "http://localhost:1", null,
                tempDir.resolve("snapshots.jsonl").toString(), null
        );

        Main.Services services = Main.wire(config, "", HttpClient.newHttpClient(), Clock.systemUTC());
        try {
            assertEquals(6, services.registry().size());
            assertEquals(SchedulerState.IDLE, services.scheduler().state());

            List<RefreshResult> results = services.scheduler().runCycle();

            assertEquals(6, results.size());
            assertTrue(results.stream().noneMatch(RefreshResult::success));
            assertThrows(DataUnavailableException.class, () -> services.readService().getLiveView("Sarajevo"));
            assertEquals(7, services.readService().getTimeline("Sarajevo").days().size());
        } finally {
            services.scheduler().stop();
        }
    }

    @Test
    void logsAlertsAndCycleSummaries() {
        AirWatchConfig config = new AirWatchConfig(
                null, null, null, null, null, null, "http://localhost:1", null,
                tempDir.resolve("snapshots.jsonl").toString(), null
        );
        List<LogRecord> records = new CopyOnWriteArrayList<>();
        Handler capture = new Handler() {
            @Override
            public void publish(LogRecord record) {
                records.add(record);
            }

            @Override
            public void flush() {
            }

            @Override
            public void close() {
            }
        };
        Logger logger = Logger.getLogger(Main.class.getName());
        logger.addHandler(capture);

        Main.Services services = Main.wire(config, "", HttpClient.newHttpClient(), Clock.systemUTC());
        try {
            services.scheduler().runCycle();
        } finally {
            services.scheduler().stop();
            logger.removeHandler(capture);
        }

        long warnings = records.stream()
                .filter(record -> record.getLevel() == Level.WARNING)
                .filter(record -> record.getMessage().startsWith("refresh: Refresh failed"))
                .count();
        assertEquals(6, warnings);
        assertTrue(records.stream().anyMatch(record -> record.getMessage().startsWith("Refresh cycle 1 started")));
        assertTrue(records.stream().anyMatch(record -> record.getMessage().startsWith("Refresh cycle 1 completed: 0 ok, 6 failed")));
    }
}
