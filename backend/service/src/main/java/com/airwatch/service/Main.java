package com.airwatch.service;

import com.airwatch.core.bus.EventBus;
import com.airwatch.core.cache.TtlCache;
import com.airwatch.core.events.AlertRaised;
import com.airwatch.core.events.RefreshCycleCompleted;
import com.airwatch.core.events.RefreshCycleStarted;
import com.airwatch.core.events.TargetRefreshed;
import com.airwatch.pipeline.api.SnapshotStore;
import com.airwatch.pipeline.api.TargetRegistry;
import com.airwatch.pipeline.forecast.ForecastAligner;
import com.airwatch.pipeline.guard.PersistenceGuard;
import com.airwatch.pipeline.refresh.TargetRefresher;
import com.airwatch.pipeline.timeline.TimelineBuilder;
import com.airwatch.service.config.AirWatchConfig;
import com.airwatch.service.config.ConfigLoader;
import com.airwatch.service.read.AirQualityReadService;
import com.airwatch.service.read.CityComparisonService;
import com.airwatch.service.read.HealthAdviceService;
import com.airwatch.service.runtime.RefreshScheduler;
import com.airwatch.service.store.JsonlSnapshotStore;
import com.airwatch.service.waqi.WaqiClient;

import java.io.IOException;
import java.io.InputStream;
import java.net.http.HttpClient;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.logging.LogManager;
import java.util.logging.Logger;

public final class Main {
    static final String TOKEN_ENV = "WAQI_API_TOKEN";

    private static final Logger LOGGER = Logger.getLogger(Main.class.getName());

    private Main() {
    }

    public static void main(String[] args) throws InterruptedException {
        installLogging();
        Map<String, String> env = System.getenv();
        Path configPath = ConfigLoader.resolvePath(env);
        AirWatchConfig config = ConfigLoader.load(configPath);
        String token = env.getOrDefault(TOKEN_ENV, "");
        if (token.isBlank()) {
            LOGGER.warning(TOKEN_ENV + " is not set; every refresh will fail until it is configured");
        }

        HttpClient httpClient = HttpClient.newBuilder()
                .connectTimeout(config.requestTimeout())
                .followRedirects(HttpClient.Redirect.NORMAL)
                .build();
        Services services = wire(config, token, httpClient, Clock.systemUTC());
        LOGGER.info("Loaded " + services.registry().size() + " targets from " + configPath
                + ", refreshing every " + config.refreshInterval());

        services.scheduler().start();

        CountDownLatch shutdownLatch = new CountDownLatch(1);
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            services.scheduler().stop();
            shutdownLatch.countDown();
        }));

        shutdownLatch.await();
    }

    static Services wire(AirWatchConfig config, String token, HttpClient httpClient, Clock clock) {
        EventBus eventBus = new EventBus();
        eventBus.subscribe(TargetRefreshed.class, event -> LOGGER.fine(() -> "Refreshed " + event.target()
                + " at index " + event.aqi() + (event.persisted() ? " (stored)" : "")));
        eventBus.subscribe(AlertRaised.class, event -> LOGGER.warning(event.category() + ": " + event.message()));
        eventBus.subscribe(RefreshCycleStarted.class, event -> LOGGER.info("Refresh cycle " + event.cycle()
                + " started for " + event.targetCount() + " targets"));
        eventBus.subscribe(RefreshCycleCompleted.class, event -> LOGGER.info("Refresh cycle " + event.cycle()
                + " completed: " + event.successes() + " ok, " + event.failures() + " failed in "
                + event.durationMillis() + " ms"));

        TargetRegistry registry = new TargetRegistry(config.targets());
        TtlCache cache = new TtlCache(clock);
        SnapshotStore store = new JsonlSnapshotStore(config.storePath());
        WaqiClient source = new WaqiClient(httpClient, registry, config.waqiBaseUrl(), token, config.requestTimeout());

        TargetRefresher refresher = new TargetRefresher(
                registry,
                source,
                store,
                new PersistenceGuard(clock, config.dedupWindow()),
                new ForecastAligner(),
                cache,
                clock,
                config.forecastDays()
        );
        RefreshScheduler scheduler = new RefreshScheduler(registry, refresher, eventBus, clock, config.refreshInterval());
        TimelineBuilder timelineBuilder = new TimelineBuilder(
                store,
                target -> scheduler.refreshOne(target).live().aqi(),
                clock
        );
        AirQualityReadService readService = new AirQualityReadService(
                registry,
                cache,
                scheduler::refreshOne,
                store,
                timelineBuilder,
                clock,
                config.liveTtl(),
                config.forecastTtl(),
                config.timelineDays()
        );
        return new Services(
                eventBus,
                registry,
                cache,
                scheduler,
                readService,
                new HealthAdviceService(readService),
                new CityComparisonService(registry, scheduler::refreshOne, clock)
        );
    }

    private static void installLogging() {
        try (InputStream in = Main.class.getResourceAsStream("/logging.properties")) {
            if (in != null) {
                LogManager.getLogManager().readConfiguration(in);
            }
        } catch (IOException e) {
            LOGGER.warning("Could not load logging.properties: " + e.getMessage());
        }
    }

    record Services(
            EventBus eventBus,
            TargetRegistry registry,
            TtlCache cache,
            RefreshScheduler scheduler,
            AirQualityReadService readService,
            HealthAdviceService healthAdvice,
            CityComparisonService cityComparison
    ) {
    }
}
