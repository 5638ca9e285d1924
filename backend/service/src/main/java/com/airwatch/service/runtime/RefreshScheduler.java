package com.airwatch.service.runtime;

import com.airwatch.core.bus.EventBus;
import com.airwatch.core.events.AlertRaised;
import com.airwatch.core.events.RefreshCycleCompleted;
import com.airwatch.core.events.RefreshCycleStarted;
import com.airwatch.core.events.TargetRefreshed;
import com.airwatch.pipeline.api.Target;
import com.airwatch.pipeline.api.TargetRegistry;
import com.airwatch.pipeline.refresh.RefreshOutcome;
import com.airwatch.pipeline.refresh.TargetRefresher;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;
import java.util.logging.Level;
import java.util.logging.Logger;

public class RefreshScheduler {
    private static final Logger LOGGER = Logger.getLogger(RefreshScheduler.class.getName());

    private final TargetRegistry registry;
    private final TargetRefresher refresher;
    private final EventBus eventBus;
    private final Clock clock;
    private final Duration interval;
    private final ExecutorService refreshExecutor;
    private final CancellationSignal cancellation = new CancellationSignal();
    private final AtomicReference<SchedulerState> state = new AtomicReference<>(SchedulerState.IDLE);
    private final AtomicLong cycles = new AtomicLong();
    private final ExecutorService loopExecutor = Executors.newSingleThreadExecutor(daemonThreads("airwatch-scheduler-"));
    private Future<?> loopTask;

    public RefreshScheduler(
            TargetRegistry registry,
            TargetRefresher refresher,
            EventBus eventBus,
            Clock clock,
            Duration interval
    ) {
        this.registry = Objects.requireNonNull(registry, "registry is required");
        this.refresher = Objects.requireNonNull(refresher, "refresher is required");
        this.eventBus = Objects.requireNonNull(eventBus, "eventBus is required");
        this.clock = Objects.requireNonNull(clock, "clock is required");
        this.interval = Objects.requireNonNull(interval, "interval is required");
        if (interval.isNegative() || interval.isZero()) {
            throw new IllegalArgumentException("interval must be positive");
        }
        this.refreshExecutor = Executors.newFixedThreadPool(Math.max(1, registry.size()), daemonThreads("airwatch-refresh-"));
    }

    public synchronized void start() {
        if (loopTask != null) {
            throw new IllegalStateException("Scheduler already started");
        }
        if (cancellation.isCancelled()) {
            throw new IllegalStateException("Scheduler was stopped");
        }
        loopTask = loopExecutor.submit(this::loop);
    }

    public void stop() {
        cancellation.cancel();
        loopExecutor.shutdown();
        refreshExecutor.shutdown();
        try {
            if (!loopExecutor.awaitTermination(30, TimeUnit.SECONDS)) {
                LOGGER.warning("Scheduler loop still running after shutdown timeout");
            }
            if (!refreshExecutor.awaitTermination(5, TimeUnit.SECONDS)) {
                LOGGER.warning("Refresh tasks still running after shutdown timeout");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        state.set(SchedulerState.STOPPED);
    }

    public SchedulerState state() {
        return state.get();
    }

    public long completedCycles() {
        return cycles.get();
    }

    public RefreshOutcome refreshOne(String target) {
        return refresher.refresh(target);
    }

    public List<RefreshResult> runCycle() {
        long cycle = cycles.get() + 1;
        Instant started = clock.instant();
        List<Target> targets = registry.all();
        eventBus.publish(new RefreshCycleStarted(started, cycle, targets.size()));

        List<Future<RefreshResult>> futures = new ArrayList<>();
        for (Target target : targets) {
            try {
                futures.add(refreshExecutor.submit(() -> refreshSafely(target)));
            } catch (RejectedExecutionException e) {
                futures.add(CompletableFuture.completedFuture(RefreshResult.skipped(target.id())));
            }
        }

        List<RefreshResult> results = new ArrayList<>();
        for (int i = 0; i < futures.size(); i++) {
            String targetId = targets.get(i).id();
            try {
                results.add(futures.get(i).get());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                results.add(RefreshResult.failure(targetId, "Cycle interrupted", Map.of("target", targetId)));
            } catch (ExecutionException e) {
                LOGGER.log(Level.SEVERE, "Refresh task crashed for " + targetId, e.getCause());
                results.add(RefreshResult.failure(targetId, "Refresh task crashed", Map.of("target", targetId)));
            }
        }

        int successes = (int) results.stream().filter(RefreshResult::success).count();
        int failures = results.size() - successes;
        long durationMillis = Duration.between(started, clock.instant()).toMillis();
        cycles.incrementAndGet();
        eventBus.publish(new RefreshCycleCompleted(clock.instant(), cycle, successes, failures, durationMillis));
        return results;
    }

    private void loop() {
        while (!cancellation.isCancelled()) {
            state.set(SchedulerState.RUNNING);
            Instant cycleStart = clock.instant();
            try {
                runCycle();
            } catch (RuntimeException e) {
                LOGGER.log(Level.SEVERE, "Refresh cycle failed", e);
            }
            if (cancellation.isCancelled()) {
                break;
            }
            state.set(SchedulerState.WAITING);
            Duration remaining = interval.minus(Duration.between(cycleStart, clock.instant()));
            if (!remaining.isNegative() && cancellation.await(remaining)) {
                break;
            }
        }
        state.set(SchedulerState.STOPPED);
        LOGGER.info("Refresh scheduler stopped after " + cycles.get() + " cycles");
    }

    private RefreshResult refreshSafely(Target target) {
        if (cancellation.isCancelled()) {
            return RefreshResult.skipped(target.id());
        }
        try {
            RefreshOutcome outcome = refresher.refresh(target.id());
            int forecastDays = outcome.forecastView().map(view -> view.days().size()).orElse(0);
            eventBus.publish(new TargetRefreshed(
                    clock.instant(),
                    target.id(),
                    outcome.live().aqi(),
                    outcome.live().category().label(),
                    outcome.persisted(),
                    forecastDays
            ));
            return RefreshResult.success(target.id(), "Refreshed " + target.id(), Map.of(
                    "aqi", outcome.live().aqi(),
                    "persisted", outcome.persisted(),
                    "forecastDays", forecastDays
            ));
        } catch (RuntimeException ex) {
            LOGGER.log(Level.FINE, "Refresh failed for " + target.id(), ex);
            eventBus.publish(new AlertRaised(
                    clock.instant(),
                    "refresh",
                    "Refresh failed: " + target.id() + " - " + ex.getMessage(),
                    Map.of("target", target.id(), "error", ex.getClass().getSimpleName())
            ));
            return RefreshResult.failure(target.id(), "Refresh failed: " + ex.getMessage(), Map.of("target", target.id()));
        }
    }

    private static ThreadFactory daemonThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
