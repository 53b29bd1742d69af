// SPDX-License-Identifier: Apache-2.0
package org.voxar.metrics;

import edu.umd.cs.findbugs.annotations.NonNull;
import java.time.Duration;
import java.time.Instant;
import java.time.InstantSource;
import java.util.Objects;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Evicts histogram samples older than the retention window.
 * <p>
 * A sweep visits the histograms one by one and holds each buffer's lock only while that buffer is trimmed, so
 * records into other histograms proceed while a sweep runs. Sweeps run either on a background schedule started via
 * {@link #start(Duration)} or lazily through {@link #sweepIfDue()}.
 * <p>
 * {@link #start(Duration)} and {@link #stop()} are synchronized; {@link #stop()} may be called any number of times.
 */
final class RetentionManager {

    private static final Logger logger = LogManager.getLogger(RetentionManager.class);

    private final HistogramStore histograms;
    private final InstantSource clock;
    private final Duration window;
    private final Duration sweepInterval;
    private final Supplier<ScheduledExecutorService> executorServiceFactory;

    private volatile Instant lastSweep;

    private ScheduledExecutorService executorService;
    private ScheduledFuture<?> scheduledSweepFuture;

    RetentionManager(
            @NonNull HistogramStore histograms,
            @NonNull InstantSource clock,
            @NonNull Duration window,
            @NonNull Duration sweepInterval,
            @NonNull Supplier<ScheduledExecutorService> executorServiceFactory) {
        this.histograms = Objects.requireNonNull(histograms, "histograms must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.window = Objects.requireNonNull(window, "window must not be null");
        this.sweepInterval = Objects.requireNonNull(sweepInterval, "sweep interval must not be null");
        this.executorServiceFactory =
                Objects.requireNonNull(executorServiceFactory, "executor service factory must not be null");
        this.lastSweep = clock.instant();
    }

    /**
     * Creates the default single daemon thread scheduler.
     */
    @NonNull
    static ScheduledExecutorService defaultExecutorService() {
        return Executors.newSingleThreadScheduledExecutor(runnable -> {
            Thread thread = new Thread(runnable, "metrics-retention");
            thread.setDaemon(true);
            return thread;
        });
    }

    /**
     * Removes all samples older than {@code now - window}, where {@code now} is read once at the start of the sweep.
     *
     * @return number of removed samples
     */
    long sweep() {
        final Instant now = clock.instant();
        final Instant cutoff = now.minus(window);
        final long removed = histograms.removeOlderThan(cutoff);
        lastSweep = now;
        logger.debug(
                "Retention sweep removed {} samples older than {} from {} histograms",
                removed,
                cutoff,
                histograms.histogramCount());
        return removed;
    }

    /**
     * Runs a sweep only if the previous one is at least one sweep interval old.
     *
     * @return {@code true} if a sweep was performed
     */
    boolean sweepIfDue() {
        if (Duration.between(lastSweep, clock.instant()).compareTo(sweepInterval) < 0) {
            return false;
        }
        sweep();
        return true;
    }

    /**
     * Schedules periodic sweeps at a fixed rate.
     *
     * @param interval the period between sweeps, must be positive
     * @return {@code false} if a loop was already running and nothing changed
     */
    synchronized boolean start(@NonNull Duration interval) {
        Objects.requireNonNull(interval, "interval must not be null");
        if (interval.isZero() || interval.isNegative()) {
            throw new IllegalArgumentException("Sweep interval must be positive, but was: " + interval);
        }
        if (isRunning()) {
            logger.info("Retention loop already running, ignoring start request");
            return false;
        }

        executorService = executorServiceFactory.get();
        final long periodNanos = interval.toNanos();
        scheduledSweepFuture = executorService.scheduleAtFixedRate(
                this::scheduledSweep, periodNanos, periodNanos, TimeUnit.NANOSECONDS);
        logger.info("Started retention loop. window={}, interval={}", window, interval);
        return true;
    }

    synchronized boolean isRunning() {
        return scheduledSweepFuture != null && !scheduledSweepFuture.isDone();
    }

    /**
     * Cancels the periodic sweeps and shuts the scheduler down. Safe to call repeatedly.
     */
    synchronized void stop() {
        if (scheduledSweepFuture == null) {
            return;
        }
        scheduledSweepFuture.cancel(false);
        scheduledSweepFuture = null;
        executorService.shutdown();
        executorService = null;
        logger.info("Stopped retention loop");
    }

    private void scheduledSweep() {
        try {
            sweep();
        } catch (RuntimeException e) {
            // an exception escaping here would cancel all following executions
            logger.error("Retention sweep failed", e);
        }
    }
}
