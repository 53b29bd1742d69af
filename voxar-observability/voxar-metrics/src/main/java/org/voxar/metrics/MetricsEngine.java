// SPDX-License-Identifier: Apache-2.0
package org.voxar.metrics;

import edu.umd.cs.findbugs.annotations.NonNull;
import java.io.Closeable;
import java.time.Duration;
import java.time.Instant;
import java.time.InstantSource;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.OptionalDouble;
import java.util.concurrent.ScheduledExecutorService;
import java.util.function.Supplier;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.voxar.metrics.core.MetricKey;
import org.voxar.metrics.core.Sample;
import org.voxar.metrics.export.MetricsSnapshot;
import org.voxar.metrics.stat.HistogramSummary;

/**
 * In-process aggregation of counters, gauges and histograms.
 * <p>
 * An engine is created once and handed to every producer and reader that needs it. Ingestion methods never block on
 * I/O and only contend with callers writing the same {@link MetricKey}. Readers get per-metric consistent views via
 * {@link #getSnapshot()}, {@link #summarize(MetricKey)} and friends; they never see internal structures.
 * <p>
 * Histogram samples are bounded twice: by {@link MetricsEngineConfig#sampleCap()} on every insert and by
 * {@link MetricsEngineConfig#retentionWindow()} on every retention sweep. Sweeps run on the loop started with
 * {@link #startRetentionLoop(Duration)}, or lazily on {@link #getSnapshot()} once the sweep interval has elapsed.
 * <p>
 * Label names {@code le}, {@code quantile} and names starting with {@code __} are reserved; using them throws
 * {@link IllegalArgumentException} and nothing is recorded.
 */
public final class MetricsEngine implements Closeable {

    private static final Logger logger = LogManager.getLogger(MetricsEngine.class);

    private final MetricsEngineConfig config;
    private final InstantSource clock;

    private final CounterStore counters = new CounterStore();
    private final GaugeStore gauges = new GaugeStore();
    private final HistogramStore histograms;
    private final RetentionManager retention;

    private boolean closed;

    /**
     * Creates an engine with default configuration and the system UTC clock.
     */
    public MetricsEngine() {
        this(MetricsEngineConfig.defaults());
    }

    public MetricsEngine(@NonNull MetricsEngineConfig config) {
        this(config, InstantSource.system());
    }

    public MetricsEngine(@NonNull MetricsEngineConfig config, @NonNull InstantSource clock) {
        this(config, clock, RetentionManager::defaultExecutorService);
    }

    MetricsEngine(
            @NonNull MetricsEngineConfig config,
            @NonNull InstantSource clock,
            @NonNull Supplier<ScheduledExecutorService> executorServiceFactory) {
        this.config = Objects.requireNonNull(config, "config must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.histograms = new HistogramStore(config.sampleCap(), config.bucketThresholds());
        this.retention = new RetentionManager(
                histograms, clock, config.retentionWindow(), config.sweepInterval(), executorServiceFactory);
        logger.info("Created metrics engine. config={}", config);
    }

    @NonNull
    public MetricsEngineConfig config() {
        return config;
    }

    @NonNull
    public InstantSource clock() {
        return clock;
    }

    // ---------------------------------------------------------------- counters

    /**
     * Increments the counter by {@code 1}.
     */
    public void incrementCounter(@NonNull String name) {
        incrementCounter(MetricKey.of(name), 1L);
    }

    public void incrementCounter(@NonNull String name, long delta) {
        incrementCounter(MetricKey.of(name), delta);
    }

    public void incrementCounter(@NonNull String name, long delta, @NonNull Map<String, String> labels) {
        incrementCounter(MetricKey.of(name, labels), delta);
    }

    /**
     * Adds {@code delta} to the counter, creating it with value {@code 0} on first use.
     * A negative delta is logged and ignored, the counter never decreases. Addition saturates at
     * {@link Long#MAX_VALUE}.
     *
     * @param key   the counter key
     * @param delta the increment
     * @return {@code true} if the increment was applied
     */
    public boolean incrementCounter(@NonNull MetricKey key, long delta) {
        return counters.increment(key, delta);
    }

    public long counterValue(@NonNull String name, @NonNull Map<String, String> labels) {
        return counterValue(MetricKey.of(name, labels));
    }

    /**
     * @return the counter value, {@code 0} for a counter never incremented
     */
    public long counterValue(@NonNull MetricKey key) {
        return counters.get(key);
    }

    // ---------------------------------------------------------------- gauges

    public void setGauge(@NonNull String name, double value) {
        setGauge(MetricKey.of(name), value);
    }

    public void setGauge(@NonNull String name, double value, @NonNull Map<String, String> labels) {
        setGauge(MetricKey.of(name, labels), value);
    }

    /**
     * Sets the gauge, the last write wins.
     */
    public void setGauge(@NonNull MetricKey key, double value) {
        gauges.set(key, value);
    }

    @NonNull
    public OptionalDouble getGauge(@NonNull String name, @NonNull Map<String, String> labels) {
        return getGauge(MetricKey.of(name, labels));
    }

    /**
     * @return the last value set, or empty if the gauge was never set
     */
    @NonNull
    public OptionalDouble getGauge(@NonNull MetricKey key) {
        return gauges.get(key);
    }

    // ---------------------------------------------------------------- histograms

    public void recordSample(@NonNull String name, double value) {
        recordSample(MetricKey.of(name), new Sample(value, clock.instant()));
    }

    /**
     * Records a sample timestamped with the engine clock.
     */
    public void recordSample(@NonNull String name, double value, @NonNull Map<String, String> labels) {
        recordSample(MetricKey.of(name, labels), new Sample(value, clock.instant()));
    }

    /**
     * Records a sample with an explicit timestamp and per-sample attribution labels.
     *
     * @param name         the histogram name
     * @param value        the observed value
     * @param timestamp    when the value was observed; late samples are accepted
     * @param labels       labels identifying the histogram
     * @param sampleLabels labels kept on the sample only, e.g. {@code map_id}
     */
    public void recordSample(
            @NonNull String name,
            double value,
            @NonNull Instant timestamp,
            @NonNull Map<String, String> labels,
            @NonNull Map<String, String> sampleLabels) {
        recordSample(MetricKey.of(name, labels), new Sample(value, timestamp, sampleLabels));
    }

    /**
     * Appends the sample to the histogram of the key, evicting the oldest sample if the histogram is full.
     */
    public void recordSample(@NonNull MetricKey key, @NonNull Sample sample) {
        histograms.record(key, Objects.requireNonNull(sample, "sample must not be null"));
    }

    @NonNull
    public HistogramSummary summarize(@NonNull String name, @NonNull Map<String, String> labels) {
        return summarize(MetricKey.of(name, labels));
    }

    /**
     * @return summary of the histogram, {@link HistogramSummary#empty()} for an unknown key
     */
    @NonNull
    public HistogramSummary summarize(@NonNull MetricKey key) {
        return histograms.summarize(key);
    }

    @NonNull
    public List<Sample> samples(@NonNull String name, @NonNull Map<String, String> labels) {
        return samples(MetricKey.of(name, labels));
    }

    /**
     * @return immutable copy of the histogram samples, oldest first
     */
    @NonNull
    public List<Sample> samples(@NonNull MetricKey key) {
        return histograms.samples(key);
    }

    // ---------------------------------------------------------------- query

    /**
     * Takes a snapshot of all metrics. Runs a retention sweep first if the last one is older than the sweep interval.
     */
    @NonNull
    public MetricsSnapshot getSnapshot() {
        retention.sweepIfDue();
        return new MetricsSnapshot(
                clock.instant(),
                config.retentionWindow(),
                counters.snapshot(),
                gauges.snapshot(),
                histograms.snapshot());
    }

    // ---------------------------------------------------------------- lifecycle

    /**
     * Clears all counters, gauges and histograms. Intended for test isolation.
     */
    public void reset() {
        counters.clear();
        gauges.clear();
        histograms.clear();
        logger.info("Metrics reset");
    }

    /**
     * Runs a retention sweep now.
     *
     * @return number of removed samples
     */
    public long sweepRetention() {
        return retention.sweep();
    }

    /**
     * Starts the background retention loop with the configured sweep interval.
     *
     * @see #startRetentionLoop(Duration)
     */
    public boolean startRetentionLoop() {
        return startRetentionLoop(config.sweepInterval());
    }

    /**
     * Starts the background retention loop.
     *
     * @param interval period between sweeps
     * @return {@code false} if the loop was already running
     * @throws IllegalStateException if the engine is closed
     */
    public synchronized boolean startRetentionLoop(@NonNull Duration interval) {
        if (closed) {
            throw new IllegalStateException("Metrics engine is closed");
        }
        return retention.start(interval);
    }

    /**
     * Stops the background retention loop. Safe to call when not running.
     */
    public void stopRetentionLoop() {
        retention.stop();
    }

    public boolean isRetentionLoopRunning() {
        return retention.isRunning();
    }

    /**
     * Stops the retention loop. Recorded metrics stay readable.
     */
    @Override
    public synchronized void close() {
        closed = true;
        retention.stop();
    }
}
