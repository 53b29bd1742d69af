// SPDX-License-Identifier: Apache-2.0
package org.voxar.metrics;

import edu.umd.cs.findbugs.annotations.NonNull;
import java.time.Duration;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Properties;
import org.voxar.metrics.core.MetricUtils;

/**
 * Configuration for the {@link MetricsEngine}.
 *
 * @param retentionWindow  maximum age of a histogram sample after a sweep (default: 24h)
 * @param sweepInterval    period of the retention loop and minimum age of the last sweep before a read triggers one
 *                         (default: 1h)
 * @param sampleCap        maximum number of samples per histogram (default: 1000)
 * @param bucketThresholds ascending finite upper bounds for exported histogram buckets, {@code +Inf} is implicit
 *                         (default: 0.1, 0.5, 1.0, 2.0, 5.0, 10.0)
 * @param namespace        prefix for exported metric names, joined with {@code _}; empty for none (default: empty)
 */
public record MetricsEngineConfig(
        @NonNull Duration retentionWindow,
        @NonNull Duration sweepInterval,
        int sampleCap,
        @NonNull List<Double> bucketThresholds,
        @NonNull String namespace) {

    public static final String PROPERTY_PREFIX = "metrics.engine.";

    public static final Duration DEFAULT_RETENTION_WINDOW = Duration.ofHours(24);
    public static final Duration DEFAULT_SWEEP_INTERVAL = Duration.ofHours(1);
    public static final int DEFAULT_SAMPLE_CAP = 1000;
    public static final List<Double> DEFAULT_BUCKET_THRESHOLDS = List.of(0.1, 0.5, 1.0, 2.0, 5.0, 10.0);

    private static final MetricsEngineConfig DEFAULTS = new MetricsEngineConfig(
            DEFAULT_RETENTION_WINDOW, DEFAULT_SWEEP_INTERVAL, DEFAULT_SAMPLE_CAP, DEFAULT_BUCKET_THRESHOLDS, "");

    /**
     * @throws NullPointerException     if any reference argument is {@code null}
     * @throws IllegalArgumentException if a duration or the cap is not positive, the thresholds are not strictly
     *                                  ascending finite values, or the namespace is not a valid metric name
     */
    public MetricsEngineConfig {
        requirePositive(retentionWindow, "retention window");
        requirePositive(sweepInterval, "sweep interval");
        if (sampleCap <= 0) {
            throw new IllegalArgumentException("Sample cap must be positive, but was: " + sampleCap);
        }
        bucketThresholds = List.copyOf(Objects.requireNonNull(bucketThresholds, "bucket thresholds must not be null"));
        for (int i = 0; i < bucketThresholds.size(); i++) {
            double threshold = bucketThresholds.get(i);
            if (!Double.isFinite(threshold)) {
                throw new IllegalArgumentException("Bucket thresholds must be finite, but was: " + threshold);
            }
            if (i > 0 && threshold <= bucketThresholds.get(i - 1)) {
                throw new IllegalArgumentException("Bucket thresholds must be strictly ascending: " + bucketThresholds);
            }
        }
        Objects.requireNonNull(namespace, "namespace must not be null");
        if (!namespace.isEmpty()) {
            MetricUtils.validateMetricName(namespace);
        }
    }

    /**
     * @return configuration with all default values
     */
    @NonNull
    public static MetricsEngineConfig defaults() {
        return DEFAULTS;
    }

    @NonNull
    public MetricsEngineConfig withRetentionWindow(@NonNull Duration retentionWindow) {
        return new MetricsEngineConfig(retentionWindow, sweepInterval, sampleCap, bucketThresholds, namespace);
    }

    @NonNull
    public MetricsEngineConfig withSweepInterval(@NonNull Duration sweepInterval) {
        return new MetricsEngineConfig(retentionWindow, sweepInterval, sampleCap, bucketThresholds, namespace);
    }

    @NonNull
    public MetricsEngineConfig withSampleCap(int sampleCap) {
        return new MetricsEngineConfig(retentionWindow, sweepInterval, sampleCap, bucketThresholds, namespace);
    }

    @NonNull
    public MetricsEngineConfig withBucketThresholds(@NonNull List<Double> bucketThresholds) {
        return new MetricsEngineConfig(retentionWindow, sweepInterval, sampleCap, bucketThresholds, namespace);
    }

    @NonNull
    public MetricsEngineConfig withNamespace(@NonNull String namespace) {
        return new MetricsEngineConfig(retentionWindow, sweepInterval, sampleCap, bucketThresholds, namespace);
    }

    /**
     * Reads configuration from properties prefixed with {@value #PROPERTY_PREFIX}. Missing properties take defaults.
     * <ul>
     *     <li>{@code metrics.engine.retentionWindow} - ISO-8601 duration, e.g. {@code PT24H}</li>
     *     <li>{@code metrics.engine.sweepInterval} - ISO-8601 duration, e.g. {@code PT1H}</li>
     *     <li>{@code metrics.engine.sampleCap} - integer</li>
     *     <li>{@code metrics.engine.bucketThresholds} - comma-separated numbers</li>
     *     <li>{@code metrics.engine.namespace} - metric name prefix</li>
     * </ul>
     *
     * @param properties the properties to read
     * @return the configuration
     * @throws IllegalArgumentException if a property cannot be parsed or the resulting values are invalid
     */
    @NonNull
    public static MetricsEngineConfig fromProperties(@NonNull Properties properties) {
        Objects.requireNonNull(properties, "properties must not be null");
        return new MetricsEngineConfig(
                durationProperty(properties, "retentionWindow", DEFAULT_RETENTION_WINDOW),
                durationProperty(properties, "sweepInterval", DEFAULT_SWEEP_INTERVAL),
                intProperty(properties, "sampleCap", DEFAULT_SAMPLE_CAP),
                thresholdsProperty(properties, "bucketThresholds", DEFAULT_BUCKET_THRESHOLDS),
                properties.getProperty(PROPERTY_PREFIX + "namespace", "").trim());
    }

    private static Duration durationProperty(Properties properties, String name, Duration defaultValue) {
        String value = properties.getProperty(PROPERTY_PREFIX + name);
        if (value == null || value.isBlank()) {
            return defaultValue;
        }
        try {
            return Duration.parse(value.trim());
        } catch (DateTimeParseException e) {
            throw new IllegalArgumentException("Invalid duration for " + PROPERTY_PREFIX + name + ": " + value, e);
        }
    }

    private static int intProperty(Properties properties, String name, int defaultValue) {
        String value = properties.getProperty(PROPERTY_PREFIX + name);
        if (value == null || value.isBlank()) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid integer for " + PROPERTY_PREFIX + name + ": " + value, e);
        }
    }

    private static List<Double> thresholdsProperty(Properties properties, String name, List<Double> defaultValue) {
        String value = properties.getProperty(PROPERTY_PREFIX + name);
        if (value == null || value.isBlank()) {
            return defaultValue;
        }
        List<Double> thresholds = new ArrayList<>();
        for (String part : value.split(",")) {
            try {
                thresholds.add(Double.parseDouble(part.trim()));
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException(
                        "Invalid threshold in " + PROPERTY_PREFIX + name + ": " + part, e);
            }
        }
        return thresholds;
    }

    private static void requirePositive(Duration duration, String name) {
        Objects.requireNonNull(duration, name + " must not be null");
        if (duration.isZero() || duration.isNegative()) {
            throw new IllegalArgumentException(name + " must be positive, but was: " + duration);
        }
    }
}
