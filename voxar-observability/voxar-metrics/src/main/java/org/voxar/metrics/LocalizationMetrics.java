// SPDX-License-Identifier: Apache-2.0
package org.voxar.metrics;

import com.fasterxml.jackson.databind.node.ObjectNode;
import edu.umd.cs.findbugs.annotations.NonNull;
import edu.umd.cs.findbugs.annotations.Nullable;
import java.time.Instant;
import java.util.Map;
import java.util.Objects;
import org.voxar.metrics.core.MetricKey;
import org.voxar.metrics.core.MetricUtils;
import org.voxar.metrics.core.Sample;
import org.voxar.metrics.export.MetricsSnapshotJson;

/**
 * Recording helpers for the visual positioning pipeline, built on a shared {@link MetricsEngine}.
 * <p>
 * Besides the raw counters and histograms, {@link #recordLocalization} keeps two derived gauges up to date:
 * {@code localization_success_rate} (successes over all attempts) and {@code localization_avg_processing_time}
 * (average of the retained processing time samples). {@link #recentPerformance()} reads them back together with
 * the attempt count.
 */
public final class LocalizationMetrics {

    public static final MetricKey LOCALIZATION_SUCCESS = MetricKey.of("localization_success_total");
    public static final MetricKey LOCALIZATION_FAILURE = MetricKey.of("localization_failure_total");
    public static final MetricKey LOCALIZATION_PROCESSING_TIME = MetricKey.of("localization_processing_time");
    public static final MetricKey LOCALIZATION_CONFIDENCE = MetricKey.of("localization_confidence");
    public static final MetricKey LOCALIZATION_FEATURE_MATCHES = MetricKey.of("localization_feature_matches");
    public static final MetricKey LOCALIZATION_SUCCESS_RATE = MetricKey.of("localization_success_rate");
    public static final MetricKey LOCALIZATION_AVG_PROCESSING_TIME = MetricKey.of("localization_avg_processing_time");

    public static final MetricKey FEATURE_EXTRACTION = MetricKey.of("feature_extraction_total");
    public static final MetricKey FEATURE_EXTRACTION_TIME = MetricKey.of("feature_extraction_time");
    public static final MetricKey FEATURE_COUNT = MetricKey.of("feature_count");

    public static final String MAP_ID_LABEL = "map_id";

    private final MetricsEngine engine;

    public LocalizationMetrics(@NonNull MetricsEngine engine) {
        this.engine = Objects.requireNonNull(engine, "engine must not be null");
    }

    /**
     * Records one localization attempt.
     *
     * @param success        whether a pose was found
     * @param processingTime processing time in seconds
     * @param confidence     pose confidence, if available
     * @param featureMatches number of matched features, if available
     */
    public void recordLocalization(
            boolean success, double processingTime, @Nullable Double confidence, @Nullable Integer featureMatches) {
        engine.incrementCounter(success ? LOCALIZATION_SUCCESS : LOCALIZATION_FAILURE, 1L);

        final Instant now = engine.clock().instant();
        engine.recordSample(LOCALIZATION_PROCESSING_TIME, new Sample(processingTime, now));
        if (confidence != null) {
            engine.recordSample(LOCALIZATION_CONFIDENCE, new Sample(confidence, now));
        }
        if (featureMatches != null) {
            engine.recordSample(LOCALIZATION_FEATURE_MATCHES, new Sample(featureMatches, now));
        }

        updateSuccessRate();
        engine.summarize(LOCALIZATION_PROCESSING_TIME)
                .findDistribution()
                .ifPresent(distribution -> engine.setGauge(LOCALIZATION_AVG_PROCESSING_TIME, distribution.avg()));
    }

    private void updateSuccessRate() {
        final long successes = engine.counterValue(LOCALIZATION_SUCCESS);
        final long total = successes + engine.counterValue(LOCALIZATION_FAILURE);
        if (total > 0) {
            engine.setGauge(LOCALIZATION_SUCCESS_RATE, (double) successes / total);
        }
    }

    /**
     * Records one feature extraction pass.
     *
     * @param featureCount   number of extracted features
     * @param extractionTime extraction time in seconds
     */
    public void recordFeatureExtraction(int featureCount, double extractionTime) {
        final Instant now = engine.clock().instant();
        engine.incrementCounter(FEATURE_EXTRACTION, 1L);
        engine.recordSample(FEATURE_EXTRACTION_TIME, new Sample(extractionTime, now));
        engine.recordSample(FEATURE_COUNT, new Sample(featureCount, now));
    }

    /**
     * Records a map operation into {@code map_<operation>_total} and {@code map_<operation>_duration}.
     * The map id is attached to the duration sample, not to the histogram identity.
     *
     * @param operation operation name, e.g. {@code load}
     * @param mapId     the map the operation touched
     * @param duration  duration in seconds
     */
    public void recordMapOperation(@NonNull String operation, @NonNull String mapId, double duration) {
        MetricUtils.throwArgBlank(operation, "operation");
        MetricUtils.throwArgBlank(mapId, "mapId");
        engine.incrementCounter(MetricKey.of("map_" + operation + "_total"), 1L);
        engine.recordSample(
                MetricKey.of("map_" + operation + "_duration"),
                new Sample(duration, engine.clock().instant(), Map.of(MAP_ID_LABEL, mapId)));
    }

    /**
     * @return attempt count and derived gauges over the retention window, gauges are 0 before the first attempt
     */
    @NonNull
    public RecentPerformance recentPerformance() {
        return new RecentPerformance(
                engine.counterValue(LOCALIZATION_SUCCESS) + engine.counterValue(LOCALIZATION_FAILURE),
                engine.getGauge(LOCALIZATION_SUCCESS_RATE).orElse(0.0),
                engine.getGauge(LOCALIZATION_AVG_PROCESSING_TIME).orElse(0.0),
                engine.config().retentionWindow().toSeconds() / 3600.0);
    }

    /**
     * Renders a fresh engine snapshot as JSON with an added {@code recent_performance} object.
     */
    @NonNull
    public ObjectNode toJsonNode() {
        final ObjectNode root = MetricsSnapshotJson.toJsonNode(engine.getSnapshot());
        final RecentPerformance performance = recentPerformance();
        final ObjectNode node = root.putObject("recent_performance");
        node.put("total_localizations", performance.totalLocalizations());
        node.put("success_rate", performance.successRate());
        node.put("avg_processing_time", performance.avgProcessingTime());
        node.put("window_hours", performance.windowHours());
        return root;
    }

    /**
     * Localization health summary.
     *
     * @param totalLocalizations successful plus failed attempts
     * @param successRate        last value of {@code localization_success_rate}
     * @param avgProcessingTime  last value of {@code localization_avg_processing_time}, in seconds
     * @param windowHours        retention window of the engine
     */
    public record RecentPerformance(
            long totalLocalizations, double successRate, double avgProcessingTime, double windowHours) {}
}
