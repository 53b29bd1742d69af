// SPDX-License-Identifier: Apache-2.0
package org.voxar.metrics;

import edu.umd.cs.findbugs.annotations.NonNull;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.voxar.metrics.core.MetricKey;
import org.voxar.metrics.core.Sample;
import org.voxar.metrics.stat.HistogramStatistics;
import org.voxar.metrics.stat.HistogramSummary;

/**
 * Bounded sample buffers, one per {@link MetricKey}, created lazily on first record.
 */
final class HistogramStore {

    private static final Logger logger = LogManager.getLogger(HistogramStore.class);

    private final int sampleCap;
    private final List<Double> thresholds;
    private final Map<MetricKey, SampleBuffer> buffers = new ConcurrentHashMap<>();

    HistogramStore(int sampleCap, @NonNull List<Double> thresholds) {
        if (sampleCap <= 0) {
            throw new IllegalArgumentException("Sample cap must be positive, but was: " + sampleCap);
        }
        this.sampleCap = sampleCap;
        this.thresholds = List.copyOf(Objects.requireNonNull(thresholds, "thresholds must not be null"));
    }

    void record(@NonNull MetricKey key, @NonNull Sample sample) {
        Objects.requireNonNull(key, "key must not be null");
        buffers.computeIfAbsent(key, this::createBuffer).add(sample);
    }

    private SampleBuffer createBuffer(MetricKey key) {
        logger.debug("Created histogram {} with capacity {}", key, sampleCap);
        return new SampleBuffer(sampleCap);
    }

    /**
     * Summarizes one histogram. The buffer is locked only while its values are copied.
     *
     * @return the summary, {@link HistogramSummary#empty()} for an unknown key
     */
    @NonNull
    HistogramSummary summarize(@NonNull MetricKey key) {
        final SampleBuffer buffer = buffers.get(Objects.requireNonNull(key, "key must not be null"));
        return buffer == null ? HistogramSummary.empty() : HistogramStatistics.summarize(buffer.values(), thresholds);
    }

    @NonNull
    List<Sample> samples(@NonNull MetricKey key) {
        final SampleBuffer buffer = buffers.get(Objects.requireNonNull(key, "key must not be null"));
        return buffer == null ? List.of() : buffer.samples();
    }

    /**
     * @return sorted summaries of all histograms, including emptied ones
     */
    @NonNull
    SortedMap<MetricKey, HistogramSummary> snapshot() {
        SortedMap<MetricKey, HistogramSummary> summaries = new TreeMap<>();
        buffers.forEach((key, buffer) -> summaries.put(key, HistogramStatistics.summarize(buffer.values(), thresholds)));
        return summaries;
    }

    /**
     * Trims every buffer one at a time. Buffers are emptied, never removed.
     *
     * @param cutoff the oldest timestamp to retain
     * @return total number of removed samples
     */
    long removeOlderThan(@NonNull Instant cutoff) {
        long removed = 0;
        for (SampleBuffer buffer : buffers.values()) {
            removed += buffer.removeOlderThan(cutoff);
        }
        return removed;
    }

    int histogramCount() {
        return buffers.size();
    }

    void clear() {
        buffers.clear();
    }
}
