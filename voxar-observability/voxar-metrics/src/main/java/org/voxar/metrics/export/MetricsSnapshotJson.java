// SPDX-License-Identifier: Apache-2.0
package org.voxar.metrics.export;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import edu.umd.cs.findbugs.annotations.NonNull;
import java.io.UncheckedIOException;
import java.util.Objects;
import org.voxar.metrics.stat.HistogramSummary;

/**
 * Renders a {@link MetricsSnapshot} as the JSON reply served by health and metrics endpoints:
 * <pre>
 * {"timestamp": "...", "window_seconds": 86400,
 *  "counters": {"name": 5}, "gauges": {"name{map_id=\"m1\"}": 0.5},
 *  "histograms": {"name": {"count": 5, "sum": 15.0, "avg": 3.0, "min": 1.0, "max": 5.0,
 *                          "p50": 3.0, "p90": 5.0, "p95": 5.0, "p99": 5.0}}}
 * </pre>
 * Labelled series are keyed by {@link org.voxar.metrics.core.MetricKey#toString()}. Histograms without finite
 * samples only carry {@code count} (and {@code non_finite_count} when non-zero).
 */
public final class MetricsSnapshotJson {

    private static final ObjectMapper mapper = new ObjectMapper();

    private MetricsSnapshotJson() {}

    /**
     * @return the snapshot as a JSON tree
     */
    @NonNull
    public static ObjectNode toJsonNode(@NonNull MetricsSnapshot snapshot) {
        Objects.requireNonNull(snapshot, "snapshot must not be null");

        ObjectNode root = mapper.createObjectNode();
        root.put("timestamp", snapshot.timestamp().toString());
        root.put("window_seconds", snapshot.retentionWindow().toSeconds());

        ObjectNode counters = root.putObject("counters");
        snapshot.counters().forEach((key, value) -> counters.put(key.toString(), value));

        ObjectNode gauges = root.putObject("gauges");
        snapshot.gauges().forEach((key, value) -> gauges.put(key.toString(), value));

        ObjectNode histograms = root.putObject("histograms");
        snapshot.histograms().forEach((key, summary) -> writeSummary(histograms.putObject(key.toString()), summary));

        return root;
    }

    /**
     * @return the snapshot as a compact JSON string
     */
    @NonNull
    public static String toJson(@NonNull MetricsSnapshot snapshot) {
        try {
            return mapper.writeValueAsString(toJsonNode(snapshot));
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException("Failed to serialize metrics snapshot", e);
        }
    }

    private static void writeSummary(ObjectNode node, HistogramSummary summary) {
        node.put("count", summary.count());
        if (summary.nonFiniteCount() > 0) {
            node.put("non_finite_count", summary.nonFiniteCount());
        }
        summary.findDistribution().ifPresent(distribution -> {
            node.put("sum", distribution.sum());
            node.put("avg", distribution.avg());
            node.put("min", distribution.min());
            node.put("max", distribution.max());
            node.put("p50", distribution.p50());
            node.put("p90", distribution.p90());
            node.put("p95", distribution.p95());
            node.put("p99", distribution.p99());
        });
    }
}
