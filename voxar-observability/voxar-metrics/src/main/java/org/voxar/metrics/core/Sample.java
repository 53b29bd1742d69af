// SPDX-License-Identifier: Apache-2.0
package org.voxar.metrics.core;

import edu.umd.cs.findbugs.annotations.NonNull;
import java.time.Instant;
import java.util.Map;
import java.util.Objects;

/**
 * A single immutable histogram observation.
 *
 * @param value     observed value, may be non-finite
 * @param timestamp the instant the value was observed
 * @param labels    per-sample attribution labels (e.g. {@code map_id}), not part of the histogram identity
 */
public record Sample(double value, @NonNull Instant timestamp, @NonNull Map<String, String> labels) {

    public Sample {
        Objects.requireNonNull(timestamp, "timestamp must not be null");
        Objects.requireNonNull(labels, "labels must not be null");
        labels.forEach((labelName, labelValue) -> {
            MetricUtils.validateLabelName(labelName);
            MetricUtils.throwArgBlank(labelValue, "labelValue");
        });
        labels = Map.copyOf(labels);
    }

    /**
     * Creates a sample without per-sample labels.
     */
    public Sample(double value, @NonNull Instant timestamp) {
        this(value, timestamp, Map.of());
    }

    /**
     * @return {@code true} if the value is neither NaN nor infinite
     */
    public boolean isFinite() {
        return Double.isFinite(value);
    }
}
