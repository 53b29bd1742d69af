// SPDX-License-Identifier: Apache-2.0
package org.voxar.metrics;

import edu.umd.cs.findbugs.annotations.NonNull;
import java.util.Map;
import java.util.Objects;
import java.util.OptionalDouble;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import org.voxar.metrics.core.MetricKey;

/**
 * Last-write-wins gauges, one per {@link MetricKey}.
 */
final class GaugeStore {

    private final Map<MetricKey, Double> gauges = new ConcurrentHashMap<>();

    void set(@NonNull MetricKey key, double value) {
        gauges.put(Objects.requireNonNull(key, "key must not be null"), value);
    }

    /**
     * @return the last value set, or empty if the gauge was never set
     */
    @NonNull
    OptionalDouble get(@NonNull MetricKey key) {
        final Double value = gauges.get(Objects.requireNonNull(key, "key must not be null"));
        return value == null ? OptionalDouble.empty() : OptionalDouble.of(value);
    }

    @NonNull
    SortedMap<MetricKey, Double> snapshot() {
        return new TreeMap<>(gauges);
    }

    void clear() {
        gauges.clear();
    }
}
