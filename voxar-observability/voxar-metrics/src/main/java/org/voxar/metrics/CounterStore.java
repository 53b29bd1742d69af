// SPDX-License-Identifier: Apache-2.0
package org.voxar.metrics;

import edu.umd.cs.findbugs.annotations.NonNull;
import java.util.Map;
import java.util.Objects;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.voxar.metrics.core.MetricKey;

/**
 * Monotonically increasing counters, one per {@link MetricKey}.
 * <p>
 * Entries are created lazily with value {@code 0}. Each entry is an independent atomic, so increments of
 * unrelated keys never contend. Addition saturates at {@link Long#MAX_VALUE}.
 */
final class CounterStore {

    private static final Logger logger = LogManager.getLogger(CounterStore.class);

    private final Map<MetricKey, AtomicLong> counters = new ConcurrentHashMap<>();

    /**
     * Adds {@code delta} to the counter of the given key. Negative deltas are logged and ignored.
     *
     * @param key   the counter key
     * @param delta the non-negative increment
     * @return {@code true} if the increment was applied
     */
    boolean increment(@NonNull MetricKey key, long delta) {
        Objects.requireNonNull(key, "key must not be null");
        if (delta < 0L) {
            logger.warn("Rejected negative increment {} for counter {}", delta, key);
            return false;
        }
        final AtomicLong counter = counters.computeIfAbsent(key, k -> new AtomicLong());
        if (delta != 0L) {
            counter.accumulateAndGet(delta, CounterStore::saturatedAdd);
        }
        return true;
    }

    long get(@NonNull MetricKey key) {
        final AtomicLong counter = counters.get(Objects.requireNonNull(key, "key must not be null"));
        return counter == null ? 0L : counter.get();
    }

    /**
     * @return sorted copy of all counter values
     */
    @NonNull
    SortedMap<MetricKey, Long> snapshot() {
        SortedMap<MetricKey, Long> copy = new TreeMap<>();
        counters.forEach((key, value) -> copy.put(key, value.get()));
        return copy;
    }

    void clear() {
        counters.clear();
    }

    private static long saturatedAdd(long current, long delta) {
        final long result = current + delta;
        // both operands are non-negative, so overflow shows up as a negative result
        return result < 0L ? Long.MAX_VALUE : result;
    }
}
