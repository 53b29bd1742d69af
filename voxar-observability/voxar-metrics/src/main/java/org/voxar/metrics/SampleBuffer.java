// SPDX-License-Identifier: Apache-2.0
package org.voxar.metrics;

import edu.umd.cs.findbugs.annotations.NonNull;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.voxar.metrics.core.Sample;

/**
 * Fixed-capacity ring of {@link Sample}s kept in arrival order.
 * <p>
 * Appending to a full buffer overwrites the oldest sample, so inserts are O(1) regardless of how many samples were
 * ever recorded. All methods are synchronized on the buffer; the lock is held only for the copy or the trim,
 * never while statistics are computed.
 */
final class SampleBuffer {

    private final Sample[] ring;
    private int head;
    private int size;

    // true while every sample timestamp is >= the one before it, allowing trims to stop at the first fresh sample
    private boolean ordered = true;

    SampleBuffer(int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("Sample buffer capacity must be positive, but was: " + capacity);
        }
        ring = new Sample[capacity];
    }

    synchronized void add(@NonNull Sample sample) {
        Objects.requireNonNull(sample, "sample must not be null");
        if (size > 0 && sample.timestamp().isBefore(ring[index(size - 1)].timestamp())) {
            ordered = false;
        }
        if (size == ring.length) {
            ring[head] = sample;
            head = index(1);
        } else {
            ring[index(size)] = sample;
            size++;
        }
    }

    /**
     * Removes every sample with a timestamp strictly before {@code cutoff}. Samples exactly at the cutoff are kept.
     *
     * @param cutoff the oldest timestamp to retain
     * @return number of removed samples
     */
    synchronized int removeOlderThan(@NonNull Instant cutoff) {
        Objects.requireNonNull(cutoff, "cutoff must not be null");
        if (ordered) {
            int removed = 0;
            while (size > 0 && ring[head].timestamp().isBefore(cutoff)) {
                ring[head] = null;
                head = index(1);
                size--;
                removed++;
            }
            return removed;
        }
        return compact(cutoff);
    }

    // in-place, order-preserving filter; the write position never overtakes the read position
    private int compact(Instant cutoff) {
        int kept = 0;
        Instant previous = null;
        boolean stillOrdered = true;
        for (int i = 0; i < size; i++) {
            Sample sample = ring[index(i)];
            if (!sample.timestamp().isBefore(cutoff)) {
                if (previous != null && sample.timestamp().isBefore(previous)) {
                    stillOrdered = false;
                }
                previous = sample.timestamp();
                ring[index(kept++)] = sample;
            }
        }
        for (int i = kept; i < size; i++) {
            ring[index(i)] = null;
        }
        final int removed = size - kept;
        size = kept;
        ordered = stillOrdered;
        return removed;
    }

    /**
     * @return copy of the sample values, oldest first
     */
    @NonNull
    synchronized double[] values() {
        double[] values = new double[size];
        for (int i = 0; i < size; i++) {
            values[i] = ring[index(i)].value();
        }
        return values;
    }

    /**
     * @return immutable copy of the samples, oldest first
     */
    @NonNull
    synchronized List<Sample> samples() {
        List<Sample> samples = new ArrayList<>(size);
        for (int i = 0; i < size; i++) {
            samples.add(ring[index(i)]);
        }
        return List.copyOf(samples);
    }

    synchronized int size() {
        return size;
    }

    int capacity() {
        return ring.length;
    }

    private int index(int offset) {
        return (head + offset) % ring.length;
    }
}
