// SPDX-License-Identifier: Apache-2.0
package org.voxar.metrics.stat;

import edu.umd.cs.findbugs.annotations.NonNull;
import edu.umd.cs.findbugs.annotations.Nullable;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Point-in-time summary of one histogram bucket.
 * <p>
 * {@link #count()} includes every retained sample, non-finite ones too. The {@link #distribution()} is computed from
 * the finite samples only and is absent when there are none: callers must treat its absence as "no data", not zero.
 *
 * @param count            number of retained samples
 * @param nonFiniteCount   number of NaN or infinite samples excluded from the distribution
 * @param distribution     statistics over finite samples, {@code null} if there are none
 * @param cumulativeCounts cumulative sample counts per upper bound of the export threshold ladder, last is {@code +Inf}
 */
public record HistogramSummary(
        long count,
        long nonFiniteCount,
        @Nullable Distribution distribution,
        @NonNull List<CumulativeCount> cumulativeCounts) {

    private static final HistogramSummary EMPTY = new HistogramSummary(0, 0, null, List.of());

    public HistogramSummary {
        if (count < 0 || nonFiniteCount < 0 || nonFiniteCount > count) {
            throw new IllegalArgumentException(
                    "Invalid sample counts: count=" + count + ", nonFiniteCount=" + nonFiniteCount);
        }
        cumulativeCounts = List.copyOf(Objects.requireNonNull(cumulativeCounts, "cumulative counts must not be null"));
    }

    /**
     * @return the summary of a bucket without samples
     */
    @NonNull
    public static HistogramSummary empty() {
        return EMPTY;
    }

    /**
     * @return the distribution, empty when the bucket holds no finite sample
     */
    @NonNull
    public Optional<Distribution> findDistribution() {
        return Optional.ofNullable(distribution);
    }

    /**
     * Statistics over the finite samples of a bucket.
     */
    public record Distribution(
            double sum, double avg, double min, double max, double p50, double p90, double p95, double p99) {}

    /**
     * Number of samples less than or equal to an upper bound.
     *
     * @param upperBound the inclusive upper bound, {@link Double#POSITIVE_INFINITY} for the last entry
     * @param count      number of samples {@code <= upperBound}
     */
    public record CumulativeCount(double upperBound, long count) {}
}
