// SPDX-License-Identifier: Apache-2.0
package org.voxar.metrics.core;

/**
 * The kinds of metric the engine aggregates.
 */
public enum MetricType {
    /**
     * A cumulative metric that represents a single monotonically increasing counter value.
     */
    COUNTER,
    /**
     * A metric that represents a single numerical value that can arbitrarily go up and down and set to any value.
     */
    GAUGE,
    /**
     * A bounded sequence of timestamped samples summarized into a distribution on demand.
     */
    HISTOGRAM
}
