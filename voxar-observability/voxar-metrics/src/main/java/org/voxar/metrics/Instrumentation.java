// SPDX-License-Identifier: Apache-2.0
package org.voxar.metrics;

import edu.umd.cs.findbugs.annotations.NonNull;
import java.time.Duration;
import java.util.Objects;
import java.util.function.LongSupplier;
import org.voxar.metrics.core.MetricKey;
import org.voxar.metrics.core.Sample;

/**
 * Times operations into a {@link MetricsEngine}.
 * <p>
 * For an operation named {@code op}, the elapsed time in seconds is recorded into the histogram
 * {@code op_processing_time} whether the operation completes or fails. A failure additionally increments the counter
 * {@code op_error_total}. The outcome of the operation, returned value or thrown exception, reaches the caller
 * unchanged.
 */
public final class Instrumentation {

    public static final String PROCESSING_TIME_SUFFIX = "_processing_time";
    public static final String ERROR_TOTAL_SUFFIX = "_error_total";

    private static final double NANOS_PER_SECOND = 1_000_000_000.0;

    private final MetricsEngine engine;
    private final LongSupplier nanoTime;

    public Instrumentation(@NonNull MetricsEngine engine) {
        this(engine, System::nanoTime);
    }

    Instrumentation(@NonNull MetricsEngine engine, @NonNull LongSupplier nanoTime) {
        this.engine = Objects.requireNonNull(engine, "engine must not be null");
        this.nanoTime = Objects.requireNonNull(nanoTime, "nano time source must not be null");
    }

    /**
     * An operation returning a value that may throw a checked exception.
     */
    @FunctionalInterface
    public interface ThrowingSupplier<T, E extends Exception> {
        T get() throws E;
    }

    /**
     * An operation without result that may throw a checked exception.
     */
    @FunctionalInterface
    public interface ThrowingRunnable<E extends Exception> {
        void run() throws E;
    }

    public <T, E extends Exception> T time(@NonNull String name, @NonNull ThrowingSupplier<T, E> operation)
            throws E {
        return time(MetricKey.of(name), operation);
    }

    /**
     * Invokes the operation and records its duration, and its failure if any, under the given key's name
     * with the key's labels.
     *
     * @param key       the operation key; suffixes are appended to its name
     * @param operation the operation to invoke
     * @return the value returned by the operation
     * @throws E whatever the operation throws, unchanged
     */
    public <T, E extends Exception> T time(@NonNull MetricKey key, @NonNull ThrowingSupplier<T, E> operation)
            throws E {
        Objects.requireNonNull(key, "key must not be null");
        Objects.requireNonNull(operation, "operation must not be null");

        final long start = nanoTime.getAsLong();
        boolean failed = true;
        try {
            final T result = operation.get();
            failed = false;
            return result;
        } finally {
            final long elapsedNanos = nanoTime.getAsLong() - start;
            engine.recordSample(
                    key.withNameSuffix(PROCESSING_TIME_SUFFIX),
                    new Sample(elapsedNanos / NANOS_PER_SECOND, engine.clock().instant()));
            if (failed) {
                engine.incrementCounter(key.withNameSuffix(ERROR_TOTAL_SUFFIX), 1L);
            }
        }
    }

    public <E extends Exception> void run(@NonNull String name, @NonNull ThrowingRunnable<E> operation) throws E {
        run(MetricKey.of(name), operation);
    }

    /**
     * Runnable variant of {@link #time(MetricKey, ThrowingSupplier)}.
     */
    public <E extends Exception> void run(@NonNull MetricKey key, @NonNull ThrowingRunnable<E> operation) throws E {
        Objects.requireNonNull(operation, "operation must not be null");
        time(key, () -> {
            operation.run();
            return null;
        });
    }

    /**
     * Records an externally measured duration the same way {@link #time(MetricKey, ThrowingSupplier)} would.
     *
     * @param key      the operation key
     * @param duration the elapsed time
     * @param failed   whether the operation failed
     */
    public void record(@NonNull MetricKey key, @NonNull Duration duration, boolean failed) {
        Objects.requireNonNull(key, "key must not be null");
        Objects.requireNonNull(duration, "duration must not be null");
        engine.recordSample(
                key.withNameSuffix(PROCESSING_TIME_SUFFIX),
                new Sample(duration.toNanos() / NANOS_PER_SECOND, engine.clock().instant()));
        if (failed) {
            engine.incrementCounter(key.withNameSuffix(ERROR_TOTAL_SUFFIX), 1L);
        }
    }
}
