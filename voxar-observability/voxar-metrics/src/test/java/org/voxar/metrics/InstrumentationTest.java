// SPDX-License-Identifier: Apache-2.0
package org.voxar.metrics;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.io.IOException;
import java.time.Duration;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.voxar.metrics.core.MetricKey;
import org.voxar.metrics.core.Sample;

public class InstrumentationTest {

    private static final long STEP_NANOS = 12_000_000L;

    private final TestUtils.ManualClock clock = new TestUtils.ManualClock();
    private final MetricsEngine engine = new MetricsEngine(MetricsEngineConfig.defaults(), clock);

    // every read advances by 12ms, so one timed call measures exactly 0.012s
    private final AtomicLong nanos = new AtomicLong();
    private final Instrumentation instrumentation =
            new Instrumentation(engine, () -> nanos.getAndAdd(STEP_NANOS));

    @AfterEach
    void tearDown() {
        engine.close();
    }

    @Test
    void testSuccessRecordsDurationAndReturnsValue() {
        String result = instrumentation.time("op", () -> "done");

        assertThat(result).isEqualTo("done");
        assertThat(engine.samples(MetricKey.of("op_processing_time")))
                .extracting(Sample::value)
                .containsExactly(0.012);
        assertThat(engine.getSnapshot().counters()).doesNotContainKey(MetricKey.of("op_error_total"));
    }

    @Test
    void testFailureRecordsDurationAndErrorAndRethrowsSameException() {
        IllegalStateException failure = new IllegalStateException("boom");

        assertThatThrownBy(() -> instrumentation.time("op", () -> {
                    throw failure;
                }))
                .isSameAs(failure);

        assertThat(engine.counterValue(MetricKey.of("op_error_total"))).isEqualTo(1);
        assertThat(engine.summarize(MetricKey.of("op_processing_time")).count())
                .isEqualTo(1);
        assertThat(engine.samples(MetricKey.of("op_processing_time")).get(0).value())
                .isEqualTo(0.012);
    }

    @Test
    void testCheckedExceptionPropagates() {
        IOException failure = new IOException("disk");

        assertThatThrownBy(() -> instrumentation.run("io", () -> {
                    throw failure;
                }))
                .isSameAs(failure);

        assertThat(engine.counterValue(MetricKey.of("io_error_total"))).isEqualTo(1);
    }

    @Test
    void testRunnable() {
        AtomicBoolean ran = new AtomicBoolean();

        instrumentation.run("task", () -> ran.set(true));

        assertThat(ran).isTrue();
        assertThat(engine.summarize(MetricKey.of("task_processing_time")).count())
                .isEqualTo(1);
    }

    @Test
    void testLabelsAreCarriedToDerivedMetrics() {
        MetricKey key = MetricKey.of("map_load", "map_id", "m1");

        assertThatThrownBy(() -> instrumentation.time(key, () -> {
                    throw new IllegalArgumentException("missing map");
                }))
                .isInstanceOf(IllegalArgumentException.class);

        assertThat(engine.counterValue(MetricKey.of("map_load_error_total", "map_id", "m1")))
                .isEqualTo(1);
        assertThat(engine.summarize(MetricKey.of("map_load_processing_time", "map_id", "m1"))
                        .count())
                .isEqualTo(1);
    }

    @Test
    void testRepeatedCallsAccumulate() {
        for (int i = 0; i < 3; i++) {
            final int value = i;
            Integer result = instrumentation.time("op", () -> value);
            assertThat(result).isEqualTo(value);
        }

        assertThat(engine.summarize(MetricKey.of("op_processing_time")).count())
                .isEqualTo(3);
    }

    @Test
    void testRecordMeasuredDuration() {
        MetricKey key = MetricKey.of("upload");

        instrumentation.record(key, Duration.ofMillis(250), false);
        instrumentation.record(key, Duration.ofMillis(750), true);

        assertThat(engine.samples(MetricKey.of("upload_processing_time")))
                .extracting(Sample::value)
                .containsExactly(0.25, 0.75);
        assertThat(engine.counterValue(MetricKey.of("upload_error_total"))).isEqualTo(1);
    }

    @Test
    void testSystemNanoTimeMeasuresNonNegative() {
        Instrumentation real = new Instrumentation(engine);

        real.run("real", () -> {});

        assertThat(engine.samples(MetricKey.of("real_processing_time")).get(0).value())
                .isGreaterThanOrEqualTo(0.0);
    }
}
