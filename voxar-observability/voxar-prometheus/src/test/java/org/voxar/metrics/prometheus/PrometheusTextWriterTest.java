// SPDX-License-Identifier: Apache-2.0
package org.voxar.metrics.prometheus;

import static org.assertj.core.api.Assertions.assertThat;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.stream.Stream;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;
import org.voxar.metrics.core.MetricKey;
import org.voxar.metrics.export.MetricsSnapshot;
import org.voxar.metrics.stat.HistogramStatistics;
import org.voxar.metrics.stat.HistogramSummary;

public class PrometheusTextWriterTest {

    private static final Instant NOW = Instant.parse("2024-01-01T00:00:00Z");
    private static final List<Double> THRESHOLDS = List.of(0.1, 0.5, 1.0, 2.0, 5.0, 10.0);

    private final PrometheusTextWriter defaultWriter = new PrometheusTextWriter("0.######", "");

    private final SortedMap<MetricKey, Long> counters = new TreeMap<>();
    private final SortedMap<MetricKey, Double> gauges = new TreeMap<>();
    private final SortedMap<MetricKey, HistogramSummary> histograms = new TreeMap<>();

    private String render(PrometheusTextWriter writer) {
        try (ByteArrayOutputStream outputStream = new ByteArrayOutputStream()) {
            writer.write(new MetricsSnapshot(NOW, Duration.ofHours(24), counters, gauges, histograms), outputStream);
            return outputStream.toString(StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    private void histogram(MetricKey key, double... values) {
        histograms.put(key, HistogramStatistics.summarize(values, THRESHOLDS));
    }

    @Test
    void testEmptySnapshot() {
        assertThat(render(defaultWriter)).isEmpty();
    }

    @Nested
    class Counters {

        @Test
        void testSingleCounter() {
            counters.put(MetricKey.of("x"), 5L);

            assertThat(render(defaultWriter)).isEqualTo("""
                    # TYPE x counter
                    x 5
                    """);
        }

        @Test
        void testLabelledSeriesShareTypeLine() {
            counters.put(MetricKey.of("map_load_total", "map_id", "m2"), 4L);
            counters.put(MetricKey.of("map_load_total", "map_id", "m1"), 2L);
            counters.put(MetricKey.of("map_load_total"), 1L);
            counters.put(MetricKey.of("a_total"), 3L);

            assertThat(render(defaultWriter)).isEqualTo("""
                    # TYPE a_total counter
                    a_total 3
                    # TYPE map_load_total counter
                    map_load_total 1
                    map_load_total{map_id="m1"} 2
                    map_load_total{map_id="m2"} 4
                    """);
        }

        @Test
        void testMultipleLabelsSortedByName() {
            counters.put(MetricKey.of("req", "z", "1", "a", "2"), 1L);

            assertThat(render(defaultWriter)).isEqualTo("""
                    # TYPE req counter
                    req{a="2",z="1"} 1
                    """);
        }

        @Test
        void testLargeValue() {
            counters.put(MetricKey.of("x"), Long.MAX_VALUE);

            assertThat(render(defaultWriter)).contains("x 9223372036854775807\n");
        }
    }

    @Nested
    class Gauges {

        private static Stream<Arguments> gaugeValues() {
            return Stream.of(
                    Arguments.of(0.5, "0.5"),
                    Arguments.of(15.0, "15"),
                    Arguments.of(-2.25, "-2.25"),
                    Arguments.of(0.012, "0.012"),
                    Arguments.of(1234567.0, "1234567"),
                    Arguments.of(0.000001, "0.000001"),
                    Arguments.of(4e-7, "4.0E-7"),
                    Arguments.of(3e-9, "3.0E-9"),
                    Arguments.of(-3e-9, "-3.0E-9"),
                    Arguments.of(0.0, "0"),
                    Arguments.of(Double.NaN, "NaN"),
                    Arguments.of(Double.POSITIVE_INFINITY, "+Inf"),
                    Arguments.of(Double.NEGATIVE_INFINITY, "-Inf"));
        }

        @ParameterizedTest
        @MethodSource("gaugeValues")
        void testValueFormat(double value, String expected) {
            gauges.put(MetricKey.of("g"), value);

            assertThat(render(defaultWriter)).isEqualTo("""
                    # TYPE g gauge
                    g %s
                    """.formatted(expected));
        }

        @Test
        void testCustomDecimalFormatKeepsValuesBelowItsPrecision() {
            gauges.put(MetricKey.of("g"), 0.004);

            assertThat(render(new PrometheusTextWriter("0.00", ""))).contains("g 0.004\n");
        }

        @Test
        void testCustomDecimalFormat() {
            gauges.put(MetricKey.of("g"), 1.23456);

            assertThat(render(new PrometheusTextWriter("0.00", ""))).contains("g 1.23\n");
        }

        private static Stream<Arguments> labelValues() {
            return Stream.of(
                    Arguments.of("\n Newline", "\\n Newline"),
                    Arguments.of("\\n Escaped Newline", "\\\\n Escaped Newline"),
                    Arguments.of("\t Tab", "\t Tab"),
                    Arguments.of("\" Double Quote", "\\\" Double Quote"),
                    Arguments.of("\\ Backslash", "\\\\ Backslash"),
                    Arguments.of("#$%^&*()_+-=[]{}|;':,.<>/?`~", "#$%^&*()_+-=[]{}|;':,.<>/?`~"),
                    Arguments.of("測試指標", "測試指標"),
                    Arguments.of("тест", "тест"));
        }

        @ParameterizedTest
        @MethodSource("labelValues")
        void testLabelValueEscape(String labelValue, String expected) {
            gauges.put(MetricKey.of("g", "label", labelValue), 1.0);

            assertThat(render(defaultWriter)).isEqualTo("""
                    # TYPE g gauge
                    g{label="%s"} 1
                    """.formatted(expected));
        }
    }

    @Nested
    class Histograms {

        @Test
        void testHistogram() {
            histogram(MetricKey.of("latency"), 1, 2, 3, 4, 5);

            assertThat(render(defaultWriter)).isEqualTo("""
                    # TYPE latency_histogram histogram
                    latency_histogram_count 5
                    latency_histogram_sum 15
                    latency_histogram_bucket{le="0.1"} 0
                    latency_histogram_bucket{le="0.5"} 0
                    latency_histogram_bucket{le="1.0"} 1
                    latency_histogram_bucket{le="2.0"} 2
                    latency_histogram_bucket{le="5.0"} 5
                    latency_histogram_bucket{le="10.0"} 5
                    latency_histogram_bucket{le="+Inf"} 5
                    """);
        }

        @Test
        void testLabelledHistogramPutsLeLast() {
            histograms.put(
                    MetricKey.of("op_processing_time", "map_id", "m1"),
                    HistogramStatistics.summarize(new double[] {0.3}, List.of(1.0)));

            assertThat(render(defaultWriter)).isEqualTo("""
                    # TYPE op_processing_time_histogram histogram
                    op_processing_time_histogram_count{map_id="m1"} 1
                    op_processing_time_histogram_sum{map_id="m1"} 0.3
                    op_processing_time_histogram_bucket{map_id="m1",le="1.0"} 1
                    op_processing_time_histogram_bucket{map_id="m1",le="+Inf"} 1
                    """);
        }

        @Test
        void testEmptyHistogramOmitted() {
            histograms.put(MetricKey.of("expired"), HistogramSummary.empty());
            counters.put(MetricKey.of("x"), 1L);

            assertThat(render(defaultWriter)).doesNotContain("expired");
        }

        @Test
        void testTinySumIsNotRoundedToZero() {
            histogram(MetricKey.of("fast_op"), 4e-7);

            String text = render(defaultWriter);

            assertThat(text).contains("fast_op_histogram_count 1\n");
            assertThat(text).contains("fast_op_histogram_sum 4.0E-7\n");
        }

        @Test
        void testOnlyNonFiniteSamples() {
            histogram(MetricKey.of("h"), Double.NaN, Double.POSITIVE_INFINITY);

            String text = render(defaultWriter);

            assertThat(text).contains("h_histogram_count 2\n");
            assertThat(text).contains("h_histogram_sum 0\n");
            assertThat(text).contains("h_histogram_bucket{le=\"10.0\"} 0\n");
            assertThat(text).contains("h_histogram_bucket{le=\"+Inf\"} 2\n");
        }

        @Test
        void testInfBucketEqualsCountAndBucketsAreMonotonic() {
            histogram(MetricKey.of("h"), 0.05, 0.7, 0.7, 3.0, 11.0, Double.NaN, 1.9);

            long previous = -1;
            long count = -1;
            long inf = -1;
            for (String line : render(defaultWriter).split("\n")) {
                if (line.startsWith("h_histogram_count ")) {
                    count = Long.parseLong(line.substring(line.lastIndexOf(' ') + 1));
                } else if (line.startsWith("h_histogram_bucket")) {
                    long value = Long.parseLong(line.substring(line.lastIndexOf(' ') + 1));
                    assertThat(value).isGreaterThanOrEqualTo(previous);
                    previous = value;
                    if (line.contains("le=\"+Inf\"")) {
                        inf = value;
                    }
                }
            }
            assertThat(count).isEqualTo(7);
            assertThat(inf).isEqualTo(count);
        }
    }

    @Nested
    class NameCollisions {

        @Test
        void testGaugeWithCounterNameSkipped() {
            counters.put(MetricKey.of("requests"), 3L);
            gauges.put(MetricKey.of("requests"), 1.5);
            gauges.put(MetricKey.of("requests", "map_id", "m1"), 2.5);
            gauges.put(MetricKey.of("rate"), 0.5);

            assertThat(render(defaultWriter)).isEqualTo("""
                    # TYPE requests counter
                    requests 3
                    # TYPE rate gauge
                    rate 0.5
                    """);
        }

        @Test
        void testHistogramWithTakenNameSkipped() {
            gauges.put(MetricKey.of("latency_histogram"), 1.0);
            histogram(MetricKey.of("latency"), 0.2);

            assertThat(render(defaultWriter)).isEqualTo("""
                    # TYPE latency_histogram gauge
                    latency_histogram 1
                    """);
        }

        @Test
        void testHistogramWithTakenSeriesNameSkipped() {
            counters.put(MetricKey.of("latency_histogram_count"), 7L);
            histogram(MetricKey.of("latency"), 0.2);
            histogram(MetricKey.of("other"), 0.2);

            String text = render(defaultWriter);

            assertThat(text).doesNotContain("# TYPE latency_histogram histogram");
            assertThat(text).contains("latency_histogram_count 7\n");
            assertThat(text).contains("# TYPE other_histogram histogram\n");
        }

        @Test
        void testEveryNameTypedOnce() {
            counters.put(MetricKey.of("x"), 1L);
            counters.put(MetricKey.of("x", "a", "1"), 1L);
            gauges.put(MetricKey.of("x"), 1.0);
            gauges.put(MetricKey.of("y"), 1.0);
            histogram(MetricKey.of("y"), 1.0);

            long typeLinesForX = render(defaultWriter)
                    .lines()
                    .filter(line -> line.startsWith("# TYPE x "))
                    .count();

            assertThat(typeLinesForX).isEqualTo(1);
        }
    }

    @Test
    void testNamespacePrefix() {
        PrometheusTextWriter writer = new PrometheusTextWriter("0.######", "vps");
        counters.put(MetricKey.of("requests"), 1L);
        gauges.put(MetricKey.of("rate"), 0.5);
        histogram(MetricKey.of("t"), 0.2);

        assertThat(render(writer)).isEqualTo("""
                # TYPE vps_requests counter
                vps_requests 1
                # TYPE vps_rate gauge
                vps_rate 0.5
                # TYPE vps_t_histogram histogram
                vps_t_histogram_count 1
                vps_t_histogram_sum 0.2
                vps_t_histogram_bucket{le="0.1"} 0
                vps_t_histogram_bucket{le="0.5"} 1
                vps_t_histogram_bucket{le="1.0"} 1
                vps_t_histogram_bucket{le="2.0"} 1
                vps_t_histogram_bucket{le="5.0"} 1
                vps_t_histogram_bucket{le="10.0"} 1
                vps_t_histogram_bucket{le="+Inf"} 1
                """);
    }

    @Test
    void testSectionsOrderedCountersGaugesHistograms() {
        histogram(MetricKey.of("a"), 1.0);
        gauges.put(MetricKey.of("b"), 1.0);
        counters.put(MetricKey.of("c"), 1L);

        String text = render(defaultWriter);

        assertThat(text.indexOf("# TYPE c counter")).isLessThan(text.indexOf("# TYPE b gauge"));
        assertThat(text.indexOf("# TYPE b gauge")).isLessThan(text.indexOf("# TYPE a_histogram histogram"));
    }
}
