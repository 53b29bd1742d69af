// SPDX-License-Identifier: Apache-2.0
package org.voxar.metrics.prometheus;

import edu.umd.cs.findbugs.annotations.NonNull;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.text.DecimalFormat;
import java.text.DecimalFormatSymbols;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.voxar.metrics.core.Label;
import org.voxar.metrics.core.MetricKey;
import org.voxar.metrics.core.MetricType;
import org.voxar.metrics.core.MetricUtils;
import org.voxar.metrics.export.MetricsSnapshot;
import org.voxar.metrics.stat.HistogramSummary;

/**
 * A writer that renders a {@link MetricsSnapshot} in the Prometheus text exposition format, version 0.0.4.
 * <p>
 * Series sharing a name are grouped under a single {@code # TYPE} line. Histograms are exposed as
 * {@code <name>_histogram} with {@code _count}, {@code _sum} and cumulative {@code _bucket{le="..."}} series;
 * histograms without samples are skipped.
 * <p>
 * Values too small for the decimal pattern are written in scientific notation instead of being rounded to zero.
 * A name is exported with one type only: series whose name was already written under another type are skipped
 * with a warning.
 * <p>
 * This class is not thread-safe, due to the use of {@link DecimalFormat}.
 *
 * <p>See <a href="https://prometheus.io/docs/instrumenting/exposition_formats/">Exposition formats</a> for details.
 */
class PrometheusTextWriter {

    private static final Logger logger = LogManager.getLogger(PrometheusTextWriter.class);

    private static final byte COMMA = ',';
    private static final byte QUOTE = '"';
    private static final byte SPACE = ' ';
    private static final byte NEW_LINE = '\n';
    private static final byte OPEN_BRACKET = '{';
    private static final byte CLOSE_BRACKET = '}';
    private static final byte UNDERSCORE = '_';
    private static final byte[] EQUALS_QUOTE = "=\"".getBytes(StandardCharsets.UTF_8);

    private static final byte[] TYPE = "# TYPE ".getBytes(StandardCharsets.UTF_8);
    private static final Map<MetricType, byte[]> METRIC_TYPES = Map.of(
            MetricType.COUNTER, "counter".getBytes(StandardCharsets.UTF_8),
            MetricType.GAUGE, "gauge".getBytes(StandardCharsets.UTF_8),
            MetricType.HISTOGRAM, "histogram".getBytes(StandardCharsets.UTF_8));

    private static final String HISTOGRAM_SUFFIX = "_histogram";
    private static final byte[] COUNT_SUFFIX = "_count".getBytes(StandardCharsets.UTF_8);
    private static final byte[] SUM_SUFFIX = "_sum".getBytes(StandardCharsets.UTF_8);
    private static final byte[] BUCKET_SUFFIX = "_bucket".getBytes(StandardCharsets.UTF_8);
    private static final byte[] LE_EQUALS_QUOTE = "le=\"".getBytes(StandardCharsets.UTF_8);

    private static final byte[] POSITIVE_INF = "+Inf".getBytes(StandardCharsets.UTF_8);
    private static final byte[] NEGATIVE_INF = "-Inf".getBytes(StandardCharsets.UTF_8);
    private static final byte[] NAN = "NaN".getBytes(StandardCharsets.UTF_8);
    private static final byte[] ZERO = "0".getBytes(StandardCharsets.UTF_8);

    private final DecimalFormat formatter;
    private final double roundsToZeroBelow;
    private final byte[] namePrefix;

    /**
     * @param decimalFormat {@link DecimalFormat} pattern for sample values, applied with locale-independent symbols
     * @param namespace     prefix for every metric name, joined with {@code _}; empty for none
     */
    PrometheusTextWriter(@NonNull String decimalFormat, @NonNull String namespace) {
        Objects.requireNonNull(decimalFormat, "decimal format must not be null");
        Objects.requireNonNull(namespace, "namespace must not be null");
        formatter = new DecimalFormat(decimalFormat, DecimalFormatSymbols.getInstance(Locale.ROOT));
        roundsToZeroBelow = 0.5 * Math.pow(10, -formatter.getMaximumFractionDigits());
        namePrefix = namespace.isEmpty() ? new byte[0] : (namespace + '_').getBytes(StandardCharsets.UTF_8);
    }

    public final void write(@NonNull MetricsSnapshot snapshot, @NonNull OutputStream output) throws IOException {
        Objects.requireNonNull(snapshot, "snapshot must not be null");
        Objects.requireNonNull(output, "output must not be null");

        // names already announced by a # TYPE line, a name may carry one type only
        final Set<String> families = new HashSet<>();
        writeCounters(snapshot.counters(), families, output);
        writeGauges(snapshot.gauges(), families, output);
        writeHistograms(snapshot.histograms(), families, output);
        output.flush();
    }

    private void writeCounters(Map<MetricKey, Long> counters, Set<String> families, OutputStream output)
            throws IOException {
        String currentName = null;
        boolean skipped = false;
        for (Map.Entry<MetricKey, Long> entry : counters.entrySet()) {
            MetricKey key = entry.getKey();
            if (!key.name().equals(currentName)) {
                currentName = key.name();
                skipped = !claimFamily(families, currentName, MetricType.COUNTER);
                if (!skipped) {
                    writeType(currentName, MetricType.COUNTER, output);
                }
            }
            if (skipped) {
                continue;
            }
            writeName(currentName, output);
            writeLabels(key.labels(), output);
            output.write(SPACE);
            output.write(formatter.format(entry.getValue()).getBytes(StandardCharsets.UTF_8));
            output.write(NEW_LINE);
        }
    }

    private void writeGauges(Map<MetricKey, Double> gauges, Set<String> families, OutputStream output)
            throws IOException {
        String currentName = null;
        boolean skipped = false;
        for (Map.Entry<MetricKey, Double> entry : gauges.entrySet()) {
            MetricKey key = entry.getKey();
            if (!key.name().equals(currentName)) {
                currentName = key.name();
                skipped = !claimFamily(families, currentName, MetricType.GAUGE);
                if (!skipped) {
                    writeType(currentName, MetricType.GAUGE, output);
                }
            }
            if (skipped) {
                continue;
            }
            writeName(currentName, output);
            writeLabels(key.labels(), output);
            output.write(SPACE);
            output.write(convertValue(entry.getValue()));
            output.write(NEW_LINE);
        }
    }

    private void writeHistograms(
            Map<MetricKey, HistogramSummary> histograms, Set<String> families, OutputStream output)
            throws IOException {
        String currentName = null;
        boolean skipped = false;
        for (Map.Entry<MetricKey, HistogramSummary> entry : histograms.entrySet()) {
            MetricKey key = entry.getKey();
            HistogramSummary summary = entry.getValue();
            if (summary.count() == 0) {
                continue;
            }

            final String histogramName = key.name() + HISTOGRAM_SUFFIX;
            if (!histogramName.equals(currentName)) {
                currentName = histogramName;
                skipped = !claimHistogramFamily(families, histogramName);
                if (!skipped) {
                    writeType(currentName, MetricType.HISTOGRAM, output);
                }
            }
            if (skipped) {
                continue;
            }

            writeName(histogramName, output);
            output.write(COUNT_SUFFIX);
            writeLabels(key.labels(), output);
            output.write(SPACE);
            output.write(formatter.format(summary.count()).getBytes(StandardCharsets.UTF_8));
            output.write(NEW_LINE);

            writeName(histogramName, output);
            output.write(SUM_SUFFIX);
            writeLabels(key.labels(), output);
            output.write(SPACE);
            output.write(summary.findDistribution()
                    .map(distribution -> convertValue(distribution.sum()))
                    .orElse(ZERO));
            output.write(NEW_LINE);

            if (summary.nonFiniteCount() > 0) {
                logger.debug(
                        "Histogram {} has {} non-finite samples excluded from sum and finite buckets",
                        key,
                        summary.nonFiniteCount());
            }

            for (HistogramSummary.CumulativeCount bucket : summary.cumulativeCounts()) {
                writeName(histogramName, output);
                output.write(BUCKET_SUFFIX);
                writeBucketLabels(key.labels(), bucket.upperBound(), output);
                output.write(SPACE);
                output.write(formatter.format(bucket.count()).getBytes(StandardCharsets.UTF_8));
                output.write(NEW_LINE);
            }
        }
    }

    /**
     * @return {@code false} if the name was already written with another type, its series are then skipped
     */
    private static boolean claimFamily(Set<String> families, String name, MetricType type) {
        if (families.add(name)) {
            return true;
        }
        logger.warn("Skipping {} {}: name is already exported as another metric type", type, name);
        return false;
    }

    private static boolean claimHistogramFamily(Set<String> families, String histogramName) {
        for (String seriesName : List.of(
                histogramName + "_count", histogramName + "_sum", histogramName + "_bucket")) {
            if (families.contains(seriesName)) {
                logger.warn(
                        "Skipping HISTOGRAM {}: series name {} is already exported as another metric type",
                        histogramName,
                        seriesName);
                return false;
            }
        }
        return claimFamily(families, histogramName, MetricType.HISTOGRAM);
    }

    private void writeType(String name, MetricType type, OutputStream output) throws IOException {
        output.write(TYPE);
        writeName(name, output);
        output.write(SPACE);
        output.write(METRIC_TYPES.get(type));
        output.write(NEW_LINE);
    }

    private void writeName(String name, OutputStream output) throws IOException {
        output.write(namePrefix);
        output.write(name.getBytes(StandardCharsets.UTF_8));
    }

    private void writeLabels(List<Label> labels, OutputStream output) throws IOException {
        if (labels.isEmpty()) {
            return;
        }
        output.write(OPEN_BRACKET);
        appendLabels(labels, output);
        output.write(CLOSE_BRACKET);
    }

    private void writeBucketLabels(List<Label> labels, double upperBound, OutputStream output) throws IOException {
        output.write(OPEN_BRACKET);
        if (appendLabels(labels, output)) {
            output.write(COMMA);
        }
        output.write(LE_EQUALS_QUOTE);
        output.write(upperBound == Double.POSITIVE_INFINITY
                ? POSITIVE_INF
                : Double.toString(upperBound).getBytes(StandardCharsets.UTF_8));
        output.write(QUOTE);
        output.write(CLOSE_BRACKET);
    }

    /**
     * @return {@code true} if at least one label was written
     */
    private boolean appendLabels(List<Label> labels, OutputStream output) throws IOException {
        boolean first = true;
        for (Label label : labels) {
            if (!first) {
                output.write(COMMA);
            }
            first = false;
            output.write(label.name().getBytes(StandardCharsets.UTF_8));
            output.write(EQUALS_QUOTE);
            output.write(MetricUtils.escapeLabelValue(label.value()).getBytes(StandardCharsets.UTF_8));
            output.write(QUOTE);
        }
        return !first;
    }

    private byte[] convertValue(double value) {
        if (value == Double.POSITIVE_INFINITY) {
            return POSITIVE_INF;
        } else if (value == Double.NEGATIVE_INFINITY) {
            return NEGATIVE_INF;
        } else if (Double.isNaN(value)) {
            return NAN;
        }
        if (value != 0.0 && Math.abs(value * formatter.getMultiplier()) <= roundsToZeroBelow) {
            // the pattern has too few fraction digits for this magnitude
            return Double.toString(value).getBytes(StandardCharsets.UTF_8);
        }
        return formatter.format(value).getBytes(StandardCharsets.UTF_8);
    }
}
