// SPDX-License-Identifier: Apache-2.0
package org.voxar.metrics.prometheus;

import edu.umd.cs.findbugs.annotations.NonNull;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.Objects;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.voxar.metrics.MetricsEngine;
import org.voxar.metrics.export.MetricsSnapshot;

/**
 * Renders the current state of a {@link MetricsEngine} as Prometheus text, to be served verbatim as the body of a
 * scrape response with {@link #CONTENT_TYPE}.
 * <p>
 * Metric names are prefixed with the engine's configured namespace. Rendering is synchronized because the underlying
 * writer is not thread-safe; concurrent scrapes are served one after another.
 */
public final class PrometheusTextExporter {

    private static final Logger logger = LogManager.getLogger(PrometheusTextExporter.class);

    public static final String CONTENT_TYPE = "text/plain; version=0.0.4";

    /** Default pattern for sample values: up to six fraction digits, no trailing zeros. */
    public static final String DEFAULT_DECIMAL_FORMAT = "0.######";

    private final MetricsEngine engine;
    private final PrometheusTextWriter writer;

    public PrometheusTextExporter(@NonNull MetricsEngine engine) {
        this(engine, DEFAULT_DECIMAL_FORMAT);
    }

    /**
     * @param engine        the engine to render
     * @param decimalFormat {@link java.text.DecimalFormat} pattern for sample values
     */
    public PrometheusTextExporter(@NonNull MetricsEngine engine, @NonNull String decimalFormat) {
        this.engine = Objects.requireNonNull(engine, "engine must not be null");
        this.writer = new PrometheusTextWriter(decimalFormat, engine.config().namespace());
        logger.info(
                "Created Prometheus text exporter. namespace={}, decimalFormat={}",
                engine.config().namespace(),
                decimalFormat);
    }

    /**
     * Takes a fresh snapshot from the engine and writes it to the stream. The stream is flushed, not closed.
     *
     * @param output the target stream
     * @throws IOException if writing to the stream fails
     */
    public synchronized void write(@NonNull OutputStream output) throws IOException {
        write(engine.getSnapshot(), output);
    }

    /**
     * Writes the given snapshot to the stream.
     */
    public synchronized void write(@NonNull MetricsSnapshot snapshot, @NonNull OutputStream output)
            throws IOException {
        writer.write(snapshot, output);
    }

    /**
     * @return the current state rendered as UTF-8 bytes
     */
    @NonNull
    public byte[] renderBytes() {
        ByteArrayOutputStream output = new ByteArrayOutputStream(4096);
        try {
            write(output);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to render metrics", e);
        }
        return output.toByteArray();
    }

    /**
     * @return the current state rendered as text
     */
    @NonNull
    public String renderText() {
        return new String(renderBytes(), StandardCharsets.UTF_8);
    }
}
