package net.relaytrace.Export;

import net.relaytrace.Tracing.TracingSpan;

/**
 * Receives completed spans on their way to an exporter.
 * Implementations must never block the caller and never throw.
 */
@FunctionalInterface
public interface SpanSink {

    void submit(TracingSpan span);
}
