package net.relaytrace.Filter;

import net.relaytrace.Tracing.TracingSpan;

/**
 * Decides whether an ended span is handed to the exporter.
 */
@FunctionalInterface
public interface SpanFilter {

    SpanFilter ACCEPT_ALL = span -> true;

    boolean shouldExport(TracingSpan span);
}
