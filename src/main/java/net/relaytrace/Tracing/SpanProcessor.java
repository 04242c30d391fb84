package net.relaytrace.Tracing;

/**
 * Receives every span once, at the moment it ends.
 */
@FunctionalInterface
public interface SpanProcessor {

    SpanProcessor NOOP = span -> { };

    /**
     * Called exactly once per span, after the span has become immutable.
     */
    void onEnd(TracingSpan span);
}
