package net.relaytrace.Tracing;

/**
 * Represents the time period during which a trace context is the "current" one.
 *
 * This must be closed when the scope ends (use try-with-resources).
 *
 * Example usage:
 * <pre>
 * try (TracingScope scope = ActiveContext.makeCurrent(span.getContext())) {
 *     // do work - the span's context is now current
 * } finally {
 *     span.end();
 * }
 * </pre>
 */
public interface TracingScope extends AutoCloseable {

    /**
     * Closes the scope. This restores the previous context as the current one.
     * Unlike AutoCloseable.close(), this method does not throw exceptions.
     */
    @Override
    void close();
}
