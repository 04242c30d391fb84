package net.relaytrace.Tracing;

/**
 * Outcome of the unit of work a span measures.
 */
public enum SpanStatus {
    UNSET,
    OK,
    ERROR,
    /** The work was cancelled before it completed. */
    CANCELLED
}
