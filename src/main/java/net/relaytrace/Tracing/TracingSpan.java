package net.relaytrace.Tracing;

import io.opentelemetry.api.trace.SpanKind;
import org.springframework.lang.Nullable;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * A timed record of one unit of message work.
 *
 * A span is mutable while active: attributes can be added, the status set and exceptions
 * appended. {@link #end()} is a one-way transition after which the span is immutable and
 * every mutator is ignored.
 */
public interface TracingSpan {

    String getName();

    SpanKind getKind();

    String getTraceId();

    String getSpanId();

    /**
     * @return the parent span id, or null for the root span of a trace
     */
    @Nullable
    String getParentSpanId();

    boolean isSampled();

    /**
     * @return the context that identifies this span, for propagation and as a parent
     */
    TraceContext getContext();

    /**
     * @return an immutable snapshot of the attributes, in insertion order
     */
    Map<String, AttributeValue> getAttributes();

    @Nullable
    AttributeValue getAttribute(String key);

    SpanStatus getStatus();

    @Nullable
    String getStatusDescription();

    /**
     * @return an immutable snapshot of the recorded exceptions
     */
    List<ExceptionEvent> getExceptionEvents();

    Instant getStartTime();

    /**
     * @return the end time, or null while the span is active
     */
    @Nullable
    Instant getEndTime();

    boolean isEnded();

    /**
     * Sets an attribute on the span.
     *
     * @param key the attribute key
     * @param value the attribute value
     * @return this span for chaining
     */
    TracingSpan setAttribute(String key, String value);

    TracingSpan setAttribute(String key, long value);

    TracingSpan setAttribute(String key, int value);

    TracingSpan setAttribute(String key, double value);

    TracingSpan setAttribute(String key, boolean value);

    TracingSpan setAttribute(String key, AttributeValue value);

    /**
     * Appends an exception event. Does not change the status.
     *
     * @param exception the exception to record
     * @return this span for chaining
     */
    TracingSpan recordException(Throwable exception);

    /**
     * Sets the span status to OK.
     */
    TracingSpan setSuccess();

    /**
     * Sets the span status to ERROR with a description.
     */
    TracingSpan setError(@Nullable String description);

    /**
     * Sets the span status to CANCELLED with a description.
     */
    TracingSpan setCancelled(@Nullable String description);

    /**
     * Ends the span. Only the first call has an effect.
     *
     * @return true if this call ended the span, false if it was already ended
     */
    boolean end();

    /**
     * Makes this span's context the current one.
     * Returns a scope that must be closed when done.
     *
     * @return a TracingScope that must be closed (use try-with-resources)
     */
    default TracingScope makeCurrent() {
        return ActiveContext.makeCurrent(getContext());
    }
}
