package net.relaytrace.Tracing;

import io.opentelemetry.api.trace.SpanId;
import io.opentelemetry.api.trace.TraceId;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Immutable position inside a trace: trace id, span id, sampling flag and baggage.
 *
 * A TraceContext is always "present" - both ids are valid, non-zero lowercase hex.
 * Absence is modelled with {@code Optional.empty()} by every API that can fail to
 * find a context, never with a zeroed instance.
 */
@Getter
@EqualsAndHashCode
@ToString
public final class TraceContext {

    private final String traceId;
    private final String spanId;
    private final boolean sampled;
    private final Map<String, String> baggage;

    private TraceContext(String traceId, String spanId, boolean sampled, Map<String, String> baggage) {
        if (!TraceId.isValid(traceId)) {
            throw new IllegalArgumentException("invalid trace id: " + traceId);
        }
        if (!SpanId.isValid(spanId)) {
            throw new IllegalArgumentException("invalid span id: " + spanId);
        }
        this.traceId = traceId;
        this.spanId = spanId;
        this.sampled = sampled;
        this.baggage = baggage == null || baggage.isEmpty()
                ? Collections.emptyMap()
                : Collections.unmodifiableMap(new LinkedHashMap<>(baggage));
    }

    public static TraceContext of(String traceId, String spanId, boolean sampled) {
        return new TraceContext(traceId, spanId, sampled, Collections.emptyMap());
    }

    public static TraceContext of(String traceId, String spanId, boolean sampled, Map<String, String> baggage) {
        return new TraceContext(traceId, spanId, sampled, baggage);
    }

    /**
     * Starts a brand new trace with fresh ids.
     */
    public static TraceContext newRoot(boolean sampled) {
        return new TraceContext(TraceIds.newTraceId(), TraceIds.newSpanId(), sampled, Collections.emptyMap());
    }

    /**
     * Creates the context of a child span: same trace, sampling decision and baggage,
     * new span id.
     */
    public TraceContext newChild() {
        return new TraceContext(traceId, TraceIds.newSpanId(), sampled, baggage);
    }

    /**
     * Returns a copy whose baggage is this baggage overlaid with {@code extra}.
     */
    public TraceContext withBaggage(Map<String, String> extra) {
        if (extra == null || extra.isEmpty()) {
            return this;
        }
        Map<String, String> merged = new LinkedHashMap<>(baggage);
        merged.putAll(extra);
        return new TraceContext(traceId, spanId, sampled, merged);
    }
}
