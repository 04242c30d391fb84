package net.relaytrace.Propagation;

import io.opentelemetry.api.baggage.Baggage;
import io.opentelemetry.api.baggage.BaggageBuilder;
import io.opentelemetry.api.baggage.propagation.W3CBaggagePropagator;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.SpanContext;
import io.opentelemetry.api.trace.TraceFlags;
import io.opentelemetry.api.trace.TraceState;
import io.opentelemetry.api.trace.propagation.W3CTraceContextPropagator;
import io.opentelemetry.context.Context;
import io.opentelemetry.context.propagation.TextMapGetter;
import io.opentelemetry.context.propagation.TextMapPropagator;
import io.opentelemetry.context.propagation.TextMapSetter;
import net.relaytrace.Metrics.NoOpTracingMetricsRecorder;
import net.relaytrace.Metrics.TracingMetricsRecorder;
import net.relaytrace.Tracing.TraceContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.lang.Nullable;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Encodes and decodes a {@link TraceContext} in a message's string metadata.
 *
 * The context travels as a W3C {@code traceparent} token plus an optional W3C
 * {@code baggage} entry. Both codecs are OpenTelemetry's own propagators; this class only
 * converts between {@link TraceContext} and an OpenTelemetry {@link Context}. Every other
 * carrier key belongs to the caller and is never touched.
 *
 * Neither direction throws: a missing or malformed token extracts as
 * {@code Optional.empty()}, which callers treat as "start a new trace".
 */
public class TraceContextPropagator {

    private static final Logger logger = LoggerFactory.getLogger(TraceContextPropagator.class);

    public static final String TRACEPARENT = "traceparent";
    public static final String BAGGAGE = "baggage";

    static final String VERSION = "00";

    private static final TextMapPropagator TRACE_CONTEXT = W3CTraceContextPropagator.getInstance();
    private static final TextMapPropagator BAGGAGE_PROPAGATOR = W3CBaggagePropagator.getInstance();
    private static final MapGetter GETTER = new MapGetter();
    private static final MapSetter SETTER = new MapSetter();

    private final TracingMetricsRecorder metricsRecorder;

    public TraceContextPropagator() {
        this(NoOpTracingMetricsRecorder.INSTANCE);
    }

    public TraceContextPropagator(TracingMetricsRecorder metricsRecorder) {
        this.metricsRecorder = metricsRecorder;
    }

    /**
     * Writes {@code context} into the reserved carrier keys. An unsampled context is
     * still written; its flags say it is unsampled.
     */
    public void inject(TraceContext context, Map<String, String> carrier) {
        if (context == null || carrier == null) {
            return;
        }
        try {
            Context otelContext = toOtelContext(context);
            carrier.remove(BAGGAGE);
            TRACE_CONTEXT.inject(otelContext, carrier, SETTER);
            if (!context.getBaggage().isEmpty()) {
                BAGGAGE_PROPAGATOR.inject(otelContext, carrier, SETTER);
            }
        } catch (RuntimeException e) {
            // e.g. an immutable carrier handed in by the caller
            logger.warn("failed to inject trace context into carrier: {}", e.getMessage());
        }
    }

    /**
     * Absent-context injection is a no-op.
     */
    public void inject(Optional<TraceContext> context, Map<String, String> carrier) {
        context.ifPresent(present -> inject(present, carrier));
    }

    /**
     * Injects {@code context} with {@code extraBaggage} merged into its baggage.
     */
    public void injectWithBaggage(TraceContext context, Map<String, String> extraBaggage, Map<String, String> carrier) {
        if (context == null) {
            return;
        }
        inject(context.withBaggage(extraBaggage), carrier);
    }

    /**
     * Reads the trace context from {@code carrier}.
     *
     * @return the context, or empty if the carrier has no well-formed traceparent
     */
    public Optional<TraceContext> extract(Map<String, String> carrier) {
        if (carrier == null) {
            return Optional.empty();
        }
        String traceparent;
        try {
            traceparent = carrier.get(TRACEPARENT);
        } catch (RuntimeException e) {
            logger.debug("carrier lookup failed: {}", e.getMessage());
            return Optional.empty();
        }
        if (traceparent == null) {
            return Optional.empty();
        }

        SpanContext spanContext = SpanContext.getInvalid();
        // newer traceparent versions are accepted by the W3C propagator, only 00 is spoken here
        if (traceparent.startsWith(VERSION)) {
            try {
                spanContext = Span.fromContext(TRACE_CONTEXT.extract(Context.root(), carrier, GETTER)).getSpanContext();
            } catch (RuntimeException e) {
                logger.debug("traceparent extraction failed: {}", e.getMessage());
            }
        }
        if (!spanContext.isValid()) {
            metricsRecorder.recordPropagationFailure();
            logger.debug("ignoring malformed traceparent '{}'", traceparent);
            return Optional.empty();
        }
        return Optional.of(TraceContext.of(
                spanContext.getTraceId(),
                spanContext.getSpanId(),
                spanContext.isSampled(),
                extractBaggage(carrier)));
    }

    private static Map<String, String> extractBaggage(Map<String, String> carrier) {
        Map<String, String> baggage = new LinkedHashMap<>();
        try {
            Baggage.fromContext(BAGGAGE_PROPAGATOR.extract(Context.root(), carrier, GETTER))
                    .forEach((key, entry) -> baggage.put(key, entry.getValue()));
        } catch (RuntimeException e) {
            logger.debug("ignoring malformed baggage '{}': {}", carrier.get(BAGGAGE), e.getMessage());
        }
        return baggage;
    }

    private static Context toOtelContext(TraceContext context) {
        SpanContext spanContext = SpanContext.create(
                context.getTraceId(),
                context.getSpanId(),
                context.isSampled() ? TraceFlags.getSampled() : TraceFlags.getDefault(),
                TraceState.getDefault());
        Context otelContext = Context.root().with(Span.wrap(spanContext));
        if (context.getBaggage().isEmpty()) {
            return otelContext;
        }
        BaggageBuilder baggage = Baggage.builder();
        context.getBaggage().forEach(baggage::put);
        return otelContext.with(baggage.build());
    }

    /**
     * TextMapGetter over a metadata carrier.
     */
    private static class MapGetter implements TextMapGetter<Map<String, String>> {
        @Override
        public Iterable<String> keys(Map<String, String> carrier) {
            return carrier.keySet();
        }

        @Override
        @Nullable
        public String get(@Nullable Map<String, String> carrier, String key) {
            return carrier != null ? carrier.get(key) : null;
        }
    }

    private static class MapSetter implements TextMapSetter<Map<String, String>> {
        @Override
        public void set(@Nullable Map<String, String> carrier, String key, String value) {
            if (carrier != null) {
                carrier.put(key, value);
            }
        }
    }
}
