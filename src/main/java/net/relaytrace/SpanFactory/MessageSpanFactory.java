package net.relaytrace.SpanFactory;

import io.opentelemetry.api.trace.SpanKind;
import net.relaytrace.Config.TracingConfiguration;
import net.relaytrace.Message.TracedMessage;
import net.relaytrace.Sampling.TraceSampler;
import net.relaytrace.Tracing.RecordingSpan;
import net.relaytrace.Tracing.SpanProcessor;
import net.relaytrace.Tracing.TraceContext;
import net.relaytrace.Tracing.TraceIds;
import net.relaytrace.Tracing.TracingSpan;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.Optional;

/**
 * Creates the two spans traced per message: the dispatch span ("sending") and the
 * handler span ("processing").
 *
 * With a parent context the new span joins the parent's trace and inherits its sampling
 * decision. Without one it starts a new trace and the sampler decides once for the
 * whole trace.
 */
public class MessageSpanFactory {

    private static final Logger logger = LoggerFactory.getLogger(MessageSpanFactory.class);

    private final TracingConfiguration configuration;
    private final SpanNameGenerator spanNameGenerator;
    private final AttributeApplier attributeApplier;
    private final TraceSampler sampler;
    private final SpanProcessor spanProcessor;
    private final Clock clock;

    public MessageSpanFactory(TracingConfiguration configuration,
                              AttributeApplier attributeApplier,
                              TraceSampler sampler,
                              SpanProcessor spanProcessor,
                              Clock clock) {
        this.configuration = configuration;
        this.spanNameGenerator = new SpanNameGenerator();
        this.attributeApplier = attributeApplier;
        this.sampler = sampler;
        this.spanProcessor = spanProcessor;
        this.clock = clock;
    }

    public TracingSpan createDispatchSpan(TracedMessage message, Optional<TraceContext> parent) {
        String spanName = spanNameGenerator.dispatchSpanName(message);
        TracingSpan span = startSpan(spanName, SpanKindResolver.dispatchKind(message.getKind()), message, parent);
        attributeApplier.applyDispatchAttributes(span, message, spanNameGenerator.messageName(message));
        return span;
    }

    public TracingSpan createHandlerSpan(TracedMessage message, String handlerId, Optional<TraceContext> parent) {
        String spanName = spanNameGenerator.handlerSpanName(message);
        TracingSpan span = startSpan(spanName, SpanKindResolver.handlerKind(message.getKind()), message, parent);
        attributeApplier.applyHandlerAttributes(span, message, spanNameGenerator.messageName(message), handlerId);
        return span;
    }

    public AttributeApplier getAttributeApplier() {
        return attributeApplier;
    }

    private TracingSpan startSpan(String spanName, SpanKind kind, TracedMessage message, Optional<TraceContext> parent) {
        TraceContext context;
        String parentSpanId;
        if (parent.isPresent()) {
            context = parent.get().newChild();
            parentSpanId = parent.get().getSpanId();
        } else {
            String traceId = TraceIds.newTraceId();
            boolean sampled = sample(traceId, spanName, message);
            context = TraceContext.of(traceId, TraceIds.newSpanId(), sampled);
            parentSpanId = null;
        }
        return new RecordingSpan(spanName, kind, context, parentSpanId, clock,
                configuration.isAttachStacktrace(), spanProcessor);
    }

    private boolean sample(String traceId, String spanName, TracedMessage message) {
        try {
            return sampler.shouldSample(traceId, spanName, message.getKind());
        } catch (RuntimeException e) {
            logger.warn("sampler failed for trace {}, sampling it: {}", traceId, e.getMessage());
            return true;
        }
    }
}
