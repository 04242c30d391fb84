package net.relaytrace.Propagation;

import net.relaytrace.Tracing.CorrelationContext;
import net.relaytrace.Tracing.SpanAttributes;
import net.relaytrace.Tracing.TraceContext;
import net.relaytrace.Tracing.TracingSpan;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Supplier;

/**
 * Carries correlation and transaction ids from message to message.
 *
 * For an outgoing message the ids are resolved in this order: ids already in the
 * message metadata, then the ids of the message being handled on this thread, then new
 * ones. A new correlation id is a random UUID; a new transaction id is the trace id of
 * the dispatch span, so every message of a trace that starts a transaction shares it.
 */
public class CorrelationPropagator {

    private static final Logger logger = LoggerFactory.getLogger(CorrelationPropagator.class);

    private final Supplier<String> correlationIdGenerator;

    public CorrelationPropagator() {
        this(() -> UUID.randomUUID().toString());
    }

    public CorrelationPropagator(Supplier<String> correlationIdGenerator) {
        this.correlationIdGenerator = correlationIdGenerator;
    }

    /**
     * Decides the ids an outgoing message carries.
     *
     * @param metadata  the outgoing message's own metadata
     * @param inherited the ids of the message currently being handled
     * @param context   the trace context of the dispatch span
     */
    public CorrelationContext resolve(Map<String, String> metadata,
                                      Optional<CorrelationContext> inherited,
                                      TraceContext context) {
        CorrelationContext own = CorrelationContext.fromMetadata(metadata);
        CorrelationContext parent = inherited.orElse(CorrelationContext.EMPTY);

        String correlationId = own.getCorrelationId();
        if (correlationId == null) {
            correlationId = parent.getCorrelationId() != null
                    ? parent.getCorrelationId()
                    : correlationIdGenerator.get();
        }
        String transactionId = own.getTransactionId();
        if (transactionId == null) {
            transactionId = parent.getTransactionId() != null
                    ? parent.getTransactionId()
                    : context.getTraceId();
        }
        return CorrelationContext.of(correlationId, transactionId);
    }

    public CorrelationContext extract(Map<String, String> metadata) {
        return CorrelationContext.fromMetadata(metadata);
    }

    /**
     * Writes the present ids into {@code carrier}, replacing earlier values.
     */
    public void inject(CorrelationContext correlation, Map<String, String> carrier) {
        try {
            carrier.putAll(correlation.toMetadata());
        } catch (RuntimeException e) {
            logger.warn("failed to inject correlation ids into carrier: {}", e.getMessage());
        }
    }

    /**
     * Records the present ids as {@code correlation.id} and {@code transaction.id}.
     */
    public void applyAttributes(TracingSpan span, CorrelationContext correlation) {
        if (correlation.getCorrelationId() != null) {
            span.setAttribute(SpanAttributes.CORRELATION_ID, correlation.getCorrelationId());
        }
        if (correlation.getTransactionId() != null) {
            span.setAttribute(SpanAttributes.TRANSACTION_ID, correlation.getTransactionId());
        }
    }
}
