package net.relaytrace.Interceptor;

import net.relaytrace.Config.TracingConfiguration;
import net.relaytrace.ErrorCorrelation.ErrorCorrelator;
import net.relaytrace.Message.AsyncMessageHandler;
import net.relaytrace.Message.MessageHandler;
import net.relaytrace.Message.MessageKind;
import net.relaytrace.Message.TracedMessage;
import net.relaytrace.Metrics.TracingMetricsRecorder;
import net.relaytrace.Propagation.CorrelationPropagator;
import net.relaytrace.Propagation.TraceContextPropagator;
import net.relaytrace.SpanFactory.MessageSpanFactory;
import net.relaytrace.SpanFactory.ResultSpanEnricher;
import net.relaytrace.Tracing.ActiveContext;
import net.relaytrace.Tracing.CorrelationContext;
import net.relaytrace.Tracing.SpanAttributes;
import net.relaytrace.Tracing.TraceContext;
import net.relaytrace.Tracing.TracingScope;
import net.relaytrace.Tracing.TracingSpan;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.lang.Nullable;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Function;

/**
 * Traces the two phases of every message: dispatch (caller to bus) and handling (bus to
 * handler).
 *
 * <p>Dispatch: a span is opened with the active context as parent and its context is
 * injected into a copy of the message metadata. Event spans end right after the hand-off.
 * Command and query spans stay open until {@link #completeDispatch(String, Object)},
 * {@link #failDispatch(String, Throwable)} or {@link #cancelDispatch(String, String)} is
 * called for the message id. A span still open after the configured dispatch timeout, or
 * pushed out by the configured maximum of open spans, is ended as cancelled.
 *
 * <p>Correlation: outgoing messages carry a correlation id and a transaction id, taken from
 * their own metadata, else from the message being handled, else newly generated. Both are
 * recorded on the dispatch and handler spans.
 *
 * <p>Handling: the parent is extracted from the inbound metadata (none means a new trace),
 * the handler span is made current while the handler runs, and the span is ended exactly
 * once on every exit path. Exceptions thrown by the handler are recorded and rethrown as is.
 *
 * <p>Tracing never changes the outcome of a message: when span bookkeeping itself fails the
 * message goes through untraced.
 */
public class MessageTracingInterceptor {

    private static final Logger logger = LoggerFactory.getLogger(MessageTracingInterceptor.class);

    static final String SHUTDOWN_REASON = "tracing shut down";
    static final String SUPERSEDED_REASON = "superseded by a new dispatch with the same id";
    static final String TIMEOUT_REASON = "timed out";
    static final String OVERFLOW_REASON = "evicted, too many pending dispatches";

    private static final Duration SWEEP_INTERVAL = Duration.ofSeconds(1);

    private final TracingConfiguration configuration;
    private final MessageSpanFactory spanFactory;
    private final TraceContextPropagator propagator;
    private final ErrorCorrelator errorCorrelator;
    private final ResultSpanEnricher resultEnricher;
    private final CorrelationPropagator correlationPropagator;
    private final TracingMetricsRecorder metricsRecorder;
    private final Clock clock;

    // oldest first, guarded by itself
    private final LinkedHashMap<String, PendingDispatch> pendingDispatches = new LinkedHashMap<>();
    private final AtomicBoolean shutdown = new AtomicBoolean(false);
    private volatile Instant lastSweep;

    public MessageTracingInterceptor(TracingConfiguration configuration,
                                     MessageSpanFactory spanFactory,
                                     TraceContextPropagator propagator,
                                     ErrorCorrelator errorCorrelator,
                                     CorrelationPropagator correlationPropagator,
                                     TracingMetricsRecorder metricsRecorder,
                                     Clock clock) {
        this.configuration = configuration;
        this.spanFactory = spanFactory;
        this.propagator = propagator;
        this.errorCorrelator = errorCorrelator;
        this.resultEnricher = new ResultSpanEnricher(spanFactory.getAttributeApplier());
        this.correlationPropagator = correlationPropagator;
        this.metricsRecorder = metricsRecorder;
        this.clock = clock;
    }

    /**
     * @return true if messages of this kind are currently traced
     */
    public boolean isTracing(MessageKind kind) {
        return configuration.isEnabled() && !shutdown.get() && configuration.isTraced(kind);
    }

    // ---------------------------------------------------------------------
    // Dispatch flow
    // ---------------------------------------------------------------------

    /**
     * Traces a batch of outgoing messages. All dispatch spans share the context that is
     * active at the time of the call as their parent.
     *
     * @return the messages in the same order, enriched with trace context where traced
     */
    public List<TracedMessage> wrapDispatch(List<TracedMessage> messages) {
        Optional<TraceContext> parent = ActiveContext.current();
        List<TracedMessage> wrapped = new ArrayList<>(messages.size());
        for (TracedMessage message : messages) {
            wrapped.add(wrapDispatch(message, parent));
        }
        return wrapped;
    }

    public TracedMessage wrapDispatch(TracedMessage message) {
        return wrapDispatch(message, ActiveContext.current());
    }

    /**
     * Traces one outgoing message under an explicit parent.
     *
     * @param parent the parent context, empty to start a new trace
     */
    public TracedMessage wrapDispatch(TracedMessage message, Optional<TraceContext> parent) {
        if (!isTracing(message.getKind())) {
            return message;
        }
        TracingSpan span;
        try {
            span = spanFactory.createDispatchSpan(message, parent);
        } catch (RuntimeException e) {
            logger.warn("failed to create dispatch span for message {}, dispatching untraced: {}",
                    message.getIdentifier(), e.getMessage());
            return message;
        }

        Map<String, String> carrier = new LinkedHashMap<>(message.getMetadata());
        if (configuration.isPropagateCorrelationIds()) {
            CorrelationContext correlation = correlationPropagator.resolve(
                    message.getMetadata(), ActiveContext.currentCorrelation(), span.getContext());
            correlationPropagator.inject(correlation, carrier);
            correlationPropagator.applyAttributes(span, correlation);
        }
        propagator.inject(span.getContext(), carrier);
        TracedMessage enriched = message.withMetadata(carrier);

        if (!message.getKind().isRequestResponse()) {
            span.setSuccess();
            span.end();
            return enriched;
        }

        sweepIfDue();
        PendingDispatch previous;
        List<PendingDispatch> evicted = new ArrayList<>();
        synchronized (pendingDispatches) {
            // re-inserting moves a redispatched id to the young end
            previous = pendingDispatches.remove(message.getIdentifier());
            pendingDispatches.put(message.getIdentifier(), new PendingDispatch(span, message, clock.instant()));
            Iterator<PendingDispatch> oldest = pendingDispatches.values().iterator();
            while (pendingDispatches.size() > configuration.getMaxPendingDispatches() && oldest.hasNext()) {
                evicted.add(oldest.next());
                oldest.remove();
            }
        }
        if (previous != null) {
            logger.debug("message {} dispatched again before its result arrived", message.getIdentifier());
            previous.span.setCancelled(SUPERSEDED_REASON);
            previous.span.end();
        }
        if (!evicted.isEmpty()) {
            logger.debug("{} open dispatch spans evicted, more than {} pending",
                    evicted.size(), configuration.getMaxPendingDispatches());
            evicted.forEach(pending -> expire(pending, OVERFLOW_REASON, TracingMetricsRecorder.EXPIRY_REASON_OVERFLOW));
        }
        return enriched;
    }

    /**
     * Ends the open dispatch span of a command or query with its result.
     *
     * @param result the result, null for void
     */
    public void completeDispatch(String messageId, @Nullable Object result) {
        PendingDispatch pending = takePending(messageId);
        if (pending == null) {
            logger.debug("no open dispatch span for message {}", messageId);
            return;
        }
        resultEnricher.enrich(pending.span, result);
        pending.span.setSuccess();
        pending.span.end();
    }

    /**
     * Ends the open dispatch span of a command or query with an error.
     */
    public void failDispatch(String messageId, Throwable error) {
        Throwable cause = unwrap(error);
        if (cause instanceof CancellationException) {
            cancelDispatch(messageId, cause.getMessage());
            return;
        }
        PendingDispatch pending = takePending(messageId);
        if (pending == null) {
            logger.debug("no open dispatch span for message {}", messageId);
            return;
        }
        errorCorrelator.recordException(pending.span, cause, pending.message);
        pending.span.end();
    }

    /**
     * Ends the open dispatch span of a command or query as cancelled.
     */
    public void cancelDispatch(String messageId, @Nullable String reason) {
        PendingDispatch pending = takePending(messageId);
        if (pending == null) {
            logger.debug("no open dispatch span for message {}", messageId);
            return;
        }
        pending.span.setCancelled(reason != null ? reason : "cancelled");
        pending.span.end();
    }

    /**
     * Dispatches a message through {@code bus} and ends its dispatch span when the returned
     * future settles. Cancelling the returned future ends the span as cancelled.
     *
     * @param bus sends the enriched message and returns the pending result
     * @return the future returned by {@code bus}
     */
    public <R> CompletableFuture<R> dispatch(TracedMessage message,
                                             Function<TracedMessage, CompletableFuture<R>> bus) {
        if (!isTracing(message.getKind())) {
            return bus.apply(message);
        }
        TracedMessage enriched = wrapDispatch(message);
        if (!message.getKind().isRequestResponse()) {
            return bus.apply(enriched);
        }

        String messageId = message.getIdentifier();
        CompletableFuture<R> future;
        try {
            future = bus.apply(enriched);
        } catch (RuntimeException | Error e) {
            failDispatch(messageId, e);
            throw e;
        }
        if (future == null) {
            completeDispatch(messageId, null);
            return null;
        }
        future.whenComplete((result, error) -> {
            if (error == null) {
                completeDispatch(messageId, result);
            } else {
                failDispatch(messageId, error);
            }
        });
        return future;
    }

    public int getPendingDispatchCount() {
        synchronized (pendingDispatches) {
            return pendingDispatches.size();
        }
    }

    /**
     * Ends every open dispatch span that has waited at least the configured dispatch
     * timeout. Also runs on its own, at most once a second, as commands and queries are
     * dispatched.
     *
     * @return the number of spans ended
     */
    public int expireStaleDispatches() {
        Instant now = clock.instant();
        lastSweep = now;
        Instant cutoff = now.minus(configuration.getDispatchTimeout());
        List<PendingDispatch> expired = new ArrayList<>();
        synchronized (pendingDispatches) {
            Iterator<PendingDispatch> oldest = pendingDispatches.values().iterator();
            while (oldest.hasNext()) {
                PendingDispatch pending = oldest.next();
                if (pending.startedAt.isAfter(cutoff)) {
                    break;
                }
                expired.add(pending);
                oldest.remove();
            }
        }
        if (!expired.isEmpty()) {
            logger.warn("{} open dispatch spans timed out after {}", expired.size(), configuration.getDispatchTimeout());
            expired.forEach(pending -> expire(pending, TIMEOUT_REASON, TracingMetricsRecorder.EXPIRY_REASON_TIMEOUT));
        }
        return expired.size();
    }

    private void sweepIfDue() {
        Instant last = lastSweep;
        if (last == null || !clock.instant().isBefore(last.plus(SWEEP_INTERVAL))) {
            expireStaleDispatches();
        }
    }

    private void expire(PendingDispatch pending, String reason, String metricReason) {
        pending.span.setCancelled(reason);
        pending.span.end();
        metricsRecorder.recordDispatchExpired(metricReason);
    }

    @Nullable
    private PendingDispatch takePending(String messageId) {
        synchronized (pendingDispatches) {
            return pendingDispatches.remove(messageId);
        }
    }

    // ---------------------------------------------------------------------
    // Handler flow
    // ---------------------------------------------------------------------

    /**
     * Runs {@code next} inside a handler span.
     *
     * @param handlerId identifies the handler, recorded as {@code message.handler}
     * @return whatever {@code next} returned
     * @throws Exception exactly the exception thrown by {@code next}
     */
    @Nullable
    public Object wrapHandler(TracedMessage message, String handlerId, MessageHandler next) throws Exception {
        if (!isTracing(message.getKind())) {
            return next.handle(message);
        }
        TracingSpan span = startHandlerSpan(message, handlerId);
        if (span == null) {
            return next.handle(message);
        }

        CorrelationContext correlation = handlerCorrelation(message, span);
        long startNanos = System.nanoTime();
        try (TracingScope ignored = span.makeCurrent();
             TracingScope ignoredCorrelation = ActiveContext.makeCurrent(correlation)) {
            Object result = next.handle(message);
            if (message.getKind().isRequestResponse()) {
                resultEnricher.enrich(span, result);
            }
            span.setSuccess();
            return result;
        } catch (InterruptedException | CancellationException e) {
            span.setCancelled(e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName());
            throw e;
        } catch (Exception | Error e) {
            errorCorrelator.recordException(span, e, message);
            throw e;
        } finally {
            span.setAttribute(SpanAttributes.MESSAGE_DURATION_NS, System.nanoTime() - startNanos);
            span.end();
        }
    }

    /**
     * Runs an asynchronous handler inside a handler span that ends when the returned future
     * settles.
     *
     * The span is current only while {@code next} builds its future. Continuations that
     * need it must carry it over with {@link ActiveContext#capture()} or
     * {@link ActiveContext#wrap(java.util.concurrent.Executor)}.
     *
     * @return the future returned by {@code next}
     */
    public <R> CompletableFuture<R> wrapAsyncHandler(TracedMessage message,
                                                     String handlerId,
                                                     AsyncMessageHandler<R> next) {
        if (!isTracing(message.getKind())) {
            return next.handle(message);
        }
        TracingSpan span = startHandlerSpan(message, handlerId);
        if (span == null) {
            return next.handle(message);
        }

        CorrelationContext correlation = handlerCorrelation(message, span);
        long startNanos = System.nanoTime();
        CompletableFuture<R> future;
        try (TracingScope ignored = span.makeCurrent();
             TracingScope ignoredCorrelation = ActiveContext.makeCurrent(correlation)) {
            future = next.handle(message);
        } catch (RuntimeException | Error e) {
            finishAsyncHandler(span, message, startNanos, null, e);
            throw e;
        }
        if (future == null) {
            finishAsyncHandler(span, message, startNanos, null, null);
            return null;
        }
        future.whenComplete((result, error) -> finishAsyncHandler(span, message, startNanos, result, error));
        return future;
    }

    /**
     * Stops tracing. Open dispatch spans are ended as cancelled and every later call
     * passes messages through untraced. Calling it again has no effect.
     */
    public void shutdown() {
        if (!shutdown.compareAndSet(false, true)) {
            return;
        }
        List<PendingDispatch> open;
        synchronized (pendingDispatches) {
            open = new ArrayList<>(pendingDispatches.values());
            pendingDispatches.clear();
        }
        for (PendingDispatch pending : open) {
            pending.span.setCancelled(SHUTDOWN_REASON);
            pending.span.end();
        }
        logger.info("message tracing shut down, {} open dispatch spans cancelled", open.size());
    }

    public boolean isShutdown() {
        return shutdown.get();
    }

    @Nullable
    private TracingSpan startHandlerSpan(TracedMessage message, String handlerId) {
        try {
            Optional<TraceContext> parent = propagator.extract(message.getMetadata());
            return spanFactory.createHandlerSpan(message, handlerId, parent);
        } catch (RuntimeException e) {
            logger.warn("failed to create handler span for message {}, handling untraced: {}",
                    message.getIdentifier(), e.getMessage());
            return null;
        }
    }

    private CorrelationContext handlerCorrelation(TracedMessage message, TracingSpan span) {
        if (!configuration.isPropagateCorrelationIds()) {
            return CorrelationContext.EMPTY;
        }
        CorrelationContext correlation = correlationPropagator.extract(message.getMetadata());
        correlationPropagator.applyAttributes(span, correlation);
        return correlation;
    }

    private void finishAsyncHandler(TracingSpan span,
                                    TracedMessage message,
                                    long startNanos,
                                    @Nullable Object result,
                                    @Nullable Throwable error) {
        try {
            if (error == null) {
                if (message.getKind().isRequestResponse()) {
                    resultEnricher.enrich(span, result);
                }
                span.setSuccess();
            } else {
                Throwable cause = unwrap(error);
                if (cause instanceof CancellationException) {
                    span.setCancelled(cause.getMessage() != null ? cause.getMessage() : "cancelled");
                } else {
                    errorCorrelator.recordException(span, cause, message);
                }
            }
            span.setAttribute(SpanAttributes.MESSAGE_DURATION_NS, System.nanoTime() - startNanos);
        } finally {
            span.end();
        }
    }

    private static Throwable unwrap(Throwable error) {
        Throwable current = error;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    private static final class PendingDispatch {

        private final TracingSpan span;
        private final TracedMessage message;
        private final Instant startedAt;

        private PendingDispatch(TracingSpan span, TracedMessage message, Instant startedAt) {
            this.span = span;
            this.message = message;
            this.startedAt = startedAt;
        }
    }
}
