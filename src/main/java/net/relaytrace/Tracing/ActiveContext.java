package net.relaytrace.Tracing;

import io.opentelemetry.context.Context;
import io.opentelemetry.context.ContextKey;
import io.opentelemetry.context.Scope;

import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.Executor;

/**
 * Scoped access to the trace context of the span currently being processed.
 *
 * The value lives in an OpenTelemetry {@link Context} under a private key, so it nests
 * and unwinds like any other OTel context entry: {@link #makeCurrent(TraceContext)}
 * pushes, closing the returned scope pops. Crossing a thread or continuation boundary
 * requires carrying the value explicitly with {@link #capture()} or one of the
 * {@code wrap} helpers.
 */
public final class ActiveContext {

    private static final ContextKey<TraceContext> TRACE_CONTEXT_KEY = ContextKey.named("relaytrace-trace-context");
    private static final ContextKey<CorrelationContext> CORRELATION_KEY = ContextKey.named("relaytrace-correlation");

    private ActiveContext() {
    }

    public static Optional<TraceContext> current() {
        return Optional.ofNullable(Context.current().get(TRACE_CONTEXT_KEY));
    }

    /**
     * Makes {@code traceContext} current until the returned scope is closed.
     */
    public static TracingScope makeCurrent(TraceContext traceContext) {
        Scope scope = Context.current().with(TRACE_CONTEXT_KEY, traceContext).makeCurrent();
        return new OpenTelemetryTracingScope(scope);
    }

    /**
     * The correlation ids of the message currently being handled, if any.
     */
    public static Optional<CorrelationContext> currentCorrelation() {
        return Optional.ofNullable(Context.current().get(CORRELATION_KEY));
    }

    /**
     * Makes {@code correlation} current until the returned scope is closed.
     */
    public static TracingScope makeCurrent(CorrelationContext correlation) {
        Scope scope = Context.current().with(CORRELATION_KEY, correlation).makeCurrent();
        return new OpenTelemetryTracingScope(scope);
    }

    /**
     * Captures the current context as a value that can be re-entered later, possibly
     * on another thread.
     */
    public static CapturedContext capture() {
        return new CapturedContext(Context.current());
    }

    public static Runnable wrap(Runnable runnable) {
        return Context.current().wrap(runnable);
    }

    public static <T> Callable<T> wrap(Callable<T> callable) {
        return Context.current().wrap(callable);
    }

    /**
     * Returns an executor that runs every task inside the context that was current
     * when the task was submitted.
     */
    public static Executor wrap(Executor executor) {
        return Context.taskWrapping(executor);
    }

    /**
     * A snapshot of the active context that can be carried across an asynchronous
     * boundary and re-entered with {@link #enter()}.
     */
    public static final class CapturedContext {

        private final Context context;

        private CapturedContext(Context context) {
            this.context = context;
        }

        public Optional<TraceContext> traceContext() {
            return Optional.ofNullable(context.get(TRACE_CONTEXT_KEY));
        }

        public TracingScope enter() {
            return new OpenTelemetryTracingScope(context.makeCurrent());
        }
    }

    private static final class OpenTelemetryTracingScope implements TracingScope {

        private final Scope scope;

        private OpenTelemetryTracingScope(Scope scope) {
            this.scope = scope;
        }

        @Override
        public void close() {
            scope.close();
        }
    }
}
