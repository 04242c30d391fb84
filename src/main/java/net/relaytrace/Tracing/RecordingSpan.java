package net.relaytrace.Tracing;

import io.opentelemetry.api.trace.SpanKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.lang.Nullable;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * In-memory {@link TracingSpan} that records everything until it is ended, then hands
 * itself to a {@link SpanProcessor}.
 *
 * Only the call stack that owns the span mutates it, but the intrinsic lock makes the
 * end transition safe if a completion races with a cancellation.
 */
public class RecordingSpan implements TracingSpan {

    private static final Logger logger = LoggerFactory.getLogger(RecordingSpan.class);

    private final String name;
    private final SpanKind kind;
    private final TraceContext context;
    @Nullable
    private final String parentSpanId;
    private final Clock clock;
    private final boolean attachStacktrace;
    private final SpanProcessor spanProcessor;
    private final Instant startTime;

    private final Map<String, AttributeValue> attributes = new LinkedHashMap<>();
    private final List<ExceptionEvent> exceptionEvents = new ArrayList<>();
    private SpanStatus status = SpanStatus.UNSET;
    @Nullable
    private String statusDescription;
    @Nullable
    private Instant endTime;

    public RecordingSpan(String name,
                         SpanKind kind,
                         TraceContext context,
                         @Nullable String parentSpanId,
                         Clock clock,
                         boolean attachStacktrace,
                         SpanProcessor spanProcessor) {
        this.name = Objects.requireNonNull(name, "name");
        this.kind = Objects.requireNonNull(kind, "kind");
        this.context = Objects.requireNonNull(context, "context");
        this.parentSpanId = parentSpanId;
        this.clock = clock;
        this.attachStacktrace = attachStacktrace;
        this.spanProcessor = spanProcessor;
        this.startTime = clock.instant();
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public SpanKind getKind() {
        return kind;
    }

    @Override
    public String getTraceId() {
        return context.getTraceId();
    }

    @Override
    public String getSpanId() {
        return context.getSpanId();
    }

    @Override
    @Nullable
    public String getParentSpanId() {
        return parentSpanId;
    }

    @Override
    public boolean isSampled() {
        return context.isSampled();
    }

    @Override
    public TraceContext getContext() {
        return context;
    }

    @Override
    public synchronized Map<String, AttributeValue> getAttributes() {
        return Collections.unmodifiableMap(new LinkedHashMap<>(attributes));
    }

    @Override
    @Nullable
    public synchronized AttributeValue getAttribute(String key) {
        return attributes.get(key);
    }

    @Override
    public synchronized SpanStatus getStatus() {
        return status;
    }

    @Override
    @Nullable
    public synchronized String getStatusDescription() {
        return statusDescription;
    }

    @Override
    public synchronized List<ExceptionEvent> getExceptionEvents() {
        return List.copyOf(exceptionEvents);
    }

    @Override
    public Instant getStartTime() {
        return startTime;
    }

    @Override
    @Nullable
    public synchronized Instant getEndTime() {
        return endTime;
    }

    @Override
    public synchronized boolean isEnded() {
        return endTime != null;
    }

    @Override
    public TracingSpan setAttribute(String key, String value) {
        if (value == null) {
            return this;
        }
        return setAttribute(key, AttributeValue.of(value));
    }

    @Override
    public TracingSpan setAttribute(String key, long value) {
        return setAttribute(key, AttributeValue.of(value));
    }

    @Override
    public TracingSpan setAttribute(String key, int value) {
        return setAttribute(key, AttributeValue.of((long) value));
    }

    @Override
    public TracingSpan setAttribute(String key, double value) {
        return setAttribute(key, AttributeValue.of(value));
    }

    @Override
    public TracingSpan setAttribute(String key, boolean value) {
        return setAttribute(key, AttributeValue.of(value));
    }

    @Override
    public synchronized TracingSpan setAttribute(String key, AttributeValue value) {
        if (isEndedForMutation("setAttribute")) {
            return this;
        }
        if (key != null && value != null) {
            attributes.put(key, value);
        }
        return this;
    }

    @Override
    public synchronized TracingSpan recordException(Throwable exception) {
        if (isEndedForMutation("recordException")) {
            return this;
        }
        exceptionEvents.add(ExceptionEvent.of(exception, clock.instant(), attachStacktrace));
        return this;
    }

    @Override
    public TracingSpan setSuccess() {
        return setStatus(SpanStatus.OK, null);
    }

    @Override
    public TracingSpan setError(@Nullable String description) {
        return setStatus(SpanStatus.ERROR, description);
    }

    @Override
    public TracingSpan setCancelled(@Nullable String description) {
        return setStatus(SpanStatus.CANCELLED, description);
    }

    private synchronized TracingSpan setStatus(SpanStatus newStatus, @Nullable String description) {
        if (isEndedForMutation("setStatus")) {
            return this;
        }
        this.status = newStatus;
        this.statusDescription = description;
        return this;
    }

    @Override
    public boolean end() {
        synchronized (this) {
            if (endTime != null) {
                logger.debug("span {} ({}) already ended", name, context.getSpanId());
                return false;
            }
            endTime = clock.instant();
        }
        try {
            spanProcessor.onEnd(this);
        } catch (RuntimeException e) {
            logger.warn("span processor failed for span {} ({}): {}", name, context.getSpanId(), e.getMessage());
        }
        return true;
    }

    private boolean isEndedForMutation(String operation) {
        if (endTime != null) {
            logger.debug("ignoring {} on ended span {} ({})", operation, name, context.getSpanId());
            return true;
        }
        return false;
    }

    @Override
    public String toString() {
        return "RecordingSpan{" +
                "name='" + name + '\'' +
                ", kind=" + kind +
                ", traceId=" + context.getTraceId() +
                ", spanId=" + context.getSpanId() +
                ", parentSpanId=" + parentSpanId +
                ", status=" + getStatus() +
                '}';
    }
}
