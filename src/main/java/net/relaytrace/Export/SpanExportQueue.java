package net.relaytrace.Export;

import net.relaytrace.Metrics.NoOpTracingMetricsRecorder;
import net.relaytrace.Metrics.TracingMetricsRecorder;
import net.relaytrace.Tracing.AttributeValue;
import net.relaytrace.Tracing.SpanAttributes;
import net.relaytrace.Tracing.TracingSpan;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.lang.Nullable;

import java.util.Collection;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Bounded hand-off between the tracing core and an external exporter.
 *
 * Producers never wait: when the queue is full the span being submitted is dropped and
 * counted, spans already queued are kept. Exporters pull with {@link #poll(long, TimeUnit)}
 * or {@link #drainTo(Collection, int)}.
 */
public class SpanExportQueue implements SpanSink {

    private static final Logger logger = LoggerFactory.getLogger(SpanExportQueue.class);

    static final long DROP_LOG_INTERVAL = 1000;

    private final BlockingQueue<TracingSpan> queue;
    private final int capacity;
    private final TracingMetricsRecorder metricsRecorder;
    private final AtomicLong droppedCount = new AtomicLong();
    private final AtomicBoolean closed = new AtomicBoolean(false);

    public SpanExportQueue(int capacity) {
        this(capacity, NoOpTracingMetricsRecorder.INSTANCE);
    }

    public SpanExportQueue(int capacity, TracingMetricsRecorder metricsRecorder) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be positive");
        }
        this.queue = new ArrayBlockingQueue<>(capacity);
        this.capacity = capacity;
        this.metricsRecorder = metricsRecorder;
    }

    @Override
    public void submit(TracingSpan span) {
        if (span == null) {
            return;
        }
        if (closed.get()) {
            drop(span, TracingMetricsRecorder.DROP_REASON_CLOSED);
            return;
        }
        if (queue.offer(span)) {
            metricsRecorder.recordSpanExported(kindTagOf(span));
        } else {
            drop(span, TracingMetricsRecorder.DROP_REASON_QUEUE_FULL);
        }
    }

    /**
     * Waits up to {@code timeout} for the next span.
     *
     * @return the span, or null if none arrived in time
     */
    @Nullable
    public TracingSpan poll(long timeout, TimeUnit unit) throws InterruptedException {
        return queue.poll(timeout, unit);
    }

    /**
     * Moves up to {@code maxSpans} queued spans into {@code target} without waiting.
     *
     * @return the number of spans moved
     */
    public int drainTo(Collection<? super TracingSpan> target, int maxSpans) {
        return queue.drainTo(target, maxSpans);
    }

    /**
     * Stops accepting spans. Spans already queued can still be drained.
     */
    public void close() {
        if (closed.compareAndSet(false, true)) {
            logger.info("span export queue closed with {} queued and {} dropped spans", queue.size(), droppedCount.get());
        }
    }

    public boolean isClosed() {
        return closed.get();
    }

    public long getDroppedCount() {
        return droppedCount.get();
    }

    public int size() {
        return queue.size();
    }

    public int remainingCapacity() {
        return queue.remainingCapacity();
    }

    public int getCapacity() {
        return capacity;
    }

    private void drop(TracingSpan span, String reason) {
        long dropped = droppedCount.incrementAndGet();
        metricsRecorder.recordSpanDropped(reason);
        if (dropped == 1 || dropped % DROP_LOG_INTERVAL == 0) {
            logger.warn("dropped span {} ({}), reason: {}, total dropped: {}",
                    span.getName(), span.getSpanId(), reason, dropped);
        } else {
            logger.debug("dropped span {} ({}), reason: {}", span.getName(), span.getSpanId(), reason);
        }
    }

    private static String kindTagOf(TracingSpan span) {
        AttributeValue tag = span.getAttribute(SpanAttributes.MESSAGE_KIND);
        return tag != null ? tag.asString() : "unknown";
    }
}
