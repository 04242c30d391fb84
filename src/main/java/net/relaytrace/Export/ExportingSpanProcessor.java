package net.relaytrace.Export;

import net.relaytrace.Filter.SpanFilter;
import net.relaytrace.Metrics.NoOpTracingMetricsRecorder;
import net.relaytrace.Metrics.TracingMetricsRecorder;
import net.relaytrace.Tracing.SpanProcessor;
import net.relaytrace.Tracing.TracingSpan;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs the export filter on every ended span and submits the accepted ones to a sink.
 */
public class ExportingSpanProcessor implements SpanProcessor {

    private static final Logger logger = LoggerFactory.getLogger(ExportingSpanProcessor.class);

    private final SpanFilter filter;
    private final SpanSink sink;
    private final TracingMetricsRecorder metricsRecorder;

    public ExportingSpanProcessor(SpanFilter filter, SpanSink sink) {
        this(filter, sink, NoOpTracingMetricsRecorder.INSTANCE);
    }

    public ExportingSpanProcessor(SpanFilter filter, SpanSink sink, TracingMetricsRecorder metricsRecorder) {
        this.filter = filter;
        this.sink = sink;
        this.metricsRecorder = metricsRecorder;
    }

    @Override
    public void onEnd(TracingSpan span) {
        boolean export;
        try {
            export = filter.shouldExport(span);
        } catch (RuntimeException e) {
            logger.warn("span filter failed for span {} ({}), exporting anyway: {}",
                    span.getName(), span.getSpanId(), e.getMessage());
            export = true;
        }
        if (!export) {
            metricsRecorder.recordSpanFiltered();
            logger.debug("span {} ({}) filtered out", span.getName(), span.getSpanId());
            return;
        }
        try {
            sink.submit(span);
        } catch (RuntimeException e) {
            logger.warn("span sink rejected span {} ({}): {}", span.getName(), span.getSpanId(), e.getMessage());
        }
    }
}
