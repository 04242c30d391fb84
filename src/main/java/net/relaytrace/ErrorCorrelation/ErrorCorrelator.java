package net.relaytrace.ErrorCorrelation;

import net.relaytrace.Message.MessageKind;
import net.relaytrace.Message.TracedMessage;
import net.relaytrace.Metrics.NoOpTracingMetricsRecorder;
import net.relaytrace.Metrics.TracingMetricsRecorder;
import net.relaytrace.Propagation.TraceContextPropagator;
import net.relaytrace.Tracing.CorrelationContext;
import net.relaytrace.Tracing.SpanAttributes;
import net.relaytrace.Tracing.TracingSpan;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.lang.Nullable;

import java.util.List;

/**
 * Records a failure on its span and forwards it to the error-monitoring backend with the
 * span's ids attached.
 *
 * The span side always happens. The forwarding side is best effort: whatever goes wrong
 * there is logged and counted, never thrown back into the message flow.
 */
public class ErrorCorrelator {

    private static final Logger logger = LoggerFactory.getLogger(ErrorCorrelator.class);

    private final ErrorReporter errorReporter;
    private final ErrorFingerprintGenerator fingerprintGenerator;
    private final TracingMetricsRecorder metricsRecorder;

    public ErrorCorrelator(ErrorReporter errorReporter) {
        this(errorReporter, new ErrorFingerprintGenerator(), NoOpTracingMetricsRecorder.INSTANCE);
    }

    public ErrorCorrelator(ErrorReporter errorReporter,
                           ErrorFingerprintGenerator fingerprintGenerator,
                           TracingMetricsRecorder metricsRecorder) {
        this.errorReporter = errorReporter;
        this.fingerprintGenerator = fingerprintGenerator;
        this.metricsRecorder = metricsRecorder;
    }

    public void recordException(TracingSpan span, Throwable error) {
        recordException(span, error, null);
    }

    /**
     * @param message the message being processed, used for report tags; may be null
     */
    public void recordException(TracingSpan span, Throwable error, @Nullable TracedMessage message) {
        String description = error.getMessage() != null ? error.getMessage() : error.getClass().getSimpleName();
        span.recordException(error);
        span.setError(description);
        span.setAttribute(SpanAttributes.ERROR, true);
        span.setAttribute(SpanAttributes.ERROR_TYPE, error.getClass().getName());
        span.setAttribute(SpanAttributes.ERROR_MESSAGE, description);

        try {
            errorReporter.reportError(buildReport(span, error, message));
        } catch (Exception | LinkageError e) {
            // a reporter built against a missing backend class fails with NoClassDefFoundError
            metricsRecorder.recordErrorReportFailure();
            logger.warn("failed to forward error for trace {} span {}: {}",
                    span.getTraceId(), span.getSpanId(), e.getMessage());
        }
    }

    private ErrorReport buildReport(TracingSpan span, Throwable error, @Nullable TracedMessage message) {
        MessageKind kind = message != null ? message.getKind() : null;
        List<String> fingerprint = fingerprintGenerator.generateFingerprint(error, kind);
        ErrorReport.ErrorReportBuilder report = ErrorReport.builder()
                .traceId(span.getTraceId())
                .spanId(span.getSpanId())
                .sampled(span.isSampled())
                .errorType(error.getClass().getName())
                .errorMessage(error.getMessage())
                .fingerprint(fingerprint)
                .throwable(error);
        if (message != null) {
            report.tag(SpanAttributes.MESSAGE_KIND, message.getKind().getTag());
            report.tag(SpanAttributes.MESSAGING_MESSAGE_ID, message.getIdentifier());
            if (message.getName() != null) {
                report.tag(SpanAttributes.MESSAGE_NAME, message.getName());
            }
            CorrelationContext correlation = CorrelationContext.fromMetadata(message.getMetadata());
            if (correlation.getCorrelationId() != null) {
                report.tag(SpanAttributes.CORRELATION_ID, correlation.getCorrelationId());
            }
            if (correlation.getTransactionId() != null) {
                report.tag(SpanAttributes.TRANSACTION_ID, correlation.getTransactionId());
            }
            message.getMetadata().forEach((key, value) -> {
                if (!TraceContextPropagator.TRACEPARENT.equals(key) && !TraceContextPropagator.BAGGAGE.equals(key)) {
                    report.metadataEntry(key, value);
                }
            });
        }
        return report.build();
    }
}
