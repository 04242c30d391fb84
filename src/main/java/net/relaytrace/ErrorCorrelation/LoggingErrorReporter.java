package net.relaytrace.ErrorCorrelation;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * Default {@link ErrorReporter}: writes the error to the log with {@code trace_id} and
 * {@code span_id} in the MDC, so log aggregation can join it with the trace.
 */
public class LoggingErrorReporter implements ErrorReporter {

    private static final Logger logger = LoggerFactory.getLogger(LoggingErrorReporter.class);

    public static final String MDC_TRACE_ID = "trace_id";
    public static final String MDC_SPAN_ID = "span_id";

    @Override
    public void reportError(ErrorReport report) {
        String previousTraceId = MDC.get(MDC_TRACE_ID);
        String previousSpanId = MDC.get(MDC_SPAN_ID);
        MDC.put(MDC_TRACE_ID, report.getTraceId());
        MDC.put(MDC_SPAN_ID, report.getSpanId());
        try {
            logger.error("message handling failed: {}: {} fingerprint={} tags={} metadata={}",
                    report.getErrorType(), report.getErrorMessage(), report.getFingerprint(), report.getTags(),
                    report.getMetadata());
        } finally {
            restore(MDC_TRACE_ID, previousTraceId);
            restore(MDC_SPAN_ID, previousSpanId);
        }
    }

    private static void restore(String key, String previous) {
        if (previous == null) {
            MDC.remove(key);
        } else {
            MDC.put(key, previous);
        }
    }
}
