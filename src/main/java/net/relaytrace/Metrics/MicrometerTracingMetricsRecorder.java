package net.relaytrace.Metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Micrometer-based implementation of TracingMetricsRecorder.
 */
public class MicrometerTracingMetricsRecorder implements TracingMetricsRecorder {

    private static final Logger logger = LoggerFactory.getLogger(MicrometerTracingMetricsRecorder.class);

    static final String SPANS_EXPORTED = "relaytrace.spans.exported";
    static final String SPANS_DROPPED = "relaytrace.spans.dropped";
    static final String SPANS_FILTERED = "relaytrace.spans.filtered";
    static final String PROVIDER_FAILURES = "relaytrace.provider.failures";
    static final String ERROR_REPORT_FAILURES = "relaytrace.error_report.failures";
    static final String PROPAGATION_FAILURES = "relaytrace.propagation.failures";
    static final String DISPATCHES_EXPIRED = "relaytrace.dispatches.expired";

    private final MeterRegistry meterRegistry;

    public MicrometerTracingMetricsRecorder(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;
    }

    @Override
    public void recordSpanExported(String messageKind) {
        try {
            Counter.builder(SPANS_EXPORTED)
                    .tag("kind", messageKind)
                    .register(meterRegistry)
                    .increment();
        } catch (Exception e) {
            logger.warn("failed to record exported span metric for kind {}: {}", messageKind, e.getMessage());
        }
    }

    @Override
    public void recordSpanDropped(String reason) {
        try {
            Counter.builder(SPANS_DROPPED)
                    .tag("reason", reason)
                    .register(meterRegistry)
                    .increment();
        } catch (Exception e) {
            logger.warn("failed to record dropped span metric for reason {}: {}", reason, e.getMessage());
        }
    }

    @Override
    public void recordSpanFiltered() {
        try {
            Counter.builder(SPANS_FILTERED)
                    .register(meterRegistry)
                    .increment();
        } catch (Exception e) {
            logger.warn("failed to record filtered span metric: {}", e.getMessage());
        }
    }

    @Override
    public void recordProviderFailure(String provider) {
        try {
            Counter.builder(PROVIDER_FAILURES)
                    .tag("provider", provider)
                    .register(meterRegistry)
                    .increment();
        } catch (Exception e) {
            logger.warn("failed to record provider failure metric for {}: {}", provider, e.getMessage());
        }
    }

    @Override
    public void recordErrorReportFailure() {
        try {
            Counter.builder(ERROR_REPORT_FAILURES)
                    .register(meterRegistry)
                    .increment();
        } catch (Exception e) {
            logger.warn("failed to record error report failure metric: {}", e.getMessage());
        }
    }

    @Override
    public void recordPropagationFailure() {
        try {
            Counter.builder(PROPAGATION_FAILURES)
                    .register(meterRegistry)
                    .increment();
        } catch (Exception e) {
            logger.warn("failed to record propagation failure metric: {}", e.getMessage());
        }
    }

    @Override
    public void recordDispatchExpired(String reason) {
        try {
            Counter.builder(DISPATCHES_EXPIRED)
                    .tag("reason", reason)
                    .register(meterRegistry)
                    .increment();
        } catch (Exception e) {
            logger.warn("failed to record expired dispatch metric for reason {}: {}", reason, e.getMessage());
        }
    }

    @Override
    public boolean isAvailable() {
        return true;
    }
}
