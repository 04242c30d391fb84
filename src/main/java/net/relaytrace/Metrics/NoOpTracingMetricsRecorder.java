package net.relaytrace.Metrics;

/**
 * No-Op implementation of TracingMetricsRecorder.
 * Used when no MeterRegistry is available.
 */
public class NoOpTracingMetricsRecorder implements TracingMetricsRecorder {

    /** Singleton instance to avoid creating many no-op objects */
    public static final NoOpTracingMetricsRecorder INSTANCE = new NoOpTracingMetricsRecorder();

    @Override
    public void recordSpanExported(String messageKind) {
        // No-Op
    }

    @Override
    public void recordSpanDropped(String reason) {
        // No-Op
    }

    @Override
    public void recordSpanFiltered() {
        // No-Op
    }

    @Override
    public void recordProviderFailure(String provider) {
        // No-Op
    }

    @Override
    public void recordErrorReportFailure() {
        // No-Op
    }

    @Override
    public void recordPropagationFailure() {
        // No-Op
    }

    @Override
    public void recordDispatchExpired(String reason) {
        // No-Op
    }

    @Override
    public boolean isAvailable() {
        return false;
    }
}
