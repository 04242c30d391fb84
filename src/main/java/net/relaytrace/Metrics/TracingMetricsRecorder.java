package net.relaytrace.Metrics;

/**
 * Interface responsible for recording tracing-core metrics.
 * Decouples the core from specific metrics implementations like Micrometer.
 */
public interface TracingMetricsRecorder {

    /** Tag value for spans rejected because the export queue was full. */
    String DROP_REASON_QUEUE_FULL = "queue_full";

    /** Tag value for spans submitted after the export queue was closed. */
    String DROP_REASON_CLOSED = "closed";

    /** Tag value for dispatch spans that waited longer than the dispatch timeout. */
    String EXPIRY_REASON_TIMEOUT = "timeout";

    /** Tag value for dispatch spans cancelled because too many were pending. */
    String EXPIRY_REASON_OVERFLOW = "overflow";

    /**
     * Records a span accepted by the export hand-off queue.
     *
     * @param messageKind the message-kind tag of the span, or "unknown"
     */
    void recordSpanExported(String messageKind);

    /**
     * Records a span the export hand-off queue could not accept.
     *
     * @param reason one of the DROP_REASON constants
     */
    void recordSpanDropped(String reason);

    /**
     * Records a span rejected by the export filter.
     */
    void recordSpanFiltered();

    /**
     * Records a failure of an attribute provider.
     *
     * @param provider the provider's simple class name
     */
    void recordProviderFailure(String provider);

    /**
     * Records a failure while forwarding an error to the error-monitoring backend.
     */
    void recordErrorReportFailure();

    /**
     * Records a carrier that held a malformed trace context.
     */
    void recordPropagationFailure();

    /**
     * Records a command or query dispatch span that was ended without its result arriving.
     *
     * @param reason one of the EXPIRY_REASON constants
     */
    void recordDispatchExpired(String reason);

    /**
     * Checks if metrics recording is available.
     *
     * @return true if metrics recording is enabled and available
     */
    boolean isAvailable();
}
