package net.relaytrace.Config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Configuration properties for message tracing.
 * These properties can be configured in application.properties with the prefix "relaytrace.tracing".
 */
@ConfigurationProperties(prefix = "relaytrace.tracing")
public class TracingProperties {

    /**
     * Enable or disable tracing globally.
     * Default: true
     */
    private boolean enabled = true;

    private boolean traceCommands = true;

    private boolean traceEvents = true;

    private boolean traceQueries = true;

    /**
     * Payload capture is off by default for every kind, payloads may hold personal data.
     */
    private boolean captureCommandPayloads = false;

    private boolean captureEventPayloads = false;

    private boolean captureQueryPayloads = false;

    /**
     * Captured payloads and string results longer than this are truncated.
     * Default: 1000
     */
    private int maxPayloadLength = TracingConfiguration.DEFAULT_MAX_PAYLOAD_LENGTH;

    /**
     * Fraction of new traces that are sampled, between 0.0 and 1.0.
     * Default: 1.0
     */
    private double sampleRate = 1.0;

    /**
     * Upper bound on new sampled traces per second. Unset means no limit.
     */
    private Double tracesPerSecond;

    /**
     * How the probability and rate limit samplers are combined.
     * Default: AND
     */
    private CombineStrategy samplerCombineStrategy = CombineStrategy.AND;

    /**
     * Capacity of the bounded queue between the core and the exporter.
     * Default: 2048
     */
    private int exportQueueCapacity = TracingConfiguration.DEFAULT_EXPORT_QUEUE_CAPACITY;

    private boolean attachStacktrace = true;

    private String serviceName = TracingConfiguration.DEFAULT_SERVICE_NAME;

    /**
     * Upper bound on command and query dispatch spans waiting for their result.
     * Default: 10000
     */
    private int maxPendingDispatches = TracingConfiguration.DEFAULT_MAX_PENDING_DISPATCHES;

    /**
     * A dispatch span still waiting for its result after this long is ended as timed out.
     * Default: 5m
     */
    private Duration dispatchTimeout = TracingConfiguration.DEFAULT_DISPATCH_TIMEOUT;

    /**
     * Attach correlationId and transactionId metadata to outgoing messages.
     * Default: true
     */
    private boolean propagateCorrelationIds = true;

    // Getters and Setters

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public boolean isTraceCommands() {
        return traceCommands;
    }

    public void setTraceCommands(boolean traceCommands) {
        this.traceCommands = traceCommands;
    }

    public boolean isTraceEvents() {
        return traceEvents;
    }

    public void setTraceEvents(boolean traceEvents) {
        this.traceEvents = traceEvents;
    }

    public boolean isTraceQueries() {
        return traceQueries;
    }

    public void setTraceQueries(boolean traceQueries) {
        this.traceQueries = traceQueries;
    }

    public boolean isCaptureCommandPayloads() {
        return captureCommandPayloads;
    }

    public void setCaptureCommandPayloads(boolean captureCommandPayloads) {
        this.captureCommandPayloads = captureCommandPayloads;
    }

    public boolean isCaptureEventPayloads() {
        return captureEventPayloads;
    }

    public void setCaptureEventPayloads(boolean captureEventPayloads) {
        this.captureEventPayloads = captureEventPayloads;
    }

    public boolean isCaptureQueryPayloads() {
        return captureQueryPayloads;
    }

    public void setCaptureQueryPayloads(boolean captureQueryPayloads) {
        this.captureQueryPayloads = captureQueryPayloads;
    }

    public int getMaxPayloadLength() {
        return maxPayloadLength;
    }

    public void setMaxPayloadLength(int maxPayloadLength) {
        this.maxPayloadLength = maxPayloadLength;
    }

    public double getSampleRate() {
        return sampleRate;
    }

    public void setSampleRate(double sampleRate) {
        this.sampleRate = sampleRate;
    }

    public Double getTracesPerSecond() {
        return tracesPerSecond;
    }

    public void setTracesPerSecond(Double tracesPerSecond) {
        this.tracesPerSecond = tracesPerSecond;
    }

    public CombineStrategy getSamplerCombineStrategy() {
        return samplerCombineStrategy;
    }

    public void setSamplerCombineStrategy(CombineStrategy samplerCombineStrategy) {
        this.samplerCombineStrategy = samplerCombineStrategy;
    }

    public int getExportQueueCapacity() {
        return exportQueueCapacity;
    }

    public void setExportQueueCapacity(int exportQueueCapacity) {
        this.exportQueueCapacity = exportQueueCapacity;
    }

    public boolean isAttachStacktrace() {
        return attachStacktrace;
    }

    public void setAttachStacktrace(boolean attachStacktrace) {
        this.attachStacktrace = attachStacktrace;
    }

    public String getServiceName() {
        return serviceName;
    }

    public void setServiceName(String serviceName) {
        this.serviceName = serviceName;
    }

    public int getMaxPendingDispatches() {
        return maxPendingDispatches;
    }

    public void setMaxPendingDispatches(int maxPendingDispatches) {
        this.maxPendingDispatches = maxPendingDispatches;
    }

    public Duration getDispatchTimeout() {
        return dispatchTimeout;
    }

    public void setDispatchTimeout(Duration dispatchTimeout) {
        this.dispatchTimeout = dispatchTimeout;
    }

    public boolean isPropagateCorrelationIds() {
        return propagateCorrelationIds;
    }

    public void setPropagateCorrelationIds(boolean propagateCorrelationIds) {
        this.propagateCorrelationIds = propagateCorrelationIds;
    }

    /**
     * Converts the bound properties into a validated configuration.
     *
     * @throws ConfigurationException if tracing is enabled and a setting is invalid
     */
    public TracingConfiguration toTracingConfiguration() {
        return TracingConfiguration.builder()
                .enabled(enabled)
                .traceCommands(traceCommands)
                .traceEvents(traceEvents)
                .traceQueries(traceQueries)
                .captureCommandPayloads(captureCommandPayloads)
                .captureEventPayloads(captureEventPayloads)
                .captureQueryPayloads(captureQueryPayloads)
                .maxPayloadLength(maxPayloadLength)
                .sampleRate(sampleRate)
                .tracesPerSecond(tracesPerSecond)
                .samplerCombineStrategy(samplerCombineStrategy)
                .exportQueueCapacity(exportQueueCapacity)
                .attachStacktrace(attachStacktrace)
                .serviceName(serviceName)
                .maxPendingDispatches(maxPendingDispatches)
                .dispatchTimeout(dispatchTimeout)
                .propagateCorrelationIds(propagateCorrelationIds)
                .build();
    }

    @Override
    public String toString() {
        return "TracingProperties{" +
                "enabled=" + enabled +
                ", traceCommands=" + traceCommands +
                ", traceEvents=" + traceEvents +
                ", traceQueries=" + traceQueries +
                ", maxPayloadLength=" + maxPayloadLength +
                ", sampleRate=" + sampleRate +
                ", tracesPerSecond=" + tracesPerSecond +
                ", exportQueueCapacity=" + exportQueueCapacity +
                ", serviceName=" + serviceName +
                ", maxPendingDispatches=" + maxPendingDispatches +
                ", dispatchTimeout=" + dispatchTimeout +
                '}';
    }
}
