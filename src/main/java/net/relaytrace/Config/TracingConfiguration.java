package net.relaytrace.Config;

import lombok.Getter;
import lombok.ToString;
import net.relaytrace.Message.MessageKind;
import org.springframework.lang.Nullable;

import java.time.Duration;

/**
 * Immutable settings of the tracing core.
 *
 * Build with {@link #builder()}. An enabled configuration is validated by
 * {@link Builder#build()}; a disabled one is accepted as is since nothing reads it.
 */
@Getter
@ToString
public final class TracingConfiguration {

    public static final int DEFAULT_MAX_PAYLOAD_LENGTH = 1000;
    public static final int DEFAULT_EXPORT_QUEUE_CAPACITY = 2048;
    public static final String DEFAULT_SERVICE_NAME = "relaytrace";
    public static final int DEFAULT_MAX_PENDING_DISPATCHES = 10_000;
    public static final Duration DEFAULT_DISPATCH_TIMEOUT = Duration.ofMinutes(5);

    private final boolean enabled;
    private final boolean traceCommands;
    private final boolean traceEvents;
    private final boolean traceQueries;
    private final boolean captureCommandPayloads;
    private final boolean captureEventPayloads;
    private final boolean captureQueryPayloads;
    private final int maxPayloadLength;
    private final double sampleRate;
    /** Maximum new traces per second, or null for no rate limit. */
    @Nullable
    private final Double tracesPerSecond;
    private final CombineStrategy samplerCombineStrategy;
    private final int exportQueueCapacity;
    private final boolean attachStacktrace;
    private final String serviceName;
    /** Open command and query dispatch spans kept at most; the oldest are cancelled beyond it. */
    private final int maxPendingDispatches;
    /** Open dispatch spans older than this are cancelled as timed out. */
    private final Duration dispatchTimeout;
    /** Attach correlation and transaction ids to outgoing messages and their spans. */
    private final boolean propagateCorrelationIds;

    private TracingConfiguration(Builder builder) {
        this.enabled = builder.enabled;
        this.traceCommands = builder.traceCommands;
        this.traceEvents = builder.traceEvents;
        this.traceQueries = builder.traceQueries;
        this.captureCommandPayloads = builder.captureCommandPayloads;
        this.captureEventPayloads = builder.captureEventPayloads;
        this.captureQueryPayloads = builder.captureQueryPayloads;
        this.maxPayloadLength = builder.maxPayloadLength;
        this.sampleRate = builder.sampleRate;
        this.tracesPerSecond = builder.tracesPerSecond;
        this.samplerCombineStrategy = builder.samplerCombineStrategy;
        this.exportQueueCapacity = builder.exportQueueCapacity;
        this.attachStacktrace = builder.attachStacktrace;
        this.serviceName = builder.serviceName;
        this.maxPendingDispatches = builder.maxPendingDispatches;
        this.dispatchTimeout = builder.dispatchTimeout;
        this.propagateCorrelationIds = builder.propagateCorrelationIds;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * A configuration with every default in place.
     */
    public static TracingConfiguration defaults() {
        return builder().build();
    }

    /**
     * A configuration that turns tracing off entirely.
     */
    public static TracingConfiguration disabled() {
        return builder().enabled(false).build();
    }

    public boolean isTraced(MessageKind kind) {
        return switch (kind) {
            case COMMAND -> traceCommands;
            case QUERY -> traceQueries;
            case EVENT -> traceEvents;
        };
    }

    public boolean isPayloadCaptured(MessageKind kind) {
        return switch (kind) {
            case COMMAND -> captureCommandPayloads;
            case QUERY -> captureQueryPayloads;
            case EVENT -> captureEventPayloads;
        };
    }

    public Builder toBuilder() {
        return new Builder()
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
                .propagateCorrelationIds(propagateCorrelationIds);
    }

    public static final class Builder {

        private boolean enabled = true;
        private boolean traceCommands = true;
        private boolean traceEvents = true;
        private boolean traceQueries = true;
        private boolean captureCommandPayloads = false;
        private boolean captureEventPayloads = false;
        private boolean captureQueryPayloads = false;
        private int maxPayloadLength = DEFAULT_MAX_PAYLOAD_LENGTH;
        private double sampleRate = 1.0;
        private Double tracesPerSecond;
        private CombineStrategy samplerCombineStrategy = CombineStrategy.AND;
        private int exportQueueCapacity = DEFAULT_EXPORT_QUEUE_CAPACITY;
        private boolean attachStacktrace = true;
        private String serviceName = DEFAULT_SERVICE_NAME;
        private int maxPendingDispatches = DEFAULT_MAX_PENDING_DISPATCHES;
        private Duration dispatchTimeout = DEFAULT_DISPATCH_TIMEOUT;
        private boolean propagateCorrelationIds = true;

        private Builder() {
        }

        public Builder enabled(boolean enabled) {
            this.enabled = enabled;
            return this;
        }

        public Builder traceCommands(boolean traceCommands) {
            this.traceCommands = traceCommands;
            return this;
        }

        public Builder traceEvents(boolean traceEvents) {
            this.traceEvents = traceEvents;
            return this;
        }

        public Builder traceQueries(boolean traceQueries) {
            this.traceQueries = traceQueries;
            return this;
        }

        public Builder captureCommandPayloads(boolean captureCommandPayloads) {
            this.captureCommandPayloads = captureCommandPayloads;
            return this;
        }

        public Builder captureEventPayloads(boolean captureEventPayloads) {
            this.captureEventPayloads = captureEventPayloads;
            return this;
        }

        public Builder captureQueryPayloads(boolean captureQueryPayloads) {
            this.captureQueryPayloads = captureQueryPayloads;
            return this;
        }

        public Builder maxPayloadLength(int maxPayloadLength) {
            this.maxPayloadLength = maxPayloadLength;
            return this;
        }

        public Builder sampleRate(double sampleRate) {
            this.sampleRate = sampleRate;
            return this;
        }

        public Builder tracesPerSecond(@Nullable Double tracesPerSecond) {
            this.tracesPerSecond = tracesPerSecond;
            return this;
        }

        public Builder samplerCombineStrategy(CombineStrategy samplerCombineStrategy) {
            this.samplerCombineStrategy = samplerCombineStrategy;
            return this;
        }

        public Builder exportQueueCapacity(int exportQueueCapacity) {
            this.exportQueueCapacity = exportQueueCapacity;
            return this;
        }

        public Builder attachStacktrace(boolean attachStacktrace) {
            this.attachStacktrace = attachStacktrace;
            return this;
        }

        public Builder serviceName(String serviceName) {
            this.serviceName = serviceName;
            return this;
        }

        public Builder maxPendingDispatches(int maxPendingDispatches) {
            this.maxPendingDispatches = maxPendingDispatches;
            return this;
        }

        public Builder dispatchTimeout(Duration dispatchTimeout) {
            this.dispatchTimeout = dispatchTimeout;
            return this;
        }

        public Builder propagateCorrelationIds(boolean propagateCorrelationIds) {
            this.propagateCorrelationIds = propagateCorrelationIds;
            return this;
        }

        /**
         * @throws ConfigurationException if the configuration is enabled and invalid
         */
        public TracingConfiguration build() {
            if (enabled) {
                validate();
            }
            return new TracingConfiguration(this);
        }

        private void validate() {
            if (Double.isNaN(sampleRate) || sampleRate < 0.0 || sampleRate > 1.0) {
                throw new ConfigurationException("sampleRate must be between 0.0 and 1.0, got " + sampleRate);
            }
            if (maxPayloadLength <= 0) {
                throw new ConfigurationException("maxPayloadLength must be positive, got " + maxPayloadLength);
            }
            if (exportQueueCapacity <= 0) {
                throw new ConfigurationException("exportQueueCapacity must be positive, got " + exportQueueCapacity);
            }
            if (tracesPerSecond != null && !(tracesPerSecond > 0.0)) {
                throw new ConfigurationException("tracesPerSecond must be positive when set, got " + tracesPerSecond);
            }
            if (samplerCombineStrategy == null) {
                throw new ConfigurationException("samplerCombineStrategy must not be null");
            }
            if (serviceName == null || serviceName.isBlank()) {
                throw new ConfigurationException("serviceName must not be blank");
            }
            if (maxPendingDispatches <= 0) {
                throw new ConfigurationException("maxPendingDispatches must be positive, got " + maxPendingDispatches);
            }
            if (dispatchTimeout == null || dispatchTimeout.isZero() || dispatchTimeout.isNegative()) {
                throw new ConfigurationException("dispatchTimeout must be positive, got " + dispatchTimeout);
            }
        }
    }
}
