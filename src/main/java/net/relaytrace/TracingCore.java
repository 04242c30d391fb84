package net.relaytrace;

import com.fasterxml.jackson.databind.ObjectMapper;
import net.relaytrace.Attributes.AttributeProvider;
import net.relaytrace.Attributes.CompositeAttributeProvider;
import net.relaytrace.Config.TracingConfiguration;
import net.relaytrace.ErrorCorrelation.ErrorCorrelator;
import net.relaytrace.ErrorCorrelation.ErrorFingerprintGenerator;
import net.relaytrace.ErrorCorrelation.ErrorReporter;
import net.relaytrace.ErrorCorrelation.LoggingErrorReporter;
import net.relaytrace.Export.ExportingSpanProcessor;
import net.relaytrace.Export.SpanExportQueue;
import net.relaytrace.Filter.CompositeSpanFilter;
import net.relaytrace.Filter.ConfigurationSpanFilter;
import net.relaytrace.Filter.SampledSpanFilter;
import net.relaytrace.Filter.SpanFilter;
import net.relaytrace.Interceptor.MessageTracingInterceptor;
import net.relaytrace.Metrics.NoOpTracingMetricsRecorder;
import net.relaytrace.Metrics.TracingMetricsRecorder;
import net.relaytrace.Propagation.CorrelationPropagator;
import net.relaytrace.Propagation.TraceContextPropagator;
import net.relaytrace.Sampling.TraceSampler;
import net.relaytrace.SpanFactory.AttributeApplier;
import net.relaytrace.SpanFactory.MessageSpanFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Explicit handle on one wired tracing core: interceptor, span factory, propagator and
 * export queue, all built from one {@link TracingConfiguration}.
 *
 * There is no global instance. Create one per application with {@link #builder} and call
 * {@link #shutdown()} when done.
 */
public class TracingCore {

    private static final Logger logger = LoggerFactory.getLogger(TracingCore.class);

    private final TracingConfiguration configuration;
    private final TracingMetricsRecorder metricsRecorder;
    private final TraceContextPropagator propagator;
    private final SpanExportQueue exportQueue;
    private final MessageSpanFactory spanFactory;
    private final ErrorCorrelator errorCorrelator;
    private final MessageTracingInterceptor interceptor;
    private final AtomicBoolean shutdown = new AtomicBoolean(false);

    private TracingCore(Builder builder) {
        this.configuration = builder.configuration;
        this.metricsRecorder = builder.metricsRecorder;
        this.propagator = new TraceContextPropagator(metricsRecorder);

        int capacity = configuration.getExportQueueCapacity() > 0
                ? configuration.getExportQueueCapacity()
                : TracingConfiguration.DEFAULT_EXPORT_QUEUE_CAPACITY;
        this.exportQueue = new SpanExportQueue(capacity, metricsRecorder);

        List<SpanFilter> filters = new ArrayList<>();
        filters.add(SampledSpanFilter.INSTANCE);
        filters.add(new ConfigurationSpanFilter(configuration));
        filters.addAll(builder.spanFilters);
        ExportingSpanProcessor spanProcessor =
                new ExportingSpanProcessor(new CompositeSpanFilter(filters), exportQueue, metricsRecorder);

        AttributeApplier attributeApplier = new AttributeApplier(
                configuration,
                new CompositeAttributeProvider(builder.attributeProviders, metricsRecorder),
                builder.payloadMapper != null ? builder.payloadMapper : AttributeApplier.defaultPayloadMapper(),
                metricsRecorder);
        TraceSampler sampler = builder.sampler != null ? builder.sampler : defaultSampler(configuration);
        this.spanFactory = new MessageSpanFactory(configuration, attributeApplier, sampler, spanProcessor, builder.clock);

        this.errorCorrelator = new ErrorCorrelator(builder.errorReporter, new ErrorFingerprintGenerator(), metricsRecorder);
        this.interceptor = new MessageTracingInterceptor(configuration, spanFactory, propagator, errorCorrelator,
                new CorrelationPropagator(), metricsRecorder, builder.clock);

        logger.info("tracing core created for service {} (enabled={}, sampleRate={}, exportQueueCapacity={})",
                configuration.getServiceName(), configuration.isEnabled(), configuration.getSampleRate(), capacity);
    }

    public static Builder builder(TracingConfiguration configuration) {
        return new Builder(configuration);
    }

    private static TraceSampler defaultSampler(TracingConfiguration configuration) {
        // a disabled configuration is not validated, its sampling settings may be garbage
        return configuration.isEnabled() ? TraceSampler.fromConfiguration(configuration) : TraceSampler.NEVER;
    }

    public MessageTracingInterceptor interceptor() {
        return interceptor;
    }

    public SpanExportQueue exportQueue() {
        return exportQueue;
    }

    public MessageSpanFactory spanFactory() {
        return spanFactory;
    }

    public TraceContextPropagator propagator() {
        return propagator;
    }

    public ErrorCorrelator errorCorrelator() {
        return errorCorrelator;
    }

    public TracingConfiguration configuration() {
        return configuration;
    }

    public TracingMetricsRecorder metricsRecorder() {
        return metricsRecorder;
    }

    /**
     * Cancels open dispatch spans and closes the export queue. Safe to call more than once.
     */
    public void shutdown() {
        if (!shutdown.compareAndSet(false, true)) {
            return;
        }
        interceptor.shutdown();
        exportQueue.close();
        logger.info("tracing core for service {} shut down", configuration.getServiceName());
    }

    public boolean isShutdown() {
        return shutdown.get();
    }

    public static final class Builder {

        private final TracingConfiguration configuration;
        private final List<AttributeProvider> attributeProviders = new ArrayList<>();
        private final List<SpanFilter> spanFilters = new ArrayList<>();
        private TracingMetricsRecorder metricsRecorder = NoOpTracingMetricsRecorder.INSTANCE;
        private ErrorReporter errorReporter = new LoggingErrorReporter();
        private TraceSampler sampler;
        private ObjectMapper payloadMapper;
        private Clock clock = Clock.systemUTC();

        private Builder(TracingConfiguration configuration) {
            this.configuration = Objects.requireNonNull(configuration, "configuration");
        }

        public Builder attributeProvider(AttributeProvider provider) {
            this.attributeProviders.add(provider);
            return this;
        }

        public Builder attributeProviders(List<? extends AttributeProvider> providers) {
            this.attributeProviders.addAll(providers);
            return this;
        }

        /**
         * Adds a filter applied after the sampled and per-kind filters.
         */
        public Builder spanFilter(SpanFilter filter) {
            this.spanFilters.add(filter);
            return this;
        }

        public Builder metricsRecorder(TracingMetricsRecorder metricsRecorder) {
            this.metricsRecorder = Objects.requireNonNull(metricsRecorder, "metricsRecorder");
            return this;
        }

        public Builder errorReporter(ErrorReporter errorReporter) {
            this.errorReporter = Objects.requireNonNull(errorReporter, "errorReporter");
            return this;
        }

        /**
         * Replaces the sampler derived from the configuration.
         */
        public Builder sampler(TraceSampler sampler) {
            this.sampler = sampler;
            return this;
        }

        public Builder payloadMapper(ObjectMapper payloadMapper) {
            this.payloadMapper = payloadMapper;
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = Objects.requireNonNull(clock, "clock");
            return this;
        }

        public TracingCore build() {
            return new TracingCore(this);
        }
    }
}
