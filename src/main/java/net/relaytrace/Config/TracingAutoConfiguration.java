package net.relaytrace.Config;

import io.micrometer.core.instrument.MeterRegistry;
import net.relaytrace.Attributes.AttributeProvider;
import net.relaytrace.Attributes.CorrelationIdAttributeProvider;
import net.relaytrace.ErrorCorrelation.ErrorReporter;
import net.relaytrace.ErrorCorrelation.LoggingErrorReporter;
import net.relaytrace.Filter.SpanFilter;
import net.relaytrace.Export.SpanExportQueue;
import net.relaytrace.Interceptor.MessageTracingInterceptor;
import net.relaytrace.Metrics.MicrometerTracingMetricsRecorder;
import net.relaytrace.Metrics.NoOpTracingMetricsRecorder;
import net.relaytrace.Metrics.TracingMetricsRecorder;
import net.relaytrace.Sampling.TraceSampler;
import net.relaytrace.TracingCore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

import java.util.stream.Collectors;

/**
 * Auto-configuration for message tracing.
 * Provides default beans that users can override if needed.
 *
 * Can be disabled by setting: relaytrace.tracing.enabled=false
 */
@AutoConfiguration(afterName = {
        "org.springframework.boot.actuate.autoconfigure.metrics.CompositeMeterRegistryAutoConfiguration",
        "org.springframework.boot.actuate.autoconfigure.metrics.export.simple.SimpleMetricsExportAutoConfiguration"
})
@ConditionalOnProperty(
        prefix = "relaytrace.tracing",
        name = "enabled",
        havingValue = "true",
        matchIfMissing = true
)
@EnableConfigurationProperties(TracingProperties.class)
public class TracingAutoConfiguration {

    private static final Logger logger = LoggerFactory.getLogger(TracingAutoConfiguration.class);

    @Bean
    @ConditionalOnMissingBean
    public TracingConfiguration tracingConfiguration(TracingProperties properties) {
        TracingConfiguration configuration = properties.toTracingConfiguration();
        logger.debug("created tracing configuration: {}", configuration);
        return configuration;
    }

    /**
     * Uses Micrometer when a MeterRegistry bean exists, otherwise falls back to no-op.
     */
    @Bean
    @ConditionalOnMissingBean(TracingMetricsRecorder.class)
    @ConditionalOnBean(MeterRegistry.class)
    public TracingMetricsRecorder micrometerTracingMetricsRecorder(MeterRegistry meterRegistry) {
        logger.info("==> tracing metrics enabled with Micrometer");
        return new MicrometerTracingMetricsRecorder(meterRegistry);
    }

    @Bean
    @ConditionalOnMissingBean(TracingMetricsRecorder.class)
    public TracingMetricsRecorder noOpTracingMetricsRecorder() {
        logger.debug("no MeterRegistry found, tracing metrics disabled");
        return NoOpTracingMetricsRecorder.INSTANCE;
    }

    @Bean
    @ConditionalOnMissingBean
    public ErrorReporter errorReporter() {
        return new LoggingErrorReporter();
    }

    @Bean
    @ConditionalOnMissingBean
    public CorrelationIdAttributeProvider correlationIdAttributeProvider() {
        return new CorrelationIdAttributeProvider();
    }

    /**
     * Every AttributeProvider and SpanFilter bean in the context is plugged in.
     */
    @Bean(destroyMethod = "shutdown")
    @ConditionalOnMissingBean
    public TracingCore tracingCore(TracingConfiguration configuration,
                                   TracingMetricsRecorder metricsRecorder,
                                   ErrorReporter errorReporter,
                                   ObjectProvider<AttributeProvider> attributeProviders,
                                   ObjectProvider<SpanFilter> spanFilters,
                                   ObjectProvider<TraceSampler> sampler) {
        TracingCore.Builder builder = TracingCore.builder(configuration)
                .metricsRecorder(metricsRecorder)
                .errorReporter(errorReporter)
                .attributeProviders(attributeProviders.orderedStream().collect(Collectors.toList()));
        spanFilters.orderedStream().forEach(builder::spanFilter);
        sampler.ifUnique(builder::sampler);
        return builder.build();
    }

    /**
     * The core owns the lifecycle of the interceptor and the queue, so no destroy method here.
     */
    @Bean(destroyMethod = "")
    @ConditionalOnMissingBean
    public MessageTracingInterceptor messageTracingInterceptor(TracingCore tracingCore) {
        return tracingCore.interceptor();
    }

    @Bean(destroyMethod = "")
    @ConditionalOnMissingBean
    public SpanExportQueue spanExportQueue(TracingCore tracingCore) {
        return tracingCore.exportQueue();
    }
}
