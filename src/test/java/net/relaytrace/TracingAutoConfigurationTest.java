package net.relaytrace;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import net.relaytrace.Attributes.AttributeProvider;
import net.relaytrace.Attributes.CorrelationIdAttributeProvider;
import net.relaytrace.Config.CombineStrategy;
import net.relaytrace.Config.ConfigurationException;
import net.relaytrace.Config.TracingAutoConfiguration;
import net.relaytrace.Config.TracingConfiguration;
import net.relaytrace.ErrorCorrelation.ErrorReporter;
import net.relaytrace.ErrorCorrelation.LoggingErrorReporter;
import net.relaytrace.Export.SpanExportQueue;
import net.relaytrace.Interceptor.MessageTracingInterceptor;
import net.relaytrace.Message.MessageKind;
import net.relaytrace.Metrics.MicrometerTracingMetricsRecorder;
import net.relaytrace.Metrics.NoOpTracingMetricsRecorder;
import net.relaytrace.Metrics.TracingMetricsRecorder;
import net.relaytrace.Tracing.AttributeValue;
import net.relaytrace.Tracing.TracingSpan;
import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

class TracingAutoConfigurationTest {

    private final ApplicationContextRunner contextRunner = new ApplicationContextRunner()
            .withConfiguration(AutoConfigurations.of(TracingAutoConfiguration.class));

    @Test
    void testDefaultBeansAreCreated() {
        contextRunner.run(context -> {
            assertThat(context).hasSingleBean(TracingCore.class);
            assertThat(context).hasSingleBean(MessageTracingInterceptor.class);
            assertThat(context).hasSingleBean(SpanExportQueue.class);
            assertThat(context).hasSingleBean(CorrelationIdAttributeProvider.class);
            assertThat(context.getBean(ErrorReporter.class)).isInstanceOf(LoggingErrorReporter.class);
            assertThat(context.getBean(TracingMetricsRecorder.class)).isSameAs(NoOpTracingMetricsRecorder.INSTANCE);

            TracingCore core = context.getBean(TracingCore.class);
            assertThat(context.getBean(MessageTracingInterceptor.class)).isSameAs(core.interceptor());
            assertThat(context.getBean(SpanExportQueue.class)).isSameAs(core.exportQueue());
        });
    }

    @Test
    void testPropertiesAreBound() {
        contextRunner
                .withPropertyValues(
                        "relaytrace.tracing.trace-events=false",
                        "relaytrace.tracing.capture-command-payloads=true",
                        "relaytrace.tracing.max-payload-length=64",
                        "relaytrace.tracing.sample-rate=0.5",
                        "relaytrace.tracing.traces-per-second=100",
                        "relaytrace.tracing.sampler-combine-strategy=OR",
                        "relaytrace.tracing.export-queue-capacity=16",
                        "relaytrace.tracing.service-name=orders",
                        "relaytrace.tracing.max-pending-dispatches=500",
                        "relaytrace.tracing.dispatch-timeout=30s",
                        "relaytrace.tracing.propagate-correlation-ids=false")
                .run(context -> {
                    TracingConfiguration configuration = context.getBean(TracingConfiguration.class);
                    assertThat(configuration.isTraceEvents()).isFalse();
                    assertThat(configuration.isTraceCommands()).isTrue();
                    assertThat(configuration.isCaptureCommandPayloads()).isTrue();
                    assertThat(configuration.getMaxPayloadLength()).isEqualTo(64);
                    assertThat(configuration.getSampleRate()).isEqualTo(0.5);
                    assertThat(configuration.getTracesPerSecond()).isEqualTo(100.0);
                    assertThat(configuration.getSamplerCombineStrategy()).isEqualTo(CombineStrategy.OR);
                    assertThat(configuration.getServiceName()).isEqualTo("orders");
                    assertThat(configuration.getMaxPendingDispatches()).isEqualTo(500);
                    assertThat(configuration.getDispatchTimeout()).isEqualTo(Duration.ofSeconds(30));
                    assertThat(configuration.isPropagateCorrelationIds()).isFalse();
                    assertThat(context.getBean(SpanExportQueue.class).getCapacity()).isEqualTo(16);
                });
    }

    @Test
    void testDisabledTracingCreatesNoBeans() {
        contextRunner
                .withPropertyValues("relaytrace.tracing.enabled=false")
                .run(context -> {
                    assertThat(context).doesNotHaveBean(TracingCore.class);
                    assertThat(context).doesNotHaveBean(MessageTracingInterceptor.class);
                });
    }

    @Test
    void testInvalidSampleRateFailsStartup() {
        contextRunner
                .withPropertyValues("relaytrace.tracing.sample-rate=1.5")
                .run(context -> {
                    assertThat(context).hasFailed();
                    assertThat(context.getStartupFailure()).hasRootCauseInstanceOf(ConfigurationException.class);
                });
    }

    @Test
    void testMeterRegistryEnablesMicrometerRecorder() {
        contextRunner
                .withUserConfiguration(MeterRegistryConfiguration.class)
                .run(context -> assertThat(context.getBean(TracingMetricsRecorder.class))
                        .isInstanceOf(MicrometerTracingMetricsRecorder.class));
    }

    @Test
    void testUserBeansTakePrecedence() {
        contextRunner
                .withUserConfiguration(CustomBeansConfiguration.class)
                .run(context -> {
                    assertThat(context.getBean(ErrorReporter.class)).isSameAs(CustomBeansConfiguration.REPORTER);
                    assertThat(context.getBean(TracingMetricsRecorder.class)).isSameAs(CustomBeansConfiguration.RECORDER);
                });
    }

    @Test
    void testAttributeProviderBeansArePluggedIn() {
        contextRunner
                .withUserConfiguration(TenantProviderConfiguration.class)
                .run(context -> {
                    TracingCore core = context.getBean(TracingCore.class);
                    core.interceptor().wrapHandler(
                            TestMessages.message(MessageKind.EVENT, "p",
                                    Map.of("correlationId", "c-7")),
                            "handler", message -> null);

                    TracingSpan span = core.exportQueue().poll(1, TimeUnit.SECONDS);
                    assertThat(span).isNotNull();
                    assertThat(span.getAttribute("tenant")).isEqualTo(AttributeValue.of("acme"));
                    assertThat(span.getAttribute("correlation.id")).isEqualTo(AttributeValue.of("c-7"));
                });
    }

    @Configuration(proxyBeanMethods = false)
    static class MeterRegistryConfiguration {

        @Bean
        MeterRegistry meterRegistry() {
            return new SimpleMeterRegistry();
        }
    }

    @Configuration(proxyBeanMethods = false)
    static class CustomBeansConfiguration {

        static final ErrorReporter REPORTER = report -> { };
        static final TracingMetricsRecorder RECORDER = new MicrometerTracingMetricsRecorder(new SimpleMeterRegistry());

        @Bean
        ErrorReporter customErrorReporter() {
            return REPORTER;
        }

        @Bean
        TracingMetricsRecorder customMetricsRecorder() {
            return RECORDER;
        }
    }

    @Configuration(proxyBeanMethods = false)
    static class TenantProviderConfiguration {

        @Bean
        AttributeProvider tenantAttributeProvider() {
            return message -> Map.of("tenant", "acme");
        }
    }
}
