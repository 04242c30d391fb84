package net.relaytrace.SpanFactory;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import net.relaytrace.Attributes.AttributeProvider;
import net.relaytrace.Config.TracingConfiguration;
import net.relaytrace.Message.TracedMessage;
import net.relaytrace.Metrics.NoOpTracingMetricsRecorder;
import net.relaytrace.Metrics.TracingMetricsRecorder;
import net.relaytrace.Tracing.AttributeValue;
import net.relaytrace.Tracing.SpanAttributes;
import net.relaytrace.Tracing.TracingSpan;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.lang.Nullable;

import java.util.Map;

/**
 * Writes attributes onto a new message span.
 *
 * Provider attributes go first and the standard attributes last, so a provider can add
 * keys but never replace {@code message.kind} and friends.
 */
public class AttributeApplier {

    private static final Logger logger = LoggerFactory.getLogger(AttributeApplier.class);

    public static final String TRUNCATION_MARKER = "...[truncated]";

    private final TracingConfiguration configuration;
    @Nullable
    private final AttributeProvider attributeProvider;
    private final ObjectMapper payloadMapper;
    private final TracingMetricsRecorder metricsRecorder;

    public AttributeApplier(TracingConfiguration configuration, @Nullable AttributeProvider attributeProvider) {
        this(configuration, attributeProvider, defaultPayloadMapper(), NoOpTracingMetricsRecorder.INSTANCE);
    }

    public AttributeApplier(TracingConfiguration configuration,
                            @Nullable AttributeProvider attributeProvider,
                            ObjectMapper payloadMapper,
                            TracingMetricsRecorder metricsRecorder) {
        this.configuration = configuration;
        this.attributeProvider = attributeProvider;
        this.payloadMapper = payloadMapper;
        this.metricsRecorder = metricsRecorder;
    }

    /**
     * Sorted keys keep the captured payload stable between runs.
     */
    public static ObjectMapper defaultPayloadMapper() {
        return JsonMapper.builder()
                .enable(MapperFeature.SORT_PROPERTIES_ALPHABETICALLY)
                .enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS)
                .disable(SerializationFeature.FAIL_ON_EMPTY_BEANS)
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .addModule(new JavaTimeModule())
                .build();
    }

    public void applyDispatchAttributes(TracingSpan span, TracedMessage message, String messageName) {
        applyProviderAttributes(span, message);
        applyStandardAttributes(span, message, messageName, SpanAttributes.OPERATION_SEND);
        applyPayloadAttribute(span, message);
    }

    public void applyHandlerAttributes(TracingSpan span, TracedMessage message, String messageName, String handlerId) {
        applyProviderAttributes(span, message);
        applyStandardAttributes(span, message, messageName, SpanAttributes.OPERATION_PROCESS);
        span.setAttribute(SpanAttributes.MESSAGE_HANDLER, handlerId);
        applyPayloadAttribute(span, message);
    }

    private void applyProviderAttributes(TracingSpan span, TracedMessage message) {
        if (attributeProvider == null) {
            return;
        }
        Map<String, Object> provided;
        try {
            provided = attributeProvider.provideAttributes(message);
        } catch (RuntimeException e) {
            // composite providers isolate their members, a bare provider is isolated here
            logger.warn("attribute provider failed for message {}: {}", message.getIdentifier(), e.getMessage());
            metricsRecorder.recordProviderFailure(providerName());
            return;
        }
        if (provided == null) {
            return;
        }
        provided.forEach((key, value) -> {
            if (key == null || value == null) {
                return;
            }
            AttributeValue converted;
            try {
                converted = AttributeValue.from(value);
            } catch (RuntimeException e) {
                // one bad value costs its own attribute, not the span
                logger.warn("skipping attribute {} on message {}, value of type {} could not be converted: {}",
                        key, message.getIdentifier(), value.getClass().getName(), e.getMessage());
                metricsRecorder.recordProviderFailure(providerName());
                return;
            }
            span.setAttribute(key, converted);
        });
    }

    private String providerName() {
        return attributeProvider.getClass().getSimpleName();
    }

    private void applyStandardAttributes(TracingSpan span, TracedMessage message, String messageName, String operation) {
        span.setAttribute(SpanAttributes.MESSAGING_SYSTEM, SpanAttributes.SYSTEM_NAME);
        span.setAttribute(SpanAttributes.MESSAGING_OPERATION, operation);
        span.setAttribute(SpanAttributes.MESSAGING_MESSAGE_ID, message.getIdentifier());
        span.setAttribute(SpanAttributes.MESSAGE_KIND, message.getKind().getTag());
        span.setAttribute(SpanAttributes.MESSAGE_NAME, messageName);
        Class<?> payloadType = message.getPayloadType();
        if (payloadType != null) {
            span.setAttribute(SpanAttributes.MESSAGE_PAYLOAD_TYPE, payloadType.getName());
        }
    }

    private void applyPayloadAttribute(TracingSpan span, TracedMessage message) {
        if (message.getPayload() == null || !configuration.isPayloadCaptured(message.getKind())) {
            return;
        }
        span.setAttribute(SpanAttributes.MESSAGE_PAYLOAD, truncate(renderPayload(message.getPayload())));
    }

    String renderPayload(Object payload) {
        if (payload instanceof CharSequence text) {
            return text.toString();
        }
        try {
            return payloadMapper.writeValueAsString(payload);
        } catch (JsonProcessingException | RuntimeException e) {
            logger.debug("payload of type {} is not serializable, using toString: {}",
                    payload.getClass().getName(), e.getMessage());
            return String.valueOf(payload);
        }
    }

    /**
     * Cuts {@code value} to the configured maximum length and appends the truncation marker.
     */
    public String truncate(String value) {
        int maxLength = configuration.getMaxPayloadLength();
        if (value.length() <= maxLength) {
            return value;
        }
        return value.substring(0, maxLength) + TRUNCATION_MARKER;
    }
}
