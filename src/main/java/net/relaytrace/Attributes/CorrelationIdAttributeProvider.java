package net.relaytrace.Attributes;

import net.relaytrace.Message.TracedMessage;
import net.relaytrace.Tracing.CorrelationContext;
import net.relaytrace.Tracing.SpanAttributes;

import java.util.Collections;
import java.util.Map;

/**
 * Copies the correlation id from message metadata onto the span as {@code correlation.id}.
 */
public class CorrelationIdAttributeProvider implements AttributeProvider {

    public static final String METADATA_KEY = CorrelationContext.CORRELATION_ID_KEY;
    public static final String ATTRIBUTE_KEY = SpanAttributes.CORRELATION_ID;
    public static final int PRIORITY = 100;

    @Override
    public Map<String, Object> provideAttributes(TracedMessage message) {
        String correlationId = message.getMetadata().get(METADATA_KEY);
        if (correlationId == null || correlationId.isBlank()) {
            return Collections.emptyMap();
        }
        return Collections.singletonMap(ATTRIBUTE_KEY, correlationId);
    }

    @Override
    public int priority() {
        return PRIORITY;
    }
}
