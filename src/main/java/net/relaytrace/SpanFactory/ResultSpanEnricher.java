package net.relaytrace.SpanFactory;

import net.relaytrace.Tracing.SpanAttributes;
import net.relaytrace.Tracing.TracingSpan;
import org.springframework.lang.Nullable;

import java.lang.reflect.Array;
import java.util.Collection;
import java.util.Map;
import java.util.Optional;

/**
 * Records what a command or query returned: the result type always, the value itself for
 * simple scalars, the element count for collections.
 */
public class ResultSpanEnricher {

    private final AttributeApplier attributeApplier;

    public ResultSpanEnricher(AttributeApplier attributeApplier) {
        this.attributeApplier = attributeApplier;
    }

    public void enrich(TracingSpan span, @Nullable Object result) {
        if (result instanceof Optional<?> optional) {
            result = optional.orElse(null);
        }
        if (result == null) {
            span.setAttribute(SpanAttributes.MESSAGE_RESULT_TYPE, SpanAttributes.RESULT_TYPE_VOID);
            return;
        }
        span.setAttribute(SpanAttributes.MESSAGE_RESULT_TYPE, result.getClass().getSimpleName().isEmpty()
                ? result.getClass().getName()
                : result.getClass().getSimpleName());

        if (result instanceof CharSequence text) {
            span.setAttribute(SpanAttributes.MESSAGE_RESULT, attributeApplier.truncate(text.toString()));
        } else if (result instanceof Long || result instanceof Integer || result instanceof Short || result instanceof Byte) {
            span.setAttribute(SpanAttributes.MESSAGE_RESULT, ((Number) result).longValue());
        } else if (result instanceof Double || result instanceof Float) {
            span.setAttribute(SpanAttributes.MESSAGE_RESULT, ((Number) result).doubleValue());
        } else if (result instanceof Number || result instanceof Enum<?>) {
            span.setAttribute(SpanAttributes.MESSAGE_RESULT, result.toString());
        } else if (result instanceof Boolean bool) {
            span.setAttribute(SpanAttributes.MESSAGE_RESULT, bool.booleanValue());
        } else if (result instanceof Collection<?> collection) {
            span.setAttribute(SpanAttributes.MESSAGE_RESULT_COUNT, collection.size());
        } else if (result instanceof Map<?, ?> map) {
            span.setAttribute(SpanAttributes.MESSAGE_RESULT_COUNT, map.size());
        } else if (result.getClass().isArray()) {
            span.setAttribute(SpanAttributes.MESSAGE_RESULT_COUNT, Array.getLength(result));
        }
    }
}
