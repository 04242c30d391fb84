package net.relaytrace.Filter;

import net.relaytrace.Config.TracingConfiguration;
import net.relaytrace.Message.MessageKind;
import net.relaytrace.Tracing.AttributeValue;
import net.relaytrace.Tracing.SpanAttributes;
import net.relaytrace.Tracing.TracingSpan;

/**
 * Applies the per-kind enable flags of the configuration to ended spans.
 *
 * Spans without a recognisable {@code message.kind} tag are exported, so spans added by
 * extensions are not silently lost.
 */
public class ConfigurationSpanFilter implements SpanFilter {

    private final TracingConfiguration configuration;

    public ConfigurationSpanFilter(TracingConfiguration configuration) {
        this.configuration = configuration;
    }

    @Override
    public boolean shouldExport(TracingSpan span) {
        if (!configuration.isEnabled()) {
            return false;
        }
        AttributeValue tag = span.getAttribute(SpanAttributes.MESSAGE_KIND);
        MessageKind kind = tag != null ? MessageKind.fromTag(tag.asString()) : null;
        if (kind == null) {
            return true;
        }
        return configuration.isTraced(kind);
    }
}
