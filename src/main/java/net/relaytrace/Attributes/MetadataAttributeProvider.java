package net.relaytrace.Attributes;

import net.relaytrace.Message.TracedMessage;
import net.relaytrace.Propagation.TraceContextPropagator;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.function.Predicate;

/**
 * Exposes message metadata entries as span attributes, {@code metadata.{key}} by default.
 * The trace context keys are never copied.
 */
public class MetadataAttributeProvider implements AttributeProvider {

    public static final String DEFAULT_PREFIX = "metadata.";

    private static final Set<String> RESERVED_KEYS =
            Set.of(TraceContextPropagator.TRACEPARENT, TraceContextPropagator.BAGGAGE);

    private final String prefix;
    private final Predicate<String> keyFilter;

    public MetadataAttributeProvider() {
        this(DEFAULT_PREFIX, key -> true);
    }

    public MetadataAttributeProvider(String prefix, Predicate<String> keyFilter) {
        this.prefix = prefix == null ? "" : prefix;
        this.keyFilter = keyFilter;
    }

    /**
     * Only the listed metadata keys are exposed.
     */
    public static MetadataAttributeProvider forKeys(Set<String> keys) {
        Set<String> allowed = Set.copyOf(keys);
        return new MetadataAttributeProvider(DEFAULT_PREFIX, allowed::contains);
    }

    @Override
    public Map<String, Object> provideAttributes(TracedMessage message) {
        Map<String, Object> attributes = new LinkedHashMap<>();
        for (Map.Entry<String, String> entry : message.getMetadata().entrySet()) {
            String key = entry.getKey();
            if (RESERVED_KEYS.contains(key) || !keyFilter.test(key)) {
                continue;
            }
            attributes.put(prefix + key, entry.getValue());
        }
        return attributes;
    }
}
