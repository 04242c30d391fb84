package net.relaytrace.Attributes;

import net.relaytrace.Message.TracedMessage;
import net.relaytrace.Metrics.NoOpTracingMetricsRecorder;
import net.relaytrace.Metrics.TracingMetricsRecorder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Merges the attributes of several providers.
 *
 * A provider that throws is logged, counted and skipped; the others still contribute.
 */
public class CompositeAttributeProvider implements AttributeProvider {

    private static final Logger logger = LoggerFactory.getLogger(CompositeAttributeProvider.class);

    private final List<AttributeProvider> providers;
    private final TracingMetricsRecorder metricsRecorder;

    public CompositeAttributeProvider(List<? extends AttributeProvider> providers) {
        this(providers, NoOpTracingMetricsRecorder.INSTANCE);
    }

    public CompositeAttributeProvider(List<? extends AttributeProvider> providers,
                                      TracingMetricsRecorder metricsRecorder) {
        List<AttributeProvider> sorted = new ArrayList<>(providers);
        // List.sort is stable, equal priorities keep registration order
        sorted.sort(Comparator.comparingInt(AttributeProvider::priority));
        this.providers = Collections.unmodifiableList(sorted);
        this.metricsRecorder = metricsRecorder;
    }

    public List<AttributeProvider> getProviders() {
        return providers;
    }

    @Override
    public Map<String, Object> provideAttributes(TracedMessage message) {
        Map<String, Object> merged = new LinkedHashMap<>();
        for (AttributeProvider provider : providers) {
            Map<String, Object> provided;
            try {
                provided = provider.provideAttributes(message);
            } catch (RuntimeException e) {
                String providerName = provider.getClass().getSimpleName();
                logger.warn("attribute provider {} failed for message {}: {}",
                        providerName, message.getIdentifier(), e.getMessage());
                metricsRecorder.recordProviderFailure(providerName);
                continue;
            }
            if (provided == null) {
                continue;
            }
            provided.forEach((key, value) -> {
                if (key != null && value != null) {
                    merged.put(key, value);
                }
            });
        }
        return merged;
    }

    /**
     * Returns the highest priority of the composed providers, 0 when empty.
     */
    @Override
    public int priority() {
        return providers.isEmpty() ? 0 : providers.get(providers.size() - 1).priority();
    }
}
