package net.relaytrace.Sampling;

import net.relaytrace.Config.TracingConfiguration;
import net.relaytrace.Message.MessageKind;

import java.util.ArrayList;
import java.util.List;

/**
 * Head sampling decision for a new trace. Only consulted when a root span is created;
 * child spans inherit the decision from their parent context.
 */
@FunctionalInterface
public interface TraceSampler {

    TraceSampler ALWAYS = (traceId, spanName, kind) -> true;
    TraceSampler NEVER = (traceId, spanName, kind) -> false;

    /**
     * @param traceId the id of the trace being started
     * @param spanName the name of its root span
     * @param kind the kind of message that starts the trace
     * @return true if the trace should be recorded as sampled
     */
    boolean shouldSample(String traceId, String spanName, MessageKind kind);

    /**
     * Builds the sampler described by {@code configuration}: a probability sampler, combined
     * with a rate limiter when {@code tracesPerSecond} is set.
     */
    static TraceSampler fromConfiguration(TracingConfiguration configuration) {
        List<TraceSampler> samplers = new ArrayList<>();
        samplers.add(new ProbabilitySampler(configuration.getSampleRate()));
        if (configuration.getTracesPerSecond() != null) {
            samplers.add(new RateLimitingSampler(configuration.getTracesPerSecond()));
        }
        if (samplers.size() == 1) {
            return samplers.get(0);
        }
        return new CompositeSampler(configuration.getSamplerCombineStrategy(), samplers);
    }
}
