package net.relaytrace.Sampling;

import net.relaytrace.Config.CombineStrategy;
import net.relaytrace.Message.MessageKind;

import java.util.List;

/**
 * Combines several samplers with AND or OR. Evaluation short-circuits, so with AND a
 * rate limiter placed after a probability sampler only spends tokens on traces the
 * probability sampler already accepted.
 */
public class CompositeSampler implements TraceSampler {

    private final CombineStrategy strategy;
    private final List<TraceSampler> samplers;

    public CompositeSampler(CombineStrategy strategy, List<? extends TraceSampler> samplers) {
        if (samplers.isEmpty()) {
            throw new IllegalArgumentException("at least one sampler is required");
        }
        this.strategy = strategy;
        this.samplers = List.copyOf(samplers);
    }

    @Override
    public boolean shouldSample(String traceId, String spanName, MessageKind kind) {
        return switch (strategy) {
            case AND -> samplers.stream().allMatch(sampler -> sampler.shouldSample(traceId, spanName, kind));
            case OR -> samplers.stream().anyMatch(sampler -> sampler.shouldSample(traceId, spanName, kind));
        };
    }

    @Override
    public String toString() {
        return "CompositeSampler{strategy=" + strategy + ", samplers=" + samplers + '}';
    }
}
