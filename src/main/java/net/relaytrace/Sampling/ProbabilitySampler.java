package net.relaytrace.Sampling;

import net.relaytrace.Message.MessageKind;

import java.util.concurrent.ThreadLocalRandom;
import java.util.function.DoubleSupplier;

/**
 * Samples a fixed fraction of traces with a uniform random draw.
 */
public class ProbabilitySampler implements TraceSampler {

    private final double rate;
    private final DoubleSupplier random;

    public ProbabilitySampler(double rate) {
        this(rate, () -> ThreadLocalRandom.current().nextDouble());
    }

    /**
     * @param random source of draws in [0.0, 1.0)
     */
    public ProbabilitySampler(double rate, DoubleSupplier random) {
        if (Double.isNaN(rate) || rate < 0.0 || rate > 1.0) {
            throw new IllegalArgumentException("rate must be between 0.0 and 1.0, got " + rate);
        }
        this.rate = rate;
        this.random = random;
    }

    public double getRate() {
        return rate;
    }

    @Override
    public boolean shouldSample(String traceId, String spanName, MessageKind kind) {
        if (rate >= 1.0) {
            return true;
        }
        if (rate <= 0.0) {
            return false;
        }
        return random.getAsDouble() < rate;
    }

    @Override
    public String toString() {
        return "ProbabilitySampler{rate=" + rate + '}';
    }
}
