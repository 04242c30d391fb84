package net.relaytrace.Sampling;

import net.relaytrace.Message.MessageKind;

import java.util.function.LongSupplier;

/**
 * Token bucket sampler that admits at most {@code tracesPerSecond} new traces per second,
 * with bursts up to {@code maxBurst}.
 */
public class RateLimitingSampler implements TraceSampler {

    private static final double NANOS_PER_SECOND = 1_000_000_000.0;

    private final double tracesPerSecond;
    private final double maxBurst;
    private final LongSupplier nanoTime;

    private double tokens;
    private long lastRefillNanos;

    public RateLimitingSampler(double tracesPerSecond) {
        this(tracesPerSecond, Math.max(1.0, tracesPerSecond), System::nanoTime);
    }

    public RateLimitingSampler(double tracesPerSecond, double maxBurst, LongSupplier nanoTime) {
        if (!(tracesPerSecond > 0.0)) {
            throw new IllegalArgumentException("tracesPerSecond must be positive, got " + tracesPerSecond);
        }
        if (!(maxBurst >= 1.0)) {
            throw new IllegalArgumentException("maxBurst must be at least 1, got " + maxBurst);
        }
        this.tracesPerSecond = tracesPerSecond;
        this.maxBurst = maxBurst;
        this.nanoTime = nanoTime;
        this.tokens = maxBurst;
        this.lastRefillNanos = nanoTime.getAsLong();
    }

    @Override
    public synchronized boolean shouldSample(String traceId, String spanName, MessageKind kind) {
        refill();
        if (tokens >= 1.0) {
            tokens -= 1.0;
            return true;
        }
        return false;
    }

    private void refill() {
        long now = nanoTime.getAsLong();
        long elapsed = now - lastRefillNanos;
        if (elapsed <= 0) {
            return;
        }
        tokens = Math.min(maxBurst, tokens + elapsed / NANOS_PER_SECOND * tracesPerSecond);
        lastRefillNanos = now;
    }

    @Override
    public String toString() {
        return "RateLimitingSampler{tracesPerSecond=" + tracesPerSecond + ", maxBurst=" + maxBurst + '}';
    }
}
