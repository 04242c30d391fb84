package net.relaytrace.Config;

/**
 * How several samplers are combined into one decision.
 */
public enum CombineStrategy {
    /** Sample only if every sampler agrees. */
    AND,
    /** Sample if any sampler agrees. */
    OR
}
