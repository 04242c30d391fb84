package net.relaytrace.Filter;

import net.relaytrace.Tracing.TracingSpan;

/**
 * Drops spans of traces the head sampler rejected.
 */
public class SampledSpanFilter implements SpanFilter {

    public static final SampledSpanFilter INSTANCE = new SampledSpanFilter();

    @Override
    public boolean shouldExport(TracingSpan span) {
        return span.isSampled();
    }
}
