package net.relaytrace.Filter;

import net.relaytrace.Tracing.TracingSpan;

import java.util.List;

/**
 * Logical AND over several filters, stopping at the first rejection.
 * With no filters every span is exported.
 */
public class CompositeSpanFilter implements SpanFilter {

    private final List<SpanFilter> filters;

    public CompositeSpanFilter(List<? extends SpanFilter> filters) {
        this.filters = List.copyOf(filters);
    }

    public static CompositeSpanFilter of(SpanFilter... filters) {
        return new CompositeSpanFilter(List.of(filters));
    }

    @Override
    public boolean shouldExport(TracingSpan span) {
        for (SpanFilter filter : filters) {
            if (!filter.shouldExport(span)) {
                return false;
            }
        }
        return true;
    }
}
