package net.relaytrace;

import io.opentelemetry.api.trace.SpanKind;
import net.relaytrace.Config.TracingConfiguration;
import net.relaytrace.Filter.CompositeSpanFilter;
import net.relaytrace.Filter.ConfigurationSpanFilter;
import net.relaytrace.Filter.SampledSpanFilter;
import net.relaytrace.Filter.SpanFilter;
import net.relaytrace.Message.MessageKind;
import net.relaytrace.Tracing.RecordingSpan;
import net.relaytrace.Tracing.SpanAttributes;
import net.relaytrace.Tracing.SpanProcessor;
import net.relaytrace.Tracing.TraceContext;
import net.relaytrace.Tracing.TracingSpan;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class SpanFilterTest {

    private static TracingSpan span(MessageKind kind, boolean sampled) {
        RecordingSpan span = new RecordingSpan("span", SpanKind.INTERNAL, TraceContext.newRoot(sampled), null,
                Clock.systemUTC(), false, SpanProcessor.NOOP);
        if (kind != null) {
            span.setAttribute(SpanAttributes.MESSAGE_KIND, kind.getTag());
        }
        return span;
    }

    @Test
    void testConfigurationFilterFollowsPerKindFlags() {
        TracingConfiguration configuration = TracingConfiguration.builder()
                .traceCommands(true)
                .traceEvents(false)
                .traceQueries(true)
                .build();
        SpanFilter filter = new ConfigurationSpanFilter(configuration);

        assertTrue(filter.shouldExport(span(MessageKind.COMMAND, true)));
        assertFalse(filter.shouldExport(span(MessageKind.EVENT, true)));
        assertTrue(filter.shouldExport(span(MessageKind.QUERY, true)));
    }

    @Test
    void testConfigurationFilterExportsSpansWithoutKindTag() {
        SpanFilter filter = new ConfigurationSpanFilter(TracingConfiguration.defaults());

        assertTrue(filter.shouldExport(span(null, true)));
    }

    @Test
    void testConfigurationFilterRejectsEverythingWhenDisabled() {
        SpanFilter filter = new ConfigurationSpanFilter(TracingConfiguration.disabled());

        assertFalse(filter.shouldExport(span(MessageKind.COMMAND, true)));
        assertFalse(filter.shouldExport(span(null, true)));
    }

    @Test
    void testEmptyCompositeAcceptsEverything() {
        assertTrue(new CompositeSpanFilter(List.of()).shouldExport(span(MessageKind.EVENT, false)));
    }

    @Test
    void testCompositeStopsAtFirstRejection() {
        SpanFilter second = mock(SpanFilter.class);
        SpanFilter composite = CompositeSpanFilter.of(span -> false, second);

        assertFalse(composite.shouldExport(span(MessageKind.COMMAND, true)));
        verifyNoInteractions(second);
    }

    @Test
    void testCompositeRequiresAllFilters() {
        SpanFilter second = mock(SpanFilter.class);
        TracingSpan span = span(MessageKind.COMMAND, true);
        when(second.shouldExport(span)).thenReturn(true);

        assertTrue(CompositeSpanFilter.of(SpanFilter.ACCEPT_ALL, second).shouldExport(span));
        verify(second).shouldExport(span);
    }

    @Test
    void testSampledFilter() {
        assertTrue(SampledSpanFilter.INSTANCE.shouldExport(span(MessageKind.QUERY, true)));
        assertFalse(SampledSpanFilter.INSTANCE.shouldExport(span(MessageKind.QUERY, false)));
    }
}
