package net.relaytrace;

import net.relaytrace.Config.CombineStrategy;
import net.relaytrace.Config.TracingConfiguration;
import net.relaytrace.Message.MessageKind;
import net.relaytrace.Sampling.CompositeSampler;
import net.relaytrace.Sampling.ProbabilitySampler;
import net.relaytrace.Sampling.RateLimitingSampler;
import net.relaytrace.Sampling.TraceSampler;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.List;
import java.util.concurrent.atomic.AtomicLong;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class TraceSamplerTest {

    private static final String TRACE_ID = "4bf92f3577b34da6a3ce929d0e0e4736";

    private static boolean sample(TraceSampler sampler) {
        return sampler.shouldSample(TRACE_ID, "Command: CreateOrder", MessageKind.COMMAND);
    }

    @Test
    void testProbabilitySamplerComparesDrawWithRate() {
        assertTrue(sample(new ProbabilitySampler(0.25, () -> 0.1)));
        assertFalse(sample(new ProbabilitySampler(0.25, () -> 0.25)));
        assertFalse(sample(new ProbabilitySampler(0.25, () -> 0.9)));
    }

    @Test
    void testProbabilitySamplerExtremes() {
        assertTrue(sample(new ProbabilitySampler(1.0, () -> 0.999)));
        assertFalse(sample(new ProbabilitySampler(0.0, () -> 0.0)));
    }

    @ParameterizedTest
    @ValueSource(doubles = {-0.1, 1.5, Double.NaN})
    void testProbabilitySamplerRejectsInvalidRate(double rate) {
        assertThrows(IllegalArgumentException.class, () -> new ProbabilitySampler(rate));
    }

    @Test
    void testProbabilitySamplerApproximatesRate() {
        ProbabilitySampler sampler = new ProbabilitySampler(0.5);
        int sampled = 0;
        for (int i = 0; i < 10_000; i++) {
            if (sample(sampler)) {
                sampled++;
            }
        }
        assertTrue(sampled > 4_000 && sampled < 6_000, "sampled " + sampled);
    }

    @Test
    void testRateLimiterAdmitsBurstThenRefills() {
        AtomicLong now = new AtomicLong(0);
        RateLimitingSampler sampler = new RateLimitingSampler(2.0, 2.0, now::get);

        assertTrue(sample(sampler));
        assertTrue(sample(sampler));
        assertFalse(sample(sampler));

        now.addAndGet(500_000_000L);
        assertTrue(sample(sampler));
        assertFalse(sample(sampler));

        // idle time never builds up more than the burst
        now.addAndGet(60_000_000_000L);
        assertTrue(sample(sampler));
        assertTrue(sample(sampler));
        assertFalse(sample(sampler));
    }

    @Test
    void testRateLimiterRejectsNonPositiveRate() {
        assertThrows(IllegalArgumentException.class, () -> new RateLimitingSampler(0.0));
    }

    @Test
    void testCompositeAndShortCircuits() {
        TraceSampler second = mock(TraceSampler.class);
        CompositeSampler sampler = new CompositeSampler(CombineStrategy.AND, List.of(TraceSampler.NEVER, second));

        assertFalse(sample(sampler));
        verifyNoInteractions(second);
    }

    @Test
    void testCompositeOrShortCircuits() {
        TraceSampler second = mock(TraceSampler.class);
        CompositeSampler sampler = new CompositeSampler(CombineStrategy.OR, List.of(TraceSampler.ALWAYS, second));

        assertTrue(sample(sampler));
        verifyNoInteractions(second);
    }

    @Test
    void testCompositeConsultsLaterSamplers() {
        TraceSampler second = mock(TraceSampler.class);
        when(second.shouldSample(any(), any(), any())).thenReturn(true);

        assertTrue(sample(new CompositeSampler(CombineStrategy.AND, List.of(TraceSampler.ALWAYS, second))));
        assertTrue(sample(new CompositeSampler(CombineStrategy.OR, List.of(TraceSampler.NEVER, second))));
        verify(second, times(2)).shouldSample(TRACE_ID, "Command: CreateOrder", MessageKind.COMMAND);
    }

    @Test
    void testCompositeRequiresSamplers() {
        assertThrows(IllegalArgumentException.class, () -> new CompositeSampler(CombineStrategy.AND, List.of()));
    }

    @Test
    void testFromConfiguration() {
        TraceSampler plain = TraceSampler.fromConfiguration(TracingConfiguration.builder().sampleRate(0.3).build());
        assertInstanceOf(ProbabilitySampler.class, plain);
        assertEquals(0.3, ((ProbabilitySampler) plain).getRate());

        TraceSampler limited = TraceSampler.fromConfiguration(TracingConfiguration.builder()
                .sampleRate(1.0)
                .tracesPerSecond(1.0)
                .build());
        assertInstanceOf(CompositeSampler.class, limited);
        assertTrue(sample(limited));
        assertFalse(sample(limited));
    }
}
