package net.relaytrace;

import net.relaytrace.Propagation.CorrelationPropagator;
import net.relaytrace.Tracing.CorrelationContext;
import net.relaytrace.Tracing.TraceContext;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class CorrelationPropagatorTest {

    private final CorrelationPropagator propagator = new CorrelationPropagator(() -> "generated");
    private final TraceContext context = TraceContext.of("4bf92f3577b34da6a3ce929d0e0e4736", "00f067aa0ba902b7", true);

    @Test
    void testNewTransactionUsesTraceId() {
        CorrelationContext resolved = propagator.resolve(Map.of(), Optional.empty(), context);

        assertEquals("generated", resolved.getCorrelationId());
        assertEquals("4bf92f3577b34da6a3ce929d0e0e4736", resolved.getTransactionId());
    }

    @Test
    void testInheritedIdsAreKept() {
        CorrelationContext resolved = propagator.resolve(Map.of(),
                Optional.of(CorrelationContext.of("corr-1", "tx-1")), context);

        assertEquals(CorrelationContext.of("corr-1", "tx-1"), resolved);
    }

    @Test
    void testOwnMetadataWinsOverInheritedIds() {
        CorrelationContext resolved = propagator.resolve(Map.of("correlationId", "corr-own"),
                Optional.of(CorrelationContext.of("corr-1", null)), context);

        assertEquals("corr-own", resolved.getCorrelationId());
        assertEquals("4bf92f3577b34da6a3ce929d0e0e4736", resolved.getTransactionId());
    }

    @Test
    void testBlankMetadataCountsAsAbsent() {
        CorrelationContext extracted = propagator.extract(Map.of("correlationId", " ", "transactionId", ""));

        assertFalse(extracted.hasCorrelation());
        assertSame(CorrelationContext.EMPTY, CorrelationContext.fromMetadata(null));
    }

    @Test
    void testInjectWritesOnlyPresentIds() {
        Map<String, String> carrier = new HashMap<>();
        carrier.put("tenant", "acme");

        propagator.inject(CorrelationContext.of("corr-1", null), carrier);

        assertEquals(Map.of("tenant", "acme", "correlationId", "corr-1"), carrier);
    }

    @Test
    void testInjectIntoImmutableCarrierDoesNotThrow() {
        assertDoesNotThrow(() -> propagator.inject(CorrelationContext.of("corr-1", "tx-1"), Map.of()));
    }
}
