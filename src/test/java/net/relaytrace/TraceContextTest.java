package net.relaytrace;

import net.relaytrace.Tracing.TraceContext;
import net.relaytrace.Tracing.TraceIds;
import org.junit.jupiter.api.Test;

import java.util.HashSet;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class TraceContextTest {

    @Test
    void testGeneratedIdsAreValidLowercaseHex() {
        for (int i = 0; i < 100; i++) {
            String traceId = TraceIds.newTraceId();
            String spanId = TraceIds.newSpanId();
            assertTrue(traceId.matches("[0-9a-f]{32}"), traceId);
            assertTrue(spanId.matches("[0-9a-f]{16}"), spanId);
            assertNotEquals("00000000000000000000000000000000", traceId);
            assertNotEquals("0000000000000000", spanId);
        }
    }

    @Test
    void testGeneratedIdsAreUnique() {
        Set<String> ids = new HashSet<>();
        for (int i = 0; i < 1000; i++) {
            ids.add(TraceIds.newSpanId());
        }
        assertEquals(1000, ids.size());
    }

    @Test
    void testRejectsInvalidIds() {
        assertThrows(IllegalArgumentException.class,
                () -> TraceContext.of("00000000000000000000000000000000", "00f067aa0ba902b7", true));
        assertThrows(IllegalArgumentException.class,
                () -> TraceContext.of("4bf92f3577b34da6a3ce929d0e0e4736", "0000000000000000", true));
        assertThrows(IllegalArgumentException.class,
                () -> TraceContext.of("abc", "00f067aa0ba902b7", true));
        assertThrows(IllegalArgumentException.class,
                () -> TraceContext.of(null, "00f067aa0ba902b7", true));
    }

    @Test
    void testNewChildKeepsTraceSamplingAndBaggage() {
        TraceContext parent = TraceContext.of("4bf92f3577b34da6a3ce929d0e0e4736", "00f067aa0ba902b7", false,
                Map.of("tenant", "acme"));

        TraceContext child = parent.newChild();

        assertEquals(parent.getTraceId(), child.getTraceId());
        assertNotEquals(parent.getSpanId(), child.getSpanId());
        assertFalse(child.isSampled());
        assertEquals(Map.of("tenant", "acme"), child.getBaggage());
    }

    @Test
    void testValueEquality() {
        TraceContext a = TraceContext.of("4bf92f3577b34da6a3ce929d0e0e4736", "00f067aa0ba902b7", true);
        TraceContext b = TraceContext.of("4bf92f3577b34da6a3ce929d0e0e4736", "00f067aa0ba902b7", true);

        assertEquals(a, b);
        assertEquals(a.hashCode(), b.hashCode());
        assertNotEquals(a, TraceContext.of("4bf92f3577b34da6a3ce929d0e0e4736", "00f067aa0ba902b7", false));
    }

    @Test
    void testBaggageIsImmutable() {
        TraceContext context = TraceContext.newRoot(true).withBaggage(Map.of("k", "v"));

        assertThrows(UnsupportedOperationException.class, () -> context.getBaggage().put("x", "y"));
    }
}
