package net.relaytrace;

import net.relaytrace.Message.MessageKind;
import net.relaytrace.Tracing.AttributeValue;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class AttributeValueTest {

    @Test
    void testIntegralNumbersBecomeLong() {
        assertEquals(AttributeValue.of(42L), AttributeValue.from(42));
        assertEquals(AttributeValue.of(42L), AttributeValue.from((short) 42));
        assertEquals(AttributeValue.of(42L), AttributeValue.from(42L));
        assertEquals(AttributeValue.Type.LONG, AttributeValue.from(BigInteger.TEN).getType());
    }

    @Test
    void testFloatingNumbersBecomeDouble() {
        assertEquals(AttributeValue.Type.DOUBLE, AttributeValue.from(1.5f).getType());
        assertEquals(AttributeValue.of(2.5), AttributeValue.from(2.5));
    }

    @Test
    void testBooleanStaysBoolean() {
        assertEquals(AttributeValue.of(true), AttributeValue.from(Boolean.TRUE));
    }

    @Test
    void testEverythingElseBecomesString() {
        assertEquals(AttributeValue.of("COMMAND"), AttributeValue.from(MessageKind.COMMAND));
        assertEquals(AttributeValue.of("[a, b]"), AttributeValue.from(List.of("a", "b")));
        assertEquals(AttributeValue.of("1.10"), AttributeValue.from(new BigDecimal("1.10")));
        assertEquals(AttributeValue.of("text"), AttributeValue.from(new StringBuilder("text")));
    }

    @Test
    void testNullIsRejected() {
        assertThrows(NullPointerException.class, () -> AttributeValue.from(null));
    }
}
