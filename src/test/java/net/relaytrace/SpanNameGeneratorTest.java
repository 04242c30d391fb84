package net.relaytrace;

import net.relaytrace.Message.MessageKind;
import net.relaytrace.Message.TracedMessage;
import net.relaytrace.SpanFactory.SpanNameGenerator;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class SpanNameGeneratorTest {

    private final SpanNameGenerator generator = new SpanNameGenerator();

    static class Outer {
        static class Inner {
        }
    }

    @Test
    void testDispatchNamesUseKindVerb() {
        assertEquals("Command: CreateOrder", generator.dispatchSpanName(TestMessages.command(new TestMessages.CreateOrder("o-1", 1))));
        assertEquals("Query: FindOrder", generator.dispatchSpanName(TestMessages.query(new TestMessages.FindOrder("o-1"))));
        assertEquals("Event: OrderCreated", generator.dispatchSpanName(TestMessages.event(new TestMessages.OrderCreated("o-1"))));
    }

    @Test
    void testHandlerName() {
        assertEquals("Handle: OrderCreated",
                generator.handlerSpanName(TestMessages.event(new TestMessages.OrderCreated("o-1"))));
    }

    @Test
    void testExplicitNameWinsOverPayloadType() {
        TracedMessage message = TracedMessage.builder()
                .identifier("m-1")
                .kind(MessageKind.COMMAND)
                .name("com.example.orders.PlaceOrder")
                .payload("raw")
                .build();

        assertEquals("Command: PlaceOrder", generator.dispatchSpanName(message));
    }

    @Test
    void testExtractMessageName() {
        assertEquals("CreateOrder", SpanNameGenerator.extractMessageName("com.example.CreateOrder", null));
        assertEquals("CreateOrder", SpanNameGenerator.extractMessageName("CreateOrder$$EnhancerByCGLIB$$1a2b3c", null));
        assertEquals("Inner", SpanNameGenerator.extractMessageName("com.example.Outer$Inner", null));
        assertEquals("Outer", SpanNameGenerator.extractMessageName("com.example.Outer$1", null));
        assertEquals("Inner", SpanNameGenerator.extractMessageName(null, Outer.Inner.class));
        assertEquals("Unknown", SpanNameGenerator.extractMessageName(null, null));
        assertEquals("Unknown", SpanNameGenerator.extractMessageName("  ", null));
    }

    @Test
    void testAnonymousPayloadTypeFallsBackToEnclosingName() {
        Object anonymous = new Object() {
        };

        assertEquals("SpanNameGeneratorTest", SpanNameGenerator.extractMessageName(null, anonymous.getClass()));
    }
}
