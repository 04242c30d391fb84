package net.relaytrace.SpanFactory;

import io.opentelemetry.api.trace.SpanKind;
import net.relaytrace.Message.MessageKind;

/**
 * Maps message kinds to OpenTelemetry span kinds.
 *
 * Request/response messages are a synchronous call (CLIENT to SERVER), events are
 * asynchronous messaging (PRODUCER to CONSUMER).
 */
public final class SpanKindResolver {

    private SpanKindResolver() {
    }

    public static SpanKind dispatchKind(MessageKind kind) {
        return kind.isRequestResponse() ? SpanKind.CLIENT : SpanKind.PRODUCER;
    }

    public static SpanKind handlerKind(MessageKind kind) {
        return kind.isRequestResponse() ? SpanKind.SERVER : SpanKind.CONSUMER;
    }
}
