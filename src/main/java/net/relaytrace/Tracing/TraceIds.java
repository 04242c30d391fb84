package net.relaytrace.Tracing;

import io.opentelemetry.api.trace.SpanId;
import io.opentelemetry.api.trace.TraceId;

import java.util.concurrent.ThreadLocalRandom;

/**
 * Random id generation for traces and spans.
 */
public final class TraceIds {

    private TraceIds() {
    }

    /**
     * @return a random, non-zero 128-bit trace id as 32 lowercase hex characters
     */
    public static String newTraceId() {
        ThreadLocalRandom random = ThreadLocalRandom.current();
        long high;
        long low;
        do {
            high = random.nextLong();
            low = random.nextLong();
        } while (high == 0 && low == 0);
        return TraceId.fromLongs(high, low);
    }

    /**
     * @return a random, non-zero 64-bit span id as 16 lowercase hex characters
     */
    public static String newSpanId() {
        ThreadLocalRandom random = ThreadLocalRandom.current();
        long id;
        do {
            id = random.nextLong();
        } while (id == 0);
        return SpanId.fromLong(id);
    }
}
