package net.relaytrace.Propagation;

import org.apache.kafka.common.header.Header;
import org.apache.kafka.common.header.Headers;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Utility class for moving a metadata carrier in and out of Kafka record headers,
 * so trace context survives a hop through a Kafka topic.
 */
public final class KafkaHeaderCarrier {

    private static final Logger logger = LoggerFactory.getLogger(KafkaHeaderCarrier.class);

    private KafkaHeaderCarrier() {
    }

    /**
     * Reads every header as a UTF-8 string. For repeated keys the last header wins,
     * matching {@link Headers#lastHeader(String)}.
     *
     * @param headers the Kafka headers, may be null
     * @return an ordered, mutable carrier map
     */
    public static Map<String, String> toCarrier(Headers headers) {
        Map<String, String> carrier = new LinkedHashMap<>();
        if (headers == null) {
            return carrier;
        }
        for (Header header : headers) {
            if (header.value() == null) {
                continue;
            }
            carrier.put(header.key(), new String(header.value(), StandardCharsets.UTF_8));
        }
        return carrier;
    }

    /**
     * Copies the trace context keys of {@code carrier} onto {@code headers}, replacing any
     * trace headers already there. Other headers are left alone.
     */
    public static void inject(Map<String, String> carrier, Headers headers) {
        if (carrier == null || headers == null) {
            return;
        }
        try {
            replace(headers, TraceContextPropagator.TRACEPARENT, carrier.get(TraceContextPropagator.TRACEPARENT));
            replace(headers, TraceContextPropagator.BAGGAGE, carrier.get(TraceContextPropagator.BAGGAGE));
        } catch (IllegalStateException e) {
            // headers of a record that was already sent are read-only
            logger.warn("failed to write trace headers: {}", e.getMessage());
        }
    }

    private static void replace(Headers headers, String key, String value) {
        headers.remove(key);
        if (value != null) {
            headers.add(key, value.getBytes(StandardCharsets.UTF_8));
            logger.debug("set trace header {} = {}", key, value);
        }
    }
}
