package net.relaytrace.Tracing;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;
import org.springframework.lang.Nullable;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Business-level ids that group messages beyond a single trace.
 *
 * The correlation id links a message to the messages it caused (a command and its events).
 * The transaction id groups every operation of one business transaction, possibly spread
 * over several traces and services. Either may be absent.
 */
@Getter
@EqualsAndHashCode
@ToString
public final class CorrelationContext {

    public static final String CORRELATION_ID_KEY = "correlationId";
    public static final String TRANSACTION_ID_KEY = "transactionId";

    public static final CorrelationContext EMPTY = new CorrelationContext(null, null);

    @Nullable
    private final String correlationId;
    @Nullable
    private final String transactionId;

    private CorrelationContext(@Nullable String correlationId, @Nullable String transactionId) {
        this.correlationId = correlationId;
        this.transactionId = transactionId;
    }

    public static CorrelationContext of(@Nullable String correlationId, @Nullable String transactionId) {
        return new CorrelationContext(blankToNull(correlationId), blankToNull(transactionId));
    }

    /**
     * Reads both ids from a metadata carrier. Blank values count as absent.
     */
    public static CorrelationContext fromMetadata(@Nullable Map<String, String> metadata) {
        if (metadata == null || metadata.isEmpty()) {
            return EMPTY;
        }
        return of(metadata.get(CORRELATION_ID_KEY), metadata.get(TRANSACTION_ID_KEY));
    }

    public boolean hasCorrelation() {
        return correlationId != null || transactionId != null;
    }

    /**
     * @return the present ids under their metadata keys
     */
    public Map<String, String> toMetadata() {
        Map<String, String> metadata = new LinkedHashMap<>();
        if (correlationId != null) {
            metadata.put(CORRELATION_ID_KEY, correlationId);
        }
        if (transactionId != null) {
            metadata.put(TRANSACTION_ID_KEY, transactionId);
        }
        return metadata;
    }

    @Nullable
    private static String blankToNull(@Nullable String value) {
        return value == null || value.isBlank() ? null : value;
    }
}
