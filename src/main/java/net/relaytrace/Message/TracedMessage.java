package net.relaytrace.Message;

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;
import org.springframework.lang.Nullable;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * The view of a bus message that the tracing core works with: identity, kind, an optional
 * logical name, the payload and the metadata carrier.
 *
 * Instances are immutable. Interceptors return enriched copies via
 * {@link #withMetadata(Map)}.
 */
@Getter
@ToString(exclude = "payload")
public final class TracedMessage {

    private final String identifier;
    private final MessageKind kind;

    /** Logical message name; when absent the payload type name is used. */
    @Nullable
    private final String name;

    @Nullable
    private final Object payload;

    /** Ordered string-to-string carrier; insertion order is preserved. */
    private final Map<String, String> metadata;

    @Builder(toBuilder = true)
    private TracedMessage(String identifier,
                          MessageKind kind,
                          @Nullable String name,
                          @Nullable Object payload,
                          @Nullable Map<String, String> metadata) {
        if (identifier == null || identifier.isBlank()) {
            throw new IllegalArgumentException("message identifier must not be blank");
        }
        this.identifier = identifier;
        this.kind = Objects.requireNonNull(kind, "kind");
        this.name = name;
        this.payload = payload;
        this.metadata = metadata == null || metadata.isEmpty()
                ? Collections.emptyMap()
                : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }

    @Nullable
    public Class<?> getPayloadType() {
        return payload != null ? payload.getClass() : null;
    }

    /**
     * @return a copy of this message carrying {@code newMetadata}
     */
    public TracedMessage withMetadata(Map<String, String> newMetadata) {
        return toBuilder().metadata(newMetadata).build();
    }
}
