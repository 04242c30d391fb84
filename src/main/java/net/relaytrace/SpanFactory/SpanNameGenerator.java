package net.relaytrace.SpanFactory;

import net.relaytrace.Message.TracedMessage;
import org.springframework.lang.Nullable;

/**
 * Produces span names: {@code "Command: X"}, {@code "Query: X"} and {@code "Event: X"} for
 * dispatch, {@code "Handle: X"} for handling.
 */
public class SpanNameGenerator {

    public static final String HANDLER_PREFIX = "Handle";
    public static final String UNKNOWN = "Unknown";

    public String dispatchSpanName(TracedMessage message) {
        return message.getKind().getVerb() + ": " + messageName(message);
    }

    public String handlerSpanName(TracedMessage message) {
        return HANDLER_PREFIX + ": " + messageName(message);
    }

    public String messageName(TracedMessage message) {
        return extractMessageName(message.getName(), message.getPayloadType());
    }

    /**
     * Reduces a message name or payload type to a short, readable name.
     *
     * <ul>
     *     <li>{@code com.example.CreateOrder} becomes {@code CreateOrder}</li>
     *     <li>{@code CreateOrder$$EnhancerByCGLIB$$1a2b} becomes {@code CreateOrder}</li>
     *     <li>{@code Orders$Create} becomes {@code Create}</li>
     *     <li>{@code Orders$1} becomes {@code Orders}</li>
     * </ul>
     *
     * @return the cleaned name, or {@code "Unknown"} if nothing usable is left
     */
    public static String extractMessageName(@Nullable String messageName, @Nullable Class<?> payloadType) {
        String rawName;
        if (messageName != null && !messageName.isBlank()) {
            rawName = messageName;
        } else if (payloadType != null) {
            rawName = payloadType.getSimpleName().isEmpty() ? payloadType.getName() : payloadType.getSimpleName();
        } else {
            return UNKNOWN;
        }

        String simpleName = rawName.substring(rawName.lastIndexOf('.') + 1);

        int proxySuffix = simpleName.indexOf("$$");
        String withoutProxy = proxySuffix >= 0 ? simpleName.substring(0, proxySuffix) : simpleName;

        String[] parts = withoutProxy.split("\\$");
        String cleaned = null;
        for (int i = parts.length - 1; i >= 0; i--) {
            if (!parts[i].isBlank() && !isNumeric(parts[i])) {
                cleaned = parts[i];
                break;
            }
        }
        if (cleaned == null) {
            cleaned = parts.length > 0 ? parts[0] : "";
        }
        return cleaned.isBlank() ? UNKNOWN : cleaned.trim();
    }

    private static boolean isNumeric(String part) {
        for (int i = 0; i < part.length(); i++) {
            if (!Character.isDigit(part.charAt(i))) {
                return false;
            }
        }
        return true;
    }
}
