package net.relaytrace.Attributes;

import net.relaytrace.Message.TracedMessage;

import java.util.Map;

/**
 * Contributes extra span attributes for a message.
 *
 * Providers are applied in ascending {@link #priority()}, so on a key collision the
 * provider with the highest priority wins. A null value means "no value for this key"
 * and is skipped.
 */
public interface AttributeProvider {

    Map<String, Object> provideAttributes(TracedMessage message);

    default int priority() {
        return 0;
    }
}
