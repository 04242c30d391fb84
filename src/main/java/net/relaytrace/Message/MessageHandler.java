package net.relaytrace.Message;

import org.springframework.lang.Nullable;

/**
 * The next step of a handler chain, typically the business handler itself.
 */
@FunctionalInterface
public interface MessageHandler {

    @Nullable
    Object handle(TracedMessage message) throws Exception;
}
