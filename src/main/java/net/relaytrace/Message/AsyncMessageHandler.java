package net.relaytrace.Message;

import java.util.concurrent.CompletableFuture;

/**
 * A handler whose work completes asynchronously.
 *
 * @param <R> the result type
 */
@FunctionalInterface
public interface AsyncMessageHandler<R> {

    CompletableFuture<R> handle(TracedMessage message);
}
