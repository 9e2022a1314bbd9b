package io.framerelay.registry;

import io.framerelay.core.model.FeedMessage;

import java.util.concurrent.CompletableFuture;

/**
 * A push sink for feed messages. Identity for registry membership is {@link #id()}.
 */
public interface Subscriber {

    String id();

    /**
     * Starts delivery of one message. The returned future completes when the transport has
     * accepted the message, or exceptionally if it could not.
     */
    CompletableFuture<Void> send(FeedMessage message);

    /**
     * Releases the underlying connection. Called after the subscriber is dropped for a failed delivery.
     */
    default void close() {
    }

    default String describe() {
        return id();
    }
}
