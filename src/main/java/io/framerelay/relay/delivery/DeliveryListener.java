package io.framerelay.relay.delivery;

import io.framerelay.registry.Subscriber;

/**
 * Observes fan-out results. Callbacks run on whichever thread completed the delivery and must not block.
 */
public interface DeliveryListener {

    DeliveryListener NOOP = new DeliveryListener() {
    };

    default void onBroadcast(final long frameId, final int feeds, final int subscribers) {
    }

    default void onDelivered(final Subscriber subscriber, final long frameId) {
    }

    /**
     * The subscriber has already been removed from the registry when this is called.
     */
    default void onFailed(final Subscriber subscriber, final long frameId, final Throwable cause) {
    }

    /**
     * The frame was not sent because the subscriber's previous delivery was still in flight.
     */
    default void onSkipped(final Subscriber subscriber, final long frameId) {
    }
}
