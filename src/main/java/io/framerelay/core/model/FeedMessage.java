package io.framerelay.core.model;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/**
 * Consumer-facing push message: one feed of one frame.
 * <p>
 * {@code frameId} is shared by all feeds of the same frame and by all subscribers.
 */
@JsonPropertyOrder({"type", "feed", "data", "frameId"})
public record FeedMessage(String type, String feed, byte[] data, long frameId) {

    public static final String TYPE_FRAME = "frame";

    public static FeedMessage of(final Feed feed, final long frameId) {
        return new FeedMessage(TYPE_FRAME, feed.name(), feed.data(), frameId);
    }
}
