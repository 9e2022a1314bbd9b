package io.framerelay.transport.impl;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.framerelay.core.model.FeedMessage;
import io.netty.handler.codec.http.websocketx.TextWebSocketFrame;

import java.io.UncheckedIOException;

/**
 * JSON form of the WebSocket push messages.
 * <pre>
 * {"type":"frame","feed":"original","data":"&lt;base64&gt;","frameId":42}
 * {"type":"test","message":"connected"}
 * </pre>
 */
public final class FeedMessageJson {

    public static final String TYPE_WELCOME = "test";

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private FeedMessageJson() {
    }

    public static String toJson(final FeedMessage message) {
        try {
            return MAPPER.writeValueAsString(message);
        } catch (final JsonProcessingException e) {
            throw new UncheckedIOException("Failed to serialize feed message " + message.feed(), e);
        }
    }

    public static FeedMessage fromJson(final String json) {
        try {
            return MAPPER.readValue(json, FeedMessage.class);
        } catch (final JsonProcessingException e) {
            throw new UncheckedIOException("Malformed feed message", e);
        }
    }

    public static TextWebSocketFrame toFrame(final FeedMessage message) {
        return new TextWebSocketFrame(toJson(message));
    }

    public static String welcome() {
        final ObjectNode node = MAPPER.createObjectNode();
        node.put("type", TYPE_WELCOME);
        node.put("message", "connected");
        return node.toString();
    }
}
