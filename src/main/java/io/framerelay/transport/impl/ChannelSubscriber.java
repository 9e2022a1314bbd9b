package io.framerelay.transport.impl;

import io.framerelay.core.model.FeedMessage;
import io.framerelay.registry.Subscriber;
import io.netty.channel.Channel;

import java.nio.channels.ClosedChannelException;
import java.util.concurrent.CompletableFuture;
import java.util.function.Function;

/**
 * {@link Subscriber} backed by a Netty channel. The encoder turns a feed message into the
 * channel's outbound message type.
 */
public final class ChannelSubscriber implements Subscriber {
    private final String id;
    private final Channel channel;
    private final Function<FeedMessage, Object> encoder;

    public ChannelSubscriber(final String id, final Channel channel, final Function<FeedMessage, Object> encoder) {
        this.id = id;
        this.channel = channel;
        this.encoder = encoder;
    }

    @Override
    public String id() {
        return id;
    }

    /**
     * Completes once Netty has flushed the message to the socket.
     */
    @Override
    public CompletableFuture<Void> send(final FeedMessage message) {
        final CompletableFuture<Void> done = new CompletableFuture<>();
        if (!channel.isActive()) {
            done.completeExceptionally(new ClosedChannelException());
            return done;
        }

        channel.writeAndFlush(encoder.apply(message)).addListener(f -> {
            if (f.isSuccess()) {
                done.complete(null);
            } else {
                done.completeExceptionally(f.cause());
            }
        });
        return done;
    }

    @Override
    public void close() {
        channel.close();
    }

    @Override
    public String describe() {
        return id + "@" + channel.remoteAddress();
    }
}
