package io.framerelay.transport.type;

import io.framerelay.registry.SubscriberRegistry;
import io.framerelay.transport.impl.WebSocketSubscriberHandler;
import io.netty.channel.ChannelPipeline;
import io.netty.channel.socket.SocketChannel;
import io.netty.handler.codec.http.HttpObjectAggregator;
import io.netty.handler.codec.http.HttpServerCodec;
import io.netty.handler.codec.http.websocketx.WebSocketServerProtocolHandler;

/**
 * WebSocket endpoint pushing JSON feed messages to browser subscribers.
 */
public class WebSocketTransport extends NettyServerTransport {

    private static final int MAX_HANDSHAKE_BYTES = 64 * 1024;
    private static final int MAX_INBOUND_FRAME_BYTES = 64 * 1024;

    private final String path;
    private final SubscriberRegistry registry;

    public WebSocketTransport(final String host, final int port, final String path, final SubscriberRegistry registry) {
        super("WebSocket transport", host, port);
        this.path = path;
        this.registry = registry;
    }

    @Override
    protected void initPipeline(final SocketChannel ch) {
        final ChannelPipeline p = ch.pipeline();
        p.addLast(new HttpServerCodec());
        p.addLast(new HttpObjectAggregator(MAX_HANDSHAKE_BYTES));
        p.addLast(new WebSocketServerProtocolHandler(path, null, true, MAX_INBOUND_FRAME_BYTES));
        p.addLast(new WebSocketSubscriberHandler(registry));
    }
}
