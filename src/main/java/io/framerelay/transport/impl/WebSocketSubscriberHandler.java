package io.framerelay.transport.impl;

import io.framerelay.registry.SubscriberRegistry;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.handler.codec.http.websocketx.TextWebSocketFrame;
import io.netty.handler.codec.http.websocketx.WebSocketFrame;
import io.netty.handler.codec.http.websocketx.WebSocketServerProtocolHandler;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Registers a WebSocket connection as a subscriber once the handshake completes and removes it
 * when the channel goes inactive. Inbound frames carry nothing the relay needs and are dropped.
 */
@Slf4j
@RequiredArgsConstructor
public class WebSocketSubscriberHandler extends SimpleChannelInboundHandler<WebSocketFrame> {

    private final SubscriberRegistry registry;
    private ChannelSubscriber subscriber;

    @Override
    public void userEventTriggered(final ChannelHandlerContext ctx, final Object evt) throws Exception {
        if (evt instanceof WebSocketServerProtocolHandler.HandshakeComplete) {
            subscriber = new ChannelSubscriber(
                    "ws-" + ctx.channel().id().asShortText(),
                    ctx.channel(),
                    FeedMessageJson::toFrame);

            ctx.writeAndFlush(new TextWebSocketFrame(FeedMessageJson.welcome()));
            registry.add(subscriber);
            return;
        }
        super.userEventTriggered(ctx, evt);
    }

    @Override
    protected void channelRead0(final ChannelHandlerContext ctx, final WebSocketFrame frame) {
        log.debug("Ignoring inbound {} from {}", frame.getClass().getSimpleName(), ctx.channel().remoteAddress());
    }

    @Override
    public void channelInactive(final ChannelHandlerContext ctx) throws Exception {
        if (subscriber != null) {
            registry.remove(subscriber);
        }
        super.channelInactive(ctx);
    }

    @Override
    public void exceptionCaught(final ChannelHandlerContext ctx, final Throwable cause) {
        log.warn("WebSocket subscriber {} failed: {}", ctx.channel().remoteAddress(), cause.toString());
        ctx.close();
    }
}
