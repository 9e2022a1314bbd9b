package io.framerelay.transport.impl;

import com.google.protobuf.UnsafeByteOperations;
import io.framerelay.api.RelayApi;
import io.framerelay.core.model.FeedMessage;
import io.framerelay.registry.SubscriberRegistry;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.SimpleChannelInboundHandler;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Feed stream endpoint: every connection is a subscriber for its whole lifetime.
 */
@Slf4j
@RequiredArgsConstructor
public class FeedStreamHandler extends SimpleChannelInboundHandler<RelayApi.Envelope> {

    private final SubscriberRegistry registry;
    private ChannelSubscriber subscriber;

    static RelayApi.Envelope encode(final FeedMessage message) {
        return RelayApi.Envelope.newBuilder()
                .setFrame(RelayApi.FramePush.newBuilder()
                        .setFeed(message.feed())
                        .setData(UnsafeByteOperations.unsafeWrap(message.data()))
                        .setFrameId(message.frameId()))
                .build();
    }

    @Override
    public void channelActive(final ChannelHandlerContext ctx) throws Exception {
        final String id = "stream-" + ctx.channel().id().asShortText();
        subscriber = new ChannelSubscriber(id, ctx.channel(), FeedStreamHandler::encode);

        ctx.writeAndFlush(RelayApi.Envelope.newBuilder()
                .setWelcome(RelayApi.Welcome.newBuilder().setSubscriberId(id))
                .build());
        registry.add(subscriber);
        super.channelActive(ctx);
    }

    @Override
    protected void channelRead0(final ChannelHandlerContext ctx, final RelayApi.Envelope env) {
        log.debug("Ignoring inbound {} from {}", env.getKindCase(), ctx.channel().remoteAddress());
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
        log.warn("Feed stream subscriber {} failed: {}", ctx.channel().remoteAddress(), cause.toString());
        ctx.close();
    }
}
