package io.framerelay.transport.type;

import io.framerelay.api.RelayApi;
import io.framerelay.registry.SubscriberRegistry;
import io.framerelay.transport.impl.FeedStreamHandler;
import io.netty.channel.ChannelPipeline;
import io.netty.channel.socket.SocketChannel;
import io.netty.handler.codec.protobuf.ProtobufDecoder;
import io.netty.handler.codec.protobuf.ProtobufEncoder;
import io.netty.handler.codec.protobuf.ProtobufVarint32FrameDecoder;
import io.netty.handler.codec.protobuf.ProtobufVarint32LengthFieldPrepender;

/**
 * Binary feed stream: varint32 length-prefixed protobuf {@link RelayApi.Envelope} messages over TCP.
 */
public class FeedStreamTransport extends NettyServerTransport {

    private final SubscriberRegistry registry;

    public FeedStreamTransport(final String host, final int port, final SubscriberRegistry registry) {
        super("Feed stream transport", host, port);
        this.registry = registry;
    }

    @Override
    protected void initPipeline(final SocketChannel ch) {
        final ChannelPipeline p = ch.pipeline();

        /* Protocol Buffers framing (varint32 length prefix) */
        p.addLast(new ProtobufVarint32FrameDecoder());
        p.addLast(new ProtobufDecoder(RelayApi.Envelope.getDefaultInstance()));
        p.addLast(new ProtobufVarint32LengthFieldPrepender());
        p.addLast(new ProtobufEncoder());

        p.addLast(new FeedStreamHandler(registry));
    }
}
