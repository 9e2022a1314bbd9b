package io.framerelay.transport.type;

import io.netty.bootstrap.ServerBootstrap;
import io.netty.channel.ChannelFuture;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelOption;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.IoHandlerFactory;
import io.netty.channel.MultiThreadIoEventLoopGroup;
import io.netty.channel.nio.NioIoHandler;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioServerSocketChannel;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.net.InetSocketAddress;

/**
 * Netty TCP server skeleton shared by the subscriber endpoints; subclasses supply the pipeline.
 */
@Slf4j
public abstract class NettyServerTransport {
    private final String name;
    private final String host;
    @Getter private int port;

    private EventLoopGroup bossGroup;
    private EventLoopGroup workerGroup;

    protected NettyServerTransport(final String name, final String host, final int port) {
        this.name = name;
        this.host = host;
        this.port = port;
    }

    protected abstract void initPipeline(SocketChannel ch);

    /**
     * Binds the server socket; on failure the event loops are shut down before the error propagates.
     */
    public void start() throws InterruptedException {
        final IoHandlerFactory factory = NioIoHandler.newFactory();

        /*
         * 1 boss thread accepting connections; 0 workers means the default of 2 x cores.
         */
        bossGroup = new MultiThreadIoEventLoopGroup(1, factory);
        workerGroup = new MultiThreadIoEventLoopGroup(0, factory);

        final ServerBootstrap b = new ServerBootstrap();
        b.group(bossGroup, workerGroup)
                .channel(NioServerSocketChannel.class)
                .childHandler(new ChannelInitializer<SocketChannel>() {
                    @Override
                    protected void initChannel(final SocketChannel ch) {
                        initPipeline(ch);
                    }
                })
                /*
                 * TCP_NODELAY: frames are latency sensitive, no Nagle batching.
                 * SO_KEEPALIVE: detect dead subscribers at TCP level.
                 */
                .childOption(ChannelOption.TCP_NODELAY, true)
                .childOption(ChannelOption.SO_KEEPALIVE, true);

        final ChannelFuture f;
        try {
            f = b.bind(new InetSocketAddress(host, port)).sync();
        } catch (final Exception e) {
            log.error("{} failed to bind {}:{}", name, host, port);
            stop();
            throw e;
        }
        port = ((InetSocketAddress) f.channel().localAddress()).getPort();
        log.info("{} started on {}:{}", name, host, port);

        f.channel().closeFuture().addListener(cf -> stop());
    }

    public void stop() {
        if (bossGroup != null) bossGroup.shutdownGracefully();
        if (workerGroup != null) workerGroup.shutdownGracefully();
    }
}
