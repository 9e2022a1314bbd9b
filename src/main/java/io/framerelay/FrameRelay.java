package io.framerelay;

import io.framerelay.config.impl.RelayConfig;
import io.framerelay.core.assembly.FrameAssembler;
import io.framerelay.core.queue.BoundedFrameQueue;
import io.framerelay.registry.SubscriberRegistry;
import io.framerelay.relay.delivery.Broadcaster;
import io.framerelay.relay.delivery.FeedDeriver;
import io.framerelay.relay.ingress.FrameReceiver;
import io.framerelay.relay.ingress.UdpDatagramSource;
import io.framerelay.relay.stats.RelayStats;
import io.framerelay.transport.type.FeedStreamTransport;
import io.framerelay.transport.type.WebSocketTransport;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Wires the receive path, the frame queue, the broadcaster and the subscriber endpoints together.
 * <p>
 * Every shared component is created here and passed by reference; nothing is process-global.
 */
@Slf4j
public final class FrameRelay implements AutoCloseable {

    @Getter private final RelayConfig config;
    @Getter private final RelayStats stats = new RelayStats();
    @Getter private final BoundedFrameQueue queue;
    @Getter private final SubscriberRegistry registry = new SubscriberRegistry();

    private final List<FeedDeriver> derivers;
    private final ExecutorService fanOut;
    private final ScheduledExecutorService statsLogger;

    private UdpDatagramSource source;
    private FrameReceiver receiver;
    private Broadcaster broadcaster;
    private WebSocketTransport webSocket;
    private FeedStreamTransport feedStream;

    public FrameRelay(final RelayConfig config, final List<FeedDeriver> derivers) {
        this.config = config;
        this.derivers = List.copyOf(derivers);
        this.queue = new BoundedFrameQueue(config.getQueueCapacity());
        this.fanOut = Executors.newCachedThreadPool(daemonThreads("relay-fanout-"));
        this.statsLogger = Executors.newSingleThreadScheduledExecutor(daemonThreads("relay-stats-"));
    }

    /**
     * Binds every socket and starts the loops.
     *
     * @return completes when the receive path ends; exceptionally on a socket fault
     * @throws io.framerelay.relay.ingress.SocketFaultException if the UDP socket cannot be bound
     * @throws InterruptedException if interrupted while binding the subscriber endpoints
     */
    public CompletableFuture<Void> start() throws InterruptedException {
        /* UDP first: a bind failure must surface before anything else is listening */
        source = new UdpDatagramSource(config.getUdpBind(), config.getMaxChunkPayload());

        webSocket = new WebSocketTransport(
                config.getWebSocketBind().getHostString(),
                config.getWebSocketBind().getPort(),
                config.getWebSocketPath(),
                registry);
        webSocket.start();

        if (config.isFeedStreamEnabled()) {
            feedStream = new FeedStreamTransport(config.getWebSocketBind().getHostString(), config.getFeedStreamPort(), registry);
            feedStream.start();
        }

        broadcaster = new Broadcaster(
                queue,
                registry,
                derivers,
                fanOut,
                config.getPollTimeout(),
                config.getSendTimeout(),
                stats);
        broadcaster.start();

        final FrameAssembler assembler = new FrameAssembler(
                config.getMaxChunkPayload(),
                config.getMaxFrameSize(),
                config.getExpectedFrameSize(),
                config.getAssemblyTimeout(),
                config.getLateStartWindow(),
                stats,
                System::nanoTime);

        receiver = new FrameReceiver(source, assembler, queue, stats);

        if (!config.getStatsInterval().isZero()) {
            final long period = config.getStatsInterval().toSeconds();
            statsLogger.scheduleAtFixedRate(
                    () -> log.info("Relay stats: {}", stats.summary(queue, registry)),
                    period, period, TimeUnit.SECONDS);
        }

        return receiver.start();
    }

    public InetSocketAddress udpAddress() {
        return source.localAddress();
    }

    public int webSocketPort() {
        return webSocket.getPort();
    }

    public int feedStreamPort() {
        return feedStream == null ? -1 : feedStream.getPort();
    }

    public long lastFrameId() {
        return broadcaster == null ? 0L : broadcaster.lastFrameId();
    }

    @Override
    public void close() throws InterruptedException {
        if (receiver != null) {
            receiver.close();
        } else if (source != null) {
            /* start() failed after the UDP bind; the receiver never took ownership of the socket */
            try {
                source.close();
            } catch (final IOException e) {
                log.warn("Failed to close UDP receive socket", e);
            }
        }
        if (broadcaster != null) broadcaster.close();
        if (webSocket != null) webSocket.stop();
        if (feedStream != null) feedStream.stop();
        statsLogger.shutdownNow();
        fanOut.shutdown();
        if (!fanOut.awaitTermination(config.getSendTimeout().toMillis() + 500L, TimeUnit.MILLISECONDS)) {
            fanOut.shutdownNow();
        }
        log.info("Relay stats at shutdown: {}", stats.summary(queue, registry));
    }

    private static ThreadFactory daemonThreads(final String prefix) {
        final AtomicInteger n = new AtomicInteger();
        return r -> {
            final Thread t = new Thread(r, prefix + n.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }
}
