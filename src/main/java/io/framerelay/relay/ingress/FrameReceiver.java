package io.framerelay.relay.ingress;

import io.framerelay.core.assembly.FrameAssembler;
import io.framerelay.core.chunk.Chunk;
import io.framerelay.core.chunk.ChunkHeaderCodec;
import io.framerelay.core.chunk.MalformedHeaderException;
import io.framerelay.core.model.Frame;
import io.framerelay.core.queue.BoundedFrameQueue;
import io.framerelay.relay.stats.RelayStats;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * The receive path: reads datagrams one at a time, decodes them, feeds the assembler and pushes
 * completed frames into the queue.
 * <p>
 * Runs on a single dedicated thread, the only one that touches the assembler. Per-datagram
 * problems are counted and dropped; only socket faults end the loop abnormally. The source is
 * closed on every exit path.
 */
@Slf4j
public final class FrameReceiver implements AutoCloseable {

    private final DatagramSource source;
    private final FrameAssembler assembler;
    private final BoundedFrameQueue queue;
    private final RelayStats stats;
    private final CompletableFuture<Void> termination = new CompletableFuture<>();

    private volatile boolean closed;
    private volatile Thread thread;

    public FrameReceiver(final DatagramSource source,
                         final FrameAssembler assembler,
                         final BoundedFrameQueue queue,
                         final RelayStats stats) {
        this.source = source;
        this.assembler = assembler;
        this.queue = queue;
        this.stats = stats;
    }

    /**
     * Starts the receive loop.
     *
     * @return completes normally after {@link #close()} or when the source is exhausted, and
     * exceptionally with {@link SocketFaultException} if the socket fails
     */
    public synchronized CompletableFuture<Void> start() {
        if (thread != null) {
            throw new IllegalStateException("Receiver already started");
        }
        final Thread t = new Thread(this::run, "relay-receiver");
        t.setDaemon(true);
        thread = t;
        t.start();
        return termination;
    }

    public CompletableFuture<Void> termination() {
        return termination;
    }

    /**
     * Processes one datagram.
     *
     * @return the frame completed by this datagram, if any
     */
    public Optional<Frame> ingest(final byte[] datagram) {
        stats.recordDatagram();

        final Chunk chunk;
        try {
            chunk = ChunkHeaderCodec.decode(datagram);
        } catch (final MalformedHeaderException e) {
            stats.recordMalformed();
            log.debug("Dropped datagram: {}", e.getMessage());
            return Optional.empty();
        }

        final Optional<Frame> frame = assembler.ingest(chunk);
        frame.ifPresent(f -> {
            if (queue.push(f)) {
                log.debug("Frame queue full; oldest frame dropped ({} total)", queue.dropped());
            }
        });
        return frame;
    }

    @Override
    public void close() {
        closed = true;
        closeSource();
    }

    private void run() {
        try {
            while (!closed) {
                final byte[] datagram = source.readChunk();
                if (datagram == null) {
                    log.info("Datagram source exhausted");
                    break;
                }
                ingest(datagram);
            }
            termination.complete(null);
        } catch (final IOException e) {
            if (closed) {
                termination.complete(null);
            } else {
                log.error("Receive socket failed", e);
                termination.completeExceptionally(new SocketFaultException("Receive socket failed", e));
            }
        } catch (final RuntimeException e) {
            log.error("Receive loop crashed", e);
            termination.completeExceptionally(e);
        } finally {
            closeSource();
            log.info("Receiver stopped");
        }
    }

    private void closeSource() {
        try {
            source.close();
        } catch (final IOException e) {
            log.warn("Failed to close datagram source", e);
        }
    }
}
