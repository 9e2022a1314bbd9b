package io.framerelay.relay.ingress;

import io.framerelay.core.chunk.ChunkHeaderCodec;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.net.StandardSocketOptions;
import java.nio.ByteBuffer;
import java.nio.channels.DatagramChannel;

/**
 * {@link DatagramSource} over a blocking UDP {@link DatagramChannel}.
 */
@Slf4j
public final class UdpDatagramSource implements DatagramSource {

    /** Largest UDP payload over IPv4. */
    public static final int MAX_DATAGRAM = 65_507;
    private static final int RECEIVE_BUFFER_BYTES = 4 * 1024 * 1024;

    private final DatagramChannel channel;
    private final ByteBuffer buffer;
    private final InetSocketAddress localAddress;

    /**
     * Binds immediately.
     *
     * @throws SocketFaultException if the socket cannot be opened or bound
     */
    public UdpDatagramSource(final InetSocketAddress bind, final int maxChunkPayload) {
        /* one spare byte so an over-long datagram is seen as such instead of silently truncated to fit */
        final int capacity = Math.min(MAX_DATAGRAM, ChunkHeaderCodec.HEADER_BYTES + maxChunkPayload + 1);
        this.buffer = ByteBuffer.allocate(capacity);

        DatagramChannel ch = null;
        try {
            ch = DatagramChannel.open();
            ch.setOption(StandardSocketOptions.SO_RCVBUF, RECEIVE_BUFFER_BYTES);
            ch.bind(bind);
            this.localAddress = (InetSocketAddress) ch.getLocalAddress();
        } catch (final IOException e) {
            closeQuietly(ch);
            throw new SocketFaultException("Failed to bind UDP receive socket on " + bind, e);
        }
        this.channel = ch;
        log.info("UDP receive socket bound on {}", localAddress);
    }

    public InetSocketAddress localAddress() {
        return localAddress;
    }

    @Override
    public byte[] readChunk() throws IOException {
        buffer.clear();
        channel.receive(buffer);
        buffer.flip();

        final byte[] out = new byte[buffer.remaining()];
        buffer.get(out);
        return out;
    }

    @Override
    public void close() throws IOException {
        if (channel.isOpen()) {
            channel.close();
            log.info("UDP receive socket on {} closed", localAddress);
        }
    }

    private static void closeQuietly(final DatagramChannel ch) {
        if (ch == null) return;
        try {
            ch.close();
        } catch (final IOException e) {
            log.debug("Failed to close half-open UDP socket", e);
        }
    }
}
