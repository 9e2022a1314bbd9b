package io.framerelay.client;

import io.framerelay.config.impl.RelayConfig;
import io.framerelay.core.chunk.FrameChunker;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.nio.ByteBuffer;
import java.nio.channels.DatagramChannel;
import java.nio.file.Files;
import java.nio.file.Paths;
import java.util.List;

/**
 * Producer side of the chunk protocol: splits each frame and sends its datagrams to the relay.
 */
@Slf4j
public final class UdpFrameSender implements AutoCloseable {

    private final DatagramChannel channel;
    private final InetSocketAddress target;
    @Getter private final int maxChunkPayload;

    public UdpFrameSender(final InetSocketAddress target, final int maxChunkPayload) throws IOException {
        this.channel = DatagramChannel.open();
        this.target = target;
        this.maxChunkPayload = maxChunkPayload;
    }

    /**
     * Sends every chunk of {@code frame}, index 0 first.
     *
     * @return number of datagrams sent
     */
    public int send(final byte[] frame) throws IOException {
        final List<byte[]> datagrams = FrameChunker.split(frame, maxChunkPayload);
        for (final byte[] d : datagrams) {
            channel.send(ByteBuffer.wrap(d), target);
        }
        return datagrams.size();
    }

    /**
     * Sends pre-encoded datagrams in the given order; used to replay loss and reordering.
     */
    public void sendRaw(final List<byte[]> datagrams) throws IOException {
        for (final byte[] d : datagrams) {
            channel.send(ByteBuffer.wrap(d), target);
        }
    }

    @Override
    public void close() throws IOException {
        channel.close();
    }

    /**
     * Replays a file as a stream of identical frames.
     */
    public static void main(final String[] args) throws Exception {
        if (args.length < 3) {
            System.err.println("Usage: UdpFrameSender <host> <port> <payload-file> [count] [intervalMillis]");
            System.exit(1);
        }

        final InetSocketAddress target = new InetSocketAddress(args[0], Integer.parseInt(args[1]));
        final byte[] payload = Files.readAllBytes(Paths.get(args[2]));
        final int count = args.length > 3 ? Integer.parseInt(args[3]) : 1;
        final long interval = args.length > 4 ? Long.parseLong(args[4]) : 33L;

        try (final UdpFrameSender sender = new UdpFrameSender(target, RelayConfig.DEFAULT_MAX_CHUNK_PAYLOAD)) {
            for (int i = 0; i < count; i++) {
                final int chunks = sender.send(payload);
                log.info("Sent frame {} ({} bytes, {} chunks) to {}", i, payload.length, chunks, target);
                Thread.sleep(interval);
            }
        }
    }
}
