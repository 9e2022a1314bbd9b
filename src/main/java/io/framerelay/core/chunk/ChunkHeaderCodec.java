package io.framerelay.core.chunk;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;

/**
 * Encodes and decodes the fixed chunk header.
 * <pre>
 * offset 0..4 : total_size  (u32, big-endian)
 * offset 4..8 : chunk_index (u32, big-endian)
 * offset 8..  : chunk data
 * </pre>
 */
public final class ChunkHeaderCodec {

    public static final int HEADER_BYTES = 8;
    public static final long MAX_U32 = 0xFFFF_FFFFL;

    private ChunkHeaderCodec() {
    }

    /**
     * @return the 8 header bytes for the given fields
     */
    public static byte[] encode(final long totalSize, final long chunkIndex) {
        final ByteBuffer buf = ByteBuffer.allocate(HEADER_BYTES).order(ByteOrder.BIG_ENDIAN);
        putHeader(buf, totalSize, chunkIndex);
        return buf.array();
    }

    /**
     * Builds a complete datagram: header followed by {@code payload}.
     */
    public static byte[] encode(final long totalSize, final long chunkIndex, final byte[] payload) {
        final ByteBuffer buf = ByteBuffer.allocate(HEADER_BYTES + payload.length).order(ByteOrder.BIG_ENDIAN);
        putHeader(buf, totalSize, chunkIndex);
        buf.put(payload);
        return buf.array();
    }

    public static Chunk decode(final byte[] datagram) {
        if (datagram.length < HEADER_BYTES) {
            throw new MalformedHeaderException(datagram.length);
        }
        return decode(ByteBuffer.wrap(datagram));
    }

    /**
     * Decodes the remaining bytes of {@code buf}; the buffer position is advanced to its limit.
     *
     * @throws MalformedHeaderException if fewer than {@link #HEADER_BYTES} bytes remain
     */
    public static Chunk decode(final ByteBuffer buf) {
        final int remaining = buf.remaining();
        if (remaining < HEADER_BYTES) {
            throw new MalformedHeaderException(remaining);
        }

        final ByteBuffer in = buf.order(ByteOrder.BIG_ENDIAN);
        final long totalSize = Integer.toUnsignedLong(in.getInt());
        final long chunkIndex = Integer.toUnsignedLong(in.getInt());

        final byte[] payload = new byte[in.remaining()];
        in.get(payload);
        return new Chunk(totalSize, chunkIndex, payload);
    }

    private static void putHeader(final ByteBuffer buf, final long totalSize, final long chunkIndex) {
        checkU32("totalSize", totalSize);
        checkU32("chunkIndex", chunkIndex);
        buf.putInt((int) totalSize);
        buf.putInt((int) chunkIndex);
    }

    private static void checkU32(final String field, final long value) {
        if (value < 0 || value > MAX_U32) {
            throw new IllegalArgumentException(field + " out of unsigned 32-bit range: " + value);
        }
    }
}
