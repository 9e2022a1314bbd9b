package io.framerelay.core.chunk;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Producer-side splitter: turns one payload into the datagrams of a single epoch.
 */
public final class FrameChunker {

    private FrameChunker() {
    }

    /**
     * Number of chunks a payload of {@code totalSize} bytes occupies.
     */
    public static long chunkCount(final long totalSize, final int maxChunkPayload) {
        if (maxChunkPayload <= 0) {
            throw new IllegalArgumentException("maxChunkPayload must be positive: " + maxChunkPayload);
        }
        return (totalSize + maxChunkPayload - 1) / maxChunkPayload;
    }

    /**
     * Splits {@code payload} into encoded datagrams, index 0 first.
     */
    public static List<byte[]> split(final byte[] payload, final int maxChunkPayload) {
        final int count = (int) chunkCount(payload.length, maxChunkPayload);
        final List<byte[]> out = new ArrayList<>(count);

        for (int i = 0; i < count; i++) {
            final int from = i * maxChunkPayload;
            final int to = Math.min(payload.length, from + maxChunkPayload);
            out.add(ChunkHeaderCodec.encode(payload.length, i, Arrays.copyOfRange(payload, from, to)));
        }
        return out;
    }
}
