package io.framerelay.core.chunk;

/**
 * One decoded datagram: the declared frame size, the chunk position and the chunk bytes.
 * <p>
 * Both header fields are unsigned 32-bit values on the wire and are widened to {@code long}.
 */
public record Chunk(long totalSize, long chunkIndex, byte[] payload) {

    public int length() {
        return payload.length;
    }
}
