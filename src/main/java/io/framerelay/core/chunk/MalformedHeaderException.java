package io.framerelay.core.chunk;

/**
 * Raised when a datagram is too short to carry a chunk header.
 */
public final class MalformedHeaderException extends IllegalArgumentException {

    private final int length;

    public MalformedHeaderException(final int length) {
        super("Datagram of " + length + " bytes is shorter than the " + ChunkHeaderCodec.HEADER_BYTES + "-byte chunk header");
        this.length = length;
    }

    public int getLength() {
        return length;
    }
}
