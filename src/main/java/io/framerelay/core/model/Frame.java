package io.framerelay.core.model;

/**
 * A fully reassembled payload. {@code payload.length == totalSize} always holds.
 */
public record Frame(long totalSize, byte[] payload) {

    public Frame {
        if (payload.length != totalSize) {
            throw new IllegalArgumentException("Frame payload has " + payload.length + " bytes, declared " + totalSize);
        }
    }

    public static Frame of(final byte[] payload) {
        return new Frame(payload.length, payload);
    }
}
