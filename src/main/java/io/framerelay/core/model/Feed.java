package io.framerelay.core.model;

/**
 * A named representation of one Frame, produced by a feed deriver.
 */
public record Feed(String name, byte[] data) {
}
