package io.framerelay.relay.ingress;

import java.io.Closeable;
import java.io.IOException;

/**
 * Blocking source of raw datagrams for the receive path.
 */
public interface DatagramSource extends Closeable {

    /**
     * Waits for the next datagram.
     *
     * @return the datagram bytes, or {@code null} once the source is exhausted
     * @throws IOException if the read fails, including when the source is closed while waiting
     */
    byte[] readChunk() throws IOException;

    /**
     * Releases the socket; unblocks a pending {@link #readChunk()}. Must be idempotent.
     */
    @Override
    void close() throws IOException;
}
