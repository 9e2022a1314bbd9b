package io.framerelay.relay.ingress;

import java.io.IOException;
import java.io.UncheckedIOException;

/**
 * Fatal failure of the receive socket: bind failure or an unrecoverable read error.
 * Surfaced to the process owner; the relay never retries on its own.
 */
public final class SocketFaultException extends UncheckedIOException {

    public SocketFaultException(final String message, final IOException cause) {
        super(message, cause);
    }
}
