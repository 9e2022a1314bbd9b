package io.framerelay;

import io.framerelay.config.impl.RelayConfig;
import io.framerelay.config.type.ConfigLoader;
import io.framerelay.relay.delivery.PassThroughFeedDeriver;
import io.framerelay.relay.ingress.SocketFaultException;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

/**
 * Main class to start the FrameRelay application.
 */
@Slf4j
public class Application {

    /** Exit status when the receive socket fails; a supervisor is expected to restart the process. */
    static final int EXIT_SOCKET_FAULT = 2;

    public static void main(final String[] args) throws Exception {
        if (args.length < 1) {
            System.err.println("Usage: java -jar framerelay.jar <relay-config.yaml>");
            System.exit(1);
        }

        final RelayConfig cfg = ConfigLoader.load(args[0]);
        log.info("Loaded configuration {}", cfg);

        final FrameRelay relay = new FrameRelay(cfg, List.of(new PassThroughFeedDeriver()));

        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            try {
                log.info("Shutting down FrameRelay...");
                relay.close();
                log.info("Shutdown complete.");
            } catch (final Exception e) {
                log.error("Error during shutdown", e);
            }
        }));

        try {
            relay.start().get();
            log.info("Receive path finished");
        } catch (final SocketFaultException e) {
            log.error("Receive socket could not be bound: {}", e.getMessage(), e);
            System.exit(EXIT_SOCKET_FAULT);
        } catch (final ExecutionException e) {
            final Throwable cause = e.getCause() instanceof CompletionException && e.getCause().getCause() != null
                    ? e.getCause().getCause()
                    : e.getCause();
            log.error("Receive path failed: {}", cause.getMessage(), cause);
            System.exit(EXIT_SOCKET_FAULT);
        }
    }
}
