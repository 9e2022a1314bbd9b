package io.framerelay.config.type;

import io.framerelay.config.impl.RelayConfig;

import java.io.IOException;

public final class ConfigLoader {

    private ConfigLoader() {
    }

    /**
     * Loads relay configuration from a YAML file by delegating to {@link RelayConfig#load(String)}.
     * <p>
     * The file is expected to look like:
     * <pre>
     * udp:
     *   host: 0.0.0.0
     *   port: 6000
     * maxChunkPayload: 60000
     * queueCapacity: 5
     * sendTimeoutMillis: 1000
     * websocket:
     *   port: 8081
     * feedStream:
     *   port: 8082
     * </pre>
     *
     * @param path the path to the relay YAML configuration file
     * @return a validated {@link RelayConfig}
     * @throws IOException if the file cannot be read
     * @throws IllegalArgumentException if a value is out of range
     */
    public static RelayConfig load(final String path) throws IOException {
        return RelayConfig.load(path);
    }
}
