package io.framerelay.config.impl;

import io.framerelay.core.chunk.ChunkHeaderCodec;
import io.framerelay.relay.ingress.UdpDatagramSource;
import lombok.Getter;
import lombok.ToString;
import org.yaml.snakeyaml.Yaml;

import java.io.IOException;
import java.io.InputStream;
import java.net.InetSocketAddress;
import java.nio.file.Files;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.Map;

/**
 * Immutable config holder loaded from relay.yaml
 */
@Getter
@ToString
public final class RelayConfig {

    public static final int DEFAULT_MAX_CHUNK_PAYLOAD = 60_000;
    public static final int DEFAULT_MAX_FRAME_SIZE = 32 * 1024 * 1024;
    public static final int DEFAULT_QUEUE_CAPACITY = 5;
    public static final long DEFAULT_LATE_START_WINDOW_MILLIS = 10L;

    private InetSocketAddress udpBind;
    private int maxChunkPayload;
    private long expectedFrameSize;
    private long maxFrameSize;
    private Duration assemblyTimeout;
    private Duration lateStartWindow;
    private int queueCapacity;
    private Duration pollTimeout;
    private Duration sendTimeout;

    private InetSocketAddress webSocketBind;
    private String webSocketPath;
    private int feedStreamPort;
    private Duration statsInterval;

    public static RelayConfig load(final String path) throws IOException {
        final Yaml yaml = new Yaml();

        try (final InputStream in = Files.newInputStream(Paths.get(path))) {
            final Object doc = yaml.load(in);
            if (doc == null) return fromMap(Map.of());
            if (!(doc instanceof Map)) {
                throw new IllegalArgumentException("Relay config must be a YAML mapping: " + path);
            }
            @SuppressWarnings("unchecked")
            final Map<String, Object> m = (Map<String, Object>) doc;
            return fromMap(m);
        }
    }

    /**
     * Builds a config from an already parsed YAML document; absent keys take their defaults.
     *
     * @throws IllegalArgumentException if a value has the wrong type or is out of range
     */
    public static RelayConfig fromMap(final Map<String, Object> m) {
        final RelayConfig cfg = new RelayConfig();

        final Map<String, Object> udp = section(m, "udp");
        cfg.udpBind = new InetSocketAddress(
                string(udp, "udp.host", "host", "0.0.0.0"),
                port(udp, "udp.port", 6000));

        cfg.maxChunkPayload   = integer(m, "maxChunkPayload", DEFAULT_MAX_CHUNK_PAYLOAD);
        cfg.expectedFrameSize = number(m, "expectedFrameSize", 0L);
        cfg.maxFrameSize      = number(m, "maxFrameSize", DEFAULT_MAX_FRAME_SIZE);
        cfg.assemblyTimeout   = Duration.ofMillis(number(m, "assemblyTimeoutMillis", 0L));
        cfg.lateStartWindow   = Duration.ofMillis(number(m, "lateStartWindowMillis", DEFAULT_LATE_START_WINDOW_MILLIS));
        cfg.queueCapacity     = integer(m, "queueCapacity", DEFAULT_QUEUE_CAPACITY);
        cfg.pollTimeout       = Duration.ofMillis(number(m, "pollTimeoutMillis", 1_000L));
        cfg.sendTimeout       = Duration.ofMillis(number(m, "sendTimeoutMillis", 1_000L));
        cfg.statsInterval     = Duration.ofSeconds(number(m, "statsIntervalSeconds", 10L));

        final Map<String, Object> ws = section(m, "websocket");
        cfg.webSocketBind = new InetSocketAddress(
                string(ws, "websocket.host", "host", "0.0.0.0"),
                port(ws, "websocket.port", 8081));
        cfg.webSocketPath = string(ws, "websocket.path", "path", "/");

        cfg.feedStreamPort = m.get("feedStream") == null ? -1 : port(section(m, "feedStream"), "feedStream.port", -1);

        cfg.validate();
        return cfg;
    }

    public boolean isFeedStreamEnabled() {
        return feedStreamPort >= 0;
    }

    private void validate() {
        final int maxPayload = UdpDatagramSource.MAX_DATAGRAM - ChunkHeaderCodec.HEADER_BYTES;
        if (maxChunkPayload < 1 || maxChunkPayload > maxPayload) {
            throw new IllegalArgumentException("maxChunkPayload must be in [1, " + maxPayload + "]: " + maxChunkPayload);
        }
        if (maxFrameSize < 1 || maxFrameSize > Integer.MAX_VALUE - 8L) {
            throw new IllegalArgumentException("maxFrameSize out of range: " + maxFrameSize);
        }
        if (expectedFrameSize < 0 || expectedFrameSize > maxFrameSize) {
            throw new IllegalArgumentException("expectedFrameSize must be in [1, maxFrameSize] when set: " + expectedFrameSize);
        }
        if (queueCapacity < 1) {
            throw new IllegalArgumentException("queueCapacity must be at least 1: " + queueCapacity);
        }
        if (assemblyTimeout.isNegative()) {
            throw new IllegalArgumentException("assemblyTimeoutMillis must not be negative");
        }
        if (lateStartWindow.isNegative()) {
            throw new IllegalArgumentException("lateStartWindowMillis must not be negative");
        }
        if (pollTimeout.isZero() || pollTimeout.isNegative() || sendTimeout.isZero() || sendTimeout.isNegative()) {
            throw new IllegalArgumentException("pollTimeoutMillis and sendTimeoutMillis must be positive");
        }
        if (statsInterval.isNegative()) {
            throw new IllegalArgumentException("statsIntervalSeconds must not be negative");
        }
        if (!webSocketPath.startsWith("/")) {
            throw new IllegalArgumentException("websocket.path must start with '/': " + webSocketPath);
        }
    }

    private static long number(final Map<String, Object> m, final String key, final long def) {
        final Object v = m.get(key);
        if (v == null) return def;
        if (!(v instanceof Number)) {
            throw new IllegalArgumentException(key + " must be a number: " + v);
        }
        return ((Number) v).longValue();
    }

    private static int integer(final Map<String, Object> m, final String key, final int def) {
        final long v = number(m, key, def);
        if (v < Integer.MIN_VALUE || v > Integer.MAX_VALUE) {
            throw new IllegalArgumentException(key + " out of int range: " + v);
        }
        return (int) v;
    }

    private static int port(final Map<String, Object> section, final String name, final int def) {
        final Object v = section.get("port");
        if (v == null) return def;
        if (!(v instanceof Number)) {
            throw new IllegalArgumentException(name + " must be a number: " + v);
        }
        final long port = ((Number) v).longValue();
        if (port < 0 || port > 65_535) {
            throw new IllegalArgumentException(name + " must be in [0, 65535]: " + port);
        }
        return (int) port;
    }

    private static String string(final Map<String, Object> section, final String name, final String key, final String def) {
        final Object v = section.get(key);
        if (v == null) return def;
        if (!(v instanceof String)) {
            throw new IllegalArgumentException(name + " must be a string: " + v);
        }
        return (String) v;
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> section(final Map<String, Object> m, final String key) {
        final Object v = m.get(key);
        if (v == null) return Map.of();
        if (!(v instanceof Map)) {
            throw new IllegalArgumentException(key + " must be a mapping: " + v);
        }
        return (Map<String, Object>) v;
    }
}
