package io.asyncbridge.server;

import java.time.Duration;
import java.util.Objects;
import java.util.Properties;
import java.util.function.Function;

/**
 * Externalised settings for an {@link AsyncBridge}.
 *
 * <p>Keys, with their {@code async-bridge.} prefix when read from {@link Properties}:
 * <ul>
 *   <li>{@code workers}: worker pool size, positive. Default {@value WorkerPool#DEFAULT_WORKERS}.</li>
 *   <li>{@code status-format}: {@code numeric} or {@code with-phrase}. Default {@code numeric}.</li>
 *   <li>{@code max-body-size}: request body cap in bytes. Default 10 MiB.</li>
 *   <li>{@code shutdown-timeout-ms}: how long {@link AsyncBridge#close()} waits for running requests.</li>
 * </ul>
 */
public record BridgeConfig(int workers, StatusFormat statusFormat, long maxBodySize, Duration shutdownTimeout) {

    public static final String PROPERTY_PREFIX = "async-bridge.";

    public BridgeConfig {
        if (workers <= 0) throw new IllegalArgumentException("workers must be positive: " + workers);
        if (maxBodySize < 0) throw new IllegalArgumentException("max-body-size must not be negative: " + maxBodySize);
        Objects.requireNonNull(statusFormat, "statusFormat");
        Objects.requireNonNull(shutdownTimeout, "shutdownTimeout");
    }

    public static BridgeConfig defaults() {
        return new BridgeConfig(WorkerPool.DEFAULT_WORKERS, StatusFormat.NUMERIC, AsyncBridge.DEFAULT_MAX_BODY_SIZE,
                WorkerPool.DEFAULT_SHUTDOWN_TIMEOUT);
    }

    public static BridgeConfig fromProperties(Properties properties) {
        Objects.requireNonNull(properties, "properties");
        return from(key -> properties.getProperty(PROPERTY_PREFIX + key));
    }

    /**
     * Reads settings by bare key ({@code workers}, {@code status-format}, ...) from {@code lookup};
     * missing or blank values keep their defaults.
     *
     * @throws IllegalArgumentException if a value is present but malformed
     */
    public static BridgeConfig from(Function<String, String> lookup) {
        Objects.requireNonNull(lookup, "lookup");
        BridgeConfig d = defaults();
        String workers = value(lookup, "workers");
        String statusFormat = value(lookup, "status-format");
        String maxBodySize = value(lookup, "max-body-size");
        String shutdownTimeout = value(lookup, "shutdown-timeout-ms");
        return new BridgeConfig(
                workers == null ? d.workers() : parseInt("workers", workers),
                statusFormat == null ? d.statusFormat() : StatusFormat.parse(statusFormat),
                maxBodySize == null ? d.maxBodySize() : parseLong("max-body-size", maxBodySize),
                shutdownTimeout == null ? d.shutdownTimeout() : Duration.ofMillis(parseLong("shutdown-timeout-ms", shutdownTimeout)));
    }

    private static String value(Function<String, String> lookup, String key) {
        String v = lookup.apply(key);
        return v == null || v.isBlank() ? null : v.trim();
    }

    private static int parseInt(String key, String value) {
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(key + " must be an integer: " + value, e);
        }
    }

    private static long parseLong(String key, String value) {
        try {
            return Long.parseLong(value);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(key + " must be an integer: " + value, e);
        }
    }
}
