package io.asyncbridge.server;

import java.util.List;
import java.util.Map;

/**
 * Callback through which a {@link SyncApplication} begins the response.
 */
@FunctionalInterface
public interface StartResponse {

    /**
     * @param status status line, e.g. {@code "200"} or {@code "200 OK"}
     * @param headers response headers in the order the application sent them
     */
    void start(String status, List<Map.Entry<String, String>> headers);
}
