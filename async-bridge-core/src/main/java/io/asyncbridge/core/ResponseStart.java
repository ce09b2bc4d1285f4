package io.asyncbridge.core;

import java.util.List;
import java.util.Objects;

/**
 * {@code http.response.start}: status code and response headers.
 */
public record ResponseStart(int status, List<Header> headers) implements OutboundMessage {

    public static final String TYPE = "http.response.start";

    public ResponseStart {
        if (status < 100 || status > 999) {
            throw new IllegalArgumentException("status must be a three-digit code: " + status);
        }
        headers = List.copyOf(Objects.requireNonNull(headers, "headers"));
    }

    public static ResponseStart of(int status, Header... headers) {
        return new ResponseStart(status, List.of(headers));
    }

    @Override
    public String type() {
        return TYPE;
    }
}
