package io.asyncbridge.core;

import java.util.Objects;

/**
 * {@code http.request}: a piece of the request body.
 *
 * <p>Hosts that read the body eagerly deliver it in a single message with {@code moreBody = false}.
 */
public record HttpRequestMessage(byte[] body, boolean moreBody) implements InboundMessage {

    public static final String TYPE = "http.request";

    public HttpRequestMessage {
        Objects.requireNonNull(body, "body");
    }

    @Override
    public String type() {
        return TYPE;
    }
}
