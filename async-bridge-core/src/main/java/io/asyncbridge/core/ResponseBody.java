package io.asyncbridge.core;

import java.nio.charset.StandardCharsets;

/**
 * {@code http.response.body}: a chunk of the response body.
 *
 * <p>A {@code null} body is treated as empty. {@code moreBody = false} ends the response.
 */
public record ResponseBody(byte[] body, boolean moreBody) implements OutboundMessage {

    public static final String TYPE = "http.response.body";

    private static final byte[] EMPTY = new byte[0];

    public ResponseBody {
        if (body == null) body = EMPTY;
    }

    /** Final chunk carrying {@code body}. */
    public static ResponseBody last(byte[] body) {
        return new ResponseBody(body, false);
    }

    /** Final chunk carrying {@code text} as UTF-8. */
    public static ResponseBody last(String text) {
        return new ResponseBody(text.getBytes(StandardCharsets.UTF_8), false);
    }

    /** Intermediate chunk; more will follow. */
    public static ResponseBody chunk(byte[] body) {
        return new ResponseBody(body, true);
    }

    /** Empty final chunk. */
    public static ResponseBody end() {
        return new ResponseBody(EMPTY, false);
    }

    @Override
    public String type() {
        return TYPE;
    }
}
