package io.asyncbridge.core;

/**
 * Message handed to an application by {@link Receive}.
 */
public sealed interface InboundMessage permits HttpRequestMessage {

    /**
     * Message type as named by the protocol, for example {@code http.request}.
     */
    String type();
}
