package io.asyncbridge.core;

import java.util.concurrent.CompletionStage;

/**
 * Emits an outbound message for the current request.
 *
 * <p>The returned stage completes once the host has accepted the message. It completes
 * exceptionally with {@link AsyncBridgeException.ProtocolViolation} when the message breaks the
 * message ordering contract.
 */
@FunctionalInterface
public interface Send {

    CompletionStage<Void> send(OutboundMessage message);
}
