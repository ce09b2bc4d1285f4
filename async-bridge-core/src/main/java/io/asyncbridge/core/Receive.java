package io.asyncbridge.core;

import java.util.concurrent.CompletionStage;

/**
 * Pulls the next inbound message for the current request.
 */
@FunctionalInterface
public interface Receive {

    CompletionStage<InboundMessage> receive();
}
