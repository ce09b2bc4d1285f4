package io.asyncbridge.core;

import java.util.concurrent.CompletionStage;

/**
 * An HTTP application written against the asynchronous, message-passing contract.
 *
 * <p>The host invokes {@link #call} once per request. The application reads the request with
 * {@code receive}, answers with one {@link ResponseStart} and one or more {@link ResponseBody}
 * messages through {@code send}, and completes the returned stage when it is done. Throwing from
 * {@code call} or completing the stage exceptionally both count as failure.
 *
 * <p>Example:
 * <pre>{@code
 * AsyncApplication hello = (scope, receive, send) ->
 *     send.send(ResponseStart.of(200, Header.of("content-type", "text/plain")))
 *         .thenCompose(ignored -> send.send(ResponseBody.last("hello " + scope.path())));
 * }</pre>
 */
@FunctionalInterface
public interface AsyncApplication {

    /**
     * Handles one request.
     *
     * @param scope immutable request metadata
     * @param receive pulls inbound messages
     * @param send emits outbound messages
     * @return stage completing when the application has finished with this request
     */
    CompletionStage<Void> call(Scope scope, Receive receive, Send send);
}
