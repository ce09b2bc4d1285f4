package io.asyncbridge.server;

import io.asyncbridge.core.AsyncBridgeException;
import io.asyncbridge.core.ResponseStart;

import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;

/**
 * One-shot hand-off of the {@link ResponseStart} for a request.
 *
 * <p>The first {@link #offer} wins; later offers are rejected and never replace it.
 */
public final class StatusChannel {

    private final CompletableFuture<ResponseStart> slot = new CompletableFuture<>();

    boolean offer(ResponseStart start) {
        return slot.complete(Objects.requireNonNull(start, "start"));
    }

    public boolean isSet() {
        return slot.isDone();
    }

    public Optional<ResponseStart> poll() {
        return Optional.ofNullable(slot.getNow(null));
    }

    /**
     * Blocks until the response start is available.
     *
     * @throws AsyncBridgeException.Interrupted if the calling thread is interrupted while waiting
     */
    public ResponseStart await() {
        try {
            return slot.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new AsyncBridgeException.Interrupted("Interrupted while waiting for the response start", e);
        } catch (ExecutionException e) {
            // the slot is only ever completed normally
            throw new IllegalStateException(e.getCause());
        }
    }
}
