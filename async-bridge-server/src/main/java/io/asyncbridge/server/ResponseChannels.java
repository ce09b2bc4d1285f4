package io.asyncbridge.server;

import io.asyncbridge.core.Header;
import io.asyncbridge.core.ResponseBody;
import io.asyncbridge.core.ResponseStart;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Objects;

/**
 * The status and body channels of a single request, plus its {@link RequestState}.
 *
 * <p>Allocated fresh for every request and never reused. Producer-side methods are called by the
 * worker and the application's event loop; the consumer side ({@link StatusChannel#await()},
 * {@link BodyChannel#take()}) by the thread serving the blocking caller. Once the request is
 * {@link RequestState#COMPLETED} no further writes reach either channel.
 */
public final class ResponseChannels {

    static final List<Header> ERROR_HEADERS = List.of(Header.of("Content-Type", "text/plain"));

    private final StatusChannel status = new StatusChannel();
    private final BodyChannel body = new BodyChannel();
    private RequestState state = RequestState.SUBMITTED;
    private volatile boolean cancelled;

    public StatusChannel status() {
        return status;
    }

    public BodyChannel body() {
        return body;
    }

    public synchronized RequestState state() {
        return state;
    }

    /**
     * Asks the worker to stop forwarding output. The application keeps running to completion;
     * whatever it sends from now on is discarded.
     */
    public void cancel() {
        cancelled = true;
    }

    public boolean isCancelled() {
        return cancelled;
    }

    synchronized void running() {
        if (state == RequestState.SUBMITTED) state = RequestState.RUNNING;
    }

    /**
     * @return {@code false} if a start was already emitted or the request is completed
     */
    synchronized boolean emitStart(ResponseStart start) {
        if (state == RequestState.COMPLETED) return false;
        if (!status.offer(start)) return false;
        if (state == RequestState.RUNNING) state = RequestState.STATUS_EMITTED;
        return true;
    }

    synchronized void emitBody(ResponseBody message) {
        if (state == RequestState.COMPLETED) return;
        if (body.push(message.body()) && state == RequestState.STATUS_EMITTED) {
            state = RequestState.STREAMING;
        }
        if (!message.moreBody()) body.close();
    }

    /**
     * Marks the request failed. If no start was emitted yet a {@code 500} with a plain-text
     * {@code diagnostic} body takes its place; in every case the body is terminated.
     *
     * @return {@code true} if a synthetic response was produced
     */
    synchronized boolean fail(String diagnostic) {
        Objects.requireNonNull(diagnostic, "diagnostic");
        if (state == RequestState.COMPLETED) return false;
        state = RequestState.FAILED;
        boolean synthesized = status.offer(new ResponseStart(500, ERROR_HEADERS));
        if (synthesized) {
            body.push(diagnostic.getBytes(StandardCharsets.UTF_8));
        }
        body.close();
        return synthesized;
    }

    synchronized void complete() {
        body.close();
        state = RequestState.COMPLETED;
    }
}
