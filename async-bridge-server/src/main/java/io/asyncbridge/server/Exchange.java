package io.asyncbridge.server;

import io.asyncbridge.core.AsyncApplication;
import io.asyncbridge.core.AsyncBridgeException;
import io.asyncbridge.core.HttpRequestMessage;
import io.asyncbridge.core.InboundMessage;
import io.asyncbridge.core.OutboundMessage;
import io.asyncbridge.core.ResponseBody;
import io.asyncbridge.core.ResponseStart;
import io.asyncbridge.core.Scope;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ExecutionException;

/**
 * One application invocation, run on a {@link Worker}.
 *
 * <p>Whatever the application does, both channels are terminated when {@link #run()} returns.
 */
final class Exchange implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(Exchange.class);

    static final String MISSING_START = "Application returned without starting a response";

    private static final CompletableFuture<Void> DONE = CompletableFuture.completedFuture(null);

    private final AsyncApplication application;
    private final Scope scope;
    private final byte[] body;
    private final ResponseChannels channels;

    Exchange(AsyncApplication application, Scope scope, byte[] body, ResponseChannels channels) {
        this.application = Objects.requireNonNull(application, "application");
        this.scope = Objects.requireNonNull(scope, "scope");
        this.body = Objects.requireNonNull(body, "body");
        this.channels = Objects.requireNonNull(channels, "channels");
    }

    @Override
    public void run() {
        EventLoop loop = null;
        try {
            loop = Worker.current().loop();
            channels.running();
            loop.runUntilComplete(() -> application.call(scope, this::receive, this::send));
            if (!channels.status().isSet()) {
                log.error("{} for {}", MISSING_START, scope);
                channels.fail(MISSING_START);
            }
        } catch (ExecutionException e) {
            failed(unwrap(e.getCause()));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            failed(e);
        } catch (RuntimeException e) {
            failed(e);
        } finally {
            channels.complete();
            if (loop != null) {
                try {
                    loop.cancelPendingTasks();
                } catch (RuntimeException e) {
                    log.debug("Ignoring event loop teardown failure for {}", scope, e);
                }
            }
        }
    }

    /**
     * Terminates the channels of an exchange that will never run.
     */
    void abandon(String reason) {
        log.warn("Dropping queued request {}: {}", scope, reason);
        channels.fail(reason);
        channels.complete();
    }

    private CompletionStage<InboundMessage> receive() {
        return CompletableFuture.completedFuture(new HttpRequestMessage(body, false));
    }

    private CompletionStage<Void> send(OutboundMessage message) {
        Objects.requireNonNull(message, "message");
        if (channels.isCancelled()) {
            log.debug("Discarding {} for {}: the caller stopped reading", message.type(), scope);
            return DONE;
        }
        if (message instanceof ResponseStart start) {
            if (!channels.emitStart(start)) {
                log.warn("Ignoring extra {} (status {}) for {}", ResponseStart.TYPE, start.status(), scope);
            }
            return DONE;
        }
        ResponseBody chunk = (ResponseBody) message;
        if (!channels.status().isSet()) {
            return CompletableFuture.failedFuture(new AsyncBridgeException.ProtocolViolation(
                    ResponseBody.TYPE + " sent before " + ResponseStart.TYPE));
        }
        channels.emitBody(chunk);
        return DONE;
    }

    private void failed(Throwable failure) {
        log.error("Application failed for {}", scope, failure);
        String detail = failure.getMessage() != null ? failure.getMessage() : failure.getClass().getName();
        if (!channels.fail("Application error: " + detail)) {
            log.debug("Response already started for {}, truncating body", scope);
        }
    }

    private static Throwable unwrap(Throwable t) {
        while ((t instanceof CompletionException || t instanceof ExecutionException) && t.getCause() != null) {
            t = t.getCause();
        }
        return t;
    }
}
