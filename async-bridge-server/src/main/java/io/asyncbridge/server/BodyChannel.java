package io.asyncbridge.server;

import io.asyncbridge.core.AsyncBridgeException;

import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;

/**
 * FIFO of response body chunks terminated by a single end-of-stream marker.
 *
 * <p>The marker is a private sentinel compared by identity, so a zero-length chunk can never be
 * mistaken for it. Zero-length chunks are not queued at all. Nothing is queued after the marker.
 */
public final class BodyChannel {

    private static final byte[] END_OF_STREAM = new byte[0];

    private final BlockingQueue<byte[]> queue = new LinkedBlockingQueue<>();
    private boolean closed;
    private volatile boolean drained;

    /**
     * Queues a copy of {@code chunk}.
     *
     * @return {@code false} if the chunk was empty or the channel is already closed
     */
    synchronized boolean push(byte[] chunk) {
        Objects.requireNonNull(chunk, "chunk");
        if (closed || chunk.length == 0) return false;
        queue.add(chunk.clone());
        return true;
    }

    /**
     * Queues the end-of-stream marker.
     *
     * @return {@code true} on the first call only
     */
    synchronized boolean close() {
        if (closed) return false;
        closed = true;
        queue.add(END_OF_STREAM);
        return true;
    }

    public synchronized boolean isClosed() {
        return closed;
    }

    /**
     * Blocks until the next chunk or the end of the stream.
     *
     * @return the next chunk, or empty once the marker has been reached (and on every call after)
     * @throws AsyncBridgeException.Interrupted if the calling thread is interrupted while waiting
     */
    public Optional<byte[]> take() {
        if (drained) return Optional.empty();
        byte[] chunk;
        try {
            chunk = queue.take();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new AsyncBridgeException.Interrupted("Interrupted while waiting for a response body chunk", e);
        }
        if (chunk == END_OF_STREAM) {
            drained = true;
            return Optional.empty();
        }
        return Optional.of(chunk);
    }
}
