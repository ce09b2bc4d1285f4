package io.asyncbridge.server;

import java.io.ByteArrayOutputStream;
import java.io.Closeable;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.Optional;

/**
 * Response returned by a {@link SyncApplication}: the status line and headers already passed to
 * {@link StartResponse}, and the body as a lazily pulled sequence of chunks.
 *
 * <p>The body can be consumed once. Every {@link #iterator()} call returns the same underlying
 * iterator, so a second pass yields nothing. Each pull may block until the application produces
 * the next chunk.
 *
 * <p>{@link #close()} tells the producing side to discard anything the application still sends.
 * It does not interrupt the application.
 */
public final class ResponseStream implements Iterable<byte[]>, Closeable {

    private final String status;
    private final List<Map.Entry<String, String>> headers;
    private final ResponseChannels channels;
    private final Iterator<byte[]> chunks = new ChunkIterator();

    ResponseStream(String status, List<Map.Entry<String, String>> headers, ResponseChannels channels) {
        this.status = Objects.requireNonNull(status, "status");
        this.headers = List.copyOf(Objects.requireNonNull(headers, "headers"));
        this.channels = Objects.requireNonNull(channels, "channels");
    }

    public String status() {
        return status;
    }

    /**
     * Numeric status code, the leading three digits of {@link #status()}.
     */
    public int statusCode() {
        return Integer.parseInt(status.substring(0, 3));
    }

    public List<Map.Entry<String, String>> headers() {
        return headers;
    }

    @Override
    public Iterator<byte[]> iterator() {
        return chunks;
    }

    /**
     * Drains whatever is left of the body into a single array.
     */
    public byte[] readAllBytes() {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        while (chunks.hasNext()) {
            out.writeBytes(chunks.next());
        }
        return out.toByteArray();
    }

    @Override
    public void close() {
        channels.cancel();
    }

    private final class ChunkIterator implements Iterator<byte[]> {
        private byte[] next;
        private boolean done;

        @Override
        public boolean hasNext() {
            if (next != null) return true;
            if (done) return false;
            Optional<byte[]> chunk = channels.body().take();
            if (chunk.isEmpty()) {
                done = true;
                return false;
            }
            next = chunk.get();
            return true;
        }

        @Override
        public byte[] next() {
            if (!hasNext()) throw new NoSuchElementException("response body fully consumed");
            byte[] out = next;
            next = null;
            return out;
        }
    }
}
