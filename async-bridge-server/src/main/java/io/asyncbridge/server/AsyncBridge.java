package io.asyncbridge.server;

import io.asyncbridge.core.AsyncApplication;
import io.asyncbridge.core.Header;
import io.asyncbridge.core.ResponseStart;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Serves an {@link AsyncApplication} through the blocking {@link SyncApplication} contract.
 *
 * <p>Each {@link #call} translates the request, hands it to a {@link WorkerPool} worker, and
 * blocks until the application has sent its {@code http.response.start}. It then calls
 * {@code startResponse} and returns a {@link ResponseStream} over the body. Application failures
 * never surface here as exceptions: the worker turns them into a {@code 500} response or a
 * truncated body.
 *
 * <p>Use {@link #builder(AsyncApplication)} to create instances with custom configuration:
 * <pre>{@code
 * AsyncBridge bridge = AsyncBridge.builder(app)
 *     .workers(2)
 *     .statusFormat(StatusFormat.WITH_PHRASE)
 *     .maxBodySize(1024 * 1024)
 *     .build();
 * }</pre>
 */
public final class AsyncBridge implements SyncApplication, AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(AsyncBridge.class);

    /** 10 MiB. */
    public static final long DEFAULT_MAX_BODY_SIZE = 10 * 1024 * 1024;

    private final AsyncApplication application;
    private final ScopeTranslator translator;
    private final WorkerPool pool;
    private final StatusFormat statusFormat;

    /**
     * Creates a new builder for configuring a bridge.
     *
     * @param application the application to serve (required)
     * @return a new builder instance
     */
    public static Builder builder(AsyncApplication application) {
        return new Builder(application);
    }

    public AsyncBridge(AsyncApplication application) {
        this(builder(application));
    }

    private AsyncBridge(Builder builder) {
        BridgeConfig config = builder.config != null ? builder.config : BridgeConfig.defaults();
        this.application = Objects.requireNonNull(builder.application, "application");
        this.statusFormat = builder.statusFormat != null ? builder.statusFormat : config.statusFormat();
        this.translator = new ScopeTranslator(builder.maxBodySize != null ? builder.maxBodySize : config.maxBodySize());
        this.pool = new WorkerPool(
                builder.workers != null ? builder.workers : config.workers(),
                builder.shutdownTimeout != null ? builder.shutdownTimeout : config.shutdownTimeout());
        log.debug("Started bridge with {} worker(s), {} status lines, {} byte body cap",
                pool.workers(), statusFormat, translator.maxBodySize());
    }

    @Override
    public ResponseStream call(SyncRequest request, StartResponse startResponse) {
        Objects.requireNonNull(request, "request");
        Objects.requireNonNull(startResponse, "startResponse");

        ScopeTranslator.Translation translation = translator.translate(request);
        ResponseChannels channels = pool.submit(application, translation.scope(), translation.body());

        ResponseStart start = channels.status().await();
        String status = statusFormat.format(start.status());
        List<Map.Entry<String, String>> headers = decode(start.headers());

        startResponse.start(status, headers);
        return new ResponseStream(status, headers, channels);
    }

    public StatusFormat statusFormat() {
        return statusFormat;
    }

    public long maxBodySize() {
        return translator.maxBodySize();
    }

    public WorkerPool pool() {
        return pool;
    }

    /**
     * Closes the worker pool; see {@link WorkerPool#close()}.
     */
    @Override
    public void close() {
        pool.close();
    }

    private static List<Map.Entry<String, String>> decode(List<Header> headers) {
        List<Map.Entry<String, String>> out = new ArrayList<>(headers.size());
        for (Header h : headers) {
            out.add(Map.entry(h.nameAsString(), h.valueAsString()));
        }
        return out;
    }

    /**
     * Builder for {@link AsyncBridge}. Explicit settings take precedence over {@link #config}.
     */
    public static final class Builder {
        private final AsyncApplication application;
        private BridgeConfig config;
        private Integer workers;
        private StatusFormat statusFormat;
        private Long maxBodySize;
        private Duration shutdownTimeout;

        private Builder(AsyncApplication application) {
            this.application = Objects.requireNonNull(application, "application");
        }

        /** Base settings, e.g. from {@link BridgeConfig#fromProperties}. Default: {@link BridgeConfig#defaults()}. */
        public Builder config(BridgeConfig config) {
            this.config = config;
            return this;
        }

        /** Sets the worker pool size. Default: {@value WorkerPool#DEFAULT_WORKERS}. */
        public Builder workers(int workers) {
            this.workers = workers;
            return this;
        }

        /** Sets how status lines are rendered. Default: {@link StatusFormat#NUMERIC}. */
        public Builder statusFormat(StatusFormat statusFormat) {
            this.statusFormat = statusFormat;
            return this;
        }

        /**
         * Sets the maximum number of request body bytes read. Default: {@link AsyncBridge#DEFAULT_MAX_BODY_SIZE}.
         *
         * <p>Bodies declared larger are truncated to this size, not rejected.
         */
        public Builder maxBodySize(long maxBodySize) {
            this.maxBodySize = maxBodySize;
            return this;
        }

        /** Sets how long {@link AsyncBridge#close()} waits for running requests. Default: 5 seconds. */
        public Builder shutdownTimeout(Duration shutdownTimeout) {
            this.shutdownTimeout = shutdownTimeout;
            return this;
        }

        public AsyncBridge build() {
            return new AsyncBridge(this);
        }
    }
}
