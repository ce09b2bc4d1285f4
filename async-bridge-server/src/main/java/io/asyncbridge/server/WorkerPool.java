package io.asyncbridge.server;

import io.asyncbridge.core.AsyncApplication;
import io.asyncbridge.core.Scope;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Fixed pool of workers, each running applications on its own {@link EventLoop}.
 *
 * <p>At most one application invocation runs per worker at a time, so up to {@link #workers()}
 * requests execute concurrently; the rest wait in submission order. A hung application
 * occupies its worker indefinitely but does not affect the others.
 *
 * <p>Example usage:
 * <pre>{@code
 * try (WorkerPool pool = new WorkerPool(4, Duration.ofSeconds(5))) {
 *     ResponseChannels channels = pool.submit(app, scope, body);
 *     ResponseStart start = channels.status().await();
 *     ...
 * }
 * }</pre>
 */
public final class WorkerPool implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(WorkerPool.class);

    public static final int DEFAULT_WORKERS = 4;

    public static final Duration DEFAULT_SHUTDOWN_TIMEOUT = Duration.ofSeconds(5);

    private static final AtomicInteger POOL_IDS = new AtomicInteger();

    private final int workers;
    private final Duration shutdownTimeout;
    private final ThreadPoolExecutor executor;
    private final AtomicInteger loopsCreated = new AtomicInteger();

    public WorkerPool() {
        this(DEFAULT_WORKERS, DEFAULT_SHUTDOWN_TIMEOUT);
    }

    public WorkerPool(int workers, Duration shutdownTimeout) {
        if (workers <= 0) {
            throw new IllegalArgumentException("workers must be positive: " + workers);
        }
        this.workers = workers;
        this.shutdownTimeout = Objects.requireNonNull(shutdownTimeout, "shutdownTimeout");
        this.executor = new ThreadPoolExecutor(workers, workers, 0L, TimeUnit.MILLISECONDS,
                new LinkedBlockingQueue<>(), new WorkerFactory("async-bridge-" + POOL_IDS.incrementAndGet()));
    }

    public int workers() {
        return workers;
    }

    /**
     * Number of event loops created so far across all workers.
     */
    public int loopsCreated() {
        return loopsCreated.get();
    }

    public boolean isClosed() {
        return executor.isShutdown();
    }

    /**
     * Queues one invocation of {@code application} and returns its channels immediately.
     *
     * @throws IllegalStateException if the pool has been closed
     */
    public ResponseChannels submit(AsyncApplication application, Scope scope, byte[] body) {
        ResponseChannels channels = new ResponseChannels();
        Exchange exchange = new Exchange(application, scope, body, channels);
        try {
            executor.execute(exchange);
        } catch (RejectedExecutionException e) {
            throw new IllegalStateException("Worker pool is closed", e);
        }
        return channels;
    }

    /**
     * Stops accepting work, waits up to the shutdown timeout for running requests, then
     * interrupts what is left. Every worker closes its event loop on the way out.
     */
    @Override
    public void close() {
        if (executor.isShutdown()) return;
        executor.shutdown();
        try {
            if (!executor.awaitTermination(shutdownTimeout.toMillis(), TimeUnit.MILLISECONDS)) {
                log.warn("Workers still busy after {}, interrupting", shutdownTimeout);
                abandonQueued();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            abandonQueued();
        }
    }

    private void abandonQueued() {
        List<Runnable> queued = executor.shutdownNow();
        for (Runnable r : queued) {
            ((Exchange) r).abandon("worker pool closed");
        }
    }

    private final class WorkerFactory implements ThreadFactory {
        private final String prefix;
        private final AtomicInteger counter = new AtomicInteger();

        private WorkerFactory(String prefix) {
            this.prefix = prefix;
        }

        @Override
        public Thread newThread(Runnable runnable) {
            Worker worker = new Worker(runnable, prefix + "-worker-" + counter.incrementAndGet(),
                    loop -> loopsCreated.incrementAndGet());
            worker.setUncaughtExceptionHandler((t, e) -> log.error("Uncaught exception on {}", t.getName(), e));
            return worker;
        }
    }
}
