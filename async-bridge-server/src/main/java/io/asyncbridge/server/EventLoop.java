package io.asyncbridge.server;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.Future;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

/**
 * Single-threaded cooperative scheduler that applications run on.
 *
 * <p>Each {@link WorkerPool} worker owns one loop and reuses it for every request it handles. An
 * application can reach the loop it runs on through {@link #current()} to hop back onto it
 * ({@code stage.thenApplyAsync(fn, loop)}) or to start timers with {@link #schedule}. Timers still
 * pending when a request ends are cancelled by {@link #cancelPendingTasks()}.
 *
 * <p>A task passed to {@link #execute} or {@link #schedule} that throws is logged at ERROR; the
 * loop keeps running.
 */
public final class EventLoop implements Executor, AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(EventLoop.class);

    private static final ThreadLocal<EventLoop> CURRENT = new ThreadLocal<>();

    private final String name;
    private final ScheduledThreadPoolExecutor scheduler;
    private final Set<ScheduledFuture<?>> pending = ConcurrentHashMap.newKeySet();
    private volatile Thread thread;

    public EventLoop(String name) {
        this.name = Objects.requireNonNull(name, "name");
        this.scheduler = new LoopScheduler(runnable -> {
            Thread t = new Thread(() -> {
                CURRENT.set(this);
                try {
                    runnable.run();
                } finally {
                    CURRENT.remove();
                }
            }, name);
            t.setDaemon(true);
            thread = t;
            return t;
        });
        this.scheduler.setRemoveOnCancelPolicy(true);
        this.scheduler.setExecuteExistingDelayedTasksAfterShutdownPolicy(false);
    }

    /**
     * The loop the calling thread belongs to, if it is a loop thread.
     */
    public static Optional<EventLoop> current() {
        return Optional.ofNullable(CURRENT.get());
    }

    public String name() {
        return name;
    }

    public boolean inEventLoop() {
        return Thread.currentThread() == thread;
    }

    public boolean isClosed() {
        return scheduler.isShutdown();
    }

    @Override
    public void execute(Runnable task) {
        scheduler.execute(Objects.requireNonNull(task, "task"));
    }

    /**
     * Runs {@code task} on this loop after {@code delay}. The task is cancelled if it is still
     * pending when the current request ends.
     */
    public ScheduledFuture<?> schedule(Runnable task, Duration delay) {
        Objects.requireNonNull(task, "task");
        Objects.requireNonNull(delay, "delay");
        pending.removeIf(Future::isDone);
        ScheduledFuture<?> future = scheduler.schedule(task, delay.toNanos(), TimeUnit.NANOSECONDS);
        pending.add(future);
        return future;
    }

    /**
     * Starts {@code work} on the loop thread and blocks the caller until the stage it returns
     * completes.
     *
     * @throws ExecutionException if {@code work} throws or its stage completes exceptionally
     * @throws InterruptedException if the caller is interrupted while waiting
     * @throws IllegalStateException if called from this loop's own thread
     */
    public <T> T runUntilComplete(Supplier<? extends CompletionStage<T>> work)
            throws ExecutionException, InterruptedException {
        Objects.requireNonNull(work, "work");
        if (inEventLoop()) {
            throw new IllegalStateException("runUntilComplete called from inside event loop " + name);
        }
        CompletableFuture<T> result = new CompletableFuture<>();
        execute(() -> {
            try {
                CompletionStage<T> stage = work.get();
                if (stage == null) {
                    result.completeExceptionally(new NullPointerException("application returned a null stage"));
                    return;
                }
                stage.whenComplete((value, failure) -> {
                    if (failure != null) {
                        result.completeExceptionally(failure);
                    } else {
                        result.complete(value);
                    }
                });
            } catch (Throwable t) {
                result.completeExceptionally(t);
            }
        });
        return result.get();
    }

    /**
     * Cancels timers scheduled through {@link #schedule} that have not run yet.
     *
     * @return number of tasks cancelled
     */
    public int cancelPendingTasks() {
        int cancelled = 0;
        for (ScheduledFuture<?> f : pending) {
            if (f.cancel(false)) cancelled++;
        }
        pending.clear();
        if (cancelled > 0) {
            log.debug("Cancelled {} pending task(s) on {}", cancelled, name);
        }
        return cancelled;
    }

    @Override
    public void close() {
        if (isClosed()) return;
        log.debug("Closing event loop {}", name);
        pending.clear();
        scheduler.shutdownNow();
    }

    private final class LoopScheduler extends ScheduledThreadPoolExecutor {

        LoopScheduler(ThreadFactory threadFactory) {
            super(1, threadFactory);
        }

        @Override
        protected void afterExecute(Runnable task, Throwable failure) {
            super.afterExecute(task, failure);
            if (failure == null && task instanceof Future<?> future && future.isDone()) {
                try {
                    future.get();
                } catch (CancellationException e) {
                    return;
                } catch (ExecutionException e) {
                    failure = e.getCause();
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            }
            if (failure != null) {
                log.error("Task failed on event loop {}", name, failure);
            }
        }
    }
}
