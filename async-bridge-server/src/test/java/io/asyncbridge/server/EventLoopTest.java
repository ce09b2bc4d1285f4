package io.asyncbridge.server;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class EventLoopTest {

    private final EventLoop loop = new EventLoop("test-loop");

    @AfterEach
    void tearDown() {
        loop.close();
    }

    @Test
    void runsWorkOnTheLoopThread() throws Exception {
        String threadName = loop.runUntilComplete(() ->
                CompletableFuture.completedFuture(Thread.currentThread().getName()));

        assertThat(threadName).isEqualTo("test-loop");
    }

    @Test
    void currentIsVisibleOnlyFromLoopThread() throws Exception {
        EventLoop seen = loop.runUntilComplete(() ->
                CompletableFuture.completedFuture(EventLoop.current().orElse(null)));

        assertThat(seen).isSameAs(loop);
        assertThat(EventLoop.current()).isEmpty();
    }

    @Test
    void waitsForStagesCompletedLater() throws Exception {
        String value = loop.runUntilComplete(() -> {
            CompletableFuture<String> f = new CompletableFuture<>();
            EventLoop.current().orElseThrow().schedule(() -> f.complete("later"), Duration.ofMillis(20));
            return f;
        });

        assertThat(value).isEqualTo("later");
    }

    @Test
    void propagatesSynchronousThrow() {
        assertThatThrownBy(() -> loop.runUntilComplete(() -> {
            throw new IllegalStateException("boom");
        }))
                .isInstanceOf(ExecutionException.class)
                .hasCauseInstanceOf(IllegalStateException.class);
    }

    @Test
    void propagatesFailedStage() {
        assertThatThrownBy(() -> loop.runUntilComplete(() ->
                CompletableFuture.failedFuture(new IllegalArgumentException("bad"))))
                .isInstanceOf(ExecutionException.class)
                .hasRootCauseMessage("bad");
    }

    @Test
    void nullStageIsAFailure() {
        assertThatThrownBy(() -> loop.runUntilComplete(() -> null))
                .isInstanceOf(ExecutionException.class)
                .hasCauseInstanceOf(NullPointerException.class);
    }

    @Test
    void rejectsReentrantRunFromLoopThread() throws Exception {
        AtomicReference<Throwable> failure = new AtomicReference<>();
        loop.runUntilComplete(() -> {
            try {
                loop.runUntilComplete(() -> CompletableFuture.completedFuture(null));
            } catch (Exception e) {
                failure.set(e);
            }
            return CompletableFuture.completedFuture(null);
        });

        assertThat(failure.get()).isInstanceOf(IllegalStateException.class);
    }

    @Test
    void cancelsPendingTimers() {
        AtomicBoolean ran = new AtomicBoolean();
        ScheduledFuture<?> timer = loop.schedule(() -> ran.set(true), Duration.ofMinutes(1));

        assertThat(loop.cancelPendingTasks()).isEqualTo(1);
        assertThat(timer.isCancelled()).isTrue();
        assertThat(ran).isFalse();
    }

    @Test
    void closedLoopReportsClosed() {
        loop.close();

        assertThat(loop.isClosed()).isTrue();
        assertThatThrownBy(() -> loop.execute(() -> {}))
                .isInstanceOf(RejectedExecutionException.class);
    }

    @Test
    void failingTaskIsLoggedAndLoopKeepsRunning() throws Exception {
        ListAppender<ILoggingEvent> appender = attachAppender();
        try {
            AtomicBoolean ran = new AtomicBoolean();
            loop.execute(() -> {
                ran.set(true);
                throw new IllegalStateException("task exploded");
            });

            String after = loop.runUntilComplete(() -> CompletableFuture.completedFuture("still alive"));

            assertThat(ran).isTrue();
            assertThat(after).isEqualTo("still alive");
            assertThat(errorsFrom(appender))
                    .anySatisfy(e -> {
                        assertThat(e.getFormattedMessage()).contains("test-loop");
                        assertThat(e.getThrowableProxy().getMessage()).isEqualTo("task exploded");
                    });
        } finally {
            detachAppender(appender);
        }
    }

    @Test
    void failingTimerIsLogged() throws Exception {
        ListAppender<ILoggingEvent> appender = attachAppender();
        try {
            ScheduledFuture<?> timer = loop.schedule(() -> {
                throw new IllegalArgumentException("timer exploded");
            }, Duration.ofMillis(10));

            assertThatThrownBy(() -> timer.get(5, TimeUnit.SECONDS)).isInstanceOf(ExecutionException.class);
            loop.runUntilComplete(() -> CompletableFuture.completedFuture(null));

            assertThat(errorsFrom(appender))
                    .anySatisfy(e -> assertThat(e.getThrowableProxy().getMessage()).isEqualTo("timer exploded"));
        } finally {
            detachAppender(appender);
        }
    }

    @Test
    void cancelledTimerIsNotReportedAsFailure() throws Exception {
        ListAppender<ILoggingEvent> appender = attachAppender();
        try {
            loop.schedule(() -> {
                throw new IllegalStateException("never runs");
            }, Duration.ofSeconds(30));
            loop.cancelPendingTasks();
            loop.runUntilComplete(() -> CompletableFuture.completedFuture(null));

            assertThat(errorsFrom(appender)).isEmpty();
        } finally {
            detachAppender(appender);
        }
    }

    private static ListAppender<ILoggingEvent> attachAppender() {
        ListAppender<ILoggingEvent> appender = new ListAppender<>();
        appender.start();
        ((Logger) LoggerFactory.getLogger(EventLoop.class)).addAppender(appender);
        return appender;
    }

    private static void detachAppender(ListAppender<ILoggingEvent> appender) {
        ((Logger) LoggerFactory.getLogger(EventLoop.class)).detachAppender(appender);
        appender.stop();
    }

    private static List<ILoggingEvent> errorsFrom(ListAppender<ILoggingEvent> appender) {
        return appender.list.stream().filter(e -> e.getLevel() == Level.ERROR).toList();
    }
}
