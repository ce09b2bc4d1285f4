package io.asyncbridge.server;

import io.asyncbridge.core.AsyncApplication;
import io.asyncbridge.core.ResponseBody;
import io.asyncbridge.core.ResponseStart;
import io.asyncbridge.core.Scope;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class WorkerPoolTest {

    private WorkerPool pool;

    @AfterEach
    void tearDown() {
        if (pool != null) pool.close();
    }

    @Test
    void rejectsNonPositivePoolSize() {
        assertThatThrownBy(() -> new WorkerPool(0, Duration.ofSeconds(1)))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void singleWorkerReusesItsEventLoop() {
        pool = new WorkerPool(1, Duration.ofSeconds(5));
        Set<EventLoop> loops = ConcurrentHashMap.newKeySet();
        AsyncApplication app = (scope, receive, send) -> {
            loops.add(EventLoop.current().orElseThrow());
            return send.send(ResponseStart.of(200)).thenCompose(v -> send.send(ResponseBody.end()));
        };

        for (int i = 0; i < 3; i++) {
            drain(pool.submit(app, scope("/" + i), new byte[0]));
        }

        assertThat(loops).hasSize(1);
        assertThat(pool.loopsCreated()).isEqualTo(1);
    }

    @Test
    void closedEventLoopIsRecreatedForTheNextRequest() {
        pool = new WorkerPool(1, Duration.ofSeconds(5));
        List<EventLoop> loops = new ArrayList<>();
        AsyncApplication closesItsLoop = (scope, receive, send) -> {
            EventLoop current = EventLoop.current().orElseThrow();
            loops.add(current);
            return send.send(ResponseStart.of(200))
                    .thenCompose(v -> send.send(ResponseBody.last(scope.path())))
                    .thenRun(current::close);
        };

        assertThat(drain(pool.submit(closesItsLoop, scope("/a"), new byte[0]))).isEqualTo("/a");
        assertThat(drain(pool.submit(closesItsLoop, scope("/b"), new byte[0]))).isEqualTo("/b");

        assertThat(pool.loopsCreated()).isEqualTo(2);
        assertThat(loops).hasSize(2);
        assertThat(loops.get(0)).isNotSameAs(loops.get(1));
        assertThat(loops.get(0).isClosed()).isTrue();
    }

    @Test
    void parallelismIsBoundedByPoolSize() throws Exception {
        pool = new WorkerPool(2, Duration.ofSeconds(5));
        AtomicInteger running = new AtomicInteger();
        AtomicInteger maxRunning = new AtomicInteger();
        CountDownLatch release = new CountDownLatch(1);

        AsyncApplication app = (scope, receive, send) -> {
            maxRunning.accumulateAndGet(running.incrementAndGet(), Math::max);
            try {
                release.await(5, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            running.decrementAndGet();
            return send.send(ResponseStart.of(200))
                    .thenCompose(v -> send.send(ResponseBody.last(scope.path())));
        };

        List<ResponseChannels> all = new ArrayList<>();
        for (int i = 0; i < 6; i++) {
            all.add(pool.submit(app, scope("/r" + i), new byte[0]));
        }

        Thread.sleep(100);
        assertThat(running.get()).isEqualTo(2);
        release.countDown();

        for (int i = 0; i < all.size(); i++) {
            assertThat(drain(all.get(i))).isEqualTo("/r" + i);
        }
        assertThat(maxRunning.get()).isEqualTo(2);
    }

    @Test
    void hungApplicationDoesNotBlockOtherWorkers() {
        pool = new WorkerPool(2, Duration.ofMillis(100));
        CompletableFuture<Void> never = new CompletableFuture<>();
        AsyncApplication app = (scope, receive, send) -> {
            if (scope.path().equals("/hang")) return never;
            return send.send(ResponseStart.of(200)).thenCompose(v -> send.send(ResponseBody.last("ok")));
        };

        pool.submit(app, scope("/hang"), new byte[0]);

        assertThat(drain(pool.submit(app, scope("/ok"), new byte[0]))).isEqualTo("ok");
        never.complete(null);
    }

    @Test
    void submitAfterCloseFails() {
        pool = new WorkerPool(1, Duration.ofSeconds(1));
        pool.close();

        assertThat(pool.isClosed()).isTrue();
        assertThatThrownBy(() -> pool.submit((s, r, w) -> CompletableFuture.completedFuture(null), scope("/"), new byte[0]))
                .isInstanceOf(IllegalStateException.class);
    }

    @Test
    void queuedRequestsAreTerminatedWhenPoolIsForcedClosed() {
        pool = new WorkerPool(1, Duration.ofMillis(50));
        CompletableFuture<Void> never = new CompletableFuture<>();
        AsyncApplication app = (scope, receive, send) -> never;

        pool.submit(app, scope("/busy"), new byte[0]);
        ResponseChannels queued = pool.submit(app, scope("/queued"), new byte[0]);
        pool.close();

        assertThat(queued.status().await().status()).isEqualTo(500);
        assertThat(queued.state()).isEqualTo(RequestState.COMPLETED);
    }

    static Scope scope(String path) {
        return Scope.builder().method("GET").path(path).build();
    }

    static String drain(ResponseChannels channels) {
        channels.status().await();
        StringBuilder sb = new StringBuilder();
        while (true) {
            var chunk = channels.body().take();
            if (chunk.isEmpty()) break;
            sb.append(new String(chunk.get(), StandardCharsets.UTF_8));
        }
        return sb.toString();
    }
}
