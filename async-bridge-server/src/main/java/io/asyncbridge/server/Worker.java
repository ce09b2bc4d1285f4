package io.asyncbridge.server;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.function.Consumer;

/**
 * Pool thread that owns one {@link EventLoop}.
 *
 * <p>The loop is created on first use, recreated if it has been closed, and closed when the
 * worker retires. Only the worker thread itself touches the loop reference.
 */
final class Worker extends Thread {

    private static final Logger log = LoggerFactory.getLogger(Worker.class);

    private final Consumer<EventLoop> onLoopCreated;
    private EventLoop loop;

    Worker(Runnable poolTask, String name, Consumer<EventLoop> onLoopCreated) {
        super(poolTask, name);
        this.onLoopCreated = onLoopCreated;
        setDaemon(true);
    }

    static Worker current() {
        Thread t = Thread.currentThread();
        if (!(t instanceof Worker worker)) {
            throw new IllegalStateException("Not running on a worker pool thread: " + t.getName());
        }
        return worker;
    }

    EventLoop loop() {
        if (loop == null || loop.isClosed()) {
            loop = new EventLoop(getName() + "-loop");
            log.debug("Created event loop {}", loop.name());
            onLoopCreated.accept(loop);
        }
        return loop;
    }

    @Override
    public void run() {
        try {
            super.run();
        } finally {
            if (loop != null) {
                loop.close();
                loop = null;
            }
        }
    }
}
