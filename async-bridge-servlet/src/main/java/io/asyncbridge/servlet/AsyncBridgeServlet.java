package io.asyncbridge.servlet;

import io.asyncbridge.core.AsyncApplication;
import io.asyncbridge.core.AsyncBridgeException;
import io.asyncbridge.server.AsyncBridge;
import io.asyncbridge.server.BridgeConfig;
import io.asyncbridge.server.ResponseStream;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServlet;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.OutputStream;
import java.util.Objects;

/**
 * Serves an {@link AsyncApplication} from a servlet container.
 *
 * <p>When constructed with an application, the servlet builds its own {@link AsyncBridge} in
 * {@link #init()} from the init-parameters {@code workers}, {@code status-format},
 * {@code max-body-size} and {@code shutdown-timeout-ms}, and closes it in {@link #destroy()}.
 * A bridge passed in directly is used as-is and left open.
 *
 * <p>Every body chunk is written and flushed as soon as the application sends it.
 */
public class AsyncBridgeServlet extends HttpServlet {

    private static final Logger log = LoggerFactory.getLogger(AsyncBridgeServlet.class);

    private final AsyncApplication application;
    private volatile AsyncBridge bridge;
    private final boolean ownsBridge;

    public AsyncBridgeServlet(AsyncApplication application) {
        this.application = Objects.requireNonNull(application, "application");
        this.ownsBridge = true;
    }

    public AsyncBridgeServlet(AsyncBridge bridge) {
        this.bridge = Objects.requireNonNull(bridge, "bridge");
        this.application = null;
        this.ownsBridge = false;
    }

    @Override
    public void init() throws ServletException {
        if (bridge != null) return;
        try {
            bridge = AsyncBridge.builder(application)
                    .config(BridgeConfig.from(this::getInitParameter))
                    .build();
        } catch (IllegalArgumentException e) {
            throw new ServletException("Invalid async bridge configuration for servlet " + getServletName(), e);
        }
        log.info("Serving {} with {} worker(s)", application.getClass().getName(), bridge.pool().workers());
    }

    @Override
    protected void service(HttpServletRequest req, HttpServletResponse resp) throws ServletException, IOException {
        AsyncBridge b = bridge;
        if (b == null) {
            throw new ServletException(getClass().getSimpleName() + " has not been initialised");
        }

        try (ResponseStream stream = start(b, req, resp)) {
            OutputStream out = resp.getOutputStream();
            for (byte[] chunk : stream) {
                out.write(chunk);
                out.flush();
            }
        }
    }

    private static ResponseStream start(AsyncBridge bridge, HttpServletRequest req, HttpServletResponse resp)
            throws ServletException {
        try {
            return bridge.call(new ServletSyncRequest(req), (status, headers) -> {
                resp.setStatus(statusCode(status));
                headers.forEach(h -> resp.addHeader(h.getKey(), h.getValue()));
            });
        } catch (AsyncBridgeException e) {
            throw new ServletException("Async bridge failed for " + req.getMethod() + " " + req.getRequestURI(), e);
        }
    }

    @Override
    public void destroy() {
        AsyncBridge b = bridge;
        if (ownsBridge && b != null) {
            bridge = null;
            b.close();
        }
    }

    static int statusCode(String statusLine) {
        int space = statusLine.indexOf(' ');
        return Integer.parseInt(space < 0 ? statusLine : statusLine.substring(0, space));
    }
}
