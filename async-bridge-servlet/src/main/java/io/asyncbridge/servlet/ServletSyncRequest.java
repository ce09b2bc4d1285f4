package io.asyncbridge.servlet;

import io.asyncbridge.server.SyncRequest;
import jakarta.servlet.http.HttpServletRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.util.Collections;
import java.util.Enumeration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * {@link SyncRequest} view of an {@link HttpServletRequest}.
 */
final class ServletSyncRequest implements SyncRequest {

    private static final Logger log = LoggerFactory.getLogger(ServletSyncRequest.class);

    private final HttpServletRequest req;
    private final Map<String, List<String>> headers;

    ServletSyncRequest(HttpServletRequest req) {
        this.req = Objects.requireNonNull(req, "req");
        Map<String, List<String>> h = new LinkedHashMap<>();
        Enumeration<String> names = req.getHeaderNames();
        while (names != null && names.hasMoreElements()) {
            String name = names.nextElement();
            h.put(name, Collections.list(req.getHeaders(name)));
        }
        this.headers = Collections.unmodifiableMap(h);
    }

    @Override
    public String method() {
        return req.getMethod();
    }

    @Override
    public String scriptName() {
        return nullToEmpty(req.getContextPath()) + nullToEmpty(req.getServletPath());
    }

    @Override
    public String pathInfo() {
        return req.getPathInfo();
    }

    @Override
    public String queryString() {
        return req.getQueryString();
    }

    @Override
    public Map<String, List<String>> headers() {
        return headers;
    }

    @Override
    public String contentType() {
        return req.getContentType();
    }

    @Override
    public String contentLength() {
        String declared = req.getHeader("Content-Length");
        if (declared != null) return declared;
        long length = req.getContentLengthLong();
        return length >= 0 ? Long.toString(length) : null;
    }

    @Override
    public String serverName() {
        return req.getServerName();
    }

    @Override
    public String serverPort() {
        return Integer.toString(req.getServerPort());
    }

    @Override
    public String remoteAddr() {
        return req.getRemoteAddr();
    }

    @Override
    public String remotePort() {
        return Integer.toString(req.getRemotePort());
    }

    @Override
    public String scheme() {
        return req.getScheme();
    }

    @Override
    public String protocol() {
        return req.getProtocol();
    }

    @Override
    public InputStream body() {
        try {
            return req.getInputStream();
        } catch (IOException | IllegalStateException e) {
            log.warn("Request body unavailable for {} {}", req.getMethod(), req.getRequestURI(), e);
            return null;
        }
    }

    private static String nullToEmpty(String s) {
        return s == null ? "" : s;
    }
}
