package io.asyncbridge.server;

import io.asyncbridge.core.Header;
import io.asyncbridge.core.Scope;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Turns a {@link SyncRequest} into a {@link Scope} and the eagerly read request body.
 *
 * <p>Malformed request metadata never fails translation: a bad port falls back to a default, a
 * bad or negative {@code Content-Length} yields an empty body. The body is never read past
 * {@link #maxBodySize()} bytes.
 */
public final class ScopeTranslator {

    private static final Logger log = LoggerFactory.getLogger(ScopeTranslator.class);

    static final String DEFAULT_CLIENT_HOST = "127.0.0.1";
    static final String DEFAULT_SERVER_HOST = "localhost";
    static final String DEFAULT_PROTOCOL = "HTTP/1.1";

    private static final String CONTENT_TYPE = "content-type";
    private static final String CONTENT_LENGTH = "content-length";
    private static final byte[] EMPTY = new byte[0];

    private final long maxBodySize;

    public ScopeTranslator(long maxBodySize) {
        if (maxBodySize < 0) {
            throw new IllegalArgumentException("maxBodySize must not be negative: " + maxBodySize);
        }
        this.maxBodySize = maxBodySize;
    }

    public long maxBodySize() {
        return maxBodySize;
    }

    /**
     * Scope and body for one request.
     */
    public record Translation(Scope scope, byte[] body) {
        public Translation {
            Objects.requireNonNull(scope, "scope");
            Objects.requireNonNull(body, "body");
        }
    }

    public Translation translate(SyncRequest request) {
        Objects.requireNonNull(request, "request");

        String scheme = orDefault(request.scheme(), "http");
        String path = orDefault(request.pathInfo(), "/");

        Scope.Builder scope = Scope.builder()
                .method(request.method())
                .httpVersion(httpVersion(request.protocol()))
                .scheme(scheme)
                .path(path)
                .rawPath(path.getBytes(StandardCharsets.UTF_8))
                .rootPath(orDefault(request.scriptName(), ""))
                .queryString(orDefault(request.queryString(), ""))
                .server(orDefault(request.serverName(), DEFAULT_SERVER_HOST),
                        parsePort(request.serverPort(), "https".equalsIgnoreCase(scheme) ? 443 : 80, "server"))
                .client(orDefault(request.remoteAddr(), DEFAULT_CLIENT_HOST),
                        parsePort(request.remotePort(), 0, "client"));

        headers(request).forEach(scope::header);

        return new Translation(scope.build(), readBody(request));
    }

    static String headerName(String transportName) {
        return transportName.replace('_', '-').toLowerCase(Locale.ROOT);
    }

    private static List<Header> headers(SyncRequest request) {
        List<Header> out = new ArrayList<>();
        boolean sawContentType = false;
        boolean sawContentLength = false;

        for (Map.Entry<String, List<String>> e : request.headers().entrySet()) {
            if (e.getKey() == null || e.getValue() == null) continue;
            String name = headerName(e.getKey());
            sawContentType |= CONTENT_TYPE.equals(name);
            sawContentLength |= CONTENT_LENGTH.equals(name);
            for (String value : e.getValue()) {
                if (value != null) out.add(Header.of(name, value));
            }
        }

        String contentType = request.contentType();
        if (!sawContentType && contentType != null && !contentType.isEmpty()) {
            out.add(Header.of(CONTENT_TYPE, contentType));
        }
        String contentLength = request.contentLength();
        if (!sawContentLength && contentLength != null && !contentLength.isEmpty()) {
            out.add(Header.of(CONTENT_LENGTH, contentLength));
        }
        return out;
    }

    private byte[] readBody(SyncRequest request) {
        String declared = request.contentLength();
        if (declared == null || declared.isBlank()) return EMPTY;

        long length;
        try {
            length = Long.parseLong(declared.trim());
        } catch (NumberFormatException e) {
            log.debug("Ignoring malformed Content-Length '{}'", declared);
            return EMPTY;
        }
        if (length <= 0) {
            if (length < 0) log.debug("Ignoring negative Content-Length {}", length);
            return EMPTY;
        }

        InputStream in = request.body();
        if (in == null) return EMPTY;

        int toRead = (int) Math.min(Math.min(length, maxBodySize), Integer.MAX_VALUE - 8);
        if (length > toRead) {
            log.debug("Content-Length {} exceeds the {} byte cap, truncating", length, toRead);
        }
        try {
            return in.readNBytes(toRead);
        } catch (IOException e) {
            log.warn("Failed to read request body, continuing with an empty body", e);
            return EMPTY;
        }
    }

    private static int parsePort(String raw, int fallback, String which) {
        if (raw == null || raw.isBlank()) return fallback;
        try {
            return Integer.parseInt(raw.trim());
        } catch (NumberFormatException e) {
            log.debug("Ignoring malformed {} port '{}', using {}", which, raw, fallback);
            return fallback;
        }
    }

    private static String httpVersion(String protocol) {
        String p = orDefault(protocol, DEFAULT_PROTOCOL);
        int slash = p.indexOf('/');
        return slash >= 0 ? p.substring(slash + 1) : p;
    }

    private static String orDefault(String value, String fallback) {
        return value == null || value.isEmpty() ? fallback : value;
    }
}
