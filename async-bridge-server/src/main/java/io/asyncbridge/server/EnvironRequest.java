package io.asyncbridge.server;

import java.io.InputStream;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * {@link SyncRequest} backed by a CGI-style environment map.
 *
 * <p>Recognised keys: {@code REQUEST_METHOD}, {@code SCRIPT_NAME}, {@code PATH_INFO},
 * {@code QUERY_STRING}, {@code CONTENT_TYPE}, {@code CONTENT_LENGTH}, {@code SERVER_NAME},
 * {@code SERVER_PORT}, {@code SERVER_PROTOCOL}, {@code REMOTE_ADDR}, {@code REMOTE_PORT},
 * {@code wsgi.url_scheme} and {@code wsgi.input} (an {@link InputStream}). Every {@code HTTP_*}
 * key becomes a header named after the rest of the key.
 */
public final class EnvironRequest implements SyncRequest {

    public static final String HEADER_PREFIX = "HTTP_";
    public static final String INPUT = "wsgi.input";
    public static final String URL_SCHEME = "wsgi.url_scheme";

    private final Map<String, Object> environ;
    private final Map<String, List<String>> headers;

    public EnvironRequest(Map<String, ?> environ) {
        Objects.requireNonNull(environ, "environ");
        this.environ = Collections.unmodifiableMap(new LinkedHashMap<>(environ));
        Map<String, List<String>> h = new LinkedHashMap<>();
        for (Map.Entry<String, ?> e : environ.entrySet()) {
            if (e.getKey().startsWith(HEADER_PREFIX) && e.getValue() != null) {
                h.put(e.getKey().substring(HEADER_PREFIX.length()), List.of(e.getValue().toString()));
            }
        }
        this.headers = Collections.unmodifiableMap(h);
        Objects.requireNonNull(method(), "REQUEST_METHOD");
    }

    public Map<String, Object> environ() {
        return environ;
    }

    @Override
    public String method() {
        return string("REQUEST_METHOD");
    }

    @Override
    public String scriptName() {
        return string("SCRIPT_NAME");
    }

    @Override
    public String pathInfo() {
        return string("PATH_INFO");
    }

    @Override
    public String queryString() {
        return string("QUERY_STRING");
    }

    @Override
    public Map<String, List<String>> headers() {
        return headers;
    }

    @Override
    public String contentType() {
        return string("CONTENT_TYPE");
    }

    @Override
    public String contentLength() {
        return string("CONTENT_LENGTH");
    }

    @Override
    public String serverName() {
        return string("SERVER_NAME");
    }

    @Override
    public String serverPort() {
        return string("SERVER_PORT");
    }

    @Override
    public String remoteAddr() {
        return string("REMOTE_ADDR");
    }

    @Override
    public String remotePort() {
        return string("REMOTE_PORT");
    }

    @Override
    public String scheme() {
        return string(URL_SCHEME);
    }

    @Override
    public String protocol() {
        return string("SERVER_PROTOCOL");
    }

    @Override
    public InputStream body() {
        Object in = environ.get(INPUT);
        return in instanceof InputStream stream ? stream : null;
    }

    private String string(String key) {
        Object v = environ.get(key);
        return v == null ? null : v.toString();
    }
}
