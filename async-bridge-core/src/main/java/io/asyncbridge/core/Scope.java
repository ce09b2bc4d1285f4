package io.asyncbridge.core;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable connection metadata for a single HTTP request.
 *
 * <p>A scope is built once per request by the host and handed by reference to exactly one
 * {@link AsyncApplication#call} invocation. Header names are lower-cased; header order is the
 * order in which the host saw them.
 *
 * <p>Use {@link #builder()} to create instances:
 * <pre>{@code
 * Scope scope = Scope.builder()
 *     .method("GET")
 *     .path("/items")
 *     .queryString("page=2")
 *     .header("accept", "application/json")
 *     .server("example.org", 443)
 *     .scheme("https")
 *     .build();
 * }</pre>
 */
public final class Scope {

    public static final String TYPE = "http";
    public static final String VERSION = "3.0";
    public static final String SPEC_VERSION = "2.1";

    private final String httpVersion;
    private final String method;
    private final String scheme;
    private final String path;
    private final byte[] rawPath;
    private final byte[] queryString;
    private final String rootPath;
    private final List<Header> headers;
    private final HostPort server;
    private final HostPort client;
    private final Map<String, Object> extensions;

    private Scope(Builder builder) {
        this.httpVersion = builder.httpVersion;
        this.method = Objects.requireNonNull(builder.method, "method");
        this.scheme = builder.scheme;
        this.path = builder.path;
        this.rawPath = builder.rawPath != null ? builder.rawPath.clone() : path.getBytes(StandardCharsets.UTF_8);
        this.queryString = builder.queryString.clone();
        this.rootPath = builder.rootPath;
        this.headers = List.copyOf(builder.headers);
        this.server = builder.server;
        this.client = builder.client;
        this.extensions = Collections.unmodifiableMap(new LinkedHashMap<>(builder.extensions));
    }

    public static Builder builder() {
        return new Builder();
    }

    /** Always {@value #TYPE}. */
    public String type() {
        return TYPE;
    }

    /** Protocol version without the {@code HTTP/} prefix, e.g. {@code 1.1}. */
    public String httpVersion() {
        return httpVersion;
    }

    /** Upper-case request method. */
    public String method() {
        return method;
    }

    public String scheme() {
        return scheme;
    }

    public String path() {
        return path;
    }

    public byte[] rawPath() {
        return rawPath.clone();
    }

    /** Query string bytes without the leading {@code ?}; empty when absent. */
    public byte[] queryString() {
        return queryString.clone();
    }

    /** Route prefix under which the application is mounted; empty at the root. */
    public String rootPath() {
        return rootPath;
    }

    public List<Header> headers() {
        return headers;
    }

    public HostPort server() {
        return server;
    }

    public HostPort client() {
        return client;
    }

    public Map<String, Object> extensions() {
        return extensions;
    }

    /**
     * First value of the named header, looked up case-insensitively.
     */
    public Optional<String> header(String name) {
        if (name == null) return Optional.empty();
        byte[] target = name.toLowerCase(Locale.ROOT).getBytes(StandardCharsets.ISO_8859_1);
        for (Header h : headers) {
            if (Arrays.equals(h.name(), target)) {
                return Optional.of(h.valueAsString());
            }
        }
        return Optional.empty();
    }

    /**
     * Conventional string-keyed view of this scope, for applications written against a map.
     *
     * <p>Byte fields ({@code raw_path}, {@code query_string}) are copies; {@code server} and
     * {@code client} are two-element lists of host and port.
     */
    public Map<String, Object> asMap() {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("type", TYPE);
        m.put("asgi", Map.of("version", VERSION, "spec_version", SPEC_VERSION));
        m.put("http_version", httpVersion);
        m.put("method", method);
        m.put("headers", headers);
        m.put("path", path);
        m.put("root_path", rootPath);
        m.put("raw_path", rawPath.clone());
        m.put("query_string", queryString.clone());
        m.put("server", List.of(server.host(), server.port()));
        m.put("client", List.of(client.host(), client.port()));
        m.put("scheme", scheme);
        m.put("extensions", extensions);
        return Collections.unmodifiableMap(m);
    }

    @Override
    public String toString() {
        return "Scope{" + method + " " + scheme + "://" + server.host() + ":" + server.port() + rootPath + path
                + (queryString.length == 0 ? "" : "?" + new String(queryString, StandardCharsets.ISO_8859_1))
                + " HTTP/" + httpVersion + ", client=" + client.host() + ":" + client.port() + "}";
    }

    /**
     * Host name or address paired with a port.
     */
    public record HostPort(String host, int port) {
        public HostPort {
            Objects.requireNonNull(host, "host");
        }
    }

    /**
     * Builder for {@link Scope}.
     */
    public static final class Builder {
        private String httpVersion = "1.1";
        private String method;
        private String scheme = "http";
        private String path = "/";
        private byte[] rawPath;
        private byte[] queryString = new byte[0];
        private String rootPath = "";
        private final List<Header> headers = new ArrayList<>();
        private HostPort server = new HostPort("localhost", 80);
        private HostPort client = new HostPort("127.0.0.1", 0);
        private final Map<String, Object> extensions = new LinkedHashMap<>();

        private Builder() {
        }

        public Builder httpVersion(String httpVersion) {
            this.httpVersion = Objects.requireNonNull(httpVersion, "httpVersion");
            return this;
        }

        public Builder method(String method) {
            this.method = Objects.requireNonNull(method, "method").toUpperCase(Locale.ROOT);
            return this;
        }

        public Builder scheme(String scheme) {
            this.scheme = Objects.requireNonNull(scheme, "scheme");
            return this;
        }

        public Builder path(String path) {
            this.path = Objects.requireNonNull(path, "path");
            return this;
        }

        /** Defaults to the UTF-8 encoding of {@link #path(String)}. */
        public Builder rawPath(byte[] rawPath) {
            this.rawPath = Objects.requireNonNull(rawPath, "rawPath");
            return this;
        }

        public Builder queryString(byte[] queryString) {
            this.queryString = Objects.requireNonNull(queryString, "queryString");
            return this;
        }

        public Builder queryString(String queryString) {
            return queryString(Objects.requireNonNull(queryString, "queryString").getBytes(StandardCharsets.ISO_8859_1));
        }

        public Builder rootPath(String rootPath) {
            this.rootPath = Objects.requireNonNull(rootPath, "rootPath");
            return this;
        }

        /** Appends a header; the name is lower-cased. */
        public Builder header(String name, String value) {
            return header(Header.of(Objects.requireNonNull(name, "name").toLowerCase(Locale.ROOT), value));
        }

        public Builder header(Header header) {
            this.headers.add(Objects.requireNonNull(header, "header"));
            return this;
        }

        public Builder server(String host, int port) {
            this.server = new HostPort(host, port);
            return this;
        }

        public Builder client(String host, int port) {
            this.client = new HostPort(host, port);
            return this;
        }

        public Builder extension(String name, Object value) {
            this.extensions.put(Objects.requireNonNull(name, "name"), Objects.requireNonNull(value, "value"));
            return this;
        }

        public Scope build() {
            return new Scope(this);
        }
    }
}
