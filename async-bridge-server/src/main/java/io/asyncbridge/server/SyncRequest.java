package io.asyncbridge.server;

import java.io.InputStream;
import java.util.List;
import java.util.Map;

/**
 * Framework-neutral view of a blocking HTTP request.
 *
 * <p>Numeric fields are exposed as the raw strings the host received so that malformed values can
 * be handled leniently by {@link ScopeTranslator}. Any accessor other than {@link #method()} and
 * {@link #headers()} may return {@code null} when the host has no value.
 */
public interface SyncRequest {

    String method();

    /** Route prefix the application is mounted under. */
    String scriptName();

    String pathInfo();

    /** Query string without the leading {@code ?}. */
    String queryString();

    /**
     * Transport headers keyed by the names the host uses. Names may be in any case and may use
     * {@code _} in place of {@code -}.
     */
    Map<String, List<String>> headers();

    String contentType();

    String contentLength();

    String serverName();

    String serverPort();

    String remoteAddr();

    String remotePort();

    /** URL scheme, {@code http} or {@code https}. */
    String scheme();

    /** Server protocol, for example {@code HTTP/1.1}. */
    String protocol();

    InputStream body();
}
