package io.asyncbridge.server;

/**
 * Lifecycle of one request inside the worker pool.
 *
 * <pre>
 * SUBMITTED -&gt; RUNNING -&gt; STATUS_EMITTED -&gt; STREAMING -&gt; COMPLETED
 *                      \-&gt; FAILED -------------------------&gt; COMPLETED
 * </pre>
 *
 * <p>{@link #FAILED} may also be entered from {@link #STATUS_EMITTED} or {@link #STREAMING}.
 */
public enum RequestState {
    SUBMITTED,
    RUNNING,
    STATUS_EMITTED,
    STREAMING,
    FAILED,
    COMPLETED
}
