package io.asyncbridge.server;

/**
 * An HTTP application with a blocking, call-and-return contract.
 *
 * <p>{@link #call} invokes {@code startResponse} exactly once before returning, and returns the
 * response body as a stream the host pulls from. The host must close the stream when done.
 */
@FunctionalInterface
public interface SyncApplication {

    ResponseStream call(SyncRequest request, StartResponse startResponse);
}
