/**
 * Blocking host for {@link io.asyncbridge.core.AsyncApplication asynchronous applications}.
 *
 * <p>Contains:
 * <ul>
 *   <li>{@link io.asyncbridge.server.AsyncBridge} (the blocking facade, a {@link io.asyncbridge.server.SyncApplication})</li>
 *   <li>{@link io.asyncbridge.server.ScopeTranslator} (blocking request to scope and body)</li>
 *   <li>{@link io.asyncbridge.server.WorkerPool} and {@link io.asyncbridge.server.EventLoop} (execution)</li>
 *   <li>{@link io.asyncbridge.server.ResponseChannels} (status and body hand-off per request)</li>
 * </ul>
 *
 * <p>Framework integrations adapt their request type to {@link io.asyncbridge.server.SyncRequest} and
 * drain the returned {@link io.asyncbridge.server.ResponseStream}.
 */
package io.asyncbridge.server;
