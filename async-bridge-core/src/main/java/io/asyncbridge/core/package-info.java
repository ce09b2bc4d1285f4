/**
 * Asynchronous application contract for Async Bridge.
 *
 * <p>This module is deliberately framework-neutral. It contains only:
 * <ul>
 *   <li>{@link io.asyncbridge.core.Scope}, the per-request connection metadata</li>
 *   <li>Inbound and outbound message models ({@code http.request}, {@code http.response.start},
 *       {@code http.response.body})</li>
 *   <li>The {@link io.asyncbridge.core.AsyncApplication} entry point and its
 *       {@link io.asyncbridge.core.Receive} / {@link io.asyncbridge.core.Send} callables</li>
 * </ul>
 *
 * <p>Hosting (thread pools, blocking facades, servlet bindings) lives in other modules.
 */
package io.asyncbridge.core;
