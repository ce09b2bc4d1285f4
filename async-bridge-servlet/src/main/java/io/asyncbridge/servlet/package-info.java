/**
 * Jakarta Servlet binding: serves an {@link io.asyncbridge.core.AsyncApplication} through
 * {@link io.asyncbridge.servlet.AsyncBridgeServlet}.
 */
package io.asyncbridge.servlet;
