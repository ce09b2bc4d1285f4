package io.asyncbridge.core;

/**
 * Message an application passes to {@link Send}.
 *
 * <p>Per request an application sends exactly one {@link ResponseStart} followed by zero or more
 * {@link ResponseBody} messages, the last of which has {@code moreBody = false}.
 */
public sealed interface OutboundMessage permits ResponseStart, ResponseBody {

    String type();
}
