package io.asyncbridge.core;

/**
 * Base class for Async Bridge related exceptions.
 *
 * <p>Subclasses are specific to the error condition and preserve the original cause when there
 * is one.
 */
public abstract class AsyncBridgeException extends RuntimeException {

    protected AsyncBridgeException(String message) {
        super(message);
    }

    protected AsyncBridgeException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * Raised when an application sends messages out of order, for example a body chunk before
     * the response start.
     */
    public static class ProtocolViolation extends AsyncBridgeException {
        public ProtocolViolation(String message) {
            super(message);
        }
    }

    /**
     * Raised when a thread blocked on a response is interrupted. The interrupt flag is restored
     * before this is thrown.
     */
    public static class Interrupted extends AsyncBridgeException {
        public Interrupted(String message, InterruptedException cause) {
            super(message, cause);
        }
    }
}
