package com.mimecast.directoryauth.exception;

/**
 * A directory operation exceeded its deadline.
 * <p>Never retried internally, callers should answer with a retry-after delay.
 */
public class BackendTimeoutException extends BackendException {

    /**
     * Constructs a new BackendTimeoutException.
     *
     * @param message Error message.
     */
    public BackendTimeoutException(String message) {
        super(message);
    }

    /**
     * Constructs a new BackendTimeoutException with cause.
     *
     * @param message Error message.
     * @param cause   Underlying cause.
     */
    public BackendTimeoutException(String message, Throwable cause) {
        super(message, cause);
    }
}
