package com.mimecast.directoryauth.exception;

/**
 * The directory connection pool is saturated and no slot could be freed.
 */
public class MaxConnectionReachedException extends AuthException {

    /**
     * Constructs a new MaxConnectionReachedException.
     *
     * @param message Error message.
     */
    public MaxConnectionReachedException(String message) {
        super(message);
    }

    /**
     * Constructs a new MaxConnectionReachedException with cause.
     *
     * @param message Error message.
     * @param cause   Underlying cause.
     */
    public MaxConnectionReachedException(String message, Throwable cause) {
        super(message, cause);
    }
}
