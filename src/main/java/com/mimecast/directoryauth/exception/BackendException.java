package com.mimecast.directoryauth.exception;

/**
 * Transport or protocol failure talking to the directory or the database.
 * <p>Callers may retry at a higher layer.
 */
public class BackendException extends AuthException {

    /**
     * Constructs a new BackendException.
     *
     * @param message Error message.
     */
    public BackendException(String message) {
        super(message);
    }

    /**
     * Constructs a new BackendException with cause.
     *
     * @param message Error message.
     * @param cause   Underlying cause.
     */
    public BackendException(String message, Throwable cause) {
        super(message, cause);
    }
}
