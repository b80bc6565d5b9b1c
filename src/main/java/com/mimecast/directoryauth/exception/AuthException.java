package com.mimecast.directoryauth.exception;

/**
 * Base of the failures an authentication backend surfaces to its callers.
 * <p>Negative outcomes such as bad credentials or unknown users are results, not exceptions.
 */
public class AuthException extends Exception {

    /**
     * Constructs a new AuthException.
     *
     * @param message Error message.
     */
    public AuthException(String message) {
        super(message);
    }

    /**
     * Constructs a new AuthException with cause.
     *
     * @param message Error message.
     * @param cause   Underlying cause.
     */
    public AuthException(String message, Throwable cause) {
        super(message, cause);
    }
}
