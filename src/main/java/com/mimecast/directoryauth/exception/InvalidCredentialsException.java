package com.mimecast.directoryauth.exception;

/**
 * The directory rejected a bind.
 * <p>Backends turn this into a negative result when the credentials came from the caller.
 */
public class InvalidCredentialsException extends AuthException {

    /**
     * Constructs a new InvalidCredentialsException.
     *
     * @param message Error message.
     */
    public InvalidCredentialsException(String message) {
        super(message);
    }

    /**
     * Constructs a new InvalidCredentialsException with cause.
     *
     * @param message Error message.
     * @param cause   Underlying cause.
     */
    public InvalidCredentialsException(String message, Throwable cause) {
        super(message, cause);
    }
}
