package com.mimecast.directoryauth.exception;

/**
 * No node has spare capacity, or the node reservation could not be written.
 */
public class NodeAttributionException extends AuthException {

    /**
     * Constructs a new NodeAttributionException.
     *
     * @param message Error message.
     */
    public NodeAttributionException(String message) {
        super(message);
    }

    /**
     * Constructs a new NodeAttributionException with cause.
     *
     * @param message Error message.
     * @param cause   Underlying cause.
     */
    public NodeAttributionException(String message, Throwable cause) {
        super(message, cause);
    }
}
