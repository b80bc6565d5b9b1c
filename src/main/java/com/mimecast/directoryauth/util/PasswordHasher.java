package com.mimecast.directoryauth.util;

/**
 * Encodes passwords before they are stored in the directory.
 */
@FunctionalInterface
public interface PasswordHasher {

    /**
     * Encodes a clear text password.
     *
     * @param password Clear text password.
     * @return Encoded value for the userPassword attribute.
     */
    String hash(String password);
}
