package com.mimecast.directoryauth.util;

import org.apache.commons.codec.binary.Base64;
import org.apache.commons.codec.digest.DigestUtils;

import java.nio.charset.StandardCharsets;
import java.security.SecureRandom;

/**
 * Salted SHA-1 password encoding: <code>{SSHA}base64(sha1(password + salt) + salt)</code>.
 */
public class SshaPasswordHasher implements PasswordHasher {

    /**
     * Scheme prefix.
     */
    public static final String PREFIX = "{SSHA}";

    private static final String SALT_CHARS = "0123456789abcdefghijklmnopqrstuvwxyzABCDEFGHIJKLMNOPQRSTUVWXYZ";
    private static final int SALT_LENGTH = 8;
    private static final SecureRandom random = new SecureRandom();

    @Override
    public String hash(String password) {
        return hash(password, salt());
    }

    /**
     * Encodes with a given salt.
     *
     * @param password Clear text password.
     * @param salt     Salt.
     * @return Encoded value.
     */
    public String hash(String password, String salt) {
        byte[] saltBytes = salt.getBytes(StandardCharsets.UTF_8);
        byte[] digest = DigestUtils.sha1((password + salt).getBytes(StandardCharsets.UTF_8));

        byte[] payload = new byte[digest.length + saltBytes.length];
        System.arraycopy(digest, 0, payload, 0, digest.length);
        System.arraycopy(saltBytes, 0, payload, digest.length, saltBytes.length);

        return PREFIX + Base64.encodeBase64String(payload).trim();
    }

    private String salt() {
        StringBuilder sb = new StringBuilder(SALT_LENGTH);
        for (int i = 0; i < SALT_LENGTH; i++) {
            sb.append(SALT_CHARS.charAt(random.nextInt(SALT_CHARS.length())));
        }
        return sb.toString();
    }
}
