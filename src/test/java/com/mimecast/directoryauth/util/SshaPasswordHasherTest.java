package com.mimecast.directoryauth.util;

import org.apache.commons.codec.binary.Base64;
import org.apache.commons.codec.digest.DigestUtils;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SshaPasswordHasherTest {

    private final SshaPasswordHasher hasher = new SshaPasswordHasher();

    @Test
    void encodesDigestFollowedBySalt() {
        String encoded = hasher.hash("secret", "abcdefgh");

        assertTrue(encoded.startsWith("{SSHA}"));
        byte[] payload = Base64.decodeBase64(encoded.substring(SshaPasswordHasher.PREFIX.length()));
        assertEquals(28, payload.length);
        assertArrayEquals(DigestUtils.sha1("secretabcdefgh"), Arrays.copyOfRange(payload, 0, 20));
        assertEquals("abcdefgh", new String(payload, 20, 8, StandardCharsets.UTF_8));
    }

    @Test
    void sameSaltSameHash() {
        assertEquals(hasher.hash("secret", "salt1234"), hasher.hash("secret", "salt1234"));
    }

    @Test
    void randomSaltPerCall() {
        String first = hasher.hash("secret");
        String second = hasher.hash("secret");

        assertNotEquals(first, second);
        assertEquals(first.length(), second.length());
    }
}
