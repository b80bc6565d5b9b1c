package com.mimecast.directoryauth.resetcode;

import java.security.SecureRandom;
import java.time.Duration;
import java.util.regex.Pattern;

/**
 * Reset code format: four groups of four upper case alphanumerics, e.g. <code>AB12-CD34-EF56-GH78</code>.
 */
public final class ResetCodes {

    /**
     * How long a generated code stays valid.
     */
    public static final Duration VALIDITY = Duration.ofHours(6);

    private static final String CHARS = "ABCDEFGHIJKLMNOPQRSTUVWXYZ0123456789";
    private static final Pattern FORMAT = Pattern.compile("[A-Z0-9]{4}-[A-Z0-9]{4}-[A-Z0-9]{4}-[A-Z0-9]{4}");
    private static final SecureRandom random = new SecureRandom();

    private ResetCodes() {
        throw new IllegalStateException("Static class");
    }

    /**
     * Generates a new code.
     *
     * @return Reset code.
     */
    public static String generate() {
        StringBuilder sb = new StringBuilder(19);
        for (int group = 0; group < 4; group++) {
            if (group > 0) {
                sb.append('-');
            }
            for (int i = 0; i < 4; i++) {
                sb.append(CHARS.charAt(random.nextInt(CHARS.length())));
            }
        }
        return sb.toString();
    }

    /**
     * Checks the code format.
     *
     * @param code Candidate code.
     * @return True if well formed.
     */
    public static boolean isWellFormed(String code) {
        return code != null && FORMAT.matcher(code).matches();
    }
}
