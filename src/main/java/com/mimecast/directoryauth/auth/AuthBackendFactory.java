package com.mimecast.directoryauth.auth;

import com.mimecast.directoryauth.config.ConfigFoundation;
import com.mimecast.directoryauth.config.DirectoryAuthConfig;
import com.mimecast.directoryauth.exception.BackendException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Factory for creating AuthBackend instances based on configuration.
 * <p>The {@code backend} key selects the implementation:
 * <ul>
 *   <li>{@code ldap} - directory users with SQL bookkeeping (default)</li>
 * </ul>
 * <p>Unknown names are rejected.
 */
public class AuthBackendFactory {

    private static final Logger log = LogManager.getLogger(AuthBackendFactory.class);

    /**
     * Configuration namespace read by {@link #create(ConfigFoundation)}.
     */
    public static final String NAMESPACE = "auth";

    /**
     * Private constructor to prevent instantiation.
     */
    private AuthBackendFactory() {
        throw new IllegalStateException("Factory class");
    }

    /**
     * Creates a backend from the {@code auth} section of a root configuration.
     *
     * @param root Root configuration.
     * @return AuthBackend instance.
     * @throws BackendException Unable to prepare the bookkeeping tables.
     */
    public static AuthBackend create(ConfigFoundation root) throws BackendException {
        return create(DirectoryAuthConfig.fromNamespace(root, NAMESPACE));
    }

    /**
     * Creates a backend from a backend configuration.
     *
     * @param config Backend configuration.
     * @return AuthBackend instance.
     * @throws BackendException         Unable to prepare the bookkeeping tables.
     * @throws IllegalArgumentException Unknown backend name.
     */
    public static AuthBackend create(DirectoryAuthConfig config) throws BackendException {
        String backend = config.getBackend();
        if (LdapAuthBackend.NAME.equalsIgnoreCase(backend)) {
            log.info("Using directory auth backend: {}", config.getLdapUri());
            return new LdapAuthBackend.Builder()
                    .withConfig(config)
                    .build();
        }

        throw new IllegalArgumentException("Unknown auth backend: " + backend);
    }
}
