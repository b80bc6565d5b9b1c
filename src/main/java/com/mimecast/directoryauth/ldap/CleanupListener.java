package com.mimecast.directoryauth.ldap;

import com.unboundid.ldap.sdk.LDAPException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Receives the errors ignored while tearing down directory sessions.
 *
 * <p>Unbinding a session that is being discarded or released must never fail the caller,
 * so such errors are reported here instead of being thrown.
 */
@FunctionalInterface
public interface CleanupListener {

    /**
     * Default listener, logs at debug level.
     */
    CleanupListener LOGGING = new CleanupListener() {
        private final Logger log = LogManager.getLogger(CleanupListener.class);

        @Override
        public void cleanupFailed(String identity, LDAPException cause) {
            log.debug("Ignored unbind error for {}: {} {}", identity, cause.getResultCode(), cause.getMessage());
        }
    };

    /**
     * Called when an unbind failed.
     *
     * @param identity Identity the session was bound to, null if anonymous.
     * @param cause    Directory error.
     */
    void cleanupFailed(String identity, LDAPException cause);
}
