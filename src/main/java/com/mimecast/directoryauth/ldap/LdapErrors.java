package com.mimecast.directoryauth.ldap;

import com.mimecast.directoryauth.exception.AuthException;
import com.mimecast.directoryauth.exception.BackendException;
import com.mimecast.directoryauth.exception.BackendTimeoutException;
import com.mimecast.directoryauth.exception.InvalidCredentialsException;
import com.unboundid.ldap.sdk.LDAPException;
import com.unboundid.ldap.sdk.ResultCode;

import java.util.Set;

/**
 * Classifies directory errors and translates them into the backend exception taxonomy.
 */
public final class LdapErrors {

    private static final Set<ResultCode> TIMEOUT = Set.of(
            ResultCode.TIMEOUT,
            ResultCode.TIME_LIMIT_EXCEEDED
    );

    private static final Set<ResultCode> RETRYABLE = Set.of(
            ResultCode.SERVER_DOWN,
            ResultCode.CONNECT_ERROR,
            ResultCode.UNAVAILABLE,
            ResultCode.BUSY,
            ResultCode.OTHER
    );

    private static final Set<ResultCode> CONNECTION_LOST = Set.of(
            ResultCode.SERVER_DOWN,
            ResultCode.CONNECT_ERROR
    );

    private LdapErrors() {
        throw new IllegalStateException("Static class");
    }

    /**
     * Checks if the error is a deadline overrun.
     *
     * @param e Directory error.
     * @return True for timeouts.
     */
    public static boolean isTimeout(LDAPException e) {
        return TIMEOUT.contains(e.getResultCode());
    }

    /**
     * Checks if the error is transient and worth retrying.
     *
     * @param e Directory error.
     * @return True for server unavailable class errors.
     */
    public static boolean isRetryable(LDAPException e) {
        return RETRYABLE.contains(e.getResultCode());
    }

    /**
     * Checks if the error means the session is gone.
     *
     * @param e Directory error.
     * @return True when the connection was lost.
     */
    public static boolean isConnectionLost(LDAPException e) {
        return CONNECTION_LOST.contains(e.getResultCode());
    }

    /**
     * Checks if the error is a credential rejection.
     * <p>Some servers answer a bind to a missing entry with no such object.
     *
     * @param e Directory error.
     * @return True for invalid credentials or missing bind entry.
     */
    public static boolean isInvalidCredentials(LDAPException e) {
        return e.getResultCode() == ResultCode.INVALID_CREDENTIALS
                || e.getResultCode() == ResultCode.NO_SUCH_OBJECT;
    }

    /**
     * Checks if the error reports a missing entry.
     *
     * @param e Directory error.
     * @return True for no such object.
     */
    public static boolean isNoSuchObject(LDAPException e) {
        return e.getResultCode() == ResultCode.NO_SUCH_OBJECT;
    }

    /**
     * Translates a directory operation error.
     *
     * @param message Context message.
     * @param e       Directory error.
     * @return BackendTimeoutException for timeouts, BackendException otherwise.
     */
    public static BackendException translate(String message, LDAPException e) {
        String detail = message + ": " + e.getResultCode() + " " + e.getMessage();
        if (isTimeout(e)) {
            return new BackendTimeoutException(detail, e);
        }
        return new BackendException(detail, e);
    }

    /**
     * Translates a bind error.
     *
     * @param message Context message.
     * @param e       Directory error.
     * @return InvalidCredentialsException for rejected credentials, otherwise as {@link #translate(String, LDAPException)}.
     */
    public static AuthException translateBind(String message, LDAPException e) {
        if (isInvalidCredentials(e)) {
            return new InvalidCredentialsException(message + ": " + e.getResultCode(), e);
        }
        return translate(message, e);
    }
}
