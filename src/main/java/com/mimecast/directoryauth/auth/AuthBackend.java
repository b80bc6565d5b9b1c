package com.mimecast.directoryauth.auth;

import com.mimecast.directoryauth.exception.AuthException;

import java.io.Closeable;
import java.util.Optional;

/**
 * Authentication backend contract.
 *
 * <p>Unknown users, rejected credentials and disabled accounts are reported as empty results or
 * <code>false</code>. Exceptions are reserved for infrastructure failures:
 * <ul>
 *     <li>{@link com.mimecast.directoryauth.exception.BackendException} transport failure.</li>
 *     <li>{@link com.mimecast.directoryauth.exception.BackendTimeoutException} deadline exceeded, retry later.</li>
 *     <li>{@link com.mimecast.directoryauth.exception.MaxConnectionReachedException} connection pool saturated.</li>
 *     <li>{@link com.mimecast.directoryauth.exception.NodeAttributionException} no node could be assigned.</li>
 * </ul>
 *
 * @see AuthBackendFactory
 */
public interface AuthBackend extends Closeable {

    /**
     * Gets the backend name.
     *
     * @return Backend name.
     */
    String getName();

    /**
     * Gets the id of a user.
     *
     * @param userName User name.
     * @return User id or empty if unknown.
     * @throws AuthException Backend failure.
     */
    Optional<Long> getUserId(String userName) throws AuthException;

    /**
     * Creates a user.
     *
     * @param userName User name.
     * @param password Clear text password.
     * @param email    Email address.
     * @return True if created.
     * @throws AuthException Backend failure.
     */
    boolean createUser(String userName, String password, String email) throws AuthException;

    /**
     * Authenticates a user.
     *
     * @param userName User name.
     * @param password Clear text password.
     * @return User id or empty if authentication failed.
     * @throws AuthException Backend failure.
     */
    Optional<Long> authenticateUser(String userName, String password) throws AuthException;

    /**
     * Generates a password reset code.
     *
     * @param userId    User id.
     * @param overwrite True to replace an unexpired code.
     * @return Reset code.
     * @throws AuthException Backend failure.
     */
    String generateResetCode(long userId, boolean overwrite) throws AuthException;

    /**
     * Verifies a password reset code.
     *
     * @param userId User id.
     * @param code   Reset code.
     * @return True if valid.
     * @throws AuthException Backend failure.
     */
    boolean verifyResetCode(long userId, String code) throws AuthException;

    /**
     * Clears the password reset code.
     *
     * @param userId User id.
     * @return True if a code was cleared.
     * @throws AuthException Backend failure.
     */
    boolean clearResetCode(long userId) throws AuthException;

    /**
     * Gets user name and email.
     *
     * @param userId User id.
     * @return UserInfo or empty if unknown.
     * @throws AuthException Backend failure.
     */
    Optional<UserInfo> getUserInfo(long userId) throws AuthException;

    /**
     * Changes the email.
     *
     * @param userId   User id.
     * @param email    New email.
     * @param password Current password for a self-service change, null for an administrative one.
     * @return True if changed.
     * @throws AuthException Backend failure.
     */
    boolean updateEmail(long userId, String email, String password) throws AuthException;

    /**
     * Changes the password.
     *
     * @param userId      User id.
     * @param password    New password.
     * @param oldPassword Current password for a self-service change, null for an administrative reset.
     * @return True if changed.
     * @throws AuthException Backend failure.
     */
    boolean updatePassword(long userId, String password, String oldPassword) throws AuthException;

    /**
     * Deletes a user.
     *
     * @param userId   User id.
     * @param password Current password for a self-service deletion, null for an administrative one.
     * @return True if deleted.
     * @throws AuthException Backend failure.
     */
    boolean deleteUser(long userId, String password) throws AuthException;

    /**
     * Gets the node URL of a user, assigning one if needed.
     * <p>Always empty on single box deployments.
     *
     * @param userId User id.
     * @param assign True to assign a node when the user has none.
     * @return Node URL or empty.
     * @throws AuthException Backend failure.
     */
    Optional<String> getUserNode(long userId, boolean assign) throws AuthException;
}
