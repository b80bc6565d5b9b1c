package com.mimecast.directoryauth.config;

import java.io.IOException;
import java.time.Duration;
import java.util.Map;

/**
 * Typed configuration for the directory authentication backend.
 *
 * <p>The map is expected to be pre-filtered to the backend namespace,
 * see {@link ConfigFoundation#filter(String)} and {@link #fromNamespace(ConfigFoundation, String)}.
 *
 * <p><b>Example:</b>
 * <pre>
 * {
 *   backend: "ldap",
 *   ldapUri: "ldap://localhost:389",
 *   adminUser: "cn=admin,dc=mozilla",
 *   adminPassword: "secret",
 *   usersRoot: "ou=users,dc=mozilla",
 *   sql: {
 *     jdbcUrl: "jdbc:postgresql://localhost/auth",
 *     user: "auth",
 *     password: "auth"
 *   }
 * }
 * </pre>
 */
public class DirectoryAuthConfig extends ConfigFoundation {

    /**
     * Users root value that switches DNs to md5 bucketing.
     */
    public static final String MD5_USERS_ROOT = "md5";

    /**
     * Constructs a new empty DirectoryAuthConfig instance.
     */
    public DirectoryAuthConfig() {
        super();
    }

    /**
     * Constructs a new DirectoryAuthConfig instance.
     *
     * @param map Configuration map.
     */
    public DirectoryAuthConfig(Map<String, Object> map) {
        super(map);
    }

    /**
     * Constructs a new DirectoryAuthConfig instance from a file.
     *
     * @param path Path to configuration file.
     * @throws IOException Unable to read file.
     */
    public DirectoryAuthConfig(String path) throws IOException {
        super(path);
    }

    /**
     * Builds a backend config from the namespace of a wider configuration.
     *
     * @param config    Full configuration.
     * @param namespace Namespace, usually <code>auth</code>.
     * @return DirectoryAuthConfig instance.
     */
    public static DirectoryAuthConfig fromNamespace(ConfigFoundation config, String namespace) {
        return new DirectoryAuthConfig(config.filter(namespace));
    }

    /**
     * Gets the backend name.
     *
     * @return Backend name.
     */
    public String getBackend() {
        return getStringProperty("backend", "ldap");
    }

    /**
     * Gets the directory server URI.
     *
     * @return LDAP URI.
     */
    public String getLdapUri() {
        return getStringProperty("ldapUri", "ldap://localhost");
    }

    /**
     * Checks if StartTLS should be negotiated on new connections.
     *
     * @return True to use StartTLS.
     */
    public boolean isUseTls() {
        return getBooleanProperty("useTls", false);
    }

    /**
     * Gets the default bind DN used for lookups.
     *
     * @return Bind DN.
     */
    public String getBindUser() {
        return getStringProperty("bindUser", "binduser");
    }

    /**
     * Gets the default bind password.
     *
     * @return Bind password.
     */
    public String getBindPassword() {
        return getStringProperty("bindPassword", "binduser");
    }

    /**
     * Gets the admin DN used for writes.
     *
     * @return Admin DN.
     */
    public String getAdminUser() {
        return getStringProperty("adminUser", "adminuser");
    }

    /**
     * Gets the admin password.
     *
     * @return Admin password.
     */
    public String getAdminPassword() {
        return getStringProperty("adminPassword", "adminuser");
    }

    /**
     * Gets the users root DN, or <code>md5</code> for bucketed DNs.
     *
     * @return Users root.
     */
    public String getUsersRoot() {
        return getStringProperty("usersRoot", "ou=users,dc=mozilla");
    }

    /**
     * Gets the base DN under which md5 buckets live.
     *
     * @return Users base DN or null.
     */
    public String getUsersBaseDn() {
        return getStringProperty("usersBaseDn", null);
    }

    /**
     * Gets the directory operation timeout.
     * <p>Zero or negative means no limit.
     *
     * @return Timeout in seconds.
     */
    public int getLdapTimeout() {
        return Math.toIntExact(getLongProperty("ldapTimeout", -1L));
    }

    /**
     * Gets the maximum number of pooled directory connections.
     *
     * @return Pool size.
     */
    public int getLdapPoolSize() {
        return Math.toIntExact(getLongProperty("ldapPoolSize", 10L));
    }

    /**
     * Checks if directory connections are pooled.
     *
     * @return True to pool connections.
     */
    public boolean isLdapUsePool() {
        return getBooleanProperty("ldapUsePool", true);
    }

    /**
     * Gets the maximum bind attempts and pool-full retries.
     *
     * @return Retry count.
     */
    public int getLdapRetryMax() {
        return Math.toIntExact(getLongProperty("ldapRetryMax", 3L));
    }

    /**
     * Gets the delay between bind attempts.
     *
     * @return Retry delay.
     */
    public Duration getLdapRetryDelay() {
        return Duration.ofMillis(getLongProperty("ldapRetryDelay", 100L));
    }

    /**
     * Checks if this is a single box deployment without node assignment.
     *
     * @return True for single box.
     */
    public boolean isSingleBox() {
        return getBooleanProperty("singleBox", false);
    }

    /**
     * Gets the scheme used to build node URLs.
     *
     * @return URL scheme.
     */
    public String getNodesScheme() {
        return getStringProperty("nodesScheme", "https");
    }

    /**
     * Checks if disabled accounts must fail authentication.
     *
     * @return True to check the account-enabled attribute.
     */
    public boolean isCheckAccountState() {
        return getBooleanProperty("checkAccountState", true);
    }

    /**
     * Checks if SQL tables should be created on startup.
     *
     * @return True to create tables.
     */
    public boolean isCreateTables() {
        return getBooleanProperty("createTables", true);
    }

    /**
     * Gets the JDBC URL of the bookkeeping database.
     *
     * @return JDBC URL or null when no database is configured.
     */
    public String getSqlJdbcUrl() {
        return getStringProperty("sql.jdbcUrl", null);
    }

    /**
     * Gets the database user.
     *
     * @return Database user.
     */
    public String getSqlUser() {
        return getStringProperty("sql.user", "");
    }

    /**
     * Gets the database password.
     *
     * @return Database password.
     */
    public String getSqlPassword() {
        return getStringProperty("sql.password", "");
    }

    /**
     * Gets the maximum number of pooled database connections.
     *
     * @return Pool size.
     */
    public int getSqlPoolSize() {
        return Math.toIntExact(getLongProperty("sql.poolSize", 100L));
    }

    /**
     * Gets the maximum lifetime of a database connection.
     *
     * @return Recycle time in seconds.
     */
    public long getSqlPoolRecycle() {
        return getLongProperty("sql.poolRecycle", 3600L);
    }
}
