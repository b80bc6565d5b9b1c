package com.mimecast.directoryauth.auth;

import com.mimecast.directoryauth.config.DirectoryAuthConfig;
import com.mimecast.directoryauth.db.DataSourceFactory;
import com.mimecast.directoryauth.exception.AuthException;
import com.mimecast.directoryauth.exception.BackendException;
import com.mimecast.directoryauth.exception.InvalidCredentialsException;
import com.mimecast.directoryauth.ldap.ConnectionPool;
import com.mimecast.directoryauth.ldap.DirectoryClientFactory;
import com.mimecast.directoryauth.ldap.LdapErrors;
import com.mimecast.directoryauth.metrics.DirectoryAuthMetrics;
import com.mimecast.directoryauth.node.NodeAssignmentStore;
import com.mimecast.directoryauth.resetcode.ResetCodeStore;
import com.mimecast.directoryauth.util.PasswordHasher;
import com.mimecast.directoryauth.util.SshaPasswordHasher;
import com.unboundid.ldap.sdk.Attribute;
import com.unboundid.ldap.sdk.Entry;
import com.unboundid.ldap.sdk.Filter;
import com.unboundid.ldap.sdk.LDAPException;
import com.unboundid.ldap.sdk.Modification;
import com.unboundid.ldap.sdk.ModificationType;
import com.unboundid.ldap.sdk.ResultCode;
import com.unboundid.ldap.sdk.SearchResultEntry;
import com.unboundid.ldap.sdk.SearchScope;
import com.zaxxer.hikari.HikariDataSource;
import org.apache.commons.codec.digest.DigestUtils;
import org.apache.commons.lang3.StringUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import javax.sql.DataSource;
import java.io.Closeable;
import java.io.IOException;
import java.security.SecureRandom;
import java.time.Clock;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Directory backed authentication with SQL bookkeeping.
 *
 * <p>Users live in the directory; a successful bind as the user DN is the password check.
 * <br>The SQL database allocates user ids, tracks node capacity and stores reset codes.
 *
 * <p>Self-service changes bind as the user with the current password.
 * Administrative changes bind with the configured admin identity.
 */
public class LdapAuthBackend implements AuthBackend {
    private static final Logger log = LogManager.getLogger(LdapAuthBackend.class);

    public static final String NAME = "ldap";

    static final String NODE_PREFIX = "weave:";
    static final String ACCOUNT_ENABLED = "Yes";

    private static final String ATTR_UID = "uid";
    private static final String ATTR_UID_NUMBER = "uidNumber";
    private static final String ATTR_MAIL = "mail";
    private static final String ATTR_PASSWORD = "userPassword";
    private static final String ATTR_PRIMARY_NODE = "primaryNode";
    private static final String ATTR_ACCOUNT_ENABLED = "account-enabled";
    private static final String ANY_OBJECT = "(objectClass=*)";

    private static final SecureRandom random = new SecureRandom();

    private final ConnectionPool pool;
    private final UserDn userDn;
    private final NodeAssignmentStore nodeStore;
    private final ResetCodeStore resetCodes;
    private final UserIdAllocator userIds;
    private final PasswordHasher passwordHasher;
    private final Closeable dataSourceHandle;

    private final String adminUser;
    private final String adminPassword;
    private final boolean singleBox;
    private final boolean checkAccountState;
    private final String nodesScheme;
    private final int timeout;

    /**
     * Constructs a new LdapAuthBackend.
     *
     * @param builder Builder instance with configuration.
     */
    private LdapAuthBackend(Builder builder) {
        DirectoryAuthConfig config = builder.config;
        this.pool = builder.pool;
        this.userDn = new UserDn(config);
        this.nodeStore = builder.nodeStore;
        this.resetCodes = builder.resetCodes;
        this.userIds = builder.userIds;
        this.passwordHasher = builder.passwordHasher;
        this.dataSourceHandle = builder.dataSourceHandle;
        this.adminUser = config.getAdminUser();
        this.adminPassword = config.getAdminPassword();
        this.singleBox = config.isSingleBox();
        this.checkAccountState = config.isCheckAccountState();
        this.nodesScheme = config.getNodesScheme();
        this.timeout = config.getLdapTimeout();
    }

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public Optional<Long> getUserId(String userName) throws AuthException {
        String filter = Filter.createEqualityFilter(ATTR_UID, userName).toString();
        List<SearchResultEntry> entries;
        try (ConnectionPool.Lease lease = pool.connection()) {
            entries = lease.get().search(userDn.searchBase(), SearchScope.SUB, filter, timeout, ATTR_UID_NUMBER);
        } catch (LDAPException e) {
            if (LdapErrors.isNoSuchObject(e)) {
                return Optional.empty();
            }
            log.debug("Could not get the user id of {}", userName);
            throw LdapErrors.translate("Could not get the user id", e);
        }

        if (entries.isEmpty()) {
            return Optional.empty();
        }
        return parseId(entries.get(0).getAttributeValue(ATTR_UID_NUMBER));
    }

    @Override
    public boolean createUser(String userName, String password, String email) throws AuthException {
        long userId = userIds.next();
        String dn = userDn.of(userName);
        String verification = DigestUtils.sha1Hex(random.nextInt(10_000_000) + userName);

        Entry entry = new Entry(dn,
                new Attribute("objectClass", "dataStore", "inetOrgPerson"),
                new Attribute("cn", userName),
                new Attribute("sn", userName),
                new Attribute(ATTR_UID, userName),
                new Attribute(ATTR_UID_NUMBER, String.valueOf(userId)),
                new Attribute(ATTR_PRIMARY_NODE, NODE_PREFIX),
                new Attribute("rescueNode", NODE_PREFIX),
                new Attribute(ATTR_PASSWORD, passwordHasher.hash(password)),
                new Attribute(ATTR_ACCOUNT_ENABLED, ACCOUNT_ENABLED),
                new Attribute(ATTR_MAIL, email),
                new Attribute("mail-verified", verification));

        try (ConnectionPool.Lease lease = pool.connection(adminUser, adminPassword)) {
            boolean created = lease.get().add(entry) == ResultCode.SUCCESS;
            log.debug("Created user {} with id {}: {}", userName, userId, created);
            return created;
        } catch (LDAPException e) {
            if (e.getResultCode() == ResultCode.ENTRY_ALREADY_EXISTS) {
                log.debug("User {} already exists", userName);
                return false;
            }
            log.debug("Could not create the user {}", userName);
            throw LdapErrors.translate("Could not create the user", e);
        }
    }

    @Override
    public Optional<Long> authenticateUser(String userName, String password) throws AuthException {
        // An empty password would be an unauthenticated bind, which servers accept.
        if (StringUtils.isEmpty(userName) || StringUtils.isEmpty(password)) {
            return Optional.empty();
        }

        String dn = userDn.of(userName);
        String[] attributes = checkAccountState
                ? new String[]{ATTR_UID_NUMBER, ATTR_ACCOUNT_ENABLED}
                : new String[]{ATTR_UID_NUMBER};

        List<SearchResultEntry> entries;
        try (ConnectionPool.Lease lease = pool.connection(dn, password)) {
            entries = lease.get().search(dn, SearchScope.BASE, ANY_OBJECT, timeout, attributes);
        } catch (InvalidCredentialsException e) {
            return Optional.empty();
        } catch (LDAPException e) {
            if (LdapErrors.isInvalidCredentials(e)) {
                return Optional.empty();
            }
            log.debug("Could not authenticate the user {}", userName);
            throw LdapErrors.translate("Could not authenticate the user", e);
        }

        if (entries.isEmpty()) {
            return Optional.empty();
        }

        SearchResultEntry entry = entries.get(0);
        if (checkAccountState && !ACCOUNT_ENABLED.equals(entry.getAttributeValue(ATTR_ACCOUNT_ENABLED))) {
            log.debug("Account {} is disabled", userName);
            return Optional.empty();
        }
        return parseId(entry.getAttributeValue(ATTR_UID_NUMBER));
    }

    @Override
    public String generateResetCode(long userId, boolean overwrite) throws AuthException {
        return resetCodes.generate(userId, overwrite);
    }

    @Override
    public boolean verifyResetCode(long userId, String code) throws AuthException {
        return resetCodes.verify(userId, code);
    }

    @Override
    public boolean clearResetCode(long userId) throws AuthException {
        return resetCodes.clear(userId);
    }

    @Override
    public Optional<UserInfo> getUserInfo(long userId) throws AuthException {
        Optional<String> userName = getUserName(userId);
        if (userName.isEmpty()) {
            return Optional.empty();
        }

        String dn = userDn.of(userName.get());
        List<SearchResultEntry> entries;
        try (ConnectionPool.Lease lease = pool.connection()) {
            entries = lease.get().search(dn, SearchScope.BASE, ANY_OBJECT, timeout, ATTR_MAIL);
        } catch (LDAPException e) {
            if (LdapErrors.isNoSuchObject(e)) {
                return Optional.empty();
            }
            log.debug("Could not get the user info of {}", userId);
            throw LdapErrors.translate("Could not get the user info", e);
        }

        if (entries.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(new UserInfo(userName.get(), entries.get(0).getAttributeValue(ATTR_MAIL)));
    }

    @Override
    public boolean updateEmail(long userId, String email, String password) throws AuthException {
        Optional<String> userName = getUserName(userId);
        if (userName.isEmpty()) {
            return false;
        }

        String dn = userDn.of(userName.get());
        return modify(dn, password, "email", new Modification(ModificationType.REPLACE, ATTR_MAIL, email));
    }

    @Override
    public boolean updatePassword(long userId, String password, String oldPassword) throws AuthException {
        Optional<String> userName = getUserName(userId);
        if (userName.isEmpty()) {
            return false;
        }

        String dn = userDn.of(userName.get());
        Modification change = new Modification(ModificationType.REPLACE, ATTR_PASSWORD, passwordHasher.hash(password));
        boolean updated = modify(dn, oldPassword, "password", change);
        if (updated) {
            pool.purge(dn, password);
        }
        return updated;
    }

    @Override
    public boolean deleteUser(long userId, String password) throws AuthException {
        Optional<String> userName = getUserName(userId);
        if (userName.isEmpty()) {
            return false;
        }

        String dn = userDn.of(userName.get());
        boolean deleted;
        try (ConnectionPool.Lease lease = connectionFor(dn, password)) {
            deleted = lease.get().delete(dn) == ResultCode.SUCCESS;
        } catch (InvalidCredentialsException e) {
            return false;
        } catch (LDAPException e) {
            if (LdapErrors.isNoSuchObject(e)) {
                return false;
            }
            log.debug("Could not delete the user {}", userId);
            throw LdapErrors.translate("Could not delete the user", e);
        }

        if (deleted) {
            pool.purge(dn, null);
        }
        return deleted;
    }

    @Override
    public Optional<String> getUserNode(long userId, boolean assign) throws AuthException {
        if (singleBox) {
            return Optional.empty();
        }

        Optional<String> userName = getUserName(userId);
        if (userName.isEmpty()) {
            return Optional.empty();
        }

        String dn = userDn.of(userName.get());
        List<SearchResultEntry> entries;
        try (ConnectionPool.Lease lease = pool.connection()) {
            entries = lease.get().search(dn, SearchScope.BASE, ANY_OBJECT, timeout, ATTR_PRIMARY_NODE);
        } catch (LDAPException e) {
            if (LdapErrors.isNoSuchObject(e)) {
                return Optional.empty();
            }
            log.debug("Could not get the user node of {}", userId);
            throw LdapErrors.translate("Could not get the user node", e);
        }

        if (!entries.isEmpty()) {
            String[] values = entries.get(0).getAttributeValues(ATTR_PRIMARY_NODE);
            if (values != null) {
                for (String value : values) {
                    String node = StringUtils.removeStart(value, NODE_PREFIX);
                    if (!node.isEmpty()) {
                        return Optional.of(nodeUrl(node));
                    }
                }
            }
        }

        if (!assign) {
            return Optional.empty();
        }

        String node = nodeStore.pickAndReserveNode(picked -> writeNode(dn, picked));
        log.info("Assigned node {} to user {}", node, userId);
        return Optional.of(nodeUrl(node));
    }

    /**
     * Releases the directory pool and the owned data source.
     *
     * @throws IOException Unable to close the data source.
     */
    @Override
    public void close() throws IOException {
        pool.close();
        if (dataSourceHandle != null) {
            dataSourceHandle.close();
        }
    }

    /**
     * Gets the directory pool.
     *
     * @return ConnectionPool instance.
     */
    public ConnectionPool getPool() {
        return pool;
    }

    /**
     * Gets the user name for an id.
     */
    private Optional<String> getUserName(long userId) throws AuthException {
        String filter = Filter.createEqualityFilter(ATTR_UID_NUMBER, String.valueOf(userId)).toString();
        List<SearchResultEntry> entries;
        try (ConnectionPool.Lease lease = pool.connection()) {
            entries = lease.get().search(userDn.searchBase(), SearchScope.SUB, filter, timeout, ATTR_UID);
        } catch (LDAPException e) {
            if (LdapErrors.isNoSuchObject(e)) {
                return Optional.empty();
            }
            log.debug("Could not get the user name of {}", userId);
            throw LdapErrors.translate("Could not get the user info", e);
        }

        if (entries.isEmpty()) {
            return Optional.empty();
        }
        return Optional.ofNullable(entries.get(0).getAttributeValue(ATTR_UID));
    }

    /**
     * Applies a single modification as the user or the admin.
     */
    private boolean modify(String dn, String password, String what, Modification modification) throws AuthException {
        try (ConnectionPool.Lease lease = connectionFor(dn, password)) {
            return lease.get().modify(dn, modification) == ResultCode.SUCCESS;
        } catch (InvalidCredentialsException e) {
            return false;
        } catch (LDAPException e) {
            if (LdapErrors.isNoSuchObject(e)) {
                return false;
            }
            log.debug("Could not update the {} of {}", what, dn);
            throw LdapErrors.translate("Could not update the " + what, e);
        }
    }

    /**
     * Records the node on the user entry with the admin identity.
     */
    private boolean writeNode(String dn, String node) throws AuthException {
        Modification change = new Modification(ModificationType.REPLACE, ATTR_PRIMARY_NODE, NODE_PREFIX + node);
        try (ConnectionPool.Lease lease = pool.connection(adminUser, adminPassword)) {
            return lease.get().modify(dn, change) == ResultCode.SUCCESS;
        } catch (LDAPException e) {
            log.debug("Could not update the node of {}", dn);
            throw LdapErrors.translate("Could not update the user node", e);
        }
    }

    /**
     * Borrows a connection bound as the user when a password is given, else as the admin.
     */
    private ConnectionPool.Lease connectionFor(String dn, String password) throws AuthException {
        if (password == null) {
            return pool.connection(adminUser, adminPassword);
        }
        return pool.connection(dn, password);
    }

    private String nodeUrl(String node) {
        return nodesScheme + "://" + node + "/";
    }

    private Optional<Long> parseId(String value) throws BackendException {
        if (value == null) {
            return Optional.empty();
        }
        try {
            return Optional.of(Long.parseLong(value.trim()));
        } catch (NumberFormatException e) {
            throw new BackendException("Invalid uidNumber: " + value, e);
        }
    }

    /**
     * Builder for LdapAuthBackend.
     * <p>Components not provided are created from the configuration.
     */
    public static class Builder {
        private DirectoryAuthConfig config = new DirectoryAuthConfig();
        private ConnectionPool pool;
        private DirectoryClientFactory clientFactory;
        private DataSource dataSource;
        private Closeable dataSourceHandle;
        private NodeAssignmentStore nodeStore;
        private ResetCodeStore resetCodes;
        private UserIdAllocator userIds;
        private PasswordHasher passwordHasher;
        private Clock clock = Clock.systemUTC();
        private DirectoryAuthMetrics metrics;

        public Builder withConfig(DirectoryAuthConfig config) {
            this.config = config;
            return this;
        }

        /**
         * Sets the directory pool, otherwise built from the configuration.
         *
         * @param pool Connection pool.
         * @return Builder instance.
         */
        public Builder withPool(ConnectionPool pool) {
            this.pool = pool;
            return this;
        }

        /**
         * Sets the client factory used when the pool is built from the configuration.
         *
         * @param clientFactory Client factory.
         * @return Builder instance.
         */
        public Builder withClientFactory(DirectoryClientFactory clientFactory) {
            this.clientFactory = clientFactory;
            return this;
        }

        /**
         * Sets a data source owned by the caller.
         *
         * @param dataSource Data source.
         * @return Builder instance.
         */
        public Builder withDataSource(DataSource dataSource) {
            this.dataSource = dataSource;
            return this;
        }

        public Builder withNodeStore(NodeAssignmentStore nodeStore) {
            this.nodeStore = nodeStore;
            return this;
        }

        public Builder withResetCodes(ResetCodeStore resetCodes) {
            this.resetCodes = resetCodes;
            return this;
        }

        public Builder withUserIds(UserIdAllocator userIds) {
            this.userIds = userIds;
            return this;
        }

        public Builder withPasswordHasher(PasswordHasher passwordHasher) {
            this.passwordHasher = passwordHasher;
            return this;
        }

        public Builder withClock(Clock clock) {
            this.clock = clock;
            return this;
        }

        public Builder withMetrics(DirectoryAuthMetrics metrics) {
            this.metrics = metrics;
            return this;
        }

        /**
         * Builds the backend, creating tables when configured to.
         *
         * @return LdapAuthBackend instance.
         * @throws BackendException Unable to create tables.
         */
        public LdapAuthBackend build() throws BackendException {
            Objects.requireNonNull(config, "config must not be null");
            if (metrics == null) {
                metrics = new DirectoryAuthMetrics();
            }
            if (passwordHasher == null) {
                passwordHasher = new SshaPasswordHasher();
            }
            if (dataSource == null) {
                HikariDataSource hikari = DataSourceFactory.create(config);
                if (hikari == null) {
                    throw new IllegalArgumentException("The directory backend needs sql.jdbcUrl");
                }
                dataSource = hikari;
                dataSourceHandle = hikari;
            }

            if (nodeStore == null) {
                nodeStore = new NodeAssignmentStore(dataSource, metrics);
                if (config.isCreateTables()) {
                    nodeStore.createTableIfNotExists();
                }
            }
            if (resetCodes == null) {
                resetCodes = new ResetCodeStore(dataSource, clock);
                if (config.isCreateTables()) {
                    resetCodes.createTableIfNotExists();
                }
            }
            if (userIds == null) {
                userIds = new UserIdAllocator(dataSource);
                if (config.isCreateTables()) {
                    userIds.createTableIfNotExists();
                }
            }

            if (pool == null) {
                pool = new ConnectionPool.Builder()
                        .withUri(config.getLdapUri())
                        .withClientFactory(clientFactory)
                        .withDefaultBind(config.getBindUser(), config.getBindPassword())
                        .withCapacity(config.getLdapPoolSize())
                        .withRetryMax(config.getLdapRetryMax())
                        .withRetryDelay(config.getLdapRetryDelay())
                        .withTimeoutSeconds(config.getLdapTimeout())
                        .withTls(config.isUseTls())
                        .withPooling(config.isLdapUsePool())
                        .withMetrics(metrics)
                        .build();
            }

            return new LdapAuthBackend(this);
        }
    }
}
