package com.mimecast.directoryauth.ldap;

import com.mimecast.directoryauth.exception.AuthException;
import com.mimecast.directoryauth.exception.BackendException;
import com.mimecast.directoryauth.exception.BackendTimeoutException;
import com.mimecast.directoryauth.exception.MaxConnectionReachedException;
import com.mimecast.directoryauth.metrics.DirectoryAuthMetrics;
import com.unboundid.ldap.sdk.LDAPException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.Closeable;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Bounded pool of directory connections reused by bound identity.
 *
 * <p>Connections are borrowed with a scoped lease:
 * <pre>
 * try (ConnectionPool.Lease lease = pool.connection(dn, password)) {
 *     lease.get().search(...);
 * }
 * </pre>
 *
 * <p>A single lock guards the entry list. It is held for bookkeeping only; binds and
 * unbinds run outside of it once an entry has been claimed by marking it active.
 * <br>Creation reserves a slot under the lock first, so the entry count never exceeds capacity.
 *
 * <p>Every released connection is unbound so no session stays bound to caller credentials.
 */
public class ConnectionPool implements Closeable {
    private static final Logger log = LogManager.getLogger(ConnectionPool.class);

    private final String uri;
    private final DirectoryClientFactory clientFactory;
    private final String defaultIdentity;
    private final String defaultSecret;
    private final int capacity;
    private final int retryMax;
    private final Duration retryDelay;
    private final Duration fullBackoff;
    private final boolean useTls;
    private final boolean usePooling;
    private final CleanupListener cleanupListener;
    private final DirectoryAuthMetrics metrics;

    private final ReentrantLock lock = new ReentrantLock();
    private final List<DirectoryConnection> entries = new ArrayList<>();

    /**
     * Slots reserved by creators that have not appended their entry yet.
     */
    private int pending;

    /**
     * Constructs a new ConnectionPool.
     *
     * @param builder Builder instance with configuration.
     */
    private ConnectionPool(Builder builder) {
        this.uri = builder.uri;
        this.clientFactory = builder.clientFactory;
        this.defaultIdentity = builder.defaultIdentity;
        this.defaultSecret = builder.defaultSecret;
        this.capacity = builder.capacity;
        this.retryMax = builder.retryMax;
        this.retryDelay = builder.retryDelay;
        this.fullBackoff = builder.fullBackoff;
        this.useTls = builder.useTls;
        this.usePooling = builder.usePooling;
        this.cleanupListener = builder.cleanupListener;
        this.metrics = builder.metrics;
    }

    /**
     * Borrows a connection bound to the default identity.
     *
     * @return Lease to close when done.
     * @throws AuthException Unable to provide a connection.
     */
    public Lease connection() throws AuthException {
        return connection(null, null);
    }

    /**
     * Borrows a connection bound to the given identity.
     * <p>When the pool is full, retries up to the retry limit, evicting one idle entry each time.
     *
     * @param identity Bind DN, null for the default identity.
     * @param secret   Password, null for the default secret.
     * @return Lease to close when done.
     * @throws MaxConnectionReachedException Pool stayed full.
     * @throws BackendTimeoutException       Bind timed out.
     * @throws BackendException              Bind failed after retries.
     * @throws AuthException                 Credentials rejected.
     */
    public Lease connection(String identity, String secret) throws AuthException {
        int tries = 0;
        DirectoryConnection conn = null;
        while (tries < retryMax) {
            try {
                conn = getConnection(identity, secret);
                break;
            } catch (MaxConnectionReachedException e) {
                tries++;
                metrics.poolFull();
                log.debug("Directory pool full for {}, attempt {}/{}", uri, tries, retryMax);
                sleep(fullBackoff);
                evictIdle();
            }
        }

        if (conn == null) {
            log.warn("Directory pool exhausted for {} after {} attempts (capacity: {})", uri, tries, capacity);
            throw new MaxConnectionReachedException(uri);
        }
        return new Lease(conn);
    }

    /**
     * Drops pooled entries bound to an identity.
     * <p>With a secret, only entries bound with a different secret are dropped.
     * <br>Idle entries are unbound and closed; checked out entries are detached and
     * discarded when their lease ends.
     *
     * @param identity Bind DN.
     * @param secret   Current password, or null to drop all entries of the identity.
     */
    public void purge(String identity, String secret) {
        if (!usePooling) {
            return;
        }

        List<DirectoryConnection> idle = new ArrayList<>();
        lock.lock();
        try {
            Iterator<DirectoryConnection> it = entries.iterator();
            while (it.hasNext()) {
                DirectoryConnection conn = it.next();
                if (!Objects.equals(conn.getBoundIdentity(), identity)) {
                    continue;
                }
                if (secret != null && Objects.equals(conn.getBoundSecret(), secret)) {
                    continue;
                }
                it.remove();
                if (!conn.isActive()) {
                    idle.add(conn);
                }
            }
        } finally {
            lock.unlock();
        }

        for (DirectoryConnection conn : idle) {
            discard(conn);
        }
    }

    /**
     * Gets the number of pooled entries.
     *
     * @return Entry count.
     */
    public int size() {
        lock.lock();
        try {
            return entries.size();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Gets the number of pooled entries currently checked out.
     *
     * @return Active count.
     */
    public int activeCount() {
        lock.lock();
        try {
            return (int) entries.stream().filter(DirectoryConnection::isActive).count();
        } finally {
            lock.unlock();
        }
    }

    public String getUri() {
        return uri;
    }

    public int getCapacity() {
        return capacity;
    }

    public boolean isUsePooling() {
        return usePooling;
    }

    /**
     * Unbinds and drops every entry.
     */
    @Override
    public void close() {
        List<DirectoryConnection> all;
        lock.lock();
        try {
            all = new ArrayList<>(entries);
            entries.clear();
        } finally {
            lock.unlock();
        }

        for (DirectoryConnection conn : all) {
            discard(conn);
        }
        log.info("Closed directory pool for {} ({} connections)", uri, all.size());
    }

    /**
     * Finds a reusable entry or creates a new one.
     */
    private DirectoryConnection getConnection(String identity, String secret) throws AuthException {
        String bind = identity != null ? identity : defaultIdentity;
        String passwd = secret != null ? secret : defaultSecret;

        if (usePooling) {
            DirectoryConnection conn = match(bind, passwd);
            if (conn != null) {
                return conn;
            }
            reserveSlot();
        }

        DirectoryConnection conn;
        try {
            conn = createConnection(bind, passwd);
        } catch (AuthException | RuntimeException e) {
            if (usePooling) {
                releaseSlot(null);
            }
            throw e;
        }

        if (usePooling) {
            releaseSlot(conn);
        }
        return conn;
    }

    /**
     * Claims an idle entry usable for the identity.
     * <p>Unbound entries match any identity and are bound here when an identity is requested.
     * <br>Entries bound to the same credentials are rebound; dead ones are dropped and the scan continues.
     */
    private DirectoryConnection match(String bind, String passwd) throws AuthException {
        while (true) {
            DirectoryConnection candidate = null;
            boolean sameIdentity = false;

            lock.lock();
            try {
                for (DirectoryConnection conn : entries) {
                    if (conn.isActive()) {
                        continue;
                    }
                    if (conn.getBoundIdentity() == null) {
                        conn.setActive(true);
                        candidate = conn;
                        break;
                    }
                    if (Objects.equals(conn.getBoundIdentity(), bind) && Objects.equals(conn.getBoundSecret(), passwd)) {
                        conn.setActive(true);
                        candidate = conn;
                        sameIdentity = true;
                        break;
                    }
                }
            } finally {
                lock.unlock();
            }

            if (candidate == null) {
                return null;
            }

            if (sameIdentity) {
                // The previous bind may have expired.
                candidate.unbind();
                try {
                    candidate.bind(bind, passwd);
                    return candidate;
                } catch (LDAPException e) {
                    log.debug("Dropping pooled connection for {}: {}", bind, e.getResultCode());
                    remove(candidate);
                    discard(candidate);
                    continue;
                }
            }

            if (bind != null) {
                try {
                    bindWithRetry(candidate, bind, passwd);
                } catch (AuthException e) {
                    release(candidate);
                    throw e;
                }
            }
            return candidate;
        }
    }

    /**
     * Opens, secures and binds a new connection.
     */
    private DirectoryConnection createConnection(String bind, String passwd) throws AuthException {
        DirectoryClient client;
        try {
            client = clientFactory.create();
        } catch (LDAPException e) {
            throw LdapErrors.translate("Unable to create directory client for " + uri, e);
        }

        DirectoryConnection conn = new DirectoryConnection(client, cleanupListener);
        try {
            if (useTls) {
                try {
                    conn.startTls();
                } catch (LDAPException e) {
                    throw LdapErrors.translate("StartTLS failed for " + uri, e);
                }
            }
            if (bind != null) {
                bindWithRetry(conn, bind, passwd);
            }
        } catch (AuthException e) {
            conn.discard();
            throw e;
        }

        conn.setActive(true);
        metrics.connectionCreated();
        log.debug("Created directory connection to {} for {}", uri, bind);
        return conn;
    }

    /**
     * Binds, retrying transient failures.
     * <p>Timeouts are not retried.
     */
    private void bindWithRetry(DirectoryConnection conn, String bind, String passwd) throws AuthException {
        LDAPException last = null;
        for (int tries = 0; tries < retryMax; tries++) {
            try {
                conn.bind(bind, passwd);
                return;
            } catch (LDAPException e) {
                if (LdapErrors.isTimeout(e)) {
                    throw new BackendTimeoutException("Bind timed out for " + bind + " on " + uri, e);
                }
                if (!LdapErrors.isRetryable(e)) {
                    throw LdapErrors.translateBind("Bind failed for " + bind, e);
                }
                last = e;
                log.debug("Transient bind failure for {} on {}, attempt {}/{}: {}",
                        bind, uri, tries + 1, retryMax, e.getResultCode());
                conn.unbind();
                sleep(retryDelay);
            }
        }

        String reason = last != null ? last.getResultCode() + " " + last.getMessage() : "no attempts";
        log.error("Unable to bind {} on {}: {}", bind, uri, reason);
        throw new BackendException("Unable to bind " + bind + " on " + uri + ": " + reason, last);
    }

    /**
     * Returns a leased connection.
     * <p>Live pooled entries become idle again; dead or detached ones are dropped.
     */
    private void release(DirectoryConnection conn) {
        boolean keep = conn.isConnected();
        conn.unbind();

        if (!usePooling) {
            conn.discard();
            return;
        }

        boolean drop;
        lock.lock();
        try {
            drop = !keep || !entries.contains(conn);
            if (drop) {
                entries.remove(conn);
            }
            conn.setActive(false);
        } finally {
            lock.unlock();
        }

        if (drop) {
            discard(conn);
        }
    }

    /**
     * Removes the first idle entry to make room.
     */
    private void evictIdle() {
        DirectoryConnection evicted = null;
        lock.lock();
        try {
            Iterator<DirectoryConnection> it = entries.iterator();
            while (it.hasNext()) {
                DirectoryConnection conn = it.next();
                if (!conn.isActive()) {
                    it.remove();
                    evicted = conn;
                    break;
                }
            }
        } finally {
            lock.unlock();
        }

        if (evicted != null) {
            log.debug("Evicted idle directory connection from {}", uri);
            discard(evicted);
        }
    }

    private void reserveSlot() throws MaxConnectionReachedException {
        lock.lock();
        try {
            if (entries.size() + pending >= capacity) {
                throw new MaxConnectionReachedException(uri);
            }
            pending++;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Frees a reserved slot, appending the created entry if any.
     */
    private void releaseSlot(DirectoryConnection created) {
        lock.lock();
        try {
            pending--;
            if (created != null) {
                entries.add(created);
            }
        } finally {
            lock.unlock();
        }
    }

    private void remove(DirectoryConnection conn) {
        lock.lock();
        try {
            entries.remove(conn);
        } finally {
            lock.unlock();
        }
    }

    private void discard(DirectoryConnection conn) {
        conn.discard();
        metrics.connectionDiscarded();
    }

    private void sleep(Duration duration) throws BackendException {
        try {
            Thread.sleep(duration.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new BackendException("Interrupted while waiting for directory connection to " + uri, e);
        }
    }

    /**
     * Scoped checkout of a pooled connection.
     * <p>Closing releases the connection exactly once.
     */
    public final class Lease implements AutoCloseable {
        private final DirectoryConnection connection;
        private final AtomicBoolean released = new AtomicBoolean();

        private Lease(DirectoryConnection connection) {
            this.connection = connection;
        }

        /**
         * Gets the borrowed connection.
         *
         * @return DirectoryConnection instance.
         */
        public DirectoryConnection get() {
            return connection;
        }

        @Override
        public void close() {
            if (released.compareAndSet(false, true)) {
                release(connection);
            }
        }
    }

    /**
     * Builder for ConnectionPool.
     */
    public static class Builder {
        private String uri = "ldap://localhost";
        private DirectoryClientFactory clientFactory;
        private String defaultIdentity;
        private String defaultSecret;
        private int capacity = 10;
        private int retryMax = 3;
        private Duration retryDelay = Duration.ofMillis(100);
        private Duration fullBackoff = Duration.ofMillis(100);
        private int timeoutSeconds = -1;
        private boolean useTls = false;
        private boolean usePooling = true;
        private CleanupListener cleanupListener = CleanupListener.LOGGING;
        private DirectoryAuthMetrics metrics;

        /**
         * Sets the directory URI.
         *
         * @param uri Directory URI.
         * @return Builder instance.
         */
        public Builder withUri(String uri) {
            this.uri = uri;
            return this;
        }

        /**
         * Sets the client factory, defaults to {@link LdapDirectoryClient} for the URI.
         *
         * @param clientFactory Client factory.
         * @return Builder instance.
         */
        public Builder withClientFactory(DirectoryClientFactory clientFactory) {
            this.clientFactory = clientFactory;
            return this;
        }

        /**
         * Sets the identity used when none is requested.
         *
         * @param identity Bind DN.
         * @param secret   Password.
         * @return Builder instance.
         */
        public Builder withDefaultBind(String identity, String secret) {
            this.defaultIdentity = identity;
            this.defaultSecret = secret;
            return this;
        }

        public Builder withCapacity(int capacity) {
            this.capacity = capacity;
            return this;
        }

        public Builder withRetryMax(int retryMax) {
            this.retryMax = retryMax;
            return this;
        }

        public Builder withRetryDelay(Duration retryDelay) {
            this.retryDelay = retryDelay;
            return this;
        }

        /**
         * Sets the pause between attempts when the pool is full.
         *
         * @param fullBackoff Backoff.
         * @return Builder instance.
         */
        public Builder withFullBackoff(Duration fullBackoff) {
            this.fullBackoff = fullBackoff;
            return this;
        }

        public Builder withTimeoutSeconds(int timeoutSeconds) {
            this.timeoutSeconds = timeoutSeconds;
            return this;
        }

        public Builder withTls(boolean useTls) {
            this.useTls = useTls;
            return this;
        }

        public Builder withPooling(boolean usePooling) {
            this.usePooling = usePooling;
            return this;
        }

        public Builder withCleanupListener(CleanupListener cleanupListener) {
            this.cleanupListener = cleanupListener;
            return this;
        }

        public Builder withMetrics(DirectoryAuthMetrics metrics) {
            this.metrics = metrics;
            return this;
        }

        /**
         * Builds the pool.
         *
         * @return ConnectionPool instance.
         */
        public ConnectionPool build() {
            Objects.requireNonNull(uri, "uri must not be null");
            if (capacity < 0) {
                throw new IllegalArgumentException("capacity must not be negative");
            }
            if (retryMax < 1) {
                throw new IllegalArgumentException("retryMax must be at least 1");
            }
            if (clientFactory == null) {
                clientFactory = LdapDirectoryClient.factory(uri, timeoutSeconds);
            }
            if (cleanupListener == null) {
                cleanupListener = CleanupListener.LOGGING;
            }
            if (metrics == null) {
                metrics = new DirectoryAuthMetrics();
            }

            ConnectionPool pool = new ConnectionPool(this);
            metrics.registerPool(uri, pool::size, pool::activeCount);
            log.info("Initialized directory pool: uri={}, size={}, pooling={}, tls={}", uri, capacity, usePooling, useTls);
            return pool;
        }
    }
}
