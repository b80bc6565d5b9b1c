package com.mimecast.directoryauth.ldap;

import com.mimecast.directoryauth.exception.BackendException;
import com.mimecast.directoryauth.exception.BackendTimeoutException;
import com.mimecast.directoryauth.exception.InvalidCredentialsException;
import com.mimecast.directoryauth.exception.MaxConnectionReachedException;
import com.mimecast.directoryauth.metrics.DirectoryAuthMetrics;
import com.unboundid.ldap.sdk.LDAPException;
import com.unboundid.ldap.sdk.ResultCode;
import com.unboundid.ldap.sdk.SearchScope;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotSame;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ConnectionPoolTest {

    private static final String URI = "ldap://localhost:389";

    private DirectoryClientMock.Factory factory;
    private DirectoryAuthMetrics metrics;
    private ConnectionPool pool;

    @BeforeEach
    void setUp() {
        factory = new DirectoryClientMock.Factory();
        metrics = new DirectoryAuthMetrics();
    }

    @AfterEach
    void tearDown() {
        if (pool != null) {
            pool.close();
        }
    }

    private ConnectionPool.Builder builder() {
        return new ConnectionPool.Builder()
                .withUri(URI)
                .withClientFactory(factory)
                .withDefaultBind("cn=bind,dc=mozilla", "bind")
                .withCapacity(2)
                .withRetryMax(3)
                .withRetryDelay(Duration.ofMillis(1))
                .withFullBackoff(Duration.ofMillis(20))
                .withMetrics(metrics);
    }

    // --- reuse ---

    @Test
    void sequentialLeasesReuseOneConnection() throws Exception {
        pool = builder().build();

        DirectoryConnection first;
        try (ConnectionPool.Lease lease = pool.connection()) {
            first = lease.get();
            assertEquals("cn=bind,dc=mozilla", first.getBoundIdentity());
            assertEquals(1, pool.activeCount());
        }
        try (ConnectionPool.Lease lease = pool.connection()) {
            assertSame(first, lease.get());
        }

        assertEquals(1, factory.getCreated());
        assertEquals(1, pool.size());
        assertEquals(0, pool.activeCount());
    }

    @Test
    void concurrentLeasesGetDistinctConnections() throws Exception {
        pool = builder().build();

        try (ConnectionPool.Lease a = pool.connection(); ConnectionPool.Lease b = pool.connection()) {
            assertNotSame(a.get(), b.get());
            assertEquals(2, pool.activeCount());
        }
        assertEquals(2, factory.getCreated());
        assertEquals(2, pool.size());
    }

    @Test
    void idleConnectionIsReboundForAnotherIdentity() throws Exception {
        pool = builder().build();

        try (ConnectionPool.Lease lease = pool.connection("uid=alice,ou=users", "a")) {
            assertEquals("uid=alice,ou=users", lease.get().getBoundIdentity());
        }
        try (ConnectionPool.Lease lease = pool.connection("uid=bob,ou=users", "b")) {
            assertEquals("uid=bob,ou=users", lease.get().getBoundIdentity());
        }

        assertEquals(1, factory.getCreated());
        assertEquals(2, factory.getBinds());
    }

    @Test
    void releaseUnbinds() throws Exception {
        pool = builder().build();

        DirectoryConnection conn;
        try (ConnectionPool.Lease lease = pool.connection("uid=alice,ou=users", "a")) {
            conn = lease.get();
        }

        assertNull(conn.getBoundIdentity());
        assertFalse(conn.isActive());
        assertNull(factory.clients.get(0).getBoundDn());
    }

    @Test
    void leaseCloseIsIdempotent() throws Exception {
        pool = builder().build();

        ConnectionPool.Lease lease = pool.connection();
        lease.close();
        lease.close();

        assertEquals(1, factory.getUnbinds());
        assertEquals(1, pool.size());
    }

    // --- liveness ---

    @Test
    void disconnectedConnectionIsDroppedOnRelease() throws Exception {
        pool = builder().build();

        try (ConnectionPool.Lease lease = pool.connection()) {
            lease.get().markDisconnected();
        }
        assertEquals(0, pool.size());
        assertTrue(factory.clients.get(0).isClosed());

        try (ConnectionPool.Lease lease = pool.connection()) {
            assertTrue(lease.get().isConnected());
        }
        assertEquals(2, factory.getCreated());
    }

    @Test
    void lostConnectionDuringSearchIsDropped() throws Exception {
        pool = builder().build();
        factory.searchFailure = ResultCode.SERVER_DOWN;

        try (ConnectionPool.Lease lease = pool.connection()) {
            assertThrows(LDAPException.class,
                    () -> lease.get().search("dc=mozilla", SearchScope.BASE, "(objectClass=*)", 0));
            assertFalse(lease.get().isConnected());
        }
        assertEquals(0, pool.size());
    }

    @Test
    void searchErrorOtherThanConnectionLossKeepsConnection() throws Exception {
        pool = builder().build();
        factory.searchFailure = ResultCode.NO_SUCH_OBJECT;

        try (ConnectionPool.Lease lease = pool.connection()) {
            assertThrows(LDAPException.class,
                    () -> lease.get().search("dc=mozilla", SearchScope.BASE, "(objectClass=*)", 0));
        }
        assertEquals(1, pool.size());
    }

    // --- capacity ---

    @Test
    void fullPoolThrowsAfterRetries() {
        pool = builder().withCapacity(0).build();

        long start = System.nanoTime();
        assertThrows(MaxConnectionReachedException.class, () -> pool.connection());
        long elapsed = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);

        assertTrue(elapsed >= 60, "Expected three backoffs, waited " + elapsed + "ms");
        assertEquals(3.0, metrics.getRegistry().counter("directory.pool.full").count());
        assertEquals(0, factory.getCreated());
    }

    @Test
    void checkedOutConnectionsAreNotShared() throws Exception {
        pool = builder().withCapacity(1).build();

        try (ConnectionPool.Lease ignored = pool.connection()) {
            assertThrows(MaxConnectionReachedException.class, () -> pool.connection());
        }
        try (ConnectionPool.Lease lease = pool.connection()) {
            assertTrue(lease.get().isActive());
        }
        assertEquals(1, factory.getCreated());
    }

    @Test
    void concurrentLeasesRespectCapacity() throws Exception {
        int capacity = 3;
        pool = builder()
                .withCapacity(capacity)
                .withRetryMax(200)
                .withFullBackoff(Duration.ofMillis(2))
                .build();

        Set<DirectoryConnection> inUse = ConcurrentHashMap.newKeySet();
        List<Throwable> failures = Collections.synchronizedList(new ArrayList<>());
        AtomicInteger maxSize = new AtomicInteger();
        AtomicInteger completed = new AtomicInteger();
        AtomicInteger starved = new AtomicInteger();

        int threads = 12;
        int iterations = 20;
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        for (int t = 0; t < threads; t++) {
            String identity = "uid=user" + t + ",ou=users";
            executor.submit(() -> {
                try {
                    start.await();
                    for (int i = 0; i < iterations; i++) {
                        try (ConnectionPool.Lease lease = pool.connection(identity, "pw")) {
                            if (!inUse.add(lease.get())) {
                                failures.add(new AssertionError("Connection handed out twice"));
                            }
                            if (!identity.equals(lease.get().getBoundIdentity())) {
                                failures.add(new AssertionError("Wrong identity " + lease.get().getBoundIdentity()));
                            }
                            maxSize.accumulateAndGet(pool.size(), Math::max);
                            Thread.sleep(1);
                            inUse.remove(lease.get());
                        }
                        completed.incrementAndGet();
                    }
                } catch (MaxConnectionReachedException e) {
                    // Allowed under contention, the bound still holds.
                    starved.incrementAndGet();
                } catch (Throwable e) {
                    failures.add(e);
                }
                return null;
            });
        }

        start.countDown();
        executor.shutdown();
        assertTrue(executor.awaitTermination(60, TimeUnit.SECONDS));

        assertTrue(failures.isEmpty(), () -> "Failures: " + failures);
        assertTrue(maxSize.get() <= capacity, "Pool grew to " + maxSize.get());
        assertTrue(pool.size() <= capacity);
        assertEquals(0, pool.activeCount());
        assertTrue(completed.get() > 0);
        assertTrue(starved.get() < threads);
    }

    // --- bind failures ---

    @Test
    void bindTimeoutIsNotRetried() {
        pool = builder().build();
        factory.failBinds(ResultCode.TIMEOUT, 1);

        assertThrows(BackendTimeoutException.class, () -> pool.connection());
        assertEquals(1, factory.getBinds());
        assertEquals(0, pool.size());
    }

    @Test
    void serverDownIsRetriedUpToLimit() {
        pool = builder().build();
        factory.failBinds(ResultCode.SERVER_DOWN, 3);

        BackendException e = assertThrows(BackendException.class, () -> pool.connection());
        assertFalse(e instanceof BackendTimeoutException);
        assertEquals(3, factory.getBinds());
        assertEquals(0, pool.size());
        assertTrue(factory.clients.get(0).isClosed());
    }

    @Test
    void transientBindFailureRecovers() throws Exception {
        pool = builder().build();
        factory.failBinds(ResultCode.BUSY, 2);

        try (ConnectionPool.Lease lease = pool.connection()) {
            assertEquals("cn=bind,dc=mozilla", lease.get().getBoundIdentity());
        }
        assertEquals(3, factory.getBinds());
        assertEquals(1, pool.size());
    }

    @Test
    void rejectedCredentialsAreNotRetried() {
        pool = builder().build();
        factory.withPassword("uid=alice,ou=users", "right");

        assertThrows(InvalidCredentialsException.class, () -> pool.connection("uid=alice,ou=users", "wrong"));
        assertEquals(1, factory.getBinds());
        assertEquals(0, pool.size());
    }

    @Test
    void rejectedCredentialsOnIdleConnectionReturnIt() throws Exception {
        pool = builder().build();
        factory.withPassword("uid=alice,ou=users", "right");

        pool.connection().close();
        assertThrows(InvalidCredentialsException.class, () -> pool.connection("uid=alice,ou=users", "wrong"));

        assertEquals(1, pool.size());
        assertEquals(0, pool.activeCount());
        assertEquals(1, factory.getCreated());
    }

    // --- purge ---

    @Test
    void purgeDetachesConnectionsWithStaleSecret() throws Exception {
        pool = builder().build();

        ConnectionPool.Lease lease = pool.connection("uid=alice,ou=users", "old");
        pool.purge("uid=alice,ou=users", "new");
        assertEquals(0, pool.size());
        assertFalse(factory.clients.get(0).isClosed());

        lease.close();
        assertEquals(0, pool.size());
        assertTrue(factory.clients.get(0).isClosed());
    }

    @Test
    void purgeKeepsConnectionsWithCurrentSecret() throws Exception {
        pool = builder().build();

        try (ConnectionPool.Lease ignored = pool.connection("uid=alice,ou=users", "pw")) {
            pool.purge("uid=alice,ou=users", "pw");
            assertEquals(1, pool.size());

            pool.purge("uid=bob,ou=users", null);
            assertEquals(1, pool.size());
        }
        assertEquals(1, pool.size());
    }

    @Test
    void purgeIsNoopWithoutPooling() throws Exception {
        pool = builder().withPooling(false).build();

        try (ConnectionPool.Lease ignored = pool.connection("uid=alice,ou=users", "pw")) {
            pool.purge("uid=alice,ou=users", null);
        }
        assertEquals(0, pool.size());
    }

    // --- misc ---

    @Test
    void withoutPoolingEveryLeaseOpensAConnection() throws Exception {
        pool = builder().withPooling(false).build();

        pool.connection().close();
        pool.connection().close();

        assertEquals(2, factory.getCreated());
        assertEquals(0, pool.size());
        assertTrue(factory.clients.get(0).isClosed());
        assertTrue(factory.clients.get(1).isClosed());
    }

    @Test
    void startTlsOnCreateWhenEnabled() throws Exception {
        pool = builder().withTls(true).build();

        pool.connection().close();
        pool.connection().close();

        assertEquals(1, factory.startTls.get());
    }

    @Test
    void unbindErrorsGoToCleanupListener() throws Exception {
        List<String> reported = Collections.synchronizedList(new ArrayList<>());
        pool = builder().withCleanupListener((identity, cause) -> reported.add(identity)).build();
        factory.unbindFailure = ResultCode.OTHER;

        try (ConnectionPool.Lease lease = pool.connection("uid=alice,ou=users", "pw")) {
            assertEquals("uid=alice,ou=users", lease.get().getBoundIdentity());
        }

        assertEquals(List.of("uid=alice,ou=users"), reported);
        assertEquals(1, pool.size());
    }

    @Test
    void closeDiscardsEveryConnection() throws Exception {
        pool = builder().build();
        try (ConnectionPool.Lease a = pool.connection(); ConnectionPool.Lease b = pool.connection()) {
            assertEquals(2, pool.activeCount());
        }

        pool.close();
        assertEquals(0, pool.size());
        assertTrue(factory.clients.stream().allMatch(DirectoryClientMock::isClosed));
        assertEquals(2.0, metrics.getRegistry().counter("directory.pool.connections.discarded").count());
    }

    @Test
    void builderRejectsInvalidSettings() {
        assertThrows(IllegalArgumentException.class, () -> builder().withCapacity(-1).build());
        assertThrows(IllegalArgumentException.class, () -> builder().withRetryMax(0).build());
        assertThrows(NullPointerException.class, () -> new ConnectionPool.Builder().build());
    }
}
