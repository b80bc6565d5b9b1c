package com.mimecast.directoryauth.node;

import com.mimecast.directoryauth.exception.BackendException;
import com.mimecast.directoryauth.exception.BackendTimeoutException;
import com.mimecast.directoryauth.exception.NodeAttributionException;
import com.mimecast.directoryauth.metrics.DirectoryAuthMetrics;
import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class NodeAssignmentStoreTest {

    private static HikariDataSource ds;

    private DirectoryAuthMetrics metrics;
    private NodeAssignmentStore store;

    @BeforeAll
    static void setupDatabase() throws Exception {
        HikariConfig cfg = new HikariConfig();
        cfg.setJdbcUrl("jdbc:h2:mem:nodes_test;MODE=PostgreSQL;DB_CLOSE_DELAY=-1");
        cfg.setUsername("sa");
        cfg.setPassword("");
        cfg.setMaximumPoolSize(2);
        ds = new HikariDataSource(cfg);

        new NodeAssignmentStore(ds, new DirectoryAuthMetrics()).createTableIfNotExists();
    }

    @AfterAll
    static void closeDatabase() {
        if (ds != null) {
            ds.close();
        }
    }

    @BeforeEach
    void seedNodes() throws Exception {
        try (Connection conn = ds.getConnection(); Statement stmt = conn.createStatement()) {
            stmt.execute("DELETE FROM available_nodes");
            stmt.execute("INSERT INTO available_nodes (node, available_assignments, actives) VALUES ('node1', 10, 101)");
            stmt.execute("INSERT INTO available_nodes (node, available_assignments, actives) VALUES ('node2', 0, 100)");
            stmt.execute("INSERT INTO available_nodes (node, available_assignments, actives) VALUES ('node3', 1, 89)");
        }
        metrics = new DirectoryAuthMetrics();
        store = new NodeAssignmentStore(ds, metrics);
    }

    // --- selection ---

    @Test
    void picksLeastActiveNodeWithCapacity() throws Exception {
        List<String> written = new ArrayList<>();

        assertEquals("node3", store.pickAndReserveNode(node -> written.add(node)));
        assertEquals("node1", store.pickAndReserveNode(node -> written.add(node)));

        assertEquals(List.of("node3", "node1"), written);
        assertEquals(2.0, metrics.getRegistry().counter("node.assignment", "result", "success").count());
    }

    @Test
    void reservationUpdatesCounters() throws Exception {
        store.pickAndReserveNode(node -> true);

        AvailableNode node3 = store.findByNode("node3").orElseThrow();
        assertEquals(0, node3.getAvailableAssignments());
        assertEquals(90, node3.getActives());

        AvailableNode node1 = store.findByNode("node1").orElseThrow();
        assertEquals(10, node1.getAvailableAssignments());
        assertEquals(101, node1.getActives());
    }

    @Test
    void downedNodesAreSkipped() throws Exception {
        execute("UPDATE available_nodes SET downed = 1 WHERE node = 'node3'");

        assertEquals("node1", store.pickAndReserveNode(node -> true));
        assertTrue(store.findByNode("node3").orElseThrow().isDowned());
    }

    @Test
    void noCapacityFailsAssignment() throws Exception {
        execute("UPDATE available_nodes SET available_assignments = 0");
        List<String> written = new ArrayList<>();

        assertThrows(NodeAttributionException.class, () -> store.pickAndReserveNode(written::add));
        assertTrue(written.isEmpty());
        assertEquals(1.0, metrics.getRegistry().counter("node.assignment", "result", "failure").count());
    }

    @Test
    void findLeastLoadedIsEmptyWithoutNodes() throws Exception {
        execute("DELETE FROM available_nodes");
        assertFalse(store.findLeastLoaded().isPresent());
    }

    // --- writer failures ---

    @Test
    void unacknowledgedWriteSkipsReservation() throws Exception {
        assertThrows(NodeAttributionException.class, () -> store.pickAndReserveNode(node -> false));

        AvailableNode node3 = store.findByNode("node3").orElseThrow();
        assertEquals(1, node3.getAvailableAssignments());
        assertEquals(89, node3.getActives());
    }

    @Test
    void writerErrorBecomesAttributionFailure() throws Exception {
        BackendException cause = new BackendException("directory down");

        NodeAttributionException e = assertThrows(NodeAttributionException.class,
                () -> store.pickAndReserveNode(node -> {
                    throw cause;
                }));
        assertSame(cause, e.getCause());
        assertEquals(1, store.findByNode("node3").orElseThrow().getAvailableAssignments());
    }

    @Test
    void writerTimeoutKeepsItsType() throws Exception {
        assertThrows(BackendTimeoutException.class,
                () -> store.pickAndReserveNode(node -> {
                    throw new BackendTimeoutException("slow directory");
                }));
        assertEquals(1, store.findByNode("node3").orElseThrow().getAvailableAssignments());
    }

    // --- bookkeeping ---

    @Test
    void failedReservationStillReturnsNode() throws Exception {
        DataSource flaky = mock(DataSource.class);
        when(flaky.getConnection())
                .thenAnswer(invocation -> ds.getConnection())
                .thenThrow(new SQLException("database gone"));
        NodeAssignmentStore flakyStore = new NodeAssignmentStore(flaky, metrics);

        assertEquals("node3", flakyStore.pickAndReserveNode(node -> true));

        assertEquals(1.0, metrics.getRegistry().counter("node.bookkeeping.failures").count());
        assertEquals(1, store.findByNode("node3").orElseThrow().getAvailableAssignments());
    }

    @Test
    void selectionErrorIsBackendError() throws Exception {
        DataSource broken = mock(DataSource.class);
        when(broken.getConnection()).thenThrow(new SQLException("database gone"));

        assertThrows(BackendException.class,
                () -> new NodeAssignmentStore(broken, metrics).pickAndReserveNode(node -> true));
    }

    private void execute(String sql) throws Exception {
        try (Connection conn = ds.getConnection(); Statement stmt = conn.createStatement()) {
            stmt.execute(sql);
        }
    }
}
