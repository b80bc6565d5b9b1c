package com.mimecast.directoryauth.node;

import com.mimecast.directoryauth.exception.AuthException;
import com.mimecast.directoryauth.exception.BackendException;
import com.mimecast.directoryauth.exception.BackendTimeoutException;
import com.mimecast.directoryauth.exception.NodeAttributionException;
import com.mimecast.directoryauth.metrics.DirectoryAuthMetrics;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.Optional;

/**
 * JDBC store for {@code available_nodes}, picks and reserves capacity for new users.
 *
 * <p>Selection reads the least active node with spare capacity. The user entry is written
 * next, and only then is the row updated from the values read at selection time.
 * <br>Selection and reservation are separate statements: two concurrent assignments can read the
 * same node before either updates it, and the later update overwrites the earlier one.
 * The counters are advisory load balancing hints, this looseness is accepted.
 */
public class NodeAssignmentStore {

    private static final Logger log = LogManager.getLogger(NodeAssignmentStore.class);

    private static final String CREATE_TABLE =
            "CREATE TABLE IF NOT EXISTS available_nodes (" +
            " node                  VARCHAR(256) NOT NULL PRIMARY KEY," +
            " available_assignments SMALLINT," +
            " downed                SMALLINT DEFAULT 0," +
            " backoff               SMALLINT DEFAULT 0," +
            " actives               INTEGER" +
            ")";

    private static final String SELECT_LEAST_LOADED =
            "SELECT node, available_assignments, actives, downed FROM available_nodes " +
            "WHERE available_assignments > 0 AND downed = 0 " +
            "ORDER BY actives ASC LIMIT 1";

    private static final String SELECT_BY_NODE =
            "SELECT node, available_assignments, actives, downed FROM available_nodes WHERE node = ?";

    private static final String UPDATE_COUNTERS =
            "UPDATE available_nodes SET available_assignments = ?, actives = ? WHERE node = ?";

    private final DataSource dataSource;
    private final DirectoryAuthMetrics metrics;

    /**
     * Constructs a new NodeAssignmentStore.
     *
     * @param dataSource Data source.
     * @param metrics    Metrics.
     */
    public NodeAssignmentStore(DataSource dataSource, DirectoryAuthMetrics metrics) {
        this.dataSource = dataSource;
        this.metrics = metrics;
    }

    /**
     * Creates the table if missing.
     *
     * @throws BackendException Database error.
     */
    public void createTableIfNotExists() throws BackendException {
        try (Connection conn = dataSource.getConnection(); Statement stmt = conn.createStatement()) {
            stmt.execute(CREATE_TABLE);
        } catch (SQLException e) {
            log.error("Failed to create available_nodes table: {}", e.getMessage());
            throw new BackendException("Failed to create available_nodes table", e);
        }
    }

    /**
     * Picks a node, records it through the writer and reserves one slot on it.
     * <p>If the writer fails the reservation is skipped and the assignment fails.
     * <br>If the writer succeeds the node is returned even when the counter update fails.
     *
     * @param writer Writes the node on the user entry.
     * @return Selected node.
     * @throws NodeAttributionException No node available or the write was not acknowledged.
     * @throws BackendTimeoutException  The write timed out.
     * @throws BackendException         Database error during selection.
     */
    public String pickAndReserveNode(NodeWriter writer) throws AuthException {
        Optional<AvailableNode> picked = findLeastLoaded();
        if (picked.isEmpty()) {
            metrics.assignmentFailed();
            log.warn("Unable to get a node: no node with available assignments");
            throw new NodeAttributionException("No node with available assignments");
        }

        AvailableNode node = picked.get();
        boolean written;
        try {
            written = writer.write(node.getNode());
        } catch (BackendTimeoutException e) {
            metrics.assignmentFailed();
            throw e;
        } catch (AuthException e) {
            metrics.assignmentFailed();
            log.error("Unable to record node {}: {}", node.getNode(), e.getMessage());
            throw new NodeAttributionException("Unable to record node " + node.getNode(), e);
        }

        if (!written) {
            metrics.assignmentFailed();
            log.error("Unable to record node {}: write not acknowledged", node.getNode());
            throw new NodeAttributionException("Unable to record node " + node.getNode());
        }

        reserve(node);
        metrics.assignmentSucceeded();
        return node.getNode();
    }

    /**
     * Finds the least active node with spare capacity.
     *
     * @return Node snapshot or empty.
     * @throws BackendException Database error.
     */
    public Optional<AvailableNode> findLeastLoaded() throws BackendException {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(SELECT_LEAST_LOADED);
             ResultSet rs = ps.executeQuery()) {
            return rs.next() ? Optional.of(map(rs)) : Optional.empty();
        } catch (SQLException e) {
            log.error("findLeastLoaded() failed: {}", e.getMessage());
            throw new BackendException("Failed to select an available node", e);
        }
    }

    /**
     * Returns a node row.
     *
     * @param node Node name.
     * @return Node snapshot or empty.
     * @throws BackendException Database error.
     */
    public Optional<AvailableNode> findByNode(String node) throws BackendException {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(SELECT_BY_NODE)) {
            ps.setString(1, node);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? Optional.of(map(rs)) : Optional.empty();
            }
        } catch (SQLException e) {
            log.error("findByNode({}) failed: {}", node, e.getMessage());
            throw new BackendException("Failed to find node " + node, e);
        }
    }

    /**
     * Writes the counters derived from the selection snapshot.
     * <p>Failures are logged and swallowed, the user already points to the node.
     */
    private void reserve(AvailableNode node) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(UPDATE_COUNTERS)) {
            ps.setInt(1, node.getAvailableAssignments() - 1);
            ps.setInt(2, node.getActives() + 1);
            ps.setString(3, node.getNode());
            ps.executeUpdate();
        } catch (SQLException | RuntimeException e) {
            metrics.bookkeepingFailed();
            log.warn("Node {} assigned but capacity update failed: {}", node.getNode(), e.getMessage());
        }
    }

    private AvailableNode map(ResultSet rs) throws SQLException {
        return new AvailableNode(
                rs.getString("node"),
                rs.getInt("available_assignments"),
                rs.getInt("actives"),
                rs.getInt("downed") != 0
        );
    }
}
