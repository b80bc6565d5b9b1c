package com.mimecast.directoryauth.auth;

import com.mimecast.directoryauth.exception.BackendException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;

/**
 * Allocates numeric user ids from the {@code user_ids} identity column.
 */
public class UserIdAllocator {

    private static final Logger log = LogManager.getLogger(UserIdAllocator.class);

    private static final String CREATE_TABLE =
            "CREATE TABLE IF NOT EXISTS user_ids (id BIGINT GENERATED BY DEFAULT AS IDENTITY PRIMARY KEY)";

    private static final String INSERT_ID =
            "INSERT INTO user_ids DEFAULT VALUES";

    private final DataSource dataSource;

    /**
     * Constructs a new UserIdAllocator.
     *
     * @param dataSource Data source.
     */
    public UserIdAllocator(DataSource dataSource) {
        this.dataSource = dataSource;
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
            log.error("Failed to create user_ids table: {}", e.getMessage());
            throw new BackendException("Failed to create user_ids table", e);
        }
    }

    /**
     * Allocates the next id.
     *
     * @return User id.
     * @throws BackendException Database error.
     */
    public long next() throws BackendException {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(INSERT_ID, Statement.RETURN_GENERATED_KEYS)) {
            ps.executeUpdate();
            try (ResultSet generated = ps.getGeneratedKeys()) {
                if (generated.next()) {
                    return generated.getLong(1);
                }
            }
        } catch (SQLException e) {
            log.error("next() failed: {}", e.getMessage());
            throw new BackendException("Failed to allocate user id", e);
        }
        throw new BackendException("No user id generated");
    }
}
