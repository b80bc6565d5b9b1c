package com.mimecast.directoryauth.resetcode;

import com.mimecast.directoryauth.exception.BackendException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.sql.Timestamp;
import java.time.Clock;
import java.time.Instant;
import java.util.Optional;

/**
 * JDBC store for {@code reset_codes}, one row per user.
 *
 * <p>A new code replaces the previous row with a delete followed by an insert,
 * so there is a short window where the user has no row at all.
 */
public class ResetCodeStore {

    private static final Logger log = LogManager.getLogger(ResetCodeStore.class);

    private static final String CREATE_TABLE =
            "CREATE TABLE IF NOT EXISTS reset_codes (" +
            " username   VARCHAR(32) NOT NULL PRIMARY KEY," +
            " reset      VARCHAR(32)," +
            " expiration TIMESTAMP" +
            ")";

    private static final String SELECT_CODE =
            "SELECT reset, expiration FROM reset_codes WHERE username = ?";

    private static final String DELETE_CODE =
            "DELETE FROM reset_codes WHERE username = ?";

    private static final String INSERT_CODE =
            "INSERT INTO reset_codes (username, reset, expiration) VALUES (?, ?, ?)";

    private final DataSource dataSource;
    private final Clock clock;

    /**
     * Constructs a new ResetCodeStore.
     *
     * @param dataSource Data source.
     * @param clock      Clock used for expiry.
     */
    public ResetCodeStore(DataSource dataSource, Clock clock) {
        this.dataSource = dataSource;
        this.clock = clock;
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
            log.error("Failed to create reset_codes table: {}", e.getMessage());
            throw new BackendException("Failed to create reset_codes table", e);
        }
    }

    /**
     * Returns the current code, or a new one.
     *
     * @param userId    User id.
     * @param overwrite True to always mint a new code.
     * @return Reset code.
     * @throws BackendException Database error.
     */
    public String generate(long userId, boolean overwrite) throws BackendException {
        if (!overwrite) {
            Optional<String> stored = find(userId);
            if (stored.isPresent()) {
                return stored.get();
            }
        }
        return store(userId);
    }

    /**
     * Verifies a code.
     * <p>Malformed codes are rejected without a database lookup.
     *
     * @param userId User id.
     * @param code   Candidate code.
     * @return True if the code matches the unexpired stored one.
     * @throws BackendException Database error.
     */
    public boolean verify(long userId, String code) throws BackendException {
        if (!ResetCodes.isWellFormed(code)) {
            return false;
        }
        return find(userId).map(code::equals).orElse(false);
    }

    /**
     * Deletes the code of a user.
     *
     * @param userId User id.
     * @return True if a row was deleted.
     * @throws BackendException Database error.
     */
    public boolean clear(long userId) throws BackendException {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(DELETE_CODE)) {
            ps.setString(1, String.valueOf(userId));
            return ps.executeUpdate() > 0;
        } catch (SQLException e) {
            log.error("clear({}) failed: {}", userId, e.getMessage());
            throw new BackendException("Failed to clear reset code", e);
        }
    }

    /**
     * Reads the unexpired code, deleting it if it has expired.
     */
    private Optional<String> find(long userId) throws BackendException {
        String reset;
        Timestamp expiration;
        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(SELECT_CODE)) {
            ps.setString(1, String.valueOf(userId));
            try (ResultSet rs = ps.executeQuery()) {
                if (!rs.next()) {
                    return Optional.empty();
                }
                reset = rs.getString("reset");
                expiration = rs.getTimestamp("expiration");
            }
        } catch (SQLException e) {
            log.error("find({}) failed: {}", userId, e.getMessage());
            throw new BackendException("Failed to read reset code", e);
        }

        if (reset == null || expiration == null) {
            return Optional.empty();
        }
        if (expiration.toInstant().isBefore(clock.instant())) {
            log.debug("Reset code for {} expired at {}", userId, expiration);
            clear(userId);
            return Optional.empty();
        }
        return Optional.of(reset);
    }

    /**
     * Replaces the row of a user with a fresh code.
     */
    private String store(long userId) throws BackendException {
        String code = ResetCodes.generate();
        Instant expiration = clock.instant().plus(ResetCodes.VALIDITY);

        try (Connection conn = dataSource.getConnection()) {
            try (PreparedStatement ps = conn.prepareStatement(DELETE_CODE)) {
                ps.setString(1, String.valueOf(userId));
                ps.executeUpdate();
            }
            try (PreparedStatement ps = conn.prepareStatement(INSERT_CODE)) {
                ps.setString(1, String.valueOf(userId));
                ps.setString(2, code);
                ps.setTimestamp(3, Timestamp.from(expiration));
                if (ps.executeUpdate() != 1) {
                    log.error("Unable to add a new reset code for {}", userId);
                    throw new BackendException("Unable to add a new reset code for " + userId);
                }
            }
        } catch (SQLException e) {
            log.error("store({}) failed: {}", userId, e.getMessage());
            throw new BackendException("Failed to store reset code", e);
        }
        return code;
    }
}
