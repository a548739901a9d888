package com.mco.core.state;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.mco.core.model.Orchestration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * JDBC-backed state store: one row per orchestration holding the JSON-serialized record,
 * keyed by {@code orchestration_id}.
 * <p>
 * The table is created automatically via {@link #createTable()}. Writes use a portable
 * UPDATE-then-INSERT so the same SQL runs on PostgreSQL and H2.
 */
public class JdbcStateStore extends AbstractStateStore {

    private static final Logger log = LoggerFactory.getLogger(JdbcStateStore.class);

    private static final Pattern TABLE_NAME = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");

    private final DataSource dataSource;
    private final ObjectMapper objectMapper;
    private final String table;

    private final String createTableSql;
    private final String selectSql;
    private final String updateSql;
    private final String insertSql;
    private final String deleteSql;
    private final String listSql;

    public JdbcStateStore(DataSource dataSource, String table) {
        this(dataSource, table, Clock.systemUTC());
    }

    public JdbcStateStore(DataSource dataSource, String table, Clock clock) {
        super(clock);
        this.dataSource = Objects.requireNonNull(dataSource, "DataSource must not be null");
        if (table == null || !TABLE_NAME.matcher(table).matches()) {
            throw new IllegalArgumentException("Invalid state table name: " + table);
        }
        this.table = table;
        this.objectMapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);

        this.createTableSql = """
                CREATE TABLE IF NOT EXISTS %s (
                    orchestration_id VARCHAR(255) NOT NULL PRIMARY KEY,
                    state            TEXT NOT NULL,
                    updated_at       TIMESTAMP NOT NULL
                )
                """.formatted(table);
        this.selectSql = """
                SELECT state FROM %s WHERE orchestration_id = ?
                """.formatted(table);
        this.updateSql = """
                UPDATE %s SET state = ?, updated_at = ? WHERE orchestration_id = ?
                """.formatted(table);
        this.insertSql = """
                INSERT INTO %s (orchestration_id, state, updated_at) VALUES (?, ?, ?)
                """.formatted(table);
        this.deleteSql = """
                DELETE FROM %s WHERE orchestration_id = ?
                """.formatted(table);
        this.listSql = """
                SELECT orchestration_id FROM %s ORDER BY updated_at ASC
                """.formatted(table);
    }

    /**
     * Creates the state table if it does not already exist.
     * Should be called once during application startup.
     */
    public void createTable() {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(createTableSql)) {
            stmt.execute();
            log.info("State table '{}' ensured", table);
        } catch (SQLException e) {
            throw new StateStoreException("Failed to create state table " + table, e);
        }
    }

    @Override
    protected Optional<Orchestration> read(String id) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(selectSql)) {
            stmt.setString(1, id);
            try (ResultSet rs = stmt.executeQuery()) {
                if (rs.next()) {
                    return Optional.of(objectMapper.readValue(rs.getString("state"), Orchestration.class));
                }
            }
            return Optional.empty();
        } catch (SQLException e) {
            throw new StateStoreException("Failed to read state for " + id, e);
        } catch (JsonProcessingException e) {
            throw new StateStoreException("Corrupt state document for " + id, e);
        }
    }

    @Override
    protected void write(Orchestration orchestration) {
        String json = serialize(orchestration);
        Timestamp updatedAt = orchestration.updatedAt() != null
                ? Timestamp.from(orchestration.updatedAt())
                : new Timestamp(System.currentTimeMillis());

        try (Connection conn = dataSource.getConnection()) {
            int updated;
            try (PreparedStatement stmt = conn.prepareStatement(updateSql)) {
                stmt.setString(1, json);
                stmt.setTimestamp(2, updatedAt);
                stmt.setString(3, orchestration.id());
                updated = stmt.executeUpdate();
            }
            if (updated == 0) {
                try (PreparedStatement stmt = conn.prepareStatement(insertSql)) {
                    stmt.setString(1, orchestration.id());
                    stmt.setString(2, json);
                    stmt.setTimestamp(3, updatedAt);
                    stmt.executeUpdate();
                }
            }
            log.debug("Saved state for orchestration {}", orchestration.id());
        } catch (SQLException e) {
            throw new StateStoreException("Failed to write state for " + orchestration.id(), e);
        }
    }

    @Override
    protected boolean remove(String id) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(deleteSql)) {
            stmt.setString(1, id);
            return stmt.executeUpdate() > 0;
        } catch (SQLException e) {
            throw new StateStoreException("Failed to delete state for " + id, e);
        }
    }

    @Override
    protected List<String> ids() {
        List<String> ids = new ArrayList<>();
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(listSql);
             ResultSet rs = stmt.executeQuery()) {
            while (rs.next()) {
                ids.add(rs.getString(1));
            }
        } catch (SQLException e) {
            throw new StateStoreException("Failed to list orchestrations", e);
        }
        return ids;
    }

    private String serialize(Orchestration orchestration) {
        try {
            return objectMapper.writeValueAsString(orchestration);
        } catch (JsonProcessingException e) {
            throw new StateStoreException("Failed to serialize state for " + orchestration.id(), e);
        }
    }
}
