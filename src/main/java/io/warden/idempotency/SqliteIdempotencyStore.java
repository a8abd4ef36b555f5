package io.warden.idempotency;

import com.fasterxml.jackson.databind.JsonNode;
import io.warden.model.IdempotencyRecord;
import io.warden.storage.Database;
import io.warden.util.Jsons;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.Optional;

/**
 * Durable store backed by the {@code idempotency_records} table. Survives process restarts, so
 * keyed tasks are deduplicated across separate runs of the same data root.
 */
public final class SqliteIdempotencyStore implements IdempotencyStore {
    private final Database database;

    public SqliteIdempotencyStore(Database database) {
        this.database = database;
    }

    @Override
    public boolean contains(String key) {
        if (key == null) {
            return false;
        }
        String sql = "SELECT 1 FROM idempotency_records WHERE idempotency_key=?";
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, key);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next();
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed to query idempotency key: " + key, e);
        }
    }

    @Override
    public Optional<IdempotencyRecord> get(String key) {
        if (key == null) {
            return Optional.empty();
        }
        String sql = "SELECT idempotency_key,task_id,task_name,output_json,completed_at_ms FROM idempotency_records WHERE idempotency_key=?";
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, key);
            try (ResultSet rs = ps.executeQuery()) {
                if (!rs.next()) {
                    return Optional.empty();
                }
                JsonNode output = Jsons.readTree(rs.getString("output_json"));
                return Optional.of(new IdempotencyRecord(
                        rs.getString("idempotency_key"),
                        rs.getString("task_id"),
                        rs.getString("task_name"),
                        Jsons.toMap(output),
                        Instant.ofEpochMilli(rs.getLong("completed_at_ms"))
                ));
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed to load idempotency key: " + key, e);
        }
    }

    @Override
    public boolean put(String key, IdempotencyRecord record) {
        if (key == null || key.isBlank()) {
            throw new IllegalArgumentException("idempotency key cannot be empty");
        }
        String sql = """
                INSERT OR IGNORE INTO idempotency_records(idempotency_key,task_id,task_name,output_json,completed_at_ms)
                VALUES(?,?,?,?,?)
                """;
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, key);
            ps.setString(2, record.taskId());
            ps.setString(3, record.taskName());
            ps.setString(4, Jsons.toCompactJson(record.output()));
            ps.setLong(5, record.completedAt() == null ? Instant.now().toEpochMilli() : record.completedAt().toEpochMilli());
            return ps.executeUpdate() == 1;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to store idempotency key: " + key, e);
        }
    }
}
