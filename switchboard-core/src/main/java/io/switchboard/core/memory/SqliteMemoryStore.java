package io.switchboard.core.memory;

import io.switchboard.core.db.Sql;
import io.switchboard.core.db.SqliteDatabase;
import io.switchboard.core.model.MemoryEntry;
import java.io.IOException;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.UUID;

public final class SqliteMemoryStore implements MemoryStore {
    private final SqliteDatabase database;
    private final Clock clock;

    public SqliteMemoryStore(SqliteDatabase database, Clock clock) {
        this.database = database;
        this.clock = clock;
    }

    @Override
    public MemoryEntry remember(String conversationId, String content) throws IOException {
        String normalized = content == null ? "" : content.trim();
        if (normalized.isBlank()) {
            throw new IllegalArgumentException("content must not be blank");
        }

        String dedupeKey = normalized.toLowerCase(Locale.ROOT);
        for (MemoryEntry existing : list(conversationId)) {
            if (existing.content().trim().toLowerCase(Locale.ROOT).equals(dedupeKey)) {
                return existing;
            }
        }

        Instant now = Sql.fromMicros(Sql.toMicros(clock.instant()));
        MemoryEntry entry = new MemoryEntry(UUID.randomUUID().toString(), conversationId, normalized, now, now);
        String sql = """
            INSERT INTO memories (id, conversation_id, content, created_at, updated_at)
            VALUES (?, ?, ?, ?, ?)
            """;
        try (Connection connection = database.openConnection();
             PreparedStatement statement = connection.prepareStatement(sql)) {
            statement.setString(1, entry.id());
            statement.setString(2, conversationId);
            statement.setString(3, normalized);
            statement.setLong(4, Sql.toMicros(now));
            statement.setLong(5, Sql.toMicros(now));
            statement.executeUpdate();
        } catch (SQLException e) {
            throw new IOException("Failed to store memory for conversation " + conversationId, e);
        }
        return entry;
    }

    @Override
    public List<MemoryEntry> list(String conversationId) throws IOException {
        String sql = "SELECT * FROM memories WHERE conversation_id = ? ORDER BY created_at ASC, rowid ASC";
        try (Connection connection = database.openConnection();
             PreparedStatement statement = connection.prepareStatement(sql)) {
            statement.setString(1, conversationId);
            try (ResultSet resultSet = statement.executeQuery()) {
                List<MemoryEntry> entries = new ArrayList<>();
                while (resultSet.next()) {
                    entries.add(map(resultSet));
                }
                return entries;
            }
        } catch (SQLException e) {
            throw new IOException("Failed to list memories for conversation " + conversationId, e);
        }
    }

    @Override
    public Optional<MemoryEntry> find(String id) throws IOException {
        try (Connection connection = database.openConnection();
             PreparedStatement statement = connection.prepareStatement("SELECT * FROM memories WHERE id = ?")) {
            statement.setString(1, id);
            try (ResultSet resultSet = statement.executeQuery()) {
                return resultSet.next() ? Optional.of(map(resultSet)) : Optional.empty();
            }
        } catch (SQLException e) {
            throw new IOException("Failed to read memory " + id, e);
        }
    }

    @Override
    public boolean forget(String id) throws IOException {
        try (Connection connection = database.openConnection();
             PreparedStatement statement = connection.prepareStatement("DELETE FROM memories WHERE id = ?")) {
            statement.setString(1, id);
            return statement.executeUpdate() > 0;
        } catch (SQLException e) {
            throw new IOException("Failed to delete memory " + id, e);
        }
    }

    private MemoryEntry map(ResultSet resultSet) throws SQLException {
        return new MemoryEntry(
            resultSet.getString("id"),
            resultSet.getString("conversation_id"),
            resultSet.getString("content"),
            Sql.instant(resultSet, "created_at"),
            Sql.instant(resultSet, "updated_at")
        );
    }
}
