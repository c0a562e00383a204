package io.switchboard.core.conversation;

import io.switchboard.core.db.Sql;
import io.switchboard.core.db.SqliteDatabase;
import io.switchboard.core.model.Conversation;
import io.switchboard.core.model.ConversationStatus;
import java.io.IOException;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

public final class SqliteConversationStore implements ConversationStore {
    private final SqliteDatabase database;
    private final Clock clock;

    public SqliteConversationStore(SqliteDatabase database, Clock clock) {
        this.database = database;
        this.clock = clock;
    }

    @Override
    public Conversation create(String ownerId, String title) throws IOException {
        if (ownerId == null || ownerId.isBlank()) {
            throw new IllegalArgumentException("ownerId must not be blank");
        }
        Instant now = clock.instant();
        Conversation conversation = new Conversation(
            UUID.randomUUID().toString(),
            ownerId,
            title == null || title.isBlank() ? null : title.trim(),
            ConversationStatus.OPEN,
            null,
            true,
            now,
            now
        );
        String sql = """
            INSERT INTO conversations (id, owner_id, title, status, external_session_id, external_active, created_at, updated_at)
            VALUES (?, ?, ?, ?, NULL, 1, ?, ?)
            """;
        try (Connection connection = database.openConnection();
             PreparedStatement statement = connection.prepareStatement(sql)) {
            statement.setString(1, conversation.id());
            statement.setString(2, conversation.ownerId());
            Sql.setNullableString(statement, 3, conversation.title());
            statement.setString(4, conversation.status().name());
            statement.setLong(5, Sql.toMicros(now));
            statement.setLong(6, Sql.toMicros(now));
            statement.executeUpdate();
            return conversation;
        } catch (SQLException e) {
            throw new IOException("Failed to create conversation for owner " + ownerId, e);
        }
    }

    @Override
    public Optional<Conversation> find(String conversationId) throws IOException {
        if (conversationId == null || conversationId.isBlank()) {
            return Optional.empty();
        }
        try (Connection connection = database.openConnection();
             PreparedStatement statement = connection.prepareStatement("SELECT * FROM conversations WHERE id = ?")) {
            statement.setString(1, conversationId);
            try (ResultSet resultSet = statement.executeQuery()) {
                return resultSet.next() ? Optional.of(map(resultSet)) : Optional.empty();
            }
        } catch (SQLException e) {
            throw new IOException("Failed to load conversation " + conversationId, e);
        }
    }

    @Override
    public List<Conversation> listByOwner(String ownerId) throws IOException {
        String sql = "SELECT * FROM conversations WHERE owner_id = ? ORDER BY created_at DESC, id ASC";
        try (Connection connection = database.openConnection();
             PreparedStatement statement = connection.prepareStatement(sql)) {
            statement.setString(1, ownerId);
            try (ResultSet resultSet = statement.executeQuery()) {
                List<Conversation> conversations = new ArrayList<>();
                while (resultSet.next()) {
                    conversations.add(map(resultSet));
                }
                return conversations;
            }
        } catch (SQLException e) {
            throw new IOException("Failed to list conversations for owner " + ownerId, e);
        }
    }

    @Override
    public boolean close(String conversationId) throws IOException {
        String sql = "UPDATE conversations SET status = 'CLOSED', updated_at = ? WHERE id = ? AND status <> 'CLOSED'";
        return update(sql, conversationId, null, "close conversation");
    }

    @Override
    public boolean assignExternalSession(String conversationId, String externalSessionId) throws IOException {
        String sql = """
            UPDATE conversations SET external_session_id = ?, updated_at = ?
            WHERE id = ? AND external_session_id IS NULL
            """;
        return update(sql, conversationId, externalSessionId, "assign external session");
    }

    @Override
    public boolean setExternalActive(String conversationId, boolean active) throws IOException {
        String sql = "UPDATE conversations SET external_active = ?, updated_at = ? WHERE id = ?";
        try (Connection connection = database.openConnection();
             PreparedStatement statement = connection.prepareStatement(sql)) {
            statement.setInt(1, active ? 1 : 0);
            statement.setLong(2, Sql.toMicros(clock.instant()));
            statement.setString(3, conversationId);
            return statement.executeUpdate() > 0;
        } catch (SQLException e) {
            throw new IOException("Failed to switch live agent forwarding for " + conversationId, e);
        }
    }

    @Override
    public boolean delete(String conversationId) throws IOException {
        try (Connection connection = database.openConnection();
             PreparedStatement statement = connection.prepareStatement("DELETE FROM conversations WHERE id = ?")) {
            statement.setString(1, conversationId);
            return statement.executeUpdate() > 0;
        } catch (SQLException e) {
            throw new IOException("Failed to delete conversation " + conversationId, e);
        }
    }

    private boolean update(String sql, String conversationId, String value, String action) throws IOException {
        try (Connection connection = database.openConnection();
             PreparedStatement statement = connection.prepareStatement(sql)) {
            int index = 1;
            if (value != null) {
                statement.setString(index++, value);
            }
            statement.setLong(index++, Sql.toMicros(clock.instant()));
            statement.setString(index, conversationId);
            return statement.executeUpdate() > 0;
        } catch (SQLException e) {
            throw new IOException("Failed to " + action + " for " + conversationId, e);
        }
    }

    private Conversation map(ResultSet resultSet) throws SQLException {
        return new Conversation(
            resultSet.getString("id"),
            resultSet.getString("owner_id"),
            resultSet.getString("title"),
            ConversationStatus.valueOf(resultSet.getString("status")),
            resultSet.getString("external_session_id"),
            resultSet.getInt("external_active") != 0,
            Sql.instant(resultSet, "created_at"),
            Sql.instant(resultSet, "updated_at")
        );
    }
}
