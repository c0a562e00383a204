package io.switchboard.core.transcript;

import io.switchboard.core.db.Sql;
import io.switchboard.core.db.SqliteDatabase;
import io.switchboard.core.model.MessageOrigin;
import io.switchboard.core.model.TranscriptMessage;
import java.io.IOException;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

public final class SqliteTranscriptStore implements TranscriptStore {
    // created_at never falls behind the newest row of the conversation, so (created_at, seq) follows insert order
    private static final String INSERT = """
        INSERT %s INTO messages (id, conversation_id, content, origin, markdown, sent_externally, external_message_id, created_at)
        SELECT ?, ?, ?, ?, ?, ?, ?, MAX(?, COALESCE((SELECT MAX(created_at) FROM messages WHERE conversation_id = ?), 0))
        """;

    private final SqliteDatabase database;
    private final Clock clock;

    public SqliteTranscriptStore(SqliteDatabase database, Clock clock) {
        this.database = database;
        this.clock = clock;
    }

    @Override
    public TranscriptMessage append(TranscriptMessage draft) throws IOException {
        return insert(draft, false)
            .orElseThrow(() -> new IOException("Message was not persisted for " + draft.conversationId()));
    }

    @Override
    public Optional<TranscriptMessage> appendExternalEvent(TranscriptMessage draft) throws IOException {
        if (draft.origin() != MessageOrigin.EXTERNAL_SYSTEM) {
            throw new IllegalArgumentException("only EXTERNAL_SYSTEM messages are deduplicated");
        }
        if (draft.externalMessageId() == null || draft.externalMessageId().isBlank()) {
            return Optional.of(append(draft));
        }
        return insert(draft, true);
    }

    @Override
    public List<TranscriptMessage> listByConversation(String conversationId) throws IOException {
        String sql = "SELECT * FROM messages WHERE conversation_id = ? ORDER BY created_at ASC, seq ASC";
        return query(sql, conversationId, null);
    }

    @Override
    public List<TranscriptMessage> recent(String conversationId, int limit) throws IOException {
        if (limit <= 0) {
            return List.of();
        }
        String sql = "SELECT * FROM messages WHERE conversation_id = ? ORDER BY created_at DESC, seq DESC LIMIT ?";
        List<TranscriptMessage> newestFirst = new ArrayList<>(query(sql, conversationId, limit));
        Collections.reverse(newestFirst);
        return List.copyOf(newestFirst);
    }

    @Override
    public Map<String, TranscriptMessage> latestPerConversation(String ownerId) throws IOException {
        String sql = """
            SELECT m.* FROM messages m
            JOIN conversations c ON c.id = m.conversation_id
            WHERE c.owner_id = ?
              AND m.seq = (
                SELECT m2.seq FROM messages m2
                WHERE m2.conversation_id = m.conversation_id
                ORDER BY m2.created_at DESC, m2.seq DESC
                LIMIT 1
              )
            ORDER BY m.created_at DESC, m.seq DESC
            """;
        Map<String, TranscriptMessage> latest = new LinkedHashMap<>();
        for (TranscriptMessage message : query(sql, ownerId, null)) {
            latest.put(message.conversationId(), message);
        }
        return latest;
    }

    private Optional<TranscriptMessage> insert(TranscriptMessage draft, boolean ignoreDuplicates) throws IOException {
        String id = UUID.randomUUID().toString();
        Instant createdAt = clock.instant();
        String sql = INSERT.formatted(ignoreDuplicates ? "OR IGNORE" : "");
        try (Connection connection = database.openConnection();
             PreparedStatement statement = connection.prepareStatement(sql, Statement.RETURN_GENERATED_KEYS)) {
            statement.setString(1, id);
            statement.setString(2, draft.conversationId());
            statement.setString(3, draft.content());
            statement.setString(4, draft.origin().name());
            statement.setInt(5, draft.markdown() ? 1 : 0);
            statement.setInt(6, draft.sentExternally() ? 1 : 0);
            Sql.setNullableString(statement, 7, draft.externalMessageId());
            statement.setLong(8, Sql.toMicros(createdAt));
            statement.setString(9, draft.conversationId());
            if (statement.executeUpdate() == 0) {
                return Optional.empty();
            }
            long sequence = 0L;
            try (ResultSet keys = statement.getGeneratedKeys()) {
                if (keys.next()) {
                    sequence = keys.getLong(1);
                }
            }
            Instant stored = storedCreatedAt(connection, sequence, createdAt);
            return Optional.of(new TranscriptMessage(
                id,
                draft.conversationId(),
                draft.content(),
                draft.origin(),
                draft.markdown(),
                draft.sentExternally(),
                draft.externalMessageId(),
                stored,
                sequence
            ));
        } catch (SQLException e) {
            throw new IOException("Failed to append message to conversation " + draft.conversationId(), e);
        }
    }

    private static Instant storedCreatedAt(Connection connection, long sequence, Instant fallback) throws SQLException {
        try (PreparedStatement statement = connection.prepareStatement("SELECT created_at FROM messages WHERE seq = ?")) {
            statement.setLong(1, sequence);
            try (ResultSet resultSet = statement.executeQuery()) {
                return resultSet.next() ? Sql.instant(resultSet, "created_at") : Sql.fromMicros(Sql.toMicros(fallback));
            }
        }
    }

    private List<TranscriptMessage> query(String sql, String key, Integer limit) throws IOException {
        try (Connection connection = database.openConnection();
             PreparedStatement statement = connection.prepareStatement(sql)) {
            statement.setString(1, key);
            if (limit != null) {
                statement.setInt(2, limit);
            }
            try (ResultSet resultSet = statement.executeQuery()) {
                List<TranscriptMessage> messages = new ArrayList<>();
                while (resultSet.next()) {
                    messages.add(map(resultSet));
                }
                return messages;
            }
        } catch (SQLException e) {
            throw new IOException("Failed to read transcript for " + key, e);
        }
    }

    private TranscriptMessage map(ResultSet resultSet) throws SQLException {
        return new TranscriptMessage(
            resultSet.getString("id"),
            resultSet.getString("conversation_id"),
            resultSet.getString("content"),
            MessageOrigin.valueOf(resultSet.getString("origin")),
            resultSet.getInt("markdown") != 0,
            resultSet.getInt("sent_externally") != 0,
            resultSet.getString("external_message_id"),
            Sql.instant(resultSet, "created_at"),
            resultSet.getLong("seq")
        );
    }
}
