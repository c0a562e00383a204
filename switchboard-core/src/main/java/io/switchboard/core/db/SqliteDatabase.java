package io.switchboard.core.db;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.List;

/**
 * Shared SQLite file backing the owner, conversation, transcript and memory
 * stores. Every store opens a short-lived connection per operation, so each
 * write is one atomic statement.
 */
public final class SqliteDatabase {
    private static final List<String> SCHEMA = List.of(
        """
        CREATE TABLE IF NOT EXISTS owners (
            id TEXT PRIMARY KEY,
            email TEXT NOT NULL UNIQUE,
            api_token TEXT NOT NULL UNIQUE,
            created_at INTEGER NOT NULL
        )
        """,
        """
        CREATE TABLE IF NOT EXISTS conversations (
            id TEXT PRIMARY KEY,
            owner_id TEXT NOT NULL REFERENCES owners(id) ON DELETE CASCADE,
            title TEXT,
            status TEXT NOT NULL DEFAULT 'OPEN',
            external_session_id TEXT,
            external_active INTEGER NOT NULL DEFAULT 1,
            created_at INTEGER NOT NULL,
            updated_at INTEGER NOT NULL
        )
        """,
        """
        CREATE INDEX IF NOT EXISTS idx_conversations_owner
        ON conversations(owner_id, created_at DESC)
        """,
        """
        CREATE TABLE IF NOT EXISTS messages (
            seq INTEGER PRIMARY KEY AUTOINCREMENT,
            id TEXT NOT NULL UNIQUE,
            conversation_id TEXT NOT NULL REFERENCES conversations(id) ON DELETE CASCADE,
            content TEXT NOT NULL,
            origin TEXT NOT NULL,
            markdown INTEGER NOT NULL DEFAULT 0,
            sent_externally INTEGER NOT NULL DEFAULT 0,
            external_message_id TEXT,
            created_at INTEGER NOT NULL
        )
        """,
        """
        CREATE INDEX IF NOT EXISTS idx_messages_conversation_created
        ON messages(conversation_id, created_at, seq)
        """,
        """
        CREATE UNIQUE INDEX IF NOT EXISTS idx_messages_external_event
        ON messages(conversation_id, external_message_id)
        WHERE origin = 'EXTERNAL_SYSTEM' AND external_message_id IS NOT NULL
        """,
        """
        CREATE TABLE IF NOT EXISTS memories (
            id TEXT PRIMARY KEY,
            conversation_id TEXT NOT NULL REFERENCES conversations(id) ON DELETE CASCADE,
            content TEXT NOT NULL,
            created_at INTEGER NOT NULL,
            updated_at INTEGER NOT NULL
        )
        """,
        """
        CREATE INDEX IF NOT EXISTS idx_memories_conversation
        ON memories(conversation_id, created_at)
        """
    );

    private final String jdbcUrl;

    public SqliteDatabase(Path dbPath) throws IOException {
        if (dbPath == null) {
            throw new IllegalArgumentException("dbPath must not be null");
        }
        Path absolute = dbPath.toAbsolutePath();
        Files.createDirectories(absolute.getParent());
        this.jdbcUrl = "jdbc:sqlite:" + absolute;
        init();
    }

    public Connection openConnection() throws SQLException {
        Connection connection = DriverManager.getConnection(jdbcUrl);
        try (Statement statement = connection.createStatement()) {
            statement.execute("PRAGMA journal_mode=WAL;");
            statement.execute("PRAGMA synchronous=NORMAL;");
            statement.execute("PRAGMA foreign_keys=ON;");
            statement.execute("PRAGMA busy_timeout=5000;");
        }
        return connection;
    }

    private void init() throws IOException {
        try (Connection connection = openConnection();
             Statement statement = connection.createStatement()) {
            for (String ddl : SCHEMA) {
                statement.execute(ddl);
            }
        } catch (SQLException e) {
            throw new IOException("Failed to initialize SQLite database at " + jdbcUrl, e);
        }
    }
}
