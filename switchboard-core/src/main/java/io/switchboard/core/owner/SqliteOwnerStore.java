package io.switchboard.core.owner;

import io.switchboard.core.db.Sql;
import io.switchboard.core.db.SqliteDatabase;
import io.switchboard.core.model.Owner;
import java.io.IOException;
import java.security.SecureRandom;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Clock;
import java.util.ArrayList;
import java.util.HexFormat;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.UUID;

public final class SqliteOwnerStore implements OwnerStore {
    private static final SecureRandom RANDOM = new SecureRandom();

    private final SqliteDatabase database;
    private final Clock clock;

    public SqliteOwnerStore(SqliteDatabase database, Clock clock) {
        this.database = database;
        this.clock = clock;
    }

    /**
     * Registers an owner, or returns the existing one for the same address.
     */
    @Override
    public Owner register(String email) throws IOException {
        String normalized = normalizeEmail(email);
        if (normalized.isBlank() || normalized.indexOf('@') <= 0) {
            throw new IllegalArgumentException("email must be a valid address");
        }
        Optional<Owner> existing = findByEmail(normalized);
        if (existing.isPresent()) {
            return existing.get();
        }

        Owner owner = new Owner(UUID.randomUUID().toString(), normalized, newToken(), clock.instant());
        String sql = "INSERT INTO owners (id, email, api_token, created_at) VALUES (?, ?, ?, ?)";
        try (Connection connection = database.openConnection();
             PreparedStatement statement = connection.prepareStatement(sql)) {
            statement.setString(1, owner.id());
            statement.setString(2, owner.email());
            statement.setString(3, owner.apiToken());
            statement.setLong(4, Sql.toMicros(owner.createdAt()));
            statement.executeUpdate();
            return owner;
        } catch (SQLException e) {
            throw new IOException("Failed to register owner " + normalized, e);
        }
    }

    @Override
    public Optional<Owner> findById(String id) throws IOException {
        return findOne("SELECT * FROM owners WHERE id = ?", id);
    }

    @Override
    public Optional<Owner> findByEmail(String email) throws IOException {
        return findOne("SELECT * FROM owners WHERE email = ?", normalizeEmail(email));
    }

    @Override
    public Optional<Owner> findByToken(String apiToken) throws IOException {
        if (apiToken == null || apiToken.isBlank()) {
            return Optional.empty();
        }
        return findOne("SELECT * FROM owners WHERE api_token = ?", apiToken.trim());
    }

    @Override
    public List<Owner> list() throws IOException {
        try (Connection connection = database.openConnection();
             PreparedStatement statement = connection.prepareStatement("SELECT * FROM owners ORDER BY created_at ASC");
             ResultSet resultSet = statement.executeQuery()) {
            List<Owner> owners = new ArrayList<>();
            while (resultSet.next()) {
                owners.add(map(resultSet));
            }
            return owners;
        } catch (SQLException e) {
            throw new IOException("Failed to list owners", e);
        }
    }

    private Optional<Owner> findOne(String sql, String value) throws IOException {
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        try (Connection connection = database.openConnection();
             PreparedStatement statement = connection.prepareStatement(sql)) {
            statement.setString(1, value);
            try (ResultSet resultSet = statement.executeQuery()) {
                return resultSet.next() ? Optional.of(map(resultSet)) : Optional.empty();
            }
        } catch (SQLException e) {
            throw new IOException("Failed to look up owner", e);
        }
    }

    private Owner map(ResultSet resultSet) throws SQLException {
        return new Owner(
            resultSet.getString("id"),
            resultSet.getString("email"),
            resultSet.getString("api_token"),
            Sql.instant(resultSet, "created_at")
        );
    }

    private static String normalizeEmail(String email) {
        return email == null ? "" : email.trim().toLowerCase(Locale.ROOT);
    }

    private static String newToken() {
        byte[] bytes = new byte[24];
        RANDOM.nextBytes(bytes);
        return "sb_" + HexFormat.of().formatHex(bytes);
    }
}
