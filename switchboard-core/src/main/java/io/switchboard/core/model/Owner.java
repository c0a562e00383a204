package io.switchboard.core.model;

import java.time.Instant;
import java.util.Objects;

public record Owner(String id, String email, String apiToken, Instant createdAt) {

    public Owner {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(email, "email must not be null");
    }
}
