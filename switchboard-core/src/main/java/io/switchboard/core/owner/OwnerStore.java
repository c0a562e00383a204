package io.switchboard.core.owner;

import io.switchboard.core.model.Owner;
import java.io.IOException;
import java.util.List;
import java.util.Optional;

public interface OwnerStore {
    Owner register(String email) throws IOException;

    Optional<Owner> findById(String id) throws IOException;

    Optional<Owner> findByEmail(String email) throws IOException;

    Optional<Owner> findByToken(String apiToken) throws IOException;

    List<Owner> list() throws IOException;
}
