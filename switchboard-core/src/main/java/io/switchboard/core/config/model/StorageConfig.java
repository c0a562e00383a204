package io.switchboard.core.config.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record StorageConfig(@JsonAlias({"database_path"}) String databasePath) {

    public static StorageConfig defaults() {
        return new StorageConfig("~/.switchboard/switchboard.db");
    }
}
