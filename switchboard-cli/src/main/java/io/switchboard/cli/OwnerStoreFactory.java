package io.switchboard.cli;

import io.switchboard.core.config.ConfigPaths;
import io.switchboard.core.config.model.SwitchboardConfig;
import io.switchboard.core.db.SqliteDatabase;
import io.switchboard.core.owner.OwnerStore;
import io.switchboard.core.owner.SqliteOwnerStore;
import java.io.IOException;
import java.time.Clock;

@FunctionalInterface
public interface OwnerStoreFactory {
    OwnerStore open(SwitchboardConfig config) throws IOException;

    static OwnerStoreFactory sqlite() {
        return config -> new SqliteOwnerStore(
            new SqliteDatabase(ConfigPaths.resolve(config.storage().databasePath())),
            Clock.systemUTC()
        );
    }
}
