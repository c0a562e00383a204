package io.switchboard.cli;

import io.switchboard.core.config.ConfigService;
import java.nio.file.Path;

public record CliContext(
    ConfigService configService,
    Path configPath,
    ServeRunner serveRunner,
    OwnerStoreFactory ownerStores
) {
    public CliContext(ConfigService configService, Path configPath) {
        this(configService, configPath, portOverride -> {
            throw new UnsupportedOperationException("serve runner is not configured");
        }, OwnerStoreFactory.sqlite());
    }
}
