package io.switchboard.cli;

import static org.assertj.core.api.Assertions.assertThat;

import io.switchboard.core.config.ConfigService;
import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class SwitchboardCliCommandTest {

    @TempDir
    Path tempDir;

    private final PrintStream originalOut = System.out;
    private final ByteArrayOutputStream captured = new ByteArrayOutputStream();
    private Path configPath;

    @BeforeEach
    void setUp() throws Exception {
        configPath = tempDir.resolve("config.json");
        Files.writeString(configPath, """
            {
              "server": {"port": 9191},
              "storage": {"databasePath": "%s"}
            }
            """.formatted(tempDir.resolve("switchboard.db").toString().replace("\\", "\\\\")), StandardCharsets.UTF_8);
        System.setOut(new PrintStream(captured, true, StandardCharsets.UTF_8));
    }

    @AfterEach
    void tearDown() {
        System.setOut(originalOut);
    }

    @Test
    void shouldRegisterAndListOwners() {
        CliContext context = new CliContext(new ConfigService(Map.of()), configPath);

        int empty = SwitchboardCliCommand.commandLine(context).execute("owner", "list");
        assertThat(empty).isZero();
        assertThat(output()).contains("No owners registered.");

        int added = SwitchboardCliCommand.commandLine(context).execute("owner", "add", "Alice@Example.com");
        assertThat(added).isZero();
        assertThat(output()).contains("Email: alice@example.com").contains("API token: ");

        captured.reset();
        int listed = SwitchboardCliCommand.commandLine(context).execute("owner", "list");
        assertThat(listed).isZero();
        assertThat(output()).contains("alice@example.com").doesNotContain("No owners registered.");
    }

    @Test
    void shouldPrintStatusFromConfig() {
        CliContext context = new CliContext(new ConfigService(Map.of("SWITCHBOARD_WEBHOOK_TOKEN", "hook")), configPath);

        int exitCode = SwitchboardCliCommand.commandLine(context).execute("status");

        assertThat(exitCode).isZero();
        assertThat(output())
            .contains("Config exists: true")
            .contains("Listen: 0.0.0.0:9191")
            .contains("Provider chain: openai, openrouter")
            .contains("Genesys configured: false")
            .contains("Webhook token set: true");
    }

    @Test
    void shouldPassPortOverrideToServeRunner() {
        List<Integer> ports = new ArrayList<>();
        CliContext context = new CliContext(
            new ConfigService(Map.of()),
            configPath,
            port -> {
                ports.add(port);
                return 0;
            },
            OwnerStoreFactory.sqlite()
        );

        int exitCode = SwitchboardCliCommand.commandLine(context).execute("serve", "--port", "7000");

        assertThat(exitCode).isZero();
        assertThat(ports).containsExactly(7000);
    }

    @Test
    void shouldFailServeWithoutRunner() {
        CliContext context = new CliContext(new ConfigService(Map.of()), configPath);

        assertThat(SwitchboardCliCommand.commandLine(context).execute("serve")).isEqualTo(1);
    }

    private String output() {
        return captured.toString(StandardCharsets.UTF_8);
    }
}
