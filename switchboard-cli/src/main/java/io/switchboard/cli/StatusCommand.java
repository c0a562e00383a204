package io.switchboard.cli;

import io.switchboard.core.config.ConfigPaths;
import io.switchboard.core.config.model.SwitchboardConfig;
import java.nio.file.Files;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;

@Command(name = "status", description = "Show configuration status")
public final class StatusCommand implements Callable<Integer> {
    private final CliContext context;

    public StatusCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        try {
            SwitchboardConfig config = context.configService().load(context.configPath());
            System.out.println("Config path: " + context.configPath());
            System.out.println("Config exists: " + Files.exists(context.configPath()));
            System.out.println("Database: " + ConfigPaths.resolve(config.storage().databasePath()));
            System.out.println("Listen: " + config.server().host() + ":" + config.server().port());
            System.out.println("Provider chain: " + String.join(", ", config.llm().providerChain()));
            System.out.println("Model: " + config.llm().model());
            System.out.println("OpenAI configured: " + config.providers().openai().configured());
            System.out.println("OpenRouter configured: " + config.providers().openrouter().configured());
            System.out.println("Genesys configured: " + config.genesys().configured());
            System.out.println("Webhook token set: " + !config.server().webhookToken().isBlank());
            System.out.println("Memory mode: " + config.memory().mode());
            return 0;
        } catch (Exception e) {
            System.err.println("Status command failed: " + e.getMessage());
            return 1;
        }
    }
}
