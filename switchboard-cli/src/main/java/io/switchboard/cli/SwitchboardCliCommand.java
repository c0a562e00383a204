package io.switchboard.cli;

import picocli.CommandLine;
import picocli.CommandLine.Command;

@Command(name = "switchboard", mixinStandardHelpOptions = true, description = "Customer-support relay between an AI assistant and live agents")
public final class SwitchboardCliCommand implements Runnable {

    @Override
    public void run() {
        // Root command only shows help when no subcommand is provided.
    }

    public static CommandLine commandLine(CliContext context) {
        CommandLine owner = new CommandLine(new OwnerCommand())
            .addSubcommand("add", new OwnerCommand.Add(context))
            .addSubcommand("list", new OwnerCommand.ListOwners(context));
        return new CommandLine(new SwitchboardCliCommand())
            .addSubcommand("serve", new ServeCommand(context))
            .addSubcommand("status", new StatusCommand(context))
            .addSubcommand("owner", owner);
    }
}
