package io.switchboard.cli;

import io.switchboard.core.model.Owner;
import io.switchboard.core.owner.OwnerStore;
import java.util.List;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

@Command(name = "owner", mixinStandardHelpOptions = true, description = "Manage owners and their API tokens")
public final class OwnerCommand implements Runnable {

    @Override
    public void run() {
        // Only subcommands do work.
    }

    @Command(name = "add", description = "Register an owner and print its API token")
    public static final class Add implements Callable<Integer> {
        private final CliContext context;

        @Parameters(index = "0", description = "Owner email address")
        String email;

        public Add(CliContext context) {
            this.context = context;
        }

        @Override
        public Integer call() {
            try {
                OwnerStore owners = context.ownerStores().open(context.configService().load(context.configPath()));
                Owner owner = owners.register(email);
                System.out.println("Owner: " + owner.id());
                System.out.println("Email: " + owner.email());
                System.out.println("API token: " + owner.apiToken());
                return 0;
            } catch (Exception e) {
                System.err.println("Owner add failed: " + e.getMessage());
                return 1;
            }
        }
    }

    @Command(name = "list", description = "List registered owners")
    public static final class ListOwners implements Callable<Integer> {
        private final CliContext context;

        public ListOwners(CliContext context) {
            this.context = context;
        }

        @Override
        public Integer call() {
            try {
                OwnerStore owners = context.ownerStores().open(context.configService().load(context.configPath()));
                List<Owner> all = owners.list();
                if (all.isEmpty()) {
                    System.out.println("No owners registered.");
                    return 0;
                }
                for (Owner owner : all) {
                    System.out.println(owner.id() + "  " + owner.email() + "  " + owner.createdAt());
                }
                return 0;
            } catch (Exception e) {
                System.err.println("Owner list failed: " + e.getMessage());
                return 1;
            }
        }
    }
}
