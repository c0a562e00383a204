package io.switchboard.cli;

@FunctionalInterface
public interface ServeRunner {
    /**
     * Runs the gateway until shutdown. {@code portOverride} is null when the
     * configured port applies.
     */
    int run(Integer portOverride) throws Exception;
}
