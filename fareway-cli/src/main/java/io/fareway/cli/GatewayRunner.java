package io.fareway.cli;

@FunctionalInterface
public interface GatewayRunner {
    /**
     * Runs the gateway until shutdown and returns the process exit code.
     *
     * @param portOverride listener port, or {@code null} for the configured one
     */
    int run(Integer portOverride) throws Exception;
}
