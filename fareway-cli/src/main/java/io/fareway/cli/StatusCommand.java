package io.fareway.cli;

import io.fareway.core.config.GatewayConfig;
import java.util.Locale;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;

@Command(name = "status", description = "Show configuration and store connectivity")
public final class StatusCommand implements Callable<Integer> {
    private final CliContext context;

    public StatusCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        GatewayConfig config = context.config();
        boolean connected = context.store().ping();
        System.out.println("Environment: " + config.environment().name().toLowerCase(Locale.ROOT));
        System.out.println("Listen address: " + config.host() + ":" + config.port());
        System.out.println("Store backend: " + config.store().backend());
        System.out.println("Store connected: " + connected);
        System.out.println("Cache active: " + config.cache().active());
        System.out.println("Auth enabled: " + config.authEnabled());
        System.out.println("Rate limit: " + config.rateLimit().maxRequests() + " per " + config.rateLimit().window().toMillis() + " ms");
        System.out.println("Tools registered: " + context.dispatcher().registry().size());
        return connected ? 0 : 1;
    }
}
