package io.fareway.app;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.fareway.cli.CallCommand;
import io.fareway.cli.CliContext;
import io.fareway.cli.FarewayCliCommand;
import io.fareway.cli.ServeCommand;
import io.fareway.cli.StatusCommand;
import io.fareway.cli.ToolsCommand;
import io.fareway.core.cache.NoopResponseCache;
import io.fareway.core.cache.RedisResponseCache;
import io.fareway.core.cache.ResponseCache;
import io.fareway.core.catalog.FarewayCatalog;
import io.fareway.core.config.CacheConfig;
import io.fareway.core.config.GatewayConfig;
import io.fareway.core.config.StoreConfig;
import io.fareway.core.json.JsonMappers;
import io.fareway.core.store.JdbcRecordStore;
import io.fareway.core.store.PostgrestRecordStore;
import io.fareway.core.store.RecordStore;
import io.fareway.core.tool.ToolDispatcher;
import io.fareway.core.tool.ToolRegistry;
import io.fareway.mcp.server.GatewayHttpServer;
import io.fareway.mcp.server.ServerOptions;
import java.time.Clock;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import okhttp3.OkHttpClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;

public final class FarewayApplication {
    private static final Logger LOG = LoggerFactory.getLogger(FarewayApplication.class);
    private static final String PROBE_TABLE = "golf_courses";

    private FarewayApplication() {
    }

    public static void main(String[] args) {
        GatewayConfig config;
        try {
            config = GatewayConfig.fromEnv();
        } catch (IllegalStateException e) {
            LOG.error("{}", e.getMessage());
            System.exit(1);
            return;
        }

        ObjectMapper mapper = JsonMappers.create();
        OkHttpClient httpClient = new OkHttpClient.Builder().callTimeout(config.store().timeout()).build();
        RecordStore store = buildStore(config.store(), httpClient, mapper);
        ResponseCache cache = buildCache(config.cache());

        ToolRegistry registry = new ToolRegistry();
        registry.register(FarewayCatalog.definitions(store, mapper));
        ToolDispatcher dispatcher = new ToolDispatcher(registry, cache, mapper, config.cache().defaultTtlSeconds());

        CountDownLatch released = new CountDownLatch(1);
        CliContext context = new CliContext(
            config,
            dispatcher,
            store,
            mapper,
            portOverride -> runGateway(config, dispatcher, store, mapper, portOverride, released)
        );

        CommandLine commandLine = new CommandLine(new FarewayCliCommand());
        commandLine.addSubcommand("serve", new ServeCommand(context));
        commandLine.addSubcommand("tools", new ToolsCommand(context));
        commandLine.addSubcommand("call", new CallCommand(context));
        commandLine.addSubcommand("status", new StatusCommand(context));

        int exitCode;
        try {
            exitCode = commandLine.execute(args.length == 0 ? new String[] {"serve"} : args);
        } finally {
            cache.close();
            store.close();
            httpClient.dispatcher().executorService().shutdown();
            httpClient.connectionPool().evictAll();
            released.countDown();
        }
        System.exit(exitCode);
    }

    static RecordStore buildStore(StoreConfig config, OkHttpClient httpClient, ObjectMapper mapper) {
        return switch (config.backend()) {
            case POSTGREST -> new PostgrestRecordStore(
                httpClient,
                mapper,
                config.url(),
                config.serviceKey(),
                config.timeout(),
                PROBE_TABLE
            );
            case JDBC -> new JdbcRecordStore(config.url(), config.timeout(), PROBE_TABLE);
        };
    }

    static ResponseCache buildCache(CacheConfig config) {
        if (!config.active()) {
            LOG.info("Response cache disabled");
            return new NoopResponseCache();
        }
        return new RedisResponseCache(config.redisUrl(), config.timeout());
    }

    private static int runGateway(
        GatewayConfig config,
        ToolDispatcher dispatcher,
        RecordStore store,
        ObjectMapper mapper,
        Integer portOverride,
        CountDownLatch released
    ) throws InterruptedException {
        if (!store.ping()) {
            LOG.error("Database connection failed, refusing to start");
            return 1;
        }

        ServerOptions defaults = ServerOptions.from(config);
        ServerOptions options = portOverride == null ? defaults : new ServerOptions(
            defaults.host(),
            portOverride,
            defaults.apiKey(),
            defaults.rateLimit(),
            defaults.requestTimeout(),
            defaults.development(),
            defaults.sessionWorkers()
        );

        CountDownLatch shutdown = new CountDownLatch(1);
        try (GatewayHttpServer server = new GatewayHttpServer(options, dispatcher, store::ping, mapper, Clock.systemUTC())) {
            Runtime.getRuntime().addShutdownHook(new Thread(() -> {
                LOG.info("Shutting down gracefully...");
                shutdown.countDown();
                awaitRelease(released);
            }, "fareway-shutdown"));
            server.start();
            LOG.info("Fareway database MCP server started environment={} port={}", config.environment(), server.port());
            shutdown.await();
        }
        return 0;
    }

    private static void awaitRelease(CountDownLatch released) {
        try {
            if (!released.await(10, TimeUnit.SECONDS)) {
                LOG.warn("Shutdown timed out before resources were released");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
