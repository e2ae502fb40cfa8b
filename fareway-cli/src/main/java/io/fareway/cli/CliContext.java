package io.fareway.cli;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.fareway.core.config.GatewayConfig;
import io.fareway.core.store.RecordStore;
import io.fareway.core.tool.ToolDispatcher;

public record CliContext(
    GatewayConfig config,
    ToolDispatcher dispatcher,
    RecordStore store,
    ObjectMapper mapper,
    GatewayRunner gatewayRunner
) {
    public CliContext(GatewayConfig config, ToolDispatcher dispatcher, RecordStore store, ObjectMapper mapper) {
        this(config, dispatcher, store, mapper, port -> {
            throw new UnsupportedOperationException("gateway runner is not configured");
        });
    }
}
