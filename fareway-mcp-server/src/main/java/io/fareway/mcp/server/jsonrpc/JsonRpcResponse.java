package io.fareway.mcp.server.jsonrpc;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.NullNode;

/**
 * Reply frame. Exactly one of {@code result} and {@code error} is set; {@code id} is JSON
 * {@code null} when the request id could not be read.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record JsonRpcResponse(String jsonrpc, JsonNode id, Object result, JsonRpcError error) {
    public static final String VERSION = "2.0";

    public static JsonRpcResponse success(JsonNode id, Object result) {
        return new JsonRpcResponse(VERSION, orNull(id), result, null);
    }

    public static JsonRpcResponse failure(JsonNode id, JsonRpcError error) {
        return new JsonRpcResponse(VERSION, orNull(id), null, error);
    }

    private static JsonNode orNull(JsonNode id) {
        return id == null ? NullNode.getInstance() : id;
    }
}
