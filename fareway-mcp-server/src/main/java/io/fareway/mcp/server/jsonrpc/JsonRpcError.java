package io.fareway.mcp.server.jsonrpc;

import com.fasterxml.jackson.annotation.JsonInclude;
import java.util.Map;

/**
 * JSON-RPC 2.0 error object, plus the gateway's rate-limit code.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record JsonRpcError(int code, String message, Object data) {
    public static final int PARSE_ERROR = -32700;
    public static final int INVALID_REQUEST = -32600;
    public static final int METHOD_NOT_FOUND = -32601;
    public static final int INVALID_PARAMS = -32602;
    public static final int INTERNAL_ERROR = -32603;
    public static final int RATE_LIMITED = -32029;

    public static JsonRpcError parseError(String details) {
        return new JsonRpcError(PARSE_ERROR, "Parse error", details);
    }

    public static JsonRpcError invalidRequest(String details) {
        return new JsonRpcError(INVALID_REQUEST, "Invalid Request", details);
    }

    public static JsonRpcError methodNotFound(String method) {
        return new JsonRpcError(METHOD_NOT_FOUND, "Method not found: " + method, null);
    }

    public static JsonRpcError invalidParams(String details) {
        return new JsonRpcError(INVALID_PARAMS, "Invalid params", details);
    }

    public static JsonRpcError internalError(String details) {
        return new JsonRpcError(INTERNAL_ERROR, "Internal error", details);
    }

    public static JsonRpcError rateLimited(long retryAfterSeconds) {
        return new JsonRpcError(
            RATE_LIMITED,
            "Too many requests, please try again later.",
            Map.of("retry_after_seconds", retryAfterSeconds)
        );
    }
}
