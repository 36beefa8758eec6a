package com.insider.resolution.mcp;

import java.util.Map;
import java.util.Objects;
import java.util.function.Function;

/**
 * An MCP (Model Context Protocol) tool exposed to LLM agents.
 *
 * <p>Insider tools only read public filing data; none of them mutate resolver state
 * beyond populating the result cache.</p>
 *
 * @param name        the tool name (e.g., "get_all_insider_companies")
 * @param description what the tool does, shown to the agent
 * @param inputSchema JSON Schema of the tool's parameters
 * @param handler     executes the tool on a parameter map and returns a result map
 */
public record McpToolDefinition(
        String name,
        String description,
        Map<String, Object> inputSchema,
        Function<Map<String, Object>, Map<String, Object>> handler
) {
    public McpToolDefinition {
        Objects.requireNonNull(name, "name is required");
        Objects.requireNonNull(description, "description is required");
        Objects.requireNonNull(inputSchema, "inputSchema is required");
        Objects.requireNonNull(handler, "handler is required");
        inputSchema = Map.copyOf(inputSchema);
    }

    /**
     * Runs the handler on the given parameters.
     */
    public Map<String, Object> invoke(Map<String, Object> params) {
        return handler.apply(params != null ? params : Map.of());
    }
}
