package com.deepproof.tool.list;

import com.deepproof.tools.Tool;
import com.deepproof.tools.ToolInstanceRegistry;
import com.deepproof.tools.ToolResult;
import com.deepproof.tools.ToolSchema;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;

/**
 * Read-only directory of invocable tools. The catalog is fixed at construction; {@link #execute}
 * ignores its parameters and returns the catalog as a pretty-printed JSON array of
 * {@code {"name", "description", "parameters", "required"}}.
 */
public final class ListTool implements Tool {

    private static final Logger log = LoggerFactory.getLogger(ListTool.class);

    public static final String TOOL_NAME = "tools/list";

    public static final ToolSchema SCHEMA = ToolSchema.builder(TOOL_NAME)
            .description("Shows the list of all available tools, with information about name and parameters.")
            .build();

    private static final ObjectMapper MAPPER = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);

    private final List<ToolSchema> catalog;
    private final ToolInstanceRegistry instances = new ToolInstanceRegistry(TOOL_NAME);

    /**
     * @param catalog schemas of the tools to list; copied, never mutated afterwards
     */
    public ListTool(List<ToolSchema> catalog) {
        this.catalog = catalog != null ? List.copyOf(catalog) : List.of();
    }

    public List<ToolSchema> getCatalog() {
        return catalog;
    }

    @Override
    public ToolSchema getSchema() {
        return SCHEMA;
    }

    @Override
    public String create(String instanceId, String groundTruth, Map<String, Object> extra) {
        return instances.create(instanceId, groundTruth);
    }

    @Override
    public ToolResult execute(String instanceId, Map<String, Object> parameters, Map<String, Object> extra) {
        try {
            return ToolResult.of(MAPPER.writeValueAsString(catalog));
        } catch (JsonProcessingException e) {
            log.warn("Failed to serialize tool catalog: {}", e.getMessage());
            return ToolResult.runtimeError(e);
        }
    }

    @Override
    public void release(String instanceId, Map<String, Object> extra) {
        instances.release(instanceId);
    }

    ToolInstanceRegistry getInstances() {
        return instances;
    }
}
