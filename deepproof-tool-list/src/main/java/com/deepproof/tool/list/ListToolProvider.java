package com.deepproof.tool.list;

import com.deepproof.tools.ToolProvider;
import com.deepproof.tools.ToolSchema;

import java.util.List;

/**
 * Provider for {@value ListTool#TOOL_NAME}. The catalog is passed in by whoever assembles the
 * registry (usually the schemas of the other registered tools).
 */
public final class ListToolProvider implements ToolProvider {

    private final ListTool tool;

    public ListToolProvider(List<ToolSchema> catalog) {
        this.tool = new ListTool(catalog);
    }

    @Override
    public String getToolName() {
        return ListTool.TOOL_NAME;
    }

    @Override
    public ListTool getTool() {
        return tool;
    }

    @Override
    public String getDescription() {
        return "Lists the available tools with their names, descriptions and parameters.";
    }
}
