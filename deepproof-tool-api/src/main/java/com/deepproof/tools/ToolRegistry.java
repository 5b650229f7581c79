package com.deepproof.tools;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Dispatch table from tool name to {@link Tool}. The hosting runtime resolves model-emitted tool calls
 * here. Populated once at startup; lookups are safe from any thread afterwards.
 */
public final class ToolRegistry {

    private static final Logger log = LoggerFactory.getLogger(ToolRegistry.class);

    private final Map<String, Tool> toolsByName = Collections.synchronizedMap(new LinkedHashMap<>());

    /**
     * Registers a tool under its schema name.
     *
     * @throws IllegalArgumentException if a tool with the same name is already registered
     */
    public void register(Tool tool) {
        Objects.requireNonNull(tool, "tool");
        register(tool.getSchema().getName(), tool);
    }

    /**
     * Registers a tool under an explicit name.
     *
     * @param name tool name (must be non-blank; trimmed)
     * @param tool implementation
     * @throws IllegalArgumentException if name is blank or already registered
     */
    public void register(String name, Tool tool) {
        Objects.requireNonNull(tool, "tool");
        String n = Objects.requireNonNull(name, "name").trim();
        if (n.isEmpty()) {
            throw new IllegalArgumentException("Tool name must be non-blank");
        }
        if (toolsByName.putIfAbsent(n, tool) != null) {
            throw new IllegalArgumentException("Tool already registered: " + n);
        }
        log.debug("Registered tool {}", n);
    }

    /** Registers the tool created by the provider under {@link ToolProvider#getToolName()}. */
    public void register(ToolProvider provider) {
        Objects.requireNonNull(provider, "provider");
        register(provider.getToolName(), provider.createTool());
        log.info("Registered tool {} (version={})", provider.getToolName(), provider.getVersion());
    }

    /** Returns the tool for the name, or null if not registered. */
    public Tool get(String name) {
        if (name == null || name.isBlank()) return null;
        return toolsByName.get(name.trim());
    }

    public boolean contains(String name) {
        return get(name) != null;
    }

    /** Registered names in registration order. */
    public Set<String> getToolNames() {
        synchronized (toolsByName) {
            return Collections.unmodifiableSet(new LinkedHashSet<>(toolsByName.keySet()));
        }
    }

    /** Schemas of all registered tools in registration order. */
    public List<ToolSchema> getSchemas() {
        List<ToolSchema> out = new ArrayList<>();
        synchronized (toolsByName) {
            for (Tool t : toolsByName.values()) {
                out.add(t.getSchema());
            }
        }
        return out;
    }

    /** OpenAI function-tool schemas for all registered tools (see {@link ToolSchema#toFunctionSchema()}). */
    public List<Map<String, Object>> getFunctionSchemas() {
        List<Map<String, Object>> out = new ArrayList<>();
        for (ToolSchema s : getSchemas()) {
            out.add(s.toFunctionSchema());
        }
        return out;
    }

    /**
     * Invokes {@link ResourceCleanup#onExit()} on every registered tool that implements it.
     * Failures are logged and skipped.
     */
    public void runResourceCleanup() {
        List<Map.Entry<String, Tool>> entries;
        synchronized (toolsByName) {
            entries = new ArrayList<>(toolsByName.entrySet());
        }
        for (Map.Entry<String, Tool> e : entries) {
            if (e.getValue() instanceof ResourceCleanup) {
                try {
                    ((ResourceCleanup) e.getValue()).onExit();
                } catch (Exception ex) {
                    log.warn("Tool {} onExit failed: {}", e.getKey(), ex.getMessage());
                }
            }
        }
    }

    public int size() {
        return toolsByName.size();
    }

    /** Removes all registrations (mainly for tests). */
    public void clear() {
        toolsByName.clear();
    }
}
