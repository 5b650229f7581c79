package com.deepproof.tools;

/**
 * Provider for a tool: supplies the instance the registry binds under {@link #getToolName()} plus
 * discovery metadata. Providers are assembled at startup (see the internal-tools module) and filtered
 * by configuration through {@link #isEnabled()}.
 */
public interface ToolProvider {

    /** Tool name the model uses to call it (e.g. "tools/execute_fstar"). */
    default String getToolName() {
        return getTool().getSchema().getName();
    }

    /** Human-readable description; defaults to the schema description. */
    default String getDescription() {
        return getTool().getSchema().getDescription();
    }

    /** Tool instance, typically built from configuration in the provider constructor. */
    Tool getTool();

    /**
     * Creates the tool bound in a registry. Default returns {@link #getTool()}; override to hand out a
     * fresh tool per registry.
     */
    default Tool createTool() {
        return getTool();
    }

    /** Tool contract version (e.g. "1.0"). */
    default String getVersion() {
        return "1.0";
    }

    /** Whether this provider should be registered. */
    default boolean isEnabled() {
        return true;
    }
}
