package com.deepproof.internal.tools;

import com.deepproof.config.DeepProofConfig;
import com.deepproof.tool.fstar.FStarToolProvider;
import com.deepproof.tool.list.ListTool;
import com.deepproof.tool.list.ListToolProvider;
import com.deepproof.tools.ToolProvider;
import com.deepproof.tools.ToolRegistry;
import com.deepproof.tools.ToolSchema;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Builds the tool dispatch table the agent runtime resolves tool calls against. Tools are enabled by
 * configuration (DEEPPROOF_TOOLS); the listing tool's catalog is the schemas of the other enabled tools,
 * fixed at startup.
 */
public final class InternalTools {

    private static final Logger log = LoggerFactory.getLogger(InternalTools.class);

    private static final Set<String> LOG_LEVELS = Set.of("TRACE", "DEBUG", "INFO", "WARN", "ERROR", "OFF", "ALL");

    private InternalTools() {
    }

    /**
     * Loads configuration from environment and returns a populated registry.
     */
    public static ToolRegistry initialize() {
        DeepProofConfig config = DeepProofConfig.fromEnvironment();
        log.info("Tools: configuration loaded from environment; {}", config);
        if (!isKnownLoggingLevel(config.getLoggingLevel())) {
            log.warn("Tools: logging level '{}' (VERL_LOGGING_LEVEL / DEEPPROOF_LOGGING_LEVEL) is not a level name; expected one of {}",
                    config.getLoggingLevel(), LOG_LEVELS);
        }
        return createRegistry(config);
    }

    static boolean isKnownLoggingLevel(String level) {
        return level != null && LOG_LEVELS.contains(level.trim().toUpperCase(Locale.ROOT));
    }

    /**
     * Registers every internal tool enabled by the given configuration.
     *
     * @param config verifier, policy and enabled-tool settings
     * @return registry keyed by tool name
     */
    public static ToolRegistry createRegistry(DeepProofConfig config) {
        ToolRegistry registry = new ToolRegistry();
        List<ToolProvider> providers = new ArrayList<>();
        providers.add(new FStarToolProvider(config));

        List<ToolSchema> catalog = new ArrayList<>();
        for (ToolProvider provider : providers) {
            if (register(registry, provider)) {
                catalog.add(provider.getTool().getSchema());
            }
        }
        if (config.isToolEnabled(ListTool.TOOL_NAME)) {
            register(registry, new ListToolProvider(catalog));
        }
        log.info("Registered {} internal tool(s): {}", registry.size(), registry.getToolNames());
        return registry;
    }

    private static boolean register(ToolRegistry registry, ToolProvider provider) {
        if (provider == null || !provider.isEnabled()) {
            log.debug("Skipping disabled tool {}", provider != null ? provider.getToolName() : null);
            return false;
        }
        registry.register(provider);
        return true;
    }
}
