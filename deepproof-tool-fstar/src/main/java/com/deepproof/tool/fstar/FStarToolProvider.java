package com.deepproof.tool.fstar;

import com.deepproof.config.DeepProofConfig;
import com.deepproof.tools.ToolProvider;

/**
 * Provider for {@value FStarExecutionTool#TOOL_NAME}. Reads the verifier URL and timeout from
 * {@link DeepProofConfig}.
 */
public final class FStarToolProvider implements ToolProvider {

    private final FStarExecutionTool tool;
    private final boolean enabled;

    public FStarToolProvider(DeepProofConfig config) {
        this.tool = new FStarExecutionTool(config);
        this.enabled = config.isToolEnabled(FStarExecutionTool.TOOL_NAME);
    }

    @Override
    public String getToolName() {
        return FStarExecutionTool.TOOL_NAME;
    }

    @Override
    public FStarExecutionTool getTool() {
        return tool;
    }

    @Override
    public String getDescription() {
        return "Checks F* proof code against the verification service and reports the verdict and diagnostics.";
    }

    @Override
    public boolean isEnabled() {
        return enabled;
    }
}
