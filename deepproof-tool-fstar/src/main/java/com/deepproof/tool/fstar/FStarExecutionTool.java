package com.deepproof.tool.fstar;

import com.deepproof.config.ContractViolationPolicy;
import com.deepproof.config.DeepProofConfig;
import com.deepproof.tools.ContractViolationException;
import com.deepproof.tools.ResourceCleanup;
import com.deepproof.tools.Tool;
import com.deepproof.tools.ToolArguments;
import com.deepproof.tools.ToolInstanceRegistry;
import com.deepproof.tools.ToolResult;
import com.deepproof.tools.ToolSchema;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Map;
import java.util.Objects;

/**
 * Tool that submits F* code to the verification service and reports whether the proof checked.
 * <p>
 * Input: "code" (model parameter) and {@code tools_kwargs.example_name} (problem id from the
 * orchestration layer). Output message: {@code "Verification Success: True|False\n<verifier messages>"}.
 * Score is always 0; the verdict is carried only by the message.
 */
public final class FStarExecutionTool implements Tool, ResourceCleanup {

    private static final Logger log = LoggerFactory.getLogger(FStarExecutionTool.class);

    public static final String TOOL_NAME = "tools/execute_fstar";
    public static final String PARAM_CODE = "code";
    public static final String KWARG_EXAMPLE_NAME = "example_name";

    static final String VERDICT_PREFIX = "Verification Success: ";

    /** Schema advertised to the model and listed by the catalog tool. */
    public static final ToolSchema SCHEMA = ToolSchema.builder(TOOL_NAME)
            .description("A tool that executes the given fstar code.")
            .parameter(PARAM_CODE, "string", "F* code to execute", true)
            .build();

    private final FStarVerifierClient client;
    private final ContractViolationPolicy contractViolationPolicy;
    private final ToolInstanceRegistry instances = new ToolInstanceRegistry(TOOL_NAME);

    public FStarExecutionTool(DeepProofConfig config) {
        Objects.requireNonNull(config, "config");
        this.client = new FStarVerifierClient(config.getVerifierBaseUrl(),
                Duration.ofSeconds(config.getVerifierTimeoutSeconds()));
        this.contractViolationPolicy = config.getContractViolationPolicy();
    }

    FStarExecutionTool(FStarVerifierClient client, ContractViolationPolicy contractViolationPolicy) {
        this.client = Objects.requireNonNull(client, "client");
        this.contractViolationPolicy = contractViolationPolicy != null ? contractViolationPolicy : ContractViolationPolicy.REPORT;
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
        if (!instances.contains(instanceId)) {
            log.debug("execute for instance {} that was not created (or already released)", instanceId);
        }
        String code;
        String problemId;
        try {
            code = ToolArguments.requireParameter(parameters, PARAM_CODE);
            problemId = ToolArguments.requireToolsKwarg(extra, KWARG_EXAMPLE_NAME);
        } catch (ContractViolationException e) {
            log.warn("Invalid {} call for instance {}: {}", TOOL_NAME, instanceId, e.getMessage());
            return contractViolationPolicy == ContractViolationPolicy.RUNTIME_ERROR
                    ? ToolResult.runtimeError(e)
                    : ToolResult.contractViolation(e);
        }
        try {
            VerificationResponse response = client.check(code, problemId);
            return ToolResult.of(formatVerdict(response));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Verification interrupted for problem {}", problemId);
            return ToolResult.runtimeError(e);
        } catch (Exception e) {
            log.warn("Verification request failed for problem {}: {}", problemId, e.toString());
            return ToolResult.runtimeError(e);
        }
    }

    @Override
    public void release(String instanceId, Map<String, Object> extra) {
        instances.release(instanceId);
    }

    @Override
    public void onExit() {
        // HttpClient is not AutoCloseable in Java 17; connections are dropped with the client
    }

    static String formatVerdict(VerificationResponse response) {
        String verdict = response.isVerified() ? "True" : "False";
        return VERDICT_PREFIX + verdict + "\n" + response.messagesOrEmpty();
    }

    ToolInstanceRegistry getInstances() {
        return instances;
    }
}
