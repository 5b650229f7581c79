package com.deepproof.config;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Configuration loaded from environment variables for the DeepProof tools.
 * <p>
 * Verifier: FSTAR_VERIFIER_SERVER_HOST, DEEPPROOF_VERIFIER_TIMEOUT_SECONDS.
 * Tools: DEEPPROOF_TOOLS (comma-separated names; empty = all), DEEPPROOF_CONTRACT_VIOLATION_POLICY.
 * Logging: VERL_LOGGING_LEVEL, else DEEPPROOF_LOGGING_LEVEL (read by logback.xml; validated at startup).
 */
public final class DeepProofConfig {

    public static final String ENV_VERIFIER_HOST = "FSTAR_VERIFIER_SERVER_HOST";
    public static final String ENV_VERIFIER_TIMEOUT_SECONDS = "DEEPPROOF_VERIFIER_TIMEOUT_SECONDS";
    public static final String ENV_CONTRACT_VIOLATION_POLICY = "DEEPPROOF_CONTRACT_VIOLATION_POLICY";
    public static final String ENV_TOOLS = "DEEPPROOF_TOOLS";
    public static final String ENV_LOGGING_LEVEL = "VERL_LOGGING_LEVEL";
    public static final String ENV_LOGGING_LEVEL_FALLBACK = "DEEPPROOF_LOGGING_LEVEL";

    public static final String DEFAULT_VERIFIER_BASE_URL = "http://localhost:8005";
    public static final int DEFAULT_VERIFIER_TIMEOUT_SECONDS = 15;
    public static final ContractViolationPolicy DEFAULT_CONTRACT_VIOLATION_POLICY = ContractViolationPolicy.REPORT;
    public static final String DEFAULT_LOGGING_LEVEL = "WARN";

    private final String verifierBaseUrl;
    private final int verifierTimeoutSeconds;
    private final ContractViolationPolicy contractViolationPolicy;
    private final Set<String> enabledTools;
    private final String loggingLevel;

    private DeepProofConfig(Builder b) {
        this.verifierBaseUrl = normalizeBaseUrl(b.verifierBaseUrl);
        this.verifierTimeoutSeconds = b.verifierTimeoutSeconds > 0 ? b.verifierTimeoutSeconds : DEFAULT_VERIFIER_TIMEOUT_SECONDS;
        this.contractViolationPolicy = b.contractViolationPolicy != null ? b.contractViolationPolicy : DEFAULT_CONTRACT_VIOLATION_POLICY;
        this.enabledTools = Collections.unmodifiableSet(new LinkedHashSet<>(b.enabledTools));
        this.loggingLevel = b.loggingLevel != null && !b.loggingLevel.isBlank() ? b.loggingLevel.trim() : DEFAULT_LOGGING_LEVEL;
    }

    /** Verifier base URL without trailing slash (e.g. http://localhost:8005). */
    public String getVerifierBaseUrl() {
        return verifierBaseUrl;
    }

    /** Whole-request timeout for one verification call. Default 15. */
    public int getVerifierTimeoutSeconds() {
        return verifierTimeoutSeconds;
    }

    /** Rendering of calls missing required parameters or context. Default {@link ContractViolationPolicy#REPORT}. */
    public ContractViolationPolicy getContractViolationPolicy() {
        return contractViolationPolicy;
    }

    /** Tool names to register; empty means every available tool. */
    public Set<String> getEnabledTools() {
        return enabledTools;
    }

    /** Whether the named tool should be registered (true for all tools when DEEPPROOF_TOOLS is unset). */
    public boolean isToolEnabled(String toolName) {
        return enabledTools.isEmpty() || (toolName != null && enabledTools.contains(toolName.trim()));
    }

    /** Log level name for com.deepproof loggers (VERL_LOGGING_LEVEL, else DEEPPROOF_LOGGING_LEVEL). Default WARN. */
    public String getLoggingLevel() {
        return loggingLevel;
    }

    public static DeepProofConfig fromEnvironment() {
        return fromEnvironment(System::getenv);
    }

    /**
     * Builds config from the given variable lookup (e.g. {@code System::getenv}, or a map in tests).
     */
    public static DeepProofConfig fromEnvironment(Function<String, String> env) {
        Objects.requireNonNull(env, "env");
        return builder()
                .verifierBaseUrl(getEnv(env, ENV_VERIFIER_HOST, DEFAULT_VERIFIER_BASE_URL))
                .verifierTimeoutSeconds(parseInt(env.apply(ENV_VERIFIER_TIMEOUT_SECONDS), DEFAULT_VERIFIER_TIMEOUT_SECONDS))
                .contractViolationPolicy(ContractViolationPolicy.parse(env.apply(ENV_CONTRACT_VIOLATION_POLICY), DEFAULT_CONTRACT_VIOLATION_POLICY))
                .enabledTools(parseCommaSeparated(env.apply(ENV_TOOLS)))
                .loggingLevel(getEnv(env, ENV_LOGGING_LEVEL, getEnv(env, ENV_LOGGING_LEVEL_FALLBACK, DEFAULT_LOGGING_LEVEL)))
                .build();
    }

    public static Builder builder() {
        return new Builder();
    }

    private static String normalizeBaseUrl(String url) {
        String u = url != null && !url.isBlank() ? url.trim() : DEFAULT_VERIFIER_BASE_URL;
        while (u.endsWith("/")) {
            u = u.substring(0, u.length() - 1);
        }
        return u;
    }

    private static Set<String> parseCommaSeparated(String value) {
        if (value == null || value.isBlank()) {
            return Set.of();
        }
        return Stream.of(value.split(","))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .collect(Collectors.toCollection(LinkedHashSet::new));
    }

    private static int parseInt(String value, int defaultValue) {
        if (value == null || value.isBlank()) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            return defaultValue;
        }
    }

    private static String getEnv(Function<String, String> env, String key, String defaultValue) {
        String v = env.apply(key);
        return (v != null && !v.isBlank()) ? v.trim() : defaultValue;
    }

    @Override
    public String toString() {
        return "DeepProofConfig{verifierBaseUrl=" + verifierBaseUrl
                + ", verifierTimeoutSeconds=" + verifierTimeoutSeconds
                + ", contractViolationPolicy=" + contractViolationPolicy
                + ", enabledTools=" + enabledTools
                + ", loggingLevel=" + loggingLevel + "}";
    }

    public static final class Builder {
        private String verifierBaseUrl = DEFAULT_VERIFIER_BASE_URL;
        private int verifierTimeoutSeconds = DEFAULT_VERIFIER_TIMEOUT_SECONDS;
        private ContractViolationPolicy contractViolationPolicy = DEFAULT_CONTRACT_VIOLATION_POLICY;
        private Set<String> enabledTools = Set.of();
        private String loggingLevel = DEFAULT_LOGGING_LEVEL;

        public Builder verifierBaseUrl(String verifierBaseUrl) {
            this.verifierBaseUrl = verifierBaseUrl;
            return this;
        }

        public Builder verifierTimeoutSeconds(int verifierTimeoutSeconds) {
            this.verifierTimeoutSeconds = verifierTimeoutSeconds;
            return this;
        }

        public Builder contractViolationPolicy(ContractViolationPolicy contractViolationPolicy) {
            this.contractViolationPolicy = contractViolationPolicy;
            return this;
        }

        public Builder enabledTools(Set<String> enabledTools) {
            this.enabledTools = enabledTools != null ? enabledTools : Set.of();
            return this;
        }

        public Builder loggingLevel(String loggingLevel) {
            this.loggingLevel = loggingLevel;
            return this;
        }

        public DeepProofConfig build() {
            return new DeepProofConfig(this);
        }
    }
}
