package com.deepproof.config;

import java.util.Locale;

/**
 * How a tool renders a call that is missing a required parameter or orchestration context.
 */
public enum ContractViolationPolicy {

    /**
     * "Invalid tool call.\n&lt;detail&gt;" with metadata {@code errorKind=CONTRACT_VIOLATION},
     * so the orchestration layer can tell it apart from verification outcomes.
     */
    REPORT,

    /** Same rendering as transport failures: "Runtime error occurred.\n&lt;kind&gt;: &lt;detail&gt;", empty metadata. */
    RUNTIME_ERROR;

    /** Parses a policy name case-insensitively; null, blank or unknown → {@code defaultValue}. */
    public static ContractViolationPolicy parse(String value, ContractViolationPolicy defaultValue) {
        if (value == null || value.isBlank()) {
            return defaultValue;
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return defaultValue;
        }
    }
}
