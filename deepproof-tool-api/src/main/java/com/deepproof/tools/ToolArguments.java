package com.deepproof.tools;

import java.util.Map;

/**
 * Helpers to read model parameters and orchestration context passed to {@link Tool#execute}.
 * Missing values raise {@link ContractViolationException} with a readable message instead of a bare
 * lookup failure.
 */
public final class ToolArguments {

    /** Key in {@code extra} holding per-sample tool arguments supplied by the orchestration layer. */
    public static final String TOOLS_KWARGS = "tools_kwargs";

    private ToolArguments() {
    }

    /**
     * Returns {@code parameters[name]} as a string.
     *
     * @throws ContractViolationException if the parameter is absent or null
     */
    public static String requireParameter(Map<String, Object> parameters, String name) {
        Object v = parameters != null ? parameters.get(name) : null;
        if (v == null) {
            throw new ContractViolationException("Missing required parameter: " + name);
        }
        return v.toString();
    }

    /**
     * Returns {@code extra["tools_kwargs"][name]} as a string.
     *
     * @throws ContractViolationException if tools_kwargs or the key is absent
     */
    public static String requireToolsKwarg(Map<String, Object> extra, String name) {
        Object kwargs = extra != null ? extra.get(TOOLS_KWARGS) : null;
        if (!(kwargs instanceof Map)) {
            throw new ContractViolationException("Missing required context: " + TOOLS_KWARGS + "." + name);
        }
        Object v = ((Map<?, ?>) kwargs).get(name);
        if (v == null) {
            throw new ContractViolationException("Missing required context: " + TOOLS_KWARGS + "." + name);
        }
        return v.toString();
    }
}
