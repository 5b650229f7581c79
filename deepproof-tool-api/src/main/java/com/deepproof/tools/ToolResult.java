package com.deepproof.tools;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Outcome of {@link Tool#execute}: the message shown to the model, a score, and metadata for the
 * orchestration layer. Tools in this project always report score 0; pass/fail lives in the message.
 */
public final class ToolResult {

    /** Metadata key set when the call itself was malformed (see {@link ContractViolationException}). */
    public static final String METADATA_ERROR_KIND = "errorKind";
    public static final String ERROR_KIND_CONTRACT_VIOLATION = "CONTRACT_VIOLATION";

    static final String RUNTIME_ERROR_HEADER = "Runtime error occurred.";
    static final String INVALID_CALL_HEADER = "Invalid tool call.";

    private final String message;
    private final double score;
    private final Map<String, Object> metadata;

    public ToolResult(String message, double score, Map<String, Object> metadata) {
        this.message = message != null ? message : "";
        this.score = score;
        this.metadata = metadata != null && !metadata.isEmpty()
                ? Collections.unmodifiableMap(new LinkedHashMap<>(metadata))
                : Collections.emptyMap();
    }

    /** Message with score 0 and empty metadata. */
    public static ToolResult of(String message) {
        return new ToolResult(message, 0, Map.of());
    }

    /**
     * Failure while running the tool (transport, protocol, serialization):
     * {@code "Runtime error occurred.\n<exception class>: <detail>"}, score 0, empty metadata.
     * The detail is the first non-blank message along the cause chain, or "" when there is none.
     */
    public static ToolResult runtimeError(Throwable error) {
        Objects.requireNonNull(error, "error");
        return of(RUNTIME_ERROR_HEADER + "\n" + error.getClass().getName() + ": " + detail(error));
    }

    private static String detail(Throwable error) {
        Throwable t = error;
        for (int depth = 0; t != null && depth < 10; depth++) {
            String m = t.getMessage();
            if (m != null && !m.isBlank()) {
                return t == error ? m : t.getClass().getName() + ": " + m;
            }
            t = t.getCause();
        }
        return "";
    }

    /**
     * Malformed call: {@code "Invalid tool call.\n<detail>"}, score 0, metadata
     * {@code errorKind=CONTRACT_VIOLATION}.
     */
    public static ToolResult contractViolation(ContractViolationException error) {
        Objects.requireNonNull(error, "error");
        return new ToolResult(INVALID_CALL_HEADER + "\n" + error.getMessage(), 0,
                Map.of(METADATA_ERROR_KIND, ERROR_KIND_CONTRACT_VIOLATION));
    }

    public String getMessage() { return message; }
    public double getScore() { return score; }
    public Map<String, Object> getMetadata() { return metadata; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ToolResult)) return false;
        ToolResult that = (ToolResult) o;
        return Double.compare(score, that.score) == 0 && message.equals(that.message) && metadata.equals(that.metadata);
    }

    @Override
    public int hashCode() {
        return Objects.hash(message, score, metadata);
    }

    @Override
    public String toString() {
        return "ToolResult{message=" + message + ", score=" + score + ", metadata=" + metadata + "}";
    }
}
