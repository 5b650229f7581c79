package com.deepproof.tool.fstar;

import com.fasterxml.jackson.databind.JsonNode;

import java.math.BigDecimal;
import java.util.Objects;

/**
 * Verifier /check_problem_solution response, read from the JSON tree without scalar coercion.
 * Every field is optional; extra fields are ignored. A field counts only when it is a JSON number:
 * {@code "0"} or {@code 0.5} as return_code never reads as 0, a string score never reads as 1.0.
 * Missing return_code reads as -2, missing score as not verified, missing or null messages as "".
 */
final class VerificationResponse {

    static final int MISSING_RETURN_CODE = -2;

    private static final String FIELD_RETURN_CODE = "return_code";
    private static final String FIELD_SCORE = "score";
    private static final String FIELD_MESSAGES = "messages";

    private final JsonNode returnCode;
    private final JsonNode score;
    private final String messages;

    private VerificationResponse(JsonNode returnCode, JsonNode score, String messages) {
        this.returnCode = returnCode;
        this.score = score;
        this.messages = messages;
    }

    /**
     * @param root response body; must be a JSON object
     */
    static VerificationResponse fromJson(JsonNode root) {
        Objects.requireNonNull(root, "root");
        if (!root.isObject()) {
            throw new IllegalArgumentException("Verifier response must be a JSON object");
        }
        JsonNode rc = root.get(FIELD_RETURN_CODE);
        JsonNode sc = root.get(FIELD_SCORE);
        JsonNode msg = root.get(FIELD_MESSAGES);
        String text;
        if (msg == null || msg.isNull()) {
            text = "";
        } else if (msg.isTextual()) {
            text = msg.textValue();
        } else {
            text = msg.toString();
        }
        return new VerificationResponse(rc, sc, text);
    }

    /** True iff return_code is the number 0. Absent return_code counts as {@value #MISSING_RETURN_CODE}. */
    boolean isReturnCodeZero() {
        return isNumberEqualTo(returnCode, BigDecimal.ZERO);
    }

    /** True iff score is the number 1.0. */
    boolean isFullScore() {
        return isNumberEqualTo(score, BigDecimal.ONE);
    }

    String messagesOrEmpty() {
        return messages;
    }

    /** True iff return_code == 0 and score == 1.0. */
    boolean isVerified() {
        return isReturnCodeZero() && isFullScore();
    }

    private static boolean isNumberEqualTo(JsonNode node, BigDecimal expected) {
        return node != null && node.isNumber() && node.decimalValue().compareTo(expected) == 0;
    }
}
