package com.deepproof.tool.fstar;

import com.fasterxml.jackson.annotation.JsonProperty;

/** Verifier /check_problem_solution request body. */
final class VerificationRequest {

    private final String solution;
    @JsonProperty("problem_id")
    private final String problemId;

    VerificationRequest(String solution, String problemId) {
        this.solution = solution;
        this.problemId = problemId;
    }

    public String getSolution() { return solution; }
    public String getProblemId() { return problemId; }
}
