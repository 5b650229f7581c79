package com.deepproof.tools;

/**
 * A tool call arrived without something the tool requires (a model parameter or orchestration context).
 * This is a caller error, not a transport or verification failure; tools report it separately.
 */
public class ContractViolationException extends RuntimeException {

    public ContractViolationException(String message) {
        super(message);
    }
}
