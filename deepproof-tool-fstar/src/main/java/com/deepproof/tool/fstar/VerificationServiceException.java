package com.deepproof.tool.fstar;

import java.io.IOException;

/**
 * The verifier answered, but not with a usable verdict (non-2xx status, empty or non-object body).
 */
public class VerificationServiceException extends IOException {

    private final int statusCode;

    public VerificationServiceException(String message, int statusCode) {
        super(message);
        this.statusCode = statusCode;
    }

    /** HTTP status of the response that caused this failure. */
    public int getStatusCode() {
        return statusCode;
    }
}
