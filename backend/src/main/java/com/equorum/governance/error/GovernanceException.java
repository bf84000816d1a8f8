package com.equorum.governance.error;

import io.micronaut.http.exceptions.HttpStatusException;

/**
 * Rejection of a governance operation. Thrown before any state is written, or
 * from inside a transaction that is then rolled back.
 */
public class GovernanceException extends HttpStatusException {

    private final ErrorCode code;

    public GovernanceException(ErrorCode code, String message) {
        super(code.getStatus(), message);
        this.code = code;
    }

    public GovernanceException(ErrorCode code, String message, Throwable cause) {
        this(code, message);
        initCause(cause);
    }

    public ErrorCode getCode() { return code; }

    public ErrorCategory getCategory() { return code.getCategory(); }

    public boolean isRetryable() { return code.isRetryable(); }
}
