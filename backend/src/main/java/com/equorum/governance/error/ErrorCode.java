package com.equorum.governance.error;

import io.micronaut.http.HttpStatus;

import static com.equorum.governance.error.ErrorCategory.AUTHORIZATION_DENIED;
import static com.equorum.governance.error.ErrorCategory.INPUT_VALIDATION;
import static com.equorum.governance.error.ErrorCategory.STATE_CONFLICT;
import static com.equorum.governance.error.ErrorCategory.TIMING_VIOLATION;

public enum ErrorCode {

    // ── Input validation ──────────────────────────────────────────────────
    INVALID_AMOUNT(INPUT_VALIDATION, HttpStatus.BAD_REQUEST, false),
    BELOW_MINIMUM_LOCK(INPUT_VALIDATION, HttpStatus.BAD_REQUEST, false),
    INSUFFICIENT_BALANCE(INPUT_VALIDATION, HttpStatus.BAD_REQUEST, false),
    INVALID_PRINCIPAL(INPUT_VALIDATION, HttpStatus.BAD_REQUEST, false),
    INVALID_TARGET(INPUT_VALIDATION, HttpStatus.BAD_REQUEST, false),
    INVALID_SIGNATURE(INPUT_VALIDATION, HttpStatus.BAD_REQUEST, false),
    INVALID_CALLDATA(INPUT_VALIDATION, HttpStatus.BAD_REQUEST, false),
    EMPTY_ACTIONS(INPUT_VALIDATION, HttpStatus.BAD_REQUEST, false),
    TOO_MANY_ACTIONS(INPUT_VALIDATION, HttpStatus.BAD_REQUEST, false),
    DUPLICATE_ACTION(INPUT_VALIDATION, HttpStatus.BAD_REQUEST, false),
    EMPTY_DESCRIPTION(INPUT_VALIDATION, HttpStatus.BAD_REQUEST, false),
    ETA_OUT_OF_RANGE(INPUT_VALIDATION, HttpStatus.BAD_REQUEST, false),
    PROPOSAL_NOT_FOUND(INPUT_VALIDATION, HttpStatus.NOT_FOUND, false),

    // ── Authorization ─────────────────────────────────────────────────────
    BELOW_THRESHOLD(AUTHORIZATION_DENIED, HttpStatus.FORBIDDEN, false),
    NO_VOTING_POWER(AUTHORIZATION_DENIED, HttpStatus.FORBIDDEN, false),
    NOT_ADMIN(AUTHORIZATION_DENIED, HttpStatus.FORBIDDEN, false),
    NOT_PENDING_ADMIN(AUTHORIZATION_DENIED, HttpStatus.FORBIDDEN, false),
    EXCLUDED_PRINCIPAL(AUTHORIZATION_DENIED, HttpStatus.FORBIDDEN, false),
    CANCEL_NOT_ALLOWED(AUTHORIZATION_DENIED, HttpStatus.FORBIDDEN, false),

    // ── State conflicts ───────────────────────────────────────────────────
    ALREADY_VOTED(STATE_CONFLICT, HttpStatus.CONFLICT, false),
    ALREADY_QUEUED(STATE_CONFLICT, HttpStatus.CONFLICT, false),
    ALREADY_EXECUTED(STATE_CONFLICT, HttpStatus.CONFLICT, false),
    INVALID_PROPOSAL_STATE(STATE_CONFLICT, HttpStatus.CONFLICT, false),
    NO_LOCK(STATE_CONFLICT, HttpStatus.CONFLICT, false),
    TRANSFER_FAILED(STATE_CONFLICT, HttpStatus.CONFLICT, false),
    TARGET_REVERTED(STATE_CONFLICT, HttpStatus.CONFLICT, false),
    CONCURRENT_MODIFICATION(STATE_CONFLICT, HttpStatus.CONFLICT, true),
    MISSING_ENTRY(STATE_CONFLICT, HttpStatus.NOT_FOUND, false),
    LEDGER_UNAVAILABLE(STATE_CONFLICT, HttpStatus.SERVICE_UNAVAILABLE, true),

    // ── Timing ────────────────────────────────────────────────────────────
    VOTING_CLOSED(TIMING_VIOLATION, HttpStatus.CONFLICT, false),
    NOT_READY(TIMING_VIOLATION, HttpStatus.CONFLICT, true),
    STALE_TRANSACTION(TIMING_VIOLATION, HttpStatus.GONE, false),
    LOCK_TOO_NEW(TIMING_VIOLATION, HttpStatus.CONFLICT, true),
    LOCK_COMMITTED(TIMING_VIOLATION, HttpStatus.CONFLICT, true);

    private final ErrorCategory category;
    private final HttpStatus status;
    private final boolean retryable;

    ErrorCode(ErrorCategory category, HttpStatus status, boolean retryable) {
        this.category = category;
        this.status = status;
        this.retryable = retryable;
    }

    public ErrorCategory getCategory() { return category; }

    public HttpStatus getStatus() { return status; }

    /** True when repeating the identical request may succeed without any state change. */
    public boolean isRetryable() { return retryable; }
}
