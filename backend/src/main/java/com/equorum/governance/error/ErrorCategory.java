package com.equorum.governance.error;

/**
 * Coarse classification of a rejected governance operation.
 *
 * TIMING_VIOLATION is kept apart from STATE_CONFLICT because it depends on the
 * clock rather than on stored state: the same request may succeed later
 * (see {@link ErrorCode#isRetryable()}).
 */
public enum ErrorCategory {
    INPUT_VALIDATION,
    AUTHORIZATION_DENIED,
    STATE_CONFLICT,
    TIMING_VIOLATION
}
