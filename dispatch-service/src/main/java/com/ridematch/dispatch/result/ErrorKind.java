package com.ridematch.dispatch.result;

/**
 * Failure categories shared by all dispatch outcomes.
 */
public enum ErrorKind {
    NOT_FOUND,
    CONFLICT,
    PRECONDITION_FAILED,
    VALIDATION,
    /** Lock contention: retry, not failure. */
    TRANSIENT,
    FORBIDDEN
}
