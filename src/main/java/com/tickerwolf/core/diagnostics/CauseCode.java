package com.tickerwolf.core.diagnostics;

/**
 * Failure causes reported by upstream fetches and store operations.
 */
public enum CauseCode {
    NONE,
    NOT_FOUND,
    RATE_LIMITED,
    UNAVAILABLE,
    TIMEOUT,
    INVALID_PAYLOAD,
    STORE_ERROR
}
