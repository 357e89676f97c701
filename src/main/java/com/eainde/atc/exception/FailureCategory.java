package com.eainde.atc.exception;

/**
 * Why an analysis run ended in {@code FAILED}. Also decides whether an agent call may be retried.
 */
public enum FailureCategory {
    INPUT_MISSING(false),
    EXTRACTION_FAILURE(true),
    VALIDATION_FAILURE(true),
    BACKEND_TIMEOUT(true),
    BACKEND_ERROR(false),
    CANCELLED(false),
    STORE_FAILURE(false),
    UNEXPECTED(false);

    private final boolean retryable;

    FailureCategory(boolean retryable) {
        this.retryable = retryable;
    }

    public boolean isRetryable() {
        return retryable;
    }
}
