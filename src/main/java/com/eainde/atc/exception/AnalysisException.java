package com.eainde.atc.exception;

/**
 * Base class for every fatal condition of an analysis run.
 */
public class AnalysisException extends RuntimeException {

    private final FailureCategory category;

    public AnalysisException(FailureCategory category, String message) {
        super(message);
        this.category = category;
    }

    public AnalysisException(FailureCategory category, String message, Throwable cause) {
        super(message, cause);
        this.category = category;
    }

    public FailureCategory getCategory() {
        return category;
    }

    /**
     * Reason string recorded on the failed run, e.g. {@code "BACKEND_TIMEOUT: ..."}.
     */
    public String toFailureReason() {
        return category.name() + ": " + getMessage();
    }
}
