package com.eainde.atc.exception;

public class BackendException extends AnalysisException {

    public BackendException(String message, Throwable cause) {
        super(FailureCategory.BACKEND_ERROR, message, cause);
    }
}
