package com.eainde.atc.exception;

public class ReportStoreException extends AnalysisException {

    public ReportStoreException(String message, Throwable cause) {
        super(FailureCategory.STORE_FAILURE, message, cause);
    }
}
