package com.eainde.atc.exception;

public class AnalysisCancelledException extends AnalysisException {

    public AnalysisCancelledException(String message) {
        super(FailureCategory.CANCELLED, message);
    }
}
