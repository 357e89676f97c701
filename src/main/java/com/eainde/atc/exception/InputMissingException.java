package com.eainde.atc.exception;

public class InputMissingException extends AnalysisException {

    public InputMissingException(String message) {
        super(FailureCategory.INPUT_MISSING, message);
    }
}
