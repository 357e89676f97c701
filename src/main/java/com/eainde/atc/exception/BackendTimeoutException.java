package com.eainde.atc.exception;

import java.time.Duration;

public class BackendTimeoutException extends AnalysisException {

    public BackendTimeoutException(String agentName, Duration timeout) {
        super(FailureCategory.BACKEND_TIMEOUT,
                "Language model call for " + agentName + " exceeded " + timeout.toMillis() + " ms");
    }

    public BackendTimeoutException(String message, Throwable cause) {
        super(FailureCategory.BACKEND_TIMEOUT, message, cause);
    }
}
