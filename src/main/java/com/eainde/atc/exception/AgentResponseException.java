package com.eainde.atc.exception;

/**
 * The model replied, but the reply could not be turned into the agent's result:
 * either no JSON payload could be extracted, or the payload broke the agent's schema.
 */
public class AgentResponseException extends AnalysisException {

    private final String rawResponse;

    public AgentResponseException(FailureCategory category, String message, String rawResponse) {
        super(category, message);
        this.rawResponse = rawResponse;
    }

    public String getRawResponse() {
        return rawResponse;
    }
}
