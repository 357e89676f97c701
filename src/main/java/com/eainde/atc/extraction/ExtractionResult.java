package com.eainde.atc.extraction;

import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * Outcome of pulling a JSON payload out of model text: either the parsed object or
 * an explicit failure carrying the raw text for diagnostics.
 */
public final class ExtractionResult {

    private final ObjectNode payload;
    private final String failureReason;
    private final String rawText;

    private ExtractionResult(ObjectNode payload, String failureReason, String rawText) {
        this.payload = payload;
        this.failureReason = failureReason;
        this.rawText = rawText;
    }

    public static ExtractionResult success(ObjectNode payload, String rawText) {
        return new ExtractionResult(payload, null, rawText);
    }

    public static ExtractionResult failure(String reason, String rawText) {
        return new ExtractionResult(null, reason, rawText);
    }

    public boolean isSuccess() {
        return payload != null;
    }

    public ObjectNode getPayload() {
        if (payload == null) {
            throw new IllegalStateException("No payload on a failed extraction: " + failureReason);
        }
        return payload;
    }

    public String getFailureReason() {
        return failureReason;
    }

    public String getRawText() {
        return rawText;
    }

    @Override
    public String toString() {
        return isSuccess()
                ? "ExtractionResult[success]"
                : "ExtractionResult[failure: " + failureReason + "]";
    }
}
