package com.eainde.atc.pipeline;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Reply to a start request: {@code processing} when a run was started, {@code rejected} when one
 * was already in progress for the shift.
 */
public record StartAnalysisResponse(
        @JsonProperty("status")  String status,
        @JsonProperty("shiftId") String shiftId
) {

    public static final String PROCESSING = "processing";
    public static final String REJECTED = "rejected";

    public static StartAnalysisResponse processing(String shiftId) {
        return new StartAnalysisResponse(PROCESSING, shiftId);
    }

    public static StartAnalysisResponse rejected(String shiftId) {
        return new StartAnalysisResponse(REJECTED, shiftId);
    }

    @JsonIgnore
    public boolean isAccepted() {
        return PROCESSING.equals(status);
    }
}
