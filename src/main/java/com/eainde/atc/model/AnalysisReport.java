package com.eainde.atc.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * The persisted outcome of one successful analysis run, addressed by {@code shiftId}.
 *
 * <p>Reports are immutable: a later successful run for the same shift replaces the whole
 * record, never individual sub-results.</p>
 */
public record AnalysisReport(
        @JsonProperty("shiftId")     String shiftId,
        @JsonProperty("metadata")    ShiftMetadata metadata,
        @JsonProperty("fatigue")     FatigueResult fatigue,
        @JsonProperty("safety")      SafetyResult safety,
        @JsonProperty("summary")     SummaryResult summary,
        @JsonProperty("generatedAt") Instant generatedAt
) {

    /**
     * @return true when either agent flagged the shift for supervisor review
     */
    @JsonIgnore
    public boolean requiresAttention() {
        return (fatigue != null && fatigue.requiresAttention())
                || (safety != null && safety.requiresImmediateReview());
    }

    @JsonIgnore
    public PriorityLevel priorityLevel() {
        return summary != null ? summary.priorityLevel() : null;
    }
}
