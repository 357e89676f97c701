package com.eainde.atc.pipeline;

import com.eainde.atc.exception.FailureCategory;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.UUID;

/**
 * Snapshot of one analysis run. Transitions produce new instances.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record AnalysisRun(
        @JsonProperty("runId")           String runId,
        @JsonProperty("shiftId")         String shiftId,
        @JsonProperty("state")           AnalysisState state,
        @JsonProperty("failureCategory") FailureCategory failureCategory,
        @JsonProperty("failureReason")   String failureReason,
        @JsonProperty("startedAt")       Instant startedAt,
        @JsonProperty("completedAt")     Instant completedAt
) {

    /** Placeholder for a shift that has never been analyzed by this instance. */
    public static AnalysisRun idle(String shiftId) {
        return new AnalysisRun(null, shiftId, AnalysisState.IDLE, null, null, null, null);
    }

    public static AnalysisRun running(String shiftId) {
        return new AnalysisRun(UUID.randomUUID().toString(), shiftId, AnalysisState.RUNNING,
                null, null, Instant.now(), null);
    }

    public AnalysisRun complete() {
        return new AnalysisRun(runId, shiftId, AnalysisState.COMPLETE, null, null, startedAt, Instant.now());
    }

    public AnalysisRun fail(FailureCategory category, String reason) {
        return new AnalysisRun(runId, shiftId, AnalysisState.FAILED, category, reason, startedAt, Instant.now());
    }

    @JsonIgnore
    public boolean isRunning() {
        return state == AnalysisState.RUNNING;
    }
}
