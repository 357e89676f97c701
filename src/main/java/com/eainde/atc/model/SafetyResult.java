package com.eainde.atc.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Output of the safety agent.
 *
 * @param score                   0 (no concern) to 100 (most critical)
 * @param issuesFound             issues in transcript order
 * @param requiresImmediateReview whether the shift must be reviewed now
 * @param summary                 overall assessment
 */
public record SafetyResult(
        @JsonProperty("score")                   int score,
        @JsonProperty("issuesFound")             List<SafetyIssue> issuesFound,
        @JsonProperty("requiresImmediateReview") boolean requiresImmediateReview,
        @JsonProperty("summary")                 String summary
) {

    public SafetyResult {
        issuesFound = issuesFound != null ? List.copyOf(issuesFound) : List.of();
    }
}
