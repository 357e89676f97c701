package com.eainde.atc.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Comparator;
import java.util.List;

/**
 * Supervisor-facing report produced by the summarizer agent from the fatigue and safety results.
 */
public record SummaryResult(
        @JsonProperty("executiveSummary") String executiveSummary,
        @JsonProperty("keyFindings")      List<String> keyFindings,
        @JsonProperty("timeline")         List<TimelineEvent> timeline,
        @JsonProperty("recommendations")  List<Recommendation> recommendations,
        @JsonProperty("priorityLevel")    PriorityLevel priorityLevel
) {

    public SummaryResult {
        keyFindings = keyFindings != null ? List.copyOf(keyFindings) : List.of();
        timeline = timeline != null ? List.copyOf(timeline) : List.of();
        // stable sort keeps the model's order for equal ordinals
        recommendations = recommendations != null
                ? recommendations.stream().sorted(Comparator.comparingInt(Recommendation::priority)).toList()
                : List.of();
    }
}
