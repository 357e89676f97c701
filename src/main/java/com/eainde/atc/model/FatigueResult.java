package com.eainde.atc.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Output of the fatigue agent, enriched with the computed metrics block.
 *
 * @param score             0 (alert) to 100 (severely fatigued)
 * @param severity          overall fatigue severity
 * @param indicators        cited fatigue signs, most concerning first
 * @param requiresAttention whether a supervisor should look at this shift
 * @param summary           short explanation
 * @param metrics           attached after validation, never produced by the model
 */
public record FatigueResult(
        @JsonProperty("score")             int score,
        @JsonProperty("severity")          Severity severity,
        @JsonProperty("indicators")        List<FatigueIndicator> indicators,
        @JsonProperty("requiresAttention") boolean requiresAttention,
        @JsonProperty("summary")           String summary,
        @JsonProperty("metrics")           ComputedMetrics metrics
) {

    public FatigueResult {
        indicators = indicators != null ? List.copyOf(indicators) : List.of();
    }

    public FatigueResult withMetrics(ComputedMetrics computedMetrics) {
        return new FatigueResult(score, severity, indicators, requiresAttention, summary, computedMetrics);
    }
}
