package com.eainde.atc.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Quantitative signals derived from a transcript. Recomputed on every analysis run.
 *
 * @param avgResponseSeconds mean pilot-to-controller latency, 0 when no pair exists
 * @param maxResponseSeconds longest latency, 0 when no pair exists
 * @param minResponseSeconds shortest latency, 0 when no pair exists
 * @param hesitationCount    filler tokens in controller speech
 * @param totalTransmissions number of transcript entries
 */
public record ComputedMetrics(
        @JsonProperty("avgResponseSeconds") double avgResponseSeconds,
        @JsonProperty("maxResponseSeconds") double maxResponseSeconds,
        @JsonProperty("minResponseSeconds") double minResponseSeconds,
        @JsonProperty("hesitationCount")    int hesitationCount,
        @JsonProperty("totalTransmissions") int totalTransmissions
) {

    public static ComputedMetrics empty() {
        return new ComputedMetrics(0, 0, 0, 0, 0);
    }
}
