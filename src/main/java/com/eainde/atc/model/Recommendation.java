package com.eainde.atc.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A supervisor action. Lower {@code priority} ordinals come first, starting at 1.
 */
public record Recommendation(
        @JsonProperty("priority")  int priority,
        @JsonProperty("action")    String action,
        @JsonProperty("rationale") String rationale
) {}
