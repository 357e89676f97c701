package com.eainde.atc.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A single fatigue sign the model cites, with the transcript evidence behind it.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record FatigueIndicator(
        @JsonProperty("type")      String type,
        @JsonProperty("evidence")  String evidence,
        @JsonProperty("severity")  Severity severity,
        @JsonProperty("timestamp") String timestamp
) {}
