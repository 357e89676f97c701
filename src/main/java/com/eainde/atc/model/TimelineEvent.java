package com.eainde.atc.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record TimelineEvent(
        @JsonProperty("timestamp")   String timestamp,
        @JsonProperty("type")        TimelineEventType type,
        @JsonProperty("description") String description,
        @JsonProperty("severity")    Severity severity
) {}
