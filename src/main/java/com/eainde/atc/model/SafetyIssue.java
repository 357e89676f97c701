package com.eainde.atc.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A communication problem found in the transcript.
 *
 * @param type      e.g. readback error, non-standard phraseology, missed acknowledgment
 * @param severity  how serious the issue is
 * @param timestamp where in the recording it occurred
 * @param evidence  verbatim quote from the transcript
 * @param concern   why it matters
 */
public record SafetyIssue(
        @JsonProperty("type")      String type,
        @JsonProperty("severity")  Severity severity,
        @JsonProperty("timestamp") String timestamp,
        @JsonProperty("evidence")  String evidence,
        @JsonProperty("concern")   String concern
) {}
