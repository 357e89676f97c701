package com.eainde.atc.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One diarized utterance of the shift recording.
 *
 * @param timestamp  seconds from the start of the recording
 * @param speaker    controller or pilot
 * @param text       transcribed text
 * @param confidence transcription confidence, when the speech-to-text step reports one
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record TranscriptEntry(
        @JsonProperty("timestamp")  double timestamp,
        @JsonProperty("speaker")    Speaker speaker,
        @JsonProperty("text")       String text,
        @JsonProperty("confidence") Double confidence
) {

    public static TranscriptEntry of(double timestamp, Speaker speaker, String text) {
        return new TranscriptEntry(timestamp, speaker, text, null);
    }

    @JsonIgnore
    public boolean isController() {
        return speaker == Speaker.CONTROLLER;
    }

    @JsonIgnore
    public boolean isPilot() {
        return speaker == Speaker.PILOT;
    }
}
