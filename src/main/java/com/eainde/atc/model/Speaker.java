package com.eainde.atc.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Who keyed the transmission, as tagged by diarization.
 */
public enum Speaker {
    CONTROLLER("controller"),
    PILOT("pilot");

    private final String value;

    Speaker(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    @JsonCreator
    public static Speaker fromValue(String value) {
        for (Speaker speaker : values()) {
            if (speaker.value.equalsIgnoreCase(value)) {
                return speaker;
            }
        }
        throw new IllegalArgumentException("Unknown speaker: " + value);
    }
}
