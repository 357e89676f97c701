package com.eainde.atc.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Optional;

public enum TimelineEventType {
    FATIGUE("fatigue"),
    SAFETY("safety"),
    NORMAL("normal");

    private final String value;

    TimelineEventType(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    @JsonCreator
    public static TimelineEventType fromValue(String value) {
        return parse(value).orElseThrow(() -> new IllegalArgumentException("Unknown timeline event type: " + value));
    }

    public static Optional<TimelineEventType> parse(String value) {
        if (value == null) {
            return Optional.empty();
        }
        String trimmed = value.trim();
        for (TimelineEventType type : values()) {
            if (type.value.equalsIgnoreCase(trimmed)) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }
}
