package com.eainde.atc.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Optional;

/**
 * Overall urgency the summarizer assigns to a shift report.
 */
public enum PriorityLevel {
    LOW("low"),
    MEDIUM("medium"),
    HIGH("high"),
    URGENT("urgent");

    private final String value;

    PriorityLevel(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    @JsonCreator
    public static PriorityLevel fromValue(String value) {
        return parse(value).orElseThrow(() -> new IllegalArgumentException("Unknown priority level: " + value));
    }

    public static Optional<PriorityLevel> parse(String value) {
        if (value == null) {
            return Optional.empty();
        }
        String trimmed = value.trim();
        for (PriorityLevel level : values()) {
            if (level.value.equalsIgnoreCase(trimmed)) {
                return Optional.of(level);
            }
        }
        return Optional.empty();
    }
}
