package com.eainde.atc.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Optional;

/**
 * Severity scale shared by fatigue results, fatigue indicators, safety issues
 * and timeline events. Serialized lowercase; the value set is part of the
 * persisted report contract.
 */
public enum Severity {
    LOW("low"),
    MEDIUM("medium"),
    HIGH("high"),
    CRITICAL("critical");

    private final String value;

    Severity(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    @JsonCreator
    public static Severity fromValue(String value) {
        return parse(value).orElseThrow(() -> new IllegalArgumentException("Unknown severity: " + value));
    }

    /**
     * Case-insensitive lookup that reports an unknown value as empty instead of failing.
     */
    public static Optional<Severity> parse(String value) {
        if (value == null) {
            return Optional.empty();
        }
        String trimmed = value.trim();
        for (Severity severity : values()) {
            if (severity.value.equalsIgnoreCase(trimmed)) {
                return Optional.of(severity);
            }
        }
        return Optional.empty();
    }
}
