package com.eainde.atc.controller;

import com.eainde.atc.model.Speaker;
import com.eainde.atc.model.TranscriptEntry;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;

import java.time.Duration;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.function.Supplier;

/**
 * Transcript entry as uploaded. {@code timestamp} is either seconds from the start of the
 * recording (number or numeric string) or an ISO-8601 instant, which is converted to seconds
 * from the shift start.
 */
public record TranscriptEntryRequest(
        @JsonProperty("timestamp")  JsonNode timestamp,
        @JsonProperty("speaker")    Speaker speaker,
        @JsonProperty("text")       String text,
        @JsonProperty("confidence") Double confidence
) {

    /**
     * @param index      position in the upload, for error messages
     * @param shiftStart resolved only when an ISO timestamp is present
     * @throws IllegalArgumentException when a field is missing or the timestamp is unusable
     */
    TranscriptEntry toEntry(int index, Supplier<Instant> shiftStart) {
        if (speaker == null || text == null) {
            throw new IllegalArgumentException("Transcript entry " + index + " needs speaker and text");
        }
        return new TranscriptEntry(seconds(index, shiftStart), speaker, text, confidence);
    }

    private double seconds(int index, Supplier<Instant> shiftStart) {
        if (timestamp == null || timestamp.isNull()) {
            throw new IllegalArgumentException("Transcript entry " + index + " needs a timestamp");
        }
        double seconds;
        if (timestamp.isNumber()) {
            seconds = timestamp.doubleValue();
        } else if (timestamp.isTextual()) {
            seconds = parseText(index, timestamp.textValue().trim(), shiftStart);
        } else {
            throw new IllegalArgumentException("Transcript entry " + index + " has an unusable timestamp: " + timestamp);
        }
        if (!Double.isFinite(seconds)) {
            throw new IllegalArgumentException("Transcript entry " + index + " has a non-finite timestamp");
        }
        return seconds;
    }

    private static double parseText(int index, String value, Supplier<Instant> shiftStart) {
        try {
            return Double.parseDouble(value);
        } catch (NumberFormatException notNumeric) {
            try {
                Instant at = Instant.parse(value);
                return Duration.between(shiftStart.get(), at).toMillis() / 1000.0;
            } catch (DateTimeParseException e) {
                throw new IllegalArgumentException("Transcript entry " + index
                        + " timestamp is neither seconds nor an ISO-8601 instant: " + value);
            }
        }
    }
}
