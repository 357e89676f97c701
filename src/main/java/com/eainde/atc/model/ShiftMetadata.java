package com.eainde.atc.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Scheduling metadata for one controller shift, keyed by {@code shiftId}.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ShiftMetadata(
        @JsonProperty("shiftId")         String shiftId,
        @JsonProperty("controllerId")    String controllerId,
        @JsonProperty("facility")        String facility,
        @JsonProperty("startTime")       Instant startTime,
        @JsonProperty("endTime")         Instant endTime,
        @JsonProperty("position")        String position,
        @JsonProperty("scheduleType")    String scheduleType,
        @JsonProperty("trafficCountAvg") Double trafficCountAvg
) {

    /**
     * Shift length in fractional hours. Only meaningful once {@link #missingRequiredFields()} is empty.
     */
    @JsonIgnore
    public double hoursOnDuty() {
        return Duration.between(startTime, endTime).toMillis() / 3_600_000d;
    }

    /**
     * Names of required fields that are absent or blank, plus a marker when the
     * shift does not end after it starts.
     */
    @JsonIgnore
    public List<String> missingRequiredFields() {
        List<String> missing = new ArrayList<>();
        if (isBlank(shiftId)) missing.add("shiftId");
        if (isBlank(controllerId)) missing.add("controllerId");
        if (isBlank(facility)) missing.add("facility");
        if (startTime == null) missing.add("startTime");
        if (endTime == null) missing.add("endTime");
        if (isBlank(position)) missing.add("position");
        if (isBlank(scheduleType)) missing.add("scheduleType");
        if (startTime != null && endTime != null && !endTime.isAfter(startTime)) {
            missing.add("endTime (must be after startTime)");
        }
        return missing;
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
