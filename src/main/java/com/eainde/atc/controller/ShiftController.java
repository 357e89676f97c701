package com.eainde.atc.controller;

import com.eainde.atc.exception.ShiftNotFoundException;
import com.eainde.atc.model.ShiftMetadata;
import com.eainde.atc.model.TranscriptEntry;
import com.eainde.atc.source.JdbcShiftDataRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Registers the inputs of an analysis: shift metadata and the diarized transcript.
 */
@RestController
@RequestMapping("/api/v1/shifts/{shiftId}")
@RequiredArgsConstructor
@Slf4j
public class ShiftController {

    private final JdbcShiftDataRepository shiftData;

    @PutMapping
    public ResponseEntity<ShiftMetadata> saveMetadata(@PathVariable String shiftId,
                                                      @RequestBody ShiftMetadata body) {
        ShiftMetadata metadata = new ShiftMetadata(shiftId, body.controllerId(), body.facility(),
                body.startTime(), body.endTime(), body.position(), body.scheduleType(), body.trafficCountAvg());
        List<String> missing = metadata.missingRequiredFields();
        if (!missing.isEmpty()) {
            throw new IllegalArgumentException("Shift metadata is missing required fields: " + missing);
        }
        shiftData.saveMetadata(metadata);
        log.info("Registered metadata for shift {}", shiftId);
        return ResponseEntity.ok(metadata);
    }

    @GetMapping
    public ResponseEntity<ShiftMetadata> getMetadata(@PathVariable String shiftId) {
        return shiftData.findMetadata(shiftId)
                .map(ResponseEntity::ok)
                .orElseThrow(() -> new ShiftNotFoundException(shiftId));
    }

    @PutMapping("/transcript")
    public ResponseEntity<Map<String, Object>> saveTranscript(@PathVariable String shiftId,
                                                              @RequestBody List<TranscriptEntryRequest> body) {
        List<TranscriptEntry> entries = new ArrayList<>(body.size());
        for (int i = 0; i < body.size(); i++) {
            TranscriptEntryRequest request = body.get(i);
            if (request == null) {
                throw new IllegalArgumentException("Transcript entry " + i + " is null");
            }
            entries.add(request.toEntry(i, () -> shiftStart(shiftId)));
        }
        shiftData.saveTranscript(shiftId, entries);
        log.info("Registered transcript for shift {} ({} entries)", shiftId, entries.size());
        return ResponseEntity.ok(Map.of("shiftId", shiftId, "entries", entries.size()));
    }

    private Instant shiftStart(String shiftId) {
        return shiftData.findMetadata(shiftId)
                .map(ShiftMetadata::startTime)
                .orElseThrow(() -> new IllegalArgumentException(
                        "Register metadata for shift " + shiftId + " before uploading ISO-8601 timestamps"));
    }
}
