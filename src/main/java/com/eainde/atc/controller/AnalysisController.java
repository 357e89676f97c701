package com.eainde.atc.controller;

import com.eainde.atc.exception.RunNotFoundException;
import com.eainde.atc.pipeline.AnalysisJobService;
import com.eainde.atc.pipeline.AnalysisRun;
import com.eainde.atc.pipeline.StartAnalysisResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/v1/shifts/{shiftId}/analysis")
@RequiredArgsConstructor
@Slf4j
public class AnalysisController {

    private final AnalysisJobService jobService;

    /**
     * 202 when a run was started, 409 when one is already in progress.
     */
    @PostMapping
    public ResponseEntity<StartAnalysisResponse> startAnalysis(@PathVariable String shiftId) {
        StartAnalysisResponse response = jobService.startAnalysis(shiftId);
        HttpStatus status = response.isAccepted() ? HttpStatus.ACCEPTED : HttpStatus.CONFLICT;
        return ResponseEntity.status(status).body(response);
    }

    @GetMapping
    public ResponseEntity<AnalysisRun> getStatus(@PathVariable String shiftId) {
        return ResponseEntity.ok(jobService.getStatus(shiftId));
    }

    @DeleteMapping
    public ResponseEntity<Map<String, Object>> cancelAnalysis(@PathVariable String shiftId) {
        if (!jobService.cancelAnalysis(shiftId)) {
            throw new RunNotFoundException(shiftId);
        }
        log.info("Cancellation requested for shift {}", shiftId);
        return ResponseEntity.status(HttpStatus.ACCEPTED)
                .body(Map.of("status", "cancelled", "shiftId", shiftId));
    }

    @GetMapping("/runs")
    public ResponseEntity<List<AnalysisRun>> getRunHistory(@PathVariable String shiftId) {
        return ResponseEntity.ok(jobService.getRunHistory(shiftId));
    }
}
