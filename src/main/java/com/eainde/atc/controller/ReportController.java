package com.eainde.atc.controller;

import com.eainde.atc.exception.ReportNotFoundException;
import com.eainde.atc.model.AnalysisReport;
import com.eainde.atc.model.PriorityLevel;
import com.eainde.atc.store.ReportQuery;
import com.eainde.atc.store.ReportStore;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/v1/reports")
@RequiredArgsConstructor
public class ReportController {

    private final ReportStore reportStore;

    @GetMapping("/{shiftId}")
    public ResponseEntity<AnalysisReport> getReport(@PathVariable String shiftId) {
        return reportStore.get(shiftId)
                .map(ResponseEntity::ok)
                .orElseThrow(() -> new ReportNotFoundException(shiftId));
    }

    /**
     * Lists reports newest first, optionally filtered by priority level and attention flag.
     */
    @GetMapping
    public ResponseEntity<Map<String, Object>> listReports(
            @RequestParam(required = false) String priorityLevel,
            @RequestParam(required = false) Boolean requiresAttention,
            @RequestParam(defaultValue = "50") int limit,
            @RequestParam(defaultValue = "0") int skip) {

        PriorityLevel priority = priorityLevel != null ? PriorityLevel.fromValue(priorityLevel) : null;
        ReportQuery query = new ReportQuery(priority, requiresAttention, limit, skip);
        List<AnalysisReport> reports = reportStore.find(query);

        Map<String, Object> response = new LinkedHashMap<>();
        response.put("count", reports.size());
        response.put("limit", limit);
        response.put("skip", skip);
        response.put("reports", reports);
        return ResponseEntity.ok(response);
    }
}
