package com.eainde.atc.store;

import com.eainde.atc.exception.ReportStoreException;
import com.eainde.atc.model.AnalysisReport;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.log4j.Log4j2;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.EmptyResultDataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

import java.sql.Timestamp;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Reports as JSON documents in {@code analysis_report}. Priority and attention flag are
 * copied into their own columns for listing queries.
 */
@Log4j2
@Repository
@ConditionalOnProperty(name = "atc.report-store.type", havingValue = "jdbc", matchIfMissing = true)
public class JdbcReportStore implements ReportStore {

    private final JdbcTemplate jdbcTemplate;
    private final ObjectMapper objectMapper;

    public JdbcReportStore(JdbcTemplate jdbcTemplate, ObjectMapper objectMapper) {
        this.jdbcTemplate = jdbcTemplate;
        this.objectMapper = objectMapper;
    }

    @Override
    public void put(String shiftId, AnalysisReport report) {
        try {
            String json = objectMapper.writeValueAsString(report);
            // single-row upsert
            jdbcTemplate.update("""
                    MERGE INTO analysis_report (shift_id, report_json, priority_level, requires_attention, generated_at)
                    KEY (shift_id)
                    VALUES (?, ?, ?, ?, ?)
                    """,
                    shiftId,
                    json,
                    report.priorityLevel() != null ? report.priorityLevel().getValue() : null,
                    report.requiresAttention(),
                    Timestamp.from(report.generatedAt()));
            log.debug("Stored report for shift {}", shiftId);
        } catch (JsonProcessingException e) {
            throw new ReportStoreException("Failed to serialize report for shift " + shiftId, e);
        } catch (DataAccessException e) {
            throw new ReportStoreException("Failed to store report for shift " + shiftId, e);
        }
    }

    @Override
    public Optional<AnalysisReport> get(String shiftId) {
        try {
            String json = jdbcTemplate.queryForObject(
                    "SELECT report_json FROM analysis_report WHERE shift_id = ?",
                    String.class,
                    shiftId);
            return Optional.of(read(json));
        } catch (EmptyResultDataAccessException e) {
            return Optional.empty();
        }
    }

    @Override
    public List<AnalysisReport> find(ReportQuery query) {
        StringBuilder sql = new StringBuilder("SELECT report_json FROM analysis_report WHERE 1 = 1");
        List<Object> args = new ArrayList<>();
        if (query.priorityLevel() != null) {
            sql.append(" AND priority_level = ?");
            args.add(query.priorityLevel().getValue());
        }
        if (query.requiresAttention() != null) {
            sql.append(" AND requires_attention = ?");
            args.add(query.requiresAttention());
        }
        sql.append(" ORDER BY generated_at DESC, shift_id LIMIT ? OFFSET ?");
        args.add(query.limit());
        args.add(query.skip());

        return jdbcTemplate.query(sql.toString(), (rs, rowNum) -> read(rs.getString(1)), args.toArray());
    }

    private AnalysisReport read(String json) {
        try {
            return objectMapper.readValue(json, AnalysisReport.class);
        } catch (JsonProcessingException e) {
            throw new RuntimeException("Failed to deserialize AnalysisReport", e);
        }
    }
}
