package com.eainde.atc.source;

import com.eainde.atc.exception.InputMissingException;
import com.eainde.atc.model.ShiftMetadata;
import com.eainde.atc.model.TranscriptEntry;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.dao.EmptyResultDataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Shift metadata and transcripts stored as JSON documents, one row per shift.
 */
@Repository
public class JdbcShiftDataRepository implements ShiftMetadataSource, TranscriptSource {

    private static final TypeReference<List<TranscriptEntry>> ENTRY_LIST = new TypeReference<>() {};

    private final JdbcTemplate jdbcTemplate;
    private final ObjectMapper objectMapper;

    public JdbcShiftDataRepository(JdbcTemplate jdbcTemplate, ObjectMapper objectMapper) {
        this.jdbcTemplate = jdbcTemplate;
        this.objectMapper = objectMapper;
    }

    // =========================================================================
    //  Metadata
    // =========================================================================

    public void saveMetadata(ShiftMetadata metadata) {
        try {
            String json = objectMapper.writeValueAsString(metadata);
            jdbcTemplate.update("""
                    MERGE INTO shift_metadata (shift_id, metadata_json, updated_at)
                    KEY (shift_id)
                    VALUES (?, ?, CURRENT_TIMESTAMP)
                    """, metadata.shiftId(), json);
        } catch (JsonProcessingException e) {
            throw new RuntimeException("Failed to serialize metadata for shift " + metadata.shiftId(), e);
        }
    }

    @Override
    public Optional<ShiftMetadata> findMetadata(String shiftId) {
        try {
            String json = jdbcTemplate.queryForObject(
                    "SELECT metadata_json FROM shift_metadata WHERE shift_id = ?",
                    String.class,
                    shiftId);
            return Optional.of(objectMapper.readValue(json, ShiftMetadata.class));
        } catch (EmptyResultDataAccessException e) {
            return Optional.empty();
        } catch (JsonProcessingException e) {
            throw new RuntimeException("Failed to deserialize metadata for shift " + shiftId, e);
        }
    }

    // =========================================================================
    //  Transcript
    // =========================================================================

    /**
     * Replaces the shift's transcript. Entries are stored ordered by timestamp.
     */
    public void saveTranscript(String shiftId, List<TranscriptEntry> entries) {
        List<TranscriptEntry> ordered = entries.stream()
                .sorted(Comparator.comparingDouble(TranscriptEntry::timestamp))
                .toList();
        try {
            String json = objectMapper.writeValueAsString(ordered);
            jdbcTemplate.update("""
                    MERGE INTO shift_transcript (shift_id, segments_json, updated_at)
                    KEY (shift_id)
                    VALUES (?, ?, CURRENT_TIMESTAMP)
                    """, shiftId, json);
        } catch (JsonProcessingException e) {
            throw new RuntimeException("Failed to serialize transcript for shift " + shiftId, e);
        }
    }

    @Override
    public List<TranscriptEntry> fetchTranscript(String shiftId) {
        try {
            String json = jdbcTemplate.queryForObject(
                    "SELECT segments_json FROM shift_transcript WHERE shift_id = ?",
                    String.class,
                    shiftId);
            return objectMapper.readValue(json, ENTRY_LIST);
        } catch (EmptyResultDataAccessException e) {
            throw new InputMissingException("No transcript for shift " + shiftId);
        } catch (JsonProcessingException e) {
            throw new RuntimeException("Failed to deserialize transcript for shift " + shiftId, e);
        }
    }
}
