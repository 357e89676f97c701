package com.eainde.atc.controller;

import com.eainde.atc.model.ShiftMetadata;
import com.eainde.atc.model.Speaker;
import com.eainde.atc.model.TranscriptEntry;
import com.eainde.atc.source.JdbcShiftDataRepository;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(ShiftController.class)
class ShiftControllerTest {

    @Autowired private MockMvc mockMvc;

    @MockBean private JdbcShiftDataRepository shiftData;

    @Test
    @DisplayName("PUT metadata stores it under the path shift id")
    void saveMetadata() throws Exception {
        mockMvc.perform(put("/api/v1/shifts/S1")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"controllerId": "CTL-042", "facility": "KJFK",
                                 "startTime": "2026-03-01T22:00:00Z", "endTime": "2026-03-02T06:00:00Z",
                                 "position": "Approach", "scheduleType": "night", "trafficCountAvg": 31.5}
                                """))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.shiftId").value("S1"));

        ArgumentCaptor<ShiftMetadata> saved = ArgumentCaptor.forClass(ShiftMetadata.class);
        verify(shiftData).saveMetadata(saved.capture());
        assertThat(saved.getValue().shiftId()).isEqualTo("S1");
        assertThat(saved.getValue().hoursOnDuty()).isEqualTo(8.0);
    }

    @Test
    @DisplayName("PUT incomplete metadata: 400")
    void incompleteMetadata() throws Exception {
        mockMvc.perform(put("/api/v1/shifts/S1")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"controllerId\": \"CTL-042\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message").value(containsString("facility")));
        verify(shiftData, never()).saveMetadata(any());
    }

    @Test
    @DisplayName("PUT transcript stores entries")
    void saveTranscript() throws Exception {
        mockMvc.perform(put("/api/v1/shifts/S1/transcript")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                [{"timestamp": 0.0, "speaker": "pilot", "text": "ready"},
                                 {"timestamp": 2.0, "speaker": "controller", "text": "cleared", "confidence": 0.93}]
                                """))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.entries").value(2));

        verify(shiftData).saveTranscript(eq("S1"), eq(List.of(
                TranscriptEntry.of(0.0, Speaker.PILOT, "ready"),
                new TranscriptEntry(2.0, Speaker.CONTROLLER, "cleared", 0.93))));
    }

    @Test
    @DisplayName("entry without a timestamp: 400, nothing stored")
    void missingTimestamp() throws Exception {
        mockMvc.perform(put("/api/v1/shifts/S1/transcript")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                [{"timestamp": 0.0, "speaker": "pilot", "text": "ready"},
                                 {"speaker": "controller", "text": "cleared"}]
                                """))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message").value(containsString("entry 1 needs a timestamp")));
        verify(shiftData, never()).saveTranscript(any(), anyList());
    }

    @Test
    @DisplayName("ISO-8601 timestamps become seconds from the shift start")
    void isoTimestamps() throws Exception {
        when(shiftData.findMetadata("S1")).thenReturn(Optional.of(new ShiftMetadata("S1", "CTL-042", "KJFK",
                Instant.parse("2026-03-01T22:00:00Z"), Instant.parse("2026-03-02T06:00:00Z"),
                "Approach", "night", null)));

        mockMvc.perform(put("/api/v1/shifts/S1/transcript")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                [{"timestamp": "2026-03-01T22:00:10Z", "speaker": "pilot", "text": "ready"},
                                 {"timestamp": "2026-03-01T22:00:12.500Z", "speaker": "controller", "text": "cleared"},
                                 {"timestamp": "15.2", "speaker": "pilot", "text": "roger"}]
                                """))
                .andExpect(status().isOk());

        verify(shiftData).saveTranscript(eq("S1"), eq(List.of(
                TranscriptEntry.of(10.0, Speaker.PILOT, "ready"),
                TranscriptEntry.of(12.5, Speaker.CONTROLLER, "cleared"),
                TranscriptEntry.of(15.2, Speaker.PILOT, "roger"))));
    }

    @Test
    @DisplayName("ISO-8601 timestamps without registered metadata: 400")
    void isoWithoutMetadata() throws Exception {
        when(shiftData.findMetadata("S1")).thenReturn(Optional.empty());

        mockMvc.perform(put("/api/v1/shifts/S1/transcript")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("[{\"timestamp\": \"2026-03-01T22:00:10Z\", \"speaker\": \"pilot\", \"text\": \"ready\"}]"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message").value(containsString("Register metadata")));
        verify(shiftData, never()).saveTranscript(any(), anyList());
    }

    @Test
    @DisplayName("unparseable timestamp: 400")
    void badTimestamp() throws Exception {
        mockMvc.perform(put("/api/v1/shifts/S1/transcript")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("[{\"timestamp\": \"ten past\", \"speaker\": \"pilot\", \"text\": \"ready\"}]"))
                .andExpect(status().isBadRequest());
        verify(shiftData, never()).saveTranscript(any(), anyList());
    }

    @Test
    @DisplayName("unknown speaker: 400")
    void unknownSpeaker() throws Exception {
        mockMvc.perform(put("/api/v1/shifts/S1/transcript")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("[{\"timestamp\": 0.0, \"speaker\": \"atis\", \"text\": \"info alpha\"}]"))
                .andExpect(status().isBadRequest());
        verify(shiftData, never()).saveTranscript(any(), anyList());
    }

    @Test
    @DisplayName("GET unknown shift: 404")
    void unknownShift() throws Exception {
        when(shiftData.findMetadata("S9")).thenReturn(Optional.empty());

        mockMvc.perform(get("/api/v1/shifts/S9"))
                .andExpect(status().isNotFound());
    }
}
