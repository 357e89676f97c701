package com.eainde.atc.agent;

import com.eainde.atc.model.TranscriptEntry;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Renders transcript entries as prompt lines: {@code [12.0s] PILOT: climb flight level two four zero}.
 */
@Component
public class TranscriptFormatter {

    static final String NO_TRANSMISSIONS = "(no transmissions)";

    public String formatLine(TranscriptEntry entry) {
        String speaker = entry.speaker() != null ? entry.speaker().getValue().toUpperCase(Locale.ROOT) : "UNKNOWN";
        String text = entry.text() != null ? entry.text() : "";
        return String.format(Locale.ROOT, "[%.1fs] %s: %s", entry.timestamp(), speaker, text);
    }

    public String format(List<TranscriptEntry> entries) {
        if (entries == null || entries.isEmpty()) {
            return NO_TRANSMISSIONS;
        }
        return entries.stream()
                .map(this::formatLine)
                .collect(Collectors.joining("\n"));
    }

    /**
     * Picks up to {@code sampleSize} entries spread over the whole shift:
     * indices 0, stride, 2*stride, ... with {@code stride = max(1, size / sampleSize)}.
     */
    public List<TranscriptEntry> sample(List<TranscriptEntry> entries, int sampleSize) {
        if (entries == null || entries.isEmpty() || sampleSize < 1) {
            return List.of();
        }
        int stride = Math.max(1, entries.size() / sampleSize);
        List<TranscriptEntry> samples = new ArrayList<>(sampleSize);
        for (int i = 0; i < entries.size() && samples.size() < sampleSize; i += stride) {
            samples.add(entries.get(i));
        }
        return samples;
    }
}
