package com.eainde.atc.metrics;

import com.eainde.atc.model.ComputedMetrics;
import com.eainde.atc.model.TranscriptEntry;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Derives response latency and hesitation signals from a diarized transcript.
 *
 * <p>Pure and deterministic: no I/O, no shared state. A transcript without any
 * pilot-then-controller adjacency produces zero latencies rather than an error.</p>
 *
 * <ul>
 *   <li><b>Latency</b>: for each adjacent pilot → controller pair,
 *       {@code controller.timestamp - pilot.timestamp}. Negative gaps are skipped.</li>
 *   <li><b>Hesitations</b>: filler words (uh, um, er, ah) matched as whole words plus
 *       ellipsis markers, counted across controller utterances only.</li>
 * </ul>
 */
@Component
public class TranscriptMetricsCalculator {

    static final List<String> FILLER_WORDS = List.of("uh", "um", "er", "ah");
    static final List<String> ELLIPSIS_MARKERS = List.of("...", "…");

    private static final Pattern FILLER_PATTERN = Pattern.compile(
            "\\b(?:" + String.join("|", FILLER_WORDS) + ")\\b");

    public ComputedMetrics compute(List<TranscriptEntry> transcript) {
        if (transcript == null || transcript.isEmpty()) {
            return ComputedMetrics.empty();
        }

        double sum = 0;
        double max = 0;
        double min = Double.MAX_VALUE;
        int pairs = 0;

        for (int i = 0; i < transcript.size() - 1; i++) {
            TranscriptEntry current = transcript.get(i);
            TranscriptEntry next = transcript.get(i + 1);
            if (current == null || next == null || !current.isPilot() || !next.isController()) {
                continue;
            }
            double latency = next.timestamp() - current.timestamp();
            if (latency < 0) {
                continue;
            }
            sum += latency;
            max = Math.max(max, latency);
            min = Math.min(min, latency);
            pairs++;
        }

        double avg = pairs > 0 ? sum / pairs : 0;
        if (pairs == 0) {
            min = 0;
        }

        return new ComputedMetrics(avg, max, min, countHesitations(transcript), transcript.size());
    }

    /**
     * Counts filler tokens in controller speech. Pilot transmissions are ignored.
     */
    public int countHesitations(List<TranscriptEntry> transcript) {
        if (transcript == null) {
            return 0;
        }
        int count = 0;
        for (TranscriptEntry entry : transcript) {
            if (entry == null || !entry.isController() || entry.text() == null) {
                continue;
            }
            count += countInUtterance(entry.text().toLowerCase(Locale.ROOT));
        }
        return count;
    }

    private int countInUtterance(String text) {
        int count = 0;
        Matcher matcher = FILLER_PATTERN.matcher(text);
        while (matcher.find()) {
            count++;
        }
        for (String marker : ELLIPSIS_MARKERS) {
            count += countOccurrences(text, marker);
        }
        return count;
    }

    private static int countOccurrences(String text, String token) {
        int count = 0;
        int from = 0;
        int idx;
        while ((idx = text.indexOf(token, from)) >= 0) {
            count++;
            from = idx + token.length();
        }
        return count;
    }
}
