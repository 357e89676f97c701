package com.eainde.atc.agent;

import com.eainde.atc.model.Speaker;
import com.eainde.atc.model.TranscriptEntry;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.IntStream;

import static org.assertj.core.api.Assertions.assertThat;

class TranscriptFormatterTest {

    private final TranscriptFormatter formatter = new TranscriptFormatter();

    private static List<TranscriptEntry> entries(int count) {
        return IntStream.range(0, count)
                .mapToObj(i -> TranscriptEntry.of(i * 3.0, i % 2 == 0 ? Speaker.PILOT : Speaker.CONTROLLER, "msg " + i))
                .toList();
    }

    @Test
    @DisplayName("line format is [t.s] SPEAKER: text")
    void formatsLine() {
        assertThat(formatter.formatLine(TranscriptEntry.of(12, Speaker.PILOT, "ready for departure")))
                .isEqualTo("[12.0s] PILOT: ready for departure");
        assertThat(formatter.formatLine(TranscriptEntry.of(7.25, Speaker.CONTROLLER, "hold short")))
                .isEqualTo("[7.3s] CONTROLLER: hold short");
    }

    @Test
    @DisplayName("empty transcript has a placeholder")
    void emptyTranscript() {
        assertThat(formatter.format(List.of())).isEqualTo(TranscriptFormatter.NO_TRANSMISSIONS);
    }

    @Test
    @DisplayName("sample is spread evenly across the shift")
    void evenSample() {
        List<TranscriptEntry> sample = formatter.sample(entries(25), 10);

        assertThat(sample).hasSize(10);
        assertThat(sample).extracting(TranscriptEntry::text)
                .containsExactly("msg 0", "msg 2", "msg 4", "msg 6", "msg 8",
                        "msg 10", "msg 12", "msg 14", "msg 16", "msg 18");
    }

    @Test
    @DisplayName("short transcript is sampled whole")
    void shortTranscript() {
        assertThat(formatter.sample(entries(4), 10)).hasSize(4);
        assertThat(formatter.sample(List.of(), 10)).isEmpty();
    }
}
