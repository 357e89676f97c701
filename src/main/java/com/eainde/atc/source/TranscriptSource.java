package com.eainde.atc.source;

import com.eainde.atc.model.TranscriptEntry;

import java.util.List;

public interface TranscriptSource {

    /**
     * @return the shift's entries ordered by timestamp; may be empty
     * @throws com.eainde.atc.exception.InputMissingException when no transcript was registered for the shift
     */
    List<TranscriptEntry> fetchTranscript(String shiftId);
}
