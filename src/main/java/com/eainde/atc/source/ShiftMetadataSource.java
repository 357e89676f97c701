package com.eainde.atc.source;

import com.eainde.atc.exception.InputMissingException;
import com.eainde.atc.model.ShiftMetadata;

import java.util.Optional;

public interface ShiftMetadataSource {

    Optional<ShiftMetadata> findMetadata(String shiftId);

    /**
     * @throws InputMissingException when no metadata was registered for the shift
     */
    default ShiftMetadata fetchMetadata(String shiftId) {
        return findMetadata(shiftId)
                .orElseThrow(() -> new InputMissingException("No metadata for shift " + shiftId));
    }
}
