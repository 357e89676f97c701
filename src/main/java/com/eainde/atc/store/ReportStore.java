package com.eainde.atc.store;

import com.eainde.atc.model.AnalysisReport;

import java.util.List;
import java.util.Optional;

/**
 * Persisted analysis reports keyed by shiftId.
 *
 * <p>{@link #put} replaces the whole report in one step: readers see the previous report,
 * nothing, or the complete new one. A successful put is visible to the next {@link #get}.</p>
 */
public interface ReportStore {

    /**
     * @throws com.eainde.atc.exception.ReportStoreException when the report could not be written
     */
    void put(String shiftId, AnalysisReport report);

    Optional<AnalysisReport> get(String shiftId);

    /**
     * @return matching reports, newest first
     */
    List<AnalysisReport> find(ReportQuery query);
}
