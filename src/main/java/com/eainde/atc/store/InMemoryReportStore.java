package com.eainde.atc.store;

import com.eainde.atc.model.AnalysisReport;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Repository;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Non-durable store for local runs and tests ({@code atc.report-store.type=memory}).
 */
@Repository
@ConditionalOnProperty(name = "atc.report-store.type", havingValue = "memory")
public class InMemoryReportStore implements ReportStore {

    private final Map<String, AnalysisReport> reports = new ConcurrentHashMap<>();

    @Override
    public void put(String shiftId, AnalysisReport report) {
        reports.put(shiftId, report);
    }

    @Override
    public Optional<AnalysisReport> get(String shiftId) {
        return Optional.ofNullable(reports.get(shiftId));
    }

    @Override
    public List<AnalysisReport> find(ReportQuery query) {
        return reports.values().stream()
                .filter(query::matches)
                .sorted(Comparator.comparing(AnalysisReport::generatedAt).reversed()
                        .thenComparing(AnalysisReport::shiftId))
                .skip(query.skip())
                .limit(query.limit())
                .toList();
    }
}
