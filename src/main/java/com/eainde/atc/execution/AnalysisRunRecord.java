package com.eainde.atc.execution;

import com.eainde.atc.exception.FailureCategory;
import com.eainde.atc.pipeline.AnalysisRun;
import com.eainde.atc.pipeline.AnalysisState;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.Getter;
import lombok.Setter;

import java.time.Instant;

@Getter
@Setter
@Entity
@Table(name = "ANALYSIS_RUN")
public class AnalysisRunRecord {
    @Id
    private String runId;
    private String shiftId;
    @Enumerated(EnumType.STRING)
    private AnalysisState status;
    @Enumerated(EnumType.STRING)
    private FailureCategory failureCategory;
    @Column(length = 2000)
    private String failureReason;
    private Instant startedAt;
    private Instant completedAt;

    public AnalysisRunRecord() {}

    public static AnalysisRunRecord from(AnalysisRun run) {
        AnalysisRunRecord record = new AnalysisRunRecord();
        record.runId = run.runId();
        record.shiftId = run.shiftId();
        record.status = run.state();
        record.failureCategory = run.failureCategory();
        record.failureReason = truncate(run.failureReason());
        record.startedAt = run.startedAt();
        record.completedAt = run.completedAt();
        return record;
    }

    public AnalysisRun toRun() {
        return new AnalysisRun(runId, shiftId, status, failureCategory, failureReason, startedAt, completedAt);
    }

    private static String truncate(String reason) {
        return reason != null && reason.length() > 2000 ? reason.substring(0, 2000) : reason;
    }
}
