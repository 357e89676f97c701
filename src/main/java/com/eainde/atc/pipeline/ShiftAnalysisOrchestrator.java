package com.eainde.atc.pipeline;

import com.eainde.atc.agent.FatigueAgent;
import com.eainde.atc.agent.SafetyAgent;
import com.eainde.atc.agent.SummarizerAgent;
import com.eainde.atc.exception.AnalysisCancelledException;
import com.eainde.atc.exception.AnalysisException;
import com.eainde.atc.exception.FailureCategory;
import com.eainde.atc.exception.InputMissingException;
import com.eainde.atc.metrics.TranscriptMetricsCalculator;
import com.eainde.atc.model.AnalysisReport;
import com.eainde.atc.model.ComputedMetrics;
import com.eainde.atc.model.FatigueResult;
import com.eainde.atc.model.SafetyResult;
import com.eainde.atc.model.ShiftMetadata;
import com.eainde.atc.model.SummaryResult;
import com.eainde.atc.model.TranscriptEntry;
import com.eainde.atc.source.ShiftMetadataSource;
import com.eainde.atc.source.TranscriptSource;
import com.eainde.atc.store.ReportStore;
import lombok.extern.log4j.Log4j2;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;

/**
 * Runs the analysis pipeline for one shift.
 *
 * <pre>
 * load metadata + transcript → compute metrics
 *   → Wave 1: fatigue ∥ safety       (two Futures, joined)
 *   → Wave 2: summarizer             (fan-in, needs both)
 *   → assemble report → store
 * </pre>
 *
 * <p>Any failure propagates as an {@link AnalysisException}; nothing is stored unless every stage
 * succeeded. When one wave-1 agent fails, the other is cancelled.</p>
 *
 * <p>The report is written through {@link ShiftRunRegistry#completeWith}, so it is stored only while
 * the run is still the shift's running run, and the run turns {@code COMPLETE} in the same step.
 * Starting and cancelling runs is left to {@link AnalysisJobService}.</p>
 */
@Log4j2
@Component
public class ShiftAnalysisOrchestrator {

    private final ShiftMetadataSource metadataSource;
    private final TranscriptSource transcriptSource;
    private final TranscriptMetricsCalculator metricsCalculator;
    private final FatigueAgent fatigueAgent;
    private final SafetyAgent safetyAgent;
    private final SummarizerAgent summarizerAgent;
    private final ReportStore reportStore;
    private final ShiftRunRegistry registry;
    private final ExecutorService executor;

    public ShiftAnalysisOrchestrator(ShiftMetadataSource metadataSource,
                                     TranscriptSource transcriptSource,
                                     TranscriptMetricsCalculator metricsCalculator,
                                     FatigueAgent fatigueAgent,
                                     SafetyAgent safetyAgent,
                                     SummarizerAgent summarizerAgent,
                                     ReportStore reportStore,
                                     ShiftRunRegistry registry,
                                     ExecutorService analysisExecutor) {
        this.metadataSource = metadataSource;
        this.transcriptSource = transcriptSource;
        this.metricsCalculator = metricsCalculator;
        this.fatigueAgent = fatigueAgent;
        this.safetyAgent = safetyAgent;
        this.summarizerAgent = summarizerAgent;
        this.reportStore = reportStore;
        this.registry = registry;
        this.executor = analysisExecutor;
    }

    // =========================================================================
    //  Public API
    // =========================================================================

    /**
     * @param run the shift's running run, as returned by {@link ShiftRunRegistry#tryStart}
     * @return the stored report; the run is {@code COMPLETE} when this returns
     * @throws AnalysisException on any stage failure; the category says which
     */
    public AnalysisReport analyze(AnalysisRun run) {
        String shiftId = run.shiftId();
        long start = System.currentTimeMillis();

        ShiftMetadata metadata = loadMetadata(shiftId);
        List<TranscriptEntry> transcript = transcriptSource.fetchTranscript(shiftId);
        ComputedMetrics metrics = metricsCalculator.compute(transcript);
        log.info("Shift {}: {} transmissions, avg latency {}s, {} hesitations",
                shiftId, metrics.totalTransmissions(), metrics.avgResponseSeconds(), metrics.hesitationCount());

        // ── Wave 1 ──
        Future<FatigueResult> fatigueTask = executor.submit(() -> fatigueAgent.analyze(metadata, transcript, metrics));
        Future<SafetyResult> safetyTask = executor.submit(() -> safetyAgent.analyze(metadata, transcript));

        FatigueResult fatigue = await(fatigueTask, "fatigue", safetyTask);
        SafetyResult safety = await(safetyTask, "safety", fatigueTask);
        log.info("Shift {}: fatigue score {} ({}), safety score {} with {} issue(s)",
                shiftId, fatigue.score(), fatigue.severity().getValue(), safety.score(), safety.issuesFound().size());

        // ── Wave 2 ──
        SummaryResult summary = summarizerAgent.summarize(metadata, fatigue, safety);

        if (Thread.currentThread().isInterrupted()) {
            throw new AnalysisCancelledException("Analysis of shift " + shiftId + " cancelled before storing");
        }
        AnalysisReport report = new AnalysisReport(shiftId, metadata, fatigue, safety, summary, Instant.now());
        if (registry.completeWith(shiftId, run.runId(), () -> reportStore.put(shiftId, report)).isEmpty()) {
            throw new AnalysisCancelledException("Run " + run.runId() + " of shift " + shiftId
                    + " is no longer running, report discarded");
        }

        log.info("Shift {} analyzed in {}ms: priority {}, requires attention {}",
                shiftId, System.currentTimeMillis() - start,
                summary.priorityLevel().getValue(), report.requiresAttention());
        return report;
    }

    // =========================================================================
    //  Internals
    // =========================================================================

    private ShiftMetadata loadMetadata(String shiftId) {
        ShiftMetadata metadata = metadataSource.fetchMetadata(shiftId);
        List<String> missing = metadata.missingRequiredFields();
        if (!missing.isEmpty()) {
            throw new InputMissingException("Metadata for shift " + shiftId + " is incomplete: " + missing);
        }
        return metadata;
    }

    private <T> T await(Future<T> task, String stage, Future<?> sibling) {
        try {
            return task.get();
        } catch (InterruptedException e) {
            task.cancel(true);
            sibling.cancel(true);
            Thread.currentThread().interrupt();
            throw new AnalysisCancelledException("Interrupted while waiting for " + stage + " analysis");
        } catch (ExecutionException e) {
            sibling.cancel(true);
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            if (cause instanceof AnalysisException analysisException) {
                throw analysisException;
            }
            throw new AnalysisException(FailureCategory.UNEXPECTED,
                    stage + " analysis failed: " + cause.getMessage(), cause);
        }
    }
}
