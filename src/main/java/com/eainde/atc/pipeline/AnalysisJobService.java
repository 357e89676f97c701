package com.eainde.atc.pipeline;

import com.eainde.atc.exception.AnalysisException;
import com.eainde.atc.exception.FailureCategory;
import com.eainde.atc.execution.AnalysisRunRecord;
import com.eainde.atc.execution.AnalysisRunRepository;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;

/**
 * Entry point for analysis runs: guards, schedules, cancels and reports on them.
 *
 * <h3>Lifecycle:</h3>
 * <pre>
 * startAnalysis → registry.tryStart ─ rejected ─→ "rejected"
 *                        │
 *                        └─ RUNNING → executor job → orchestrator.analyze
 *                                           ├─ success → COMPLETE (set together with the report write)
 *                                           └─ failure → FAILED (category + reason)
 * </pre>
 *
 * <p>A job whose run was cancelled before it started does no work. Whatever way a job ends,
 * its run leaves {@code RUNNING}.</p>
 *
 * <p>Run history is written to {@code analysis_run}. History write failures are logged and
 * never change the outcome of a run.</p>
 */
@Slf4j
@Service
public class AnalysisJobService {

    static final String MDC_SHIFT_ID = "shiftId";
    static final String MDC_RUN_ID = "runId";

    private final ShiftRunRegistry registry;
    private final ShiftAnalysisOrchestrator orchestrator;
    private final ExecutorService executor;
    private final AnalysisRunRepository runRepository;

    /** In-flight jobs by runId. */
    private final Map<String, Future<?>> jobs = new ConcurrentHashMap<>();

    public AnalysisJobService(ShiftRunRegistry registry,
                              ShiftAnalysisOrchestrator orchestrator,
                              ExecutorService analysisExecutor,
                              AnalysisRunRepository runRepository) {
        this.registry = registry;
        this.orchestrator = orchestrator;
        this.executor = analysisExecutor;
        this.runRepository = runRepository;
    }

    // =========================================================================
    //  Public API
    // =========================================================================

    /**
     * Starts an asynchronous run unless one is already in progress for the shift.
     * Never queues and never blocks on the run itself.
     */
    public StartAnalysisResponse startAnalysis(String shiftId) {
        Optional<AnalysisRun> started = registry.tryStart(shiftId);
        if (started.isEmpty()) {
            log.info("Analysis already in progress for shift {}, rejecting", shiftId);
            return StartAnalysisResponse.rejected(shiftId);
        }

        AnalysisRun run = started.get();
        recordHistory(run);
        jobs.values().removeIf(Future::isDone);

        try (MDC.MDCCloseable s = MDC.putCloseable(MDC_SHIFT_ID, shiftId);
             MDC.MDCCloseable r = MDC.putCloseable(MDC_RUN_ID, run.runId())) {
            jobs.put(run.runId(), executor.submit(() -> execute(run)));
            log.info("Analysis run {} scheduled", run.runId());
        } catch (RejectedExecutionException e) {
            finishFailed(run, FailureCategory.UNEXPECTED, "UNEXPECTED: executor rejected the run");
            throw new AnalysisException(FailureCategory.UNEXPECTED, "Could not schedule analysis of " + shiftId, e);
        }
        return StartAnalysisResponse.processing(shiftId);
    }

    /**
     * @return the latest run of the shift, or an {@code IDLE} placeholder when none exists
     */
    public AnalysisRun getStatus(String shiftId) {
        return registry.find(shiftId).orElseGet(() -> AnalysisRun.idle(shiftId));
    }

    /**
     * Marks the shift's running run as {@code FAILED/CANCELLED} and interrupts its job.
     * In-flight model calls are cancelled best-effort; no report is written.
     *
     * @return false when no run is in progress for the shift
     */
    public boolean cancelAnalysis(String shiftId) {
        Optional<AnalysisRun> running = registry.find(shiftId).filter(AnalysisRun::isRunning);
        if (running.isEmpty()) {
            return false;
        }
        AnalysisRun run = running.get();
        Optional<AnalysisRun> cancelled = registry.fail(shiftId, run.runId(),
                FailureCategory.CANCELLED, "CANCELLED: cancelled by request");
        if (cancelled.isEmpty()) {
            // finished on its own in the meantime
            return false;
        }
        recordHistory(cancelled.get());
        Future<?> job = jobs.remove(run.runId());
        if (job != null) {
            job.cancel(true);
        }
        log.info("Analysis run {} for shift {} cancelled", run.runId(), shiftId);
        return true;
    }

    /**
     * @return persisted runs of the shift, newest first
     */
    public List<AnalysisRun> getRunHistory(String shiftId) {
        return runRepository.findByShiftIdOrderByStartedAtDesc(shiftId).stream()
                .map(AnalysisRunRecord::toRun)
                .toList();
    }

    // =========================================================================
    //  Internals
    // =========================================================================

    private void execute(AnalysisRun run) {
        String shiftId = run.shiftId();
        try {
            if (!registry.isCurrent(shiftId, run.runId())) {
                log.info("Analysis run {} was cancelled before it started", run.runId());
                return;
            }
            orchestrator.analyze(run);
            registry.find(shiftId)
                    .filter(done -> done.runId().equals(run.runId()) && done.state() == AnalysisState.COMPLETE)
                    .ifPresent(done -> {
                        recordHistory(done);
                        log.info("Analysis run {} complete", run.runId());
                    });
        } catch (AnalysisException e) {
            finishFailed(run, e.getCategory(), e.toFailureReason());
        } catch (RuntimeException e) {
            log.error("Unexpected failure in analysis run {}", run.runId(), e);
            finishFailed(run, FailureCategory.UNEXPECTED, "UNEXPECTED: " + e.getMessage());
        } catch (Error e) {
            log.error("Fatal error in analysis run {}", run.runId(), e);
            finishFailed(run, FailureCategory.UNEXPECTED, "UNEXPECTED: " + e);
            throw e;
        } finally {
            jobs.remove(run.runId());
            finishFailed(run, FailureCategory.UNEXPECTED, "UNEXPECTED: analysis ended without storing a report");
        }
    }

    private void finishFailed(AnalysisRun run, FailureCategory category, String reason) {
        registry.fail(run.shiftId(), run.runId(), category, reason).ifPresent(failed -> {
            recordHistory(failed);
            log.warn("Analysis run {} for shift {} failed: {}", run.runId(), run.shiftId(), reason);
        });
    }

    private void recordHistory(AnalysisRun run) {
        try {
            runRepository.save(AnalysisRunRecord.from(run));
        } catch (RuntimeException e) {
            log.warn("Failed to record run {} ({}) in history: {}", run.runId(), run.state(), e.getMessage());
        }
    }
}
