package com.eainde.atc.pipeline;

import com.eainde.atc.exception.FailureCategory;
import org.springframework.stereotype.Component;

import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.function.UnaryOperator;

/**
 * Run guard: at most one {@code RUNNING} analysis per shift.
 *
 * <p>Every transition goes through {@link ConcurrentMap#compute}, so check-and-set is atomic per shiftId.
 * Terminal runs stay in the map for status lookups until the next start replaces them.</p>
 */
@Component
public class ShiftRunRegistry {

    private final ConcurrentMap<String, AnalysisRun> runs = new ConcurrentHashMap<>();

    /**
     * @return the new run, or empty when the shift already has a run in progress
     */
    public Optional<AnalysisRun> tryStart(String shiftId) {
        AnalysisRun candidate = AnalysisRun.running(shiftId);
        AnalysisRun current = runs.compute(shiftId,
                (id, existing) -> existing != null && existing.isRunning() ? existing : candidate);
        return current == candidate ? Optional.of(candidate) : Optional.empty();
    }

    /**
     * @return the completed run, or empty when {@code runId} is no longer the running run of the shift
     */
    public Optional<AnalysisRun> complete(String shiftId, String runId) {
        return transition(shiftId, runId, AnalysisRun::complete);
    }

    /**
     * @return the failed run, or empty when {@code runId} is no longer the running run of the shift
     */
    public Optional<AnalysisRun> fail(String shiftId, String runId, FailureCategory category, String reason) {
        return transition(shiftId, runId, run -> run.fail(category, reason));
    }

    /**
     * Runs {@code commit} and marks the run complete as one step. A concurrent {@link #fail} for the
     * same shift waits for it, so a cancelled run never commits and a committed run can no longer be
     * cancelled. When {@code commit} throws, the run stays {@code RUNNING}.
     *
     * @return the completed run, or empty (without running {@code commit}) when {@code runId} is no
     *         longer the running run of the shift
     */
    public Optional<AnalysisRun> completeWith(String shiftId, String runId, Runnable commit) {
        return transition(shiftId, runId, run -> {
            commit.run();
            return run.complete();
        });
    }

    public boolean isCurrent(String shiftId, String runId) {
        AnalysisRun run = runs.get(shiftId);
        return run != null && run.isRunning() && run.runId().equals(runId);
    }

    public Optional<AnalysisRun> find(String shiftId) {
        return Optional.ofNullable(runs.get(shiftId));
    }

    private Optional<AnalysisRun> transition(String shiftId, String runId, UnaryOperator<AnalysisRun> change) {
        AnalysisRun[] result = new AnalysisRun[1];
        runs.computeIfPresent(shiftId, (id, existing) -> {
            if (!existing.isRunning() || !existing.runId().equals(runId)) {
                return existing;
            }
            result[0] = change.apply(existing);
            return result[0];
        });
        return Optional.ofNullable(result[0]);
    }
}
