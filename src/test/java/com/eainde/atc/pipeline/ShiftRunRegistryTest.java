package com.eainde.atc.pipeline;

import com.eainde.atc.exception.FailureCategory;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

class ShiftRunRegistryTest {

    private final ShiftRunRegistry registry = new ShiftRunRegistry();

    @Test
    @DisplayName("second start while running is rejected")
    void rejectsWhileRunning() {
        Optional<AnalysisRun> first = registry.tryStart("S1");
        Optional<AnalysisRun> second = registry.tryStart("S1");

        assertThat(first).isPresent();
        assertThat(second).isEmpty();
        assertThat(registry.find("S1")).contains(first.get());
    }

    @Test
    @DisplayName("different shifts run independently")
    void independentShifts() {
        assertThat(registry.tryStart("S1")).isPresent();
        assertThat(registry.tryStart("S2")).isPresent();
    }

    @Test
    @DisplayName("terminal run releases the guard and stays visible")
    void terminalReleasesGuard() {
        AnalysisRun run = registry.tryStart("S1").orElseThrow();

        Optional<AnalysisRun> failed = registry.fail("S1", run.runId(), FailureCategory.BACKEND_TIMEOUT, "BACKEND_TIMEOUT: slow");

        assertThat(failed).hasValueSatisfying(f -> {
            assertThat(f.state()).isEqualTo(AnalysisState.FAILED);
            assertThat(f.failureCategory()).isEqualTo(FailureCategory.BACKEND_TIMEOUT);
            assertThat(f.completedAt()).isNotNull();
        });
        assertThat(registry.find("S1").orElseThrow().state()).isEqualTo(AnalysisState.FAILED);

        AnalysisRun next = registry.tryStart("S1").orElseThrow();
        assertThat(next.runId()).isNotEqualTo(run.runId());
    }

    @Test
    @DisplayName("transitions are idempotent and ignore stale run ids")
    void idempotentFinish() {
        AnalysisRun run = registry.tryStart("S1").orElseThrow();

        assertThat(registry.complete("S1", "other-run")).isEmpty();
        assertThat(registry.complete("S1", run.runId())).isPresent();
        assertThat(registry.fail("S1", run.runId(), FailureCategory.CANCELLED, "late")).isEmpty();
        assertThat(registry.find("S1").orElseThrow().state()).isEqualTo(AnalysisState.COMPLETE);
        assertThat(registry.complete("unknown", run.runId())).isEmpty();
    }

    @Test
    @DisplayName("exactly one of many concurrent starts wins")
    void concurrentStarts() throws Exception {
        int threads = 16;
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        CountDownLatch go = new CountDownLatch(1);
        try {
            List<Future<Optional<AnalysisRun>>> results = new ArrayList<>();
            for (int i = 0; i < threads; i++) {
                Callable<Optional<AnalysisRun>> start = () -> {
                    go.await();
                    return registry.tryStart("S1");
                };
                results.add(pool.submit(start));
            }
            go.countDown();

            int winners = 0;
            for (Future<Optional<AnalysisRun>> result : results) {
                if (result.get().isPresent()) {
                    winners++;
                }
            }
            assertThat(winners).isEqualTo(1);
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    @DisplayName("completeWith runs the commit and completes the run")
    void completeWithCommits() {
        AnalysisRun run = registry.tryStart("S1").orElseThrow();
        List<String> committed = new ArrayList<>();

        Optional<AnalysisRun> done = registry.completeWith("S1", run.runId(), () -> committed.add("report"));

        assertThat(committed).containsExactly("report");
        assertThat(done).hasValueSatisfying(d -> assertThat(d.state()).isEqualTo(AnalysisState.COMPLETE));
        assertThat(registry.isCurrent("S1", run.runId())).isFalse();
    }

    @Test
    @DisplayName("completeWith skips the commit for a cancelled run")
    void completeWithSkipsCancelled() {
        AnalysisRun run = registry.tryStart("S1").orElseThrow();
        registry.fail("S1", run.runId(), FailureCategory.CANCELLED, "CANCELLED: cancelled by request");
        List<String> committed = new ArrayList<>();

        Optional<AnalysisRun> done = registry.completeWith("S1", run.runId(), () -> committed.add("report"));

        assertThat(done).isEmpty();
        assertThat(committed).isEmpty();
    }

    @Test
    @DisplayName("cancel arriving during a commit waits and then finds the run complete")
    void cancelDuringCommit() throws Exception {
        AnalysisRun run = registry.tryStart("S1").orElseThrow();
        CountDownLatch inCommit = new CountDownLatch(1);
        CountDownLatch finishCommit = new CountDownLatch(1);

        ExecutorService pool = Executors.newFixedThreadPool(2);
        try {
            Future<Optional<AnalysisRun>> commit = pool.submit(() -> registry.completeWith("S1", run.runId(), () -> {
                inCommit.countDown();
                try {
                    finishCommit.await();
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            }));
            assertThat(inCommit.await(5, TimeUnit.SECONDS)).isTrue();
            Future<Optional<AnalysisRun>> cancel = pool.submit(() ->
                    registry.fail("S1", run.runId(), FailureCategory.CANCELLED, "CANCELLED: cancelled by request"));
            Thread.sleep(50);
            assertThat(cancel.isDone()).isFalse();

            finishCommit.countDown();

            assertThat(commit.get(5, TimeUnit.SECONDS)).isPresent();
            assertThat(cancel.get(5, TimeUnit.SECONDS)).isEmpty();
            assertThat(registry.find("S1")).get().extracting(AnalysisRun::state).isEqualTo(AnalysisState.COMPLETE);
        } finally {
            pool.shutdownNow();
        }
    }
}
