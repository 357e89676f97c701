package com.eainde.atc.pipeline;

import com.eainde.atc.exception.AnalysisCancelledException;
import com.eainde.atc.exception.BackendTimeoutException;
import com.eainde.atc.exception.FailureCategory;
import com.eainde.atc.execution.AnalysisRunRecord;
import com.eainde.atc.execution.AnalysisRunRepository;
import com.eainde.atc.thread.MdcAwareExecutorService;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.stubbing.Answer;
import org.slf4j.MDC;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.timeout;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class AnalysisJobServiceTest {

    private static final String SHIFT_ID = "SHIFT-9";

    @Mock private ShiftAnalysisOrchestrator orchestrator;
    @Mock private AnalysisRunRepository runRepository;

    private ExecutorService executor;
    private ShiftRunRegistry registry;
    private AnalysisJobService service;

    @BeforeEach
    void setUp() {
        executor = new MdcAwareExecutorService(Executors.newCachedThreadPool());
        registry = new ShiftRunRegistry();
        service = new AnalysisJobService(registry, orchestrator, executor, runRepository);
        lenient().when(runRepository.save(any(AnalysisRunRecord.class))).thenAnswer(inv -> inv.getArgument(0));
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    /** Stands in for a successful pipeline: stores nothing, completes the run. */
    private final Answer<Object> completesRun = inv -> {
        AnalysisRun run = inv.getArgument(0);
        registry.completeWith(run.shiftId(), run.runId(), () -> { });
        return null;
    };

    private AnalysisRun awaitTerminal(String shiftId) throws InterruptedException {
        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
        while (System.nanoTime() < deadline) {
            AnalysisRun run = service.getStatus(shiftId);
            if (run.state().isTerminal()) {
                return run;
            }
            Thread.sleep(10);
        }
        throw new AssertionError("Run for " + shiftId + " did not finish in time");
    }

    // =========================================================================
    //  Start / status
    // =========================================================================

    @Test
    @DisplayName("unknown shift reports IDLE")
    void idleStatus() {
        AnalysisRun status = service.getStatus("never-seen");

        assertThat(status.state()).isEqualTo(AnalysisState.IDLE);
        assertThat(status.runId()).isNull();
    }

    @Test
    @DisplayName("successful run ends COMPLETE and is recorded in history")
    void successfulRun() throws Exception {
        when(orchestrator.analyze(any(AnalysisRun.class))).thenAnswer(completesRun);

        StartAnalysisResponse response = service.startAnalysis(SHIFT_ID);

        assertThat(response.status()).isEqualTo(StartAnalysisResponse.PROCESSING);
        AnalysisRun run = awaitTerminal(SHIFT_ID);
        assertThat(run.state()).isEqualTo(AnalysisState.COMPLETE);
        assertThat(run.failureCategory()).isNull();

        ArgumentCaptor<AnalysisRunRecord> records = ArgumentCaptor.forClass(AnalysisRunRecord.class);
        verify(runRepository, timeout(2_000).times(2)).save(records.capture());
        assertThat(records.getAllValues()).extracting(AnalysisRunRecord::getStatus)
                .containsExactly(AnalysisState.RUNNING, AnalysisState.COMPLETE);
    }

    @Test
    @DisplayName("worker threads see shiftId and runId in the MDC")
    void mdcPropagated() throws Exception {
        Map<String, String> seen = new ConcurrentHashMap<>();
        when(orchestrator.analyze(any(AnalysisRun.class))).thenAnswer(inv -> {
            seen.put("shiftId", MDC.get(AnalysisJobService.MDC_SHIFT_ID));
            seen.put("runId", MDC.get(AnalysisJobService.MDC_RUN_ID));
            return completesRun.answer(inv);
        });

        service.startAnalysis(SHIFT_ID);
        AnalysisRun run = awaitTerminal(SHIFT_ID);

        assertThat(seen).containsEntry("shiftId", SHIFT_ID).containsEntry("runId", run.runId());
        assertThat(MDC.get(AnalysisJobService.MDC_SHIFT_ID)).isNull();
    }

    @Test
    @DisplayName("two concurrent starts: one processing, one rejected")
    void concurrentStarts() throws Exception {
        CountDownLatch release = new CountDownLatch(1);
        when(orchestrator.analyze(any(AnalysisRun.class))).thenAnswer(inv -> {
            release.await(5, TimeUnit.SECONDS);
            return completesRun.answer(inv);
        });

        ExecutorService callers = Executors.newFixedThreadPool(2);
        CountDownLatch go = new CountDownLatch(1);
        try {
            Callable<StartAnalysisResponse> start = () -> {
                go.await();
                return service.startAnalysis(SHIFT_ID);
            };
            Future<StartAnalysisResponse> a = callers.submit(start);
            Future<StartAnalysisResponse> b = callers.submit(start);
            go.countDown();

            List<String> statuses = List.of(a.get().status(), b.get().status());
            assertThat(statuses).containsExactlyInAnyOrder(
                    StartAnalysisResponse.PROCESSING, StartAnalysisResponse.REJECTED);
        } finally {
            release.countDown();
            callers.shutdownNow();
        }
        assertThat(awaitTerminal(SHIFT_ID).state()).isEqualTo(AnalysisState.COMPLETE);
    }

    // =========================================================================
    //  Failure / cancellation
    // =========================================================================

    @Nested
    @DisplayName("failure handling")
    class FailureHandling {

        @Test
        @DisplayName("timeout exhausted: FAILED with category and reason, then eligible again")
        void failedRunCanRestart() throws Exception {
            when(orchestrator.analyze(any(AnalysisRun.class)))
                    .thenThrow(new BackendTimeoutException("fatigue-analysis", Duration.ofSeconds(120)))
                    .thenAnswer(completesRun);

            service.startAnalysis(SHIFT_ID);
            AnalysisRun failed = awaitTerminal(SHIFT_ID);

            assertThat(failed.state()).isEqualTo(AnalysisState.FAILED);
            assertThat(failed.failureCategory()).isEqualTo(FailureCategory.BACKEND_TIMEOUT);
            assertThat(failed.failureReason()).startsWith("BACKEND_TIMEOUT: ").contains("fatigue-analysis");

            StartAnalysisResponse retry = service.startAnalysis(SHIFT_ID);
            assertThat(retry.isAccepted()).isTrue();
            AnalysisRun second = awaitTerminal(SHIFT_ID);
            assertThat(second.runId()).isNotEqualTo(failed.runId());
            assertThat(second.state()).isEqualTo(AnalysisState.COMPLETE);
        }

        @Test
        @DisplayName("unexpected exception is recorded as UNEXPECTED")
        void unexpectedException() throws Exception {
            when(orchestrator.analyze(any(AnalysisRun.class))).thenThrow(new IllegalStateException("bug"));

            service.startAnalysis(SHIFT_ID);
            AnalysisRun failed = awaitTerminal(SHIFT_ID);

            assertThat(failed.failureCategory()).isEqualTo(FailureCategory.UNEXPECTED);
            assertThat(failed.failureReason()).isEqualTo("UNEXPECTED: bug");
        }

        @Test
        @DisplayName("history write failures do not affect the run")
        void historyFailureIgnored() throws Exception {
            when(runRepository.save(any(AnalysisRunRecord.class))).thenThrow(new IllegalStateException("db down"));
            when(orchestrator.analyze(any(AnalysisRun.class))).thenAnswer(completesRun);

            assertThat(service.startAnalysis(SHIFT_ID).isAccepted()).isTrue();
            assertThat(awaitTerminal(SHIFT_ID).state()).isEqualTo(AnalysisState.COMPLETE);
        }

        @Test
        @DisplayName("cancel interrupts the job and marks the run CANCELLED")
        void cancel() throws Exception {
            CountDownLatch started = new CountDownLatch(1);
            CountDownLatch interrupted = new CountDownLatch(1);
            when(orchestrator.analyze(any(AnalysisRun.class))).thenAnswer(inv -> {
                started.countDown();
                try {
                    new CountDownLatch(1).await();
                } catch (InterruptedException e) {
                    interrupted.countDown();
                    throw new AnalysisCancelledException("interrupted");
                }
                return null;
            });

            service.startAnalysis(SHIFT_ID);
            assertThat(started.await(5, TimeUnit.SECONDS)).isTrue();

            assertThat(service.cancelAnalysis(SHIFT_ID)).isTrue();

            AnalysisRun run = service.getStatus(SHIFT_ID);
            assertThat(run.state()).isEqualTo(AnalysisState.FAILED);
            assertThat(run.failureCategory()).isEqualTo(FailureCategory.CANCELLED);
            assertThat(interrupted.await(5, TimeUnit.SECONDS)).isTrue();
            assertThat(service.getStatus(SHIFT_ID).failureCategory()).isEqualTo(FailureCategory.CANCELLED);
        }

        @Test
        @DisplayName("run cancelled before its job starts never reaches the pipeline")
        void cancelledBeforeJobStarts() {
            ExecutorService heldExecutor = mock(ExecutorService.class);
            AtomicReference<Runnable> held = new AtomicReference<>();
            when(heldExecutor.submit(any(Runnable.class))).thenAnswer(inv -> {
                held.set(inv.getArgument(0));
                return CompletableFuture.completedFuture(null);
            });
            AnalysisJobService heldService = new AnalysisJobService(registry, orchestrator, heldExecutor, runRepository);

            assertThat(heldService.startAnalysis(SHIFT_ID).isAccepted()).isTrue();
            assertThat(heldService.cancelAnalysis(SHIFT_ID)).isTrue();
            held.get().run();

            verify(orchestrator, never()).analyze(any());
            AnalysisRun run = heldService.getStatus(SHIFT_ID);
            assertThat(run.state()).isEqualTo(AnalysisState.FAILED);
            assertThat(run.failureCategory()).isEqualTo(FailureCategory.CANCELLED);
        }

        @Test
        @DisplayName("an Error from the pipeline still releases the run guard")
        void errorReleasesGuard() throws Exception {
            when(orchestrator.analyze(any(AnalysisRun.class)))
                    .thenThrow(new StackOverflowError("deep"))
                    .thenAnswer(completesRun);

            service.startAnalysis(SHIFT_ID);
            AnalysisRun failed = awaitTerminal(SHIFT_ID);

            assertThat(failed.state()).isEqualTo(AnalysisState.FAILED);
            assertThat(failed.failureCategory()).isEqualTo(FailureCategory.UNEXPECTED);
            assertThat(failed.failureReason()).contains("StackOverflowError");

            assertThat(service.startAnalysis(SHIFT_ID).isAccepted()).isTrue();
            assertThat(awaitTerminal(SHIFT_ID).state()).isEqualTo(AnalysisState.COMPLETE);
        }

        @Test
        @DisplayName("pipeline returning without completing the run ends FAILED")
        void returnedWithoutCompleting() throws Exception {
            when(orchestrator.analyze(any(AnalysisRun.class))).thenReturn(null);

            service.startAnalysis(SHIFT_ID);
            AnalysisRun failed = awaitTerminal(SHIFT_ID);

            assertThat(failed.failureCategory()).isEqualTo(FailureCategory.UNEXPECTED);
            assertThat(failed.failureReason()).contains("without storing a report");
        }

        @Test
        @DisplayName("cancel without a running analysis returns false")
        void cancelNothing() {
            assertThat(service.cancelAnalysis(SHIFT_ID)).isFalse();
        }
    }

    @Test
    @DisplayName("run history is mapped newest first from the repository")
    void runHistory() {
        AnalysisRun older = AnalysisRun.running(SHIFT_ID).fail(FailureCategory.BACKEND_ERROR, "BACKEND_ERROR: x");
        AnalysisRun newer = AnalysisRun.running(SHIFT_ID).complete();
        when(runRepository.findByShiftIdOrderByStartedAtDesc(SHIFT_ID))
                .thenReturn(List.of(AnalysisRunRecord.from(newer), AnalysisRunRecord.from(older)));

        assertThat(service.getRunHistory(SHIFT_ID)).containsExactly(newer, older);
    }
}
