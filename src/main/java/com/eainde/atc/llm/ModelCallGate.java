package com.eainde.atc.llm;

import com.eainde.atc.exception.AnalysisCancelledException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.Semaphore;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Caps how many model calls are in flight at once, across all shifts.
 *
 * <p>Callers acquire a {@link Permit} before starting the timed part of a call, so waiting for
 * a free slot never counts against the per-call timeout. The permit goes back when the backend
 * call itself returns, even if the caller stopped waiting for it earlier.</p>
 */
public class ModelCallGate {

    private static final Logger log = LoggerFactory.getLogger(ModelCallGate.class);

    private final Semaphore permits;
    private final int maxConcurrentCalls;

    public ModelCallGate(int maxConcurrentCalls) {
        if (maxConcurrentCalls < 1) {
            throw new IllegalArgumentException("maxConcurrentCalls must be >= 1, was " + maxConcurrentCalls);
        }
        this.maxConcurrentCalls = maxConcurrentCalls;
        this.permits = new Semaphore(maxConcurrentCalls, true);
    }

    /**
     * Blocks until a slot is free.
     *
     * @throws AnalysisCancelledException when interrupted while waiting
     */
    public Permit acquire(String caller) {
        try {
            if (!permits.tryAcquire()) {
                log.debug("All {} model call permits in use, {} waiting", maxConcurrentCalls, caller);
                permits.acquire();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new AnalysisCancelledException("Interrupted while waiting for a model call permit for " + caller);
        }
        return new Permit();
    }

    public int availablePermits() {
        return permits.availablePermits();
    }

    /**
     * One acquired slot. The task that performs the call {@link #claim()}s it and {@link #release()}s
     * it when done; a caller that gives up on a call that never started uses {@link #abandon()}.
     */
    public final class Permit {

        private final AtomicBoolean claimed = new AtomicBoolean();
        private final AtomicBoolean released = new AtomicBoolean();

        private Permit() {}

        /**
         * @return false when the permit was abandoned before the call could start
         */
        public boolean claim() {
            return claimed.compareAndSet(false, true);
        }

        /** Returns the slot if no call ever claimed it; a claimed permit is left to its call. */
        public void abandon() {
            if (claim()) {
                release();
            }
        }

        public void release() {
            if (released.compareAndSet(false, true)) {
                permits.release();
            }
        }
    }
}
