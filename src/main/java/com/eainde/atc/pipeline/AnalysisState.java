package com.eainde.atc.pipeline;

/**
 * Per-shift lifecycle: {@code IDLE → RUNNING → COMPLETE | FAILED}. A terminal shift may start again.
 */
public enum AnalysisState {
    IDLE,
    RUNNING,
    COMPLETE,
    FAILED;

    public boolean isTerminal() {
        return this == COMPLETE || this == FAILED;
    }
}
