package com.eainde.atc.agent;

/**
 * Agent names. Each name doubles as the prompt template file name under {@code atc.prompts.location}.
 *
 * <pre>
 * Wave 1 (parallel):
 *   fatigue-analysis  → FatigueResult
 *   safety-analysis   → SafetyResult
 *
 * Wave 2 (fan-in):
 *   shift-summarizer  → SummaryResult
 * </pre>
 */
public final class AgentNames {

    private AgentNames() {}

    /** Scores controller fatigue from metrics and a sample of transmissions. */
    public static final String FATIGUE = "fatigue-analysis";

    /** Reviews the full transcript for readback errors, phraseology and separation issues. */
    public static final String SAFETY = "safety-analysis";

    /** Writes the supervisor report from both upstream results. */
    public static final String SUMMARIZER = "shift-summarizer";

    /** Appended to a prompt when the previous reply could not be used. Not an agent. */
    public static final String RETRY_INSTRUCTION = "retry-instruction";
}
