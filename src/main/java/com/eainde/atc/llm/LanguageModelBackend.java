package com.eainde.atc.llm;

/**
 * Single entry point through which model nondeterminism enters the pipeline.
 *
 * <p>Implementations throw {@link com.eainde.atc.exception.BackendTimeoutException} when the
 * provider times out and {@link com.eainde.atc.exception.BackendException} for any other
 * provider failure.</p>
 */
public interface LanguageModelBackend {

    /**
     * @param prompt    fully rendered user prompt
     * @param maxTokens upper bound on generated tokens
     * @return raw model text, possibly empty
     */
    String complete(String prompt, int maxTokens);
}
