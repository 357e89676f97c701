package com.eainde.atc.agent;

import com.eainde.atc.agent.schema.AgentOutputSchema;
import com.eainde.atc.exception.AgentResponseException;
import com.eainde.atc.exception.AnalysisCancelledException;
import com.eainde.atc.exception.AnalysisException;
import com.eainde.atc.exception.BackendException;
import com.eainde.atc.exception.BackendTimeoutException;
import com.eainde.atc.exception.FailureCategory;
import com.eainde.atc.extraction.ExtractionResult;
import com.eainde.atc.extraction.ModelResponseExtractor;
import com.eainde.atc.llm.LanguageModelBackend;
import com.eainde.atc.llm.ModelCallGate;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.extern.log4j.Log4j2;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Runs one agent: render prompt, call the model under a time budget, extract, validate, convert.
 *
 * <h3>Retry policy (at most {@value #MAX_ATTEMPTS} attempts):</h3>
 * <ul>
 *   <li>Extraction or validation failure → retry with a clarifying instruction appended</li>
 *   <li>Backend timeout → retry with the same prompt</li>
 *   <li>Any other backend error → fail immediately</li>
 * </ul>
 *
 * <p>The call timeout covers the backend call only. Waiting for a {@link ModelCallGate} slot
 * happens before the clock starts.</p>
 */
@Log4j2
@Component
public class AgentInvoker {

    static final int MAX_ATTEMPTS = 2;
    private static final int RAW_PREVIEW_CHARS = 200;

    private final LanguageModelBackend backend;
    private final ModelCallGate gate;
    private final PromptService promptService;
    private final ModelResponseExtractor extractor;
    private final ExecutorService executor;
    private final Duration callTimeout;

    public AgentInvoker(LanguageModelBackend backend,
                        ModelCallGate gate,
                        PromptService promptService,
                        ModelResponseExtractor extractor,
                        ExecutorService analysisExecutor,
                        @Value("${atc.agents.call-timeout:PT120S}") Duration callTimeout) {
        this.backend = backend;
        this.gate = gate;
        this.promptService = promptService;
        this.extractor = extractor;
        this.executor = analysisExecutor;
        this.callTimeout = callTimeout;
    }

    // =========================================================================
    //  Public API
    // =========================================================================

    /**
     * @param spec      agent identity and token budget
     * @param variables template variables; values must be non-null
     * @param schema    expected reply shape
     * @return the validated, typed result
     * @throws AnalysisException when every attempt failed, carrying the last cause's category
     */
    public <T> T invoke(AgentSpec spec, Map<String, Object> variables, AgentOutputSchema<T> schema) {
        String basePrompt = promptService.render(spec.getAgentName(), variables);
        String prompt = basePrompt;

        for (int attempt = 1; ; attempt++) {
            try {
                String raw = callBackend(spec, prompt);
                T result = parse(spec, raw, schema);
                if (attempt > 1) {
                    log.info("Agent {} succeeded on attempt {}", spec.getAgentName(), attempt);
                }
                return result;
            } catch (AnalysisException e) {
                if (!e.getCategory().isRetryable() || attempt >= MAX_ATTEMPTS) {
                    log.error("Agent {} failed after {} attempt(s): {}",
                            spec.getAgentName(), attempt, e.toFailureReason());
                    throw e;
                }
                log.warn("Agent {} attempt {} failed, retrying: {}",
                        spec.getAgentName(), attempt, e.toFailureReason());
                if (e instanceof AgentResponseException) {
                    prompt = basePrompt + "\n\n"
                            + promptService.renderRetryInstruction(e.getMessage(), schema.requiredKeys());
                } else {
                    prompt = basePrompt;
                }
            }
        }
    }

    // =========================================================================
    //  Internals
    // =========================================================================

    private String callBackend(AgentSpec spec, String prompt) {
        log.debug("Calling model for {} ({} prompt chars, maxOutputTokens={})",
                spec.getAgentName(), prompt.length(), spec.getMaxOutputTokens());

        ModelCallGate.Permit permit = gate.acquire(spec.getAgentName());
        Future<String> call;
        try {
            call = executor.submit(() -> {
                if (!permit.claim()) {
                    throw new CancellationException("Model call for " + spec.getAgentName() + " abandoned");
                }
                try {
                    return backend.complete(prompt, spec.getMaxOutputTokens());
                } finally {
                    permit.release();
                }
            });
        } catch (RejectedExecutionException e) {
            permit.abandon();
            throw new BackendException("Model call for " + spec.getAgentName() + " could not be scheduled", e);
        }

        try {
            return call.get(callTimeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            call.cancel(true);
            permit.abandon();
            throw new BackendTimeoutException(spec.getAgentName(), callTimeout);
        } catch (InterruptedException e) {
            call.cancel(true);
            permit.abandon();
            Thread.currentThread().interrupt();
            throw new AnalysisCancelledException("Interrupted while waiting for " + spec.getAgentName());
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            if (cause instanceof AnalysisException analysisException) {
                throw analysisException;
            }
            throw new BackendException("Model call for " + spec.getAgentName() + " failed: "
                    + cause.getMessage(), cause);
        }
    }

    private <T> T parse(AgentSpec spec, String raw, AgentOutputSchema<T> schema) {
        ExtractionResult extraction = extractor.extract(raw, schema.requiredKeys());
        if (!extraction.isSuccess()) {
            throw new AgentResponseException(FailureCategory.EXTRACTION_FAILURE,
                    spec.getAgentName() + ": " + extraction.getFailureReason()
                            + " (raw: " + preview(raw) + ")",
                    raw);
        }

        ObjectNode payload = extraction.getPayload();
        List<String> violations = schema.validate(payload);
        if (!violations.isEmpty()) {
            throw new AgentResponseException(FailureCategory.VALIDATION_FAILURE,
                    spec.getAgentName() + ": reply violates schema " + violations,
                    raw);
        }
        return schema.convert(payload);
    }

    static String preview(String raw) {
        if (raw == null) {
            return "<null>";
        }
        String flat = raw.replaceAll("\\s+", " ").trim();
        return flat.length() <= RAW_PREVIEW_CHARS ? flat : flat.substring(0, RAW_PREVIEW_CHARS) + "...";
    }
}
