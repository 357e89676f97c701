package com.eainde.atc.agent;

import com.eainde.atc.agent.schema.SummaryOutputSchema;
import com.eainde.atc.model.FatigueIndicator;
import com.eainde.atc.model.FatigueResult;
import com.eainde.atc.model.SafetyIssue;
import com.eainde.atc.model.SafetyResult;
import com.eainde.atc.model.ShiftMetadata;
import com.eainde.atc.model.SummaryResult;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Fan-in agent: turns the fatigue and safety results into the supervisor report.
 * Both inputs must already be validated.
 */
@Component
public class SummarizerAgent {

    static final String NONE = "none";

    private final AgentInvoker invoker;
    private final SummaryOutputSchema schema = new SummaryOutputSchema();
    private final AgentSpec spec;

    public SummarizerAgent(AgentInvoker invoker,
                           @Value("${atc.agents.summarizer.max-output-tokens:2048}") int maxOutputTokens) {
        this.invoker = invoker;
        this.spec = AgentSpec.of(AgentNames.SUMMARIZER, "Writes the supervisor shift report")
                .maxOutputTokens(maxOutputTokens)
                .build();
    }

    public SummaryResult summarize(ShiftMetadata metadata, FatigueResult fatigue, SafetyResult safety) {
        Objects.requireNonNull(fatigue, "fatigue result");
        Objects.requireNonNull(safety, "safety result");
        return invoker.invoke(spec, templateVariables(metadata, fatigue, safety), schema);
    }

    Map<String, Object> templateVariables(ShiftMetadata metadata, FatigueResult fatigue, SafetyResult safety) {
        Map<String, Object> vars = new LinkedHashMap<>();
        vars.put("shiftId", metadata.shiftId());
        vars.put("controllerId", metadata.controllerId());
        vars.put("facility", metadata.facility());
        vars.put("position", metadata.position());
        vars.put("scheduleType", metadata.scheduleType());
        vars.put("startTime", metadata.startTime().toString());
        vars.put("endTime", metadata.endTime().toString());
        vars.put("hoursOnDuty", String.format(Locale.ROOT, "%.1f", metadata.hoursOnDuty()));
        vars.put("trafficCountAvg", metadata.trafficCountAvg() != null
                ? String.format(Locale.ROOT, "%.1f", metadata.trafficCountAvg())
                : "n/a");

        vars.put("fatigueScore", String.valueOf(fatigue.score()));
        vars.put("fatigueSeverity", fatigue.severity().getValue());
        vars.put("fatigueIndicatorCount", String.valueOf(fatigue.indicators().size()));
        vars.put("fatigueIndicatorTypes", joinTypes(fatigue.indicators(), FatigueIndicator::type));
        vars.put("fatigueRequiresAttention", String.valueOf(fatigue.requiresAttention()));
        vars.put("fatigueSummary", Objects.toString(fatigue.summary(), ""));

        vars.put("safetyScore", String.valueOf(safety.score()));
        vars.put("safetyIssueCount", String.valueOf(safety.issuesFound().size()));
        vars.put("safetyIssueTypes", joinTypes(safety.issuesFound(), SafetyIssue::type));
        vars.put("safetyRequiresImmediateReview", String.valueOf(safety.requiresImmediateReview()));
        vars.put("safetySummary", Objects.toString(safety.summary(), ""));
        return vars;
    }

    private static <E> String joinTypes(List<E> items, Function<E, String> type) {
        String joined = items.stream()
                .map(type)
                .filter(Objects::nonNull)
                .distinct()
                .collect(Collectors.joining(", "));
        return joined.isEmpty() ? NONE : joined;
    }
}
