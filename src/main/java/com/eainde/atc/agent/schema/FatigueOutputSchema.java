package com.eainde.atc.agent.schema;

import com.eainde.atc.model.FatigueIndicator;
import com.eainde.atc.model.FatigueResult;
import com.eainde.atc.model.Severity;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.ArrayList;
import java.util.List;

/**
 * Fatigue reply: {@code score, severity, indicators[type, evidence, severity?, timestamp?],
 * requiresAttention, summary}. Metrics are not part of the reply; the agent attaches them.
 */
public class FatigueOutputSchema implements AgentOutputSchema<FatigueResult> {

    static final String SEVERITIES = "[low, medium, high, critical]";

    private static final List<String> REQUIRED = List.of(
            "score", "severity", "indicators", "requiresAttention", "summary");

    @Override
    public List<String> requiredKeys() {
        return REQUIRED;
    }

    @Override
    public List<String> validate(ObjectNode payload) {
        SchemaValidator v = new SchemaValidator();
        v.score(payload, "score");
        v.enumValue(payload, "severity", "", Severity::parse, SEVERITIES);
        v.objectArray(payload, "indicators", ctx -> {
            v.text(ctx.element(), "type", ctx.path());
            v.text(ctx.element(), "evidence", ctx.path());
            v.optionalEnumValue(ctx.element(), "severity", ctx.path(), Severity::parse, SEVERITIES);
            v.optionalText(ctx.element(), "timestamp", ctx.path());
        });
        v.bool(payload, "requiresAttention");
        v.text(payload, "summary", "");
        return v.violations();
    }

    @Override
    public FatigueResult convert(ObjectNode payload) {
        List<FatigueIndicator> indicators = new ArrayList<>();
        for (JsonNode node : payload.get("indicators")) {
            indicators.add(new FatigueIndicator(
                    JsonFields.textOrNull(node.get("type")),
                    JsonFields.textOrNull(node.get("evidence")),
                    JsonFields.text(node.get("severity")).flatMap(Severity::parse).orElse(null),
                    JsonFields.textOrNull(node.get("timestamp"))));
        }
        return new FatigueResult(
                JsonFields.integer(payload.get("score")).orElseThrow(),
                Severity.fromValue(payload.get("severity").textValue()),
                indicators,
                JsonFields.bool(payload.get("requiresAttention")).orElseThrow(),
                JsonFields.textOrNull(payload.get("summary")),
                null);
    }
}
