package com.eainde.atc.agent.schema;

import com.eainde.atc.model.SafetyIssue;
import com.eainde.atc.model.SafetyResult;
import com.eainde.atc.model.Severity;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.ArrayList;
import java.util.List;

/**
 * Safety reply: {@code score, issuesFound[type, severity, timestamp, evidence, concern],
 * requiresImmediateReview, summary}.
 */
public class SafetyOutputSchema implements AgentOutputSchema<SafetyResult> {

    private static final List<String> REQUIRED = List.of(
            "score", "issuesFound", "requiresImmediateReview", "summary");

    @Override
    public List<String> requiredKeys() {
        return REQUIRED;
    }

    @Override
    public List<String> validate(ObjectNode payload) {
        SchemaValidator v = new SchemaValidator();
        v.score(payload, "score");
        v.objectArray(payload, "issuesFound", ctx -> {
            v.text(ctx.element(), "type", ctx.path());
            v.enumValue(ctx.element(), "severity", ctx.path(), Severity::parse, FatigueOutputSchema.SEVERITIES);
            v.text(ctx.element(), "timestamp", ctx.path());
            v.text(ctx.element(), "evidence", ctx.path());
            v.text(ctx.element(), "concern", ctx.path());
        });
        v.bool(payload, "requiresImmediateReview");
        v.text(payload, "summary", "");
        return v.violations();
    }

    @Override
    public SafetyResult convert(ObjectNode payload) {
        List<SafetyIssue> issues = new ArrayList<>();
        for (JsonNode node : payload.get("issuesFound")) {
            issues.add(new SafetyIssue(
                    JsonFields.textOrNull(node.get("type")),
                    Severity.fromValue(node.get("severity").textValue()),
                    JsonFields.textOrNull(node.get("timestamp")),
                    JsonFields.textOrNull(node.get("evidence")),
                    JsonFields.textOrNull(node.get("concern"))));
        }
        return new SafetyResult(
                JsonFields.integer(payload.get("score")).orElseThrow(),
                issues,
                JsonFields.bool(payload.get("requiresImmediateReview")).orElseThrow(),
                JsonFields.textOrNull(payload.get("summary")));
    }
}
