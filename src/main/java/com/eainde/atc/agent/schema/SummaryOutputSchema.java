package com.eainde.atc.agent.schema;

import com.eainde.atc.model.PriorityLevel;
import com.eainde.atc.model.Recommendation;
import com.eainde.atc.model.Severity;
import com.eainde.atc.model.SummaryResult;
import com.eainde.atc.model.TimelineEvent;
import com.eainde.atc.model.TimelineEventType;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.ArrayList;
import java.util.List;

/**
 * Summarizer reply: {@code executiveSummary, keyFindings[], timeline[timestamp, type, description, severity?],
 * recommendations[priority, action, rationale], priorityLevel}.
 */
public class SummaryOutputSchema implements AgentOutputSchema<SummaryResult> {

    private static final List<String> REQUIRED = List.of(
            "executiveSummary", "keyFindings", "timeline", "recommendations", "priorityLevel");

    @Override
    public List<String> requiredKeys() {
        return REQUIRED;
    }

    @Override
    public List<String> validate(ObjectNode payload) {
        SchemaValidator v = new SchemaValidator();
        v.text(payload, "executiveSummary", "");
        v.textArray(payload, "keyFindings");
        v.objectArray(payload, "timeline", ctx -> {
            v.text(ctx.element(), "timestamp", ctx.path());
            v.enumValue(ctx.element(), "type", ctx.path(), TimelineEventType::parse, "[fatigue, safety, normal]");
            v.text(ctx.element(), "description", ctx.path());
            v.optionalEnumValue(ctx.element(), "severity", ctx.path(), Severity::parse, FatigueOutputSchema.SEVERITIES);
        });
        v.objectArray(payload, "recommendations", ctx -> {
            v.positiveInteger(ctx.element(), "priority", ctx.path());
            v.text(ctx.element(), "action", ctx.path());
            v.text(ctx.element(), "rationale", ctx.path());
        });
        v.enumValue(payload, "priorityLevel", "", PriorityLevel::parse, "[low, medium, high, urgent]");
        return v.violations();
    }

    @Override
    public SummaryResult convert(ObjectNode payload) {
        List<String> keyFindings = new ArrayList<>();
        payload.get("keyFindings").forEach(node -> keyFindings.add(node.textValue()));

        List<TimelineEvent> timeline = new ArrayList<>();
        for (JsonNode node : payload.get("timeline")) {
            timeline.add(new TimelineEvent(
                    JsonFields.textOrNull(node.get("timestamp")),
                    TimelineEventType.fromValue(node.get("type").textValue()),
                    JsonFields.textOrNull(node.get("description")),
                    JsonFields.text(node.get("severity")).flatMap(Severity::parse).orElse(null)));
        }

        List<Recommendation> recommendations = new ArrayList<>();
        for (JsonNode node : payload.get("recommendations")) {
            recommendations.add(new Recommendation(
                    JsonFields.integer(node.get("priority")).orElseThrow(),
                    JsonFields.textOrNull(node.get("action")),
                    JsonFields.textOrNull(node.get("rationale"))));
        }

        return new SummaryResult(
                JsonFields.textOrNull(payload.get("executiveSummary")),
                keyFindings,
                timeline,
                recommendations,
                PriorityLevel.fromValue(payload.get("priorityLevel").textValue()));
    }
}
