package com.eainde.atc.agent;

import com.eainde.atc.agent.schema.FatigueOutputSchema;
import com.eainde.atc.model.ComputedMetrics;
import com.eainde.atc.model.FatigueResult;
import com.eainde.atc.model.ShiftMetadata;
import com.eainde.atc.model.TranscriptEntry;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Scores controller fatigue from shift context, computed metrics and a spread sample of transmissions.
 * The metrics block is attached to the validated result and never requested from the model.
 */
@Component
public class FatigueAgent {

    private final AgentInvoker invoker;
    private final TranscriptFormatter formatter;
    private final FatigueOutputSchema schema = new FatigueOutputSchema();
    private final AgentSpec spec;
    private final int sampleSize;

    public FatigueAgent(AgentInvoker invoker,
                        TranscriptFormatter formatter,
                        @Value("${atc.agents.fatigue-sample-size:10}") int sampleSize,
                        @Value("${atc.agents.fatigue.max-output-tokens:1024}") int maxOutputTokens) {
        this.invoker = invoker;
        this.formatter = formatter;
        this.sampleSize = sampleSize;
        this.spec = AgentSpec.of(AgentNames.FATIGUE, "Scores controller fatigue")
                .maxOutputTokens(maxOutputTokens)
                .build();
    }

    public FatigueResult analyze(ShiftMetadata metadata, List<TranscriptEntry> transcript, ComputedMetrics metrics) {
        return invoker.invoke(spec, templateVariables(metadata, transcript, metrics), schema)
                .withMetrics(metrics);
    }

    Map<String, Object> templateVariables(ShiftMetadata metadata,
                                          List<TranscriptEntry> transcript,
                                          ComputedMetrics metrics) {
        List<TranscriptEntry> samples = formatter.sample(transcript, sampleSize);

        Map<String, Object> vars = new LinkedHashMap<>();
        vars.put("hoursOnDuty", String.format(Locale.ROOT, "%.1f", metadata.hoursOnDuty()));
        vars.put("shiftStart", metadata.startTime().toString());
        vars.put("scheduleType", metadata.scheduleType());
        vars.put("position", metadata.position());
        vars.put("avgResponseSeconds", String.format(Locale.ROOT, "%.2f", metrics.avgResponseSeconds()));
        vars.put("maxResponseSeconds", String.format(Locale.ROOT, "%.2f", metrics.maxResponseSeconds()));
        vars.put("hesitationCount", String.valueOf(metrics.hesitationCount()));
        vars.put("totalTransmissions", String.valueOf(metrics.totalTransmissions()));
        vars.put("sampleSize", String.valueOf(samples.size()));
        vars.put("sampleTransmissions", formatter.format(samples));
        return vars;
    }
}
