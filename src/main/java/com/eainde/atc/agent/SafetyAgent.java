package com.eainde.atc.agent;

import com.eainde.atc.agent.schema.SafetyOutputSchema;
import com.eainde.atc.model.SafetyResult;
import com.eainde.atc.model.ShiftMetadata;
import com.eainde.atc.model.TranscriptEntry;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;

/**
 * Reviews the full transcript for readback errors, non-standard phraseology and separation concerns.
 */
@Component
public class SafetyAgent {

    private final AgentInvoker invoker;
    private final TranscriptFormatter formatter;
    private final SafetyOutputSchema schema = new SafetyOutputSchema();
    private final AgentSpec spec;

    public SafetyAgent(AgentInvoker invoker,
                       TranscriptFormatter formatter,
                       @Value("${atc.agents.safety.max-output-tokens:1536}") int maxOutputTokens) {
        this.invoker = invoker;
        this.formatter = formatter;
        this.spec = AgentSpec.of(AgentNames.SAFETY, "Flags safety-relevant transmissions")
                .maxOutputTokens(maxOutputTokens)
                .build();
    }

    public SafetyResult analyze(ShiftMetadata metadata, List<TranscriptEntry> transcript) {
        Map<String, Object> vars = Map.of(
                "facility", metadata.facility(),
                "position", metadata.position(),
                "controllerId", metadata.controllerId(),
                "transcript", formatter.format(transcript));
        return invoker.invoke(spec, vars, schema);
    }
}
