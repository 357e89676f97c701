package com.eainde.atc.agent.schema;

import com.eainde.atc.model.SafetyIssue;
import com.eainde.atc.model.SafetyResult;
import com.eainde.atc.model.Severity;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class SafetyOutputSchemaTest {

    private final ObjectMapper mapper = new ObjectMapper();
    private final SafetyOutputSchema schema = new SafetyOutputSchema();

    @Test
    @DisplayName("empty issue list is a valid reply")
    void noIssues() throws Exception {
        ObjectNode payload = (ObjectNode) mapper.readTree("""
                {"score": 15, "issuesFound": [], "requiresImmediateReview": false, "summary": "Routine"}
                """);

        assertThat(schema.validate(payload)).isEmpty();
        SafetyResult result = schema.convert(payload);
        assertThat(result.score()).isEqualTo(15);
        assertThat(result.issuesFound()).isEmpty();
        assertThat(result.requiresImmediateReview()).isFalse();
    }

    @Test
    @DisplayName("issues keep their order and numeric timestamps become text")
    void issuesConverted() throws Exception {
        ObjectNode payload = (ObjectNode) mapper.readTree("""
                {
                  "score": 72,
                  "issuesFound": [
                    {"type": "readback error", "severity": "high", "timestamp": 45.5,
                     "evidence": "climb three five zero", "concern": "wrong level read back"},
                    {"type": "phraseology", "severity": "low", "timestamp": "80.0",
                     "evidence": "go up", "concern": "non-standard"}
                  ],
                  "requiresImmediateReview": true,
                  "summary": "One uncorrected readback"
                }
                """);

        assertThat(schema.validate(payload)).isEmpty();
        SafetyResult result = schema.convert(payload);
        assertThat(result.issuesFound()).extracting(SafetyIssue::type).containsExactly("readback error", "phraseology");
        assertThat(result.issuesFound().get(0).timestamp()).isEqualTo("45.5");
        assertThat(result.issuesFound().get(0).severity()).isEqualTo(Severity.HIGH);
    }

    @Test
    @DisplayName("issue without severity or concern is rejected")
    void incompleteIssue() throws Exception {
        ObjectNode payload = (ObjectNode) mapper.readTree("""
                {"score": 30, "issuesFound": [{"type": "t", "timestamp": "1", "evidence": "e"}],
                 "requiresImmediateReview": false, "summary": "s"}
                """);

        assertThat(schema.validate(payload))
                .hasSize(2)
                .anySatisfy(v -> assertThat(v).startsWith("issuesFound[0].severity"))
                .anySatisfy(v -> assertThat(v).startsWith("issuesFound[0].concern"));
    }
}
