package com.eainde.atc.agent;

/**
 * Declarative description of one agent.
 *
 * <p>The prompt is resolved by {@link PromptService} from {@link #getAgentName()}; the spec
 * only carries identity and the output token budget.</p>
 *
 * <pre>
 * AgentSpec.of(AgentNames.FATIGUE, "Scores controller fatigue")
 *          .maxOutputTokens(1024)
 *          .build();
 * </pre>
 */
public class AgentSpec {

    static final int DEFAULT_MAX_OUTPUT_TOKENS = 1024;

    private final String agentName;
    private final String description;
    private final int maxOutputTokens;

    private AgentSpec(Builder builder) {
        this.agentName = builder.agentName;
        this.description = builder.description;
        this.maxOutputTokens = builder.maxOutputTokens;
    }

    public static Builder of(String agentName, String description) {
        return new Builder(agentName, description);
    }

    public String getAgentName() { return agentName; }
    public String getDescription() { return description; }
    public int getMaxOutputTokens() { return maxOutputTokens; }

    @Override
    public String toString() {
        return agentName + " [maxOutputTokens=" + maxOutputTokens + "]";
    }

    public static class Builder {
        private final String agentName;
        private final String description;
        private int maxOutputTokens = DEFAULT_MAX_OUTPUT_TOKENS;

        private Builder(String agentName, String description) {
            this.agentName = agentName;
            this.description = description;
        }

        /** Upper bound on tokens the model may generate for this agent. */
        public Builder maxOutputTokens(int maxOutputTokens) {
            this.maxOutputTokens = maxOutputTokens;
            return this;
        }

        public AgentSpec build() {
            if (agentName == null || agentName.isBlank()) {
                throw new IllegalArgumentException("agentName is mandatory");
            }
            if (maxOutputTokens < 1) {
                throw new IllegalArgumentException("maxOutputTokens must be >= 1 for " + agentName);
            }
            return new AgentSpec(this);
        }
    }
}
