package com.eainde.atc.agent.schema;

import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.List;

/**
 * Expected shape of one agent's reply.
 *
 * <p>The invoker extracts a JSON object, checks {@link #requiredKeys()} during extraction,
 * runs {@link #validate} and only converts payloads with no violations. Anything that does
 * not conform is rejected rather than trusted.</p>
 *
 * @param <T> typed result the payload converts into
 */
public interface AgentOutputSchema<T> {

    /** Top-level keys that must be present for extraction to succeed. */
    List<String> requiredKeys();

    /**
     * @return human-readable violations; empty when the payload conforms
     */
    List<String> validate(ObjectNode payload);

    /**
     * Converts a payload that passed {@link #validate}. Behaviour on non-conforming input is undefined.
     */
    T convert(ObjectNode payload);
}
