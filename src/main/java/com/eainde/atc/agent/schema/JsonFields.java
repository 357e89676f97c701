package com.eainde.atc.agent.schema;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Optional;
import java.util.OptionalInt;

/**
 * Lenient scalar readers for model-produced JSON. Small models often quote numbers
 * and booleans, so {@code "58"} and {@code "true"} are accepted alongside their native forms.
 */
final class JsonFields {

    private JsonFields() {}

    static OptionalInt integer(JsonNode node) {
        if (node == null || node.isNull()) {
            return OptionalInt.empty();
        }
        if (node.isIntegralNumber() && node.canConvertToInt()) {
            return OptionalInt.of(node.intValue());
        }
        if (node.isNumber()) {
            double value = node.doubleValue();
            if (value == Math.rint(value) && !Double.isInfinite(value)) {
                return OptionalInt.of((int) value);
            }
            return OptionalInt.empty();
        }
        if (node.isTextual()) {
            try {
                return OptionalInt.of(Integer.parseInt(node.textValue().trim()));
            } catch (NumberFormatException e) {
                return OptionalInt.empty();
            }
        }
        return OptionalInt.empty();
    }

    static Optional<Boolean> bool(JsonNode node) {
        if (node == null || node.isNull()) {
            return Optional.empty();
        }
        if (node.isBoolean()) {
            return Optional.of(node.booleanValue());
        }
        if (node.isTextual()) {
            String value = node.textValue().trim();
            if ("true".equalsIgnoreCase(value)) return Optional.of(Boolean.TRUE);
            if ("false".equalsIgnoreCase(value)) return Optional.of(Boolean.FALSE);
        }
        return Optional.empty();
    }

    /**
     * Textual or numeric scalars as text; numbers are allowed because models emit timestamps both ways.
     */
    static Optional<String> text(JsonNode node) {
        if (node == null || node.isNull()) {
            return Optional.empty();
        }
        if (node.isTextual() || node.isNumber()) {
            return Optional.of(node.asText());
        }
        return Optional.empty();
    }

    static String textOrNull(JsonNode node) {
        return text(node).orElse(null);
    }

    static String describe(JsonNode node) {
        if (node == null) {
            return "<absent>";
        }
        String rendered = node.toString();
        return rendered.length() > 60 ? rendered.substring(0, 60) + "..." : rendered;
    }
}
