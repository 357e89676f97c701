package com.eainde.atc.agent.schema;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.Consumer;
import java.util.function.Function;

/**
 * Collects violations while walking a payload. One instance per validation pass.
 */
final class SchemaValidator {

    private final List<String> violations = new ArrayList<>();

    void score(JsonNode parent, String field) {
        JsonNode node = parent.get(field);
        var value = JsonFields.integer(node);
        if (value.isEmpty() || value.getAsInt() < 0 || value.getAsInt() > 100) {
            violations.add(field + " must be an integer between 0 and 100 (was " + JsonFields.describe(node) + ")");
        }
    }

    void positiveInteger(JsonNode parent, String field, String path) {
        JsonNode node = parent.get(field);
        var value = JsonFields.integer(node);
        if (value.isEmpty() || value.getAsInt() < 1) {
            violations.add(path + field + " must be an integer >= 1 (was " + JsonFields.describe(node) + ")");
        }
    }

    void bool(JsonNode parent, String field) {
        JsonNode node = parent.get(field);
        if (JsonFields.bool(node).isEmpty()) {
            violations.add(field + " must be a boolean (was " + JsonFields.describe(node) + ")");
        }
    }

    void text(JsonNode parent, String field, String path) {
        JsonNode node = parent.get(field);
        if (JsonFields.text(node).isEmpty()) {
            violations.add(path + field + " must be a string (was " + JsonFields.describe(node) + ")");
        }
    }

    void optionalText(JsonNode parent, String field, String path) {
        JsonNode node = parent.get(field);
        if (node != null && !node.isNull() && JsonFields.text(node).isEmpty()) {
            violations.add(path + field + " must be a string when present (was " + JsonFields.describe(node) + ")");
        }
    }

    <E extends Enum<E>> void enumValue(JsonNode parent, String field, String path,
                                       Function<String, Optional<E>> parser, String allowed) {
        JsonNode node = parent.get(field);
        if (node == null || !node.isTextual() || parser.apply(node.textValue()).isEmpty()) {
            violations.add(path + field + " must be one of " + allowed + " (was " + JsonFields.describe(node) + ")");
        }
    }

    <E extends Enum<E>> void optionalEnumValue(JsonNode parent, String field, String path,
                                               Function<String, Optional<E>> parser, String allowed) {
        JsonNode node = parent.get(field);
        if (node != null && !node.isNull()) {
            enumValue(parent, field, path, parser, allowed);
        }
    }

    /**
     * Requires an array of objects and validates each element with the given callback.
     */
    void objectArray(JsonNode parent, String field, Consumer<ElementContext> elementCheck) {
        JsonNode node = parent.get(field);
        if (node == null || !node.isArray()) {
            violations.add(field + " must be an array (was " + JsonFields.describe(node) + ")");
            return;
        }
        for (int i = 0; i < node.size(); i++) {
            JsonNode element = node.get(i);
            String path = field + "[" + i + "].";
            if (!element.isObject()) {
                violations.add(field + "[" + i + "] must be an object (was " + JsonFields.describe(element) + ")");
                continue;
            }
            elementCheck.accept(new ElementContext(element, path));
        }
    }

    void textArray(JsonNode parent, String field) {
        JsonNode node = parent.get(field);
        if (node == null || !node.isArray()) {
            violations.add(field + " must be an array of strings (was " + JsonFields.describe(node) + ")");
            return;
        }
        for (int i = 0; i < node.size(); i++) {
            if (!node.get(i).isTextual()) {
                violations.add(field + "[" + i + "] must be a string (was " + JsonFields.describe(node.get(i)) + ")");
            }
        }
    }

    List<String> violations() {
        return List.copyOf(violations);
    }

    record ElementContext(JsonNode element, String path) {}
}
