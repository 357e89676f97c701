package com.eainde.atc.extraction;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.json.JsonReadFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectReader;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Recovers one JSON object from free-form language model output.
 *
 * <p>Lookup order:</p>
 * <ol>
 *   <li>a fenced block tagged {@code json} (an untagged fence is tried next)</li>
 *   <li>the first balanced top-level {@code {...}} in the text, string-literal aware</li>
 * </ol>
 * <p>The parsed object must contain every required key. This class never throws;
 * every problem comes back as {@link ExtractionResult#failure}.</p>
 */
@Component
public class ModelResponseExtractor {

    private static final Logger log = LoggerFactory.getLogger(ModelResponseExtractor.class);

    private static final Pattern JSON_FENCE = Pattern.compile("```json\\s*([\\s\\S]*?)\\s*```", Pattern.CASE_INSENSITIVE);
    private static final Pattern ANY_FENCE = Pattern.compile("```[a-zA-Z]*\\s*([\\s\\S]*?)\\s*```");

    private final ObjectReader reader;

    public ModelResponseExtractor(ObjectMapper objectMapper) {
        this.reader = objectMapper.reader()
                .with(JsonReadFeature.ALLOW_TRAILING_COMMA.mappedFeature());
    }

    public ExtractionResult extract(String rawText) {
        return extract(rawText, List.of());
    }

    /**
     * @param rawText      model reply, possibly wrapped in prose or markdown
     * @param requiredKeys top-level keys the payload must contain
     */
    public ExtractionResult extract(String rawText, Collection<String> requiredKeys) {
        if (rawText == null || rawText.isBlank()) {
            return ExtractionResult.failure("Model returned an empty response", rawText);
        }

        Optional<ObjectNode> payload = fromFence(rawText, JSON_FENCE)
                .or(() -> fromFence(rawText, ANY_FENCE))
                .or(() -> firstBalancedObject(rawText).flatMap(this::parseObject));

        if (payload.isEmpty()) {
            log.debug("No JSON object found in model response ({} chars)", rawText.length());
            return ExtractionResult.failure("No parseable JSON object found in model response", rawText);
        }

        List<String> missing = requiredKeys.stream()
                .filter(key -> !payload.get().has(key))
                .toList();
        if (!missing.isEmpty()) {
            return ExtractionResult.failure("JSON payload is missing required keys " + missing, rawText);
        }
        return ExtractionResult.success(payload.get(), rawText);
    }

    private Optional<ObjectNode> fromFence(String text, Pattern fence) {
        Matcher matcher = fence.matcher(text);
        if (!matcher.find()) {
            return Optional.empty();
        }
        String inner = matcher.group(1);
        return parseObject(inner)
                .or(() -> firstBalancedObject(inner).flatMap(this::parseObject));
    }

    private Optional<ObjectNode> parseObject(String candidate) {
        try {
            JsonNode node = reader.readTree(candidate);
            if (node instanceof ObjectNode objectNode) {
                return Optional.of(objectNode);
            }
            return Optional.empty();
        } catch (JsonProcessingException e) {
            log.trace("Candidate is not valid JSON: {}", e.getOriginalMessage());
            return Optional.empty();
        }
    }

    /**
     * Scans from the first opening brace to its matching close, skipping braces inside string literals.
     */
    static Optional<String> firstBalancedObject(String text) {
        int start = text.indexOf('{');
        if (start < 0) {
            return Optional.empty();
        }
        int depth = 0;
        boolean inString = false;
        boolean escaped = false;
        for (int i = start; i < text.length(); i++) {
            char c = text.charAt(i);
            if (inString) {
                if (escaped) {
                    escaped = false;
                } else if (c == '\\') {
                    escaped = true;
                } else if (c == '"') {
                    inString = false;
                }
                continue;
            }
            if (c == '"') {
                inString = true;
            } else if (c == '{') {
                depth++;
            } else if (c == '}') {
                depth--;
                if (depth == 0) {
                    return Optional.of(text.substring(start, i + 1));
                }
            }
        }
        return Optional.empty();
    }
}
