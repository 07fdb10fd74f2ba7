package com.dcision.pipeline.inference;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Finds the JSON object inside a language-model response. Models wrap their answer in
 * prose or Markdown fences; this takes a fenced block if there is one, otherwise the
 * outermost braces.
 */
@Slf4j
public class JsonPayloadExtractor {

    private static final Pattern FENCE = Pattern.compile("```(?:json)?\\s*(\\{.*?})\\s*```", Pattern.DOTALL);

    private final ObjectMapper objectMapper;

    public JsonPayloadExtractor(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public Optional<JsonNode> extract(String raw) {
        if (raw == null || raw.isBlank()) {
            return Optional.empty();
        }
        Matcher fenced = FENCE.matcher(raw);
        if (fenced.find()) {
            Optional<JsonNode> node = readObject(fenced.group(1));
            if (node.isPresent()) {
                return node;
            }
        }
        int start = raw.indexOf('{');
        int end = raw.lastIndexOf('}');
        if (start < 0 || end <= start) {
            return Optional.empty();
        }
        return readObject(raw.substring(start, end + 1));
    }

    private Optional<JsonNode> readObject(String candidate) {
        try {
            JsonNode node = objectMapper.readTree(candidate);
            return node != null && node.isObject() ? Optional.of(node) : Optional.empty();
        } catch (JsonProcessingException e) {
            log.debug("Candidate payload is not valid JSON: {}", e.getOriginalMessage());
            return Optional.empty();
        }
    }
}
