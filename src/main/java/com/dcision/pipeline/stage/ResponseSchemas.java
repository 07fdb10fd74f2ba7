package com.dcision.pipeline.stage;

import com.dcision.pipeline.domain.StageName;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.core.io.ClassPathResource;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.EnumMap;
import java.util.Map;

/**
 * JSON schemas sent with each inference request, loaded from {@code schemas/*.json}.
 */
@Component
public class ResponseSchemas {

    private final Map<StageName, JsonNode> schemas = new EnumMap<>(StageName.class);

    public ResponseSchemas(ObjectMapper objectMapper) {
        schemas.put(StageName.INTENT, load(objectMapper, "schemas/intent.json"));
        schemas.put(StageName.DATA_ANALYSIS, load(objectMapper, "schemas/data_analysis.json"));
        schemas.put(StageName.MODEL_BUILDING, load(objectMapper, "schemas/model_building.json"));
    }

    public JsonNode forStage(StageName stage) {
        JsonNode schema = schemas.get(stage);
        if (schema == null) {
            throw new IllegalArgumentException("No response schema for stage " + stage.wireName());
        }
        return schema;
    }

    private static JsonNode load(ObjectMapper objectMapper, String path) {
        try (InputStream in = new ClassPathResource(path).getInputStream()) {
            return objectMapper.readTree(in);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot load response schema " + path, e);
        }
    }
}
