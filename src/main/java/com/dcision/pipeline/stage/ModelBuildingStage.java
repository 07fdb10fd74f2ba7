package com.dcision.pipeline.stage;

import com.dcision.pipeline.config.PipelineProperties;
import com.dcision.pipeline.domain.OptimizationModel;
import com.dcision.pipeline.domain.StageContext;
import com.dcision.pipeline.domain.StageName;
import com.dcision.pipeline.inference.JsonPayloadExtractor;
import com.dcision.pipeline.validation.ModelValidator;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Iterator;
import java.util.Locale;
import java.util.Map;

@Slf4j
@Component
public class ModelBuildingStage extends InferenceStage<OptimizationModel> {

    public ModelBuildingStage(InferenceGateway gateway, JsonPayloadExtractor extractor, ObjectMapper objectMapper,
                              PipelineProperties properties, ResponseSchemas schemas, ModelValidator validator) {
        super(gateway, extractor, objectMapper, properties, schemas, validator);
    }

    @Override
    public StageName name() {
        return StageName.MODEL_BUILDING;
    }

    @Override
    public Class<OptimizationModel> outputType() {
        return OptimizationModel.class;
    }

    @Override
    protected String modelId() {
        return properties.getModels().getModelBuilding();
    }

    @Override
    public Object fingerprintInputs(StageContext context) {
        Map<String, Object> inputs = IntentStage.requestInputs(context.getRequest());
        inputs.put("intent", context.getIntent());
        inputs.put("data_analysis", context.getDataAnalysis());
        return inputs;
    }

    @Override
    protected String prompt(StageContext context) {
        return PromptTemplates.MODEL_BUILDING.formatted(context.getRequest().getRawText(),
                json(context.getIntent()), json(context.getDataAnalysis()));
    }

    /**
     * Models often answer in older shapes: a reasoning trace keyed by step, an objective
     * written as {@code "minimize 45*x1 + ..."}, variables with {@code type} and a
     * {@code bounds} pair. These are rewritten into the declared shape.
     */
    @Override
    protected ObjectNode repair(ObjectNode payload) {
        repairReasoningTrace(payload);
        repairObjective(payload);
        JsonNode variables = payload.path("variables");
        if (variables.isArray()) {
            variables.forEach(v -> {
                if (v.isObject()) {
                    repairVariable((ObjectNode) v);
                }
            });
        }
        return payload;
    }

    private void repairReasoningTrace(ObjectNode payload) {
        JsonNode trace = payload.get("reasoning_trace");
        if (trace == null) {
            return;
        }
        ArrayNode steps = objectMapper.createArrayNode();
        if (trace.isObject()) {
            Iterator<Map.Entry<String, JsonNode>> fields = trace.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                steps.addObject().put("step_name", field.getKey()).put("text", text(field.getValue()));
            }
        } else if (trace.isArray()) {
            int index = 1;
            for (JsonNode step : trace) {
                if (step.isObject()) {
                    steps.add(step);
                } else {
                    steps.addObject().put("step_name", "step_" + index).put("text", text(step));
                }
                index++;
            }
        } else if (trace.isTextual()) {
            steps.addObject().put("step_name", "step_1").put("text", trace.asText());
        } else {
            return;
        }
        payload.set("reasoning_trace", steps);
    }

    private void repairObjective(ObjectNode payload) {
        JsonNode objective = payload.get("objective");
        if (objective == null || !objective.isTextual()) {
            return;
        }
        String text = objective.asText().trim();
        int space = text.indexOf(' ');
        String first = space < 0 ? "" : text.substring(0, space).toLowerCase(Locale.ROOT);
        if (first.startsWith("min") || first.startsWith("max")) {
            ObjectNode repaired = payload.putObject("objective");
            repaired.put("direction", first.startsWith("min") ? "minimize" : "maximize");
            repaired.put("expression", text.substring(space + 1).trim());
        }
    }

    private void repairVariable(ObjectNode variable) {
        if (!variable.has("kind") && variable.path("type").isTextual()) {
            variable.put("kind", variable.get("type").asText());
        }
        variable.remove("type");
        JsonNode bounds = variable.get("bounds");
        if (bounds != null && bounds.isArray() && bounds.size() == 2) {
            if (!variable.has("lower_bound") && bounds.get(0).isNumber()) {
                variable.set("lower_bound", bounds.get(0));
            }
            if (!variable.has("upper_bound") && bounds.get(1).isNumber()) {
                variable.set("upper_bound", bounds.get(1));
            }
        }
        variable.remove("bounds");
    }

    private static String text(JsonNode node) {
        return node.isTextual() ? node.asText() : node.toString();
    }
}
