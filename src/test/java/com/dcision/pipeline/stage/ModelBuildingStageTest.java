package com.dcision.pipeline.stage;

import com.dcision.pipeline.config.PipelineJson;
import com.dcision.pipeline.config.PipelineProperties;
import com.dcision.pipeline.domain.ObjectiveDirection;
import com.dcision.pipeline.domain.OptimizationModel;
import com.dcision.pipeline.domain.ProblemRequest;
import com.dcision.pipeline.domain.StageContext;
import com.dcision.pipeline.domain.VariableKind;
import com.dcision.pipeline.exception.ErrorKind;
import com.dcision.pipeline.exception.StageValidationException;
import com.dcision.pipeline.inference.JsonPayloadExtractor;
import com.dcision.pipeline.routing.RegionRouter;
import com.dcision.pipeline.support.MutableClock;
import com.dcision.pipeline.support.Payloads;
import com.dcision.pipeline.support.ScriptedInferenceClient;
import com.dcision.pipeline.validation.ModelValidator;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class ModelBuildingStageTest {

    private static final String MODEL = "builder-model";

    private final ScriptedInferenceClient client = new ScriptedInferenceClient();
    private final PipelineProperties properties = new PipelineProperties();
    private ModelBuildingStage stage;

    @BeforeEach
    void setUp() {
        PipelineProperties.Region region = new PipelineProperties.Region();
        region.setId("us-east-1");
        region.setModels(List.of(MODEL));
        region.setCostPerThousandTokens(0.002);
        properties.getRegions().add(region);
        properties.getModels().setModelBuilding(MODEL);

        ObjectMapper objectMapper = PipelineJson.objectMapper();
        RegionRouter router = new RegionRouter(properties, new MutableClock(Instant.EPOCH));
        stage = new ModelBuildingStage(new InferenceGateway(router, client, properties),
                new JsonPayloadExtractor(objectMapper), objectMapper, properties,
                new ResponseSchemas(objectMapper), new ModelValidator());
    }

    private OptimizationModel produce(StageAttempt attempt) {
        return stage.produce(StageContext.of(ProblemRequest.of(Payloads.PRODUCTION_PROBLEM)), attempt);
    }

    @Test
    void reasoningTraceObjectBecomesOrderedSteps() {
        client.answer(MODEL, Payloads.MODEL_DEMAND_800);

        OptimizationModel model = produce(new StageAttempt(1, Set.of()));

        assertEquals(3, model.getVariables().size());
        assertTrue(model.getVariables().stream().allMatch(v -> v.getKind() == VariableKind.CONTINUOUS));
        assertEquals("45*x1 + 50*x2 + 55*x3", model.getObjective().getExpression());
        assertEquals(ObjectiveDirection.MINIMIZE, model.getObjective().getDirection());
        assertEquals("x1 + x2 + x3 >= 800", model.getConstraints().get(3).getExpression());
        assertEquals(List.of("step_1", "step_2", "step_3"),
                model.getReasoningTrace().stream().map(s -> s.getStepName()).toList());
    }

    @Test
    void legacyShapesAreRepaired() {
        client.answer(MODEL, """
                The model is:
                {
                  "model_type": "linear_programming",
                  "variables": [{"name": "x1", "type": "continuous", "bounds": [0, 100]},
                                {"name": "x2", "type": "integer", "bounds": [5, null]}],
                  "constraints": [{"expression": "x1 + x2 <= 50", "type": "inequality"}],
                  "objective": "maximize 10*x1 + 15*x2",
                  "reasoning_trace": ["declare", "constrain"]
                }
                """);

        OptimizationModel model = produce(new StageAttempt(1, Set.of()));

        assertEquals(ObjectiveDirection.MAXIMIZE, model.getObjective().getDirection());
        assertEquals("10*x1 + 15*x2", model.getObjective().getExpression());
        assertEquals(100.0, model.getVariables().get(0).getUpperBound());
        assertEquals(VariableKind.INTEGER, model.getVariables().get(1).getKind());
        assertEquals(5.0, model.getVariables().get(1).getLowerBound());
        assertNull(model.getVariables().get(1).getUpperBound());
        assertEquals("step_2", model.getReasoningTrace().get(1).getStepName());
        assertEquals("constrain", model.getReasoningTrace().get(1).getText());
    }

    @Test
    void unparseableResponseIsAValidationFailure() {
        client.answer(MODEL, "I am unable to formulate this problem.");

        StageValidationException e = assertThrows(StageValidationException.class,
                () -> produce(new StageAttempt(1, Set.of())));

        assertEquals(ErrorKind.VALIDATION_FAILURE, e.getKind());
    }

    @Test
    void unknownEnumValueIsAValidationFailure() {
        client.answer(MODEL, """
                {"model_type": "lp", "variables": [{"name": "x", "kind": "fractional"}],
                 "constraints": [], "objective": {"direction": "minimize", "expression": "x"}}
                """);

        assertThrows(StageValidationException.class, () -> produce(new StageAttempt(1, Set.of())));
    }

    @Test
    void attemptRecordsRegionAndPricedUsage() {
        client.answer(MODEL, Payloads.MODEL_DEMAND_800);
        StageAttempt attempt = new StageAttempt(1, Set.of());

        produce(attempt);

        assertEquals("us-east-1", attempt.getRegionId());
        assertEquals(400, attempt.getUsage().getInputTokens());
        assertEquals(100, attempt.getUsage().getOutputTokens());
        assertEquals(0.001, attempt.getUsage().getEstimatedCost(), 1e-9);
        assertEquals(MODEL, client.requests().get(0).getModelId());
        assertEquals("OptimizationModel", client.requests().get(0).getResponseSchema().path("title").asText());
    }
}
