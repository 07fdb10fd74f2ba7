package com.dcision.pipeline.service;

import com.dcision.pipeline.domain.PipelineRun;
import com.dcision.pipeline.domain.ProblemRequest;
import com.dcision.pipeline.domain.RunStatus;
import com.dcision.pipeline.domain.SolveStatus;
import com.dcision.pipeline.domain.StageEvent;
import com.dcision.pipeline.domain.StageName;
import com.dcision.pipeline.domain.StageOutcome;
import com.dcision.pipeline.domain.VariableKind;
import com.dcision.pipeline.exception.ErrorKind;
import com.dcision.pipeline.exception.InferenceException;
import com.dcision.pipeline.support.Payloads;
import com.dcision.pipeline.support.PipelineFixture;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static com.dcision.pipeline.support.PipelineFixture.ANALYSIS_MODEL;
import static com.dcision.pipeline.support.PipelineFixture.BUILDER_MODEL;
import static com.dcision.pipeline.support.PipelineFixture.INTENT_MODEL;
import static org.junit.jupiter.api.Assertions.*;

class PipelineOrchestratorTest {

    private final PipelineFixture fixture = new PipelineFixture();

    @AfterEach
    void tearDown() {
        fixture.close();
    }

    private PipelineRun run() {
        return fixture.orchestrator.run(ProblemRequest.of(Payloads.PRODUCTION_PROBLEM));
    }

    private List<StageEvent> eventsOf(PipelineRun run) {
        return fixture.events.stream().filter(e -> e.getRunId().equals(run.getRunId())).toList();
    }

    @Test
    void productionPlanIsSolvedAtFullCapacity() {
        fixture.scripted().build();

        PipelineRun run = run();

        assertEquals(RunStatus.COMPLETED, run.getStatus(), () -> String.valueOf(run.getError()));
        assertEquals("production_planning", run.getIntent().getIntentLabel());
        assertEquals(3, run.getModel().getVariables().size());
        assertTrue(run.getModel().getVariables().stream().allMatch(v -> v.getKind() == VariableKind.CONTINUOUS));
        assertEquals("45*x1 + 50*x2 + 55*x3", run.getModel().getObjective().getExpression());
        assertEquals(SolveStatus.OPTIMAL, run.getSolution().getStatus());
        assertEquals(15350.0, run.getSolution().getObjectiveValue(), 1e-6);
        assertEquals(120.0, run.getSolution().getVariableValues().get("x1"), 1e-6);
        assertEquals(100.0, run.getSolution().getVariableValues().get("x2"), 1e-6);
        assertEquals(90.0, run.getSolution().getVariableValues().get("x3"), 1e-6);
        assertEquals("glop", run.getSolution().getSolverUsed());

        assertEquals(List.of(StageName.INTENT, StageName.DATA_ANALYSIS, StageName.MODEL_BUILDING, StageName.SOLVING),
                run.getEvents().stream().map(StageEvent::getStage).toList());
        assertTrue(run.getEvents().stream().allMatch(e -> e.getOutcome() == StageOutcome.SUCCEEDED));
        assertNull(run.getEvents().get(3).getRegionId());
        assertEquals(3 * 400, run.getUsage().getInputTokens());
        assertEquals(3 * 100, run.getUsage().getOutputTokens());
        assertTrue(run.getUsage().getEstimatedCost() > 0);
        assertNotNull(run.getFinishedAt());
    }

    @Test
    void demandAboveCapacityCompletesAsInfeasible() {
        fixture.scripted().client.answer(BUILDER_MODEL, Payloads.MODEL_DEMAND_800);
        fixture.build();

        PipelineRun run = run();

        assertEquals(RunStatus.COMPLETED, run.getStatus());
        assertEquals("x1 + x2 + x3 >= 800", run.getModel().getConstraints().get(3).getExpression());
        assertEquals(SolveStatus.INFEASIBLE, run.getSolution().getStatus());
        assertTrue(run.getSolution().getVariableValues().isEmpty());
    }

    @Test
    void identicalRequestIsServedFromCacheOnEveryStage() {
        fixture.scripted().build();

        PipelineRun first = run();
        PipelineRun second = run();

        assertNotEquals(first.getRunId(), second.getRunId());
        assertEquals(first.getIntent(), second.getIntent());
        assertEquals(first.getDataAnalysis(), second.getDataAnalysis());
        assertEquals(first.getModel(), second.getModel());
        assertEquals(first.getSolution(), second.getSolution());
        assertTrue(eventsOf(first).stream().noneMatch(StageEvent::isCacheHit));
        assertEquals(4, eventsOf(second).size());
        assertTrue(eventsOf(second).stream().allMatch(StageEvent::isCacheHit));
        assertTrue(eventsOf(second).stream().allMatch(e -> e.getAttempts() == 0));
        assertEquals(1, fixture.client.calls(INTENT_MODEL));
        assertEquals(1, fixture.client.calls(BUILDER_MODEL));
        assertEquals(0, second.getUsage().getInputTokens());
    }

    @Test
    void insufficientDataStopsBeforeModelBuilding() {
        fixture.scripted().client.answer(ANALYSIS_MODEL, Payloads.DATA_NOT_READY);
        fixture.build();

        PipelineRun run = run();

        assertEquals(RunStatus.FAILED, run.getStatus());
        assertEquals(StageName.DATA_ANALYSIS, run.getFailedStage());
        assertEquals(ErrorKind.INSUFFICIENT_DATA, run.getError().getKind());
        assertFalse(run.getError().getDiagnostics().isEmpty());
        assertEquals(1, fixture.client.calls(ANALYSIS_MODEL));
        assertEquals(0, fixture.client.calls(BUILDER_MODEL));
        assertNull(run.getModel());
        assertNull(run.getSolution());
        assertNotNull(run.getIntent());
    }

    @Test
    void invalidModelIsRetriedWithAFreshCallOnAnotherRegion() {
        fixture.scripted().client.thenAnswer(BUILDER_MODEL, Payloads.MODEL_NON_LINEAR);
        fixture.build();

        PipelineRun run = run();

        assertEquals(RunStatus.COMPLETED, run.getStatus());
        assertEquals(2, fixture.client.calls(BUILDER_MODEL));
        List<String> regions = fixture.client.regionsCalled(BUILDER_MODEL);
        assertNotEquals(regions.get(0), regions.get(1));
        StageEvent modelBuilding = run.getEvents().get(2);
        assertEquals(StageName.MODEL_BUILDING, modelBuilding.getStage());
        assertEquals(2, modelBuilding.getAttempts());
        assertEquals(regions.get(1), modelBuilding.getRegionId());
    }

    @Test
    void exhaustedRetriesFailTheRunWithoutPoisoningTheCache() {
        fixture.scripted().client.answer(BUILDER_MODEL, Payloads.MODEL_NON_LINEAR);
        fixture.build();

        PipelineRun failed = run();

        assertEquals(RunStatus.FAILED, failed.getStatus());
        assertEquals(StageName.MODEL_BUILDING, failed.getFailedStage());
        assertEquals(ErrorKind.VALIDATION_FAILURE, failed.getError().getKind());
        assertTrue(failed.getError().getDiagnostics().stream().anyMatch(d -> d.contains("non-linear")));
        assertEquals(3, fixture.client.calls(BUILDER_MODEL));
        assertEquals(StageOutcome.FAILED, failed.getEvents().get(2).getOutcome());
        assertEquals(5 * 400, failed.getUsage().getInputTokens());

        fixture.client.answer(BUILDER_MODEL, Payloads.MODEL_DEMAND_310);
        PipelineRun retried = run();

        assertEquals(RunStatus.COMPLETED, retried.getStatus());
        assertEquals(4, fixture.client.calls(BUILDER_MODEL));
        assertTrue(retried.getEvents().get(0).isCacheHit());
        assertFalse(retried.getEvents().get(2).isCacheHit());
    }

    @Test
    void backendErrorsAreRetriedElsewhere() {
        fixture.scripted().client.thenAnswer(INTENT_MODEL,
                new InferenceException(ErrorKind.RATE_LIMITED, null, "throttled"));
        fixture.build();

        PipelineRun run = run();

        assertEquals(RunStatus.COMPLETED, run.getStatus());
        List<String> regions = fixture.client.regionsCalled(INTENT_MODEL);
        assertEquals(2, regions.size());
        assertNotEquals(regions.get(0), regions.get(1));
    }

    @Test
    void missingRegionFailsTheStage() {
        fixture.scripted();
        fixture.properties.getRegions().forEach(r -> r.setModels(List.of(INTENT_MODEL, ANALYSIS_MODEL)));
        fixture.build();

        PipelineRun run = run();

        assertEquals(RunStatus.FAILED, run.getStatus());
        assertEquals(StageName.MODEL_BUILDING, run.getFailedStage());
        assertEquals(ErrorKind.NO_AVAILABLE_REGION, run.getError().getKind());
        assertEquals(3, run.getEvents().get(2).getAttempts());
    }

    @Test
    void slowCallsTimeOut() {
        fixture.scripted();
        fixture.properties.setInferenceTimeout(Duration.ofMillis(200));
        fixture.properties.setMaxRetries(1);
        fixture.build();
        CountDownLatch gate = fixture.client.gate(INTENT_MODEL);
        try {
            PipelineRun run = run();

            assertEquals(RunStatus.FAILED, run.getStatus());
            assertEquals(StageName.INTENT, run.getFailedStage());
            assertEquals(ErrorKind.TIMEOUT, run.getError().getKind());
            assertEquals(2, fixture.client.calls(INTENT_MODEL));
        } finally {
            gate.countDown();
        }
    }

    @Test
    void concurrentIdenticalRunsShareOneComputation() throws Exception {
        fixture.scripted().build();
        CountDownLatch gate = fixture.client.gate(INTENT_MODEL);

        List<Future<PipelineRun>> runs = new ArrayList<>();
        for (int i = 0; i < 5; i++) {
            runs.add(fixture.workers.submit(this::run));
        }
        assertTrue(fixture.client.gateEntered().await(5, TimeUnit.SECONDS));
        Thread.sleep(200);
        gate.countDown();

        for (Future<PipelineRun> future : runs) {
            assertEquals(RunStatus.COMPLETED, future.get(30, TimeUnit.SECONDS).getStatus());
        }
        assertEquals(1, fixture.client.calls(INTENT_MODEL));
        assertEquals(1, fixture.client.calls(ANALYSIS_MODEL));
        assertEquals(1, fixture.client.calls(BUILDER_MODEL));
        assertEquals(4, fixture.events.stream().filter(e -> e.getStage() == StageName.INTENT)
                .filter(StageEvent::isCacheHit).count());
    }
}
