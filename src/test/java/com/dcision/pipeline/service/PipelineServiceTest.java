package com.dcision.pipeline.service;

import com.dcision.pipeline.domain.PipelineRun;
import com.dcision.pipeline.domain.ProblemRequest;
import com.dcision.pipeline.domain.RunStatus;
import com.dcision.pipeline.domain.StageEvent;
import com.dcision.pipeline.domain.StageName;
import com.dcision.pipeline.domain.StageOutcome;
import com.dcision.pipeline.exception.RunNotFoundException;
import com.dcision.pipeline.routing.RegionHealthSnapshot;
import com.dcision.pipeline.routing.RegionStatus;
import com.dcision.pipeline.support.Payloads;
import com.dcision.pipeline.support.PipelineFixture;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static com.dcision.pipeline.support.PipelineFixture.BUILDER_MODEL;
import static com.dcision.pipeline.support.PipelineFixture.INTENT_MODEL;
import static org.junit.jupiter.api.Assertions.*;

class PipelineServiceTest {

    private final PipelineFixture fixture = new PipelineFixture();
    private PipelineService service;

    @BeforeEach
    void setUp() {
        fixture.scripted().build();
        service = fixture.service();
    }

    @AfterEach
    void tearDown() {
        fixture.close();
    }

    private PipelineRun awaitTerminal(String runId) throws InterruptedException {
        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(30);
        PipelineRun run = service.getStatus(runId);
        while (!run.isTerminal()) {
            assertTrue(System.nanoTime() < deadline, "run " + runId + " did not finish");
            Thread.sleep(20);
            run = service.getStatus(runId);
        }
        return run;
    }

    @Test
    void submittedRunCanBePolledToCompletion() throws Exception {
        String runId = service.submit(Payloads.PRODUCTION_PROBLEM, Map.of("units", "tons"));

        assertNotNull(runId);
        PipelineRun run = awaitTerminal(runId);

        assertEquals(runId, run.getRunId());
        assertEquals(RunStatus.COMPLETED, run.getStatus());
        assertEquals("tons", run.getRequest().getHints().get("units"));
        assertEquals(15350.0, run.getSolution().getObjectiveValue(), 1e-6);
        assertEquals(fixture.clock.instant(), run.getStartedAt());
    }

    @Test
    void blankProblemTextIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> service.submit("  ", Map.of()));
        assertThrows(IllegalArgumentException.class, () -> service.submit(null, null));
    }

    @Test
    void duplicateRequestIdIsRejected() {
        ProblemRequest request = ProblemRequest.of(Payloads.PRODUCTION_PROBLEM);
        service.submit(request);

        assertThrows(IllegalArgumentException.class, () -> service.submit(request));
    }

    @Test
    void unknownRunIsNotFound() {
        assertThrows(RunNotFoundException.class, () -> service.getStatus("missing"));
        assertThrows(RunNotFoundException.class, () -> service.cancel("missing"));
    }

    @Test
    void runsExpireAfterRetention() throws Exception {
        String runId = service.submit(Payloads.PRODUCTION_PROBLEM, Map.of());
        awaitTerminal(runId);

        fixture.ticker.advance(fixture.properties.getRunRetention().plus(Duration.ofMinutes(1)));

        assertThrows(RunNotFoundException.class, () -> service.getStatus(runId));
    }

    @Test
    void cancellingAFinishedRunChangesNothing() throws Exception {
        String runId = service.submit(Payloads.PRODUCTION_PROBLEM, Map.of());
        awaitTerminal(runId);

        CancellationAck ack = service.cancel(runId);

        assertFalse(ack.isCancelled());
        assertEquals(RunStatus.COMPLETED, ack.getStatus());
        assertEquals(RunStatus.COMPLETED, service.getStatus(runId).getStatus());
    }

    @Test
    void cancellingInFlightRunStopsItAndCachesNothing() throws Exception {
        CountDownLatch gate = fixture.client.gate(BUILDER_MODEL);
        String runId = service.submit(Payloads.PRODUCTION_PROBLEM, Map.of());
        assertTrue(fixture.client.gateEntered().await(10, TimeUnit.SECONDS));

        CancellationAck ack = service.cancel(runId);

        assertTrue(ack.isCancelled());
        assertEquals(RunStatus.CANCELLED, ack.getStatus());
        PipelineRun run = service.getStatus(runId);
        assertEquals(RunStatus.CANCELLED, run.getStatus());
        assertNull(run.getModel());
        StageEvent last = run.getEvents().get(run.getEvents().size() - 1);
        assertEquals(StageName.MODEL_BUILDING, last.getStage());
        assertEquals(StageOutcome.CANCELLED, last.getOutcome());

        gate.countDown();
        PipelineRun rerun = fixture.orchestrator.run(ProblemRequest.of(Payloads.PRODUCTION_PROBLEM));

        assertEquals(RunStatus.COMPLETED, rerun.getStatus());
        assertEquals(2, fixture.client.calls(BUILDER_MODEL));
        assertTrue(rerun.getEvents().get(1).isCacheHit());
        assertFalse(rerun.getEvents().get(2).isCacheHit());
    }

    @Test
    void cancelledCallDoesNotCountAgainstItsRegion() throws Exception {
        CountDownLatch gate = fixture.client.gate(INTENT_MODEL);
        try {
            String runId = service.submit(Payloads.PRODUCTION_PROBLEM, Map.of());
            assertTrue(fixture.client.gateEntered().await(10, TimeUnit.SECONDS));

            assertTrue(service.cancel(runId).isCancelled());

            long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(10);
            while (fixture.router.snapshot().stream().anyMatch(r -> r.getInFlight() > 0)) {
                assertTrue(System.nanoTime() < deadline, "cancelled call still holds its region");
                Thread.sleep(20);
            }
            for (RegionHealthSnapshot region : fixture.router.snapshot()) {
                assertEquals(0, region.getConsecutiveFailures(), region.getRegionId());
                assertEquals(0, region.getTotalFailures(), region.getRegionId());
                assertEquals(RegionStatus.HEALTHY, region.getStatus());
            }
        } finally {
            gate.countDown();
        }
    }

    @Test
    void cancellingQueuedRunPreventsItFromStarting() throws Exception {
        ExecutorService single = Executors.newSingleThreadExecutor();
        CountDownLatch blocker = new CountDownLatch(1);
        try {
            single.submit(() -> {
                blocker.await();
                return null;
            });
            PipelineService queued = new PipelineService(fixture.orchestrator, single, fixture.properties,
                    fixture.clock, fixture.ticker);
            String runId = queued.submit(Payloads.PRODUCTION_PROBLEM, Map.of());

            CancellationAck ack = queued.cancel(runId);
            blocker.countDown();

            assertTrue(ack.isCancelled());
            assertEquals(RunStatus.CANCELLED, queued.getStatus(runId).getStatus());
            assertEquals(List.of(), queued.getStatus(runId).getEvents());
            single.shutdown();
            assertTrue(single.awaitTermination(5, TimeUnit.SECONDS));
            assertEquals(0, fixture.client.calls(INTENT_MODEL));
        } finally {
            single.shutdownNow();
        }
    }
}
