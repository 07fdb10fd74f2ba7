package com.dcision.pipeline.stage;

import com.dcision.pipeline.config.PipelineProperties;
import com.dcision.pipeline.exception.ErrorKind;
import com.dcision.pipeline.exception.InferenceException;
import com.dcision.pipeline.routing.RegionHealthSnapshot;
import com.dcision.pipeline.routing.RegionRouter;
import com.dcision.pipeline.support.MutableClock;
import com.dcision.pipeline.support.ScriptedInferenceClient;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class InferenceGatewayTest {

    private static final String MODEL = "intent-model";

    private final ScriptedInferenceClient client = new ScriptedInferenceClient();
    private RegionRouter router;
    private InferenceGateway gateway;

    @BeforeEach
    void setUp() {
        PipelineProperties properties = new PipelineProperties();
        PipelineProperties.Region region = new PipelineProperties.Region();
        region.setId("us-east-1");
        region.setModels(List.of(MODEL));
        properties.getRegions().add(region);
        router = new RegionRouter(properties, new MutableClock(Instant.EPOCH));
        gateway = new InferenceGateway(router, client, properties);
        client.answer(MODEL, new InferenceException(ErrorKind.TIMEOUT, "us-east-1", "Call interrupted"));
    }

    private void call(StageAttempt attempt) {
        assertThrows(InferenceException.class,
                () -> gateway.call(MODEL, "classify", JsonNodeFactory.instance.objectNode(), attempt));
    }

    @Test
    void failedCallCountsAgainstTheRegion() {
        call(new StageAttempt(1, Set.of()));

        RegionHealthSnapshot region = router.snapshot().get(0);
        assertEquals(1, region.getConsecutiveFailures());
        assertEquals(0, region.getInFlight());
    }

    @Test
    void callOfCancelledRunOnlyFreesItsSlot() {
        for (int i = 0; i < 3; i++) {
            call(new StageAttempt(1, Set.of(), () -> true));
        }

        RegionHealthSnapshot region = router.snapshot().get(0);
        assertEquals(0, region.getConsecutiveFailures());
        assertEquals(0, region.getTotalCalls());
        assertEquals(0, region.getInFlight());
        assertEquals("us-east-1", router.select(MODEL, Set.of()));
    }
}
