package com.dcision.pipeline.stage;

import com.dcision.pipeline.config.PipelineProperties;
import com.dcision.pipeline.domain.InferenceUsage;
import com.dcision.pipeline.exception.ErrorKind;
import com.dcision.pipeline.exception.InferenceException;
import com.dcision.pipeline.exception.PipelineException;
import com.dcision.pipeline.inference.InferenceClient;
import com.dcision.pipeline.inference.InferenceRequest;
import com.dcision.pipeline.inference.InferenceResponse;
import com.dcision.pipeline.routing.RegionDescriptor;
import com.dcision.pipeline.routing.RegionRouter;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Routes one inference call: picks a region, calls it, reports the outcome back to the
 * router and prices the tokens it used.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class InferenceGateway {

    private final RegionRouter router;
    private final InferenceClient client;
    private final PipelineProperties properties;

    public InferenceResponse call(String modelId, String prompt, JsonNode schema, StageAttempt attempt) {
        String regionId = router.select(modelId, attempt.getExcludedRegions());
        attempt.routedTo(regionId);

        InferenceRequest request = InferenceRequest.builder()
                .modelId(modelId)
                .regionId(regionId)
                .prompt(prompt)
                .responseSchema(schema)
                .maxTokens(properties.getInference().getMaxTokens())
                .temperature(properties.getInference().getTemperature())
                .build();

        long start = System.nanoTime();
        boolean success = false;
        try {
            InferenceResponse response = client.complete(request);
            success = true;
            attempt.consumed(price(regionId, response));
            log.debug("Region {} answered {} in {} ms ({} in / {} out tokens)", regionId, modelId,
                    response.getLatencyMs(), response.getInputTokens(), response.getOutputTokens());
            return response;
        } catch (PipelineException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new InferenceException(ErrorKind.BACKEND_UNAVAILABLE, regionId,
                    "Inference call to " + regionId + " failed: " + e.getMessage(), e);
        } finally {
            if (!success && attempt.isCancelled()) {
                // the run was cancelled under this call; says nothing about the region
                router.release(regionId);
            } else {
                router.reportOutcome(regionId, success, (System.nanoTime() - start) / 1_000_000);
            }
        }
    }

    private InferenceUsage price(String regionId, InferenceResponse response) {
        RegionDescriptor region = router.descriptor(regionId);
        double rate = region == null ? 0.0 : region.getCostPerThousandTokens();
        long tokens = response.getInputTokens() + response.getOutputTokens();
        return new InferenceUsage(response.getInputTokens(), response.getOutputTokens(), tokens / 1000.0 * rate);
    }
}
