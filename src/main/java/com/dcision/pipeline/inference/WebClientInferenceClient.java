package com.dcision.pipeline.inference;

import com.dcision.pipeline.config.PipelineProperties;
import com.dcision.pipeline.exception.ErrorKind;
import com.dcision.pipeline.exception.InferenceException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.Exceptions;

import java.time.Duration;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeoutException;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Calls a regional inference endpoint speaking the Bedrock messages format:
 * {@code POST {endpoint}/model/{modelId}/invoke}.
 */
@Slf4j
@Component
public class WebClientInferenceClient implements InferenceClient {

    private static final String ANTHROPIC_VERSION = "bedrock-2023-05-31";

    private final WebClient webClient;
    private final ObjectMapper objectMapper;
    private final Map<String, PipelineProperties.Region> regions;
    private final Duration timeout;

    public WebClientInferenceClient(WebClient.Builder webClientBuilder, ObjectMapper objectMapper,
                                    PipelineProperties properties) {
        this.webClient = webClientBuilder.build();
        this.objectMapper = objectMapper;
        this.regions = properties.getRegions().stream()
                .collect(Collectors.toMap(PipelineProperties.Region::getId, Function.identity()));
        this.timeout = properties.getInferenceTimeout();
    }

    @Override
    public InferenceResponse complete(InferenceRequest request) {
        PipelineProperties.Region region = regions.get(request.getRegionId());
        if (region == null || region.getEndpoint() == null) {
            throw new InferenceException(ErrorKind.BACKEND_UNAVAILABLE, request.getRegionId(),
                    "No endpoint configured for region " + request.getRegionId());
        }

        long start = System.nanoTime();
        String body = post(region, request);
        long latencyMs = (System.nanoTime() - start) / 1_000_000;

        try {
            JsonNode root = objectMapper.readTree(body);
            JsonNode text = root.path("content").path(0).path("text");
            if (!text.isTextual()) {
                throw new InferenceException(ErrorKind.MALFORMED_RESPONSE, region.getId(),
                        "Response has no content[0].text");
            }
            JsonNode usage = root.path("usage");
            return InferenceResponse.builder()
                    .regionId(region.getId())
                    .rawPayload(text.asText())
                    .latencyMs(latencyMs)
                    .inputTokens(usage.path("input_tokens").asLong(0))
                    .outputTokens(usage.path("output_tokens").asLong(0))
                    .build();
        } catch (JsonProcessingException e) {
            throw new InferenceException(ErrorKind.MALFORMED_RESPONSE, region.getId(),
                    "Response body is not JSON: " + e.getOriginalMessage(), e);
        }
    }

    private String post(PipelineProperties.Region region, InferenceRequest request) {
        Map<String, Object> payload = new HashMap<>();
        payload.put("anthropic_version", ANTHROPIC_VERSION);
        payload.put("max_tokens", request.getMaxTokens());
        payload.put("temperature", request.getTemperature());
        payload.put("system", systemPrompt(request.getResponseSchema()));
        payload.put("messages", List.of(Map.of("role", "user", "content", request.getPrompt())));

        try {
            String body = webClient.post()
                    .uri(region.getEndpoint() + "/model/{modelId}/invoke", request.getModelId())
                    .headers(h -> {
                        if (region.getApiKey() != null && !region.getApiKey().isEmpty()) {
                            h.setBearerAuth(region.getApiKey());
                        }
                    })
                    .bodyValue(payload)
                    .retrieve()
                    .bodyToMono(String.class)
                    .timeout(timeout)
                    .block();
            if (body == null) {
                throw new InferenceException(ErrorKind.MALFORMED_RESPONSE, region.getId(), "Empty response body");
            }
            return body;
        } catch (WebClientResponseException e) {
            throw new InferenceException(classify(e), region.getId(),
                    "Region " + region.getId() + " answered " + e.getStatusCode().value(), e);
        } catch (WebClientRequestException e) {
            throw new InferenceException(ErrorKind.BACKEND_UNAVAILABLE, region.getId(),
                    "Region " + region.getId() + " unreachable: " + e.getMessage(), e);
        } catch (InferenceException e) {
            throw e;
        } catch (RuntimeException e) {
            Throwable cause = Exceptions.unwrap(e);
            if (cause instanceof TimeoutException) {
                throw new InferenceException(ErrorKind.TIMEOUT, region.getId(),
                        "Region " + region.getId() + " did not answer within " + timeout, e);
            }
            if (cause instanceof InterruptedException) {
                Thread.currentThread().interrupt();
                throw new InferenceException(ErrorKind.TIMEOUT, region.getId(), "Call interrupted", e);
            }
            throw new InferenceException(ErrorKind.BACKEND_UNAVAILABLE, region.getId(), e.getMessage(), e);
        }
    }

    private static ErrorKind classify(WebClientResponseException e) {
        int status = e.getStatusCode().value();
        if (status == HttpStatus.TOO_MANY_REQUESTS.value()) {
            return ErrorKind.RATE_LIMITED;
        }
        if (status == HttpStatus.REQUEST_TIMEOUT.value() || status == HttpStatus.GATEWAY_TIMEOUT.value()) {
            return ErrorKind.TIMEOUT;
        }
        return ErrorKind.BACKEND_UNAVAILABLE;
    }

    private String systemPrompt(JsonNode schema) {
        return "You are an operations research assistant. Respond with a single JSON object "
                + "that conforms to this JSON schema and nothing else:\n" + schema;
    }
}
