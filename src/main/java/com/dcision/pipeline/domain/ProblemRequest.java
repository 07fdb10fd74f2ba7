package com.dcision.pipeline.domain;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;
import java.util.Map;
import java.util.UUID;

/**
 * A single submission of a decision problem in natural language.
 */
@Value
@Builder
@Jacksonized
public class ProblemRequest {
    String id;
    String rawText;

    // Optional structured hints supplied by the caller (units, horizon, ...)
    @Singular
    Map<String, String> hints;

    Instant submittedAt;

    public static ProblemRequest of(String rawText) {
        return of(rawText, Map.of());
    }

    public static ProblemRequest of(String rawText, Map<String, String> hints) {
        return ProblemRequest.builder()
                .id(UUID.randomUUID().toString())
                .rawText(rawText)
                .hints(hints)
                .submittedAt(Instant.now())
                .build();
    }
}
