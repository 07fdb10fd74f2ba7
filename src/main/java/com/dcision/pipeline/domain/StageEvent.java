package com.dcision.pipeline.domain;

import com.dcision.pipeline.exception.ErrorKind;
import lombok.Builder;
import lombok.Value;

/**
 * Stage transition emitted to observability listeners.
 */
@Value
@Builder
public class StageEvent {
    String runId;
    StageName stage;
    StageOutcome outcome;
    long durationMs;
    String regionId;
    boolean cacheHit;
    int attempts;
    ErrorKind errorKind;
}
