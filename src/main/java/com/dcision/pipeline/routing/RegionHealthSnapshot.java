package com.dcision.pipeline.routing;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class RegionHealthSnapshot {
    String regionId;
    RegionStatus status;
    double successRatio;
    double latencyMs;
    int inFlight;
    int consecutiveFailures;
    long totalCalls;
    long totalFailures;
}
