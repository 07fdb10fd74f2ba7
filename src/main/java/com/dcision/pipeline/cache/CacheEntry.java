package com.dcision.pipeline.cache;

import com.dcision.pipeline.domain.StageName;
import lombok.Value;

import java.time.Duration;
import java.time.Instant;

/**
 * A validated stage output stored under its fingerprint.
 */
@Value
public class CacheEntry {
    String fingerprint;
    StageName stageName;
    Object payload;
    Instant createdAt;
    Duration ttl;
}
