package com.dcision.pipeline.routing;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum RegionStatus {
    HEALTHY,
    // out of rotation until the cooldown elapses
    UNHEALTHY,
    // cooldown elapsed; a single trial call decides
    PROBING;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
