package com.dcision.pipeline.domain;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * The four pipeline stages, in execution order.
 */
public enum StageName {
    INTENT,
    DATA_ANALYSIS,
    MODEL_BUILDING,
    SOLVING;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
