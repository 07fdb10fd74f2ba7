package com.dcision.pipeline.exception;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Failure taxonomy of the pipeline. Whether a kind is retried inside the orchestrator
 * is decided here and nowhere else.
 */
public enum ErrorKind {
    VALIDATION_FAILURE("ValidationFailure", true),
    INSUFFICIENT_DATA("InsufficientData", false),
    NO_AVAILABLE_REGION("NoAvailableRegion", true),
    BACKEND_UNAVAILABLE("BackendUnavailable", true),
    RATE_LIMITED("RateLimited", true),
    MALFORMED_RESPONSE("MalformedResponse", true),
    TIMEOUT("Timeout", true),
    DEGENERATE_MODEL("DegenerateModel", false),
    UNSUPPORTED_CAPABILITY("UnsupportedCapability", false),
    ADAPTER_ERROR("AdapterError", true),
    CANCELLED("Cancelled", false),
    INTERNAL("Internal", false);

    private final String code;
    private final boolean retryable;

    ErrorKind(String code, boolean retryable) {
        this.code = code;
        this.retryable = retryable;
    }

    @JsonValue
    public String code() {
        return code;
    }

    public boolean isRetryable() {
        return retryable;
    }
}
