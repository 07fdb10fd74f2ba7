package com.dcision.pipeline.exception;

import lombok.Getter;

/**
 * Typed failure of an inference backend call: Timeout, RateLimited, BackendUnavailable
 * or MalformedResponse.
 */
@Getter
public class InferenceException extends PipelineException {

    private final String regionId;

    public InferenceException(ErrorKind kind, String regionId, String message) {
        super(kind, message);
        this.regionId = regionId;
    }

    public InferenceException(ErrorKind kind, String regionId, String message, Throwable cause) {
        super(kind, message, cause);
        this.regionId = regionId;
    }
}
