package com.dcision.pipeline.exception;

import lombok.Getter;

import java.util.List;

/**
 * A stage output was rejected by its validator. The kind is either
 * {@link ErrorKind#VALIDATION_FAILURE} or {@link ErrorKind#INSUFFICIENT_DATA}.
 */
@Getter
public class StageValidationException extends PipelineException {

    private final List<String> diagnostics;

    public StageValidationException(ErrorKind kind, List<String> diagnostics) {
        super(kind, String.join("; ", diagnostics));
        this.diagnostics = List.copyOf(diagnostics);
    }

    public static StageValidationException malformed(String diagnostic) {
        return new StageValidationException(ErrorKind.VALIDATION_FAILURE, List.of(diagnostic));
    }
}
