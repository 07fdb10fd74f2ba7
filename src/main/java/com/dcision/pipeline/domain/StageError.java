package com.dcision.pipeline.domain;

import com.dcision.pipeline.exception.ErrorKind;
import com.dcision.pipeline.exception.PipelineException;
import com.dcision.pipeline.exception.StageValidationException;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * The last error of a failed stage, as surfaced to the caller.
 */
@Value
@Builder
public class StageError {
    ErrorKind kind;
    String message;

    @Singular("diagnostic")
    List<String> diagnostics;

    public static StageError from(PipelineException e) {
        StageErrorBuilder builder = StageError.builder()
                .kind(e.getKind())
                .message(e.getMessage());
        if (e instanceof StageValidationException validation) {
            builder.diagnostics(validation.getDiagnostics());
        }
        return builder.build();
    }
}
