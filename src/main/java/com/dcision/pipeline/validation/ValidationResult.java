package com.dcision.pipeline.validation;

import com.dcision.pipeline.exception.ErrorKind;
import com.dcision.pipeline.exception.StageValidationException;
import lombok.Getter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Outcome of a validator: valid, or a failure kind with the diagnostics that caused it.
 * Built incrementally by the validator that owns it.
 */
public final class ValidationResult {

    private final List<Diagnostic> diagnostics = new ArrayList<>();
    @Getter
    private ErrorKind failureKind;

    public static ValidationResult ok() {
        return new ValidationResult();
    }

    public ValidationResult fail(String field, String message) {
        return fail(ErrorKind.VALIDATION_FAILURE, field, message);
    }

    public ValidationResult fail(ErrorKind kind, String field, String message) {
        diagnostics.add(new Diagnostic(field, message));
        // a business-rule stop outranks structural findings
        if (failureKind == null || kind == ErrorKind.INSUFFICIENT_DATA) {
            failureKind = kind;
        }
        return this;
    }

    public boolean isValid() {
        return diagnostics.isEmpty();
    }

    public List<Diagnostic> getDiagnostics() {
        return Collections.unmodifiableList(diagnostics);
    }

    public StageValidationException toException() {
        return new StageValidationException(failureKind,
                diagnostics.stream().map(Diagnostic::toString).toList());
    }

    /**
     * @throws StageValidationException if this result is not valid
     */
    public void throwIfInvalid() {
        if (!isValid()) {
            throw toException();
        }
    }
}
