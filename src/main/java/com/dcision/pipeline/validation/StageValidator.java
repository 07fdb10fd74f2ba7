package com.dcision.pipeline.validation;

import com.dcision.pipeline.domain.StageContext;

/**
 * Pure check of one stage's output. Implementations never call out and never mutate.
 *
 * @param <T> the stage output type
 */
public interface StageValidator<T> {

    ValidationResult validate(T output, StageContext context);
}
