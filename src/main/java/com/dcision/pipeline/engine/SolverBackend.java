package com.dcision.pipeline.engine;

import com.dcision.pipeline.domain.SolutionRecord;
import com.dcision.pipeline.exception.SolverException;

/**
 * One numeric solver. Infeasible and unbounded models come back as solution records;
 * a {@link SolverException} means the solver itself could not produce an answer.
 */
public interface SolverBackend {

    String id();

    boolean supportsIntegers();

    SolutionRecord solve(NormalizedModel model);
}
