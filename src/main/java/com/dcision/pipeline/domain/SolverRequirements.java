package com.dcision.pipeline.domain;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Solver ids the intent stage declared for a problem: primary ones first, fallback ones
 * only when every primary solver is unusable.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class SolverRequirements {
    @Singular("primarySolver")
    List<String> primary;

    @Singular("fallbackSolver")
    List<String> fallback;

    @JsonIgnore
    public Set<String> declaredSolvers() {
        Set<String> all = new LinkedHashSet<>(primary);
        all.addAll(fallback);
        return all;
    }
}
