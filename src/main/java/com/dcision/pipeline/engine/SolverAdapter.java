package com.dcision.pipeline.engine;

import com.dcision.pipeline.domain.OptimizationModel;
import com.dcision.pipeline.domain.SolutionRecord;
import com.dcision.pipeline.domain.SolverRequirements;

import java.util.List;

public interface SolverAdapter {

    /**
     * Solves with the first usable primary solver, or the first usable fallback solver when
     * every primary one lacks a required capability or fails at adapter level.
     */
    SolutionRecord solve(OptimizationModel model, SolverRequirements requirements);

    default SolutionRecord solve(OptimizationModel model, List<String> preferredSolverIds) {
        return solve(model, SolverRequirements.builder().primary(preferredSolverIds).build());
    }
}
