package com.dcision.pipeline.engine;

import com.dcision.pipeline.config.PipelineProperties;
import com.dcision.pipeline.domain.ObjectiveDirection;
import com.dcision.pipeline.domain.SolutionRecord;
import com.dcision.pipeline.domain.SolveStatus;
import com.dcision.pipeline.exception.ErrorKind;
import com.dcision.pipeline.exception.SolverException;
import com.google.ortools.Loader;
import com.google.ortools.linearsolver.MPConstraint;
import com.google.ortools.linearsolver.MPObjective;
import com.google.ortools.linearsolver.MPSolver;
import com.google.ortools.linearsolver.MPVariable;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * {@link SolverBackend} over an OR-Tools {@link MPSolver} engine such as GLOP, SCIP or CBC.
 */
@Slf4j
public class OrToolsSolverBackend implements SolverBackend {

    static {
        Loader.loadNativeLibraries();
    }

    private final String id;
    private final String engine;
    private final boolean integerSupport;
    private final Duration timeLimit;

    public OrToolsSolverBackend(String id, String engine, boolean integerSupport, Duration timeLimit) {
        this.id = id;
        this.engine = engine;
        this.integerSupport = integerSupport;
        this.timeLimit = timeLimit;
    }

    public static OrToolsSolverBackend from(PipelineProperties.Solver solver) {
        return new OrToolsSolverBackend(solver.getId(), solver.getEngine(), solver.isIntegerSupport(),
                solver.getTimeLimit());
    }

    @Override
    public String id() {
        return id;
    }

    @Override
    public boolean supportsIntegers() {
        return integerSupport;
    }

    @Override
    public SolutionRecord solve(NormalizedModel model) {
        if (model.isIntegral() && !integerSupport) {
            throw new SolverException(ErrorKind.UNSUPPORTED_CAPABILITY, id,
                    "Solver " + id + " does not handle integer variables");
        }

        long startTime = System.currentTimeMillis();
        MPSolver solver = MPSolver.createSolver(engine);
        if (solver == null) {
            log.error("Could not create solver {} for backend {}", engine, id);
            throw new SolverException(ErrorKind.ADAPTER_ERROR, id, "OR-Tools engine " + engine + " is not available");
        }

        try {
            if (timeLimit != null) {
                solver.setTimeLimit(timeLimit.toMillis());
            }

            Map<String, MPVariable> variables = new LinkedHashMap<>();
            for (NormalizedModel.NormalizedVariable v : model.getVariables()) {
                double lower = finite(v.getLowerBound());
                double upper = finite(v.getUpperBound());
                variables.put(v.getName(), v.isIntegral()
                        ? solver.makeIntVar(lower, upper, v.getName())
                        : solver.makeNumVar(lower, upper, v.getName()));
            }

            for (NormalizedModel.Row row : model.getRows()) {
                MPConstraint constraint = solver.makeConstraint(finite(row.getLowerBound()),
                        finite(row.getUpperBound()), row.getName());
                row.getCoefficients().forEach((name, coefficient) ->
                        constraint.setCoefficient(lookup(variables, name), coefficient));
            }

            MPObjective objective = solver.objective();
            model.getObjective().getCoefficients().forEach((name, coefficient) ->
                    objective.setCoefficient(lookup(variables, name), coefficient));
            objective.setOffset(model.getObjective().getConstant());
            if (model.getDirection() == ObjectiveDirection.MAXIMIZE) {
                objective.setMaximization();
            } else {
                objective.setMinimization();
            }

            final MPSolver.ResultStatus status = solver.solve();
            long elapsed = System.currentTimeMillis() - startTime;
            log.debug("Solver {} ({}) finished with {} in {} ms", id, engine, status, elapsed);

            SolutionRecord.SolutionRecordBuilder result = SolutionRecord.builder()
                    .solverUsed(id)
                    .solveTimeMs(elapsed);
            switch (status) {
                case OPTIMAL -> {
                    variables.forEach((name, variable) -> result.variableValue(name, variable.solutionValue()));
                    return result.status(SolveStatus.OPTIMAL).objectiveValue(objective.value()).build();
                }
                case INFEASIBLE -> {
                    return result.status(SolveStatus.INFEASIBLE).build();
                }
                case UNBOUNDED -> {
                    return result.status(SolveStatus.UNBOUNDED).build();
                }
                case MODEL_INVALID -> {
                    return result.status(SolveStatus.ERROR).build();
                }
                default -> throw new SolverException(ErrorKind.ADAPTER_ERROR, id,
                        "Solver " + id + " stopped without a proven optimum: " + status);
            }
        } finally {
            solver.delete();
        }
    }

    private MPVariable lookup(Map<String, MPVariable> variables, String name) {
        MPVariable variable = variables.get(name);
        if (variable == null) {
            throw new SolverException(ErrorKind.ADAPTER_ERROR, id, "Undeclared variable '" + name + "'");
        }
        return variable;
    }

    private static double finite(double bound) {
        if (bound == Double.POSITIVE_INFINITY) {
            return MPSolver.infinity();
        }
        if (bound == Double.NEGATIVE_INFINITY) {
            return -MPSolver.infinity();
        }
        return bound;
    }
}
