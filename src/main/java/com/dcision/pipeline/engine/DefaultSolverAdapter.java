package com.dcision.pipeline.engine;

import com.dcision.pipeline.domain.OptimizationModel;
import com.dcision.pipeline.domain.SolutionRecord;
import com.dcision.pipeline.domain.SolverRequirements;
import com.dcision.pipeline.exception.ErrorKind;
import com.dcision.pipeline.exception.SolverException;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Slf4j
public class DefaultSolverAdapter implements SolverAdapter {

    private final Map<String, SolverBackend> backends = new LinkedHashMap<>();

    public DefaultSolverAdapter(List<? extends SolverBackend> backends) {
        backends.forEach(b -> this.backends.put(b.id(), b));
    }

    @Override
    public SolutionRecord solve(OptimizationModel model, SolverRequirements requirements) {
        if (model.getVariables().isEmpty() || model.getConstraints().isEmpty()) {
            throw new SolverException(ErrorKind.DEGENERATE_MODEL, null,
                    "Model has " + model.getVariables().size() + " variables and "
                            + model.getConstraints().size() + " constraints");
        }

        NormalizedModel normalized = ModelNormalizer.normalize(model);
        boolean integral = normalized.isIntegral();

        List<String> order = new ArrayList<>(requirements.getPrimary());
        order.addAll(requirements.getFallback());

        SolverException lastError = null;
        for (String solverId : order) {
            SolverBackend backend = backends.get(solverId);
            if (backend == null) {
                log.warn("Solver {} is not configured, skipping", solverId);
                continue;
            }
            if (integral && !backend.supportsIntegers()) {
                log.debug("Solver {} cannot handle integer variables, skipping", solverId);
                continue;
            }
            try {
                return backend.solve(normalized);
            } catch (SolverException e) {
                if (e.getKind() != ErrorKind.ADAPTER_ERROR && e.getKind() != ErrorKind.UNSUPPORTED_CAPABILITY) {
                    throw e;
                }
                log.warn("Solver {} failed: {}", solverId, e.getMessage());
                lastError = e;
            }
        }

        if (lastError == null) {
            throw new SolverException(ErrorKind.UNSUPPORTED_CAPABILITY, null,
                    "No declared solver supports this model (declared " + order
                            + (integral ? ", integer variables required)" : ")"));
        }
        throw new SolverException(ErrorKind.ADAPTER_ERROR, lastError.getSolverId(),
                "Every declared solver failed; last error: " + lastError.getMessage(), lastError);
    }
}
