package com.dcision.pipeline.exception;

import lombok.Getter;

/**
 * Adapter-level solver failure. Mathematical infeasibility is never reported this way.
 */
@Getter
public class SolverException extends PipelineException {

    private final String solverId;

    public SolverException(ErrorKind kind, String solverId, String message) {
        super(kind, message);
        this.solverId = solverId;
    }

    public SolverException(ErrorKind kind, String solverId, String message, Throwable cause) {
        super(kind, message, cause);
        this.solverId = solverId;
    }
}
