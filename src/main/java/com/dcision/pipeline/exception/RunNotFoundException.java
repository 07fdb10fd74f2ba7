package com.dcision.pipeline.exception;

public class RunNotFoundException extends RuntimeException {

    public RunNotFoundException(String runId) {
        super("Unknown pipeline run: " + runId);
    }
}
