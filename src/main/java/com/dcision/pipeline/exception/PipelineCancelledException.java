package com.dcision.pipeline.exception;

public class PipelineCancelledException extends PipelineException {

    public PipelineCancelledException(String message) {
        super(ErrorKind.CANCELLED, message);
    }
}
