package com.dcision.pipeline.exception;

public class NoAvailableRegionException extends PipelineException {

    public NoAvailableRegionException(String capability) {
        super(ErrorKind.NO_AVAILABLE_REGION, "No available region serves capability '" + capability + "'");
    }
}
