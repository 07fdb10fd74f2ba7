package com.dcision.pipeline.service;

import com.dcision.pipeline.domain.RunStatus;
import lombok.Value;

/**
 * Answer to a cancel request. {@code cancelled} is false when the run had already
 * finished before the request arrived; {@code status} is the run's status afterwards.
 */
@Value
public class CancellationAck {
    String runId;
    boolean cancelled;
    RunStatus status;
}
