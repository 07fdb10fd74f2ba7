package com.dcision.pipeline.service;

import com.dcision.pipeline.domain.StageEvent;
import com.dcision.pipeline.domain.StageOutcome;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

@Slf4j
@Component
public class LoggingStageEventListener implements StageEventListener {

    @Override
    public void onStageEvent(StageEvent event) {
        if (event.getOutcome() == StageOutcome.SUCCEEDED) {
            log.info("stage_event run={} stage={} outcome={} duration_ms={} region={} cache_hit={} attempts={}",
                    event.getRunId(), event.getStage().wireName(), event.getOutcome().wireName(),
                    event.getDurationMs(), event.getRegionId(), event.isCacheHit(), event.getAttempts());
        } else {
            log.warn("stage_event run={} stage={} outcome={} duration_ms={} region={} cache_hit={} attempts={} error={}",
                    event.getRunId(), event.getStage().wireName(), event.getOutcome().wireName(),
                    event.getDurationMs(), event.getRegionId(), event.isCacheHit(), event.getAttempts(),
                    event.getErrorKind() == null ? null : event.getErrorKind().code());
        }
    }
}
