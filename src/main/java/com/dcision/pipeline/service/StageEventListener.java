package com.dcision.pipeline.service;

import com.dcision.pipeline.domain.StageEvent;

/**
 * Receives every stage transition of every run. Called on the run's worker thread;
 * implementations must be quick and must not throw.
 */
public interface StageEventListener {

    void onStageEvent(StageEvent event);
}
