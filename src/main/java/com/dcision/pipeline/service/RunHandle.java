package com.dcision.pipeline.service;

import com.dcision.pipeline.domain.PipelineRun;
import com.dcision.pipeline.domain.ProblemRequest;
import com.dcision.pipeline.exception.PipelineCancelledException;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.UnaryOperator;

/**
 * Live state of one run, shared between the worker executing it and callers querying or
 * cancelling it. The run snapshot only moves forward: once terminal it never changes.
 */
public class RunHandle {

    private final ProblemRequest request;
    private final AtomicReference<PipelineRun> state;
    private final CountDownLatch finished = new CountDownLatch(1);
    // set by whoever gets there first: the worker starting the run or a cancel before it started
    private final AtomicBoolean claimed = new AtomicBoolean();

    private volatile boolean cancelRequested;
    private volatile Future<?> worker;
    private volatile Future<?> inFlightCall;

    public RunHandle(ProblemRequest request, Instant now) {
        this.request = request;
        this.state = new AtomicReference<>(PipelineRun.started(request, now));
    }

    public String getRunId() {
        return request.getId();
    }

    public ProblemRequest getRequest() {
        return request;
    }

    public PipelineRun snapshot() {
        return state.get();
    }

    /**
     * Applies {@code change} unless the run is already terminal.
     */
    public PipelineRun update(UnaryOperator<PipelineRun> change) {
        PipelineRun updated = state.updateAndGet(run -> run.isTerminal() ? run : change.apply(run));
        if (updated.isTerminal()) {
            finished.countDown();
        }
        return updated;
    }

    public boolean isCancelRequested() {
        return cancelRequested;
    }

    /**
     * @throws PipelineCancelledException if cancellation was requested
     */
    public void checkNotCancelled() {
        if (cancelRequested) {
            throw new PipelineCancelledException("Run " + getRunId() + " was cancelled");
        }
    }

    /**
     * Flags the run as cancelled and interrupts the call in flight, if any.
     */
    public void requestCancel() {
        cancelRequested = true;
        Future<?> call = inFlightCall;
        if (call != null) {
            call.cancel(true);
        }
        Future<?> run = worker;
        if (run != null) {
            run.cancel(true);
        }
    }

    /**
     * Claims the run for execution. Returns false if a cancel got there first.
     */
    boolean claimForExecution() {
        return claimed.compareAndSet(false, true);
    }

    /**
     * Claims the run for cancellation before it started. Returns false if it already started.
     */
    boolean claimBeforeStart() {
        return claimed.compareAndSet(false, true);
    }

    void attachWorker(Future<?> worker) {
        this.worker = worker;
        if (cancelRequested) {
            worker.cancel(true);
        }
    }

    void attachCall(Future<?> call) {
        this.inFlightCall = call;
        if (cancelRequested) {
            call.cancel(true);
        }
    }

    void detachCall() {
        this.inFlightCall = null;
    }

    public boolean awaitTerminal(Duration timeout) throws InterruptedException {
        return finished.await(timeout.toMillis(), TimeUnit.MILLISECONDS);
    }
}
