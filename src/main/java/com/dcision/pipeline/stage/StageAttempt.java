package com.dcision.pipeline.stage;

import com.dcision.pipeline.domain.InferenceUsage;
import lombok.Getter;

import java.util.Set;
import java.util.function.BooleanSupplier;

/**
 * One try of a stage. The call may run on another thread, so the region it was routed to
 * and the tokens it consumed are published here for the orchestrator to read afterwards.
 */
public class StageAttempt {

    @Getter
    private final int number;
    @Getter
    private final Set<String> excludedRegions;

    private final BooleanSupplier cancelled;

    private volatile String regionId;
    private volatile InferenceUsage usage = InferenceUsage.NONE;

    public StageAttempt(int number, Set<String> excludedRegions) {
        this(number, excludedRegions, () -> false);
    }

    /**
     * @param cancelled whether the run owning this attempt has been cancelled
     */
    public StageAttempt(int number, Set<String> excludedRegions, BooleanSupplier cancelled) {
        this.number = number;
        this.excludedRegions = Set.copyOf(excludedRegions);
        this.cancelled = cancelled;
    }

    public boolean isCancelled() {
        return cancelled.getAsBoolean();
    }

    public String getRegionId() {
        return regionId;
    }

    void routedTo(String regionId) {
        this.regionId = regionId;
    }

    public InferenceUsage getUsage() {
        return usage;
    }

    void consumed(InferenceUsage usage) {
        this.usage = this.usage.plus(usage);
    }
}
