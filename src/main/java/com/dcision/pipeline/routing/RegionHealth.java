package com.dcision.pipeline.routing;

import lombok.Getter;

import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Lock-free health counters of one region. Updates are individually atomic; concurrent
 * reports may interleave, which only blurs the rolling estimates.
 */
final class RegionHealth {

    private static final double NO_SAMPLE = -1.0;

    @Getter
    private final RegionDescriptor descriptor;

    private final AtomicInteger consecutiveFailures = new AtomicInteger();
    private final AtomicInteger inFlight = new AtomicInteger();
    private final AtomicLong successRatio = new AtomicLong(Double.doubleToLongBits(1.0));
    private final AtomicLong latencyMs = new AtomicLong(Double.doubleToLongBits(NO_SAMPLE));
    private final AtomicLong unhealthyUntil = new AtomicLong();
    private final AtomicBoolean probeInFlight = new AtomicBoolean();
    private final AtomicLong totalCalls = new AtomicLong();
    private final AtomicLong totalFailures = new AtomicLong();

    RegionHealth(RegionDescriptor descriptor) {
        this.descriptor = descriptor;
    }

    String id() {
        return descriptor.getId();
    }

    RegionStatus status(long nowMillis, int failureThreshold) {
        if (consecutiveFailures.get() < failureThreshold) {
            return RegionStatus.HEALTHY;
        }
        return nowMillis < unhealthyUntil.get() ? RegionStatus.UNHEALTHY : RegionStatus.PROBING;
    }

    /**
     * Failure-weighted latency: the decayed latency divided by the decayed success ratio.
     * A region without samples scores 0 so that it gets tried.
     */
    double score() {
        double latency = Double.longBitsToDouble(latencyMs.get());
        if (latency == NO_SAMPLE) {
            return 0.0;
        }
        return latency / Math.max(successRatio(), 0.01);
    }

    int consecutiveFailures() {
        return consecutiveFailures.get();
    }

    int inFlight() {
        return inFlight.get();
    }

    /**
     * Claims a call slot. A probing region hands out exactly one slot, the trial call.
     */
    boolean tryAcquire(long nowMillis, int failureThreshold) {
        switch (status(nowMillis, failureThreshold)) {
            case UNHEALTHY -> {
                return false;
            }
            case PROBING -> {
                if (!probeInFlight.compareAndSet(false, true)) {
                    return false;
                }
                inFlight.incrementAndGet();
                return true;
            }
            default -> {
                int max = descriptor.getMaxConcurrent();
                if (inFlight.incrementAndGet() > max && max > 0) {
                    inFlight.decrementAndGet();
                    return false;
                }
                return true;
            }
        }
    }

    /**
     * Records a finished call.
     *
     * @return true if this report took the region out of rotation
     */
    boolean record(boolean success, long callLatencyMs, long nowMillis, int failureThreshold,
                   long cooldownMillis, double latencyDecay, double successDecay) {
        inFlight.updateAndGet(n -> Math.max(0, n - 1));
        totalCalls.incrementAndGet();
        decay(successRatio, success ? 1.0 : 0.0, successDecay);
        decay(latencyMs, callLatencyMs, latencyDecay);
        boolean wasProbe = probeInFlight.getAndSet(false);

        if (success) {
            // a call that started before the region tripped does not end its cooldown
            if (wasProbe || consecutiveFailures.get() < failureThreshold || nowMillis >= unhealthyUntil.get()) {
                consecutiveFailures.set(0);
                unhealthyUntil.set(0);
            }
            return false;
        }
        totalFailures.incrementAndGet();
        int failures = consecutiveFailures.incrementAndGet();
        if (wasProbe || failures == failureThreshold) {
            unhealthyUntil.set(nowMillis + cooldownMillis);
            return true;
        }
        return false;
    }

    /**
     * Gives back the slot of a call abandoned before it produced an outcome, without
     * touching the health counters. An abandoned trial call lets the next selection probe again.
     */
    void release() {
        inFlight.updateAndGet(n -> Math.max(0, n - 1));
        probeInFlight.set(false);
    }

    RegionHealthSnapshot snapshot(long nowMillis, int failureThreshold) {
        double latency = Double.longBitsToDouble(latencyMs.get());
        return RegionHealthSnapshot.builder()
                .regionId(id())
                .status(status(nowMillis, failureThreshold))
                .successRatio(successRatio())
                .latencyMs(latency == NO_SAMPLE ? 0.0 : latency)
                .inFlight(inFlight.get())
                .consecutiveFailures(consecutiveFailures.get())
                .totalCalls(totalCalls.get())
                .totalFailures(totalFailures.get())
                .build();
    }

    private double successRatio() {
        return Double.longBitsToDouble(successRatio.get());
    }

    private static void decay(AtomicLong bits, double sample, double alpha) {
        bits.updateAndGet(current -> {
            double previous = Double.longBitsToDouble(current);
            double next = previous == NO_SAMPLE ? sample : alpha * sample + (1 - alpha) * previous;
            return Double.doubleToLongBits(next);
        });
    }
}
