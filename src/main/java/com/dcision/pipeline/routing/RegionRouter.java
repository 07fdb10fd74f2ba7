package com.dcision.pipeline.routing;

import com.dcision.pipeline.config.PipelineProperties;
import com.dcision.pipeline.exception.NoAvailableRegionException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Chooses the inference region for each call and tracks per-region health.
 * <p>
 * Selection considers regions that serve the requested capability, are not excluded and
 * are not cooling down; the lowest failure-weighted latency wins, ties go to the region
 * with fewer calls in flight. After {@code failureThreshold} consecutive failures a region
 * leaves rotation for the cooldown window and is then readmitted through a single trial call.
 * <p>
 * Every successful {@link #select} must be paired with one {@link #reportOutcome}, or with
 * {@link #release} when the call was abandoned by its caller.
 */
@Slf4j
@Component
public class RegionRouter {

    private static final Comparator<Candidate> ORDER = Comparator
            .comparingDouble((Candidate c) -> c.score)
            .thenComparingInt(c -> c.inFlight)
            .thenComparing(c -> c.region.id());

    private final Map<String, RegionHealth> regions;
    private final PipelineProperties.Router settings;
    private final Clock clock;

    public RegionRouter(PipelineProperties properties, Clock clock) {
        Map<String, RegionHealth> byId = new LinkedHashMap<>();
        for (PipelineProperties.Region region : properties.getRegions()) {
            byId.put(region.getId(), new RegionHealth(RegionDescriptor.from(region)));
        }
        this.regions = Collections.unmodifiableMap(byId);
        this.settings = properties.getRouter();
        this.clock = clock;
        log.info("Region router initialized with regions {}", byId.keySet());
    }

    /**
     * @throws NoAvailableRegionException if no eligible region can take the call
     */
    public String select(String capability, Set<String> exclude) {
        long now = clock.millis();
        int threshold = settings.getFailureThreshold();

        List<Candidate> candidates = new ArrayList<>();
        for (RegionHealth region : regions.values()) {
            if (region.getDescriptor().supports(capability)
                    && !exclude.contains(region.id())
                    && region.status(now, threshold) != RegionStatus.UNHEALTHY) {
                candidates.add(new Candidate(region, region.score(), region.inFlight()));
            }
        }
        candidates.sort(ORDER);

        for (Candidate candidate : candidates) {
            RegionStatus before = candidate.region.status(now, threshold);
            if (candidate.region.tryAcquire(now, threshold)) {
                if (before == RegionStatus.PROBING) {
                    log.info("Probing region {} with a trial call", candidate.region.id());
                }
                return candidate.region.id();
            }
        }
        throw new NoAvailableRegionException(capability);
    }

    public void reportOutcome(String regionId, boolean success, long latencyMs) {
        RegionHealth region = regions.get(regionId);
        if (region == null) {
            log.warn("Outcome reported for unknown region {}", regionId);
            return;
        }
        int before = region.consecutiveFailures();
        boolean tripped = region.record(success, latencyMs, clock.millis(), settings.getFailureThreshold(),
                settings.getCooldown().toMillis(), settings.getLatencyDecay(), settings.getSuccessDecay());
        if (tripped) {
            log.warn("Region {} marked unhealthy after {} consecutive failures; cooling down for {}",
                    regionId, before + 1, settings.getCooldown());
        } else if (success && before >= settings.getFailureThreshold() && region.consecutiveFailures() == 0) {
            log.info("Region {} passed its trial call and is back in rotation", regionId);
        }
    }

    /**
     * Frees the call slot taken by {@link #select} without counting the call for or against the region.
     */
    public void release(String regionId) {
        RegionHealth region = regions.get(regionId);
        if (region != null) {
            region.release();
        }
    }

    public RegionDescriptor descriptor(String regionId) {
        RegionHealth region = regions.get(regionId);
        return region == null ? null : region.getDescriptor();
    }

    public List<RegionHealthSnapshot> snapshot() {
        long now = clock.millis();
        return regions.values().stream()
                .map(r -> r.snapshot(now, settings.getFailureThreshold()))
                .toList();
    }

    private static final class Candidate {
        final RegionHealth region;
        final double score;
        final int inFlight;

        Candidate(RegionHealth region, double score, int inFlight) {
            this.region = region;
            this.score = score;
            this.inFlight = inFlight;
        }
    }
}
