package com.dcision.pipeline.routing;

import com.dcision.pipeline.config.PipelineProperties;
import lombok.Value;

import java.util.Set;

/**
 * Static description of an inference region: which models it serves and its limits.
 */
@Value
public class RegionDescriptor {
    String id;
    Set<String> capabilities;
    int maxConcurrent;
    double costPerThousandTokens;

    public static RegionDescriptor from(PipelineProperties.Region region) {
        return new RegionDescriptor(region.getId(), Set.copyOf(region.getModels()),
                region.getMaxConcurrent(), region.getCostPerThousandTokens());
    }

    public boolean supports(String capability) {
        return capabilities.contains(capability);
    }
}
