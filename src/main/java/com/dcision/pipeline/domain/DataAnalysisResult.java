package com.dcision.pipeline.domain;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;

@Value
@Builder(toBuilder = true)
@Jacksonized
public class DataAnalysisResult {
    Double readinessScore;
    Integer entityCount;
    DataQuality dataQuality;

    @Singular("missingDataItem")
    List<String> missingData;

    @Singular
    List<String> recommendations;
}
