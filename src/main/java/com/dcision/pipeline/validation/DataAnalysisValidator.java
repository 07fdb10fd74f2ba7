package com.dcision.pipeline.validation;

import com.dcision.pipeline.config.PipelineProperties;
import com.dcision.pipeline.domain.DataAnalysisResult;
import com.dcision.pipeline.domain.StageContext;
import com.dcision.pipeline.exception.ErrorKind;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Rejects readiness below the configured threshold with {@link ErrorKind#INSUFFICIENT_DATA}:
 * building a model from low-readiness input only wastes a solver call.
 */
@Component
public class DataAnalysisValidator implements StageValidator<DataAnalysisResult> {

    private final double readinessThreshold;

    @Autowired
    public DataAnalysisValidator(PipelineProperties properties) {
        this(properties.getReadinessThreshold());
    }

    public DataAnalysisValidator(double readinessThreshold) {
        this.readinessThreshold = readinessThreshold;
    }

    @Override
    public ValidationResult validate(DataAnalysisResult analysis, StageContext context) {
        ValidationResult result = ValidationResult.ok();
        if (analysis == null) {
            return result.fail("data_analysis", "missing");
        }
        Double readiness = analysis.getReadinessScore();
        if (!ValidationSupport.isUnitInterval(readiness)) {
            result.fail("readiness_score", "must be within [0,1] but was " + readiness);
        } else if (readiness < readinessThreshold) {
            result.fail(ErrorKind.INSUFFICIENT_DATA, "readiness_score",
                    "readiness " + readiness + " is below the threshold " + readinessThreshold
                            + (analysis.getMissingData().isEmpty() ? "" : "; missing " + analysis.getMissingData()));
        }
        if (analysis.getEntityCount() == null || analysis.getEntityCount() < 0) {
            result.fail("entity_count", "must be >= 0 but was " + analysis.getEntityCount());
        }
        if (analysis.getDataQuality() == null) {
            result.fail("data_quality", "must be one of low, medium, high");
        }
        return result;
    }
}
