package com.modellifecycle.domain;

import com.modellifecycle.exception.ValidationException;
import lombok.Builder;
import lombok.Value;

@Value
@Builder(toBuilder = true)
public class ThresholdConfig {
    double maxMissingShare;
    int maxDriftedColumns;
    double maxPredictionDrift;

    public ThresholdConfig validated() {
        if (Double.isNaN(maxMissingShare) || maxMissingShare < 0.0 || maxMissingShare > 1.0) {
            throw new ValidationException("maxMissingShare must be between 0 and 1");
        }
        if (maxDriftedColumns < 0) {
            throw new ValidationException("maxDriftedColumns must be >= 0");
        }
        if (Double.isNaN(maxPredictionDrift) || maxPredictionDrift < 0.0) {
            throw new ValidationException("maxPredictionDrift must be >= 0");
        }
        return this;
    }
}
