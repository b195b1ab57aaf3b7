package com.modellifecycle.dto;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

@Value
@Builder
@Jacksonized
public class ThresholdOverrides {

    @DecimalMin(value = "0.0", message = "maxMissingShare must be between 0 and 1")
    @DecimalMax(value = "1.0", message = "maxMissingShare must be between 0 and 1")
    Double maxMissingShare;

    @Min(value = 0, message = "maxDriftedColumns must be >= 0")
    Integer maxDriftedColumns;

    @DecimalMin(value = "0.0", message = "maxPredictionDrift must be >= 0")
    Double maxPredictionDrift;
}
