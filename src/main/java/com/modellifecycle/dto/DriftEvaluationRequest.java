package com.modellifecycle.dto;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

@Value
@Builder
@Jacksonized
public class DriftEvaluationRequest {

    @Valid
    @NotNull(message = "reference snapshot is required")
    SnapshotPayload reference;

    @Valid
    @NotNull(message = "current snapshot is required")
    SnapshotPayload current;

    @Valid
    ThresholdOverrides thresholds;
}
