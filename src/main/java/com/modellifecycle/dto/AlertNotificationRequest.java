package com.modellifecycle.dto;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.UUID;

@Value
@Builder
@Jacksonized
public class AlertNotificationRequest {

    @NotBlank(message = "alertId is required")
    @Size(max = 128, message = "alertId must be at most 128 characters")
    String alertId;

    UUID sourceReportId;

    @Min(value = 1, message = "severity must be between 1 and 3")
    @Max(value = 3, message = "severity must be between 1 and 3")
    int severity;

    String modelName;

    String datasetReference;
}
