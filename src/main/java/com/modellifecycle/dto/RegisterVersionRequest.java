package com.modellifecycle.dto;

import jakarta.validation.constraints.*;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.Map;

@Value
@Builder
@Jacksonized
public class RegisterVersionRequest {

    // next free number when absent
    @Min(value = 1, message = "versionNumber must be >= 1")
    Integer versionNumber;

    @NotBlank(message = "trainingRunId is required")
    @Size(max = 128, message = "trainingRunId must be at most 128 characters")
    String trainingRunId;

    @NotNull(message = "validationScore is required")
    Double validationScore;

    Map<String, Object> hyperparameters;

    @NotBlank(message = "artifactReference is required")
    @Size(max = 512, message = "artifactReference must be at most 512 characters")
    String artifactReference;
}
