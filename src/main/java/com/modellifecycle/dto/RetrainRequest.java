package com.modellifecycle.dto;

import jakarta.validation.constraints.Size;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

@Value
@Builder
@Jacksonized
public class RetrainRequest {

    @Size(max = 256, message = "datasetReference must be at most 256 characters")
    String datasetReference;
}
