package com.modellifecycle.dto;

import jakarta.validation.constraints.NotEmpty;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.Map;

@Value
@Builder
@Jacksonized
public class PredictionRequest {

    @NotEmpty(message = "features are required")
    Map<String, Object> features;
}
