package com.modellifecycle.dto;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.Map;

@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class PredictionResponse {
    String modelName;
    int versionNumber;
    String trainingRunId;
    String label;
    Double score;
    Map<String, Double> probabilities;
    @JsonFormat(shape = JsonFormat.Shape.STRING)
    Instant servedAt;
    String requestId;
}
