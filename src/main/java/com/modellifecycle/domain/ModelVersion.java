package com.modellifecycle.domain;

import com.modellifecycle.entity.ModelStage;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.Map;
import java.util.UUID;

@Value
@Builder
public class ModelVersion {
    UUID id;
    String modelName;
    int versionNumber;
    String trainingRunId;
    double validationScore;
    Map<String, Object> hyperparameters;
    ModelStage stage;
    String artifactReference;
    Instant createdAt;
    Instant stageChangedAt;
}
