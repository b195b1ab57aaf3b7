package com.modellifecycle.dto;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.modellifecycle.domain.ModelVersion;
import com.modellifecycle.entity.ModelStage;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.Map;

@Value
@Builder
public class ModelVersionResponse {
    String modelName;
    int versionNumber;
    String trainingRunId;
    double validationScore;
    Map<String, Object> hyperparameters;
    ModelStage stage;
    String artifactReference;
    @JsonFormat(shape = JsonFormat.Shape.STRING)
    Instant createdAt;
    @JsonFormat(shape = JsonFormat.Shape.STRING)
    Instant stageChangedAt;

    public static ModelVersionResponse from(ModelVersion version) {
        if (version == null) {
            return null;
        }
        return ModelVersionResponse.builder()
            .modelName(version.getModelName())
            .versionNumber(version.getVersionNumber())
            .trainingRunId(version.getTrainingRunId())
            .validationScore(version.getValidationScore())
            .hyperparameters(version.getHyperparameters())
            .stage(version.getStage())
            .artifactReference(version.getArtifactReference())
            .createdAt(version.getCreatedAt())
            .stageChangedAt(version.getStageChangedAt())
            .build();
    }
}
