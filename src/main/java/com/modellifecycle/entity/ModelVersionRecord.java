package com.modellifecycle.entity;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;
import java.util.Map;
import java.util.UUID;

@Entity
@Table(
    name = "model_versions",
    uniqueConstraints = {
        @UniqueConstraint(name = "uk_model_version_number", columnNames = {"model_name", "version_number"}),
        @UniqueConstraint(name = "uk_model_version_run",    columnNames = {"model_name", "training_run_id"}),
    },
    indexes = {
        @Index(name = "idx_mv_model_stage", columnList = "model_name, stage"),
    }
)
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ModelVersionRecord {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(updatable = false, nullable = false)
    private UUID id;

    @Column(name = "model_name", nullable = false, length = 100, updatable = false)
    private String modelName;

    @Column(name = "version_number", nullable = false, updatable = false)
    private int versionNumber;

    @Column(name = "training_run_id", nullable = false, length = 128, updatable = false)
    private String trainingRunId;

    @Column(name = "validation_score", nullable = false, updatable = false)
    private double validationScore;

    @Convert(converter = HyperparametersConverter.class)
    @Column(name = "hyperparameters", length = 4000)
    private Map<String, Object> hyperparameters;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private ModelStage stage;

    @Column(name = "artifact_reference", nullable = false, length = 512, updatable = false)
    private String artifactReference;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "stage_changed_at")
    private Instant stageChangedAt;
}
