package com.modellifecycle.entity;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;
import java.util.Map;
import java.util.UUID;

@Entity
@Table(
    name = "training_metrics",
    indexes = {
        @Index(name = "idx_metric_model", columnList = "model_name, recorded_at"),
    }
)
@Getter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class TrainingMetricRecord {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(updatable = false, nullable = false)
    private UUID id;

    @Column(name = "model_name", nullable = false, length = 100, updatable = false)
    private String modelName;

    @Column(name = "training_run_id", nullable = false, length = 128, updatable = false)
    private String trainingRunId;

    @Column(name = "job_id", updatable = false)
    private UUID jobId;

    @Column(name = "validation_score", nullable = false, updatable = false)
    private double validationScore;

    @Convert(converter = HyperparametersConverter.class)
    @Column(name = "hyperparameters", length = 4000, updatable = false)
    private Map<String, Object> hyperparameters;

    @Column(name = "recorded_at", nullable = false, updatable = false)
    private Instant recordedAt;
}
