package com.modellifecycle.entity;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;
import java.util.UUID;

@Entity
@Table(
    name = "retrain_jobs",
    indexes = {
        @Index(name = "idx_job_model_status", columnList = "model_name, status"),
        @Index(name = "idx_job_alert",        columnList = "triggering_alert_id"),
    }
)
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class RetrainJobRecord {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(updatable = false, nullable = false)
    private UUID id;

    @Column(name = "model_name", nullable = false, length = 100, updatable = false)
    private String modelName;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private RetrainJobStatus status;

    @Enumerated(EnumType.STRING)
    @Column(name = "trigger_source", nullable = false, length = 20, updatable = false)
    private TriggerSource triggerSource;

    @Column(name = "triggering_alert_id", length = 128, updatable = false)
    private String triggeringAlertId;

    @Column(name = "dataset_reference", nullable = false, length = 256, updatable = false)
    private String datasetReference;

    @Column(name = "request_id", length = 64, updatable = false)
    private String requestId;

    @Column(name = "queued_at", nullable = false, updatable = false)
    private Instant queuedAt;

    @Column(name = "started_at")
    private Instant startedAt;

    @Column(name = "finished_at")
    private Instant finishedAt;

    private int attempts;

    @Column(name = "failure_reason", length = 1000)
    private String failureReason;

    @Column(name = "resulting_model_version")
    private Integer resultingModelVersion;

    @Column(name = "resulting_training_run_id", length = 128)
    private String resultingTrainingRunId;
}
