package com.modellifecycle.entity;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;
import java.util.UUID;

@Entity
@Table(
    name = "lifecycle_events",
    indexes = {
        @Index(name = "idx_event_model_time", columnList = "model_name, occurred_at"),
        @Index(name = "idx_event_job",        columnList = "job_id"),
    }
)
@Getter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class LifecycleEventRecord {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(updatable = false, nullable = false)
    private UUID id;

    @Column(name = "model_name", nullable = false, length = 100, updatable = false)
    private String modelName;

    @Enumerated(EnumType.STRING)
    @Column(name = "event_type", nullable = false, length = 40, updatable = false)
    private LifecycleEventType eventType;

    @Column(name = "job_id", updatable = false)
    private UUID jobId;

    @Column(name = "alert_id", length = 128, updatable = false)
    private String alertId;

    @Column(name = "version_number", updatable = false)
    private Integer versionNumber;

    @Enumerated(EnumType.STRING)
    @Column(name = "from_stage", length = 20, updatable = false)
    private ModelStage fromStage;

    @Enumerated(EnumType.STRING)
    @Column(name = "to_stage", length = 20, updatable = false)
    private ModelStage toStage;

    @Column(length = 2000, updatable = false)
    private String detail;

    @Column(name = "request_id", length = 64, updatable = false)
    private String requestId;

    @Column(name = "occurred_at", nullable = false, updatable = false)
    private Instant occurredAt;
}
