package com.modellifecycle.entity;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;
import java.util.UUID;

@Entity
@Table(
    name = "alert_events",
    indexes = {
        @Index(name = "idx_alert_model", columnList = "model_name"),
    }
)
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class AlertEventRecord {

    @Id
    @Column(name = "alert_id", nullable = false, updatable = false, length = 128)
    private String alertId;

    @Column(name = "model_name", nullable = false, length = 100, updatable = false)
    private String modelName;

    @Column(name = "source_report_id", updatable = false)
    private UUID sourceReportId;

    @Column(nullable = false, updatable = false)
    private int severity;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20, updatable = false)
    private AlertOrigin origin;

    @Column(nullable = false)
    private boolean consumed;

    @Column(name = "triggered_at", nullable = false, updatable = false)
    private Instant triggeredAt;

    @Column(name = "consumed_at")
    private Instant consumedAt;
}
