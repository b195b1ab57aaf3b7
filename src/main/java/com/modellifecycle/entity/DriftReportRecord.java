package com.modellifecycle.entity;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

@Entity
@Table(
    name = "drift_reports",
    indexes = {
        @Index(name = "idx_drift_model_generated", columnList = "model_name, generated_at"),
    }
)
@Getter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class DriftReportRecord {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(updatable = false, nullable = false)
    private UUID id;

    @Column(name = "model_name", nullable = false, length = 100, updatable = false)
    private String modelName;

    @Column(name = "generated_at", nullable = false, updatable = false)
    private Instant generatedAt;

    @Column(name = "reference_window", length = 256, updatable = false)
    private String referenceWindow;

    @Column(name = "current_window", length = 256, updatable = false)
    private String currentWindow;

    @Column(name = "column_drift_count", nullable = false, updatable = false)
    private int columnDriftCount;

    @Column(name = "total_columns", nullable = false, updatable = false)
    private int totalColumns;

    @Column(name = "missing_value_share", nullable = false, updatable = false)
    private double missingValueShare;

    @Column(name = "prediction_drift_score", nullable = false, updatable = false)
    private double predictionDriftScore;

    @Builder.Default
    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "drift_report_columns", joinColumns = @JoinColumn(name = "report_id"))
    @OrderColumn(name = "column_index")
    private List<ColumnDriftEntry> columns = new ArrayList<>();
}
