package com.modellifecycle.domain;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

@Value
@Builder(toBuilder = true)
public class DriftReport {
    UUID reportId;
    String modelName;
    Instant generatedAt;
    String referenceWindow;
    String currentWindow;
    int columnDriftCount;
    int totalColumns;
    double missingValueShare;
    double predictionDriftScore;
    List<ColumnDrift> columns;
}
