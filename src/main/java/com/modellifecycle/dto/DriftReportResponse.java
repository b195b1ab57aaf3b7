package com.modellifecycle.dto;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.modellifecycle.domain.ColumnDrift;
import com.modellifecycle.domain.ColumnType;
import com.modellifecycle.domain.DriftReport;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

@Value
@Builder
public class DriftReportResponse {
    UUID reportId;
    String modelName;
    @JsonFormat(shape = JsonFormat.Shape.STRING)
    Instant generatedAt;
    String referenceWindow;
    String currentWindow;
    int columnDriftCount;
    int totalColumns;
    double missingValueShare;
    double predictionDriftScore;
    List<ColumnDriftResponse> columns;

    @Value
    @Builder
    public static class ColumnDriftResponse {
        String column;
        ColumnType type;
        double distance;
        double missingShare;
        boolean drifted;
    }

    public static DriftReportResponse from(DriftReport report) {
        return DriftReportResponse.builder()
            .reportId(report.getReportId())
            .modelName(report.getModelName())
            .generatedAt(report.getGeneratedAt())
            .referenceWindow(report.getReferenceWindow())
            .currentWindow(report.getCurrentWindow())
            .columnDriftCount(report.getColumnDriftCount())
            .totalColumns(report.getTotalColumns())
            .missingValueShare(report.getMissingValueShare())
            .predictionDriftScore(report.getPredictionDriftScore())
            .columns(report.getColumns().stream().map(DriftReportResponse::toColumn).toList())
            .build();
    }

    private static ColumnDriftResponse toColumn(ColumnDrift c) {
        return ColumnDriftResponse.builder()
            .column(c.getColumn())
            .type(c.getType())
            .distance(c.getDistance())
            .missingShare(c.getMissingShare())
            .drifted(c.isDrifted())
            .build();
    }
}
