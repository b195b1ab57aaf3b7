package com.modellifecycle.dto;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.modellifecycle.domain.AlertEvent;
import com.modellifecycle.entity.AlertOrigin;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

@Value
@Builder
public class AlertEventResponse {
    String alertId;
    String modelName;
    UUID sourceReportId;
    int severity;
    AlertOrigin origin;
    boolean consumed;
    @JsonFormat(shape = JsonFormat.Shape.STRING)
    Instant triggeredAt;

    public static AlertEventResponse from(AlertEvent alert) {
        if (alert == null) {
            return null;
        }
        return AlertEventResponse.builder()
            .alertId(alert.getAlertId())
            .modelName(alert.getModelName())
            .sourceReportId(alert.getSourceReportId())
            .severity(alert.getSeverity())
            .origin(alert.getOrigin())
            .consumed(alert.isConsumed())
            .triggeredAt(alert.getTriggeredAt())
            .build();
    }
}
