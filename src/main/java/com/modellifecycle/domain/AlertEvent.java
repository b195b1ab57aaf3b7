package com.modellifecycle.domain;

import com.modellifecycle.entity.AlertOrigin;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

@Value
@Builder
public class AlertEvent {
    String alertId;
    String modelName;
    UUID sourceReportId;
    int severity;
    AlertOrigin origin;
    boolean consumed;
    Instant triggeredAt;
}
