package com.modellifecycle.dto;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.modellifecycle.entity.LifecycleEventType;
import com.modellifecycle.entity.ModelStage;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class LifecycleEventResponse {
    UUID eventId;
    String modelName;
    LifecycleEventType eventType;
    UUID jobId;
    String alertId;
    Integer versionNumber;
    ModelStage fromStage;
    ModelStage toStage;
    String detail;
    String requestId;
    @JsonFormat(shape = JsonFormat.Shape.STRING)
    Instant occurredAt;
}
