package com.modellifecycle.dto;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.modellifecycle.entity.RetrainJobStatus;
import com.modellifecycle.entity.TriggerSource;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class RetrainJobResponse {
    UUID jobId;
    String modelName;
    RetrainJobStatus status;
    TriggerSource triggerSource;
    String triggeringAlertId;
    String datasetReference;
    @JsonFormat(shape = JsonFormat.Shape.STRING)
    Instant queuedAt;
    @JsonFormat(shape = JsonFormat.Shape.STRING)
    Instant startedAt;
    @JsonFormat(shape = JsonFormat.Shape.STRING)
    Instant finishedAt;
    int attempts;
    String failureReason;
    Integer resultingModelVersion;
    String resultingTrainingRunId;
    String requestId;
}
