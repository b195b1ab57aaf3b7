package com.modellifecycle.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.modellifecycle.domain.TriggerOutcome;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class RetrainTriggerResponse {
    TriggerOutcome outcome;
    String message;
    RetrainJobResponse job;
}
