package com.modellifecycle.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.modellifecycle.domain.BreachedCondition;
import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class DriftCheckResponse {
    DriftReportResponse report;
    boolean alertFired;
    int severity;
    List<BreachedCondition> breaches;
    AlertEventResponse alert;
    RetrainTriggerResponse retrain;
}
