package com.modellifecycle.controller;

import com.modellifecycle.domain.TriggerOutcome;
import com.modellifecycle.dto.AlertNotificationRequest;
import com.modellifecycle.dto.LifecycleEventResponse;
import com.modellifecycle.dto.RetrainJobResponse;
import com.modellifecycle.dto.RetrainRequest;
import com.modellifecycle.dto.RetrainTriggerResponse;
import com.modellifecycle.service.RetrainService;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.UUID;

@Slf4j
@Validated
@RestController
@RequestMapping("/api/v1")
@RequiredArgsConstructor
public class RetrainController {

    private final RetrainService retrainService;

    @PostMapping("/models/{modelName}/retrain")
    public ResponseEntity<RetrainTriggerResponse> trigger(
            @PathVariable String modelName,
            @Valid @RequestBody(required = false) RetrainRequest request, HttpServletRequest httpRequest) {
        String requestId = resolveRequestId(httpRequest);
        String dataset = request != null ? request.getDatasetReference() : null;
        log.info("POST /models/{}/retrain | dataset={} | requestId={}", modelName, dataset, requestId);
        return toResponseEntity(retrainService.triggerManual(modelName, dataset, requestId), requestId);
    }

    @PostMapping("/alerts/notifications")
    public ResponseEntity<RetrainTriggerResponse> alertNotification(
            @Valid @RequestBody AlertNotificationRequest request, HttpServletRequest httpRequest) {
        String requestId = resolveRequestId(httpRequest);
        log.info("POST /alerts/notifications | alertId={} | model={} | sourceReport={} | requestId={}",
                 request.getAlertId(), request.getModelName(), request.getSourceReportId(), requestId);
        return toResponseEntity(retrainService.onAlertNotification(request, requestId), requestId);
    }

    @GetMapping("/models/{modelName}/retrain-jobs")
    public ResponseEntity<Page<RetrainJobResponse>> listJobs(
            @PathVariable String modelName,
            @RequestParam(defaultValue = "0") @Min(0) int page,
            @RequestParam(defaultValue = "20") @Min(1) @Max(100) int size) {
        return ResponseEntity.ok(retrainService.listJobs(modelName, PageRequest.of(page, size)));
    }

    @GetMapping("/retrain-jobs/{jobId}")
    public ResponseEntity<RetrainJobResponse> getJob(@PathVariable UUID jobId) {
        return ResponseEntity.ok(retrainService.getJob(jobId));
    }

    @GetMapping("/retrain-jobs/{jobId}/events")
    public ResponseEntity<List<LifecycleEventResponse>> jobEvents(@PathVariable UUID jobId) {
        return ResponseEntity.ok(retrainService.getJobEvents(jobId));
    }

    @PostMapping("/retrain-jobs/{jobId}/cancel")
    public ResponseEntity<RetrainJobResponse> cancel(@PathVariable UUID jobId, HttpServletRequest httpRequest) {
        String requestId = resolveRequestId(httpRequest);
        log.info("POST /retrain-jobs/{}/cancel | requestId={}", jobId, requestId);
        return ResponseEntity.ok()
            .header("X-Request-ID", requestId)
            .body(retrainService.cancel(jobId, requestId));
    }

    // QUEUED → 202, rejected → 409, duplicate alert → 200
    private ResponseEntity<RetrainTriggerResponse> toResponseEntity(RetrainTriggerResponse result, String requestId) {
        HttpStatus status = switch (result.getOutcome()) {
            case QUEUED -> HttpStatus.ACCEPTED;
            case REJECTED_ALREADY_IN_FLIGHT -> HttpStatus.CONFLICT;
            case DUPLICATE_ALERT -> HttpStatus.OK;
        };
        ResponseEntity.BodyBuilder builder = ResponseEntity.status(status).header("X-Request-ID", requestId);
        if (result.getOutcome() == TriggerOutcome.QUEUED) {
            builder.header("Location", "/api/v1/retrain-jobs/" + result.getJob().getJobId());
        }
        return builder.body(result);
    }

    private String resolveRequestId(HttpServletRequest request) {
        String id = request.getHeader("X-Request-ID");
        return (id != null && !id.isBlank()) ? id : UUID.randomUUID().toString();
    }
}
