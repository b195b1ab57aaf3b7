package com.modellifecycle.controller;

import com.modellifecycle.dto.DriftCheckResponse;
import com.modellifecycle.dto.DriftEvaluationRequest;
import com.modellifecycle.dto.DriftReportResponse;
import com.modellifecycle.service.DriftMonitoringService;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.*;

import java.time.Instant;
import java.util.UUID;

@Slf4j
@Validated
@RestController
@RequestMapping("/api/v1/models/{modelName}/drift")
@RequiredArgsConstructor
public class DriftController {

    private final DriftMonitoringService monitoringService;

    @PostMapping("/evaluations")
    public ResponseEntity<DriftCheckResponse> evaluate(
            @PathVariable String modelName,
            @Valid @RequestBody DriftEvaluationRequest request, HttpServletRequest httpRequest) {
        String requestId = resolveRequestId(httpRequest);
        log.info("POST /models/{}/drift/evaluations | reference={} | current={} | requestId={}",
                 modelName, request.getReference().getDatasetId(), request.getCurrent().getDatasetId(), requestId);
        DriftCheckResponse body = monitoringService.checkDrift(modelName,
            request.getReference().toSnapshot(), request.getCurrent().toSnapshot(),
            request.getThresholds(), requestId);
        return ResponseEntity.status(HttpStatus.CREATED)
            .header("X-Request-ID", requestId)
            .body(body);
    }

    @GetMapping("/history")
    public ResponseEntity<Page<DriftReportResponse>> history(
            @PathVariable String modelName,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant from,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant to,
            @RequestParam(defaultValue = "0") @Min(0) int page,
            @RequestParam(defaultValue = "20") @Min(1) @Max(100) int size) {
        return ResponseEntity.ok(monitoringService.getDriftHistory(modelName, from, to, PageRequest.of(page, size)));
    }

    private String resolveRequestId(HttpServletRequest request) {
        String id = request.getHeader("X-Request-ID");
        return (id != null && !id.isBlank()) ? id : UUID.randomUUID().toString();
    }
}
