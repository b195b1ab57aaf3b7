package com.modellifecycle.controller;

import com.modellifecycle.dto.LifecycleEventResponse;
import com.modellifecycle.dto.ModelVersionResponse;
import com.modellifecycle.dto.PredictionRequest;
import com.modellifecycle.dto.PredictionResponse;
import com.modellifecycle.dto.ProductionPromotionResponse;
import com.modellifecycle.dto.RegisterVersionRequest;
import com.modellifecycle.service.InferenceGatewayService;
import com.modellifecycle.service.MetricStoreService;
import com.modellifecycle.service.ModelRegistryService;
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
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.UUID;

@Slf4j
@Validated
@RestController
@RequestMapping("/api/v1/models/{modelName}")
@RequiredArgsConstructor
public class ModelController {

    private final ModelRegistryService    registry;
    private final InferenceGatewayService inferenceGateway;
    private final MetricStoreService      metricStore;

    @PostMapping("/versions")
    public ResponseEntity<ModelVersionResponse> register(
            @PathVariable String modelName,
            @Valid @RequestBody RegisterVersionRequest request, HttpServletRequest httpRequest) {
        String requestId = resolveRequestId(httpRequest);
        log.info("POST /models/{}/versions | run={} | score={} | requestId={}",
                 modelName, request.getTrainingRunId(), request.getValidationScore(), requestId);
        ModelVersionResponse body = ModelVersionResponse.from(registry.register(modelName, request, requestId));
        return ResponseEntity.status(HttpStatus.CREATED)
            .header("X-Request-ID", requestId)
            .header("Location", "/api/v1/models/" + modelName + "/versions/" + body.getVersionNumber())
            .body(body);
    }

    @GetMapping("/versions")
    public ResponseEntity<List<ModelVersionResponse>> listVersions(@PathVariable String modelName) {
        return ResponseEntity.ok(registry.listVersions(modelName).stream().map(ModelVersionResponse::from).toList());
    }

    @GetMapping("/versions/{versionNumber}")
    public ResponseEntity<ModelVersionResponse> getVersion(
            @PathVariable String modelName, @PathVariable int versionNumber) {
        return ResponseEntity.ok(ModelVersionResponse.from(registry.getVersion(modelName, versionNumber)));
    }

    @PostMapping("/promotions/staging")
    public ResponseEntity<List<ModelVersionResponse>> promoteTopK(
            @PathVariable String modelName,
            @RequestParam(defaultValue = "3") int k, HttpServletRequest httpRequest) {
        String requestId = resolveRequestId(httpRequest);
        log.info("POST /models/{}/promotions/staging | k={} | requestId={}", modelName, k, requestId);
        return ResponseEntity.ok()
            .header("X-Request-ID", requestId)
            .body(registry.promoteTopK(modelName, k, requestId).stream().map(ModelVersionResponse::from).toList());
    }

    @PostMapping("/promotions/production")
    public ResponseEntity<ProductionPromotionResponse> promoteProduction(
            @PathVariable String modelName, HttpServletRequest httpRequest) {
        String requestId = resolveRequestId(httpRequest);
        log.info("POST /models/{}/promotions/production | requestId={}", modelName, requestId);
        ModelRegistryService.ProductionPromotion promotion = registry.promoteProduction(modelName, requestId);
        return ResponseEntity.ok()
            .header("X-Request-ID", requestId)
            .body(ProductionPromotionResponse.builder()
                .promoted(ModelVersionResponse.from(promotion.promoted()))
                .archived(ModelVersionResponse.from(promotion.archived()))
                .build());
    }

    @GetMapping("/production")
    public ResponseEntity<ModelVersionResponse> production(@PathVariable String modelName) {
        return ResponseEntity.ok(ModelVersionResponse.from(registry.getProduction(modelName)));
    }

    @PostMapping("/predictions")
    public Mono<ResponseEntity<PredictionResponse>> predict(
            @PathVariable String modelName,
            @Valid @RequestBody PredictionRequest request, HttpServletRequest httpRequest) {
        String requestId = resolveRequestId(httpRequest);
        return inferenceGateway.predict(modelName, request, requestId)
            .map(r -> ResponseEntity.ok().header("X-Request-ID", requestId).body(r));
    }

    @GetMapping("/events")
    public ResponseEntity<Page<LifecycleEventResponse>> events(
            @PathVariable String modelName,
            @RequestParam(defaultValue = "0") @Min(0) int page,
            @RequestParam(defaultValue = "50") @Min(1) @Max(500) int size) {
        return ResponseEntity.ok(metricStore.getEvents(modelName, PageRequest.of(page, size)));
    }

    private String resolveRequestId(HttpServletRequest request) {
        String id = request.getHeader("X-Request-ID");
        return (id != null && !id.isBlank()) ? id : UUID.randomUUID().toString();
    }
}
