package com.modellifecycle.service;

import com.modellifecycle.client.ModelServingClient;
import com.modellifecycle.dto.PredictionRequest;
import com.modellifecycle.dto.PredictionResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.time.Instant;

@Slf4j
@Service
@RequiredArgsConstructor
public class InferenceGatewayService {

    private final ModelRegistryService registry;
    private final ModelServingClient   servingClient;

    public Mono<PredictionResponse> predict(String modelName, PredictionRequest request, String requestId) {
        return Mono.fromCallable(() -> registry.getProduction(modelName))
            .flatMap(version -> servingClient.score(version.getArtifactReference(), request.getFeatures(), requestId)
                .map(result -> {
                    log.debug("Prediction served | model={} | version={} | label={} | requestId={}",
                        modelName, version.getVersionNumber(), result.label(), requestId);
                    return PredictionResponse.builder()
                        .modelName(modelName)
                        .versionNumber(version.getVersionNumber())
                        .trainingRunId(version.getTrainingRunId())
                        .label(result.label())
                        .score(result.score())
                        .probabilities(result.probabilities())
                        .servedAt(Instant.now())
                        .requestId(requestId)
                        .build();
                }))
            .doOnError(ex -> log.warn("Prediction failed | model={} | requestId={} | error={}",
                modelName, requestId, ex.getMessage()));
    }
}
