package com.modellifecycle.client;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.modellifecycle.exception.PipelineFailureException;
import io.netty.channel.ChannelOption;
import io.netty.handler.timeout.ReadTimeoutHandler;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import reactor.core.publisher.Mono;
import reactor.netty.http.client.HttpClient;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.TimeUnit;

@Slf4j
@Component
public class TrainingPipelineClient {

    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {};

    @Value("${pipeline.api.base-url}")
    private String baseUrl;

    @Value("${pipeline.api.read-timeout-seconds:1800}")
    private int readTimeoutSeconds;

    private WebClient webClient;
    private final ObjectMapper mapper = new ObjectMapper();

    @PostConstruct
    void init() {
        HttpClient httpClient = HttpClient.create()
            .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, 5_000)
            .doOnConnected(conn -> conn.addHandlerLast(
                new ReadTimeoutHandler(readTimeoutSeconds, TimeUnit.SECONDS)));
        this.webClient = WebClient.builder()
            .baseUrl(baseUrl)
            .clientConnector(new ReactorClientHttpConnector(httpClient))
            .defaultHeader("Content-Type", "application/json")
            .build();
        log.info("TrainingPipelineClient initialised → {}", baseUrl);
    }

    public Mono<TrainingRunResult> runTraining(String modelName, String datasetReference, String requestId) {
        ObjectNode body = mapper.createObjectNode();
        body.put("model_name", modelName);
        body.put("dataset_reference", datasetReference);

        return webClient.post().uri("/pipelines/train")
            .header("X-Request-ID", requestId != null ? requestId : "")
            .bodyValue(body)
            .retrieve()
            .onStatus(HttpStatusCode::is4xxClientError, resp -> resp.bodyToMono(String.class)
                .defaultIfEmpty("")
                .map(b -> new PipelineFailureException(
                    "Training pipeline rejected the request (" + resp.statusCode().value() + "): " + b, false)))
            .onStatus(HttpStatusCode::is5xxServerError, resp -> resp.bodyToMono(String.class)
                .defaultIfEmpty("")
                .map(b -> new PipelineFailureException(
                    "Training pipeline failed (" + resp.statusCode().value() + "): " + b, true)))
            .bodyToMono(JsonNode.class)
            .map(this::toResult)
            .onErrorMap(WebClientRequestException.class,
                ex -> new PipelineFailureException("Training pipeline unreachable: " + ex.getMessage(), ex));
    }

    private TrainingRunResult toResult(JsonNode json) {
        if (json == null || !json.hasNonNull("training_run_id") || !json.hasNonNull("validation_score")
                || !json.hasNonNull("artifact_reference")) {
            throw new PipelineFailureException("Training pipeline response is incomplete: " + json, false);
        }
        JsonNode score = json.get("validation_score");
        if (!score.isNumber() || !Double.isFinite(score.asDouble())) {
            throw new PipelineFailureException("Training pipeline returned a non-numeric validation_score: " + score, false);
        }
        Map<String, Object> hyperparameters = json.hasNonNull("hyperparameters")
            ? mapper.convertValue(json.get("hyperparameters"), MAP_TYPE)
            : new LinkedHashMap<>();
        return new TrainingRunResult(
            json.get("training_run_id").asText(),
            score.asDouble(),
            hyperparameters,
            json.get("artifact_reference").asText());
    }

    public record TrainingRunResult(
        String trainingRunId, double validationScore,
        Map<String, Object> hyperparameters, String artifactReference
    ) {}
}
