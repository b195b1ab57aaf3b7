package com.modellifecycle.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.modellifecycle.exception.ModelServingException;
import com.modellifecycle.exception.ModelServingUnavailableException;
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
import reactor.util.retry.Retry;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.TimeUnit;

@Slf4j
@Component
public class ModelServingClient {

    @Value("${serving.api.base-url}")
    private String baseUrl;

    @Value("${serving.api.timeout-seconds:10}")
    private int timeoutSeconds;

    private WebClient webClient;
    private final ObjectMapper mapper = new ObjectMapper();

    @PostConstruct
    void init() {
        HttpClient httpClient = HttpClient.create()
            .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, 5_000)
            .doOnConnected(conn -> conn.addHandlerLast(
                new ReadTimeoutHandler(timeoutSeconds, TimeUnit.SECONDS)));
        this.webClient = WebClient.builder()
            .baseUrl(baseUrl)
            .clientConnector(new ReactorClientHttpConnector(httpClient))
            .defaultHeader("Content-Type", "application/json")
            .build();
        log.info("ModelServingClient initialised → {}", baseUrl);
    }

    public Mono<ScoreResult> score(String artifactReference, Map<String, Object> features, String requestId) {
        ObjectNode body = mapper.createObjectNode();
        body.put("artifact_reference", artifactReference);
        body.set("features", mapper.valueToTree(features));

        return webClient.post().uri("/score")
            .header("X-Request-ID", requestId != null ? requestId : "")
            .bodyValue(body)
            .retrieve()
            .onStatus(HttpStatusCode::is4xxClientError, resp -> resp.bodyToMono(String.class)
                .defaultIfEmpty("")
                .map(b -> new ModelServingException("Model server rejected request (4xx): " + b)))
            .onStatus(HttpStatusCode::is5xxServerError, resp -> resp.bodyToMono(String.class)
                .defaultIfEmpty("")
                .map(b -> new ModelServingUnavailableException(new IllegalStateException(b))))
            .bodyToMono(JsonNode.class)
            .map(this::toScoreResult)
            .retryWhen(Retry.backoff(2, Duration.ofMillis(300))
                .filter(ex -> ex instanceof WebClientRequestException)
                .onRetryExhaustedThrow((spec, sig) -> new ModelServingUnavailableException(sig.failure())))
            .onErrorMap(WebClientRequestException.class, ModelServingUnavailableException::new);
    }

    private ScoreResult toScoreResult(JsonNode json) {
        if (json == null || !json.hasNonNull("label")) {
            throw new ModelServingException("Model server response missing 'label': " + json);
        }
        Double score = json.hasNonNull("score") ? json.get("score").asDouble() : null;
        Map<String, Double> probabilities = null;
        JsonNode probabilitiesNode = json.get("probabilities");
        if (probabilitiesNode != null && probabilitiesNode.isObject()) {
            probabilities = new LinkedHashMap<>();
            for (Map.Entry<String, JsonNode> entry : (Iterable<Map.Entry<String, JsonNode>>) probabilitiesNode::fields) {
                probabilities.put(entry.getKey(), entry.getValue().asDouble());
            }
        }
        return new ScoreResult(json.get("label").asText(), score, probabilities);
    }

    public record ScoreResult(String label, Double score, Map<String, Double> probabilities) {}
}
