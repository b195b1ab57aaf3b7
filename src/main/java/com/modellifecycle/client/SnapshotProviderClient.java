package com.modellifecycle.client;

import com.modellifecycle.dto.SnapshotPayload;
import com.modellifecycle.exception.SnapshotProviderException;
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
import java.util.concurrent.TimeUnit;

@Slf4j
@Component
public class SnapshotProviderClient {

    @Value("${snapshots.api.base-url}")
    private String baseUrl;

    @Value("${snapshots.api.timeout-seconds:30}")
    private int timeoutSeconds;

    private WebClient webClient;

    @PostConstruct
    void init() {
        HttpClient httpClient = HttpClient.create()
            .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, 5_000)
            .doOnConnected(conn -> conn.addHandlerLast(
                new ReadTimeoutHandler(timeoutSeconds, TimeUnit.SECONDS)));
        this.webClient = WebClient.builder()
            .baseUrl(baseUrl)
            .clientConnector(new ReactorClientHttpConnector(httpClient))
            .codecs(c -> c.defaultCodecs().maxInMemorySize(16 * 1024 * 1024))
            .build();
        log.info("SnapshotProviderClient initialised → {}", baseUrl);
    }

    public Mono<SnapshotPayload> reference(String modelName) {
        return fetch(modelName, "reference");
    }

    public Mono<SnapshotPayload> current(String modelName) {
        return fetch(modelName, "current");
    }

    private Mono<SnapshotPayload> fetch(String modelName, String which) {
        return webClient.get().uri("/snapshots/{model}/{which}", modelName, which)
            .retrieve()
            .onStatus(HttpStatusCode::isError, resp -> resp.bodyToMono(String.class)
                .defaultIfEmpty("")
                .map(b -> new SnapshotProviderException("Snapshot provider returned "
                    + resp.statusCode().value() + " for " + which + " snapshot of '" + modelName + "': " + b)))
            .bodyToMono(SnapshotPayload.class)
            .switchIfEmpty(Mono.error(() -> new SnapshotProviderException(
                "Snapshot provider returned no " + which + " snapshot for '" + modelName + "'")))
            .retryWhen(Retry.backoff(2, Duration.ofMillis(300))
                .filter(ex -> ex instanceof WebClientRequestException)
                .onRetryExhaustedThrow((spec, sig) -> new SnapshotProviderException(
                    "Snapshot provider unreachable", sig.failure())))
            .onErrorMap(WebClientRequestException.class,
                ex -> new SnapshotProviderException("Snapshot provider unreachable", ex));
    }
}
