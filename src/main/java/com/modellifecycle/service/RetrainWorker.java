package com.modellifecycle.service;

import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;

@Slf4j
@Component
public class RetrainWorker {

    @Value("${lifecycle.retrain.worker-pool-size:4}")
    private int poolSize;

    @Value("${lifecycle.retrain.shutdown-grace-seconds:10}")
    private int shutdownGraceSeconds;

    private ExecutorService executor;

    @PostConstruct
    void init() {
        AtomicInteger counter = new AtomicInteger();
        ThreadFactory threads = r -> {
            Thread t = new Thread(r, "retrain-worker-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
        executor = Executors.newFixedThreadPool(Math.max(2, poolSize), threads);
        log.info("Retrain worker pool started | size={}", Math.max(2, poolSize));
    }

    @PreDestroy
    void shutdown() {
        if (executor == null) {
            return;
        }
        executor.shutdown();
        try {
            if (!executor.awaitTermination(shutdownGraceSeconds, TimeUnit.SECONDS)) {
                log.warn("Retrain workers still busy after {}s, interrupting", shutdownGraceSeconds);
                executor.shutdownNow();
            }
        } catch (InterruptedException ex) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    public CompletableFuture<Void> dispatch(UUID jobId, Consumer<UUID> job) {
        return CompletableFuture.runAsync(() -> {
            try {
                job.accept(jobId);
            } catch (RuntimeException ex) {
                log.error("Retrain job crashed | jobId={} | error={}", jobId, ex.getMessage(), ex);
            }
        }, executor);
    }
}
