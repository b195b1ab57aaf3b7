package com.modellifecycle.service;

import com.modellifecycle.exception.ConcurrencyConflictException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * One exclusive lock per (scope, model name). Acquisition waits a bounded time,
 * backs off and retries a bounded number of times, then fails with {@link ConcurrencyConflictException}.
 * Callers holding a RETRAIN lock may take a REGISTRY lock, never the other way round.
 */
@Slf4j
@Component
public class ModelLockRegistry {

    public enum Scope { REGISTRY, RETRAIN }

    @Value("${lifecycle.locks.wait-ms:2000}")
    private long waitMillis;

    @Value("${lifecycle.locks.max-attempts:3}")
    private int maxAttempts;

    @Value("${lifecycle.locks.backoff-ms:50}")
    private long backoffMillis;

    private final ConcurrentHashMap<String, ReentrantLock> locks = new ConcurrentHashMap<>();

    public ModelLockRegistry() {
        this(2000, 3, 50);
    }

    ModelLockRegistry(long waitMillis, int maxAttempts, long backoffMillis) {
        this.waitMillis = waitMillis;
        this.maxAttempts = maxAttempts;
        this.backoffMillis = backoffMillis;
    }

    public <T> T withLock(Scope scope, String modelName, Supplier<T> action) {
        ReentrantLock lock = locks.computeIfAbsent(scope + ":" + modelName, k -> new ReentrantLock(true));
        acquire(lock, scope, modelName);
        try {
            return action.get();
        } finally {
            lock.unlock();
        }
    }

    public void withLock(Scope scope, String modelName, Runnable action) {
        withLock(scope, modelName, () -> {
            action.run();
            return null;
        });
    }

    private void acquire(ReentrantLock lock, Scope scope, String modelName) {
        int attempts = Math.max(1, maxAttempts);
        for (int attempt = 1; attempt <= attempts; attempt++) {
            try {
                if (lock.tryLock(waitMillis, TimeUnit.MILLISECONDS)) {
                    return;
                }
                log.warn("Lock contention | scope={} | model={} | attempt={}/{}", scope, modelName, attempt, attempts);
                if (attempt < attempts) {
                    Thread.sleep(backoffMillis * (1L << (attempt - 1)));
                }
            } catch (InterruptedException ex) {
                Thread.currentThread().interrupt();
                throw new ConcurrencyConflictException(scope.name(), modelName, attempt);
            }
        }
        throw new ConcurrencyConflictException(scope.name(), modelName, attempts);
    }
}
