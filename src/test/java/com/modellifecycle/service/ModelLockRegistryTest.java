package com.modellifecycle.service;

import com.modellifecycle.exception.ConcurrencyConflictException;
import org.junit.jupiter.api.Test;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.*;

class ModelLockRegistryTest {

    @Test
    void withLock_returnsActionResult() {
        ModelLockRegistry locks = new ModelLockRegistry();

        assertThat(locks.withLock(ModelLockRegistry.Scope.REGISTRY, "fraud_model", () -> 42)).isEqualTo(42);
    }

    @Test
    void sameKey_serialisesCallers() throws Exception {
        ModelLockRegistry locks = new ModelLockRegistry(5_000, 3, 10);
        ExecutorService pool = Executors.newFixedThreadPool(8);
        AtomicInteger inside = new AtomicInteger();
        AtomicInteger maxInside = new AtomicInteger();
        CountDownLatch start = new CountDownLatch(1);
        try {
            Future<?>[] futures = new Future<?>[8];
            for (int i = 0; i < futures.length; i++) {
                futures[i] = pool.submit(() -> {
                    start.await();
                    locks.withLock(ModelLockRegistry.Scope.RETRAIN, "fraud_model", () -> {
                        maxInside.accumulateAndGet(inside.incrementAndGet(), Math::max);
                        sleep(5);
                        inside.decrementAndGet();
                    });
                    return null;
                });
            }
            start.countDown();
            for (Future<?> f : futures) {
                f.get(10, TimeUnit.SECONDS);
            }
        } finally {
            pool.shutdownNow();
        }
        assertThat(maxInside.get()).isEqualTo(1);
    }

    @Test
    void heldLock_exhaustsAttemptsAndReportsBusy() throws Exception {
        ModelLockRegistry locks = new ModelLockRegistry(20, 2, 5);
        CountDownLatch held = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        Thread holder = new Thread(() -> locks.withLock(ModelLockRegistry.Scope.REGISTRY, "fraud_model", () -> {
            held.countDown();
            await(release);
        }));
        holder.start();
        try {
            assertThat(held.await(5, TimeUnit.SECONDS)).isTrue();

            assertThatThrownBy(() -> locks.withLock(ModelLockRegistry.Scope.REGISTRY, "fraud_model", () -> 1))
                .isInstanceOf(ConcurrencyConflictException.class)
                .hasMessageContaining("REGISTRY")
                .satisfies(ex -> assertThat(((ConcurrencyConflictException) ex).getErrorCode()).isEqualTo("BUSY"));

            // other scopes and models are independent
            assertThat(locks.withLock(ModelLockRegistry.Scope.RETRAIN, "fraud_model", () -> 1)).isEqualTo(1);
            assertThat(locks.withLock(ModelLockRegistry.Scope.REGISTRY, "churn_model", () -> 2)).isEqualTo(2);
        } finally {
            release.countDown();
            holder.join(5_000);
        }
    }

    @Test
    void lock_isReentrant() {
        ModelLockRegistry locks = new ModelLockRegistry(20, 1, 5);

        int result = locks.withLock(ModelLockRegistry.Scope.RETRAIN, "fraud_model",
            () -> locks.withLock(ModelLockRegistry.Scope.RETRAIN, "fraud_model", () -> 7));

        assertThat(result).isEqualTo(7);
    }

    @Test
    void lock_isReleasedWhenActionThrows() {
        ModelLockRegistry locks = new ModelLockRegistry(20, 1, 5);

        assertThatThrownBy(() -> locks.withLock(ModelLockRegistry.Scope.REGISTRY, "fraud_model", () -> {
            throw new IllegalStateException("boom");
        })).isInstanceOf(IllegalStateException.class);

        assertThat(locks.withLock(ModelLockRegistry.Scope.REGISTRY, "fraud_model", () -> "free")).isEqualTo("free");
    }

    private static void sleep(long millis) {
        try {
            Thread.sleep(millis);
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
        }
    }

    private static void await(CountDownLatch latch) {
        try {
            latch.await(10, TimeUnit.SECONDS);
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
        }
    }
}
