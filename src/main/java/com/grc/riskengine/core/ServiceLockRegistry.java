package com.grc.riskengine.core;

import com.grc.riskengine.config.RiskEngineProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Per-service mutual exclusion for writes to a service's score and associations.
 * Callers must never hold two service locks at once.
 */
@Slf4j
@Component
public class ServiceLockRegistry {

    private final ConcurrentMap<Long, ReentrantLock> locks = new ConcurrentHashMap<>();
    private final Duration lockWait;

    public ServiceLockRegistry(RiskEngineProperties properties) {
        this.lockWait = properties.getBatch().getLockWait();
    }

    public <T> T withLock(Long serviceId, Supplier<T> action) {
        ReentrantLock lock = locks.computeIfAbsent(serviceId, id -> new ReentrantLock());
        boolean acquired;
        try {
            acquired = lock.tryLock(lockWait.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ServiceLockTimeoutException("Interrupted waiting for lock on service " + serviceId);
        }
        if (!acquired) {
            log.warn("Timed out after {} waiting for lock on service {}", lockWait, serviceId);
            throw new ServiceLockTimeoutException("Timed out waiting for lock on service " + serviceId);
        }
        try {
            return action.get();
        } finally {
            lock.unlock();
        }
    }

    public void withLock(Long serviceId, Runnable action) {
        withLock(serviceId, () -> {
            action.run();
            return null;
        });
    }

    /**
     * Lock wait exceeded. Transient: the event is retried in a later cycle.
     */
    public static class ServiceLockTimeoutException extends RiskProcessingException {
        public ServiceLockTimeoutException(String message) {
            super(message);
        }
    }
}
