package com.company.errorbudget.service;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.CannotAcquireLockException;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Single-writer lock per (service, SLO target) around the ledger's
 * read-accrue-write sequence. Different pairs never contend.
 */
@Component
@Slf4j
public class LedgerLocks {

    private final Map<String, ReentrantLock> locks = new ConcurrentHashMap<>();
    private final long acquireTimeoutMs;

    public LedgerLocks(@Value("${errorbudget.evaluation.tick-timeout-ms:30000}") long acquireTimeoutMs) {
        this.acquireTimeoutMs = acquireTimeoutMs;
    }

    public <T> T withLock(Long serviceId, Long sloTargetId, Supplier<T> action) {
        String key = serviceId + ":" + sloTargetId;
        ReentrantLock lock = locks.computeIfAbsent(key, k -> new ReentrantLock());

        boolean acquired;
        try {
            acquired = lock.tryLock(acquireTimeoutMs, TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CannotAcquireLockException("Interrupted waiting for ledger lock " + key, e);
        }

        if (!acquired) {
            throw new CannotAcquireLockException(
                    "Ledger lock " + key + " not acquired within " + acquireTimeoutMs + " ms");
        }

        try {
            return action.get();
        } finally {
            lock.unlock();
        }
    }
}
