package com.synthetic.solvency.domain.service;

import com.synthetic.solvency.domain.exception.SolvencyErrorCode;
import com.synthetic.solvency.domain.exception.SolvencyException;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Supplier;

/**
 * Global totals and the circuit breaker, plus the single-writer transaction
 * every state-mutating operation runs in. Mutators refuse to run outside a
 * write transaction.
 */
@Slf4j
@Component
public class SolvencyState {

    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock(true);
    private final MeterRegistry meterRegistry;

    private long totalCollateral;
    private long totalSyntheticSupply;
    private boolean paused;

    public SolvencyState(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;
    }

    public <T> T write(String operation, Supplier<T> body) {
        lock.writeLock().lock();
        try {
            T result = body.get();
            meterRegistry.counter("solvency.operations.committed", "operation", operation).increment();
            return result;
        } catch (SolvencyException e) {
            meterRegistry.counter("solvency.operations.rejected",
                    "operation", operation, "code", e.getCode().name()).increment();
            log.debug("[Tx] {} 거부: code={}, reason={}", operation, e.getCode(), e.getMessage());
            throw e;
        } finally {
            lock.writeLock().unlock();
        }
    }

    public <T> T read(Supplier<T> body) {
        lock.readLock().lock();
        try {
            return body.get();
        } finally {
            lock.readLock().unlock();
        }
    }

    public long getTotalCollateral() {
        return read(() -> totalCollateral);
    }

    public long getTotalSyntheticSupply() {
        return read(() -> totalSyntheticSupply);
    }

    public boolean isPaused() {
        return read(() -> paused);
    }

    public void requireNotPaused() {
        if (isPaused()) {
            throw new SolvencyException(SolvencyErrorCode.CONTRACT_PAUSED, "contract is paused");
        }
    }

    void commitTotals(long newTotalCollateral, long newTotalSyntheticSupply) {
        requireWriteTransaction();
        if (newTotalCollateral < 0 || newTotalSyntheticSupply < 0) {
            throw new IllegalStateException("global totals must not be negative");
        }
        this.totalCollateral = newTotalCollateral;
        this.totalSyntheticSupply = newTotalSyntheticSupply;
    }

    void commitPaused(boolean paused) {
        requireWriteTransaction();
        this.paused = paused;
    }

    void requireWriteTransaction() {
        if (!lock.isWriteLockedByCurrentThread()) {
            throw new IllegalStateException("state mutation outside of a write transaction");
        }
    }
}
