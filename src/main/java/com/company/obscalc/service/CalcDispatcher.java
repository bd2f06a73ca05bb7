package com.company.obscalc.service;

import com.company.obscalc.domain.ClaimedCalc;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;

import java.util.Optional;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.Semaphore;
import java.util.function.Consumer;

/**
 * Claims work only while a worker slot is free and hands each claim to the
 * worker pool. Safe to call from several threads.
 */
@Slf4j
public class CalcDispatcher {

    private final CalcCacheService service;
    private final Executor executor;
    private final Consumer<ClaimedCalc> processor;
    private final Semaphore permits;
    private final int capacity;

    public CalcDispatcher(CalcCacheService service, Executor executor, int capacity, Consumer<ClaimedCalc> processor) {
        this.service = service;
        this.executor = executor;
        this.processor = processor;
        this.capacity = capacity;
        this.permits = new Semaphore(capacity);
    }

    /**
     * @return the number of claims handed to workers
     */
    public int dispatch() {
        int started = 0;

        while (permits.tryAcquire()) {
            Optional<ClaimedCalc> claimed;
            try {
                claimed = service.claimNext();
            } catch (DataAccessException e) {
                permits.release();
                log.error("Cannot claim {} work, store unavailable", service.getKind(), e);
                break;
            }

            if (claimed.isEmpty()) {
                permits.release();
                break;
            }

            ClaimedCalc claim = claimed.get();
            try {
                executor.execute(() -> {
                    try {
                        processor.accept(claim);
                    } finally {
                        permits.release();
                    }
                });
                started++;
            } catch (RejectedExecutionException e) {
                permits.release();
                log.warn("Worker pool rejected {} claim on {}, releasing", service.getKind(), claim.getObservationId());
                service.release(claim.getObservationId());
                break;
            }
        }

        if (started > 0) {
            log.debug("Dispatched {} {} calculations ({} of {} workers busy)",
                    started, service.getKind(), busyWorkers(), capacity);
        }
        return started;
    }

    public int busyWorkers() {
        return capacity - permits.availablePermits();
    }
}
