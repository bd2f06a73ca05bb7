package com.company.obscalc.scheduled;

import com.company.obscalc.domain.enums.CalcKind;
import com.company.obscalc.domain.enums.CalcState;
import com.company.obscalc.event.CalcStateChangedEvent;
import com.company.obscalc.service.CalcCacheService;
import com.company.obscalc.service.CalcDispatcher;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.annotation.Async;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Feeds the observation calculation workers. Polls on a fixed delay and is
 * woken early whenever a record becomes pending.
 */
@Component
@Slf4j
@ConditionalOnProperty(
        value = "obscalc.worker.enabled",
        havingValue = "true",
        matchIfMissing = true
)
public class ObscalcDispatchJob {

    private final CalcCacheService obscalcService;
    private final CalcDispatcher obscalcDispatcher;
    private final MeterRegistry meterRegistry;

    public ObscalcDispatchJob(@Qualifier("obscalcService") CalcCacheService obscalcService,
                              @Qualifier("obscalcDispatcher") CalcDispatcher obscalcDispatcher,
                              MeterRegistry meterRegistry) {
        this.obscalcService = obscalcService;
        this.obscalcDispatcher = obscalcDispatcher;
        this.meterRegistry = meterRegistry;
    }

    /**
     * Claims left by a previous run are returned to the queue before any
     * worker starts.
     */
    @EventListener(ApplicationReadyEvent.class)
    public void onStartup() {
        int reset = obscalcService.resetCalculating();
        log.info("Observation calculation workers starting ({} stale claims reset)", reset);
        dispatch();
    }

    @Scheduled(
            fixedDelayString = "${obscalc.worker.poll-interval-ms:5000}",
            initialDelayString = "${obscalc.worker.initial-delay-ms:5000}"
    )
    public void poll() {
        dispatch();
    }

    @Async
    @EventListener
    public void onStateChanged(CalcStateChangedEvent event) {
        if (event.getKind() == CalcKind.OBSCALC && event.getNewState() == CalcState.PENDING) {
            dispatch();
        }
    }

    private void dispatch() {
        try {
            int started = obscalcDispatcher.dispatch();
            if (started > 0) {
                meterRegistry.counter("obscalc.dispatch.started").increment(started);
            }
        } catch (Exception e) {
            log.error("Observation calculation dispatch failed", e);
            meterRegistry.counter("obscalc.dispatch.failures").increment();
        }
    }
}
