package com.company.obscalc.scheduled;

import com.company.obscalc.service.CalcCacheService;
import com.company.obscalc.service.CalcDispatcher;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
@Slf4j
@ConditionalOnProperty(
        value = "obscalc.telluric.enabled",
        havingValue = "true",
        matchIfMissing = true
)
public class TelluricResolutionJob {

    private final CalcCacheService telluricService;
    private final CalcDispatcher telluricDispatcher;

    public TelluricResolutionJob(@Qualifier("telluricService") CalcCacheService telluricService,
                                 @Qualifier("telluricDispatcher") CalcDispatcher telluricDispatcher) {
        this.telluricService = telluricService;
        this.telluricDispatcher = telluricDispatcher;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void onStartup() {
        int reset = telluricService.resetCalculating();
        log.info("Telluric resolution starting ({} stale claims reset)", reset);
    }

    @Scheduled(
            fixedDelayString = "${obscalc.telluric.poll-interval-ms:10000}",
            initialDelayString = "${obscalc.telluric.initial-delay-ms:10000}"
    )
    public void poll() {
        try {
            telluricDispatcher.dispatch();
        } catch (Exception e) {
            log.error("Telluric resolution dispatch failed", e);
        }
    }
}
