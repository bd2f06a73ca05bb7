package com.company.obscalc.controller;

import com.company.obscalc.domain.CalcTransition;
import com.company.obscalc.domain.OwnerRef;
import com.company.obscalc.domain.enums.OwnerKind;
import com.company.obscalc.dto.request.InvalidationRequest;
import com.company.obscalc.dto.request.OwnerInvalidationRequest;
import com.company.obscalc.dto.request.TelluricRequest;
import com.company.obscalc.dto.response.TransitionResponse;
import com.company.obscalc.service.InvalidationTracker;
import com.company.obscalc.service.TelluricResolutionService;
import io.micrometer.core.instrument.MeterRegistry;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Clock;
import java.time.Instant;

@RestController
@RequestMapping("/api/v1/invalidations")
@Tag(name = "Invalidation", description = "Report upstream changes that affect cached calculations")
@RequiredArgsConstructor
@Slf4j
public class InvalidationController {

    private final InvalidationTracker invalidationTracker;
    private final TelluricResolutionService telluricResolutionService;
    private final MeterRegistry meterRegistry;
    private final Clock clock;

    @PostMapping
    @Operation(
            summary = "Invalidate one observation",
            description = "Creates the calculation record on first use. Unknown observations are ignored."
    )
    public ResponseEntity<TransitionResponse> invalidate(@Valid @RequestBody InvalidationRequest request) {
        Instant changeTime = request.getChangeTime() != null ? request.getChangeTime() : clock.instant();

        meterRegistry.counter("api.invalidations.requests", "scope", "observation").increment();

        CalcTransition transition = invalidationTracker.notifyChanged(request.getObservationId(), changeTime);
        return ResponseEntity.ok(TransitionResponse.from(transition));
    }

    @PostMapping("/owners")
    @Operation(
            summary = "Invalidate every observation of a program or call for proposals",
            description = "The sweep is queued and applied in the background; reads reflect it immediately."
    )
    public ResponseEntity<Void> invalidateOwner(@Valid @RequestBody OwnerInvalidationRequest request) {
        Instant changeTime = request.getChangeTime() != null ? request.getChangeTime() : clock.instant();
        OwnerRef owner = request.getOwnerKind() == OwnerKind.PROGRAM
                ? OwnerRef.program(request.getOwnerId())
                : OwnerRef.callForProposals(request.getOwnerId());

        meterRegistry.counter("api.invalidations.requests", "scope", request.getOwnerKind().name()).increment();
        log.debug("Owner invalidation for {} at {}", owner, changeTime);

        invalidationTracker.notifyChangedForOwner(owner, changeTime);
        return ResponseEntity.status(HttpStatus.ACCEPTED).build();
    }

    @PostMapping("/telluric")
    @Operation(summary = "Request telluric standard resolution for a calibration observation")
    public ResponseEntity<TransitionResponse> requestTelluric(@Valid @RequestBody TelluricRequest request) {
        CalcTransition transition = telluricResolutionService.request(
                request.getCalibrationObservationId(),
                request.getScienceObservationId(),
                clock.instant());
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(TransitionResponse.from(transition));
    }
}
