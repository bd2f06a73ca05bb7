package com.company.obscalc.controller;

import com.company.obscalc.domain.enums.CalcKind;
import com.company.obscalc.dto.response.CalcResultResponse;
import com.company.obscalc.dto.response.ChangeEventResponse;
import com.company.obscalc.service.CalcResultQueryService;
import com.company.obscalc.service.ChangeNotifier;
import io.micrometer.core.instrument.MeterRegistry;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.io.IOException;
import java.time.Duration;
import java.util.List;

@RestController
@RequestMapping("/api/v1")
@Tag(name = "Calculation Results", description = "Read cached calculation results and follow their changes")
@RequiredArgsConstructor
@Slf4j
public class CalcResultController {

    private static final Duration STREAM_TIMEOUT = Duration.ofMinutes(30);

    private final CalcResultQueryService queryService;
    private final ChangeNotifier changeNotifier;
    private final MeterRegistry meterRegistry;

    @GetMapping("/observations/{observationId}/calc")
    @Operation(
            summary = "Get the cached calculation of an observation",
            description = "A stale result is returned as the previous best-effort value."
    )
    public ResponseEntity<CalcResultResponse> getObservationCalc(@PathVariable String observationId) {
        meterRegistry.counter("api.results.requests", "kind", CalcKind.OBSCALC.name()).increment();
        return ResponseEntity.ok(queryService.getResult(CalcKind.OBSCALC, observationId));
    }

    @GetMapping("/observations/{observationId}/telluric")
    @Operation(summary = "Get the resolved telluric standard of a calibration observation")
    public ResponseEntity<CalcResultResponse> getTelluricResolution(@PathVariable String observationId) {
        meterRegistry.counter("api.results.requests", "kind", CalcKind.TELLURIC.name()).increment();
        return ResponseEntity.ok(queryService.getResult(CalcKind.TELLURIC, observationId));
    }

    @GetMapping("/programs/{programId}/calc")
    @Operation(summary = "Get the cached calculations of every observation in a program")
    public ResponseEntity<List<CalcResultResponse>> getProgramCalcs(@PathVariable String programId) {
        return ResponseEntity.ok(queryService.getProgramResults(CalcKind.OBSCALC, programId));
    }

    @GetMapping("/programs/{programId}/calc/events")
    @Operation(
            summary = "Stream calculation state changes of a program",
            description = "Server-sent events, one per state change, for as long as the client stays connected."
    )
    public SseEmitter streamProgramChanges(@PathVariable String programId) {
        SseEmitter emitter = new SseEmitter(STREAM_TIMEOUT.toMillis());

        ChangeNotifier.Subscription subscription = changeNotifier.subscribe(programId, event -> {
            try {
                emitter.send(SseEmitter.event()
                        .name("calc-state")
                        .data(ChangeEventResponse.from(event)));
            } catch (IOException e) {
                log.debug("Change stream for program {} closed by client: {}", programId, e.getMessage());
                emitter.completeWithError(e);
            }
        });

        emitter.onCompletion(subscription::close);
        emitter.onTimeout(subscription::close);
        emitter.onError(e -> subscription.close());

        log.debug("Opened change stream for program {}", programId);
        return emitter;
    }
}
