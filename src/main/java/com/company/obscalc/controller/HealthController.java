package com.company.obscalc.controller;

import com.company.obscalc.domain.enums.CalcState;
import com.company.obscalc.repository.OwnerSweepRepository;
import com.company.obscalc.service.CalcCacheService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Clock;
import java.util.HashMap;
import java.util.Map;

@RestController
@RequestMapping("/api/v1/health")
@Tag(name = "Health", description = "Health check endpoints")
public class HealthController {

    private final CalcCacheService obscalcService;
    private final CalcCacheService telluricService;
    private final OwnerSweepRepository sweepRepository;
    private final Clock clock;

    public HealthController(@Qualifier("obscalcService") CalcCacheService obscalcService,
                            @Qualifier("telluricService") CalcCacheService telluricService,
                            OwnerSweepRepository sweepRepository,
                            Clock clock) {
        this.obscalcService = obscalcService;
        this.telluricService = telluricService;
        this.sweepRepository = sweepRepository;
        this.clock = clock;
    }

    @GetMapping
    @Operation(summary = "Health check with calculation queue depth")
    public ResponseEntity<Map<String, Object>> health() {
        Map<String, Map<CalcState, Long>> records = new HashMap<>();
        records.put(obscalcService.getKind().name(), obscalcService.countByState());
        records.put(telluricService.getKind().name(), telluricService.countByState());

        Map<String, Object> response = new HashMap<>();
        response.put("status", "UP");
        response.put("timestamp", clock.instant());
        response.put("service", "obscalc-service");
        response.put("version", "1.0.0");
        response.put("records", records);
        response.put("pendingSweeps", sweepRepository.countPending());

        return ResponseEntity.ok(response);
    }
}
