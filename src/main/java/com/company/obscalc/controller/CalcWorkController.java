package com.company.obscalc.controller;

import com.company.obscalc.domain.CalcTransition;
import com.company.obscalc.domain.ClaimedCalc;
import com.company.obscalc.dto.request.CompleteCalcRequest;
import com.company.obscalc.dto.request.FailCalcRequest;
import com.company.obscalc.dto.response.ClaimResponse;
import com.company.obscalc.dto.response.TransitionResponse;
import com.company.obscalc.service.CalcCacheService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.Optional;

/**
 * Claim protocol for external calculation workers. Lost races are normal
 * responses: an empty claim is 204, a stale token is reported in the outcome.
 */
@RestController
@RequestMapping("/api/v1/calc")
@Tag(name = "Calculation Work", description = "Claim, complete and fail observation calculations")
@Slf4j
public class CalcWorkController {

    private final CalcCacheService obscalcService;

    public CalcWorkController(@Qualifier("obscalcService") CalcCacheService obscalcService) {
        this.obscalcService = obscalcService;
    }

    @PostMapping("/claims")
    @Operation(
            summary = "Claim the next calculation",
            description = "Claims the given observation, or the one with the oldest invalidation. 204 when nothing is claimable."
    )
    public ResponseEntity<ClaimResponse> claim(
            @Parameter(description = "Claim this observation instead of the next in line")
            @RequestParam(required = false) String observationId) {

        Optional<ClaimedCalc> claim = observationId != null
                ? obscalcService.claim(observationId)
                : obscalcService.claimNext();

        return claim.map(c -> ResponseEntity.ok(ClaimResponse.from(c)))
                .orElseGet(() -> ResponseEntity.noContent().build());
    }

    @PostMapping("/{observationId}/complete")
    @Operation(summary = "Report a calculation result for a claimed observation")
    public ResponseEntity<TransitionResponse> complete(
            @PathVariable String observationId,
            @Valid @RequestBody CompleteCalcRequest request) {

        CalcTransition transition = obscalcService.complete(
                observationId, request.getClaimToken(), request.getSnapshotVersion(), request.getResult());
        return ResponseEntity.ok(TransitionResponse.from(transition));
    }

    @PostMapping("/{observationId}/fail")
    @Operation(summary = "Report a failed calculation for a claimed observation")
    public ResponseEntity<TransitionResponse> fail(
            @PathVariable String observationId,
            @Valid @RequestBody FailCalcRequest request) {

        CalcTransition transition = obscalcService.fail(
                observationId, request.getClaimToken(), request.getSnapshotVersion(),
                request.isTransientFailure(), request.getMessage());
        return ResponseEntity.ok(TransitionResponse.from(transition));
    }
}
