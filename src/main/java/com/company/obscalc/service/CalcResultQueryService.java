package com.company.obscalc.service;

import com.company.obscalc.domain.CalcRecord;
import com.company.obscalc.domain.enums.CalcKind;
import com.company.obscalc.domain.enums.CalcState;
import com.company.obscalc.dto.response.CalcResultResponse;
import com.company.obscalc.exception.CalcRecordNotFoundException;
import com.company.obscalc.exception.ObservationNotFoundException;
import com.company.obscalc.repository.ObservationDirectory;
import com.company.obscalc.repository.OwnerSweepRepository;
import com.company.obscalc.util.TimeUtils;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Read side of the cache. An owner-wide change that is queued but not yet
 * swept is already reflected here: a settled record older than the change is
 * reported as pending and stale.
 */
@Service
@Slf4j
public class CalcResultQueryService {

    private final CalcCacheService obscalcService;
    private final CalcCacheService telluricService;
    private final ObservationDirectory observationDirectory;
    private final OwnerSweepRepository sweepRepository;

    public CalcResultQueryService(@Qualifier("obscalcService") CalcCacheService obscalcService,
                                  @Qualifier("telluricService") CalcCacheService telluricService,
                                  ObservationDirectory observationDirectory,
                                  OwnerSweepRepository sweepRepository) {
        this.obscalcService = obscalcService;
        this.telluricService = telluricService;
        this.observationDirectory = observationDirectory;
        this.sweepRepository = sweepRepository;
    }

    public CalcResultResponse getResult(CalcKind kind, String observationId) {
        CalcCacheService service = serviceFor(kind);
        Optional<CalcRecord> record = service.get(observationId);

        if (record.isEmpty()) {
            if (observationDirectory.programOf(observationId).isEmpty()) {
                throw new ObservationNotFoundException(observationId);
            }
            throw new CalcRecordNotFoundException(observationId);
        }

        Optional<Instant> pendingSweep = pendingSweepFor(record.get().getProgramId());
        return toResponse(service, record.get(), pendingSweep);
    }

    public List<CalcResultResponse> getProgramResults(CalcKind kind, String programId) {
        CalcCacheService service = serviceFor(kind);
        Optional<Instant> pendingSweep = pendingSweepFor(programId);

        return service.getByProgram(programId).stream()
                .sorted(Comparator.comparing(CalcRecord::getObservationId))
                .map(r -> toResponse(service, r, pendingSweep))
                .collect(Collectors.toList());
    }

    private Optional<Instant> pendingSweepFor(String programId) {
        Optional<String> cfpId = observationDirectory.callForProposalsOf(programId);
        return sweepRepository.latestPending(programId, cfpId.orElse(null));
    }

    private CalcResultResponse toResponse(CalcCacheService service, CalcRecord record, Optional<Instant> pendingSweep) {
        CalcState state = record.getState();
        boolean stale = record.isStale();

        if (state.isSettled() && pendingSweep.isPresent()
                && TimeUtils.isAfter(pendingSweep.get(), CalcStateMachine.inputsAsOf(record))) {
            log.debug("{} record for {} predates pending sweep at {}",
                    service.getKind(), record.getObservationId(), pendingSweep.get());
            state = CalcState.PENDING;
            stale = true;
        }

        return CalcResultResponse.builder()
                .kind(service.getKind())
                .observationId(record.getObservationId())
                .programId(record.getProgramId())
                .state(state)
                .stale(stale)
                .result(service.readResult(record, JsonNode.class).orElse(null))
                .errorMessage(record.getErrorMessage())
                .lastInvalidation(record.getLastInvalidation())
                .lastUpdate(record.getLastUpdate())
                .retryAt(record.getRetryAt())
                .failureCount(record.getFailureCount())
                .build();
    }

    private CalcCacheService serviceFor(CalcKind kind) {
        return kind == CalcKind.TELLURIC ? telluricService : obscalcService;
    }
}
