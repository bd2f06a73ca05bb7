package com.company.obscalc.service;

import com.company.obscalc.client.TelluricTargetsClient;
import com.company.obscalc.domain.CalcRecord;
import com.company.obscalc.domain.CalcTransition;
import com.company.obscalc.domain.ClaimedCalc;
import com.company.obscalc.domain.ObservationSnapshot;
import com.company.obscalc.domain.TelluricQuery;
import com.company.obscalc.domain.enums.CalcKind;
import com.company.obscalc.domain.enums.CalcState;
import com.company.obscalc.domain.result.ExecutionDigest;
import com.company.obscalc.domain.result.ObservationCalcResult;
import com.company.obscalc.domain.result.SequenceDigest;
import com.company.obscalc.domain.result.TelluricResolutionResult;
import com.company.obscalc.event.CalcStateChangedEvent;
import com.company.obscalc.exception.InvalidCalculationInputException;
import com.company.obscalc.exception.ObservationNotFoundException;
import com.company.obscalc.repository.ObservationDirectory;
import com.company.obscalc.repository.ObservationSnapshotSource;
import com.company.obscalc.repository.TelluricRequestRepository;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.event.EventListener;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Resolves the telluric standard for telluric calibration observations. Uses
 * the same record lifecycle as observation calculations, with its own table
 * and retry policy.
 */
@Service
@Slf4j
public class TelluricResolutionService {

    // Longest science duration considered when searching for a standard
    static final Duration MAX_SEARCH_DURATION = Duration.ofHours(3);

    private final CalcCacheService telluricService;
    private final CalcCacheService obscalcService;
    private final TelluricRequestRepository requestRepository;
    private final ObservationDirectory observationDirectory;
    private final ObservationSnapshotSource snapshotSource;
    private final TelluricTargetsClient telluricTargetsClient;
    private final MeterRegistry meterRegistry;

    public TelluricResolutionService(@Qualifier("telluricService") CalcCacheService telluricService,
                                     @Qualifier("obscalcService") CalcCacheService obscalcService,
                                     TelluricRequestRepository requestRepository,
                                     ObservationDirectory observationDirectory,
                                     ObservationSnapshotSource snapshotSource,
                                     TelluricTargetsClient telluricTargetsClient,
                                     MeterRegistry meterRegistry) {
        this.telluricService = telluricService;
        this.obscalcService = obscalcService;
        this.requestRepository = requestRepository;
        this.observationDirectory = observationDirectory;
        this.snapshotSource = snapshotSource;
        this.telluricTargetsClient = telluricTargetsClient;
        this.meterRegistry = meterRegistry;
    }

    /**
     * Record that the calibration observation needs a telluric standard for
     * the science observation, and queue its resolution.
     */
    public CalcTransition request(String calibrationObservationId, String scienceObservationId, Instant at) {
        String programId = observationDirectory.programOf(calibrationObservationId)
                .orElseThrow(() -> new ObservationNotFoundException(calibrationObservationId));
        if (observationDirectory.programOf(scienceObservationId).isEmpty()) {
            throw new ObservationNotFoundException(scienceObservationId);
        }

        requestRepository.link(calibrationObservationId, scienceObservationId, at);
        log.info("Telluric resolution requested for {} (science {})", calibrationObservationId, scienceObservationId);
        return telluricService.invalidate(calibrationObservationId, programId, at);
    }

    public CalcTransition resolve(ClaimedCalc claim) {
        MDC.put("observationId", claim.getObservationId());
        MDC.put("calcKind", CalcKind.TELLURIC.name());
        try {
            return doResolve(claim);
        } catch (DataAccessException e) {
            log.error("Store unavailable while resolving telluric target for {}", claim.getObservationId(), e);
            meterRegistry.counter("obscalc.telluric.store_errors").increment();
            return null;
        } finally {
            MDC.remove("observationId");
            MDC.remove("calcKind");
        }
    }

    /**
     * A science observation's calculation became current; give its telluric
     * calibrations a fresh attempt with the new inputs.
     */
    public int recheckForScience(String scienceObservationId, Instant at) {
        int invalidated = 0;
        for (String calibrationId : requestRepository.findCalibrationsFor(scienceObservationId)) {
            Optional<String> programId = observationDirectory.programOf(calibrationId);
            if (programId.isPresent()) {
                telluricService.invalidate(calibrationId, programId.get(), at);
                invalidated++;
            }
        }
        if (invalidated > 0) {
            log.debug("Rechecking {} telluric calibrations of {}", invalidated, scienceObservationId);
        }
        return invalidated;
    }

    @EventListener
    public void onCalculationChanged(CalcStateChangedEvent event) {
        if (event.getKind() == CalcKind.OBSCALC && event.getNewState() == CalcState.READY) {
            recheckForScience(event.getObservationId(), event.getOccurredAt());
        }
    }

    private CalcTransition doResolve(ClaimedCalc claim) {
        String calibrationId = claim.getObservationId();

        Optional<String> scienceId = requestRepository.findScienceObservation(calibrationId);
        if (scienceId.isEmpty()) {
            return telluricService.fail(claim, false,
                    "No science observation linked to " + calibrationId);
        }

        Optional<TelluricQuery> query = buildQuery(scienceId.get());
        if (query.isEmpty()) {
            return telluricService.fail(claim, true,
                    "Missing inputs for science observation " + scienceId.get());
        }

        try {
            Optional<TelluricResolutionResult> found = telluricTargetsClient.search(query.get());
            if (found.isEmpty()) {
                meterRegistry.counter("obscalc.telluric.not_found").increment();
                return telluricService.fail(claim, true,
                        "No telluric stars found for observation " + calibrationId);
            }

            TelluricResolutionResult result = found.get();
            result.setScienceObservationId(scienceId.get());
            log.info("Resolved telluric target {} for {}", result.getTargetId(), calibrationId);
            return telluricService.complete(claim, result);

        } catch (InvalidCalculationInputException e) {
            return telluricService.fail(claim, false, e.getMessage());
        } catch (DataAccessException e) {
            throw e;
        } catch (RuntimeException e) {
            log.warn("Telluric search for {} failed: {}", calibrationId, e.getMessage());
            return telluricService.fail(claim, true, e.getMessage());
        }
    }

    private Optional<TelluricQuery> buildQuery(String scienceObservationId) {
        Optional<ObservationSnapshot> snapshot = snapshotSource.load(scienceObservationId);
        if (snapshot.isEmpty() || snapshot.get().getTargets() == null || snapshot.get().getTargets().isEmpty()) {
            return Optional.empty();
        }

        Optional<Duration> scienceTime = obscalcService.get(scienceObservationId)
                .filter(r -> r.getState() == CalcState.READY)
                .flatMap(this::scienceProgramTime);
        if (scienceTime.isEmpty()) {
            return Optional.empty();
        }

        Duration duration = scienceTime.get().compareTo(MAX_SEARCH_DURATION) > 0 ? MAX_SEARCH_DURATION : scienceTime.get();
        List<String> targetIds = snapshot.get().getTargets().stream()
                .map(ObservationSnapshot.TargetRef::getTargetId)
                .collect(Collectors.toList());

        return Optional.of(TelluricQuery.builder()
                .scienceObservationId(scienceObservationId)
                .programId(snapshot.get().getProgramId())
                .scienceTargetIds(targetIds)
                .observingMode(snapshot.get().getObservingMode())
                .scienceDuration(duration)
                .build());
    }

    private Optional<Duration> scienceProgramTime(CalcRecord scienceRecord) {
        return obscalcService.readResult(scienceRecord, ObservationCalcResult.class)
                .map(ObservationCalcResult::getDigest)
                .map(ExecutionDigest::getScience)
                .map(SequenceDigest::getProgramTime);
    }
}
