package com.company.obscalc.service;

import com.company.obscalc.domain.OwnerRef;
import com.company.obscalc.domain.enums.QaState;
import com.company.obscalc.repository.ObservationDirectory;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.List;

/**
 * Write-path hooks for the collaborators that own upstream data. Each
 * collaborator calls the matching hook after its own write; the hook decides
 * which observations are affected.
 */
@Component
@Slf4j
public class UpstreamChangeHooks {

    private final InvalidationTracker tracker;
    private final ObservationDirectory observationDirectory;
    private final CalcCacheService obscalcService;
    private final CalcCacheService telluricService;

    public UpstreamChangeHooks(InvalidationTracker tracker,
                               ObservationDirectory observationDirectory,
                               @Qualifier("obscalcService") CalcCacheService obscalcService,
                               @Qualifier("telluricService") CalcCacheService telluricService) {
        this.tracker = tracker;
        this.observationDirectory = observationDirectory;
        this.obscalcService = obscalcService;
        this.telluricService = telluricService;
    }

    public void observationCreated(String observationId, Instant at) {
        tracker.notifyChanged(observationId, at);
    }

    /**
     * Any edit to the observation row itself: constraints, timing window,
     * exposure time mode, workflow user state.
     */
    public void observationEdited(String observationId, Instant at) {
        tracker.notifyChanged(observationId, at);
    }

    public void observationDeleted(String observationId) {
        obscalcService.delete(observationId);
        telluricService.delete(observationId);
    }

    public void asterismChanged(String observationId, Instant at) {
        tracker.notifyChanged(observationId, at);
    }

    /**
     * Name, existence, source profile or role of a target changed. Every
     * observation whose asterism references it is affected.
     */
    public void targetEdited(String targetId, Instant at) {
        List<String> observationIds = observationDirectory.observationsForTarget(targetId);
        log.debug("Target {} edited, invalidating {} observations", targetId, observationIds.size());
        observationIds.forEach(observationId -> tracker.notifyChanged(observationId, at));
    }

    /**
     * GMOS North/South long slit, Flamingos 2 long slit or imaging settings
     * of the observation changed.
     */
    public void observingModeEdited(String observationId, Instant at) {
        tracker.notifyChanged(observationId, at);
    }

    public void configurationRequestChanged(String programId, Instant at) {
        tracker.notifyChangedForOwner(OwnerRef.program(programId), at);
    }

    public void callForProposalsEdited(String cfpId, Instant at) {
        tracker.notifyChangedForOwner(OwnerRef.callForProposals(cfpId), at);
    }

    /**
     * Program attributes used by validation: proposal status, allocations,
     * call for proposals assignment.
     */
    public void programChanged(String programId, Instant at) {
        tracker.notifyChangedForOwner(OwnerRef.program(programId), at);
    }

    /**
     * Only a move between passing (Pass or unset) and failing (Fail or
     * Usable) changes what counts as completed data.
     */
    public boolean datasetQaStateChanged(String observationId, QaState previous, QaState current, Instant at) {
        if (QaState.isPassing(previous) == QaState.isPassing(current)) {
            log.debug("QA state of {} moved {} -> {}, no effect", observationId, previous, current);
            return false;
        }
        tracker.notifyChanged(observationId, at);
        return true;
    }

    public boolean stepCompletionToggled(String observationId, boolean wasCompleted, boolean completed, Instant at) {
        if (wasCompleted == completed) {
            return false;
        }
        tracker.notifyChanged(observationId, at);
        return true;
    }
}
