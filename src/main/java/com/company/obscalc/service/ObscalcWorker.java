package com.company.obscalc.service;

import com.company.obscalc.client.ObservationCalculator;
import com.company.obscalc.domain.CalcTransition;
import com.company.obscalc.domain.ClaimedCalc;
import com.company.obscalc.domain.ObservationSnapshot;
import com.company.obscalc.domain.result.ObservationCalcResult;
import com.company.obscalc.exception.InvalidCalculationInputException;
import com.company.obscalc.repository.ObservationSnapshotSource;
import com.company.obscalc.repository.OwnerSweepRepository;
import com.company.obscalc.util.TimeUtils;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.timelimiter.TimeLimiter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.SpanKind;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeoutException;

/**
 * One calculation cycle for a claimed observation: snapshot, compute, report.
 * A record invalidated while the calculator runs is not interrupted; the
 * store demotes the result when it is reported.
 */
@Component
@Slf4j
public class ObscalcWorker {

    private final CalcCacheService obscalcService;
    private final ObservationSnapshotSource snapshotSource;
    private final OwnerSweepRepository sweepRepository;
    private final ObservationCalculator calculator;
    private final CircuitBreaker circuitBreaker;
    private final TimeLimiter timeLimiter;
    private final Executor callExecutor;
    private final Tracer tracer;
    private final MeterRegistry meterRegistry;

    public ObscalcWorker(@Qualifier("obscalcService") CalcCacheService obscalcService,
                         ObservationSnapshotSource snapshotSource,
                         OwnerSweepRepository sweepRepository,
                         ObservationCalculator calculator,
                         @Qualifier("calculatorCircuitBreaker") CircuitBreaker circuitBreaker,
                         @Qualifier("calculatorTimeLimiter") TimeLimiter timeLimiter,
                         @Qualifier("calculatorCallExecutor") Executor callExecutor,
                         Tracer tracer,
                         MeterRegistry meterRegistry) {
        this.obscalcService = obscalcService;
        this.snapshotSource = snapshotSource;
        this.sweepRepository = sweepRepository;
        this.calculator = calculator;
        this.circuitBreaker = circuitBreaker;
        this.timeLimiter = timeLimiter;
        this.callExecutor = callExecutor;
        this.tracer = tracer;
        this.meterRegistry = meterRegistry;
    }

    public CalcTransition process(ClaimedCalc claim) {
        MDC.put("observationId", claim.getObservationId());
        MDC.put("calcKind", claim.getKind().name());

        Span span = tracer.spanBuilder("obscalc.calculate")
                .setSpanKind(SpanKind.INTERNAL)
                .startSpan();
        Timer.Sample sample = Timer.start(meterRegistry);
        String outcome = "error";

        try (Scope scope = span.makeCurrent()) {
            span.setAttribute("observation.id", claim.getObservationId());
            span.setAttribute("program.id", String.valueOf(claim.getProgramId()));
            span.setAttribute("snapshot.version", claim.getSnapshotVersion());
            span.setAttribute("failure.count", claim.getFailureCount());

            Optional<ObservationSnapshot> snapshot = snapshotSource.load(claim.getObservationId());
            if (snapshot.isEmpty()) {
                // The record is deleted together with the observation
                log.info("Observation {} vanished before calculation", claim.getObservationId());
                outcome = "vanished";
                return null;
            }

            CalcTransition transition = calculateAndReport(claim, snapshot.get(), span);
            outcome = transition.getOutcome().name().toLowerCase();
            span.setAttribute("calc.outcome", outcome);
            return transition;

        } catch (DataAccessException e) {
            // The lease reaper returns the record to the queue
            log.error("Store unavailable while processing {}", claim.getObservationId(), e);
            meterRegistry.counter("obscalc.worker.store_errors").increment();
            span.recordException(e);
            span.setStatus(StatusCode.ERROR, "Store unavailable");
            return null;
        } catch (RuntimeException e) {
            log.error("Unexpected error while processing {}", claim.getObservationId(), e);
            meterRegistry.counter("obscalc.worker.unexpected_errors",
                    "cause", e.getClass().getSimpleName()).increment();
            span.recordException(e);
            span.setStatus(StatusCode.ERROR, describe(e));
            return reportUnexpectedError(claim, e);
        } finally {
            sample.stop(meterRegistry.timer("obscalc.worker.cycle", "outcome", outcome));
            span.end();
            MDC.remove("observationId");
            MDC.remove("calcKind");
        }
    }

    private CalcTransition calculateAndReport(ClaimedCalc claim, ObservationSnapshot snapshot, Span span) {
        ObservationCalcResult result;
        try {
            result = timeLimiter.executeFutureSupplier(() -> CompletableFuture.supplyAsync(
                    () -> circuitBreaker.executeSupplier(() -> calculator.calculate(snapshot)),
                    callExecutor));
        } catch (Exception e) {
            Throwable cause = unwrap(e);
            boolean transientFailure = !(cause instanceof InvalidCalculationInputException);
            String message = describe(cause);

            span.recordException(cause);
            span.setStatus(StatusCode.ERROR, message);
            meterRegistry.counter("obscalc.worker.failures",
                    "transient", String.valueOf(transientFailure),
                    "cause", cause.getClass().getSimpleName()
            ).increment();

            applyPendingSweeps(claim, snapshot);
            return obscalcService.fail(claim, transientFailure, message);
        }

        applyPendingSweeps(claim, snapshot);
        return obscalcService.complete(claim, result);
    }

    /**
     * Hand the claim back as a transient failure so the record is retried
     * with backoff instead of waiting for the lease to expire.
     */
    private CalcTransition reportUnexpectedError(ClaimedCalc claim, RuntimeException error) {
        try {
            return obscalcService.fail(claim, true, describe(error));
        } catch (DataAccessException e) {
            log.error("Could not report failure of {}, leaving it to the lease reaper",
                    claim.getObservationId(), e);
            return null;
        }
    }

    /**
     * An owner-wide change queued after the claim may not be in the snapshot.
     * Apply it to this observation before reporting, so the result is not
     * committed as current.
     */
    private void applyPendingSweeps(ClaimedCalc claim, ObservationSnapshot snapshot) {
        Optional<Instant> pending = sweepRepository.latestPending(snapshot.getProgramId(), snapshot.getCallForProposalsId());
        if (pending.isPresent() && TimeUtils.isAfter(pending.get(), claim.getClaimedAt())) {
            log.debug("Sweep at {} newer than claim of {}, invalidating first", pending.get(), claim.getObservationId());
            obscalcService.invalidate(claim.getObservationId(), snapshot.getProgramId(), pending.get());
        }
    }

    private static Throwable unwrap(Throwable e) {
        Throwable current = e;
        while ((current instanceof ExecutionException || current instanceof CompletionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    private static String describe(Throwable cause) {
        if (cause instanceof TimeoutException) {
            return "Calculation timed out";
        }
        if (cause instanceof CallNotPermittedException) {
            return "Calculator circuit open";
        }
        return cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
    }
}
