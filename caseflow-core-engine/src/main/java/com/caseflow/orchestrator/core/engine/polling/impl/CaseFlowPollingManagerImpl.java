package com.caseflow.orchestrator.core.engine.polling.impl;

import com.caseflow.orchestrator.core.engine.lock.CaseLockedException;
import com.caseflow.orchestrator.core.engine.lock.ICaseFlowCaseLockService;
import com.caseflow.orchestrator.core.engine.polling.ICaseFlowPollingManager;
import com.caseflow.orchestrator.core.engine.polling.ICaseFlowResumeHandler;
import com.caseflow.orchestrator.core.engine.precondition.CaseFlowPreconditionRegistry;
import com.caseflow.orchestrator.core.engine.store.ICaseFlowCaseStore;
import com.caseflow.orchestrator.integration.constant.CaseFlowConstants;
import com.caseflow.orchestrator.integration.enumerations.CaseFlowInterventionStatus;
import com.caseflow.orchestrator.integration.enumerations.CaseFlowLogType;
import com.caseflow.orchestrator.integration.enumerations.CaseFlowPollOutcome;
import com.caseflow.orchestrator.integration.models.cases.CaseFlowCase;
import com.caseflow.orchestrator.integration.models.intervention.CaseFlowInterventionRecord;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Polling manager backed by a {@link ScheduledExecutorService}.
 *
 * <h2>Tick</h2>
 * Every {@code pollingInterval} a loop wakes up and, holding the case lock:
 * <ol>
 *   <li>exits if it was cancelled, or if the case or its pending record is gone</li>
 *   <li>re-checks the record's missing fields against the current case</li>
 *   <li>still missing: counts the attempt, logs a "still waiting" entry and re-arms, or expires
 *       once {@code maxPollAttempts} is reached (the record stays PENDING, polling stops)</li>
 *   <li>present: releases the lock and hands the case to the resume handler, whose engine run
 *       resolves the record and stops the loop under its own lock</li>
 * </ol>
 * The record stays PENDING and the loop armed until a resume has actually resolved it: a resume
 * that finds the case locked re-arms like a skipped tick, and a failed one counts as an attempt.
 * Without a resume handler the tick resolves the record itself.
 */
@Slf4j
public class CaseFlowPollingManagerImpl implements ICaseFlowPollingManager {

    private static final String LOCK_OPERATION = "poll";

    private final ScheduledExecutorService scheduler;
    private final Map<String, PollLoop> activeLoops = new ConcurrentHashMap<>();
    private final ICaseFlowCaseStore caseStore;
    private final ICaseFlowCaseLockService lockService;
    private final CaseFlowPreconditionRegistry preconditionRegistry;
    private final Duration pollingInterval;
    private final int maxPollAttempts;
    private final Duration lockDuration;
    private final Clock clock;
    private volatile ICaseFlowResumeHandler resumeHandler;
    private volatile boolean running = false;

    public CaseFlowPollingManagerImpl(ICaseFlowCaseStore caseStore,
                                      ICaseFlowCaseLockService lockService,
                                      CaseFlowPreconditionRegistry preconditionRegistry,
                                      Duration pollingInterval,
                                      int maxPollAttempts,
                                      Duration lockDuration) {
        this(caseStore, lockService, preconditionRegistry, pollingInterval, maxPollAttempts, lockDuration, Clock.systemUTC(), 2);
    }

    public CaseFlowPollingManagerImpl(ICaseFlowCaseStore caseStore,
                                      ICaseFlowCaseLockService lockService,
                                      CaseFlowPreconditionRegistry preconditionRegistry,
                                      Duration pollingInterval,
                                      int maxPollAttempts,
                                      Duration lockDuration,
                                      Clock clock,
                                      int schedulerThreads) {
        this.caseStore = caseStore;
        this.lockService = lockService;
        this.preconditionRegistry = preconditionRegistry;
        this.pollingInterval = pollingInterval;
        this.maxPollAttempts = maxPollAttempts;
        this.lockDuration = lockDuration;
        this.clock = clock;
        AtomicInteger threadCounter = new AtomicInteger();
        this.scheduler = Executors.newScheduledThreadPool(schedulerThreads, r -> {
            Thread t = new Thread(r, "caseflow-poller-" + threadCounter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    // ========================================================================
    // INTERVENTIONS
    // ========================================================================

    @Override
    public Mono<CaseFlowInterventionRecord> raiseIntervention(String caseId, String kind, String reason,
                                                              List<String> missingFields) {
        return caseStore.findPendingIntervention(caseId)
                .map(existing -> existing.toBuilder()
                        .kind(kind)
                        .reason(reason)
                        .missingFields(new ArrayList<>(missingFields))
                        .pollingActive(true)
                        .updatedAt(clock.instant())
                        .build())
                .switchIfEmpty(Mono.fromSupplier(() -> {
                    Instant now = clock.instant();
                    return CaseFlowInterventionRecord.builder()
                            .interventionId(UUID.randomUUID().toString())
                            .caseId(caseId)
                            .kind(kind)
                            .reason(reason)
                            .missingFields(new ArrayList<>(missingFields))
                            .status(CaseFlowInterventionStatus.PENDING)
                            .pollingActive(true)
                            .createdAt(now)
                            .updatedAt(now)
                            .build();
                }))
                .flatMap(caseStore::saveIntervention)
                .flatMap(record -> {
                    boolean armed = arm(caseId);
                    if (!armed) {
                        log.debug("Polling already active for caseId={}, intervention refreshed", caseId);
                        return Mono.just(record);
                    }
                    return caseStore.appendLog(caseId,
                                    "[POLLING] Polling for " + String.join(", ", missingFields)
                                            + " every " + pollingInterval.toSeconds() + "s",
                                    CaseFlowLogType.POLLING)
                            .thenReturn(record);
                });
    }

    @Override
    public Mono<CaseFlowInterventionRecord> resolveIntervention(String caseId, String resolution) {
        return stopLoop(caseId)
                .then(caseStore.findPendingIntervention(caseId))
                .map(pending -> resolved(pending, resolution))
                .flatMap(caseStore::saveIntervention)
                .doOnNext(record -> log.info("Intervention resolved: caseId={}, id={}", caseId, record.getInterventionId()));
    }

    // ========================================================================
    // LOOP CONTROL
    // ========================================================================

    @Override
    public Mono<Boolean> stopPolling(String caseId) {
        return stopLoop(caseId)
                .flatMap(wasActive -> caseStore.findPendingIntervention(caseId)
                        .filter(CaseFlowInterventionRecord::isPollingActive)
                        .flatMap(pending -> caseStore.saveIntervention(pending.toBuilder()
                                .pollingActive(false)
                                .updatedAt(clock.instant())
                                .build()))
                        .thenReturn(wasActive));
    }

    @Override
    public Mono<CaseFlowPollOutcome> pollNow(String caseId) {
        return Mono.defer(() -> {
            PollLoop loop = activeLoops.get(caseId);
            if (loop == null) {
                return Mono.just(CaseFlowPollOutcome.NOT_ACTIVE);
            }
            return runTick(loop);
        });
    }

    @Override
    public Mono<Integer> recoverPolling() {
        return caseStore.findPolledInterventions()
                .filter(record -> arm(record.getCaseId()))
                .count()
                .map(Long::intValue)
                .doOnNext(count -> {
                    if (count > 0) {
                        log.info("Recovered {} polling loops", count);
                    }
                });
    }

    @Override
    public boolean isPolling(String caseId) {
        PollLoop loop = activeLoops.get(caseId);
        return loop != null && !loop.isCancelled();
    }

    @Override
    public List<String> getActivePolls() {
        List<String> caseIds = new ArrayList<>(activeLoops.keySet());
        caseIds.sort(String::compareTo);
        return caseIds;
    }

    @Override
    public void setResumeHandler(ICaseFlowResumeHandler resumeHandler) {
        this.resumeHandler = resumeHandler;
    }

    @Override
    public void start() {
        running = true;
        activeLoops.values().forEach(loop -> {
            if (loop.getFuture() == null) {
                schedule(loop);
            }
        });
        log.info("Polling manager started with interval {}", pollingInterval);
    }

    @Override
    public void stop() {
        running = false;
        activeLoops.values().forEach(loop -> {
            loop.setCancelled(true);
            if (loop.getFuture() != null) {
                loop.getFuture().cancel(false);
            }
        });
        activeLoops.clear();
        scheduler.shutdown();
        try {
            if (!scheduler.awaitTermination(5, TimeUnit.SECONDS)) {
                scheduler.shutdownNow();
            }
        } catch (InterruptedException e) {
            scheduler.shutdownNow();
            Thread.currentThread().interrupt();
        }
        log.info("Polling manager stopped");
    }

    // ========================================================================
    // TICK
    // ========================================================================

    private Mono<CaseFlowPollOutcome> runTick(PollLoop loop) {
        String caseId = loop.getCaseId();
        ICaseFlowResumeHandler handler = resumeHandler;
        return lockService.executeWithLock(caseId, lockDuration, LOCK_OPERATION, Mono.defer(() -> checkOnce(caseId, handler)))
                .flatMap(outcome -> outcome == CaseFlowPollOutcome.RESOLVED && handler != null
                        ? resumeWorkflow(loop, handler)
                        : Mono.just(outcome))
                .onErrorResume(CaseLockedException.class, e -> {
                    log.debug("Poll tick skipped, case locked: caseId={}, holder={}", caseId, e.getCurrentOwner());
                    return Mono.just(CaseFlowPollOutcome.SKIPPED_LOCKED);
                })
                .doOnError(e -> recordFailedTick(loop, e));
    }

    /**
     * @return RESOLVED when the input is present; the record is only resolved here when no resume
     *         handler will do it
     */
    private Mono<CaseFlowPollOutcome> checkOnce(String caseId, ICaseFlowResumeHandler handler) {
        PollLoop loop = activeLoops.get(caseId);
        if (loop == null || loop.isCancelled()) {
            return Mono.just(CaseFlowPollOutcome.NOT_ACTIVE);
        }
        return caseStore.findCase(caseId)
                .flatMap(caseFlowCase -> caseStore.findPendingIntervention(caseId)
                        .flatMap(pending -> evaluate(loop, caseFlowCase, pending, handler != null)))
                .switchIfEmpty(Mono.defer(() -> {
                    log.info("Nothing left to poll for caseId={}, leaving loop", caseId);
                    removeLoop(caseId, loop);
                    return Mono.just(CaseFlowPollOutcome.NOT_ACTIVE);
                }));
    }

    private Mono<CaseFlowPollOutcome> evaluate(PollLoop loop, CaseFlowCase caseFlowCase, CaseFlowInterventionRecord pending,
                                               boolean resumable) {
        String caseId = caseFlowCase.getCaseId();
        List<String> stillMissing = preconditionRegistry.findStillMissing(caseFlowCase, pending.getMissingFields());

        if (stillMissing.isEmpty() && resumable) {
            return caseStore.appendLog(caseId,
                            "[POLLING] Input detected for " + String.join(", ", pending.getMissingFields())
                                    + ", resuming workflow",
                            CaseFlowLogType.POLLING)
                    .doOnSuccess(entry -> log.info("Missing input arrived for caseId={}, resuming workflow", caseId))
                    .thenReturn(CaseFlowPollOutcome.RESOLVED);
        }
        if (stillMissing.isEmpty()) {
            removeLoop(caseId, loop);
            return caseStore.saveIntervention(resolved(pending, "Input detected by background poller"))
                    .then(caseStore.appendStatus(caseId, CaseFlowConstants.STATUS_INTERVENTION_RESOLVED))
                    .then(caseStore.appendLog(caseId,
                            "[POLLING] Input detected for " + String.join(", ", pending.getMissingFields())
                                    + ", intervention resolved",
                            CaseFlowLogType.POLLING))
                    .doOnSuccess(entry -> log.info("Missing input arrived for caseId={}, resolving intervention", caseId))
                    .thenReturn(CaseFlowPollOutcome.RESOLVED);
        }

        int attempt = loop.getAttempts().incrementAndGet();
        if (attempt >= maxPollAttempts) {
            removeLoop(caseId, loop);
            return caseStore.saveIntervention(pending.toBuilder()
                            .pollCount(attempt)
                            .pollingActive(false)
                            .updatedAt(clock.instant())
                            .build())
                    .then(caseStore.appendLog(caseId,
                            "[POLLING] Polling expired after " + attempt + " attempts, intervention remains pending",
                            CaseFlowLogType.POLLING))
                    .doOnSuccess(entry -> log.warn("Polling expired for caseId={} after {} attempts", caseId, attempt))
                    .thenReturn(CaseFlowPollOutcome.EXPIRED);
        }

        return caseStore.saveIntervention(pending.toBuilder()
                        .pollCount(attempt)
                        .updatedAt(clock.instant())
                        .build())
                .then(caseStore.appendLog(caseId,
                        "[POLLING] Still waiting for " + String.join(", ", stillMissing)
                                + " (attempt " + attempt + "/" + maxPollAttempts + ")",
                        CaseFlowLogType.POLLING))
                .thenReturn(CaseFlowPollOutcome.STILL_WAITING);
    }

    /**
     * Runs the resume handler after the tick released the lock. The outcome is RESOLVED once the
     * resumed run took the case out of this loop, STILL_WAITING while the loop is still the case's.
     */
    private Mono<CaseFlowPollOutcome> resumeWorkflow(PollLoop loop, ICaseFlowResumeHandler handler) {
        String caseId = loop.getCaseId();
        return Mono.defer(() -> handler.resume(caseId, CaseFlowConstants.POLLER_RESUME_MESSAGE))
                .then(Mono.fromSupplier(() -> activeLoops.get(caseId) == loop && !loop.isCancelled()
                        ? CaseFlowPollOutcome.STILL_WAITING
                        : CaseFlowPollOutcome.RESOLVED))
                .onErrorResume(e -> !(e instanceof CaseLockedException), e -> {
                    log.error("Autonomous resume failed for caseId={}, intervention stays pending", caseId, e);
                    return caseStore.appendLog(caseId, "[POLLING] Resume failed: " + e.getMessage(), CaseFlowLogType.ERROR)
                            .then(Mono.<CaseFlowPollOutcome>error(e));
                });
    }

    /**
     * Counts a failed tick as an attempt, so that a loop whose store or resume keeps failing still
     * expires after {@code maxPollAttempts}.
     */
    private void recordFailedTick(PollLoop loop, Throwable failure) {
        String caseId = loop.getCaseId();
        int attempt = loop.getAttempts().incrementAndGet();
        if (attempt < maxPollAttempts || activeLoops.get(caseId) != loop) {
            return;
        }
        removeLoop(caseId, loop);
        log.warn("Polling expired for caseId={} after {} attempts, last failure: {}", caseId, attempt, failure.toString());
        caseStore.findPendingIntervention(caseId)
                .flatMap(pending -> caseStore.saveIntervention(pending.toBuilder()
                        .pollCount(attempt)
                        .pollingActive(false)
                        .updatedAt(clock.instant())
                        .build()))
                .subscribe(
                        saved -> log.debug("Polling flag cleared for caseId={}", caseId),
                        e -> log.error("Could not clear the polling flag of caseId={}", caseId, e));
    }

    // ========================================================================
    // PRIVATE HELPERS
    // ========================================================================

    /**
     * @return true if a new loop was registered
     */
    private boolean arm(String caseId) {
        boolean[] created = {false};
        activeLoops.computeIfAbsent(caseId, key -> {
            created[0] = true;
            PollLoop loop = new PollLoop(caseId);
            if (running) {
                schedule(loop);
            } else {
                log.warn("Polling manager not started, loop for caseId={} only runs on demand", caseId);
            }
            return loop;
        });
        if (created[0]) {
            log.info("Polling armed: caseId={}, interval={}", caseId, pollingInterval);
        }
        return created[0];
    }

    private void schedule(PollLoop loop) {
        loop.setFuture(scheduler.schedule(() -> handleTick(loop), pollingInterval.toMillis(), TimeUnit.MILLISECONDS));
    }

    private void handleTick(PollLoop loop) {
        if (loop.isCancelled()) {
            log.debug("Loop for caseId={} cancelled, exiting", loop.getCaseId());
            return;
        }
        CaseFlowPollOutcome outcome;
        try {
            outcome = runTick(loop).block();
        } catch (RuntimeException e) {
            log.error("Poll tick failed for caseId={}", loop.getCaseId(), e);
            outcome = CaseFlowPollOutcome.STILL_WAITING;
        }
        if ((outcome == CaseFlowPollOutcome.STILL_WAITING || outcome == CaseFlowPollOutcome.SKIPPED_LOCKED)
                && running && !loop.isCancelled() && activeLoops.get(loop.getCaseId()) == loop) {
            schedule(loop);
        }
    }

    private Mono<Boolean> stopLoop(String caseId) {
        return Mono.fromCallable(() -> {
            PollLoop loop = activeLoops.remove(caseId);
            if (loop == null) {
                return false;
            }
            loop.setCancelled(true);
            if (loop.getFuture() != null) {
                loop.getFuture().cancel(false);
            }
            log.info("Polling stopped: caseId={}", caseId);
            return true;
        });
    }

    private void removeLoop(String caseId, PollLoop loop) {
        loop.setCancelled(true);
        activeLoops.remove(caseId, loop);
    }

    private CaseFlowInterventionRecord resolved(CaseFlowInterventionRecord pending, String resolution) {
        Instant now = clock.instant();
        return pending.toBuilder()
                .status(CaseFlowInterventionStatus.RESOLVED)
                .pollingActive(false)
                .resolution(resolution)
                .resolvedAt(now)
                .updatedAt(now)
                .build();
    }

    @Data
    private static class PollLoop {
        private final String caseId;
        private final AtomicInteger attempts = new AtomicInteger();
        private volatile boolean cancelled;
        private volatile ScheduledFuture<?> future;
    }
}
