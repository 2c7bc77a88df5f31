package com.caseflow.orchestrator.core.engine.workflow.impl;

import com.caseflow.orchestrator.core.engine.config.CaseFlowEngineConfig;
import com.caseflow.orchestrator.core.engine.executor.CaseFlowActionExecutorRegistry;
import com.caseflow.orchestrator.core.engine.lock.CaseLockedException;
import com.caseflow.orchestrator.core.engine.lock.ICaseFlowCaseLockService;
import com.caseflow.orchestrator.core.engine.oracle.ICaseFlowDecisionOracle;
import com.caseflow.orchestrator.core.engine.polling.ICaseFlowPollingManager;
import com.caseflow.orchestrator.core.engine.precondition.CaseFlowPreconditionRegistry;
import com.caseflow.orchestrator.core.engine.store.ICaseFlowCaseStore;
import com.caseflow.orchestrator.core.engine.store.ICaseFlowCheckpointStore;
import com.caseflow.orchestrator.core.engine.workflow.ICaseFlowWorkflowEngine;
import com.caseflow.orchestrator.core.exception.codes.CaseFlowInternalErrorCodes;
import com.caseflow.orchestrator.core.exception.engine.CaseFlowActionExecutionException;
import com.caseflow.orchestrator.core.exception.store.CaseFlowCaseNotFound;
import com.caseflow.orchestrator.core.exception.store.CaseFlowPersistenceException;
import com.caseflow.orchestrator.integration.constant.CaseFlowConstants;
import com.caseflow.orchestrator.integration.contract.ICaseFlowErrorInfo;
import com.caseflow.orchestrator.integration.contract.executor.ICaseFlowActionContext;
import com.caseflow.orchestrator.integration.contract.executor.ICaseFlowActionExecutor;
import com.caseflow.orchestrator.integration.contract.executor.ICaseFlowActionResult;
import com.caseflow.orchestrator.integration.contract.plugin.ICaseFlowWorkflowPlugin;
import com.caseflow.orchestrator.integration.enumerations.CaseFlowExecutionState;
import com.caseflow.orchestrator.integration.enumerations.CaseFlowLogType;
import com.caseflow.orchestrator.integration.exception.CaseFlowActionRuntimeException;
import com.caseflow.orchestrator.integration.exception.ICaseFlowActionException;
import com.caseflow.orchestrator.integration.models.cases.CaseFlowCase;
import com.caseflow.orchestrator.integration.models.checkpoint.CaseFlowWorkflowCheckpoint;
import com.caseflow.orchestrator.integration.models.decision.CaseFlowDecision;
import com.caseflow.orchestrator.integration.models.decision.CaseFlowDecisionContext;
import com.caseflow.orchestrator.integration.models.run.CaseFlowRunResult;
import lombok.Getter;
import lombok.Setter;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

/**
 * Drives a case through its workflow, one oracle decision at a time.
 *
 * <h2>Routing</h2>
 * <ul>
 *   <li><b>complete:</b> ends the run COMPLETED</li>
 *   <li><b>error:</b> runs the error executor, then decides again</li>
 *   <li><b>wait:</b> raises an intervention for the first unmet precondition and suspends the
 *       run; a wait with nothing missing goes through error handling instead</li>
 *   <li><b>resolve_intervention:</b> resolves the pending intervention, then decides again</li>
 *   <li><b>step label:</b> runs the executor, then decides again; a failed executor goes
 *       through error handling</li>
 * </ul>
 * Labels outside this set become {@code error}. A step already completed in the run is handled
 * by the configured repeat policy, and {@code maxSteps} decisions per invocation end the run FAILED.
 *
 * <p>The whole invocation holds the case lock and extends it before every decision and every
 * routed action; an invocation whose lock was taken over stops with {@link CaseLockedException}.
 * The checkpoint is saved after every step and persistence failures are propagated unchanged.
 *
 * <p>A run that resumes a case parked in AWAITING_INTERVENTION resolves the pending intervention
 * once every precondition holds, and a run that ends COMPLETED or FAILED closes any intervention
 * still pending.
 */
@Slf4j
public class CaseFlowWorkflowEngine implements ICaseFlowWorkflowEngine {

    private static final String LOCK_OPERATION = "run";
    private static final String RESUME_LOCK_OPERATION = "resume";
    private static final String INPUT_PRESENT_RESOLUTION = "Required input present on resume";
    private static final Set<String> REPEATABLE_ACTIONS = Set.of(
            CaseFlowConstants.ACTION_WAIT,
            CaseFlowConstants.ACTION_ERROR,
            CaseFlowConstants.ACTION_COMPLETE);

    private final ICaseFlowCaseStore caseStore;
    private final ICaseFlowCheckpointStore checkpointStore;
    private final CaseFlowActionExecutorRegistry executorRegistry;
    private final CaseFlowPreconditionRegistry preconditionRegistry;
    private final ICaseFlowDecisionOracle decisionOracle;
    private final ICaseFlowPollingManager pollingManager;
    private final ICaseFlowCaseLockService lockService;
    private final ICaseFlowActionContext actionContext;
    private final ICaseFlowWorkflowPlugin plugin;
    private final CaseFlowEngineConfig config;
    private final Clock clock;

    public CaseFlowWorkflowEngine(ICaseFlowCaseStore caseStore,
                                  ICaseFlowCheckpointStore checkpointStore,
                                  CaseFlowActionExecutorRegistry executorRegistry,
                                  CaseFlowPreconditionRegistry preconditionRegistry,
                                  ICaseFlowDecisionOracle decisionOracle,
                                  ICaseFlowPollingManager pollingManager,
                                  ICaseFlowCaseLockService lockService,
                                  ICaseFlowActionContext actionContext,
                                  ICaseFlowWorkflowPlugin plugin,
                                  CaseFlowEngineConfig config,
                                  Clock clock) {
        this.caseStore = caseStore;
        this.checkpointStore = checkpointStore;
        this.executorRegistry = executorRegistry;
        this.preconditionRegistry = preconditionRegistry;
        this.decisionOracle = decisionOracle;
        this.pollingManager = pollingManager;
        this.lockService = lockService;
        this.actionContext = actionContext;
        this.plugin = plugin;
        this.config = config;
        this.clock = clock;
    }

    @Override
    public Mono<CaseFlowRunResult> run(String caseId, String seedMessage) {
        String seed = seedOrDefault(seedMessage);
        return caseStore.exists(caseId)
                .flatMap(exists -> exists
                        ? lockService.executeWithLock(caseId, config.getLockDuration(), LOCK_OPERATION,
                                ownerId -> findCheckpoint(caseId).flatMap(existing -> doRun(caseId, seed, ownerId, existing)))
                        : Mono.<CaseFlowRunResult>error(new CaseFlowCaseNotFound(caseId)));
    }

    @Override
    public Mono<CaseFlowRunResult> resume(String caseId, String seedMessage) {
        String seed = seedOrDefault(seedMessage);
        return caseStore.exists(caseId)
                .flatMap(exists -> exists
                        ? lockService.executeWithLock(caseId, config.getLockDuration(), RESUME_LOCK_OPERATION,
                                ownerId -> findCheckpoint(caseId).flatMap(existing -> existing.isPresent() && existing.get().isTerminal()
                                        ? closeFinishedWorkflow(new RunState(caseId, ownerId, existing.get()))
                                        : doRun(caseId, seed, ownerId, existing)))
                        : Mono.<CaseFlowRunResult>error(new CaseFlowCaseNotFound(caseId)));
    }

    private Mono<CaseFlowRunResult> doRun(String caseId, String seed, String ownerId,
                                          Optional<CaseFlowWorkflowCheckpoint> existing) {
        boolean resuming = existing.isPresent() && !existing.get().isTerminal();
        boolean parked = resuming && existing.get().getExecutionState() == CaseFlowExecutionState.AWAITING_INTERVENTION;
        RunState state = new RunState(caseId, ownerId, resuming
                ? resumedCheckpoint(existing.get())
                : newCheckpoint(caseId, existing.map(CaseFlowWorkflowCheckpoint::getRunNumber).orElse(0)));
        log.info("{} workflow for caseId={}, runId={}",
                resuming ? "Resuming" : "Starting", caseId, state.getCheckpoint().getRunId());

        Mono<String> resolution = parked ? resolveSatisfiedIntervention(caseId) : Mono.empty();
        return resolution
                .map(Optional::of)
                .defaultIfEmpty(Optional.empty())
                .flatMap(resolvedMessage -> caseStore.appendStatus(caseId, resuming
                                ? CaseFlowConstants.STATUS_WORKFLOW_RESUMED
                                : CaseFlowConstants.STATUS_WORKFLOW_STARTED)
                        .then(trace(state, seed, seedLogType(seed)))
                        .then(resolvedMessage
                                .map(message -> trace(state, message, CaseFlowLogType.INTERVENTION))
                                .orElseGet(Mono::empty))
                        .then(save(state))
                        .then(decideNext(state))
                        .then(Mono.defer(() -> buildResult(state))));
    }

    private Mono<CaseFlowRunResult> closeFinishedWorkflow(RunState state) {
        CaseFlowExecutionState finalState = state.getCheckpoint().getExecutionState();
        log.info("Workflow for caseId={} already ended {}, nothing to resume", state.getCaseId(), finalState);
        return closePendingIntervention(state.getCaseId(), "Workflow already " + finalState)
                .then(Mono.defer(() -> buildResult(state)));
    }

    // ========================================================================
    // DECISION LOOP
    // ========================================================================

    // recursive method
    private Mono<Void> decideNext(RunState state) {
        if (state.getCheckpoint().getStepCount() >= config.getMaxSteps()) {
            return failWithDiagnostic(state, CaseFlowInternalErrorCodes.STEP_LIMIT_EXCEEDED, Map.of(
                    "maxSteps", String.valueOf(config.getMaxSteps()),
                    "caseId", state.getCaseId()));
        }

        return heartbeat(state)
                .then(Mono.defer(() -> buildDecisionContext(state)))
                .flatMap(decisionOracle::decide)
                .map(this::validateLabel)
                .flatMap(decision -> {
                    CaseFlowDecision guarded = applyRepeatGuard(state, decision);
                    if (guarded == null) {
                        return failWithDiagnostic(state, CaseFlowInternalErrorCodes.REPEATED_ACTION, Map.of(
                                "action", decision.getAction(),
                                "caseId", state.getCaseId()));
                    }
                    return heartbeat(state)
                            .then(Mono.defer(() -> {
                                CaseFlowWorkflowCheckpoint checkpoint = state.getCheckpoint();
                                state.setCheckpoint(checkpoint.toBuilder()
                                        .lastDecision(guarded)
                                        .stepCount(checkpoint.getStepCount() + 1)
                                        .totalSteps(checkpoint.getTotalSteps() + 1)
                                        .build());
                                return trace(state, "[ORCHESTRATOR] Next: " + guarded.getAction() + " | " + guarded.getReasoning(),
                                        CaseFlowLogType.DECISION);
                            }))
                            .then(Mono.defer(() -> route(state, guarded.getAction())));
                });
    }

    private Mono<Void> route(RunState state, String action) {
        switch (action) {
            case CaseFlowConstants.ACTION_COMPLETE:
                return finish(state, CaseFlowExecutionState.COMPLETED, CaseFlowConstants.STATUS_COMPLETED,
                        "[COMPLETE] Workflow completed", CaseFlowLogType.INFO);
            case CaseFlowConstants.ACTION_ERROR:
                return handleError(state).then(Mono.defer(() -> decideNext(state)));
            case CaseFlowConstants.ACTION_WAIT:
                return handleWait(state);
            case CaseFlowConstants.ACTION_RESOLVE_INTERVENTION:
                return resolveIntervention(state).then(Mono.defer(() -> decideNext(state)));
            default:
                return executeStep(state, action);
        }
    }

    private CaseFlowDecision validateLabel(CaseFlowDecision decision) {
        if (executorRegistry.getRoutableLabels().contains(decision.getAction())) {
            return decision;
        }
        log.warn("Oracle chose unroutable action '{}', routing to error handling", decision.getAction());
        return CaseFlowDecision.builder()
                .action(CaseFlowConstants.ACTION_ERROR)
                .reasoning(CaseFlowActionRuntimeException.formatMessage(CaseFlowInternalErrorCodes.ORACLE_UNKNOWN_ACTION,
                        Map.of("action", String.valueOf(decision.getAction()))))
                .forced(true)
                .originalAction(decision.getAction())
                .build();
    }

    /**
     * @return the decision to route, or null when the run must fail
     */
    private CaseFlowDecision applyRepeatGuard(RunState state, CaseFlowDecision decision) {
        String action = decision.getAction();
        if (REPEATABLE_ACTIONS.contains(action) || !state.getCheckpoint().hasCompleted(action)) {
            return decision;
        }
        log.warn("Action '{}' already completed for caseId={}, applying policy {}",
                action, state.getCaseId(), config.getRepeatActionPolicy());

        switch (config.getRepeatActionPolicy()) {
            case ROUTE_TO_ERROR:
                return CaseFlowDecision.builder()
                        .action(CaseFlowConstants.ACTION_ERROR)
                        .reasoning("Action '" + action + "' was already done")
                        .forced(true)
                        .originalAction(action)
                        .build();
            case FAIL:
                return null;
            case FORCE_COMPLETE:
            default:
                return CaseFlowDecision.builder()
                        .action(CaseFlowConstants.ACTION_COMPLETE)
                        .reasoning("Action '" + action + "' was already done")
                        .forced(true)
                        .originalAction(action)
                        .build();
        }
    }

    // ========================================================================
    // ROUTES
    // ========================================================================

    private Mono<Void> executeStep(RunState state, String label) {
        ICaseFlowActionExecutor executor = executorRegistry.get(label);
        state.setCheckpoint(state.getCheckpoint().toBuilder()
                .executionState(CaseFlowExecutionState.EXECUTING)
                .currentAction(label)
                .build());

        return save(state)
                .then(Mono.defer(() -> executor.execute(state.getCaseId(), actionContext)))
                .switchIfEmpty(Mono.error(() -> new IllegalStateException("executor returned no result")))
                .map(StepOutcome::succeeded)
                .onErrorResume(e -> !(e instanceof CaseFlowPersistenceException), e -> Mono.just(StepOutcome.failed(e)))
                .flatMap(outcome -> outcome.failure() == null
                        ? onStepSucceeded(state, label, outcome.result())
                        : onStepFailed(state, label, outcome.failure()));
    }

    private Mono<Void> onStepSucceeded(RunState state, String label, ICaseFlowActionResult result) {
        log.debug("Action '{}' completed for caseId={} with status {}", label, state.getCaseId(), result.getStatusLabel());
        markCompleted(state, label);
        return trace(state, result.getTraceMessage(), CaseFlowLogType.STEP)
                .then(save(state))
                .then(Mono.defer(() -> decideNext(state)));
    }

    private Mono<Void> onStepFailed(RunState state, String label, Throwable failure) {
        CaseFlowActionExecutionException executionException = toExecutionException(state.getCaseId(), label, failure);
        log.error("Action '{}' failed for caseId={}", label, state.getCaseId(), executionException);
        state.setCheckpoint(state.getCheckpoint().toBuilder()
                .executionState(CaseFlowExecutionState.DECIDING)
                .currentAction(null)
                .build());

        String reason = failure instanceof ICaseFlowActionException ? failure.getMessage() : String.valueOf(failure);
        return trace(state, "[ERROR] Action '" + label + "' failed: " + reason, CaseFlowLogType.ERROR)
                .then(handleError(state))
                .then(Mono.defer(() -> decideNext(state)));
    }

    private Mono<Void> handleError(RunState state) {
        ICaseFlowActionExecutor errorExecutor = executorRegistry.getErrorExecutor();
        return Mono.defer(() -> errorExecutor.execute(state.getCaseId(), actionContext))
                .flatMap(result -> trace(state, result.getTraceMessage(), CaseFlowLogType.ERROR))
                .then(save(state));
    }

    private Mono<Void> handleWait(RunState state) {
        String caseId = state.getCaseId();
        return caseStore.findCase(caseId)
                .switchIfEmpty(Mono.error(() -> new CaseFlowCaseNotFound(caseId)))
                .flatMap(caseFlowCase -> {
                    Optional<CaseFlowPreconditionRegistry.UnmetPrecondition> unmet = preconditionRegistry.findFirstUnmet(caseFlowCase);
                    if (unmet.isEmpty()) {
                        log.warn("Wait requested for caseId={} but no required input is missing", caseId);
                        return trace(state, "[ERROR] Wait requested but no required input is missing", CaseFlowLogType.ERROR)
                                .then(handleError(state))
                                .then(Mono.defer(() -> decideNext(state)));
                    }

                    CaseFlowPreconditionRegistry.UnmetPrecondition precondition = unmet.get();
                    List<String> missingFields = precondition.missingFields();
                    state.setMissingFields(missingFields);
                    state.setCheckpoint(state.getCheckpoint().toBuilder()
                            .executionState(CaseFlowExecutionState.AWAITING_INTERVENTION)
                            .currentAction(CaseFlowConstants.ACTION_WAIT)
                            .build());

                    return pollingManager.raiseIntervention(caseId, precondition.precondition().getKind(),
                                    precondition.precondition().getReason(), missingFields)
                            .then(caseStore.appendStatus(caseId, CaseFlowConstants.STATUS_AWAITING_INTERVENTION))
                            .then(trace(state, "[WAITING] Waiting for " + String.join(", ", missingFields)
                                    + " - polling every " + config.getPollingInterval().toSeconds() + "s",
                                    CaseFlowLogType.INTERVENTION))
                            .then(save(state))
                            .doOnSuccess(ignored -> log.info("Workflow for caseId={} suspended, awaiting {}", caseId, missingFields));
                });
    }

    private Mono<Void> resolveIntervention(RunState state) {
        String caseId = state.getCaseId();
        return pollingManager.resolveIntervention(caseId, "Resolved by orchestrator")
                .flatMap(record -> caseStore.appendStatus(caseId, CaseFlowConstants.STATUS_INTERVENTION_RESOLVED)
                        .thenReturn("[INTERVENTION] Intervention " + record.getInterventionId() + " resolved"))
                .defaultIfEmpty("[INTERVENTION] No pending intervention to resolve")
                .flatMap(message -> {
                    markCompleted(state, CaseFlowConstants.ACTION_RESOLVE_INTERVENTION);
                    return trace(state, message, CaseFlowLogType.INTERVENTION);
                })
                .then(save(state));
    }

    private Mono<Void> failWithDiagnostic(RunState state, ICaseFlowErrorInfo errorInfo, Map<String, String> variables) {
        String diagnostic = CaseFlowActionRuntimeException.formatMessage(errorInfo, variables);
        log.error("Loop guard tripped for caseId={}: {}", state.getCaseId(), diagnostic);
        state.setDiagnostic(diagnostic);
        return finish(state, CaseFlowExecutionState.FAILED, CaseFlowConstants.STATUS_FAILED,
                "[LOOP GUARD] " + diagnostic, CaseFlowLogType.ERROR);
    }

    private Mono<Void> finish(RunState state, CaseFlowExecutionState executionState, String statusLabel,
                              String message, CaseFlowLogType logType) {
        state.setCheckpoint(state.getCheckpoint().toBuilder()
                .executionState(executionState)
                .currentAction(null)
                .build());
        return closePendingIntervention(state.getCaseId(), "Workflow " + executionState)
                .then(caseStore.appendStatus(state.getCaseId(), statusLabel))
                .then(trace(state, message, logType))
                .then(save(state))
                .doOnSuccess(ignored -> log.info("Workflow for caseId={} ended {}", state.getCaseId(), executionState));
    }

    // ========================================================================
    // INTERVENTIONS & LOCK
    // ========================================================================

    /**
     * Resolves the pending intervention when no precondition is unmet any more.
     *
     * @return the trace message for the resolution, empty when nothing was resolved
     */
    private Mono<String> resolveSatisfiedIntervention(String caseId) {
        return caseStore.findCase(caseId)
                .filter(caseFlowCase -> preconditionRegistry.findFirstUnmet(caseFlowCase).isEmpty())
                .flatMap(caseFlowCase -> pollingManager.resolveIntervention(caseId, INPUT_PRESENT_RESOLUTION))
                .flatMap(record -> caseStore.appendStatus(caseId, CaseFlowConstants.STATUS_INTERVENTION_RESOLVED)
                        .thenReturn("[INTERVENTION] Intervention " + record.getInterventionId()
                                + " resolved, required input present"));
    }

    private Mono<Void> closePendingIntervention(String caseId, String resolution) {
        return pollingManager.resolveIntervention(caseId, resolution)
                .flatMap(record -> caseStore.appendStatus(caseId, CaseFlowConstants.STATUS_INTERVENTION_RESOLVED)
                        .doOnSuccess(entry -> log.info("Closed intervention {} of caseId={}: {}",
                                record.getInterventionId(), caseId, resolution)))
                .then();
    }

    private Mono<Void> heartbeat(RunState state) {
        String caseId = state.getCaseId();
        return lockService.extend(caseId, state.getLockOwner(), config.getLockDuration())
                .flatMap(extended -> extended
                        ? Mono.<Void>empty()
                        : lockService.getLockInfo(caseId).flatMap(info -> {
                            log.error("Lost the lock of caseId={} to {}, abandoning the run",
                                    caseId, info.map(lock -> lock.getOwnerId()).orElse("nobody"));
                            return Mono.<Void>error(CaseLockedException.withLockInfo(caseId, info.orElse(null)));
                        }));
    }

    // ========================================================================
    // CHECKPOINT & TRACE
    // ========================================================================

    private CaseFlowWorkflowCheckpoint newCheckpoint(String caseId, int previousRunNumber) {
        return CaseFlowWorkflowCheckpoint.builder()
                .caseId(caseId)
                .runId(UUID.randomUUID().toString())
                .runNumber(previousRunNumber + 1)
                .executionState(CaseFlowExecutionState.DECIDING)
                .createdAt(clock.instant())
                .updatedAt(clock.instant())
                .build();
    }

    private CaseFlowWorkflowCheckpoint resumedCheckpoint(CaseFlowWorkflowCheckpoint existing) {
        return existing.toBuilder()
                .executionState(CaseFlowExecutionState.DECIDING)
                .currentAction(null)
                .stepCount(0)
                .completedActions(new ArrayList<>(existing.getCompletedActions()))
                .messages(new ArrayList<>(existing.getMessages()))
                .build();
    }

    private void markCompleted(RunState state, String label) {
        CaseFlowWorkflowCheckpoint checkpoint = state.getCheckpoint();
        List<String> completed = new ArrayList<>(checkpoint.getCompletedActions());
        if (!completed.contains(label)) {
            completed.add(label);
        }
        state.setCheckpoint(checkpoint.toBuilder()
                .completedActions(completed)
                .executionState(CaseFlowExecutionState.DECIDING)
                .currentAction(null)
                .build());
    }

    private Mono<Void> trace(RunState state, String message, CaseFlowLogType logType) {
        return Mono.defer(() -> {
            CaseFlowWorkflowCheckpoint checkpoint = state.getCheckpoint();
            List<String> messages = new ArrayList<>(checkpoint.getMessages());
            messages.add(message);
            state.setCheckpoint(checkpoint.toBuilder().messages(messages).build());
            return caseStore.appendLog(state.getCaseId(), message, logType);
        }).then();
    }

    private Mono<Void> save(RunState state) {
        return Mono.defer(() -> {
            state.setCheckpoint(state.getCheckpoint().toBuilder().updatedAt(clock.instant()).build());
            return checkpointStore.save(state.getCheckpoint());
        }).then();
    }

    private Mono<Optional<CaseFlowWorkflowCheckpoint>> findCheckpoint(String caseId) {
        return checkpointStore.findByCaseId(caseId)
                .map(Optional::of)
                .defaultIfEmpty(Optional.empty());
    }

    private static String seedOrDefault(String seedMessage) {
        return seedMessage == null || seedMessage.isBlank() ? CaseFlowConstants.DEFAULT_START_MESSAGE : seedMessage;
    }

    private CaseFlowLogType seedLogType(String seed) {
        return seed.startsWith("[AUTONOMOUS RESUME]") ? CaseFlowLogType.RESUME : CaseFlowLogType.INFO;
    }

    // ========================================================================
    // CONTEXT & RESULT
    // ========================================================================

    private Mono<CaseFlowDecisionContext> buildDecisionContext(RunState state) {
        String caseId = state.getCaseId();
        return Mono.zip(
                        caseStore.findCase(caseId).switchIfEmpty(Mono.error(() -> new CaseFlowCaseNotFound(caseId))),
                        caseStore.findCurrentStatus(caseId))
                .map(tuple -> {
                    CaseFlowWorkflowCheckpoint checkpoint = state.getCheckpoint();
                    List<String> messages = checkpoint.getMessages();
                    int from = Math.max(0, messages.size() - config.getHistoryWindow());
                    return CaseFlowDecisionContext.builder()
                            .caseId(caseId)
                            .currentStatus(tuple.getT2())
                            .facts(collectFacts(tuple.getT1()))
                            .completedActions(new ArrayList<>(checkpoint.getCompletedActions()))
                            .recentMessages(new ArrayList<>(messages.subList(from, messages.size())))
                            .availableActions(executorRegistry.describeActions())
                            .decisionRules(plugin == null ? List.of() : plugin.getDecisionRules())
                            .build();
                });
    }

    private Map<String, Object> collectFacts(CaseFlowCase caseFlowCase) {
        Map<String, Object> facts = new LinkedHashMap<>();
        caseFlowCase.getInputs().forEach((name, value) -> facts.put("Input " + name,
                value == null || value.isBlank() ? "missing" : "present (" + value.length() + " chars)"));
        caseFlowCase.getArtifacts().keySet().forEach(name -> facts.put("Artifact " + name, "present"));
        if (plugin != null) {
            facts.putAll(plugin.describeCase(caseFlowCase));
        }
        return facts;
    }

    private Mono<CaseFlowRunResult> buildResult(RunState state) {
        return caseStore.findCurrentStatus(state.getCaseId())
                .map(currentStatus -> {
                    CaseFlowWorkflowCheckpoint checkpoint = state.getCheckpoint();
                    CaseFlowDecision lastDecision = checkpoint.getLastDecision();
                    boolean waiting = checkpoint.getExecutionState() == CaseFlowExecutionState.AWAITING_INTERVENTION;
                    return CaseFlowRunResult.builder()
                            .caseId(state.getCaseId())
                            .runId(checkpoint.getRunId())
                            .executionState(checkpoint.getExecutionState())
                            .currentStatus(currentStatus)
                            .lastAction(lastDecision == null ? null : lastDecision.getAction())
                            .reasoning(lastDecision == null ? null : lastDecision.getReasoning())
                            .stepCount(checkpoint.getStepCount())
                            .messages(new ArrayList<>(checkpoint.getMessages()))
                            .completedActions(new ArrayList<>(checkpoint.getCompletedActions()))
                            .waitingForInput(waiting)
                            .pollingActive(pollingManager.isPolling(state.getCaseId()))
                            .missingFields(waiting ? new ArrayList<>(state.getMissingFields()) : new ArrayList<>())
                            .diagnostic(state.getDiagnostic())
                            .build();
                });
    }

    private CaseFlowActionExecutionException toExecutionException(String caseId, String label, Throwable failure) {
        if (failure instanceof ICaseFlowActionException) {
            return new CaseFlowActionExecutionException(caseId, label, (ICaseFlowActionException) failure);
        }
        return new CaseFlowActionExecutionException(caseId, label,
                CaseFlowInternalErrorCodes.ACTION_EXECUTION_FAILED,
                Map.of("action", label, "reason", String.valueOf(failure.getMessage())),
                failure, null);
    }

    /**
     * Mutable state of one invocation. Only the sequential decision chain touches it.
     */
    @Getter
    @Setter
    private static final class RunState {
        private final String caseId;
        private final String lockOwner;
        private CaseFlowWorkflowCheckpoint checkpoint;
        private List<String> missingFields = List.of();
        private String diagnostic;

        private RunState(String caseId, String lockOwner, CaseFlowWorkflowCheckpoint checkpoint) {
            this.caseId = caseId;
            this.lockOwner = lockOwner;
            this.checkpoint = checkpoint;
        }
    }

    private record StepOutcome(ICaseFlowActionResult result, Throwable failure) {
        static StepOutcome succeeded(ICaseFlowActionResult result) {
            return new StepOutcome(result, null);
        }

        static StepOutcome failed(Throwable failure) {
            return new StepOutcome(null, failure);
        }
    }
}
