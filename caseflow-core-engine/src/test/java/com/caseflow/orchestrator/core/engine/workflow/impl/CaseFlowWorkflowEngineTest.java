package com.caseflow.orchestrator.core.engine.workflow.impl;

import com.caseflow.orchestrator.core.engine.config.CaseFlowEngineConfig;
import com.caseflow.orchestrator.core.engine.executor.CaseFlowActionContext;
import com.caseflow.orchestrator.core.engine.executor.CaseFlowActionExecutorRegistry;
import com.caseflow.orchestrator.core.engine.fixtures.DocumentReviewTestPlugin;
import com.caseflow.orchestrator.core.engine.fixtures.ScriptedDecisionOracle;
import com.caseflow.orchestrator.core.engine.lock.CaseLockedException;
import com.caseflow.orchestrator.core.engine.lock.impl.InMemoryCaseLockService;
import com.caseflow.orchestrator.core.engine.misc.CaseFlowObjectMapper;
import com.caseflow.orchestrator.core.engine.oracle.ICaseFlowDecisionOracle;
import com.caseflow.orchestrator.core.engine.polling.impl.CaseFlowPollingManagerImpl;
import com.caseflow.orchestrator.core.engine.precondition.CaseFlowPreconditionRegistry;
import com.caseflow.orchestrator.core.engine.store.impl.InMemoryCaseStore;
import com.caseflow.orchestrator.core.engine.store.impl.InMemoryCheckpointStore;
import com.caseflow.orchestrator.core.exception.store.CaseFlowCaseNotFound;
import com.caseflow.orchestrator.core.exception.store.CaseFlowPersistenceException;
import com.caseflow.orchestrator.integration.constant.CaseFlowConstants;
import com.caseflow.orchestrator.integration.contract.plugin.ICaseFlowWorkflowPlugin;
import com.caseflow.orchestrator.integration.enumerations.CaseFlowExecutionState;
import com.caseflow.orchestrator.integration.enumerations.CaseFlowInterventionStatus;
import com.caseflow.orchestrator.integration.enumerations.CaseFlowLogType;
import com.caseflow.orchestrator.integration.enumerations.CaseFlowPollOutcome;
import com.caseflow.orchestrator.integration.enumerations.CaseFlowRepeatActionPolicy;
import com.caseflow.orchestrator.integration.models.checkpoint.CaseFlowWorkflowCheckpoint;
import com.caseflow.orchestrator.integration.models.decision.CaseFlowActionDescriptor;
import com.caseflow.orchestrator.integration.models.decision.CaseFlowDecision;
import com.caseflow.orchestrator.integration.models.decision.CaseFlowDecisionContext;
import com.caseflow.orchestrator.integration.models.intervention.CaseFlowInterventionRecord;
import com.caseflow.orchestrator.integration.models.run.CaseFlowRunResult;
import com.caseflow.orchestrator.integration.models.status.CaseFlowActionLogEntry;
import com.caseflow.orchestrator.integration.models.status.CaseFlowStatusEntry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for {@link CaseFlowWorkflowEngine} against in-memory stores, a scripted oracle and a
 * two-step document review plugin.
 */
class CaseFlowWorkflowEngineTest {

    private static final String CASE_ID = "case-1";
    private static final String DOCUMENT_TEXT = "quarterly report text";

    private InMemoryCaseStore caseStore;
    private InMemoryCheckpointStore checkpointStore;
    private InMemoryCaseLockService lockService;
    private CaseFlowActionExecutorRegistry executorRegistry;
    private CaseFlowPreconditionRegistry preconditionRegistry;
    private CaseFlowPollingManagerImpl pollingManager;
    private DocumentReviewTestPlugin pluginProvider;
    private ICaseFlowWorkflowPlugin plugin;

    @BeforeEach
    void setUp() {
        caseStore = new InMemoryCaseStore();
        checkpointStore = new InMemoryCheckpointStore();
        lockService = new InMemoryCaseLockService();
        pluginProvider = new DocumentReviewTestPlugin();
        plugin = pluginProvider.create();
        executorRegistry = new CaseFlowActionExecutorRegistry();
        plugin.getActionExecutors().forEach(executorRegistry::register);
        preconditionRegistry = new CaseFlowPreconditionRegistry();
        plugin.getPreconditions().forEach(preconditionRegistry::register);
        pollingManager = new CaseFlowPollingManagerImpl(caseStore, lockService, preconditionRegistry,
                Duration.ofHours(1), 10, Duration.ofMinutes(1));
    }

    @AfterEach
    void tearDown() {
        pollingManager.stop();
    }

    private CaseFlowWorkflowEngine engine(ICaseFlowDecisionOracle oracle) {
        return engine(oracle, CaseFlowEngineConfig.builder().pollingInterval(Duration.ofHours(1)).build());
    }

    private CaseFlowWorkflowEngine engine(ICaseFlowDecisionOracle oracle, CaseFlowEngineConfig config) {
        CaseFlowWorkflowEngine engine = new CaseFlowWorkflowEngine(caseStore, checkpointStore, executorRegistry,
                preconditionRegistry, oracle, pollingManager, lockService,
                new CaseFlowActionContext(caseStore, CaseFlowObjectMapper.getInstance()),
                plugin, config, Clock.systemUTC());
        pollingManager.setResumeHandler(engine::resume);
        return engine;
    }

    private void useLockService(InMemoryCaseLockService replacement) {
        pollingManager.stop();
        lockService = replacement;
        pollingManager = new CaseFlowPollingManagerImpl(caseStore, lockService, preconditionRegistry,
                Duration.ofHours(1), 10, Duration.ofMinutes(1));
    }

    private void provideDocument() {
        caseStore.inTransaction(CASE_ID, tx -> {
            tx.putInput(DocumentReviewTestPlugin.DOCUMENT, DOCUMENT_TEXT);
            return null;
        }).block();
    }

    private void createCase(boolean withDocument) {
        caseStore.createCase(CASE_ID, withDocument ? Map.of(DocumentReviewTestPlugin.DOCUMENT, DOCUMENT_TEXT) : Map.of()).block();
    }

    private List<String> statusLabels() {
        return caseStore.findStatusHistory(CASE_ID).map(CaseFlowStatusEntry::getLabel).collectList().block();
    }

    // ========================================================================
    // HAPPY PATH
    // ========================================================================

    @Nested
    @DisplayName("Happy Path")
    class HappyPathTests {

        @Test
        @DisplayName("should run every step and complete when the input is present")
        void shouldCompleteWhenInputPresent() {
            // Given
            createCase(true);
            ScriptedDecisionOracle oracle = ScriptedDecisionOracle.following(DocumentReviewTestPlugin::happyPath);

            // When
            CaseFlowRunResult result = engine(oracle).run(CASE_ID, null).block();

            // Then
            assertEquals(CaseFlowExecutionState.COMPLETED, result.getExecutionState());
            assertEquals(CaseFlowConstants.STATUS_COMPLETED, result.getCurrentStatus());
            assertEquals(List.of("ingest", "approve"), result.getCompletedActions());
            assertEquals(3, result.getStepCount());
            assertEquals("complete", result.getLastAction());
            assertFalse(result.isWaitingForInput());
            assertEquals(List.of("CREATED", "WORKFLOW_STARTED", "INGESTED", "APPROVED", "COMPLETED"), statusLabels());
            assertEquals(CaseFlowConstants.DEFAULT_START_MESSAGE, result.getMessages().get(0));
            assertEquals("[COMPLETE] Workflow completed", result.getMessages().get(result.getMessages().size() - 1));
            assertEquals(DOCUMENT_TEXT, caseStore.findCase(CASE_ID).block().getArtifacts().get("ingested"));
        }

        @Test
        @DisplayName("should complete immediately when the oracle says so")
        void shouldCompleteImmediately() {
            // Given
            createCase(false);

            // When
            CaseFlowRunResult result = engine(ScriptedDecisionOracle.sequence("complete")).run(CASE_ID, null).block();

            // Then
            assertEquals(CaseFlowExecutionState.COMPLETED, result.getExecutionState());
            assertEquals(1, result.getStepCount());
            assertEquals(List.of("CREATED", "WORKFLOW_STARTED", "COMPLETED"), statusLabels());
        }

        @Test
        @DisplayName("should give the oracle facts, actions, rules and a bounded history")
        void shouldBuildDecisionContext() {
            // Given
            createCase(true);
            ScriptedDecisionOracle oracle = ScriptedDecisionOracle.following(DocumentReviewTestPlugin::happyPath);
            CaseFlowEngineConfig config = CaseFlowEngineConfig.builder().historyWindow(2).build();

            // When
            engine(oracle, config).run(CASE_ID, null).block();

            // Then
            List<CaseFlowDecisionContext> contexts = oracle.getContexts();
            assertEquals(3, contexts.size());
            CaseFlowDecisionContext first = contexts.get(0);
            assertEquals("WORKFLOW_STARTED", first.getCurrentStatus());
            assertEquals("present (" + DOCUMENT_TEXT.length() + " chars)", first.getFacts().get("Input document"));
            assertEquals(Boolean.FALSE, first.getFacts().get("Ingested"));
            assertEquals(List.of(CaseFlowConstants.DEFAULT_START_MESSAGE), first.getRecentMessages());
            assertEquals(List.of("ingest", "approve", "explode", "wait", "resolve_intervention", "error", "complete"),
                    first.getAvailableActions().stream().map(CaseFlowActionDescriptor::getLabel).collect(Collectors.toList()));
            assertEquals(2, first.getDecisionRules().size());

            CaseFlowDecisionContext last = contexts.get(2);
            assertEquals("present", last.getFacts().get("Artifact ingested"));
            assertEquals(List.of("ingest", "approve"), last.getCompletedActions());
            assertTrue(contexts.stream().allMatch(context -> context.getRecentMessages().size() <= 2));
        }

        @Test
        @DisplayName("should start a new run after a terminal one")
        void shouldStartNewRunAfterTerminal() {
            // Given
            createCase(false);
            CaseFlowWorkflowEngine engine = engine(ScriptedDecisionOracle.sequence("complete", "complete"));
            CaseFlowRunResult first = engine.run(CASE_ID, null).block();

            // When
            CaseFlowRunResult second = engine.run(CASE_ID, "[USER] Run again").block();

            // Then
            assertNotEquals(first.getRunId(), second.getRunId());
            assertEquals(2, checkpointStore.findByCaseId(CASE_ID).block().getRunNumber());
            assertEquals("[USER] Run again", second.getMessages().get(0));
            assertEquals(3, second.getMessages().size());
        }
    }

    // ========================================================================
    // HUMAN INTERVENTION
    // ========================================================================

    @Nested
    @DisplayName("Human Intervention")
    class HumanInterventionTests {

        @Test
        @DisplayName("should suspend and raise an intervention when the input is missing")
        void shouldSuspendWhenInputMissing() {
            // Given
            createCase(false);

            // When
            CaseFlowRunResult result = engine(ScriptedDecisionOracle.following(DocumentReviewTestPlugin::happyPath))
                    .run(CASE_ID, null).block();

            // Then
            assertEquals(CaseFlowExecutionState.AWAITING_INTERVENTION, result.getExecutionState());
            assertEquals(CaseFlowConstants.STATUS_AWAITING_INTERVENTION, result.getCurrentStatus());
            assertTrue(result.isWaitingForInput());
            assertTrue(result.isPollingActive());
            assertEquals(List.of("document"), result.getMissingFields());
            assertEquals("wait", result.getLastAction());
            assertEquals("[WAITING] Waiting for document - polling every 3600s",
                    result.getMessages().get(result.getMessages().size() - 1));

            CaseFlowInterventionRecord pending = caseStore.findPendingIntervention(CASE_ID).block();
            assertNotNull(pending);
            assertEquals("MISSING_DOCUMENT", pending.getKind());
            assertTrue(pending.isPollingActive());
        }

        @Test
        @DisplayName("should resume from the checkpoint when the poller detects the input")
        void shouldResumeFromPoller() {
            // Given
            createCase(false);
            engine(ScriptedDecisionOracle.following(DocumentReviewTestPlugin::happyPath)).run(CASE_ID, null).block();
            caseStore.inTransaction(CASE_ID, tx -> {
                tx.putInput(DocumentReviewTestPlugin.DOCUMENT, DOCUMENT_TEXT);
                return null;
            }).block();

            // When
            CaseFlowPollOutcome outcome = pollingManager.pollNow(CASE_ID).block();

            // Then
            assertEquals(CaseFlowPollOutcome.RESOLVED, outcome);
            CaseFlowWorkflowCheckpoint checkpoint = checkpointStore.findByCaseId(CASE_ID).block();
            assertEquals(CaseFlowExecutionState.COMPLETED, checkpoint.getExecutionState());
            assertEquals(1, checkpoint.getRunNumber());
            assertEquals(List.of("ingest", "approve"), checkpoint.getCompletedActions());
            assertEquals(4, checkpoint.getTotalSteps());
            assertTrue(checkpoint.getMessages().contains(CaseFlowConstants.POLLER_RESUME_MESSAGE));
            assertEquals(1, pluginProvider.ingestRuns.get());
            assertThat(statusLabels()).containsSubsequence(
                    "AWAITING_INTERVENTION", "INTERVENTION_RESOLVED", "WORKFLOW_RESUMED", "INGESTED", "APPROVED", "COMPLETED");

            List<CaseFlowActionLogEntry> resumeEntries = caseStore.findActionLog(CASE_ID)
                    .filter(entry -> entry.getLogType() == CaseFlowLogType.RESUME)
                    .collectList().block();
            assertEquals(1, resumeEntries.size());
            assertFalse(pollingManager.isPolling(CASE_ID));
        }

        @Test
        @DisplayName("should resolve the intervention when the oracle chooses to")
        void shouldResolveInterventionOnDecision() {
            // Given
            createCase(false);
            CaseFlowWorkflowEngine engine = engine(ScriptedDecisionOracle.sequence(
                    "wait", "resolve_intervention", "ingest", "approve", "complete"));
            engine.run(CASE_ID, null).block();
            caseStore.inTransaction(CASE_ID, tx -> {
                tx.putInput(DocumentReviewTestPlugin.DOCUMENT, DOCUMENT_TEXT);
                return null;
            }).block();

            // When
            CaseFlowRunResult result = engine.run(CASE_ID, "[USER] Document uploaded").block();

            // Then
            assertEquals(CaseFlowExecutionState.COMPLETED, result.getExecutionState());
            assertEquals(List.of("resolve_intervention", "ingest", "approve"), result.getCompletedActions());
            assertNull(caseStore.findPendingIntervention(CASE_ID).block());
            assertEquals(CaseFlowInterventionStatus.RESOLVED,
                    caseStore.findInterventions(CASE_ID).blockFirst().getStatus());
            assertTrue(statusLabels().contains(CaseFlowConstants.STATUS_INTERVENTION_RESOLVED));
            assertFalse(pollingManager.isPolling(CASE_ID));
        }

        @Test
        @DisplayName("should route a wait with nothing missing to error handling")
        void shouldRouteSpuriousWaitToError() {
            // Given
            createCase(true);

            // When
            CaseFlowRunResult result = engine(ScriptedDecisionOracle.sequence("wait", "complete")).run(CASE_ID, null).block();

            // Then
            assertEquals(CaseFlowExecutionState.COMPLETED, result.getExecutionState());
            assertTrue(result.getMessages().contains("[ERROR] Wait requested but no required input is missing"));
            assertTrue(statusLabels().contains(CaseFlowConstants.STATUS_ERROR));
            assertTrue(caseStore.findInterventions(CASE_ID).collectList().block().isEmpty());
        }
    }

    // ========================================================================
    // ERROR ROUTING
    // ========================================================================

    @Nested
    @DisplayName("Error Routing")
    class ErrorRoutingTests {

        @Test
        @DisplayName("should route an unknown action to the error handler")
        void shouldRouteUnknownActionToError() {
            // Given
            createCase(false);

            // When
            CaseFlowRunResult result = engine(ScriptedDecisionOracle.sequence("teleport", "complete")).run(CASE_ID, null).block();

            // Then
            assertEquals(CaseFlowExecutionState.COMPLETED, result.getExecutionState());
            assertThat(result.getMessages()).anyMatch(m -> m.startsWith("[ORCHESTRATOR] Next: error | [CASEFLOW_ERR_0003]"));
            assertTrue(result.getMessages().contains("[ERROR HANDLER] Error recorded, returning to decision"));
            assertEquals(List.of("CREATED", "WORKFLOW_STARTED", "ERROR", "COMPLETED"), statusLabels());
        }

        @Test
        @DisplayName("should route a failing executor to the error handler and keep deciding")
        void shouldHandleExecutorFailure() {
            // Given
            createCase(false);

            // When
            CaseFlowRunResult result = engine(ScriptedDecisionOracle.sequence("explode", "complete")).run(CASE_ID, null).block();

            // Then
            assertEquals(CaseFlowExecutionState.COMPLETED, result.getExecutionState());
            assertThat(result.getMessages()).anyMatch(m -> m.startsWith("[ERROR] Action 'explode' failed") && m.contains("boom"));
            assertFalse(result.getCompletedActions().contains("explode"));
            assertTrue(statusLabels().contains(CaseFlowConstants.STATUS_ERROR));
        }

        @Test
        @DisplayName("should report a precondition failure with its error code")
        void shouldReportPreconditionFailure() {
            // Given
            createCase(false);

            // When
            CaseFlowRunResult result = engine(ScriptedDecisionOracle.sequence("ingest", "complete")).run(CASE_ID, null).block();

            // Then
            assertThat(result.getMessages()).anyMatch(m -> m.contains("[CASEFLOW_ERR_0010] Action 'ingest' requires missing fields: document"));
            assertEquals(0, pluginProvider.ingestRuns.get());
        }

        @Test
        @DisplayName("should fail the run at the step ceiling")
        void shouldFailAtStepCeiling() {
            // Given
            createCase(false);
            ScriptedDecisionOracle oracle = ScriptedDecisionOracle.always("error");
            CaseFlowEngineConfig config = CaseFlowEngineConfig.builder().maxSteps(3).build();

            // When
            CaseFlowRunResult result = engine(oracle, config).run(CASE_ID, null).block();

            // Then
            assertEquals(CaseFlowExecutionState.FAILED, result.getExecutionState());
            assertEquals(CaseFlowConstants.STATUS_FAILED, result.getCurrentStatus());
            assertEquals("[CASEFLOW_ERR_0030] Step ceiling of 3 reached for case 'case-1'", result.getDiagnostic());
            assertEquals(3, oracle.getDecisionCount());
            assertEquals(3, result.getStepCount());
            assertEquals("[LOOP GUARD] " + result.getDiagnostic(), result.getMessages().get(result.getMessages().size() - 1));
        }

        @Test
        @DisplayName("should propagate persistence failures unchanged")
        void shouldPropagatePersistenceFailure() {
            // Given
            createCase(false);
            checkpointStore = new InMemoryCheckpointStore() {
                @Override
                protected void persist(CaseFlowWorkflowCheckpoint checkpoint) {
                    throw new CaseFlowPersistenceException(checkpoint.getCaseId(), "saveCheckpoint", new IOException("disk full"));
                }
            };

            // When / Then
            StepVerifier.create(engine(ScriptedDecisionOracle.sequence("complete")).run(CASE_ID, null))
                    .expectError(CaseFlowPersistenceException.class)
                    .verify();
            assertFalse(lockService.isLocked(CASE_ID).block());
        }
    }

    // ========================================================================
    // REPEAT GUARD
    // ========================================================================

    @Nested
    @DisplayName("Repeat Guard")
    class RepeatGuardTests {

        @Test
        @DisplayName("should force completion when a done step is chosen again")
        void shouldForceComplete() {
            // Given
            createCase(true);

            // When
            CaseFlowRunResult result = engine(ScriptedDecisionOracle.sequence("ingest", "ingest")).run(CASE_ID, null).block();

            // Then
            assertEquals(CaseFlowExecutionState.COMPLETED, result.getExecutionState());
            assertEquals("complete", result.getLastAction());
            assertEquals("Action 'ingest' was already done", result.getReasoning());
            assertEquals(1, pluginProvider.ingestRuns.get());
            CaseFlowWorkflowCheckpoint checkpoint = checkpointStore.findByCaseId(CASE_ID).block();
            assertTrue(checkpoint.getLastDecision().isForced());
            assertEquals("ingest", checkpoint.getLastDecision().getOriginalAction());
        }

        @Test
        @DisplayName("should route a repeated step to error under ROUTE_TO_ERROR")
        void shouldRouteRepeatToError() {
            // Given
            createCase(true);
            CaseFlowEngineConfig config = CaseFlowEngineConfig.builder()
                    .repeatActionPolicy(CaseFlowRepeatActionPolicy.ROUTE_TO_ERROR).build();

            // When
            CaseFlowRunResult result = engine(ScriptedDecisionOracle.sequence("ingest", "ingest", "complete"), config)
                    .run(CASE_ID, null).block();

            // Then
            assertEquals(CaseFlowExecutionState.COMPLETED, result.getExecutionState());
            assertEquals(List.of("CREATED", "WORKFLOW_STARTED", "INGESTED", "ERROR", "COMPLETED"), statusLabels());
            assertEquals(1, pluginProvider.ingestRuns.get());
        }

        @Test
        @DisplayName("should fail the run under FAIL")
        void shouldFailOnRepeat() {
            // Given
            createCase(true);
            CaseFlowEngineConfig config = CaseFlowEngineConfig.builder()
                    .repeatActionPolicy(CaseFlowRepeatActionPolicy.FAIL).build();

            // When
            CaseFlowRunResult result = engine(ScriptedDecisionOracle.sequence("ingest", "ingest"), config)
                    .run(CASE_ID, null).block();

            // Then
            assertEquals(CaseFlowExecutionState.FAILED, result.getExecutionState());
            assertTrue(result.getDiagnostic().startsWith("[CASEFLOW_ERR_0031]"));
        }

        @Test
        @DisplayName("should allow error and wait to repeat")
        void shouldAllowReservedRepeats() {
            // Given
            createCase(true);

            // When
            CaseFlowRunResult result = engine(ScriptedDecisionOracle.sequence("error", "error", "complete")).run(CASE_ID, null).block();

            // Then
            assertEquals(CaseFlowExecutionState.COMPLETED, result.getExecutionState());
            assertEquals(3, result.getStepCount());
            assertEquals(2, statusLabels().stream().filter(CaseFlowConstants.STATUS_ERROR::equals).count());
        }
    }

    // ========================================================================
    // RESUME HANDOFF
    // ========================================================================

    @Nested
    @DisplayName("Resume Handoff")
    class ResumeHandoffTests {

        @Test
        @DisplayName("should resolve the intervention and stop polling when a manual run finds the input")
        void shouldResolveOnManualResume() {
            // Given
            createCase(false);
            CaseFlowWorkflowEngine engine = engine(ScriptedDecisionOracle.following(DocumentReviewTestPlugin::happyPath));
            engine.run(CASE_ID, null).block();
            provideDocument();

            // When
            CaseFlowRunResult manual = engine.run(CASE_ID, "[USER] Document uploaded").block();
            CaseFlowPollOutcome laterTick = pollingManager.pollNow(CASE_ID).block();

            // Then
            assertEquals(CaseFlowExecutionState.COMPLETED, manual.getExecutionState());
            assertFalse(manual.isPollingActive());
            assertEquals(CaseFlowPollOutcome.NOT_ACTIVE, laterTick);
            assertNull(caseStore.findPendingIntervention(CASE_ID).block());
            CaseFlowInterventionRecord record = caseStore.findInterventions(CASE_ID).blockFirst();
            assertEquals(CaseFlowInterventionStatus.RESOLVED, record.getStatus());
            assertEquals("Required input present on resume", record.getResolution());
            assertEquals(1, checkpointStore.findByCaseId(CASE_ID).block().getRunNumber());
            assertEquals(1, pluginProvider.ingestRuns.get());
            assertEquals(1, pluginProvider.approveRuns.get());
            assertThat(statusLabels()).containsSubsequence(
                    "AWAITING_INTERVENTION", "INTERVENTION_RESOLVED", "WORKFLOW_RESUMED", "INGESTED", "COMPLETED");
        }

        @Test
        @DisplayName("should not start the workflow again when the poller resumes a finished case")
        void shouldNotRerunFinishedWorkflow() {
            // Given
            createCase(true);
            engine(ScriptedDecisionOracle.following(DocumentReviewTestPlugin::happyPath)).run(CASE_ID, null).block();
            pollingManager.raiseIntervention(CASE_ID, "MISSING_DOCUMENT", "stale request", List.of("document")).block();

            // When
            CaseFlowPollOutcome outcome = pollingManager.pollNow(CASE_ID).block();

            // Then
            assertEquals(CaseFlowPollOutcome.RESOLVED, outcome);
            CaseFlowWorkflowCheckpoint checkpoint = checkpointStore.findByCaseId(CASE_ID).block();
            assertEquals(1, checkpoint.getRunNumber());
            assertEquals(CaseFlowExecutionState.COMPLETED, checkpoint.getExecutionState());
            assertEquals(1, pluginProvider.ingestRuns.get());
            assertEquals(1, pluginProvider.approveRuns.get());
            assertEquals("Workflow already COMPLETED", caseStore.findInterventions(CASE_ID).blockFirst().getResolution());
            assertFalse(pollingManager.isPolling(CASE_ID));
        }

        @Test
        @DisplayName("should keep the intervention pending and retry when the resume finds the case locked")
        void shouldRetryResumeAfterLockRace() {
            // Given
            AtomicInteger refusals = new AtomicInteger(1);
            useLockService(new InMemoryCaseLockService() {
                @Override
                public Mono<Boolean> tryAcquire(String caseId, String ownerId, Duration duration, String operation) {
                    if ("resume".equals(operation) && refusals.getAndDecrement() > 0) {
                        return Mono.just(false);
                    }
                    return super.tryAcquire(caseId, ownerId, duration, operation);
                }
            });
            createCase(false);
            CaseFlowWorkflowEngine engine = engine(ScriptedDecisionOracle.following(DocumentReviewTestPlugin::happyPath));
            engine.run(CASE_ID, null).block();
            provideDocument();

            // When
            CaseFlowPollOutcome lostRace = pollingManager.pollNow(CASE_ID).block();

            // Then
            assertEquals(CaseFlowPollOutcome.SKIPPED_LOCKED, lostRace);
            assertEquals(CaseFlowExecutionState.AWAITING_INTERVENTION,
                    checkpointStore.findByCaseId(CASE_ID).block().getExecutionState());
            assertNotNull(caseStore.findPendingIntervention(CASE_ID).block());
            assertTrue(pollingManager.isPolling(CASE_ID));

            // When
            CaseFlowPollOutcome retried = pollingManager.pollNow(CASE_ID).block();

            // Then
            assertEquals(CaseFlowPollOutcome.RESOLVED, retried);
            assertEquals(CaseFlowExecutionState.COMPLETED,
                    checkpointStore.findByCaseId(CASE_ID).block().getExecutionState());
            assertNull(caseStore.findPendingIntervention(CASE_ID).block());
            assertFalse(pollingManager.isPolling(CASE_ID));
        }

        @Test
        @DisplayName("should close a pending intervention when the run completes without the input")
        void shouldCloseInterventionOnCompletion() {
            // Given
            createCase(false);
            CaseFlowWorkflowEngine engine = engine(ScriptedDecisionOracle.sequence("wait", "complete"));
            engine.run(CASE_ID, null).block();

            // When
            CaseFlowRunResult result = engine.run(CASE_ID, "[USER] Close the case").block();

            // Then
            assertEquals(CaseFlowExecutionState.COMPLETED, result.getExecutionState());
            assertEquals(CaseFlowConstants.STATUS_COMPLETED, result.getCurrentStatus());
            CaseFlowInterventionRecord record = caseStore.findInterventions(CASE_ID).blockFirst();
            assertEquals(CaseFlowInterventionStatus.RESOLVED, record.getStatus());
            assertEquals("Workflow COMPLETED", record.getResolution());
            assertFalse(pollingManager.isPolling(CASE_ID));
        }
    }

    // ========================================================================
    // LOCK HEARTBEAT
    // ========================================================================

    @Nested
    @DisplayName("Lock Heartbeat")
    class LockHeartbeatTests {

        @Test
        @DisplayName("should extend the lock before every decision and every routed action")
        void shouldExtendLockPerIteration() {
            // Given
            AtomicInteger extensions = new AtomicInteger();
            useLockService(new InMemoryCaseLockService() {
                @Override
                public Mono<Boolean> extend(String caseId, String ownerId, Duration extensionDuration) {
                    extensions.incrementAndGet();
                    return super.extend(caseId, ownerId, extensionDuration);
                }
            });
            createCase(true);
            ScriptedDecisionOracle oracle = ScriptedDecisionOracle.following(DocumentReviewTestPlugin::happyPath);

            // When
            CaseFlowRunResult result = engine(oracle).run(CASE_ID, null).block();

            // Then
            assertEquals(CaseFlowExecutionState.COMPLETED, result.getExecutionState());
            assertEquals(2 * oracle.getDecisionCount(), extensions.get());
        }

        @Test
        @DisplayName("should keep a second run out while a slow run outlives the lock duration")
        void shouldHoldLockForSlowRun() throws Exception {
            // Given
            createCase(false);
            ScriptedDecisionOracle scripted = ScriptedDecisionOracle.always("error");
            ICaseFlowDecisionOracle slowOracle = context -> Mono.delay(Duration.ofMillis(150)).then(scripted.decide(context));
            CaseFlowEngineConfig config = CaseFlowEngineConfig.builder()
                    .pollingInterval(Duration.ofHours(1))
                    .lockDuration(Duration.ofMillis(400))
                    .maxSteps(8)
                    .build();
            CaseFlowWorkflowEngine engine = engine(slowOracle, config);

            // When
            CompletableFuture<CaseFlowRunResult> first = engine.run(CASE_ID, null).toFuture();
            Thread.sleep(700);

            // Then
            StepVerifier.create(engine.run(CASE_ID, "[USER] Second trigger"))
                    .expectError(CaseLockedException.class)
                    .verify();
            CaseFlowRunResult firstResult = first.get(10, TimeUnit.SECONDS);
            assertEquals(CaseFlowExecutionState.FAILED, firstResult.getExecutionState());
            assertEquals(8, scripted.getDecisionCount());
        }

        @Test
        @DisplayName("should abandon the run once another writer took the expired lock over")
        void shouldAbandonRunAfterTakeover() {
            // Given
            createCase(true);
            ICaseFlowDecisionOracle stallingOracle = context -> Mono.fromCallable(() -> {
                Thread.sleep(150);
                lockService.tryAcquireSync(CASE_ID, "intruder", Duration.ofMinutes(1), "run");
                return CaseFlowDecision.builder().action("ingest").reasoning("ingest the document").build();
            });
            CaseFlowEngineConfig config = CaseFlowEngineConfig.builder()
                    .pollingInterval(Duration.ofHours(1))
                    .lockDuration(Duration.ofMillis(50))
                    .build();

            // When / Then
            StepVerifier.create(engine(stallingOracle, config).run(CASE_ID, null))
                    .expectError(CaseLockedException.class)
                    .verify();
            assertEquals(0, pluginProvider.ingestRuns.get());
            assertEquals("intruder", lockService.getLockInfo(CASE_ID).block().get().getOwnerId());
            assertTrue(checkpointStore.findByCaseId(CASE_ID).block().getCompletedActions().isEmpty());
        }
    }

    // ========================================================================
    // EXCLUSION
    // ========================================================================

    @Nested
    @DisplayName("Exclusion")
    class ExclusionTests {

        @Test
        @DisplayName("should refuse to run a case locked by another writer")
        void shouldRefuseLockedCase() {
            // Given
            createCase(false);
            lockService.tryAcquire(CASE_ID, "another-writer", Duration.ofMinutes(1), "provide-input").block();

            // When / Then
            StepVerifier.create(engine(ScriptedDecisionOracle.sequence("complete")).run(CASE_ID, null))
                    .expectError(CaseLockedException.class)
                    .verify();
        }

        @Test
        @DisplayName("should fail for an unknown case")
        void shouldFailForUnknownCase() {
            StepVerifier.create(engine(ScriptedDecisionOracle.sequence("complete")).run("missing", null))
                    .expectError(CaseFlowCaseNotFound.class)
                    .verify();
        }
    }
}
