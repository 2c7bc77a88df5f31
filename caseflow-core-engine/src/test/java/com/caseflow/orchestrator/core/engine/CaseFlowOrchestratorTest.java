package com.caseflow.orchestrator.core.engine;

import com.caseflow.orchestrator.core.engine.config.CaseFlowEngineConfig;
import com.caseflow.orchestrator.core.engine.config.CaseFlowStoreType;
import com.caseflow.orchestrator.core.engine.fixtures.DocumentReviewTestPlugin;
import com.caseflow.orchestrator.core.engine.fixtures.ScriptedDecisionOracle;
import com.caseflow.orchestrator.core.engine.store.CaseFlowStoreManager;
import com.caseflow.orchestrator.core.engine.store.impl.InMemoryCaseStore;
import com.caseflow.orchestrator.core.engine.store.impl.InMemoryCheckpointStore;
import com.caseflow.orchestrator.core.exception.CaseFlowRuntimeException;
import com.caseflow.orchestrator.core.exception.codes.CaseFlowInternalErrorCodes;
import com.caseflow.orchestrator.core.exception.misc.CaseFlowValidationException;
import com.caseflow.orchestrator.core.exception.store.CaseFlowCaseAlreadyExists;
import com.caseflow.orchestrator.core.exception.store.CaseFlowCaseNotFound;
import com.caseflow.orchestrator.integration.constant.CaseFlowConstants;
import com.caseflow.orchestrator.integration.enumerations.CaseFlowExecutionState;
import com.caseflow.orchestrator.integration.enumerations.CaseFlowInterventionStatus;
import com.caseflow.orchestrator.integration.enumerations.CaseFlowLogType;
import com.caseflow.orchestrator.integration.enumerations.CaseFlowPollOutcome;
import com.caseflow.orchestrator.integration.models.cases.CaseFlowCase;
import com.caseflow.orchestrator.integration.models.cases.CaseFlowCaseCreateRequest;
import com.caseflow.orchestrator.integration.models.intervention.CaseFlowInterventionRecord;
import com.caseflow.orchestrator.integration.models.run.CaseFlowCaseState;
import com.caseflow.orchestrator.integration.models.run.CaseFlowRunResult;
import com.caseflow.orchestrator.integration.models.run.CaseFlowStatistics;
import com.caseflow.orchestrator.integration.models.status.CaseFlowActionLogEntry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import reactor.test.StepVerifier;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for {@link CaseFlowOrchestrator}, the facade over case management, the engine and the poller.
 */
class CaseFlowOrchestratorTest {

    private static final String CASE_ID = "case-1";
    private static final String DOCUMENT_TEXT = "signed contract text";

    private static final CaseFlowEngineConfig CONFIG = CaseFlowEngineConfig.builder()
            .pollingInterval(Duration.ofHours(1))
            .lockWaitTimeout(Duration.ofMillis(200))
            .build();

    private CaseFlowOrchestrator orchestrator;
    private InMemoryCaseStore caseStore;

    @BeforeEach
    void setUp() {
        caseStore = new InMemoryCaseStore();
        orchestrator = CaseFlowOrchestrator.builder()
                .config(CONFIG)
                .storeManager(new CaseFlowStoreManager(caseStore, new InMemoryCheckpointStore()))
                .plugin(new DocumentReviewTestPlugin().create())
                .decisionOracle(ScriptedDecisionOracle.following(DocumentReviewTestPlugin::happyPath))
                .build();
        orchestrator.start().block();
    }

    @AfterEach
    void tearDown() {
        orchestrator.shutdown().block();
    }

    private CaseFlowCase create(Map<String, String> inputs) {
        return orchestrator.createCase(CaseFlowCaseCreateRequest.builder().caseId(CASE_ID).inputs(inputs).build()).block();
    }

    // ========================================================================
    // ASSEMBLY
    // ========================================================================

    @Nested
    @DisplayName("Assembly")
    class AssemblyTests {

        @Test
        @DisplayName("should require a decision oracle or transport")
        void shouldRequireOracle() {
            CaseFlowRuntimeException error = assertThrows(CaseFlowRuntimeException.class,
                    () -> CaseFlowOrchestrator.builder()
                            .config(CONFIG)
                            .plugin(new DocumentReviewTestPlugin().create())
                            .build());

            assertEquals(CaseFlowInternalErrorCodes.INVALID_CONFIGURATION, error.getErrorInfo());
        }

        @Test
        @DisplayName("should reject an invalid configuration")
        void shouldRejectInvalidConfig() {
            assertThrows(CaseFlowValidationException.class,
                    () -> CaseFlowOrchestrator.builder()
                            .config(CONFIG.withMaxSteps(0))
                            .decisionOracle(ScriptedDecisionOracle.sequence())
                            .build());
        }

        @Test
        @DisplayName("should discover the workflow plugin through ServiceLoader")
        void shouldDiscoverPlugin() {
            // When
            CaseFlowOrchestrator discovered = CaseFlowOrchestrator.builder()
                    .config(CONFIG)
                    .decisionOracle(ScriptedDecisionOracle.sequence())
                    .build();

            // Then
            assertEquals("document-review", discovered.getPlugin().getIdentifier());
            discovered.shutdown().block();
        }
    }

    // ========================================================================
    // CASE MANAGEMENT
    // ========================================================================

    @Nested
    @DisplayName("Case Management")
    class CaseManagementTests {

        @Test
        @DisplayName("should validate the create request")
        void shouldValidateCreateRequest() {
            StepVerifier.create(orchestrator.createCase(CaseFlowCaseCreateRequest.builder().caseId(" ").build()))
                    .expectError(CaseFlowValidationException.class)
                    .verify();
        }

        @Test
        @DisplayName("should reject a duplicate case")
        void shouldRejectDuplicate() {
            // Given
            create(Map.of());

            // When / Then
            StepVerifier.create(orchestrator.createCase(CaseFlowCaseCreateRequest.builder().caseId(CASE_ID).build()))
                    .expectError(CaseFlowCaseAlreadyExists.class)
                    .verify();
        }

        @Test
        @DisplayName("should write the input to the primary field when nothing is pending")
        void shouldProvideInputToPrimaryField() {
            // Given
            create(Map.of());

            // When
            CaseFlowCase updated = orchestrator.provideMissingInput(CASE_ID, DOCUMENT_TEXT).block();

            // Then
            assertEquals(DOCUMENT_TEXT, updated.getInputs().get("document"));
            CaseFlowCaseState state = orchestrator.getCaseState(CASE_ID).block();
            assertEquals(CaseFlowConstants.STATUS_INPUT_PROVIDED, state.getCurrentStatus());
            CaseFlowActionLogEntry last = state.getActionLog().get(state.getActionLog().size() - 1);
            assertEquals(CaseFlowLogType.INPUT, last.getLogType());
            assertEquals("[INPUT] Received document (" + DOCUMENT_TEXT.length() + " chars)", last.getMessage());
        }

        @Test
        @DisplayName("should fail to read the state of an unknown case")
        void shouldFailForUnknownCase() {
            StepVerifier.create(orchestrator.getCaseState("missing"))
                    .expectError(CaseFlowCaseNotFound.class)
                    .verify();
            StepVerifier.create(orchestrator.deleteCase("missing"))
                    .expectError(CaseFlowCaseNotFound.class)
                    .verify();
        }

        @Test
        @DisplayName("should delete a waiting case, stop its poller and keep the intervention record closed")
        void shouldDeleteWaitingCase() {
            // Given
            create(Map.of());
            orchestrator.run(CASE_ID).block();
            assertTrue(orchestrator.getPollingManager().isPolling(CASE_ID));

            // When
            Boolean deleted = orchestrator.deleteCase(CASE_ID).block();

            // Then
            assertTrue(deleted);
            assertFalse(orchestrator.getPollingManager().isPolling(CASE_ID));
            CaseFlowStatistics statistics = orchestrator.getStatistics().block();
            assertEquals(0, statistics.getTotalCases());
            assertEquals(0, statistics.getPendingInterventions());
            assertTrue(statistics.getCheckpointsByState().isEmpty());
            List<CaseFlowInterventionRecord> retained = caseStore.findInterventions(CASE_ID).collectList().block();
            assertEquals(1, retained.size());
            assertEquals(CaseFlowInterventionStatus.RESOLVED, retained.get(0).getStatus());
            assertEquals("Case deleted", retained.get(0).getResolution());
        }
    }

    // ========================================================================
    // END TO END
    // ========================================================================

    @Nested
    @DisplayName("End To End")
    class EndToEndTests {

        @Test
        @DisplayName("should wait for input, accept it and resume to completion")
        void shouldWaitAndResume() {
            // Given
            create(Map.of());
            CaseFlowRunResult first = orchestrator.run(CASE_ID).block();
            assertEquals(CaseFlowExecutionState.AWAITING_INTERVENTION, first.getExecutionState());

            CaseFlowStatistics waiting = orchestrator.getStatistics().block();
            assertEquals(List.of(CASE_ID), waiting.getActivePolls());
            assertEquals(1, waiting.getPendingInterventions());

            // When
            orchestrator.provideMissingInput(CASE_ID, DOCUMENT_TEXT).block();
            CaseFlowPollOutcome outcome = orchestrator.getPollingManager().pollNow(CASE_ID).block();

            // Then
            assertEquals(CaseFlowPollOutcome.RESOLVED, outcome);
            CaseFlowCaseState state = orchestrator.getCaseState(CASE_ID).block();
            assertEquals(CaseFlowConstants.STATUS_COMPLETED, state.getCurrentStatus());
            assertEquals(CaseFlowExecutionState.COMPLETED, state.getCheckpoint().getExecutionState());
            assertEquals(List.of("ingest", "approve"), state.getCheckpoint().getCompletedActions());
            assertEquals(CaseFlowInterventionStatus.RESOLVED, state.getInterventions().get(0).getStatus());
            assertFalse(state.isPollingActive());
            assertEquals(DOCUMENT_TEXT, state.getCaseRecord().getArtifacts().get("ingested"));

            CaseFlowStatistics done = orchestrator.getStatistics().block();
            assertEquals(0, done.getPendingInterventions());
            assertEquals(1L, done.getCheckpointsByState().get(CaseFlowExecutionState.COMPLETED));
            assertEquals(0, done.getActivePollCount());
        }

        @Test
        @DisplayName("should stop polling on request")
        void shouldStopPolling() {
            // Given
            create(Map.of());
            orchestrator.run(CASE_ID).block();

            // When
            Boolean stopped = orchestrator.stopPolling(CASE_ID).block();

            // Then
            assertTrue(stopped);
            CaseFlowCaseState state = orchestrator.getCaseState(CASE_ID).block();
            assertFalse(state.isPollingActive());
            assertEquals(CaseFlowInterventionStatus.PENDING, state.getInterventions().get(0).getStatus());
            assertFalse(state.getInterventions().get(0).isPollingActive());
        }
    }

    // ========================================================================
    // RESTART
    // ========================================================================

    @Nested
    @DisplayName("Restart")
    class RestartTests {

        @TempDir
        Path storeDir;

        private CaseFlowOrchestrator fileOrchestrator() {
            return CaseFlowOrchestrator.builder()
                    .config(CONFIG.toBuilder()
                            .storeType(CaseFlowStoreType.FILE)
                            .storePath(storeDir.toString())
                            .build())
                    .plugin(new DocumentReviewTestPlugin().create())
                    .decisionOracle(ScriptedDecisionOracle.following(DocumentReviewTestPlugin::happyPath))
                    .build();
        }

        @Test
        @DisplayName("should re-arm polling and finish the workflow after a restart")
        void shouldRecoverAfterRestart() {
            // Given
            CaseFlowOrchestrator before = fileOrchestrator();
            before.start().block();
            before.createCase(CaseFlowCaseCreateRequest.builder().caseId(CASE_ID).build()).block();
            before.run(CASE_ID).block();
            before.shutdown().block();

            // When
            CaseFlowOrchestrator after = fileOrchestrator();
            after.start().block();

            // Then
            try {
                assertTrue(after.getPollingManager().isPolling(CASE_ID));
                after.provideMissingInput(CASE_ID, DOCUMENT_TEXT).block();
                assertEquals(CaseFlowPollOutcome.RESOLVED, after.getPollingManager().pollNow(CASE_ID).block());
                CaseFlowCaseState state = after.getCaseState(CASE_ID).block();
                assertEquals(CaseFlowExecutionState.COMPLETED, state.getCheckpoint().getExecutionState());
                assertEquals(1, state.getCheckpoint().getRunNumber());
            } finally {
                after.shutdown().block();
            }
        }
    }
}
