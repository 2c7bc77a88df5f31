package com.caseflow.orchestrator.core.engine.oracle.impl;

import com.caseflow.orchestrator.integration.models.decision.CaseFlowActionDescriptor;
import com.caseflow.orchestrator.integration.models.decision.CaseFlowDecision;
import com.caseflow.orchestrator.integration.models.decision.CaseFlowDecisionContext;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for {@link CaseFlowDecisionOracleAdapter}.
 * Every failure of the oracle path must come back as an error decision, never as an exception.
 */
class CaseFlowDecisionOracleAdapterTest {

    private static CaseFlowDecisionContext context() {
        return CaseFlowDecisionContext.builder()
                .caseId("case-1")
                .currentStatus("CREATED")
                .facts(Map.of("Input document", "missing"))
                .completedActions(List.of("ingest"))
                .recentMessages(List.of("[SYSTEM] Workflow started"))
                .availableActions(List.of(
                        new CaseFlowActionDescriptor("ingest", "Ingest the document"),
                        new CaseFlowActionDescriptor("wait", "Wait for input"),
                        new CaseFlowActionDescriptor("error", "Record an error"),
                        new CaseFlowActionDescriptor("complete", "Finish")))
                .decisionRules(List.of("If the document is missing -> \"wait\""))
                .build();
    }

    // ========================================================================
    // REPLY PARSING TESTS
    // ========================================================================

    @Nested
    @DisplayName("Reply Parsing")
    class ReplyParsingTests {

        private final CaseFlowDecisionOracleAdapter adapter = new CaseFlowDecisionOracleAdapter(prompt -> Mono.empty());

        @Test
        @DisplayName("should accept a known action with reasoning")
        void shouldAcceptKnownAction() {
            // When
            CaseFlowDecision decision = adapter.parse("{\"action\": \"wait\", \"reasoning\": \"document missing\"}", context());

            // Then
            assertEquals("wait", decision.getAction());
            assertEquals("document missing", decision.getReasoning());
            assertFalse(decision.isForced());
        }

        @Test
        @DisplayName("should normalize case and surrounding whitespace of the action")
        void shouldNormalizeAction() {
            CaseFlowDecision decision = adapter.parse("{\"action\": \"  Ingest \"}", context());

            assertEquals("ingest", decision.getAction());
            assertEquals("  Ingest ", decision.getOriginalAction());
        }

        @Test
        @DisplayName("should use default reasoning when none is given")
        void shouldUseDefaultReasoning() {
            CaseFlowDecision decision = adapter.parse("{\"action\": \"complete\", \"reasoning\": \"\"}", context());

            assertEquals("No reasoning provided", decision.getReasoning());
        }

        @Test
        @DisplayName("should map an unknown action to error")
        void shouldMapUnknownActionToError() {
            // When
            CaseFlowDecision decision = adapter.parse("{\"action\": \"teleport\"}", context());

            // Then
            assertEquals("error", decision.getAction());
            assertTrue(decision.isForced());
            assertEquals("teleport", decision.getOriginalAction());
            assertTrue(decision.getReasoning().contains("CASEFLOW_ERR_0003"));
        }

        @Test
        @DisplayName("should map a reply without JSON to error")
        void shouldMapNonJsonToError() {
            CaseFlowDecision decision = adapter.parse("I think we should wait.", context());

            assertEquals("error", decision.getAction());
            assertTrue(decision.getReasoning().contains("CASEFLOW_ERR_0002"));
        }

        @Test
        @DisplayName("should map a missing or non-text action to error")
        void shouldMapMissingActionToError() {
            assertEquals("error", adapter.parse("{\"reasoning\": \"no action\"}", context()).getAction());
            assertEquals("error", adapter.parse("{\"action\": 42}", context()).getAction());
            assertEquals("error", adapter.parse("{\"action\": \"   \"}", context()).getAction());
        }
    }

    // ========================================================================
    // TRANSPORT TESTS
    // ========================================================================

    @Nested
    @DisplayName("Transport")
    class TransportTests {

        @Test
        @DisplayName("should call the transport exactly once with the rendered prompt")
        void shouldCallTransportOnce() {
            // Given
            AtomicInteger calls = new AtomicInteger();
            AtomicReference<String> seenPrompt = new AtomicReference<>();
            CaseFlowDecisionOracleAdapter adapter = new CaseFlowDecisionOracleAdapter(prompt -> {
                calls.incrementAndGet();
                seenPrompt.set(prompt);
                return Mono.just("{\"action\": \"wait\", \"reasoning\": \"missing\"}");
            });

            // When
            CaseFlowDecision decision = adapter.decide(context()).block();

            // Then
            assertEquals("wait", decision.getAction());
            assertEquals(1, calls.get());
            assertTrue(seenPrompt.get().contains("- Case ID: case-1"));
            assertTrue(seenPrompt.get().contains("- Input document: missing"));
            assertTrue(seenPrompt.get().contains("- Completed Actions: ingest"));
            assertTrue(seenPrompt.get().contains("\"ingest\" - Ingest the document"));
            assertTrue(seenPrompt.get().contains("If the document is missing"));
        }

        @Test
        @DisplayName("should map a transport failure to error")
        void shouldMapTransportFailure() {
            CaseFlowDecisionOracleAdapter adapter = new CaseFlowDecisionOracleAdapter(
                    prompt -> Mono.error(new IllegalStateException("connection refused")));

            CaseFlowDecision decision = adapter.decide(context()).block();

            assertEquals("error", decision.getAction());
            assertTrue(decision.getReasoning().contains("connection refused"));
        }

        @Test
        @DisplayName("should map a transport that throws synchronously to error")
        void shouldMapSynchronousThrow() {
            CaseFlowDecisionOracleAdapter adapter = new CaseFlowDecisionOracleAdapter(prompt -> {
                throw new IllegalStateException("no credentials");
            });

            CaseFlowDecision decision = adapter.decide(context()).block();

            assertEquals("error", decision.getAction());
            assertTrue(decision.getReasoning().contains("CASEFLOW_ERR_0001"));
        }

        @Test
        @DisplayName("should map an empty reply to error")
        void shouldMapEmptyReply() {
            CaseFlowDecisionOracleAdapter adapter = new CaseFlowDecisionOracleAdapter(prompt -> Mono.empty());

            CaseFlowDecision decision = adapter.decide(context()).block();

            assertEquals("error", decision.getAction());
            assertTrue(decision.getReasoning().contains("empty reply"));
        }
    }
}
