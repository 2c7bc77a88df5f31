package com.caseflow.orchestrator.core.engine.misc;

import com.caseflow.orchestrator.core.engine.config.CaseFlowEngineConfig;
import com.caseflow.orchestrator.core.exception.misc.CaseFlowValidationException;
import com.caseflow.orchestrator.integration.models.cases.CaseFlowCaseCreateRequest;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class CaseFlowBeanValidatorTest {

    private final CaseFlowBeanValidator validator = CaseFlowBeanValidator.getInstance();

    @Test
    @DisplayName("should accept a valid create request")
    void shouldAcceptValidRequest() {
        CaseFlowCaseCreateRequest request = CaseFlowCaseCreateRequest.builder()
                .caseId("case-2026.03_A")
                .inputs(Map.of("document", "text"))
                .build();

        assertSame(request, validator.validate(request));
    }

    @Test
    @DisplayName("should list every violation sorted by property path")
    void shouldListViolations() {
        // Given
        CaseFlowEngineConfig config = CaseFlowEngineConfig.builder()
                .maxSteps(0)
                .pollingInterval(null)
                .build();

        // When
        CaseFlowValidationException error = assertThrows(CaseFlowValidationException.class,
                () -> validator.validate(config));

        // Then
        assertEquals(List.of("maxSteps: maxSteps must be at least 1", "pollingInterval: pollingInterval must not be null"),
                error.getViolations());
        assertTrue(error.getMessage().startsWith("[CASEFLOW_ERR_0050]"));
    }

    @Test
    @DisplayName("should reject case ids with path characters")
    void shouldRejectUnsafeCaseId() {
        CaseFlowCaseCreateRequest request = CaseFlowCaseCreateRequest.builder()
                .caseId("../etc/passwd")
                .build();

        CaseFlowValidationException error = assertThrows(CaseFlowValidationException.class,
                () -> validator.validate(request));
        assertEquals(1, error.getViolations().size());
        assertTrue(error.getViolations().get(0).startsWith("caseId:"));
    }

    @Test
    @DisplayName("should reject null")
    void shouldRejectNull() {
        assertThrows(CaseFlowValidationException.class, () -> validator.validate(null));
    }

    @Test
    @DisplayName("should accept the default configuration")
    void shouldAcceptDefaults() {
        assertDoesNotThrow(() -> validator.validate(CaseFlowEngineConfig.defaults().withLockWaitTimeout(Duration.ZERO)));
    }
}
