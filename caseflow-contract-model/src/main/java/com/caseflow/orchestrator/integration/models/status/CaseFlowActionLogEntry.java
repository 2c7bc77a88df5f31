package com.caseflow.orchestrator.integration.models.status;

import com.caseflow.orchestrator.integration.enumerations.CaseFlowLogType;
import lombok.Builder;
import lombok.Data;
import lombok.extern.jackson.Jacksonized;

import java.io.Serializable;
import java.time.Instant;

@Data
@Builder
@Jacksonized
public class CaseFlowActionLogEntry implements Serializable {

    private static final long serialVersionUID = 1L;

    private final String caseId;
    private final String message;
    private final CaseFlowLogType logType;
    private final long sequence;
    private final Instant timestamp;
}
