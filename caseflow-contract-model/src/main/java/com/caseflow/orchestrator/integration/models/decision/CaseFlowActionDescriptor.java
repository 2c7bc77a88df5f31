package com.caseflow.orchestrator.integration.models.decision;

import lombok.AllArgsConstructor;
import lombok.Data;

import java.io.Serializable;

@Data
@AllArgsConstructor
public class CaseFlowActionDescriptor implements Serializable {

    private static final long serialVersionUID = 1L;

    private final String label;
    private final String description;
}
