package com.caseflow.orchestrator.core.engine.config;

/**
 * Supported storage backends for cases and checkpoints.
 */
public enum CaseFlowStoreType {
    /** In-memory storage (no persistence) */
    MEMORY,
    /** File-based JSON storage */
    FILE
}
