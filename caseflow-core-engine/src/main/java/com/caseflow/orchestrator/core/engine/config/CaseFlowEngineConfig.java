package com.caseflow.orchestrator.core.engine.config;

import com.caseflow.orchestrator.integration.enumerations.CaseFlowRepeatActionPolicy;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.Builder;
import lombok.Data;
import lombok.With;

import java.time.Duration;

/**
 * Tunables of the orchestrator. Defaults match a single-process deployment polling every thirty seconds.
 *
 * @see CaseFlowConfigLoader
 */
@Data
@Builder(toBuilder = true)
@With
public class CaseFlowEngineConfig {

    public static final int DEFAULT_MAX_STEPS = 50;
    public static final int DEFAULT_HISTORY_WINDOW = 10;
    public static final int DEFAULT_MAX_POLL_ATTEMPTS = 120;
    public static final Duration DEFAULT_POLLING_INTERVAL = Duration.ofSeconds(30);
    public static final Duration DEFAULT_LOCK_DURATION = Duration.ofMinutes(10);
    public static final Duration DEFAULT_LOCK_WAIT_TIMEOUT = Duration.ofSeconds(5);

    /**
     * Hard ceiling on engine steps per invocation.
     */
    @Min(value = 1, message = "maxSteps must be at least 1")
    @Builder.Default
    private final int maxSteps = DEFAULT_MAX_STEPS;

    @NotNull(message = "repeatActionPolicy must not be null")
    @Builder.Default
    private final CaseFlowRepeatActionPolicy repeatActionPolicy = CaseFlowRepeatActionPolicy.FORCE_COMPLETE;

    /**
     * Number of most recent trace messages shown to the decision oracle.
     */
    @Min(value = 0, message = "historyWindow must not be negative")
    @Builder.Default
    private final int historyWindow = DEFAULT_HISTORY_WINDOW;

    @NotNull(message = "pollingInterval must not be null")
    @Builder.Default
    private final Duration pollingInterval = DEFAULT_POLLING_INTERVAL;

    /**
     * Ticks after which an unanswered intervention stops being polled. The record stays PENDING.
     */
    @Min(value = 1, message = "maxPollAttempts must be at least 1")
    @Builder.Default
    private final int maxPollAttempts = DEFAULT_MAX_POLL_ATTEMPTS;

    @NotNull(message = "lockDuration must not be null")
    @Builder.Default
    private final Duration lockDuration = DEFAULT_LOCK_DURATION;

    @NotNull(message = "lockWaitTimeout must not be null")
    @Builder.Default
    private final Duration lockWaitTimeout = DEFAULT_LOCK_WAIT_TIMEOUT;

    @NotNull(message = "storeType must not be null")
    @Builder.Default
    private final CaseFlowStoreType storeType = CaseFlowStoreType.MEMORY;

    /**
     * Root directory of the file-based stores.
     */
    @Builder.Default
    private final String storePath = "./caseflow-data";

    public static CaseFlowEngineConfig defaults() {
        return CaseFlowEngineConfig.builder().build();
    }
}
