package com.caseflow.orchestrator.core.engine.lock;

import lombok.Builder;
import lombok.Data;

import java.time.Duration;
import java.time.Instant;

/**
 * Exclusive write access to one case, held by the engine run, the poller tick or an input write.
 */
@Data
@Builder(toBuilder = true)
public class CaseLock {

    private final String caseId;

    private final String ownerId;

    /**
     * The operation that acquired the lock (for debugging).
     */
    private final String operation;

    private final Instant acquiredAt;

    private final Instant expiresAt;

    private final int extensionCount;

    private final String holderThread;

    public boolean isExpired() {
        return expiresAt != null && Instant.now().isAfter(expiresAt);
    }

    public Duration getRemainingTime() {
        if (expiresAt == null) {
            return Duration.ZERO;
        }
        Duration remaining = Duration.between(Instant.now(), expiresAt);
        return remaining.isNegative() ? Duration.ZERO : remaining;
    }

    public CaseLock extend(Duration extensionDuration) {
        return toBuilder()
                .expiresAt(Instant.now().plus(extensionDuration))
                .extensionCount(extensionCount + 1)
                .build();
    }

    public static CaseLock create(String caseId, String ownerId, Duration duration, String operation) {
        Instant now = Instant.now();
        return CaseLock.builder()
                .caseId(caseId)
                .ownerId(ownerId)
                .operation(operation)
                .acquiredAt(now)
                .expiresAt(now.plus(duration))
                .holderThread(Thread.currentThread().getName())
                .build();
    }
}
