package com.caseflow.orchestrator.core.engine.lock;

import reactor.core.publisher.Mono;

import java.lang.management.ManagementFactory;
import java.time.Duration;
import java.util.Optional;
import java.util.function.Function;

/**
 * Per-case single-writer guard. Engine runs, poller ticks and input writes for the same case
 * never interleave; locks expire so that a crashed holder cannot block a case forever.
 */
public interface ICaseFlowCaseLockService {

    Mono<Boolean> tryAcquire(String caseId, String ownerId, Duration duration, String operation);

    /**
     * Retries until the lock is free or {@code waitTimeout} has elapsed.
     */
    Mono<Boolean> acquireWithWait(String caseId, String ownerId, Duration duration, Duration waitTimeout, String operation);

    Mono<Boolean> release(String caseId, String ownerId);

    /**
     * Pushes the expiry of a lock still owned by {@code ownerId} to now plus {@code extensionDuration}.
     * Emits false once another owner has taken the lock over.
     */
    Mono<Boolean> extend(String caseId, String ownerId, Duration extensionDuration);

    Mono<Boolean> isLocked(String caseId);

    Mono<Optional<CaseLock>> getLockInfo(String caseId);

    Mono<Long> cleanupExpiredLocks();

    /**
     * Runs {@code action} while holding the case lock, failing with {@link CaseLockedException}
     * when it is held elsewhere. The lock is released on completion, error and cancellation, and
     * before the result reaches the subscriber.
     */
    default <T> Mono<T> executeWithLock(String caseId, Duration duration, String operation, Mono<T> action) {
        return executeWithLock(caseId, duration, operation, ownerId -> action);
    }

    /**
     * Like {@link #executeWithLock(String, Duration, String, Mono)}, handing the owner id to the
     * action so that a long holder can {@link #extend} the lock as it goes.
     */
    default <T> Mono<T> executeWithLock(String caseId, Duration duration, String operation,
                                        Function<String, Mono<T>> action) {
        String ownerId = generateOwnerId(operation);
        return tryAcquire(caseId, ownerId, duration, operation)
                .flatMap(acquired -> {
                    if (!acquired) {
                        return getLockInfo(caseId)
                                .flatMap(info -> Mono.<T>error(CaseLockedException.withLockInfo(caseId, info.orElse(null))));
                    }
                    return runAndRelease(caseId, ownerId, Mono.defer(() -> action.apply(ownerId)));
                });
    }

    /**
     * Like {@link #executeWithLock} but waits up to {@code waitTimeout} for a busy lock.
     */
    default <T> Mono<T> executeWithLockWaiting(String caseId, Duration duration, Duration waitTimeout,
                                               String operation, Mono<T> action) {
        String ownerId = generateOwnerId(operation);
        return acquireWithWait(caseId, ownerId, duration, waitTimeout, operation)
                .flatMap(acquired -> {
                    if (!acquired) {
                        return getLockInfo(caseId)
                                .flatMap(info -> Mono.<T>error(CaseLockedException.withLockInfo(caseId, info.orElse(null))));
                    }
                    return runAndRelease(caseId, ownerId, action);
                });
    }

    private <T> Mono<T> runAndRelease(String caseId, String ownerId, Mono<T> action) {
        return action
                .materialize()
                .flatMap(signal -> release(caseId, ownerId)
                        .onErrorReturn(false)
                        .thenReturn(signal))
                .<T>dematerialize()
                .doOnCancel(() -> release(caseId, ownerId).subscribe());
    }

    static String generateOwnerId(String operation) {
        return operation + "-" + ManagementFactory.getRuntimeMXBean().getName()
                + "-" + Thread.currentThread().getId()
                + "-" + System.nanoTime();
    }
}
