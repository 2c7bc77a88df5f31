package com.caseflow.orchestrator.core.engine.lock.impl;

import com.caseflow.orchestrator.core.engine.lock.CaseLock;
import com.caseflow.orchestrator.core.engine.lock.ICaseFlowCaseLockService;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * In-memory case lock service for a single-process deployment.
 *
 * <h2>Features</h2>
 * <ul>
 *   <li>Atomic acquisition through {@link ConcurrentHashMap#compute}</li>
 *   <li>Re-entrant refresh for the same owner</li>
 *   <li>Takeover of expired locks</li>
 * </ul>
 */
@Slf4j
public class InMemoryCaseLockService implements ICaseFlowCaseLockService {

    private final Map<String, CaseLock> locks = new ConcurrentHashMap<>();
    private final AtomicLong acquiredCount = new AtomicLong(0);
    private final AtomicLong releasedCount = new AtomicLong(0);
    private final AtomicLong expiredCount = new AtomicLong(0);
    private final AtomicLong contendedCount = new AtomicLong(0);

    private final Duration defaultLockDuration;
    private final Duration retryInterval;

    public InMemoryCaseLockService() {
        this(Duration.ofMinutes(10), Duration.ofMillis(50));
    }

    public InMemoryCaseLockService(Duration defaultLockDuration, Duration retryInterval) {
        this.defaultLockDuration = defaultLockDuration;
        this.retryInterval = retryInterval;
    }

    @Override
    public Mono<Boolean> tryAcquire(String caseId, String ownerId, Duration duration, String operation) {
        return Mono.fromCallable(() -> tryAcquireSync(caseId, ownerId, duration, operation));
    }

    public boolean tryAcquireSync(String caseId, String ownerId, Duration duration, String operation) {
        if (caseId == null || ownerId == null) {
            throw new IllegalArgumentException("caseId and ownerId cannot be null");
        }
        Duration lockDuration = duration != null ? duration : defaultLockDuration;

        return locks.compute(caseId, (key, existingLock) -> {
            if (existingLock == null) {
                log.debug("Acquiring lock: caseId={}, owner={}, operation={}", caseId, ownerId, operation);
                acquiredCount.incrementAndGet();
                return CaseLock.create(caseId, ownerId, lockDuration, operation);
            }
            if (existingLock.getOwnerId().equals(ownerId)) {
                return existingLock.extend(lockDuration);
            }
            if (existingLock.isExpired()) {
                log.warn("Taking over expired lock: caseId={}, previousOwner={}, newOwner={}",
                        caseId, existingLock.getOwnerId(), ownerId);
                expiredCount.incrementAndGet();
                acquiredCount.incrementAndGet();
                return CaseLock.create(caseId, ownerId, lockDuration, operation);
            }
            log.debug("Lock busy: caseId={}, holder={}, requestedBy={}", caseId, existingLock.getOwnerId(), operation);
            contendedCount.incrementAndGet();
            return existingLock;
        }).getOwnerId().equals(ownerId);
    }

    @Override
    public Mono<Boolean> acquireWithWait(String caseId, String ownerId, Duration duration,
                                         Duration waitTimeout, String operation) {
        long attempts = Math.max(1, waitTimeout.toMillis() / Math.max(1, retryInterval.toMillis()));
        return Flux.range(0, (int) Math.min(attempts, Integer.MAX_VALUE))
                .concatMap(attempt -> attempt == 0
                        ? Mono.just(attempt)
                        : Mono.delay(retryInterval).thenReturn(attempt))
                .map(attempt -> tryAcquireSync(caseId, ownerId, duration, operation))
                .takeUntil(Boolean::booleanValue)
                .last(false);
    }

    @Override
    public Mono<Boolean> release(String caseId, String ownerId) {
        return Mono.fromCallable(() -> releaseSync(caseId, ownerId));
    }

    public boolean releaseSync(String caseId, String ownerId) {
        if (caseId == null || ownerId == null) {
            return false;
        }
        boolean[] released = {false};
        locks.computeIfPresent(caseId, (key, existingLock) -> {
            if (existingLock.getOwnerId().equals(ownerId)) {
                log.debug("Releasing lock: caseId={}, owner={}", caseId, ownerId);
                released[0] = true;
                releasedCount.incrementAndGet();
                return null;
            }
            log.warn("Cannot release lock - not owner: caseId={}, holder={}, requester={}",
                    caseId, existingLock.getOwnerId(), ownerId);
            return existingLock;
        });
        return released[0];
    }

    @Override
    public Mono<Boolean> extend(String caseId, String ownerId, Duration extensionDuration) {
        return Mono.fromCallable(() -> {
            boolean[] extended = {false};
            locks.computeIfPresent(caseId, (key, existingLock) -> {
                if (existingLock.getOwnerId().equals(ownerId)) {
                    extended[0] = true;
                    return existingLock.extend(extensionDuration);
                }
                return existingLock;
            });
            return extended[0];
        });
    }

    @Override
    public Mono<Boolean> isLocked(String caseId) {
        return Mono.fromCallable(() -> {
            CaseLock lock = locks.get(caseId);
            return lock != null && !lock.isExpired();
        });
    }

    @Override
    public Mono<Optional<CaseLock>> getLockInfo(String caseId) {
        return Mono.fromCallable(() -> Optional.ofNullable(locks.get(caseId)).filter(lock -> !lock.isExpired()));
    }

    @Override
    public Mono<Long> cleanupExpiredLocks() {
        return Mono.fromCallable(() -> {
            long count = 0;
            for (Map.Entry<String, CaseLock> entry : locks.entrySet()) {
                if (entry.getValue().isExpired() && locks.remove(entry.getKey(), entry.getValue())) {
                    count++;
                    expiredCount.incrementAndGet();
                }
            }
            if (count > 0) {
                log.info("Cleaned up {} expired case locks", count);
            }
            return count;
        });
    }

    public LockStatistics getStatistics() {
        return new LockStatistics(
                locks.values().stream().filter(lock -> !lock.isExpired()).count(),
                acquiredCount.get(),
                releasedCount.get(),
                expiredCount.get(),
                contendedCount.get()
        );
    }

    public record LockStatistics(
            long activeLocks,
            long acquiredCount,
            long releasedCount,
            long expiredCount,
            long contendedCount
    ) {}
}
