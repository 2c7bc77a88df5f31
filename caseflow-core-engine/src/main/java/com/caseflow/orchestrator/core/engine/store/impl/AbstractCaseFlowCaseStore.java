package com.caseflow.orchestrator.core.engine.store.impl;

import com.caseflow.orchestrator.core.engine.store.ICaseFlowCaseStore;
import com.caseflow.orchestrator.core.exception.store.CaseFlowCaseAlreadyExists;
import com.caseflow.orchestrator.core.exception.store.CaseFlowCaseNotFound;
import com.caseflow.orchestrator.core.exception.store.CaseFlowPersistenceException;
import com.caseflow.orchestrator.integration.constant.CaseFlowConstants;
import com.caseflow.orchestrator.integration.contract.ICaseFlowCaseTransaction;
import com.caseflow.orchestrator.integration.enumerations.CaseFlowInterventionStatus;
import com.caseflow.orchestrator.integration.enumerations.CaseFlowLogType;
import com.caseflow.orchestrator.integration.models.cases.CaseFlowCase;
import com.caseflow.orchestrator.integration.models.intervention.CaseFlowInterventionRecord;
import com.caseflow.orchestrator.integration.models.status.CaseFlowActionLogEntry;
import com.caseflow.orchestrator.integration.models.status.CaseFlowStatusEntry;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;

/**
 * Shared commit logic of the case stores. Committed records live in a {@link ConcurrentHashMap};
 * each commit happens inside {@code compute} for its case, calling the persistence hook first so a
 * failed write leaves the map untouched.
 */
@Slf4j
public abstract class AbstractCaseFlowCaseStore implements ICaseFlowCaseStore {

    protected final Map<String, CaseFlowCaseRecord> records = new ConcurrentHashMap<>();
    protected final Map<String, List<CaseFlowInterventionRecord>> interventions = new ConcurrentHashMap<>();
    protected final Clock clock;

    protected AbstractCaseFlowCaseStore(Clock clock) {
        this.clock = clock;
    }

    // ========================================================================
    // PERSISTENCE HOOKS
    // ========================================================================

    protected abstract void persistRecord(CaseFlowCaseRecord record) throws Exception;

    protected abstract void removeRecord(String caseId) throws Exception;

    protected abstract void persistInterventions(String caseId, List<CaseFlowInterventionRecord> records) throws Exception;

    // ========================================================================
    // CASES
    // ========================================================================

    @Override
    public Mono<CaseFlowCase> createCase(String caseId, Map<String, String> inputs) {
        return Mono.fromCallable(() -> {
            Instant now = clock.instant();
            CaseFlowCase caseFlowCase = CaseFlowCase.builder()
                    .caseId(caseId)
                    .inputs(new LinkedHashMap<>(inputs == null ? Map.of() : inputs))
                    .artifacts(new LinkedHashMap<>())
                    .version(1)
                    .createdAt(now)
                    .updatedAt(now)
                    .build();

            records.compute(caseId, (key, existing) -> {
                if (existing != null) {
                    throw new CaseFlowCaseAlreadyExists(caseId);
                }
                CaseFlowCaseRecord record = CaseFlowCaseRecord.builder()
                        .caseFlowCase(caseFlowCase)
                        .statusHistory(List.of(statusEntry(caseId, CaseFlowConstants.STATUS_CREATED, 0, now)))
                        .actionLog(List.of())
                        .nextSequence(1)
                        .build();
                persist(caseId, "createCase", record);
                return record;
            });
            log.info("Case created: caseId={}, inputs={}", caseId, caseFlowCase.getInputs().keySet());
            return caseFlowCase;
        });
    }

    @Override
    public Mono<CaseFlowCase> findCase(String caseId) {
        return Mono.fromCallable(() -> {
            CaseFlowCaseRecord record = records.get(caseId);
            return record == null ? null : record.getCaseFlowCase();
        });
    }

    @Override
    public Mono<Boolean> exists(String caseId) {
        return Mono.fromCallable(() -> records.containsKey(caseId));
    }

    @Override
    public Mono<Boolean> deleteCase(String caseId) {
        return Mono.fromCallable(() -> {
            boolean[] deleted = {false};
            records.computeIfPresent(caseId, (key, existing) -> {
                try {
                    removeRecord(caseId);
                } catch (Exception e) {
                    throw new CaseFlowPersistenceException(caseId, "deleteCase", e);
                }
                deleted[0] = true;
                return null;
            });
            if (deleted[0]) {
                log.info("Case deleted: caseId={}", caseId);
            }
            return deleted[0];
        });
    }

    @Override
    public Mono<Long> countCases() {
        return Mono.fromCallable(() -> (long) records.size());
    }

    @Override
    public Flux<String> findAllCaseIds() {
        return Flux.defer(() -> Flux.fromIterable(new ArrayList<>(records.keySet())).sort());
    }

    @Override
    public <T> Mono<T> inTransaction(String caseId, Function<ICaseFlowCaseTransaction, T> work) {
        return Mono.fromCallable(() -> {
            CaseFlowCaseRecord snapshot = records.get(caseId);
            if (snapshot == null) {
                throw new CaseFlowCaseNotFound(caseId);
            }
            CaseFlowCaseTransaction transaction = new CaseFlowCaseTransaction(snapshot.getCaseFlowCase());

            // Work runs outside compute; a throw here discards the staged writes
            T result = work.apply(transaction);

            records.compute(caseId, (key, current) -> {
                if (current == null) {
                    throw new CaseFlowCaseNotFound(caseId);
                }
                if (current.getCaseFlowCase().getVersion() != snapshot.getCaseFlowCase().getVersion()) {
                    throw new CaseFlowPersistenceException(caseId, "commit",
                            new IllegalStateException("Concurrent modification of case " + caseId));
                }
                CaseFlowCaseRecord updated = applyTransaction(current, transaction);
                persist(caseId, "commit", updated);
                return updated;
            });
            log.debug("Transaction committed: caseId={}, statuses={}, modified={}",
                    caseId, transaction.getStagedStatuses(), transaction.isCaseModified());
            return result;
        });
    }

    private CaseFlowCaseRecord applyTransaction(CaseFlowCaseRecord current, CaseFlowCaseTransaction transaction) {
        Instant now = clock.instant();
        CaseFlowCase caseFlowCase = current.getCaseFlowCase();
        if (transaction.isCaseModified()) {
            caseFlowCase = caseFlowCase.toBuilder()
                    .inputs(new LinkedHashMap<>(transaction.getStagedInputs()))
                    .artifacts(new LinkedHashMap<>(transaction.getStagedArtifacts()))
                    .version(caseFlowCase.getVersion() + 1)
                    .updatedAt(now)
                    .build();
        }

        long sequence = current.getNextSequence();
        List<CaseFlowStatusEntry> statusHistory = new ArrayList<>(current.getStatusHistory());
        for (String label : transaction.getStagedStatuses()) {
            statusHistory.add(statusEntry(current.getCaseFlowCase().getCaseId(), label, sequence++, now));
        }
        List<CaseFlowActionLogEntry> actionLog = new ArrayList<>(current.getActionLog());
        for (CaseFlowCaseTransaction.StagedLog staged : transaction.getStagedLogs()) {
            actionLog.add(logEntry(current.getCaseFlowCase().getCaseId(), staged.message(), staged.logType(), sequence++, now));
        }

        return current.toBuilder()
                .caseFlowCase(caseFlowCase)
                .statusHistory(statusHistory)
                .actionLog(actionLog)
                .nextSequence(sequence)
                .build();
    }

    // ========================================================================
    // STATUS LOG
    // ========================================================================

    @Override
    public Mono<CaseFlowStatusEntry> appendStatus(String caseId, String label) {
        return Mono.fromCallable(() -> {
            CaseFlowStatusEntry[] appended = new CaseFlowStatusEntry[1];
            CaseFlowCaseRecord updated = records.computeIfPresent(caseId, (key, current) -> {
                appended[0] = statusEntry(caseId, label, current.getNextSequence(), clock.instant());
                List<CaseFlowStatusEntry> statusHistory = new ArrayList<>(current.getStatusHistory());
                statusHistory.add(appended[0]);
                CaseFlowCaseRecord record = current.toBuilder()
                        .statusHistory(statusHistory)
                        .nextSequence(current.getNextSequence() + 1)
                        .build();
                persist(caseId, "appendStatus", record);
                return record;
            });
            if (updated == null) {
                throw new CaseFlowCaseNotFound(caseId);
            }
            log.debug("Status appended: caseId={}, label={}", caseId, label);
            return appended[0];
        });
    }

    @Override
    public Mono<String> findCurrentStatus(String caseId) {
        return Mono.fromCallable(() -> {
            CaseFlowCaseRecord record = records.get(caseId);
            if (record == null || record.getStatusHistory().isEmpty()) {
                return CaseFlowConstants.STATUS_UNKNOWN;
            }
            return record.getStatusHistory().stream()
                    .max(Comparator.comparingLong(CaseFlowStatusEntry::getSequence))
                    .map(CaseFlowStatusEntry::getLabel)
                    .orElse(CaseFlowConstants.STATUS_UNKNOWN);
        });
    }

    @Override
    public Flux<CaseFlowStatusEntry> findStatusHistory(String caseId) {
        return Flux.defer(() -> {
            CaseFlowCaseRecord record = records.get(caseId);
            return record == null ? Flux.empty() : Flux.fromIterable(record.getStatusHistory());
        });
    }

    @Override
    public Mono<CaseFlowActionLogEntry> appendLog(String caseId, String message, CaseFlowLogType logType) {
        return Mono.fromCallable(() -> {
            CaseFlowActionLogEntry[] appended = new CaseFlowActionLogEntry[1];
            CaseFlowCaseRecord updated = records.computeIfPresent(caseId, (key, current) -> {
                appended[0] = logEntry(caseId, message, logType, current.getNextSequence(), clock.instant());
                List<CaseFlowActionLogEntry> actionLog = new ArrayList<>(current.getActionLog());
                actionLog.add(appended[0]);
                CaseFlowCaseRecord record = current.toBuilder()
                        .actionLog(actionLog)
                        .nextSequence(current.getNextSequence() + 1)
                        .build();
                persist(caseId, "appendLog", record);
                return record;
            });
            if (updated == null) {
                throw new CaseFlowCaseNotFound(caseId);
            }
            return appended[0];
        });
    }

    @Override
    public Flux<CaseFlowActionLogEntry> findActionLog(String caseId) {
        return Flux.defer(() -> {
            CaseFlowCaseRecord record = records.get(caseId);
            return record == null ? Flux.empty() : Flux.fromIterable(record.getActionLog());
        });
    }

    // ========================================================================
    // INTERVENTIONS
    // ========================================================================

    @Override
    public Mono<CaseFlowInterventionRecord> saveIntervention(CaseFlowInterventionRecord record) {
        return Mono.fromCallable(() -> {
            interventions.compute(record.getCaseId(), (key, current) -> {
                List<CaseFlowInterventionRecord> updated = new ArrayList<>();
                boolean replaced = false;
                for (CaseFlowInterventionRecord existing : current == null ? List.<CaseFlowInterventionRecord>of() : current) {
                    if (existing.getInterventionId().equals(record.getInterventionId())) {
                        updated.add(record);
                        replaced = true;
                    } else {
                        if (record.isPending() && existing.isPending()) {
                            throw new IllegalStateException("Case " + record.getCaseId()
                                    + " already has pending intervention " + existing.getInterventionId());
                        }
                        updated.add(existing);
                    }
                }
                if (!replaced) {
                    updated.add(record);
                }
                try {
                    persistInterventions(record.getCaseId(), updated);
                } catch (Exception e) {
                    throw new CaseFlowPersistenceException(record.getCaseId(), "saveIntervention", e);
                }
                return updated;
            });
            log.debug("Intervention saved: caseId={}, id={}, status={}, pollingActive={}",
                    record.getCaseId(), record.getInterventionId(), record.getStatus(), record.isPollingActive());
            return record;
        });
    }

    @Override
    public Mono<CaseFlowInterventionRecord> findPendingIntervention(String caseId) {
        return findInterventions(caseId)
                .filter(CaseFlowInterventionRecord::isPending)
                .next();
    }

    @Override
    public Flux<CaseFlowInterventionRecord> findInterventions(String caseId) {
        return Flux.defer(() -> Flux.fromIterable(interventions.getOrDefault(caseId, List.of())));
    }

    @Override
    public Flux<CaseFlowInterventionRecord> findPolledInterventions() {
        return Flux.defer(() -> Flux.fromStream(interventions.values().stream()
                .flatMap(List::stream)
                .filter(record -> record.getStatus() == CaseFlowInterventionStatus.PENDING && record.isPollingActive())));
    }

    @Override
    public Mono<Long> countPendingInterventions() {
        return Mono.fromCallable(() -> interventions.values().stream()
                .flatMap(List::stream)
                .filter(CaseFlowInterventionRecord::isPending)
                .count());
    }

    // ========================================================================
    // PRIVATE HELPERS
    // ========================================================================

    private void persist(String caseId, String operation, CaseFlowCaseRecord record) {
        try {
            persistRecord(record);
        } catch (CaseFlowPersistenceException e) {
            throw e;
        } catch (Exception e) {
            throw new CaseFlowPersistenceException(caseId, operation, e);
        }
    }

    private static CaseFlowStatusEntry statusEntry(String caseId, String label, long sequence, Instant timestamp) {
        return CaseFlowStatusEntry.builder()
                .caseId(caseId)
                .label(label)
                .sequence(sequence)
                .timestamp(timestamp)
                .build();
    }

    private static CaseFlowActionLogEntry logEntry(String caseId, String message, CaseFlowLogType logType,
                                                   long sequence, Instant timestamp) {
        return CaseFlowActionLogEntry.builder()
                .caseId(caseId)
                .message(message)
                .logType(logType)
                .sequence(sequence)
                .timestamp(timestamp)
                .build();
    }
}
