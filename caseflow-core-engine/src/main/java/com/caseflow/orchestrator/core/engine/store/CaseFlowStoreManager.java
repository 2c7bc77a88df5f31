package com.caseflow.orchestrator.core.engine.store;

import com.caseflow.orchestrator.core.engine.config.CaseFlowEngineConfig;
import com.caseflow.orchestrator.core.engine.config.CaseFlowStoreType;
import com.caseflow.orchestrator.core.engine.store.impl.FileBasedCaseStore;
import com.caseflow.orchestrator.core.engine.store.impl.FileBasedCheckpointStore;
import com.caseflow.orchestrator.core.engine.store.impl.InMemoryCaseStore;
import com.caseflow.orchestrator.core.engine.store.impl.InMemoryCheckpointStore;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;

import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Creates and owns the case store and checkpoint store for the configured backend.
 *
 * <h2>Supported Storage Types</h2>
 * <ul>
 *   <li>MEMORY: In-memory storage (no persistence, fast)</li>
 *   <li>FILE: JSON documents under {@code caseflow.store.path}</li>
 * </ul>
 */
@Slf4j
@Getter
public class CaseFlowStoreManager {

    private final CaseFlowStoreType storeType;
    private final ICaseFlowCaseStore caseStore;
    private final ICaseFlowCheckpointStore checkpointStore;
    private volatile boolean initialized = false;

    public CaseFlowStoreManager(ICaseFlowCaseStore caseStore, ICaseFlowCheckpointStore checkpointStore) {
        this(null, caseStore, checkpointStore);
    }

    private CaseFlowStoreManager(CaseFlowStoreType storeType, ICaseFlowCaseStore caseStore,
                                 ICaseFlowCheckpointStore checkpointStore) {
        this.storeType = storeType;
        this.caseStore = caseStore;
        this.checkpointStore = checkpointStore;
    }

    public static CaseFlowStoreManager fromConfig(CaseFlowEngineConfig config) {
        CaseFlowStoreType type = config.getStoreType();
        log.info("Creating case stores with type: {}", type);
        switch (type) {
            case FILE:
                Path baseDir = Paths.get(config.getStorePath());
                return new CaseFlowStoreManager(type, new FileBasedCaseStore(baseDir), new FileBasedCheckpointStore(baseDir));
            case MEMORY:
            default:
                return new CaseFlowStoreManager(type, new InMemoryCaseStore(), new InMemoryCheckpointStore());
        }
    }

    public Mono<Void> initialize() {
        return Mono.defer(() -> {
            if (initialized) {
                return Mono.empty();
            }
            return caseStore.initialize()
                    .then(checkpointStore.initialize())
                    .doOnSuccess(v -> {
                        initialized = true;
                        log.info("Case stores initialized");
                    })
                    .doOnError(e -> log.error("Failed to initialize case stores", e));
        });
    }

    public Mono<Void> shutdown() {
        return Mono.defer(() -> {
            if (!initialized) {
                return Mono.empty();
            }
            log.info("Shutting down case stores");
            return checkpointStore.shutdown()
                    .then(caseStore.shutdown())
                    .doFinally(signal -> initialized = false);
        });
    }

    public Mono<Boolean> healthCheck() {
        if (!initialized) {
            return Mono.just(false);
        }
        return caseStore.healthCheck();
    }
}
