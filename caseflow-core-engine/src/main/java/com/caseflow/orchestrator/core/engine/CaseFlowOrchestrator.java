package com.caseflow.orchestrator.core.engine;

import com.caseflow.orchestrator.core.engine.config.CaseFlowConfigLoader;
import com.caseflow.orchestrator.core.engine.config.CaseFlowEngineConfig;
import com.caseflow.orchestrator.core.engine.executor.CaseFlowActionContext;
import com.caseflow.orchestrator.core.engine.executor.CaseFlowActionExecutorRegistry;
import com.caseflow.orchestrator.core.engine.lock.ICaseFlowCaseLockService;
import com.caseflow.orchestrator.core.engine.lock.impl.InMemoryCaseLockService;
import com.caseflow.orchestrator.core.engine.misc.CaseFlowBeanValidator;
import com.caseflow.orchestrator.core.engine.misc.CaseFlowObjectMapper;
import com.caseflow.orchestrator.core.engine.oracle.ICaseFlowDecisionOracle;
import com.caseflow.orchestrator.core.engine.oracle.impl.CaseFlowDecisionOracleAdapter;
import com.caseflow.orchestrator.core.engine.polling.ICaseFlowPollingManager;
import com.caseflow.orchestrator.core.engine.polling.impl.CaseFlowPollingManagerImpl;
import com.caseflow.orchestrator.core.engine.precondition.CaseFlowPreconditionRegistry;
import com.caseflow.orchestrator.core.engine.store.CaseFlowStoreManager;
import com.caseflow.orchestrator.core.engine.store.ICaseFlowCaseStore;
import com.caseflow.orchestrator.core.engine.store.ICaseFlowCheckpointStore;
import com.caseflow.orchestrator.core.engine.workflow.ICaseFlowWorkflowEngine;
import com.caseflow.orchestrator.core.engine.workflow.impl.CaseFlowWorkflowEngine;
import com.caseflow.orchestrator.core.exception.CaseFlowRuntimeException;
import com.caseflow.orchestrator.core.exception.codes.CaseFlowInternalErrorCodes;
import com.caseflow.orchestrator.core.exception.store.CaseFlowCaseNotFound;
import com.caseflow.orchestrator.integration.ICaseFlowPluginProvider;
import com.caseflow.orchestrator.integration.constant.CaseFlowConstants;
import com.caseflow.orchestrator.integration.contract.oracle.ICaseFlowOracleTransport;
import com.caseflow.orchestrator.integration.contract.plugin.ICaseFlowWorkflowPlugin;
import com.caseflow.orchestrator.integration.enumerations.CaseFlowLogType;
import com.caseflow.orchestrator.integration.models.cases.CaseFlowCase;
import com.caseflow.orchestrator.integration.models.cases.CaseFlowCaseCreateRequest;
import com.caseflow.orchestrator.integration.models.run.CaseFlowCaseState;
import com.caseflow.orchestrator.integration.models.run.CaseFlowRunResult;
import com.caseflow.orchestrator.integration.models.run.CaseFlowStatistics;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.Map;
import java.util.Optional;
import java.util.ServiceLoader;

/**
 * Default {@link ICaseFlowOrchestrator}, wiring stores, lock service, poller and engine around one
 * workflow plugin.
 *
 * <pre>{@code
 * ICaseFlowOrchestrator orchestrator = CaseFlowOrchestrator.builder()
 *         .config(CaseFlowConfigLoader.loadDefault())
 *         .oracleTransport(new ChatModelOracleTransport(chatModel))
 *         .build();
 * orchestrator.start().block();
 * }</pre>
 * Without an explicit plugin the first {@link ICaseFlowPluginProvider} found by
 * {@link ServiceLoader} is used, created with the oracle transport so that its executors can share
 * the same language model.
 */
@Slf4j
public class CaseFlowOrchestrator implements ICaseFlowOrchestrator {

    private static final String PROVIDE_INPUT_OPERATION = "provide-input";
    private static final String DELETE_OPERATION = "delete";
    private static final String DELETED_RESOLUTION = "Case deleted";

    @Getter
    private final CaseFlowEngineConfig config;
    @Getter
    private final ICaseFlowWorkflowPlugin plugin;
    private final CaseFlowStoreManager storeManager;
    private final ICaseFlowCaseStore caseStore;
    private final ICaseFlowCheckpointStore checkpointStore;
    private final ICaseFlowCaseLockService lockService;
    @Getter
    private final ICaseFlowPollingManager pollingManager;
    private final ICaseFlowWorkflowEngine workflowEngine;

    private CaseFlowOrchestrator(Builder builder) {
        this.config = CaseFlowBeanValidator.getInstance().validate(
                builder.config == null ? CaseFlowConfigLoader.loadDefault() : builder.config);
        this.plugin = builder.plugin == null ? discoverPlugin(builder.oracleTransport) : builder.plugin;
        this.storeManager = builder.storeManager == null ? CaseFlowStoreManager.fromConfig(config) : builder.storeManager;
        this.caseStore = storeManager.getCaseStore();
        this.checkpointStore = storeManager.getCheckpointStore();
        this.lockService = builder.lockService == null ? new InMemoryCaseLockService() : builder.lockService;
        Clock clock = builder.clock == null ? Clock.systemUTC() : builder.clock;

        CaseFlowActionExecutorRegistry executorRegistry = new CaseFlowActionExecutorRegistry();
        plugin.getActionExecutors().forEach(executorRegistry::register);
        CaseFlowPreconditionRegistry preconditionRegistry = new CaseFlowPreconditionRegistry();
        plugin.getPreconditions().forEach(preconditionRegistry::register);

        ICaseFlowDecisionOracle oracle = builder.decisionOracle;
        if (oracle == null) {
            if (builder.oracleTransport == null) {
                throw new CaseFlowRuntimeException(CaseFlowInternalErrorCodes.INVALID_CONFIGURATION,
                        Map.of("reason", "either a decision oracle or an oracle transport is required"));
            }
            oracle = new CaseFlowDecisionOracleAdapter(builder.oracleTransport);
        }

        this.pollingManager = new CaseFlowPollingManagerImpl(caseStore, lockService, preconditionRegistry,
                config.getPollingInterval(), config.getMaxPollAttempts(), config.getLockDuration(), clock, 2);
        this.workflowEngine = new CaseFlowWorkflowEngine(caseStore, checkpointStore, executorRegistry,
                preconditionRegistry, oracle, pollingManager, lockService,
                new CaseFlowActionContext(caseStore, CaseFlowObjectMapper.getInstance()),
                plugin, config, clock);
        this.pollingManager.setResumeHandler(workflowEngine::resume);

        log.info("Orchestrator assembled: plugin={}, store={}, maxSteps={}",
                plugin.getIdentifier(), config.getStoreType(), config.getMaxSteps());
    }

    public static Builder builder() {
        return new Builder();
    }

    // ========================================================================
    // LIFECYCLE
    // ========================================================================

    @Override
    public Mono<Void> start() {
        return storeManager.initialize()
                .then(Mono.fromRunnable(pollingManager::start))
                .then(pollingManager.recoverPolling())
                .then();
    }

    @Override
    public Mono<Void> shutdown() {
        return Mono.fromRunnable(pollingManager::stop)
                .then(storeManager.shutdown());
    }

    // ========================================================================
    // CASES
    // ========================================================================

    @Override
    public Mono<CaseFlowCase> createCase(CaseFlowCaseCreateRequest request) {
        return Mono.fromCallable(() -> CaseFlowBeanValidator.getInstance().validate(request))
                .flatMap(valid -> caseStore.createCase(valid.getCaseId(), valid.getInputs()))
                .doOnNext(created -> log.info("Case created: caseId={}, inputs={}", created.getCaseId(), created.getInputs().keySet()));
    }

    @Override
    public Mono<CaseFlowRunResult> run(String caseId) {
        return run(caseId, CaseFlowConstants.DEFAULT_START_MESSAGE);
    }

    @Override
    public Mono<CaseFlowRunResult> run(String caseId, String seedMessage) {
        return workflowEngine.run(caseId, seedMessage);
    }

    @Override
    public Mono<CaseFlowCase> provideMissingInput(String caseId, String value) {
        return caseStore.findPendingIntervention(caseId)
                .filter(pending -> !pending.getMissingFields().isEmpty())
                .map(pending -> pending.getMissingFields().get(0))
                .switchIfEmpty(Mono.defer(() -> plugin.getPrimaryInputField() == null
                        ? Mono.error(new CaseFlowRuntimeException(CaseFlowInternalErrorCodes.NO_INPUT_FIELD, Map.of("caseId", caseId)))
                        : Mono.just(plugin.getPrimaryInputField())))
                .flatMap(field -> provideMissingInput(caseId, field, value));
    }

    @Override
    public Mono<CaseFlowCase> provideMissingInput(String caseId, String field, String value) {
        Mono<CaseFlowCase> write = caseStore.inTransaction(caseId, transaction -> {
                    transaction.putInput(field, value);
                    transaction.appendStatus(CaseFlowConstants.STATUS_INPUT_PROVIDED);
                    transaction.log("[INPUT] Received " + field + " (" + (value == null ? 0 : value.length()) + " chars)",
                            CaseFlowLogType.INPUT);
                    return field;
                })
                .then(caseStore.findCase(caseId));

        return lockService.executeWithLockWaiting(caseId, config.getLockDuration(), config.getLockWaitTimeout(),
                        PROVIDE_INPUT_OPERATION, Mono.defer(() -> write))
                .doOnNext(updated -> log.info("Input provided: caseId={}, field={}", caseId, field));
    }

    @Override
    public Mono<CaseFlowCaseState> getCaseState(String caseId) {
        return caseStore.findCase(caseId)
                .switchIfEmpty(Mono.error(() -> new CaseFlowCaseNotFound(caseId)))
                .flatMap(caseFlowCase -> Mono.zip(
                                caseStore.findCurrentStatus(caseId),
                                caseStore.findStatusHistory(caseId).collectList(),
                                caseStore.findActionLog(caseId).collectList(),
                                caseStore.findInterventions(caseId).collectList(),
                                checkpointStore.findByCaseId(caseId).map(Optional::of).defaultIfEmpty(Optional.empty()))
                        .map(tuple -> CaseFlowCaseState.builder()
                                .caseRecord(caseFlowCase)
                                .currentStatus(tuple.getT1())
                                .statusHistory(tuple.getT2())
                                .actionLog(tuple.getT3())
                                .interventions(tuple.getT4())
                                .checkpoint(tuple.getT5().orElse(null))
                                .pollingActive(pollingManager.isPolling(caseId))
                                .build()));
    }

    @Override
    public Mono<Boolean> stopPolling(String caseId) {
        return pollingManager.stopPolling(caseId);
    }

    @Override
    public Mono<Boolean> deleteCase(String caseId) {
        Mono<Boolean> delete = pollingManager.resolveIntervention(caseId, DELETED_RESOLUTION)
                .then(checkpointStore.deleteByCaseId(caseId))
                .then(caseStore.deleteCase(caseId));

        return caseStore.exists(caseId)
                .flatMap(exists -> exists
                        ? lockService.executeWithLockWaiting(caseId, config.getLockDuration(), config.getLockWaitTimeout(),
                                DELETE_OPERATION, Mono.defer(() -> delete))
                        : Mono.<Boolean>error(new CaseFlowCaseNotFound(caseId)))
                .doOnNext(deleted -> log.info("Case deleted: caseId={}", caseId));
    }

    @Override
    public Mono<CaseFlowStatistics> getStatistics() {
        return Mono.zip(caseStore.countCases(), caseStore.countPendingInterventions(), checkpointStore.countByState())
                .map(tuple -> CaseFlowStatistics.builder()
                        .totalCases(tuple.getT1())
                        .pendingInterventions(tuple.getT2())
                        .activePolls(new ArrayList<>(pollingManager.getActivePolls()))
                        .checkpointsByState(tuple.getT3())
                        .build());
    }

    // ========================================================================
    // PLUGIN DISCOVERY
    // ========================================================================

    private static ICaseFlowWorkflowPlugin discoverPlugin(ICaseFlowOracleTransport oracleTransport) {
        Iterator<ICaseFlowPluginProvider> providers = ServiceLoader.load(ICaseFlowPluginProvider.class).iterator();
        if (!providers.hasNext()) {
            throw new CaseFlowRuntimeException(CaseFlowInternalErrorCodes.INVALID_CONFIGURATION,
                    Map.of("reason", "no workflow plugin configured and none found on the classpath"));
        }
        ICaseFlowPluginProvider provider = providers.next();
        ICaseFlowWorkflowPlugin discovered = provider.create(oracleTransport);
        log.info("Discovered workflow plugin {} through {}", discovered.getIdentifier(), provider.getClass().getName());
        return discovered;
    }

    public static final class Builder {
        private CaseFlowEngineConfig config;
        private ICaseFlowWorkflowPlugin plugin;
        private ICaseFlowOracleTransport oracleTransport;
        private ICaseFlowDecisionOracle decisionOracle;
        private CaseFlowStoreManager storeManager;
        private ICaseFlowCaseLockService lockService;
        private Clock clock;

        private Builder() {
        }

        public Builder config(CaseFlowEngineConfig config) {
            this.config = config;
            return this;
        }

        public Builder plugin(ICaseFlowWorkflowPlugin plugin) {
            this.plugin = plugin;
            return this;
        }

        public Builder oracleTransport(ICaseFlowOracleTransport oracleTransport) {
            this.oracleTransport = oracleTransport;
            return this;
        }

        public Builder decisionOracle(ICaseFlowDecisionOracle decisionOracle) {
            this.decisionOracle = decisionOracle;
            return this;
        }

        public Builder storeManager(CaseFlowStoreManager storeManager) {
            this.storeManager = storeManager;
            return this;
        }

        public Builder lockService(ICaseFlowCaseLockService lockService) {
            this.lockService = lockService;
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        public CaseFlowOrchestrator build() {
            return new CaseFlowOrchestrator(this);
        }
    }
}
