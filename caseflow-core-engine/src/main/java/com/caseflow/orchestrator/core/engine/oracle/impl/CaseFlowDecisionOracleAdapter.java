package com.caseflow.orchestrator.core.engine.oracle.impl;

import com.caseflow.orchestrator.core.engine.executor.CaseFlowActionExecutorRegistry;
import com.caseflow.orchestrator.core.engine.misc.CaseFlowObjectMapper;
import com.caseflow.orchestrator.core.engine.oracle.CaseFlowDecisionPromptRenderer;
import com.caseflow.orchestrator.core.engine.oracle.CaseFlowJsonObjectExtractor;
import com.caseflow.orchestrator.core.engine.oracle.ICaseFlowDecisionOracle;
import com.caseflow.orchestrator.core.exception.codes.CaseFlowInternalErrorCodes;
import com.caseflow.orchestrator.integration.constant.CaseFlowConstants;
import com.caseflow.orchestrator.integration.contract.ICaseFlowErrorInfo;
import com.caseflow.orchestrator.integration.contract.oracle.ICaseFlowOracleTransport;
import com.caseflow.orchestrator.integration.exception.CaseFlowActionRuntimeException;
import com.caseflow.orchestrator.integration.models.decision.CaseFlowActionDescriptor;
import com.caseflow.orchestrator.integration.models.decision.CaseFlowDecision;
import com.caseflow.orchestrator.integration.models.decision.CaseFlowDecisionContext;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;

import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Turns the raw text reply of an oracle transport into a routable {@link CaseFlowDecision}.
 *
 * <h2>Failure mapping</h2>
 * Each of the following yields an {@code error} decision whose reasoning names the cause:
 * <ul>
 *   <li>the transport signals an error or completes empty</li>
 *   <li>the reply contains no JSON object</li>
 *   <li>the object has no non-blank {@code action}</li>
 *   <li>the action is not one of the context's available actions</li>
 * </ul>
 * The transport is called exactly once per decision.
 */
@Slf4j
public class CaseFlowDecisionOracleAdapter implements ICaseFlowDecisionOracle {

    private final ICaseFlowOracleTransport transport;
    private final CaseFlowDecisionPromptRenderer promptRenderer;
    private final CaseFlowJsonObjectExtractor jsonExtractor;

    public CaseFlowDecisionOracleAdapter(ICaseFlowOracleTransport transport) {
        this(transport, new CaseFlowDecisionPromptRenderer(),
                new CaseFlowJsonObjectExtractor(CaseFlowObjectMapper.getInstance().getObjectMapper()));
    }

    public CaseFlowDecisionOracleAdapter(ICaseFlowOracleTransport transport,
                                         CaseFlowDecisionPromptRenderer promptRenderer,
                                         CaseFlowJsonObjectExtractor jsonExtractor) {
        this.transport = transport;
        this.promptRenderer = promptRenderer;
        this.jsonExtractor = jsonExtractor;
    }

    @Override
    public Mono<CaseFlowDecision> decide(CaseFlowDecisionContext context) {
        String prompt = promptRenderer.render(context);
        log.debug("Requesting decision: caseId={}, completed={}", context.getCaseId(), context.getCompletedActions());

        return Mono.defer(() -> transport.complete(prompt))
                .map(reply -> parse(reply, context))
                .switchIfEmpty(Mono.fromSupplier(() -> errorDecision(
                        CaseFlowInternalErrorCodes.ORACLE_TRANSPORT_FAILED, Map.of("reason", "empty reply"))))
                .onErrorResume(e -> {
                    log.warn("Decision oracle call failed for caseId={}: {}", context.getCaseId(), e.toString());
                    return Mono.just(errorDecision(CaseFlowInternalErrorCodes.ORACLE_TRANSPORT_FAILED,
                            Map.of("reason", String.valueOf(e.getMessage()))));
                })
                .doOnNext(decision -> log.info("Decision for caseId={}: {} | {}",
                        context.getCaseId(), decision.getAction(), decision.getReasoning()));
    }

    CaseFlowDecision parse(String reply, CaseFlowDecisionContext context) {
        Optional<JsonNode> json = jsonExtractor.extractFirstObject(reply);
        if (json.isEmpty()) {
            return errorDecision(CaseFlowInternalErrorCodes.ORACLE_RESPONSE_UNPARSEABLE,
                    Map.of("reason", "no JSON object in reply"));
        }
        JsonNode actionNode = json.get().get("action");
        if (actionNode == null || !actionNode.isTextual() || actionNode.asText().isBlank()) {
            return errorDecision(CaseFlowInternalErrorCodes.ORACLE_RESPONSE_UNPARSEABLE,
                    Map.of("reason", "missing action"));
        }
        String rawAction = actionNode.asText();
        String action = CaseFlowActionExecutorRegistry.normalize(rawAction);
        JsonNode reasoningNode = json.get().get("reasoning");
        String reasoning = reasoningNode != null && !reasoningNode.isNull() && !reasoningNode.asText().isBlank()
                ? reasoningNode.asText()
                : CaseFlowConstants.DEFAULT_REASONING;

        Set<String> allowed = context.getAvailableActions().stream()
                .map(CaseFlowActionDescriptor::getLabel)
                .collect(Collectors.toSet());
        if (!allowed.contains(action)) {
            return errorDecision(CaseFlowInternalErrorCodes.ORACLE_UNKNOWN_ACTION, Map.of("action", rawAction))
                    .withOriginalAction(rawAction);
        }
        return CaseFlowDecision.builder()
                .action(action)
                .reasoning(reasoning)
                .originalAction(rawAction)
                .build();
    }

    private static CaseFlowDecision errorDecision(ICaseFlowErrorInfo errorInfo, Map<String, String> variables) {
        return CaseFlowDecision.builder()
                .action(CaseFlowConstants.ACTION_ERROR)
                .reasoning(CaseFlowActionRuntimeException.formatMessage(errorInfo, variables))
                .forced(true)
                .build();
    }
}
