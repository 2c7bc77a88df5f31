package com.caseflow.orchestrator.integration.contract.oracle;

import reactor.core.publisher.Mono;

/**
 * Sends a rendered decision prompt to an external decision maker and returns its raw text reply.
 */
@FunctionalInterface
public interface ICaseFlowOracleTransport {
    Mono<String> complete(String prompt);
}
