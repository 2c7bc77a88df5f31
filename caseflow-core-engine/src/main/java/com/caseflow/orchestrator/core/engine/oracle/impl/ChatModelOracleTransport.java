package com.caseflow.orchestrator.core.engine.oracle.impl;

import com.caseflow.orchestrator.integration.contract.oracle.ICaseFlowOracleTransport;
import dev.langchain4j.model.chat.ChatModel;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

/**
 * Oracle transport backed by a LangChain4j {@link ChatModel}. The blocking model call runs on
 * the bounded-elastic scheduler.
 */
@Slf4j
public class ChatModelOracleTransport implements ICaseFlowOracleTransport {

    private final ChatModel chatModel;

    public ChatModelOracleTransport(ChatModel chatModel) {
        this.chatModel = chatModel;
    }

    @Override
    public Mono<String> complete(String prompt) {
        return Mono.fromCallable(() -> {
                    long start = System.nanoTime();
                    String reply = chatModel.chat(prompt);
                    log.debug("Chat model replied in {} ms", (System.nanoTime() - start) / 1_000_000);
                    return reply;
                })
                .subscribeOn(Schedulers.boundedElastic());
    }
}
