package com.caseflow.orchestrator.discharge.plugin.summary;

import com.caseflow.orchestrator.integration.contract.oracle.ICaseFlowOracleTransport;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.langchain4j.model.chat.ChatModel;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

/**
 * Asks a LangChain4j chat model for a discharge summary and normalizes its reply. The model is
 * reached either directly or through the orchestrator's oracle transport.
 */
@Slf4j
public class ChatModelDischargeSummaryGenerator implements IDischargeSummaryGenerator {

    static final String PROMPT_TEMPLATE = """
            You are a medical discharge summary assistant.

            From the following cleaned transcript, produce a SINGLE STRICT JSON object
            with ALL of these fields:

            - chief_complaint: string
            - history: array of strings (each item can be a sentence)
            - exam_findings: string
            - diagnosis: array of strings
            - investigations: array of strings (or empty array if none)
            - medications: array of objects with keys: name, dose, frequency
            - follow_up_instructions: string

            Rules:
            - DO NOT leave any field empty.
            - If something is not explicitly stated, infer a reasonable, concise entry,
              or write "Not clearly specified in the transcript".
            - Return STRICT VALID JSON ONLY. No markdown, no comments, no extra text.

            Transcript:
            %s
            """;

    private final ICaseFlowOracleTransport model;
    private final DischargeSummaryNormalizer normalizer;

    public ChatModelDischargeSummaryGenerator(ChatModel chatModel) {
        this(chatModel, new DischargeSummaryNormalizer(new ObjectMapper()));
    }

    public ChatModelDischargeSummaryGenerator(ChatModel chatModel, DischargeSummaryNormalizer normalizer) {
        this(blockingCall(chatModel), normalizer);
    }

    public ChatModelDischargeSummaryGenerator(ICaseFlowOracleTransport model) {
        this(model, new DischargeSummaryNormalizer(new ObjectMapper()));
    }

    public ChatModelDischargeSummaryGenerator(ICaseFlowOracleTransport model, DischargeSummaryNormalizer normalizer) {
        this.model = model;
        this.normalizer = normalizer;
    }

    private static ICaseFlowOracleTransport blockingCall(ChatModel chatModel) {
        return prompt -> Mono.fromCallable(() -> chatModel.chat(prompt)).subscribeOn(Schedulers.boundedElastic());
    }

    @Override
    public Mono<DischargeSummary> generate(String cleanedTranscript) {
        return Mono.defer(() -> model.complete(String.format(PROMPT_TEMPLATE, cleanedTranscript)))
                .doOnNext(reply -> log.debug("Summary model replied with {} chars", reply == null ? 0 : reply.length()))
                .map(normalizer::normalize);
    }
}
