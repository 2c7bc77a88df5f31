package com.caseflow.orchestrator.discharge.plugin.summary;

import dev.langchain4j.model.chat.ChatModel;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import reactor.test.StepVerifier;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ChatModelDischargeSummaryGeneratorTest {

    private static ChatModel replying(String reply, List<String> prompts) {
        return new ChatModel() {
            @Override
            public String chat(String userMessage) {
                prompts.add(userMessage);
                return reply;
            }
        };
    }

    @Test
    @DisplayName("should send the transcript inside the prompt and normalize the reply")
    void shouldGenerateSummary() {
        // Given
        List<String> prompts = new ArrayList<>();
        ChatModelDischargeSummaryGenerator generator = new ChatModelDischargeSummaryGenerator(
                replying("{\"chief_complaint\": \"Headache\", \"diagnosis\": [\"Migraine\"]}", prompts));

        // When
        DischargeSummary summary = generator.generate("Patient reports a throbbing headache").block();

        // Then
        assertEquals(1, prompts.size());
        assertTrue(prompts.get(0).startsWith("You are a medical discharge summary assistant."));
        assertTrue(prompts.get(0).contains("Transcript:\nPatient reports a throbbing headache"));
        assertEquals("Headache", summary.getChiefComplaint());
        assertEquals(List.of("Migraine"), summary.getDiagnosis());
        assertEquals(List.of(DischargeSummaryNormalizer.NOT_IN_TRANSCRIPT), summary.getHistory());
    }

    @Test
    @DisplayName("should signal an error when the model reply holds no JSON")
    void shouldFailOnUnusableReply() {
        ChatModelDischargeSummaryGenerator generator =
                new ChatModelDischargeSummaryGenerator(replying("I cannot help with that.", new ArrayList<>()));

        StepVerifier.create(generator.generate("transcript"))
                .expectError(IllegalArgumentException.class)
                .verify();
    }
}
