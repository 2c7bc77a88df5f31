package com.caseflow.orchestrator.core.engine.oracle;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.Optional;

/**
 * Finds the first well-formed JSON object embedded in free text, e.g. a model reply wrapped
 * in prose or a markdown fence. Braces inside string literals are ignored while scanning.
 */
public class CaseFlowJsonObjectExtractor {

    private final ObjectMapper objectMapper;

    public CaseFlowJsonObjectExtractor(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public Optional<JsonNode> extractFirstObject(String text) {
        if (text == null) {
            return Optional.empty();
        }
        int start = text.indexOf('{');
        while (start >= 0) {
            int end = findMatchingBrace(text, start);
            if (end < 0) {
                return Optional.empty();
            }
            try {
                JsonNode node = objectMapper.readTree(text.substring(start, end + 1));
                if (node != null && node.isObject()) {
                    return Optional.of(node);
                }
            } catch (JsonProcessingException e) {
                // not valid JSON, keep scanning from the next opening brace
            }
            start = text.indexOf('{', start + 1);
        }
        return Optional.empty();
    }

    private static int findMatchingBrace(String text, int start) {
        int depth = 0;
        boolean inString = false;
        boolean escaped = false;
        for (int i = start; i < text.length(); i++) {
            char c = text.charAt(i);
            if (inString) {
                if (escaped) {
                    escaped = false;
                } else if (c == '\\') {
                    escaped = true;
                } else if (c == '"') {
                    inString = false;
                }
                continue;
            }
            if (c == '"') {
                inString = true;
            } else if (c == '{') {
                depth++;
            } else if (c == '}') {
                depth--;
                if (depth == 0) {
                    return i;
                }
            }
        }
        return -1;
    }
}
