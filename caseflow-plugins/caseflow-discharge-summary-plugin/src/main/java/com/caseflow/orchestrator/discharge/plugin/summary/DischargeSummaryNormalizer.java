package com.caseflow.orchestrator.discharge.plugin.summary;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads the loosely structured JSON a language model returns for a summary request and fills the
 * gaps with placeholders, so downstream validation sees a complete shape.
 *
 * <h2>Rules</h2>
 * <ul>
 *   <li>the span from the first '{' to the last '}' of the reply is parsed as JSON</li>
 *   <li>list fields accept a string or an array; entries are trimmed and blanks dropped</li>
 *   <li>empty history or diagnosis becomes a single "not specified" entry</li>
 *   <li>medications keep only object entries; missing name, dose or frequency read "Not specified"</li>
 * </ul>
 */
public class DischargeSummaryNormalizer {

    public static final String NOT_SPECIFIED = "Not specified";
    public static final String NOT_IN_TRANSCRIPT = "Not clearly specified in the transcript.";
    public static final String EXAM_NOT_DOCUMENTED = "Not clearly documented.";
    public static final String NO_FOLLOW_UP = "No specific follow-up instructions documented.";

    private static final Pattern JSON_SPAN = Pattern.compile("\\{.*}", Pattern.DOTALL);

    private final ObjectMapper objectMapper;

    public DischargeSummaryNormalizer(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * @throws IllegalArgumentException when the reply holds no parseable JSON object
     */
    public DischargeSummary normalize(String reply) {
        Matcher matcher = JSON_SPAN.matcher(reply == null ? "" : reply);
        if (!matcher.find()) {
            throw new IllegalArgumentException("reply contains no JSON object");
        }
        JsonNode root;
        try {
            root = objectMapper.readTree(matcher.group());
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("reply JSON is malformed: " + e.getOriginalMessage(), e);
        }
        return normalize(root);
    }

    public DischargeSummary normalize(JsonNode root) {
        List<String> history = toStringList(root.get("history"));
        List<String> diagnosis = toStringList(root.get("diagnosis"));

        return DischargeSummary.builder()
                .chiefComplaint(text(root, "chief_complaint").orElse(NOT_IN_TRANSCRIPT))
                .history(history.isEmpty() ? List.of(NOT_IN_TRANSCRIPT) : history)
                .examFindings(text(root, "exam_findings").orElse(EXAM_NOT_DOCUMENTED))
                .diagnosis(diagnosis.isEmpty() ? List.of(NOT_IN_TRANSCRIPT) : diagnosis)
                .investigations(toStringList(root.get("investigations")))
                .medications(toMedications(root.get("medications")))
                .followUpInstructions(text(root, "follow_up_instructions")
                        .or(() -> text(root, "followup_instructions"))
                        .orElse(NO_FOLLOW_UP))
                .build();
    }

    static List<String> toStringList(JsonNode value) {
        List<String> items = new ArrayList<>();
        if (value == null || value.isNull()) {
            return items;
        }
        if (value.isArray()) {
            for (JsonNode element : value) {
                if (element != null && !element.isNull()) {
                    addIfNotBlank(items, element.isValueNode() ? element.asText() : element.toString());
                }
            }
            return items;
        }
        addIfNotBlank(items, value.isValueNode() ? value.asText() : value.toString());
        return items;
    }

    private List<Medication> toMedications(JsonNode value) {
        List<Medication> medications = new ArrayList<>();
        if (value == null || !value.isArray()) {
            return medications;
        }
        for (JsonNode element : value) {
            if (element.isObject()) {
                medications.add(Medication.builder()
                        .name(text(element, "name").orElse(NOT_SPECIFIED))
                        .dose(text(element, "dose").orElse(NOT_SPECIFIED))
                        .frequency(text(element, "frequency").orElse(NOT_SPECIFIED))
                        .build());
            }
        }
        return medications;
    }

    private static Optional<String> text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            return Optional.empty();
        }
        String text = (value.isValueNode() ? value.asText() : value.toString()).strip();
        return text.isEmpty() ? Optional.empty() : Optional.of(text);
    }

    private static void addIfNotBlank(List<String> items, String candidate) {
        String stripped = candidate.strip();
        if (!stripped.isEmpty()) {
            items.add(stripped);
        }
    }
}
