package com.caseflow.orchestrator.core.engine.misc;

import com.caseflow.orchestrator.integration.contract.ICaseFlowObjectMapper;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

public class CaseFlowObjectMapper implements ICaseFlowObjectMapper {

    private final ObjectMapper objectMapper = createObjectMapper();

    private CaseFlowObjectMapper() {}

    @Override
    public <T> T convertValue(Object fromValue, Class<T> toValueType) throws IllegalArgumentException {
        return objectMapper.convertValue(fromValue, toValueType);
    }

    @Override
    public String writeValueAsString(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Value is not serializable: " + e.getOriginalMessage(), e);
        }
    }

    public JsonNode readTree(String content) throws JsonProcessingException {
        return objectMapper.readTree(content);
    }

    /**
     * The shared mapper, configured for java.time values and tolerant of unknown properties.
     */
    public ObjectMapper getObjectMapper() {
        return objectMapper;
    }

    public static ObjectMapper createObjectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        return mapper;
    }

    private static final class SingletonHolder {
        private static final CaseFlowObjectMapper INSTANCE = new CaseFlowObjectMapper();
    }

    public static CaseFlowObjectMapper getInstance() {
        return SingletonHolder.INSTANCE;
    }
}
