package com.caseflow.orchestrator.integration.contract;

public interface ICaseFlowObjectMapper {
    <T> T convertValue(Object fromValue, Class<T> toValueType) throws IllegalArgumentException;
    String writeValueAsString(Object value);
}
