package com.samterminal.core.engine.misc;

import com.samterminal.integration.contract.ISamTerminalObjectMapper;
import tools.jackson.core.JacksonException;
import tools.jackson.databind.ObjectMapper;
import tools.jackson.databind.SerializationFeature;
import tools.jackson.databind.json.JsonMapper;

public class SamTerminalObjectMapper implements ISamTerminalObjectMapper {

    private final ObjectMapper objectMapper;

    public SamTerminalObjectMapper() {
        this.objectMapper = JsonMapper.builder()
                .enable(SerializationFeature.INDENT_OUTPUT)
                .build();
    }

    @Override
    public <T> T convertValue(Object fromValue, Class<T> toValueType) throws IllegalArgumentException {
        return objectMapper.convertValue(fromValue, toValueType);
    }

    @Override
    public <T> T readValue(String content, Class<T> valueType) throws IllegalArgumentException {
        try {
            return objectMapper.readValue(content, valueType);
        } catch (JacksonException e) {
            throw new IllegalArgumentException(e.getOriginalMessage(), e);
        }
    }

    @Override
    public String writeValueAsString(Object value) throws IllegalArgumentException {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JacksonException e) {
            throw new IllegalArgumentException(e.getOriginalMessage(), e);
        }
    }
}
