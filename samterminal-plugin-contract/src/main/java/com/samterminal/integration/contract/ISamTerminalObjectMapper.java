package com.samterminal.integration.contract;

public interface ISamTerminalObjectMapper {
    <T> T convertValue(Object fromValue, Class<T> toValueType) throws IllegalArgumentException;
    <T> T readValue(String content, Class<T> valueType) throws IllegalArgumentException;
    String writeValueAsString(Object value) throws IllegalArgumentException;
}
