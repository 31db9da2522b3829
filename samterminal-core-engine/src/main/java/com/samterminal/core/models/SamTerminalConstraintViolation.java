package com.samterminal.core.models;

import lombok.AllArgsConstructor;
import lombok.Data;

import java.util.Map;

@Data
@AllArgsConstructor
public class SamTerminalConstraintViolation {
    private final Class<?> rootBeanClass;
    private final String propertyPath;
    private final String message;
    private final Map<String, String> templateVariables;
}
