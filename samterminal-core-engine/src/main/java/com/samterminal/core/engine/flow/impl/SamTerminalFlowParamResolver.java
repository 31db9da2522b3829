package com.samterminal.core.engine.flow.impl;

import com.samterminal.core.util.PathUtil;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Replaces {@code "{{path.to.value}}"} strings with the variable at that path. Only strings
 * that are a template as a whole are replaced, keeping the type of the resolved value.
 */
final class SamTerminalFlowParamResolver {

    private static final String TEMPLATE_START = "{{";
    private static final String TEMPLATE_END = "}}";

    private SamTerminalFlowParamResolver() {
    }

    static Map<String, Object> resolve(Map<String, Object> params, Map<String, Object> variables) {
        Map<String, Object> resolved = new LinkedHashMap<>();
        if (params == null) {
            return resolved;
        }
        params.forEach((key, value) -> resolved.put(key, resolveValue(value, variables)));
        return resolved;
    }

    @SuppressWarnings("unchecked")
    private static Object resolveValue(Object value, Map<String, Object> variables) {
        if (value instanceof String str && isTemplate(str)) {
            return PathUtil.getValue(variables, pathOf(str));
        } else if (value instanceof Map<?, ?> map) {
            return resolve((Map<String, Object>) map, variables);
        } else if (value instanceof List<?> list) {
            List<Object> resolved = new ArrayList<>(list.size());
            list.forEach(item -> resolved.add(resolveValue(item, variables)));
            return resolved;
        }
        return value;
    }

    static boolean isTemplate(String value) {
        return value.startsWith(TEMPLATE_START)
                && value.endsWith(TEMPLATE_END)
                && value.length() > TEMPLATE_START.length() + TEMPLATE_END.length();
    }

    /**
     * @return the path inside a template, or the value itself when it is a bare path
     */
    static String pathOf(String value) {
        if (!isTemplate(value)) {
            return value.trim();
        }
        return value.substring(TEMPLATE_START.length(), value.length() - TEMPLATE_END.length()).trim();
    }
}
