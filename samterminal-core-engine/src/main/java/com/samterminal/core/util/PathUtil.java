package com.samterminal.core.util;

import java.util.Map;

/**
 * Dotted path lookup into nested maps, {@code "_lastOutput.price"}.
 */
public final class PathUtil {

    private PathUtil() {
    }

    /**
     * @return the value at the path, or {@code null} when any segment is absent or not a map
     */
    public static Object getValue(Map<String, ?> root, String path) {
        if (root == null || CommonUtil.isNullOrBlank(path)) {
            return null;
        }
        // exact keys win, so "a.b" may also be stored flat
        if (root.containsKey(path)) {
            return root.get(path);
        }

        Object current = root;
        for (String segment : path.split("\\.")) {
            if (!(current instanceof Map<?, ?> map)) {
                return null;
            }
            current = map.get(segment);
            if (current == null) {
                return null;
            }
        }
        return current;
    }
}
