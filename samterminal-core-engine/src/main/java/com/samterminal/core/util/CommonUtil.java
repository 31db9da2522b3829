package com.samterminal.core.util;

public final class CommonUtil {

    private CommonUtil() {
    }

    public static boolean isNullOrBlank(final String str) {
        return str == null || str.trim().isEmpty();
    }
}
