package com.samterminal.core.util;

import java.util.Optional;

public class CastUtil {

    private CastUtil() {}

    /**
     * @return the value as a double when it is a number, empty for anything else including numeric strings
     */
    public static Optional<Double> asNumber(Object e) {
        if (e instanceof Number number) {
            return Optional.of(number.doubleValue());
        }
        return Optional.empty();
    }
}
