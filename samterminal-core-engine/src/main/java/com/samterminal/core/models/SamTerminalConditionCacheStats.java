package com.samterminal.core.models;

import java.time.Instant;

/**
 * @param oldestEntry timestamp of the oldest cached observation, {@code null} when the cache is empty
 */
public record SamTerminalConditionCacheStats(int size, Instant oldestEntry) {
}
