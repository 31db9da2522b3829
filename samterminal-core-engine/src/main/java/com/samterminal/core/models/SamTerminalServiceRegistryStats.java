package com.samterminal.core.models;

public record SamTerminalServiceRegistryStats(int actionCount, int providerCount) {
}
