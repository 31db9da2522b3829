package com.samterminal.core.models;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class SamTerminalPluginRegistrationOptions {
    public static final SamTerminalPluginRegistrationOptions DEFAULT = SamTerminalPluginRegistrationOptions.builder().build();

    // higher runs first among plugins whose dependencies are equally satisfied
    @Builder.Default
    int priority = 0;
}
