package com.samterminal.core.exception.plugin;

import lombok.Data;

@Data
public class SamTerminalPluginAlreadyRegistered extends RuntimeException {
    private final String pluginName;
    private final String existingVersion;
    private final String newVersion;

    public SamTerminalPluginAlreadyRegistered(String pluginName, String existingVersion, String newVersion) {
        super("Plugin already registered. " +
                "Name: [" + pluginName + "], " +
                "Existing version: [" + existingVersion + "], " +
                "New version: [" + newVersion + "]"
        );
        this.pluginName = pluginName;
        this.existingVersion = existingVersion;
        this.newVersion = newVersion;
    }
}
