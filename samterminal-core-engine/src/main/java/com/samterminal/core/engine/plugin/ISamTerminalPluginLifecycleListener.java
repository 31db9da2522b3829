package com.samterminal.core.engine.plugin;

import com.samterminal.integration.contract.ISamTerminalPlugin;
import com.samterminal.integration.enumerations.SamTerminalLifecycleEvent;

@FunctionalInterface
public interface ISamTerminalPluginLifecycleListener {
    /**
     * @param error set for {@link SamTerminalLifecycleEvent#ERROR} only
     */
    void onEvent(SamTerminalLifecycleEvent event, ISamTerminalPlugin plugin, Throwable error);
}
