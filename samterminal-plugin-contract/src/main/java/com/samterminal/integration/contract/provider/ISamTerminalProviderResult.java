package com.samterminal.integration.contract.provider;

import java.time.Instant;

public interface ISamTerminalProviderResult {
    boolean isSuccess();
    Object getData();
    String getError();
    Instant getTimestamp();
}
