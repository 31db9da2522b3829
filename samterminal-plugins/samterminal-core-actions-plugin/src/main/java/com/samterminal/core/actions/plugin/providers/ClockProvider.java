package com.samterminal.core.actions.plugin.providers;

import com.samterminal.integration.models.providers.SamTerminalProviderDefinition;
import com.samterminal.integration.models.providers.SamTerminalProviderOutput;
import reactor.core.publisher.Mono;

import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.Map;

public class ClockProvider {

    public static SamTerminalProviderDefinition.BuildStep build(SamTerminalProviderDefinition.InitialStepBuilder providerBuilder) {
        return providerBuilder
                .name("clock")
                .description("Current time, optionally in the zone given by query.zone")
                .get(context -> Mono.fromCallable(() -> {
                    Object zone = context.getQuery().get("zone");
                    ZoneId zoneId = zone == null ? ZoneId.of("UTC") : ZoneId.of(zone.toString());
                    ZonedDateTime now = ZonedDateTime.now(zoneId);
                    return SamTerminalProviderOutput.ofData(Map.of(
                            "epochMillis", now.toInstant().toEpochMilli(),
                            "iso", now.toString(),
                            "zone", zoneId.getId()));
                }));
    }
}
