package io.cadence.cli;

import io.cadence.core.detached.DetachedScheduler;
import io.cadence.core.engine.SchedulerEngine;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;

public record CliContext(
    SchedulerEngine engine,
    DetachedScheduler detachedScheduler,
    Clock clock,
    ZoneId zone
) {
    private static final DateTimeFormatter DISPLAY = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss z");

    public String format(Instant instant) {
        return instant == null ? "-" : DISPLAY.format(instant.atZone(zone));
    }
}
