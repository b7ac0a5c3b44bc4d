package io.cadence.core.engine;

import io.cadence.core.job.ContextValue;
import io.cadence.core.schedule.Cadence;
import java.util.Map;

public record ScheduleRequest(
    String name,
    String command,
    Cadence cadence,
    Map<String, ContextValue> context
) {

    public ScheduleRequest(String name, String command, Cadence cadence) {
        this(name, command, cadence, Map.of());
    }
}
