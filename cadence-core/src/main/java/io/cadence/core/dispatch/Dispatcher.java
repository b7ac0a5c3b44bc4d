package io.cadence.core.dispatch;

import io.cadence.core.job.ContextValue;
import java.util.Map;

/**
 * Runs a job's command and reports how it ended. Implementations never retry.
 */
@FunctionalInterface
public interface Dispatcher {
    ExitStatus execute(String command, Map<String, ContextValue> context);
}
