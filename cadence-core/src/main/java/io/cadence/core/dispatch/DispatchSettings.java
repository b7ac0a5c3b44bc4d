package io.cadence.core.dispatch;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.time.Duration;
import java.util.List;

/**
 * How commands are launched: the shell prefix, the environment prefix for context keys and an
 * optional timeout in seconds ({@code 0} waits indefinitely).
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record DispatchSettings(List<String> shell, String envPrefix, long timeoutSeconds) {

    public DispatchSettings {
        shell = shell == null || shell.isEmpty() ? List.of("/bin/sh", "-c") : List.copyOf(shell);
        envPrefix = envPrefix == null ? "CADENCE_" : envPrefix;
        timeoutSeconds = Math.max(0, timeoutSeconds);
    }

    public static DispatchSettings defaults() {
        return new DispatchSettings(List.of("/bin/sh", "-c"), "CADENCE_", 0);
    }

    public ProcessDispatcher toDispatcher() {
        return new ProcessDispatcher(shell, envPrefix, Duration.ofSeconds(timeoutSeconds));
    }
}
