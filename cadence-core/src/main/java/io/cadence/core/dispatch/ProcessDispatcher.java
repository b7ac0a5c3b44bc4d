package io.cadence.core.dispatch;

import io.cadence.core.job.ContextValue;
import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Launches the command through a shell with the caller's standard streams. Context entries are
 * exported as environment variables named {@code <prefix><KEY>}, with the key upper-cased and any
 * character outside {@code [A-Z0-9_]} replaced by an underscore.
 */
public final class ProcessDispatcher implements Dispatcher {
    private static final Logger LOG = LoggerFactory.getLogger(ProcessDispatcher.class);

    private final List<String> shell;
    private final String envPrefix;
    private final Duration timeout;

    /**
     * @param timeout maximum run time, or {@code null} / zero to wait indefinitely
     */
    public ProcessDispatcher(List<String> shell, String envPrefix, Duration timeout) {
        if (shell == null || shell.isEmpty()) {
            throw new IllegalArgumentException("shell must not be empty");
        }
        this.shell = List.copyOf(shell);
        this.envPrefix = envPrefix == null ? "" : envPrefix;
        this.timeout = timeout == null || timeout.isZero() || timeout.isNegative() ? null : timeout;
    }

    @Override
    public ExitStatus execute(String command, Map<String, ContextValue> context) {
        Objects.requireNonNull(command, "command must not be null");
        List<String> argv = new ArrayList<>(shell);
        argv.add(command);

        ProcessBuilder builder = new ProcessBuilder(argv).inheritIO();
        builder.environment().putAll(environmentOverlay(context));

        try {
            LOG.debug("Dispatching: {}", command);
            Process process = builder.start();
            if (timeout == null) {
                return ExitStatus.of(process.waitFor());
            }
            if (!process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
                process.destroyForcibly();
                LOG.warn("Command timed out after {}s: {}", timeout.toSeconds(), command);
                return ExitStatus.timedOut(timeout.toSeconds());
            }
            return ExitStatus.of(process.exitValue());
        } catch (IOException e) {
            return ExitStatus.launchFailed(e.getMessage());
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            return ExitStatus.launchFailed("interrupted while waiting for command");
        }
    }

    public Map<String, String> environmentOverlay(Map<String, ContextValue> context) {
        Map<String, String> overlay = new LinkedHashMap<>();
        if (context == null) {
            return overlay;
        }
        context.forEach((key, value) -> overlay.put(variableName(key), value.asString()));
        return overlay;
    }

    public String variableName(String key) {
        return envPrefix + key.toUpperCase(Locale.ROOT).replaceAll("[^A-Z0-9_]", "_");
    }
}
