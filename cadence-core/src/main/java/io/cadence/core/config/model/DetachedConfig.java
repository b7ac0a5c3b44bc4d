package io.cadence.core.config.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Settings of the detached one-shot scheduler. {@code launchPrefix} is prepended to the JVM command
 * line, e.g. {@code ["setsid"]} to leave the terminal's session; a blank {@code javaCommand} uses
 * the running JVM's binary.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record DetachedConfig(String spoolDir, String javaCommand, List<String> launchPrefix) {

    public DetachedConfig {
        launchPrefix = launchPrefix == null ? List.of() : List.copyOf(launchPrefix);
    }

    public static DetachedConfig defaults() {
        return new DetachedConfig("~/.cadence/detached", "", List.of());
    }

    public List<String> javaLauncher() {
        List<String> launcher = new ArrayList<>(launchPrefix);
        if (javaCommand == null || javaCommand.isBlank()) {
            launcher.add(Path.of(System.getProperty("java.home"), "bin", "java").toString());
        } else {
            launcher.add(javaCommand);
        }
        return launcher;
    }
}
