package io.cadence.core.detached;

import java.io.IOException;
import java.util.List;

/**
 * Starts a process that is not waited for and returns its pid.
 */
@FunctionalInterface
public interface ProcessLauncher {
    long launch(List<String> command) throws IOException;

    static ProcessLauncher background() {
        return command -> new ProcessBuilder(command)
            .redirectOutput(ProcessBuilder.Redirect.DISCARD)
            .redirectError(ProcessBuilder.Redirect.DISCARD)
            .start()
            .pid();
    }
}
