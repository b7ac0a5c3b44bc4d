package io.cadence.core.detached;

import io.cadence.core.dispatch.DispatchSettings;
import java.nio.file.Path;
import java.time.Clock;

/**
 * Entry point of the background JVM started by {@link DetachedScheduler}. Takes the ticket path as
 * its only argument.
 */
public final class DetachedTaskMain {

    private DetachedTaskMain() {
    }

    public static void main(String[] args) {
        if (args.length != 1) {
            System.err.println("usage: DetachedTaskMain <ticket>");
            System.exit(DetachedTaskRunner.UNREADABLE_TICKET);
        }
        DetachedTaskRunner runner = new DetachedTaskRunner(
            Clock.systemUTC(),
            duration -> Thread.sleep(duration.toMillis()),
            DispatchSettings::toDispatcher
        );
        System.exit(runner.run(Path.of(args[0])));
    }
}
