package io.cadence.cli;

import io.cadence.core.detached.DetachedHandle;
import java.time.Duration;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

@Command(name = "at", description = "Run a command once after a delay, in the background")
public final class AtCommand implements Callable<Integer> {
    private final CliContext context;

    @Parameters(index = "0", arity = "1", description = "When: \"10 seconds\", \"5 minutes\", \"2 hours\", \"now\", \"3:30pm\"")
    String when;

    @Parameters(index = "1", arity = "1", description = "Command to execute")
    String command;

    public AtCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        try {
            DetachedHandle handle = context.detachedScheduler().schedule(command, when);
            long seconds = Math.max(0, Duration.between(context.clock().instant(), handle.fireAt()).toSeconds());
            System.out.println("Task scheduled for: " + context.format(handle.fireAt()));
            System.out.println("Will execute in " + seconds + " seconds");
            System.out.println("Background scheduler started (PID: " + handle.pid() + ", ticket: " + handle.ticketId() + ")");
            return 0;
        } catch (Exception e) {
            System.err.println("At failed: " + e.getMessage());
            return 1;
        }
    }
}
