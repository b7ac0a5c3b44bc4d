package io.cadence.cli;

import java.util.concurrent.Callable;
import picocli.CommandLine.Command;

@Command(name = "clear", description = "Remove all jobs")
public final class ClearCommand implements Callable<Integer> {
    private final CliContext context;

    public ClearCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        try {
            int count = context.engine().list().size();
            context.engine().clear();
            System.out.println("Cleared " + count + " jobs");
            return 0;
        } catch (Exception e) {
            System.err.println("Clear failed: " + e.getMessage());
            return 1;
        }
    }
}
