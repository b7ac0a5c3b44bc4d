package io.cadence.cli;

import io.cadence.core.job.Job;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

@Command(name = "remove", description = "Remove a job")
public final class RemoveCommand implements Callable<Integer> {
    private final CliContext context;

    @Parameters(index = "0", arity = "1", description = "Job id")
    String id;

    public RemoveCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        try {
            Job removed = context.engine().remove(id);
            System.out.println("Removed: " + removed.id() + " (" + removed.name() + ")");
            return 0;
        } catch (Exception e) {
            System.err.println("Remove failed: " + e.getMessage());
            return 1;
        }
    }
}
