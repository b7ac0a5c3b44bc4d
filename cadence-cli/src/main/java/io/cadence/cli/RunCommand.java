package io.cadence.cli;

import io.cadence.core.engine.RunOutcome;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

@Command(name = "run", description = "Run a job now")
public final class RunCommand implements Callable<Integer> {
    private final CliContext context;

    @Parameters(index = "0", arity = "1", description = "Job id")
    String id;

    public RunCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        try {
            RunOutcome outcome = context.engine().run(id);
            System.out.println(Outcomes.describe(outcome, context));
            return outcome.success() ? 0 : 1;
        } catch (Exception e) {
            System.err.println("Run failed: " + e.getMessage());
            return 1;
        }
    }
}
