package io.cadence.cli;

import io.cadence.core.engine.RunOutcome;
import java.util.List;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;

@Command(name = "due", description = "Run every job whose next run has passed")
public final class DueCommand implements Callable<Integer> {
    private final CliContext context;

    public DueCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        try {
            List<RunOutcome> outcomes = context.engine().runDue();
            if (outcomes.isEmpty()) {
                System.out.println("No due jobs");
                return 0;
            }
            System.out.println("Executed " + outcomes.size() + " jobs");
            outcomes.forEach(outcome -> System.out.println(Outcomes.describe(outcome, context)));
            return outcomes.stream().allMatch(RunOutcome::success) ? 0 : 1;
        } catch (Exception e) {
            System.err.println("Due check failed: " + e.getMessage());
            return 1;
        }
    }
}
