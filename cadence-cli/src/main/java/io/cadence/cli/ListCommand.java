package io.cadence.cli;

import io.cadence.core.job.Job;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;

@Command(name = "list", description = "List scheduled jobs")
public final class ListCommand implements Callable<Integer> {
    private final CliContext context;

    public ListCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        try {
            List<Job> jobs = context.engine().list();
            if (jobs.isEmpty()) {
                System.out.println("No jobs");
                return 0;
            }
            for (Job job : jobs) {
                System.out.println(job.id()
                    + " | " + job.name()
                    + " | " + job.cadence().describe()
                    + " | next " + context.format(job.nextRun())
                    + " | last " + context.format(job.lastRun())
                    + " | " + context.engine().state(job).name().toLowerCase(Locale.ROOT));
            }
            return 0;
        } catch (Exception e) {
            System.err.println("List failed: " + e.getMessage());
            return 1;
        }
    }
}
