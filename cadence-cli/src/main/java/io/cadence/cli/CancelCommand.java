package io.cadence.cli;

import java.util.concurrent.Callable;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

@Command(name = "cancel", description = "Cancel a pending background task")
public final class CancelCommand implements Callable<Integer> {
    private final CliContext context;

    @Parameters(index = "0", arity = "1", description = "Ticket id")
    String ticketId;

    public CancelCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        try {
            if (context.detachedScheduler().cancel(ticketId)) {
                System.out.println("Cancelled: " + ticketId);
                return 0;
            }
            System.out.println("Not found: " + ticketId);
            return 1;
        } catch (Exception e) {
            System.err.println("Cancel failed: " + e.getMessage());
            return 1;
        }
    }
}
