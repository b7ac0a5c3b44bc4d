package io.cadence.cli;

import io.cadence.core.detached.DetachedTicket;
import java.util.List;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;

@Command(name = "pending", description = "List background tasks that have not fired yet")
public final class PendingCommand implements Callable<Integer> {
    private final CliContext context;

    public PendingCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        try {
            List<DetachedTicket> tickets = context.detachedScheduler().pending();
            if (tickets.isEmpty()) {
                System.out.println("No pending tasks");
                return 0;
            }
            for (DetachedTicket ticket : tickets) {
                System.out.println(ticket.id() + " | " + context.format(ticket.fireAt()) + " | " + ticket.command());
            }
            return 0;
        } catch (Exception e) {
            System.err.println("Pending failed: " + e.getMessage());
            return 1;
        }
    }
}
