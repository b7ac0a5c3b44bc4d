package io.cadence.core.detached;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.cadence.core.dispatch.DispatchSettings;
import io.cadence.core.dispatch.Dispatcher;
import io.cadence.core.dispatch.ExitStatus;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Body of the background process: waits for the ticket's fire time, claims the ticket and runs the
 * command once. The returned value is the process exit code.
 */
public final class DetachedTaskRunner {
    private static final Logger LOG = LoggerFactory.getLogger(DetachedTaskRunner.class);

    static final int UNREADABLE_TICKET = 2;

    private final Clock clock;
    private final Sleeper sleeper;
    private final Function<DispatchSettings, Dispatcher> dispatchers;
    private final ObjectMapper mapper = DetachedScheduler.ticketMapper();

    public DetachedTaskRunner(Clock clock, Sleeper sleeper, Function<DispatchSettings, Dispatcher> dispatchers) {
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.sleeper = Objects.requireNonNull(sleeper, "sleeper must not be null");
        this.dispatchers = Objects.requireNonNull(dispatchers, "dispatchers must not be null");
    }

    public int run(Path ticketPath) {
        DetachedTicket ticket;
        try {
            ticket = mapper.readValue(Files.readString(ticketPath), DetachedTicket.class);
        } catch (IOException e) {
            LOG.error("Cannot read ticket {}: {}", ticketPath, e.getMessage());
            return UNREADABLE_TICKET;
        }

        Duration remaining = Duration.between(clock.instant(), ticket.fireAt());
        if (!remaining.isNegative() && !remaining.isZero()) {
            LOG.info("Detached task {} waiting {}s", ticket.id(), remaining.toSeconds());
            try {
                sleeper.sleep(remaining);
            } catch (InterruptedException ie) {
                Thread.currentThread().interrupt();
                LOG.warn("Detached task {} interrupted before firing", ticket.id());
                return 1;
            }
        }

        try {
            Files.delete(ticketPath);
        } catch (NoSuchFileException e) {
            LOG.info("Detached task {} was cancelled", ticket.id());
            return 0;
        } catch (IOException e) {
            LOG.warn("Failed to remove ticket {}: {}", ticketPath, e.getMessage());
        }

        LOG.info("Executing detached task {}", ticket.id());
        DispatchSettings settings = ticket.dispatch() == null ? DispatchSettings.defaults() : ticket.dispatch();
        ExitStatus status = dispatchers.apply(settings).execute(ticket.command(), Map.of());
        LOG.info("Detached task {} completed with code {}", ticket.id(), status.code());
        return status.code() >= 0 ? status.code() : 1;
    }

    @FunctionalInterface
    public interface Sleeper {
        void sleep(Duration duration) throws InterruptedException;
    }
}
