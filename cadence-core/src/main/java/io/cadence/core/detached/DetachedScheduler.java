package io.cadence.core.detached;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.cadence.core.ValidationException;
import io.cadence.core.dispatch.DispatchSettings;
import io.cadence.core.time.ParsedTime;
import io.cadence.core.time.TimeExpressionParser;
import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Schedules a single command to run after a delay in a background JVM that outlives the caller.
 *
 * <p>Each task is a JSON ticket in the spool directory plus a process running
 * {@link DetachedTaskMain} on it. The process deletes the ticket when it fires; deleting the ticket
 * beforehand through {@link #cancel(String)} makes it exit without running the command.
 */
public final class DetachedScheduler {
    private static final Logger LOG = LoggerFactory.getLogger(DetachedScheduler.class);
    private static final String TICKET_SUFFIX = ".json";

    private final Path spoolDir;
    private final List<String> javaLauncher;
    private final DispatchSettings dispatch;
    private final ProcessLauncher launcher;
    private final TimeExpressionParser parser;
    private final Clock clock;
    private final ObjectMapper mapper;

    /**
     * @param javaLauncher command prefix that starts a JVM, e.g. {@code [setsid, /usr/bin/java]}
     */
    public DetachedScheduler(
        Path spoolDir,
        List<String> javaLauncher,
        DispatchSettings dispatch,
        ProcessLauncher launcher,
        TimeExpressionParser parser,
        Clock clock
    ) {
        this.spoolDir = Objects.requireNonNull(spoolDir, "spoolDir must not be null");
        this.javaLauncher = List.copyOf(javaLauncher);
        this.dispatch = Objects.requireNonNull(dispatch, "dispatch must not be null");
        this.launcher = Objects.requireNonNull(launcher, "launcher must not be null");
        this.parser = Objects.requireNonNull(parser, "parser must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.mapper = ticketMapper();
    }

    public DetachedHandle schedule(String command, String when) throws IOException {
        Instant now = clock.instant();
        ParsedTime parsed = parser.parse(when, now);
        return launch(command, now, parsed.fireAt(now));
    }

    public DetachedHandle scheduleOnce(String command, Duration delay) throws IOException {
        Objects.requireNonNull(delay, "delay must not be null");
        if (delay.isNegative()) {
            throw new ValidationException("delay must not be negative: " + delay);
        }
        Instant now = clock.instant();
        return launch(command, now, now.plus(delay));
    }

    public List<DetachedTicket> pending() throws IOException {
        if (!Files.isDirectory(spoolDir)) {
            return List.of();
        }
        List<DetachedTicket> tickets = new ArrayList<>();
        try (DirectoryStream<Path> files = Files.newDirectoryStream(spoolDir, "*" + TICKET_SUFFIX)) {
            for (Path file : files) {
                try {
                    tickets.add(mapper.readValue(Files.readString(file), DetachedTicket.class));
                } catch (IOException e) {
                    LOG.warn("Skipping unreadable ticket {}: {}", file, e.getMessage());
                }
            }
        }
        tickets.sort(Comparator.comparing(DetachedTicket::fireAt));
        return tickets;
    }

    public boolean cancel(String ticketId) throws IOException {
        boolean cancelled = Files.deleteIfExists(ticketPath(ticketId));
        if (cancelled) {
            LOG.info("Cancelled detached task {}", ticketId);
        }
        return cancelled;
    }

    public Path ticketPath(String ticketId) {
        if (ticketId == null || !ticketId.matches("[A-Za-z0-9-]+")) {
            throw new ValidationException("invalid ticket id: " + ticketId);
        }
        return spoolDir.resolve(ticketId + TICKET_SUFFIX);
    }

    private DetachedHandle launch(String command, Instant now, Instant fireAt) throws IOException {
        if (command == null || command.isBlank()) {
            throw new ValidationException("command is required");
        }
        DetachedTicket ticket = new DetachedTicket(UUID.randomUUID().toString(), command, now, fireAt, dispatch);
        Path path = writeTicket(ticket);

        List<String> argv = new ArrayList<>(javaLauncher);
        argv.add("-cp");
        argv.add(System.getProperty("java.class.path"));
        argv.add(DetachedTaskMain.class.getName());
        argv.add(path.toString());

        long pid;
        try {
            pid = launcher.launch(argv);
        } catch (IOException e) {
            Files.deleteIfExists(path);
            throw e;
        }
        LOG.info("Detached task {} scheduled for {} (pid {}, in {}s)",
            ticket.id(), fireAt, pid, Duration.between(now, fireAt).toSeconds());
        return new DetachedHandle(ticket.id(), fireAt, pid, path);
    }

    private Path writeTicket(DetachedTicket ticket) throws IOException {
        Files.createDirectories(spoolDir);
        Path path = ticketPath(ticket.id());
        Path tmp = path.resolveSibling(ticket.id() + ".tmp");
        Files.writeString(tmp, mapper.writerWithDefaultPrettyPrinter().writeValueAsString(ticket) + System.lineSeparator());
        Files.move(tmp, path, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        return path;
    }

    static ObjectMapper ticketMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        return mapper;
    }
}
