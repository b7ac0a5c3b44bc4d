package io.cadence.cli;

import io.cadence.core.ValidationException;
import io.cadence.core.engine.ScheduleRequest;
import io.cadence.core.job.ContextValue;
import io.cadence.core.job.Job;
import io.cadence.core.schedule.Cadence;
import io.cadence.core.schedule.Frequency;
import io.cadence.core.schedule.Weekdays;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.format.DateTimeParseException;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

@Command(name = "schedule", description = "Schedule a recurring or one-off job")
public final class ScheduleCommand implements Callable<Integer> {
    private final CliContext context;

    @Option(names = {"-n", "--name"}, required = true, description = "Job name")
    String name;

    @Option(names = {"-c", "--command"}, required = true, description = "Command to execute")
    String command;

    @Option(names = {"-f", "--frequency"}, required = true, description = "once, hourly, daily, weekly or monthly")
    String frequency;

    @Option(names = {"-t", "--time"}, description = "Time of day, HH:MM")
    String time;

    @Option(names = {"-d", "--date"}, description = "Date for one-off jobs, YYYY-MM-DD")
    String date;

    @Option(names = {"-w", "--weekday"}, description = "Weekday for weekly jobs: name or 0-6 (0 = Sunday)")
    String weekday;

    @Option(names = {"--day-of-month"}, description = "Day of month for monthly jobs, 1-31")
    Integer dayOfMonth;

    @Option(names = {"-x", "--context"}, description = "Context binding exposed to the command, key=value")
    Map<String, String> contextValues = new LinkedHashMap<>();

    public ScheduleCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        try {
            Cadence cadence = new Cadence(
                Frequency.from(frequency),
                time == null ? null : parseTime(time),
                date == null ? null : parseDate(date),
                weekday == null ? null : Weekdays.parse(weekday),
                dayOfMonth
            );
            Map<String, ContextValue> bindings = new LinkedHashMap<>();
            contextValues.forEach((key, value) -> bindings.put(key, ContextValue.parse(value)));

            Job job = context.engine().schedule(new ScheduleRequest(name, command, cadence, bindings));
            System.out.println("Scheduled job: " + job.id());
            System.out.println("Next run: " + context.format(job.nextRun()));
            return 0;
        } catch (Exception e) {
            System.err.println("Schedule failed: " + e.getMessage());
            return 1;
        }
    }

    private static LocalTime parseTime(String value) {
        try {
            return LocalTime.parse(value.trim());
        } catch (DateTimeParseException e) {
            throw new ValidationException("invalid time, expected HH:MM: " + value);
        }
    }

    private static LocalDate parseDate(String value) {
        try {
            return LocalDate.parse(value.trim());
        } catch (DateTimeParseException e) {
            throw new ValidationException("invalid date, expected YYYY-MM-DD: " + value);
        }
    }
}
