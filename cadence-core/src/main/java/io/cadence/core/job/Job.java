package io.cadence.core.job;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import io.cadence.core.schedule.Cadence;
import io.cadence.core.schedule.Frequency;
import java.time.DayOfWeek;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.temporal.ChronoUnit;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

@JsonIgnoreProperties(ignoreUnknown = true)
public record Job(
    String id,
    String name,
    String command,
    Frequency frequency,
    @JsonFormat(pattern = "HH:mm") LocalTime time,
    LocalDate date,
    DayOfWeek weekday,
    Integer dayOfMonth,
    Map<String, ContextValue> context,
    Instant createdAt,
    Instant lastRun,
    Instant nextRun,
    boolean enabled
) {

    public Job {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(frequency, "frequency must not be null");
        time = time == null ? null : time.truncatedTo(ChronoUnit.MINUTES);
        context = context == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(context));
    }

    public static Job create(
        String id,
        String name,
        String command,
        Cadence cadence,
        Map<String, ContextValue> context,
        Instant createdAt,
        Instant nextRun
    ) {
        return new Job(
            id,
            name,
            command,
            cadence.frequency(),
            cadence.time(),
            cadence.date(),
            cadence.weekday(),
            cadence.dayOfMonth(),
            context,
            createdAt,
            null,
            nextRun,
            true
        );
    }

    public Cadence cadence() {
        return new Cadence(frequency, time, date, weekday, dayOfMonth);
    }

    public Job withCompletedRun(Instant ranAt, Instant next) {
        return new Job(id, name, command, frequency, time, date, weekday, dayOfMonth, context, createdAt, ranAt, next, enabled);
    }

    public Job retired(Instant ranAt) {
        return new Job(id, name, command, frequency, time, date, weekday, dayOfMonth, context, createdAt, ranAt, nextRun, false);
    }
}
