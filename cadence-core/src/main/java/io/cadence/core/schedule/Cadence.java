package io.cadence.core.schedule;

import io.cadence.core.ValidationException;
import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.temporal.ChronoUnit;
import java.util.Locale;
import java.util.Objects;

/**
 * Recurrence rule of a job. Only the fields required by {@link #frequency()} are meaningful;
 * {@link #validate()} checks that they are present.
 */
public record Cadence(
    Frequency frequency,
    LocalTime time,
    LocalDate date,
    DayOfWeek weekday,
    Integer dayOfMonth
) {

    public Cadence {
        Objects.requireNonNull(frequency, "frequency must not be null");
        time = time == null ? null : time.truncatedTo(ChronoUnit.MINUTES);
    }

    public static Cadence once(LocalDate date, LocalTime time) {
        return new Cadence(Frequency.ONCE, time, date, null, null);
    }

    public static Cadence hourly() {
        return new Cadence(Frequency.HOURLY, null, null, null, null);
    }

    public static Cadence daily(LocalTime time) {
        return new Cadence(Frequency.DAILY, time, null, null, null);
    }

    public static Cadence weekly(DayOfWeek weekday, LocalTime time) {
        return new Cadence(Frequency.WEEKLY, time, null, weekday, null);
    }

    public static Cadence monthly(int dayOfMonth, LocalTime time) {
        return new Cadence(Frequency.MONTHLY, time, null, null, dayOfMonth);
    }

    public Cadence validate() {
        String label = frequency.id();
        switch (frequency) {
            case ONCE -> {
                require(date, label, "date");
                require(time, label, "time");
            }
            case HOURLY -> {
            }
            case DAILY -> require(time, label, "time");
            case WEEKLY -> {
                require(weekday, label, "weekday");
                require(time, label, "time");
            }
            case MONTHLY -> {
                require(dayOfMonth, label, "dayOfMonth");
                require(time, label, "time");
                if (dayOfMonth < 1 || dayOfMonth > 31) {
                    throw new ValidationException("dayOfMonth must be between 1 and 31: " + dayOfMonth);
                }
            }
            default -> throw new ValidationException("unsupported frequency: " + frequency);
        }
        return this;
    }

    public boolean recurring() {
        return frequency != Frequency.ONCE;
    }

    public String describe() {
        return switch (frequency) {
            case ONCE -> "once on " + date + " at " + time;
            case HOURLY -> "hourly";
            case DAILY -> "daily at " + time;
            case WEEKLY -> "weekly on " + weekday.name().toLowerCase(Locale.ROOT) + " at " + time;
            case MONTHLY -> "monthly on day " + dayOfMonth + " at " + time;
        };
    }

    private static void require(Object value, String frequency, String field) {
        if (value == null) {
            throw ValidationException.missingField(frequency, field);
        }
    }
}
