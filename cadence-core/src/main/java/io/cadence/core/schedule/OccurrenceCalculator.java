package io.cadence.core.schedule;

import java.time.DayOfWeek;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.YearMonth;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.temporal.ChronoUnit;
import java.util.Objects;

/**
 * Computes the next firing instant of a {@link Cadence}. Wall-clock fields are interpreted in the
 * zone given at construction.
 *
 * <p>Monthly cadences whose day does not exist in the target month fall on that month's last day.
 * The clamp is applied per month, so a day-31 job fires on April 30 and then on May 31.
 */
public final class OccurrenceCalculator {
    private final ZoneId zone;

    public OccurrenceCalculator(ZoneId zone) {
        this.zone = Objects.requireNonNull(zone, "zone must not be null");
    }

    public ZoneId zone() {
        return zone;
    }

    public Instant nextOccurrence(Cadence cadence, Instant now) {
        Objects.requireNonNull(cadence, "cadence must not be null");
        Objects.requireNonNull(now, "now must not be null");
        cadence.validate();

        ZonedDateTime current = now.atZone(zone);
        return switch (cadence.frequency()) {
            case ONCE -> at(cadence.date(), cadence.time());
            case HOURLY -> current.truncatedTo(ChronoUnit.HOURS).plusHours(1).toInstant();
            case DAILY -> daily(current, cadence.time());
            case WEEKLY -> weekly(current, cadence.weekday(), cadence.time());
            case MONTHLY -> monthly(current, cadence.dayOfMonth(), cadence.time());
        };
    }

    private Instant daily(ZonedDateTime current, LocalTime time) {
        LocalDate today = current.toLocalDate();
        Instant candidate = at(today, time);
        if (!candidate.isAfter(current.toInstant())) {
            candidate = at(today.plusDays(1), time);
        }
        return candidate;
    }

    private Instant weekly(ZonedDateTime current, DayOfWeek weekday, LocalTime time) {
        LocalDate today = current.toLocalDate();
        int daysAhead = Math.floorMod(weekday.getValue() - today.getDayOfWeek().getValue(), 7);
        LocalDate target = today.plusDays(daysAhead);
        Instant candidate = at(target, time);
        if (!candidate.isAfter(current.toInstant())) {
            candidate = at(target.plusDays(7), time);
        }
        return candidate;
    }

    private Instant monthly(ZonedDateTime current, int dayOfMonth, LocalTime time) {
        YearMonth month = YearMonth.from(current);
        Instant candidate = at(clamp(month, dayOfMonth), time);
        if (!candidate.isAfter(current.toInstant())) {
            candidate = at(clamp(month.plusMonths(1), dayOfMonth), time);
        }
        return candidate;
    }

    private static LocalDate clamp(YearMonth month, int dayOfMonth) {
        return month.atDay(Math.min(dayOfMonth, month.lengthOfMonth()));
    }

    private Instant at(LocalDate date, LocalTime time) {
        return ZonedDateTime.of(date, time, zone).toInstant();
    }
}
