package io.cadence.core.time;

import io.cadence.core.UnparsableExpressionException;
import java.time.DateTimeException;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.Locale;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses "when" expressions such as {@code 10 seconds}, {@code 5 minutes}, {@code 2 hours},
 * {@code now} or {@code 3:30pm}. Units are checked before clock times, first match wins.
 */
public final class TimeExpressionParser {
    private static final Pattern SECONDS = Pattern.compile("(\\d+)\\s*second");
    private static final Pattern MINUTES = Pattern.compile("(\\d+)\\s*minute");
    private static final Pattern HOURS = Pattern.compile("(\\d+)\\s*hour");
    private static final Pattern CLOCK_TIME = Pattern.compile("(\\d{1,2}):(\\d{2})\\s*(am|pm)?");

    private final ZoneId zone;

    public TimeExpressionParser(ZoneId zone) {
        this.zone = Objects.requireNonNull(zone, "zone must not be null");
    }

    public ParsedTime parse(String expression, Instant now) {
        if (expression == null || expression.isBlank()) {
            throw new UnparsableExpressionException(String.valueOf(expression));
        }
        String normalized = expression.trim().toLowerCase(Locale.ROOT);

        if (normalized.contains("second")) {
            return new ParsedTime.RelativeDelay(Duration.ofSeconds(count(SECONDS, normalized, expression)));
        }
        if (normalized.contains("minute")) {
            return new ParsedTime.RelativeDelay(Duration.ofMinutes(count(MINUTES, normalized, expression)));
        }
        if (normalized.contains("hour")) {
            return new ParsedTime.RelativeDelay(Duration.ofHours(count(HOURS, normalized, expression)));
        }
        if (normalized.equals("now")) {
            return new ParsedTime.RelativeDelay(Duration.ZERO);
        }

        Matcher clock = CLOCK_TIME.matcher(normalized);
        if (clock.find()) {
            return new ParsedTime.AbsoluteTime(nextWallClock(clock, now, expression));
        }
        throw new UnparsableExpressionException(expression);
    }

    private Instant nextWallClock(Matcher clock, Instant now, String expression) {
        int hour = Integer.parseInt(clock.group(1));
        int minute = Integer.parseInt(clock.group(2));
        String meridiem = clock.group(3);
        if (meridiem != null) {
            if (hour < 1 || hour > 12) {
                throw new UnparsableExpressionException(expression);
            }
            if ("pm".equals(meridiem) && hour < 12) {
                hour += 12;
            } else if ("am".equals(meridiem) && hour == 12) {
                hour = 0;
            }
        }

        LocalTime time;
        try {
            time = LocalTime.of(hour, minute);
        } catch (DateTimeException e) {
            throw new UnparsableExpressionException(expression);
        }

        ZonedDateTime current = now.atZone(zone);
        ZonedDateTime target = ZonedDateTime.of(current.toLocalDate(), time, zone);
        if (!target.toInstant().isAfter(now)) {
            target = ZonedDateTime.of(current.toLocalDate().plusDays(1), time, zone);
        }
        return target.toInstant();
    }

    // "a second" or "minutes" without a count means one unit
    private static long count(Pattern pattern, String normalized, String expression) {
        Matcher matcher = pattern.matcher(normalized);
        if (!matcher.find()) {
            return 1L;
        }
        try {
            return Integer.parseInt(matcher.group(1));
        } catch (NumberFormatException e) {
            throw new UnparsableExpressionException(expression);
        }
    }
}
