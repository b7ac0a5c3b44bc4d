package io.cadence.core.schedule;

import io.cadence.core.ValidationException;
import java.time.DayOfWeek;
import java.util.Locale;

/**
 * Weekday input conversion. Numbers use 0=Sunday .. 6=Saturday, with 7 also accepted as Sunday.
 */
public final class Weekdays {

    private Weekdays() {
    }

    public static DayOfWeek parse(String value) {
        if (value == null || value.isBlank()) {
            throw new ValidationException("weekday is required");
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        if (normalized.chars().allMatch(Character::isDigit)) {
            if (normalized.length() > 1) {
                throw new ValidationException("unknown weekday: " + value);
            }
            return fromSundayIndex(Integer.parseInt(normalized));
        }
        for (DayOfWeek day : DayOfWeek.values()) {
            String name = day.name().toLowerCase(Locale.ROOT);
            if (name.equals(normalized) || (normalized.length() >= 3 && name.startsWith(normalized))) {
                return day;
            }
        }
        throw new ValidationException("unknown weekday: " + value);
    }

    public static DayOfWeek fromSundayIndex(int index) {
        if (index < 0 || index > 7) {
            throw new ValidationException("weekday must be between 0 (Sunday) and 6 (Saturday): " + index);
        }
        return index == 0 || index == 7 ? DayOfWeek.SUNDAY : DayOfWeek.of(index);
    }

    public static int toSundayIndex(DayOfWeek day) {
        return day.getValue() % 7;
    }
}
