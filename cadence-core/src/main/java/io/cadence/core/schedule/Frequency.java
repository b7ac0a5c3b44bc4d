package io.cadence.core.schedule;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import io.cadence.core.ValidationException;
import java.util.Locale;

public enum Frequency {
    ONCE,
    HOURLY,
    DAILY,
    WEEKLY,
    MONTHLY;

    @JsonValue
    public String id() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static Frequency from(String value) {
        if (value == null || value.isBlank()) {
            throw new ValidationException("frequency is required");
        }
        String normalized = value.trim().toUpperCase(Locale.ROOT);
        for (Frequency frequency : values()) {
            if (frequency.name().equals(normalized)) {
                return frequency;
            }
        }
        throw new ValidationException("unsupported frequency: " + value);
    }
}
