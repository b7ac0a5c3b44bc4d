package io.cadence.core.schedule;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.cadence.core.ValidationException;
import java.time.DayOfWeek;
import org.junit.jupiter.api.Test;

class WeekdaysTest {

    @Test
    void numbersCountFromSunday() {
        assertThat(Weekdays.parse("0")).isEqualTo(DayOfWeek.SUNDAY);
        assertThat(Weekdays.parse("1")).isEqualTo(DayOfWeek.MONDAY);
        assertThat(Weekdays.parse("6")).isEqualTo(DayOfWeek.SATURDAY);
        assertThat(Weekdays.parse("7")).isEqualTo(DayOfWeek.SUNDAY);
        assertThat(Weekdays.toSundayIndex(DayOfWeek.SUNDAY)).isZero();
        assertThat(Weekdays.toSundayIndex(DayOfWeek.SATURDAY)).isEqualTo(6);
    }

    @Test
    void acceptsFullAndShortNames() {
        assertThat(Weekdays.parse("Monday")).isEqualTo(DayOfWeek.MONDAY);
        assertThat(Weekdays.parse("thu")).isEqualTo(DayOfWeek.THURSDAY);
    }

    @Test
    void rejectsUnknownValues() {
        assertThatThrownBy(() -> Weekdays.parse("8")).isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> Weekdays.parse("mo")).isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> Weekdays.parse("someday")).isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> Weekdays.parse("99999999999"))
            .isInstanceOf(ValidationException.class)
            .hasMessageContaining("unknown weekday");
    }
}
