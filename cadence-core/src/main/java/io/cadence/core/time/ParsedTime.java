package io.cadence.core.time;

import java.time.Duration;
import java.time.Instant;

/**
 * Result of {@link TimeExpressionParser#parse}: either a delay relative to the parse instant or an
 * absolute wall-clock instant.
 */
public interface ParsedTime {

    Instant fireAt(Instant now);

    default Duration delayFrom(Instant now) {
        Duration delay = Duration.between(now, fireAt(now));
        return delay.isNegative() ? Duration.ZERO : delay;
    }

    record RelativeDelay(Duration delay) implements ParsedTime {
        @Override
        public Instant fireAt(Instant now) {
            return now.plus(delay);
        }
    }

    record AbsoluteTime(Instant instant) implements ParsedTime {
        @Override
        public Instant fireAt(Instant now) {
            return instant;
        }
    }
}
