package at.sv.edo.temporal;

import java.time.Duration;
import java.time.Instant;

/**
 * One of the twelve unequal hours: the koku (1-6, counted from dawn or dusk) of a period and its interval
 * [start, end).
 */
public record TemporalTime(Period period, int koku, Instant start, Instant end) {

    public KokuName kokuName() {
        return KokuName.of(period, koku);
    }

    public Duration duration() {
        return Duration.between(start, end);
    }

    public boolean contains(Instant instant) {
        return !instant.isBefore(start) && instant.isBefore(end);
    }

    @Override
    public String toString() {
        return period + " " + koku + " [" + start + ", " + end + ")";
    }
}
