package at.sv.edo.calendar;

import java.time.Duration;
import java.time.Instant;

import static at.sv.edo.astronomy.AstronomyUtil.MILLIS_PER_DAY;

/**
 * Moon age as the days elapsed since the latest tabulated new moon. Valid from the first tabulated new moon up to one
 * synodic month after the last one.
 */
public final class MoonAgeCalculator {

    /**
     * Mean synodic month in days.
     */
    public static final double SYNODIC_MONTH = 29.530588;

    private final NewMoonTable newMoonTable;

    public MoonAgeCalculator(NewMoonTable newMoonTable) {
        this.newMoonTable = newMoonTable;
    }

    public MoonAgeResult calculate(Instant instant) {
        if (newMoonTable.isEmpty()) {
            return MoonAgeResult.failed("No new moon data loaded");
        }
        Instant first = newMoonTable.first();
        if (instant.isBefore(first)) {
            return MoonAgeResult.failed("Instant " + instant + " is before the new moon data, which starts at " + first);
        }
        Instant limit = newMoonTable.last().plusMillis(Math.round(SYNODIC_MONTH * MILLIS_PER_DAY));
        if (instant.isAfter(limit)) {
            return MoonAgeResult.failed("Instant " + instant + " is after the new moon data, which covers up to " + limit);
        }
        Instant newMoon = newMoonTable.get(newMoonTable.indexOfLatestNotAfter(instant));
        double days = Duration.between(newMoon, instant).toMillis() / MILLIS_PER_DAY;
        double age = days % SYNODIC_MONTH;
        if (age < 0) {
            age += SYNODIC_MONTH;
        }
        return MoonAgeResult.of(age);
    }
}
