package at.sv.edo.temporal;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Splits the dawn to dusk arc into six day koku and the dusk to dawn arc into six night koku and classifies an instant.
 * All boundaries are {@code start + round(total * i / 6)} in milliseconds, so the six intervals of a period are
 * contiguous and the last one ends exactly at the period end.
 */
public final class TemporalTimeCalculator {

    public static final int KOKU_PER_PERIOD = 6;
    private static final long DAY_MILLIS = Duration.ofDays(1).toMillis();

    private TemporalTimeCalculator() {
    }

    /**
     * @param dawn         start of the day period
     * @param dusk         end of the day period
     * @param now          the instant to classify
     * @param previousDusk the previous day's dusk, used to place instants before {@code dawn} into the previous
     *                     night; may be null
     * @return the temporal hour containing {@code now}
     */
    public static TemporalTime calculate(Instant dawn, Instant dusk, Instant now, Instant previousDusk) {
        long dayMillis = Duration.between(dawn, dusk).toMillis();

        if (!now.isBefore(dawn) && now.isBefore(dusk)) {
            return classify(Period.DAY, dawn, dayMillis, now);
        }
        if (now.isBefore(dawn)) {
            if (previousDusk != null) {
                return classify(Period.NIGHT, previousDusk, Duration.between(previousDusk, dawn).toMillis(), now);
            }
            long nightMillis = DAY_MILLIS - dayMillis;
            return classify(Period.NIGHT, dawn.minusMillis(nightMillis), nightMillis, now);
        }
        return classify(Period.NIGHT, dusk, DAY_MILLIS - dayMillis, now);
    }

    public static TemporalTime calculate(Instant dawn, Instant dusk, Instant now) {
        return calculate(dawn, dusk, now, null);
    }

    /**
     * @return the six contiguous koku of the period [start, end)
     */
    public static List<TemporalTime> partition(Period period, Instant start, Instant end) {
        long totalMillis = Duration.between(start, end).toMillis();
        List<TemporalTime> result = new ArrayList<>(KOKU_PER_PERIOD);
        for (int koku = 1; koku <= KOKU_PER_PERIOD; koku++) {
            result.add(new TemporalTime(period, koku, boundary(start, totalMillis, koku - 1),
                    boundary(start, totalMillis, koku)));
        }
        return Collections.unmodifiableList(result);
    }

    /**
     * @return the six night koku following the given dusk, assuming the night lasts the rest of the 24 hours
     */
    public static List<TemporalTime> nightAfter(Instant dawn, Instant dusk) {
        long nightMillis = DAY_MILLIS - Duration.between(dawn, dusk).toMillis();
        return partition(Period.NIGHT, dusk, dusk.plusMillis(nightMillis));
    }

    private static TemporalTime classify(Period period, Instant start, long totalMillis, Instant now) {
        if (totalMillis <= 0) {
            // all boundaries collapse onto the start
            int koku = now.isBefore(start) ? 1 : KOKU_PER_PERIOD;
            return new TemporalTime(period, koku, start, start);
        }
        double kokuMillis = totalMillis / (double) KOKU_PER_PERIOD;
        long elapsed = Duration.between(start, now).toMillis();
        int koku = (int) Math.floor(elapsed / kokuMillis) + 1;
        koku = Math.max(1, Math.min(KOKU_PER_PERIOD, koku)); // guards the exact end boundary and degenerate spans
        // boundaries are rounded to whole milliseconds, the quotient is not
        if (koku < KOKU_PER_PERIOD && !now.isBefore(boundary(start, totalMillis, koku))) {
            koku++;
        } else if (koku > 1 && now.isBefore(boundary(start, totalMillis, koku - 1))) {
            koku--;
        }
        return new TemporalTime(period, koku, boundary(start, totalMillis, koku - 1), boundary(start, totalMillis, koku));
    }

    private static Instant boundary(Instant start, long totalMillis, int index) {
        return start.plusMillis(Math.round(totalMillis * (double) index / KOKU_PER_PERIOD));
    }
}
