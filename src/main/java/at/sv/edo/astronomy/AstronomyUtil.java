package at.sv.edo.astronomy;

import java.time.Duration;
import java.time.Instant;

public final class AstronomyUtil {

    /**
     * 2000-01-01T12:00:00Z, the zero point of all time arguments.
     */
    public static final Instant J2000 = Instant.parse("2000-01-01T12:00:00Z");
    public static final double MILLIS_PER_DAY = 86_400_000.0;

    private AstronomyUtil() {
    }

    public static double daysSinceJ2000(Instant instant) {
        return Duration.between(J2000, instant).toMillis() / MILLIS_PER_DAY;
    }

    /**
     * @return the angle normalized into [0,360)
     */
    public static double normalizeDegrees(double degrees) {
        double normalized = degrees % 360;
        if (normalized < 0) {
            normalized += 360;
        }
        if (normalized >= 360) { // -1e-15 % 360 + 360 rounds up to 360.0
            normalized = 0;
        }
        return normalized;
    }

    public static Instant plusMinutes(Instant instant, double minutes) {
        return instant.plusMillis(Math.round(minutes * 60_000));
    }
}
