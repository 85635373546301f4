package at.sv.edo.astronomy;

import java.time.Instant;

import static at.sv.edo.astronomy.AstronomyUtil.daysSinceJ2000;
import static at.sv.edo.astronomy.AstronomyUtil.normalizeDegrees;

/**
 * Low order solar ephemeris: mean longitude plus equation of center. Good to a few arc minutes around the present,
 * which translates into an error of a few minutes for the derived event times.
 */
public final class SolarPositionCalculator {

    private SolarPositionCalculator() {
    }

    public static SolarPosition calculate(Instant instant) {
        double days = daysSinceJ2000(instant);
        double t = days / 36525.0;

        double meanLongitude = 280.4665 + 36000.7698 * t;
        double meanAnomaly = Math.toRadians(357.5291 + 35999.0503 * t);
        double equationOfCenter = (1.9146 - 0.004817 * t - 0.000014 * t * t) * Math.sin(meanAnomaly)
                                  + (0.019993 - 0.000101 * t) * Math.sin(2 * meanAnomaly)
                                  + 0.000289 * Math.sin(3 * meanAnomaly);
        double longitude = normalizeDegrees(meanLongitude + equationOfCenter);

        double obliquity = 23.4393 - 0.0000004 * days;
        double declination = Math.toDegrees(Math.asin(Math.sin(Math.toRadians(longitude))
                                                      * Math.sin(Math.toRadians(obliquity))));
        return new SolarPosition(instant, days, longitude, obliquity, declination);
    }

    public static double solarLongitude(Instant instant) {
        return calculate(instant).longitude();
    }
}
