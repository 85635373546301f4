package at.sv.edo.astronomy;

import java.time.Instant;

/**
 * Position of the sun at an instant.
 *
 * @param instant        the instant the position was computed for
 * @param daysSinceJ2000 fractional days since {@link AstronomyUtil#J2000}
 * @param longitude      apparent ecliptic longitude in degrees, [0,360)
 * @param obliquity      obliquity of the ecliptic in degrees
 * @param declination    declination in degrees
 */
public record SolarPosition(Instant instant, double daysSinceJ2000, double longitude, double obliquity,
                            double declination) {
}
