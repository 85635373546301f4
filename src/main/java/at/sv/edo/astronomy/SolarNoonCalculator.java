package at.sv.edo.astronomy;

import at.sv.edo.Location;
import at.sv.edo.time.StandardMeridians;
import at.sv.edo.time.TimeZoneResolver;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;

/**
 * Computes the instant of apparent solar noon (true solar transit) from civil noon, the longitude offset to the zone's
 * standard meridian and the equation of time.
 */
@Slf4j
public final class SolarNoonCalculator {

    private final TimeZoneResolver timeZoneResolver;
    private final StandardMeridians standardMeridians;

    public SolarNoonCalculator(TimeZoneResolver timeZoneResolver, StandardMeridians standardMeridians) {
        this.timeZoneResolver = timeZoneResolver;
        this.standardMeridians = standardMeridians;
    }

    public Instant solarNoon(LocalDate date, Location location) {
        Instant civilNoon = timeZoneResolver.noonInstant(date, location.zone());
        double meridian = standardMeridians.effectiveMeridian(location.zone(), civilNoon);

        // east of the standard meridian the sun transits earlier
        double longitudeCorrectionMinutes = 4 * (meridian - location.longitude());
        double eotMinutes = equationOfTime(dayOfYear(date, location.zone()));
        double offsetMinutes = longitudeCorrectionMinutes - eotMinutes;
        Instant solarNoon = AstronomyUtil.plusMinutes(civilNoon, offsetMinutes);

        log.trace("Solar noon for {} at {}: longitudeCorrection={}min, eot={}min, offset={}min, solarNoon={}",
                date, location, longitudeCorrectionMinutes, eotMinutes, offsetMinutes, solarNoon);
        return solarNoon;
    }

    /**
     * Equation of time (apparent minus mean solar time) in minutes, NOAA short form.
     */
    static double equationOfTime(int dayOfYear) {
        double b = 2 * Math.PI * (dayOfYear - 81) / 365;
        return 9.87 * Math.sin(2 * b) - 7.53 * Math.cos(b) - 1.5 * Math.sin(b);
    }

    /**
     * Counts civil days between January 1st noon and the given day's noon in the zone, 1-based.
     */
    int dayOfYear(LocalDate date, ZoneId zone) {
        Instant noon = timeZoneResolver.noonInstant(date, zone);
        Instant januaryFirstNoon = timeZoneResolver.noonInstant(date.withDayOfYear(1), zone);
        double days = Duration.between(januaryFirstNoon, noon).toMillis() / AstronomyUtil.MILLIS_PER_DAY;
        return (int) Math.round(days) + 1;
    }
}
