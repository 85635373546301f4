package at.sv.edo.astronomy;

import at.sv.edo.Location;
import at.sv.edo.time.TimeZoneResolver;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;

/**
 * Hour angle based event times. The declination is taken at civil noon for the whole day and the events are placed
 * symmetrically around true solar noon.
 */
@Slf4j
public final class SunEventsProviderImpl implements SunEventsProvider {

    private static final Duration POLAR_FALLBACK_OFFSET = Duration.ofHours(6);

    private final TimeZoneResolver timeZoneResolver;
    private final SolarNoonCalculator solarNoonCalculator;

    public SunEventsProviderImpl(TimeZoneResolver timeZoneResolver, SolarNoonCalculator solarNoonCalculator) {
        this.timeZoneResolver = timeZoneResolver;
        this.solarNoonCalculator = solarNoonCalculator;
    }

    @Override
    public RiseAndSet getRiseAndSet(LocalDate date, Location location, double altitude) {
        Instant solarNoon = solarNoonCalculator.solarNoon(date, location);
        return riseAndSet(date, location, altitude, solarNoon);
    }

    @Override
    public SunEvents getSunEvents(LocalDate date, Location location) {
        Instant solarNoon = solarNoonCalculator.solarNoon(date, location);
        RiseAndSet sun = riseAndSet(date, location, SUNRISE_ALTITUDE, solarNoon);
        RiseAndSet twilight = riseAndSet(date, location, TWILIGHT_ALTITUDE, solarNoon);
        return SunEvents.of(solarNoon, sun, twilight);
    }

    private RiseAndSet riseAndSet(LocalDate date, Location location, double altitude, Instant solarNoon) {
        Instant civilNoon = timeZoneResolver.noonInstant(date, location.zone());
        double declination = Math.toRadians(SolarPositionCalculator.calculate(civilNoon).declination());
        double latitude = Math.toRadians(location.latitude());

        double hourAngleCosine = (Math.sin(Math.toRadians(altitude)) - Math.sin(latitude) * Math.sin(declination))
                                 / (Math.cos(latitude) * Math.cos(declination));

        if (!(Math.abs(hourAngleCosine) <= 1)) { // also catches NaN at the poles
            log.debug("Sun does not cross {}° on {} at {} (cos H = {}), using solar noon ±6h.",
                    altitude, date, location, hourAngleCosine);
            return new RiseAndSet(solarNoon.minus(POLAR_FALLBACK_OFFSET), solarNoon.plus(POLAR_FALLBACK_OFFSET), true);
        }

        double hourAngleDegrees = Math.toDegrees(Math.acos(hourAngleCosine));
        double offsetMinutes = hourAngleDegrees / 15 * 60;
        return new RiseAndSet(AstronomyUtil.plusMinutes(solarNoon, -offsetMinutes),
                AstronomyUtil.plusMinutes(solarNoon, offsetMinutes), false);
    }
}
