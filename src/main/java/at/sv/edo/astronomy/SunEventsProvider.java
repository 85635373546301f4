package at.sv.edo.astronomy;

import at.sv.edo.Location;

import java.time.LocalDate;

public interface SunEventsProvider {

    /**
     * Geometric sunrise and sunset: the sun's center at altitude 0.
     */
    double SUNRISE_ALTITUDE = 0.0;

    /**
     * Depression of the sun at ake-mutsu and kure-mutsu, -7°21'40".
     */
    double TWILIGHT_ALTITUDE = -(7 + 21 / 60.0 + 40 / 3600.0);

    /**
     * @param date     civil day in the location's zone
     * @param location the observation point
     * @param altitude the solar altitude in degrees to find the crossings for
     * @return the morning and evening crossing, symmetric around true solar noon
     */
    RiseAndSet getRiseAndSet(LocalDate date, Location location, double altitude);

    SunEvents getSunEvents(LocalDate date, Location location);
}
