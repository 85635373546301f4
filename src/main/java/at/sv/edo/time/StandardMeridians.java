package at.sv.edo.time;

import lombok.extern.slf4j.Slf4j;

import java.time.Instant;
import java.time.ZoneId;
import java.util.Map;

import static java.util.Map.entry;

/**
 * Maps IANA zones to the longitude of the meridian their standard civil time is based on. Zones without an explicit
 * entry derive it from their standard (non daylight saving) offset, i.e. 15 degrees per hour.
 */
@Slf4j
public final class StandardMeridians {

    private static final Map<String, Double> DEFAULT_MERIDIANS = Map.ofEntries(
            entry("Asia/Tokyo", 135.0),
            entry("Asia/Seoul", 135.0),
            entry("Asia/Shanghai", 120.0),
            entry("Asia/Taipei", 120.0),
            entry("Asia/Kolkata", 82.5),
            entry("UTC", 0.0),
            entry("Europe/London", 0.0),
            entry("Europe/Berlin", 15.0),
            entry("Europe/Paris", 15.0),
            entry("Europe/Oslo", 15.0),
            entry("Europe/Vienna", 15.0),
            entry("America/New_York", -75.0),
            entry("America/Chicago", -90.0),
            entry("America/Denver", -105.0),
            entry("America/Los_Angeles", -120.0),
            entry("Australia/Sydney", 150.0),
            entry("Pacific/Honolulu", -150.0)
    );

    private final Map<String, Double> meridians;

    public StandardMeridians() {
        this(DEFAULT_MERIDIANS);
    }

    public StandardMeridians(Map<String, Double> meridians) {
        this.meridians = Map.copyOf(meridians);
    }

    /**
     * @param zone    the civil time zone
     * @param instant the instant used to resolve the standard offset of zones without an explicit entry
     * @return the standard meridian in degrees, east positive
     */
    public double standardMeridian(ZoneId zone, Instant instant) {
        Double meridian = meridians.get(zone.getId());
        if (meridian != null) {
            return meridian;
        }
        int standardOffsetSeconds = zone.getRules().getStandardOffset(instant).getTotalSeconds();
        double derived = standardOffsetSeconds / 240.0;
        log.debug("No standard meridian configured for '{}', derived {} from its standard offset.", zone.getId(), derived);
        return derived;
    }

    /**
     * @return the standard meridian shifted by the daylight saving amount in force at the instant, so that it matches
     * the civil clock of that instant
     */
    public double effectiveMeridian(ZoneId zone, Instant instant) {
        long daylightSavingSeconds = zone.getRules().getDaylightSavings(instant).getSeconds();
        return standardMeridian(zone, instant) + daylightSavingSeconds / 240.0;
    }

    public boolean isConfigured(ZoneId zone) {
        return meridians.containsKey(zone.getId());
    }
}
