package at.sv.edo.time;

import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;

public interface TimeZoneResolver {

    /**
     * @param instant the instant to resolve
     * @param zone    the IANA zone used as the civil calendar
     * @return the civil calendar day the instant falls on in the given zone
     */
    LocalDate calendarDate(Instant instant, ZoneId zone);

    /**
     * @param date the civil calendar day
     * @param zone the IANA zone used as the civil calendar
     * @return the instant of 12:00 local civil time on the given day
     */
    Instant noonInstant(LocalDate date, ZoneId zone);
}
