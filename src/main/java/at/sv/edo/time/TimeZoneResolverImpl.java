package at.sv.edo.time;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;

public final class TimeZoneResolverImpl implements TimeZoneResolver {

    @Override
    public LocalDate calendarDate(Instant instant, ZoneId zone) {
        return instant.atZone(zone).toLocalDate();
    }

    @Override
    public Instant noonInstant(LocalDate date, ZoneId zone) {
        return ZonedDateTime.of(date, LocalTime.NOON, zone).toInstant();
    }
}
