package at.sv.edo;

import at.sv.edo.astronomy.LunarIllumination;
import at.sv.edo.astronomy.MoonIlluminationProvider;
import at.sv.edo.astronomy.MoonIlluminationProviderImpl;
import at.sv.edo.astronomy.SolarNoonCalculator;
import at.sv.edo.astronomy.SolarPositionCalculator;
import at.sv.edo.astronomy.SunEvents;
import at.sv.edo.astronomy.SunEventsProvider;
import at.sv.edo.astronomy.SunEventsProviderImpl;
import at.sv.edo.calendar.LunarLookup;
import at.sv.edo.calendar.MoonAgeCalculator;
import at.sv.edo.calendar.MoonAgeResult;
import at.sv.edo.calendar.ReferenceData;
import at.sv.edo.season.SolarTermClassifier;
import at.sv.edo.temporal.Period;
import at.sv.edo.temporal.TemporalTime;
import at.sv.edo.temporal.TemporalTimeCalculator;
import at.sv.edo.time.StandardMeridians;
import at.sv.edo.time.TimeZoneResolver;
import at.sv.edo.time.TimeZoneResolverImpl;
import lombok.extern.slf4j.Slf4j;

import java.time.Instant;
import java.time.LocalDate;
import java.util.List;

/**
 * Combines all calculations for an instant and a location into one {@link EdoTimeData}. Stateless apart from the
 * immutable reference data, so one instance can be shared.
 */
@Slf4j
public final class EdoTimeCalculator {

    private final TimeZoneResolver timeZoneResolver;
    private final SunEventsProvider sunEventsProvider;
    private final ReferenceData referenceData;
    private final MoonAgeCalculator moonAgeCalculator;
    private final MoonIlluminationProvider moonIlluminationProvider;

    public EdoTimeCalculator(TimeZoneResolver timeZoneResolver, SunEventsProvider sunEventsProvider,
                             ReferenceData referenceData, MoonIlluminationProvider moonIlluminationProvider) {
        this.timeZoneResolver = timeZoneResolver;
        this.sunEventsProvider = sunEventsProvider;
        this.referenceData = referenceData;
        this.moonAgeCalculator = new MoonAgeCalculator(referenceData.newMoons());
        this.moonIlluminationProvider = moonIlluminationProvider;
    }

    public static EdoTimeCalculator create(ReferenceData referenceData) {
        TimeZoneResolver timeZoneResolver = new TimeZoneResolverImpl();
        SolarNoonCalculator solarNoonCalculator = new SolarNoonCalculator(timeZoneResolver, new StandardMeridians());
        return new EdoTimeCalculator(timeZoneResolver, new SunEventsProviderImpl(timeZoneResolver, solarNoonCalculator),
                referenceData, new MoonIlluminationProviderImpl());
    }

    public EdoTimeData calculate(Instant now, Location location) {
        LocalDate date = timeZoneResolver.calendarDate(now, location.zone());
        Instant civilNoon = timeZoneResolver.noonInstant(date, location.zone());
        double solarLongitude = SolarPositionCalculator.solarLongitude(now);
        log.trace("Calculating for {} at {}: civil date {}, solar longitude {}", now, location, date, solarLongitude);

        SunEvents today = sunEventsProvider.getSunEvents(date, location);
        EdoTimeData.EdoTimeDataBuilder builder = EdoTimeData.builder()
                                                            .instant(now)
                                                            .location(location)
                                                            .calendarDate(date)
                                                            .civilNoon(civilNoon)
                                                            .solarLongitude(solarLongitude)
                                                            .solarTerm(SolarTermClassifier.solarTermFor(solarLongitude))
                                                            .microSeason(SolarTermClassifier.microSeasonFor(solarLongitude))
                                                            .sunEvents(today);
        addTemporalTime(builder, now, date, location, today);

        LunarLookup lunar = referenceData.lunarCalendar().lookup(date);
        MoonAgeResult moonAge = moonAgeCalculator.calculate(now);
        if (!lunar.isFound()) {
            log.trace("No lunar date for {}: {}", date, lunar.failure());
        }
        if (!moonAge.isAvailable()) {
            log.trace("No moon age for {}: {}", now, moonAge.failure());
        }
        LunarIllumination illumination = new LunarIllumination(moonIlluminationProvider.getFraction(now),
                moonIlluminationProvider.getPhase(now));
        return builder.lunar(lunar)
                      .moonAge(moonAge)
                      .moonIllumination(illumination)
                      .build();
    }

    private void addTemporalTime(EdoTimeData.EdoTimeDataBuilder builder, Instant now, LocalDate date,
                                 Location location, SunEvents today) {
        if (!now.isBefore(today.dusk())) {
            addTemporalTimeAfterDusk(builder, now, date, location, today);
            return;
        }
        if (!now.isBefore(today.dawn())) {
            setTemporalTime(builder, TemporalTimeCalculator.calculate(today.dawn(), today.dusk(), now),
                    TemporalTimeCalculator.partition(Period.DAY, today.dawn(), today.dusk()),
                    TemporalTimeCalculator.nightAfter(today.dawn(), today.dusk()));
            return;
        }
        SunEvents yesterday = sunEventsProvider.getSunEvents(date.minusDays(1), location);
        if (now.isBefore(yesterday.dusk())) {
            // dusk of the previous civil day is after midnight
            log.trace("{} is before the previous day's dusk {}, using the previous day period", now, yesterday.dusk());
            setTemporalTime(builder, TemporalTimeCalculator.calculate(yesterday.dawn(), yesterday.dusk(), now),
                    TemporalTimeCalculator.partition(Period.DAY, yesterday.dawn(), yesterday.dusk()),
                    TemporalTimeCalculator.nightAfter(yesterday.dawn(), yesterday.dusk()));
            return;
        }
        setTemporalTime(builder, TemporalTimeCalculator.calculate(today.dawn(), today.dusk(), now, yesterday.dusk()),
                TemporalTimeCalculator.partition(Period.DAY, today.dawn(), today.dusk()),
                TemporalTimeCalculator.partition(Period.NIGHT, yesterday.dusk(), today.dawn()));
    }

    private void addTemporalTimeAfterDusk(EdoTimeData.EdoTimeDataBuilder builder, Instant now, LocalDate date,
                                          Location location, SunEvents today) {
        SunEvents tomorrow = sunEventsProvider.getSunEvents(date.plusDays(1), location);
        if (!now.isBefore(tomorrow.dawn())) {
            // dawn of the next civil day is before midnight
            log.trace("{} is after the next day's dawn {}, using the next day period", now, tomorrow.dawn());
            setTemporalTime(builder, TemporalTimeCalculator.calculate(tomorrow.dawn(), tomorrow.dusk(), now),
                    TemporalTimeCalculator.partition(Period.DAY, tomorrow.dawn(), tomorrow.dusk()),
                    TemporalTimeCalculator.nightAfter(tomorrow.dawn(), tomorrow.dusk()));
            return;
        }
        List<TemporalTime> night = TemporalTimeCalculator.nightAfter(today.dawn(), today.dusk());
        if (now.isBefore(night.get(night.size() - 1).end())) {
            setTemporalTime(builder, TemporalTimeCalculator.calculate(today.dawn(), today.dusk(), now),
                    TemporalTimeCalculator.partition(Period.DAY, today.dawn(), today.dusk()), night);
            return;
        }
        // the next dawn is later than a 24 hour cycle would place it
        setTemporalTime(builder, TemporalTimeCalculator.calculate(tomorrow.dawn(), tomorrow.dusk(), now, today.dusk()),
                TemporalTimeCalculator.partition(Period.DAY, today.dawn(), today.dusk()),
                TemporalTimeCalculator.partition(Period.NIGHT, today.dusk(), tomorrow.dawn()));
    }

    private static void setTemporalTime(EdoTimeData.EdoTimeDataBuilder builder, TemporalTime temporalTime,
                                        List<TemporalTime> daySchedule, List<TemporalTime> nightSchedule) {
        builder.temporalTime(temporalTime)
               .daySchedule(daySchedule)
               .nightSchedule(nightSchedule);
    }
}
