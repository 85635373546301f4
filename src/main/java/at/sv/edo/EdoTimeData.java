package at.sv.edo;

import at.sv.edo.astronomy.LunarIllumination;
import at.sv.edo.astronomy.SunEvents;
import at.sv.edo.calendar.LunarLookup;
import at.sv.edo.calendar.MoonAgeResult;
import at.sv.edo.season.MicroSeason;
import at.sv.edo.season.SolarTerm;
import at.sv.edo.temporal.TemporalTime;
import lombok.Builder;

import java.time.Instant;
import java.time.LocalDate;
import java.util.List;

/**
 * Everything known about one instant at one location. The lunar lookup and the moon age may carry a failure
 * independently of each other; all other fields are always set.
 *
 * @param calendarDate  civil date of the instant in the location's zone
 * @param civilNoon     12:00 civil time on that date
 * @param sunEvents     sun events of the civil date
 * @param daySchedule   the six koku of the day period the instant was classified against
 * @param nightSchedule the six koku of the night that contains the instant, or follows the day period
 */
@Builder
public record EdoTimeData(Instant instant,
                          Location location,
                          LocalDate calendarDate,
                          Instant civilNoon,
                          double solarLongitude,
                          SolarTerm solarTerm,
                          MicroSeason microSeason,
                          SunEvents sunEvents,
                          TemporalTime temporalTime,
                          List<TemporalTime> daySchedule,
                          List<TemporalTime> nightSchedule,
                          LunarLookup lunar,
                          MoonAgeResult moonAge,
                          LunarIllumination moonIllumination) {
}
