package at.sv.edo;

import at.sv.edo.calendar.LunarCalendarEntry;
import at.sv.edo.calendar.LunarLookup;
import at.sv.edo.calendar.MoonAgeResult;
import at.sv.edo.temporal.KokuName;
import at.sv.edo.temporal.TemporalTime;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

import java.time.Instant;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Renders {@link EdoTimeData} as a plain text report or as JSON.
 */
public final class EdoTimeFormatter {

    private static final DateTimeFormatter DATE_TIME_FORMATTER = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss xxx");
    private static final DateTimeFormatter TIME_FORMATTER = DateTimeFormatter.ofPattern("HH:mm:ss");

    private final ObjectMapper objectMapper;

    public EdoTimeFormatter() {
        objectMapper = new ObjectMapper();
        objectMapper.registerModule(new JavaTimeModule());
        objectMapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        objectMapper.enable(SerializationFeature.INDENT_OUTPUT);
    }

    public String toText(EdoTimeData data, boolean includeSchedule) {
        ZoneId zone = data.location().zone();
        StringBuilder sb = new StringBuilder();
        sb.append("time: ").append(DATE_TIME_FORMATTER.format(data.instant().atZone(zone)))
          .append("\nlocation: ").append(data.location())
          .append("\ntemporal_time: ").append(formatTemporalTime(data.temporalTime(), zone))
          .append("\nsolar_longitude: ").append(String.format(Locale.ROOT, "%.2f°", data.solarLongitude()))
          .append("\nsolar_term: ").append(data.solarTerm().getLabel())
          .append(" (").append(data.solarTerm().getReading()).append(")")
          .append("\nmicro_season: ").append(data.microSeason().getLabel())
          .append(" (").append(data.microSeason().getReading()).append(")")
          .append("\n").append(data.sunEvents().toDebugString(zone))
          .append("\nlunar_date: ").append(formatLunar(data.lunar()))
          .append("\nmoon_age: ").append(formatMoonAge(data.moonAge()))
          .append("\nmoon_illumination: ")
          .append(String.format(Locale.ROOT, "%.0f%%", data.moonIllumination().fraction() * 100));
        if (includeSchedule) {
            sb.append("\nday:");
            data.daySchedule().forEach(koku -> sb.append("\n  ").append(formatTemporalTime(koku, zone)));
            sb.append("\nnight:");
            data.nightSchedule().forEach(koku -> sb.append("\n  ").append(formatTemporalTime(koku, zone)));
        }
        return sb.toString();
    }

    public String toJson(EdoTimeData data) {
        try {
            return objectMapper.writeValueAsString(toMap(data));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize result for " + data.instant(), e);
        }
    }

    private static String formatTemporalTime(TemporalTime temporalTime, ZoneId zone) {
        KokuName name = temporalTime.kokuName();
        return name.getLabel() + " (" + name.getBranch() + ") " + temporalTime.period().getLabel() + " " +
               temporalTime.koku() + "/6, " + formatTime(temporalTime.start(), zone) + " - " +
               formatTime(temporalTime.end(), zone);
    }

    private static String formatLunar(LunarLookup lunar) {
        if (!lunar.isFound()) {
            return "unavailable (" + lunar.failure() + ")";
        }
        LunarCalendarEntry entry = lunar.entry();
        return entry.lunarDate() + " " + entry.lunarDate().monthName().getLabel() + ", rokuyo: " +
               entry.rokuyo().getLabel();
    }

    private static String formatMoonAge(MoonAgeResult moonAge) {
        if (!moonAge.isAvailable()) {
            return "unavailable (" + moonAge.failure() + ")";
        }
        return String.format(Locale.ROOT, "%.1f", moonAge.moonAge()) + " (" + moonAge.phaseName().getLabel() + ")";
    }

    private static String formatTime(Instant instant, ZoneId zone) {
        return TIME_FORMATTER.format(instant.atZone(zone));
    }

    private static Map<String, Object> toMap(EdoTimeData data) {
        Map<String, Object> result = new LinkedHashMap<>();
        result.put("instant", data.instant());
        result.put("latitude", data.location().latitude());
        result.put("longitude", data.location().longitude());
        result.put("timeZone", data.location().zone().getId());
        result.put("calendarDate", data.calendarDate());
        result.put("civilNoon", data.civilNoon());
        result.put("solarLongitude", data.solarLongitude());
        result.put("solarTerm", labelled(data.solarTerm().name(), data.solarTerm().getLabel(),
                data.solarTerm().getReading()));
        result.put("microSeason", labelled(data.microSeason().name(), data.microSeason().getLabel(),
                data.microSeason().getReading()));

        Map<String, Object> sun = new LinkedHashMap<>();
        sun.put("dawn", data.sunEvents().dawn());
        sun.put("sunrise", data.sunEvents().sunrise());
        sun.put("solarNoon", data.sunEvents().solarNoon());
        sun.put("sunset", data.sunEvents().sunset());
        sun.put("dusk", data.sunEvents().dusk());
        sun.put("sunFallback", data.sunEvents().sunFallback());
        sun.put("twilightFallback", data.sunEvents().twilightFallback());
        result.put("sunEvents", sun);

        result.put("temporalTime", toMap(data.temporalTime()));
        result.put("daySchedule", toMaps(data.daySchedule()));
        result.put("nightSchedule", toMaps(data.nightSchedule()));

        Map<String, Object> lunar = new LinkedHashMap<>();
        if (data.lunar().isFound()) {
            LunarCalendarEntry entry = data.lunar().entry();
            lunar.put("year", entry.lunarDate().year());
            lunar.put("month", entry.lunarDate().month());
            lunar.put("day", entry.lunarDate().day());
            lunar.put("leapMonth", entry.lunarDate().leapMonth());
            lunar.put("monthName", entry.lunarDate().monthName().getLabel());
            lunar.put("rokuyo", entry.rokuyo().getLabel());
        } else {
            lunar.put("error", data.lunar().failure().kind().name());
            lunar.put("reason", data.lunar().failure().reason());
        }
        result.put("lunar", lunar);

        Map<String, Object> moon = new LinkedHashMap<>();
        if (data.moonAge().isAvailable()) {
            moon.put("age", data.moonAge().moonAge());
            moon.put("phaseName", data.moonAge().phaseName().getLabel());
        } else {
            moon.put("error", data.moonAge().failure().kind().name());
            moon.put("reason", data.moonAge().failure().reason());
        }
        moon.put("illumination", data.moonIllumination().fraction());
        moon.put("phaseAngle", data.moonIllumination().phase());
        result.put("moon", moon);
        return result;
    }

    private static Map<String, Object> labelled(String id, String label, String reading) {
        Map<String, Object> result = new LinkedHashMap<>();
        result.put("id", id);
        result.put("label", label);
        result.put("reading", reading);
        return result;
    }

    private static Map<String, Object> toMap(TemporalTime temporalTime) {
        Map<String, Object> result = new LinkedHashMap<>();
        result.put("period", temporalTime.period().name());
        result.put("koku", temporalTime.koku());
        result.put("name", temporalTime.kokuName().getLabel());
        result.put("branch", temporalTime.kokuName().getBranch());
        result.put("start", temporalTime.start());
        result.put("end", temporalTime.end());
        return result;
    }

    private static List<Map<String, Object>> toMaps(List<TemporalTime> temporalTimes) {
        List<Map<String, Object>> result = new ArrayList<>(temporalTimes.size());
        for (TemporalTime temporalTime : temporalTimes) {
            result.add(toMap(temporalTime));
        }
        return result;
    }
}
