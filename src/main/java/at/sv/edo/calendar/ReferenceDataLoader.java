package at.sv.edo.calendar;

import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Loads the lunar calendar and new moon tables, either from the bundled classpath resources or from files.
 */
@Slf4j
public final class ReferenceDataLoader {

    public static final String DEFAULT_LUNAR_CALENDAR_RESOURCE = "data/lunar_2026_2028.csv";
    public static final String DEFAULT_NEW_MOON_RESOURCE = "data/new_moon_dates.json";

    private ReferenceDataLoader() {
    }

    public static ReferenceData loadDefault() {
        return new ReferenceData(loadLunarCalendar(DEFAULT_LUNAR_CALENDAR_RESOURCE), loadNewMoons(DEFAULT_NEW_MOON_RESOURCE));
    }

    /**
     * @param lunarCalendarFile dataset file, or null for the bundled one
     * @param newMoonFile       dataset file, or null for the bundled one
     */
    public static ReferenceData load(Path lunarCalendarFile, Path newMoonFile) {
        LunarCalendarTable lunarCalendar = lunarCalendarFile != null
                ? loadLunarCalendar(lunarCalendarFile) : loadLunarCalendar(DEFAULT_LUNAR_CALENDAR_RESOURCE);
        NewMoonTable newMoons = newMoonFile != null
                ? loadNewMoons(newMoonFile) : loadNewMoons(DEFAULT_NEW_MOON_RESOURCE);
        return new ReferenceData(lunarCalendar, newMoons);
    }

    public static LunarCalendarTable loadLunarCalendar(String resource) {
        try (InputStream inputStream = openResource(resource);
             Reader reader = new InputStreamReader(inputStream, StandardCharsets.UTF_8)) {
            return logLoaded(resource, LunarCalendarTable.parse(reader));
        } catch (IOException e) {
            throw new InvalidReferenceData("Failed to read '" + resource + "': " + e.getMessage(), e);
        }
    }

    public static LunarCalendarTable loadLunarCalendar(Path file) {
        try (Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            return logLoaded(file.toString(), LunarCalendarTable.parse(reader));
        } catch (IOException e) {
            throw new InvalidReferenceData("Failed to read '" + file + "': " + e.getMessage(), e);
        }
    }

    public static NewMoonTable loadNewMoons(String resource) {
        try (InputStream inputStream = openResource(resource)) {
            return logLoaded(resource, NewMoonTable.parse(inputStream));
        } catch (IOException e) {
            throw new InvalidReferenceData("Failed to read '" + resource + "': " + e.getMessage(), e);
        }
    }

    public static NewMoonTable loadNewMoons(Path file) {
        try (InputStream inputStream = Files.newInputStream(file)) {
            return logLoaded(file.toString(), NewMoonTable.parse(inputStream));
        } catch (IOException e) {
            throw new InvalidReferenceData("Failed to read '" + file + "': " + e.getMessage(), e);
        }
    }

    private static InputStream openResource(String resource) {
        InputStream inputStream = ReferenceDataLoader.class.getClassLoader().getResourceAsStream(resource);
        if (inputStream == null) {
            throw new InvalidReferenceData("Reference data '" + resource + "' not found on classpath");
        }
        return inputStream;
    }

    private static LunarCalendarTable logLoaded(String source, LunarCalendarTable table) {
        log.info("Loaded {} lunar calendar days ({} to {}) from '{}'", table.size(), table.coveredFrom(),
                table.coveredTo(), source);
        return table;
    }

    private static NewMoonTable logLoaded(String source, NewMoonTable table) {
        if (table.isEmpty()) {
            log.warn("No new moons in '{}', moon age will be unavailable", source);
        } else {
            log.info("Loaded {} new moons ({} to {}) from '{}'", table.size(), table.first(), table.last(), source);
        }
        return table;
    }
}
