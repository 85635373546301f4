package at.sv.edo.calendar;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.Collections;
import java.util.NavigableMap;
import java.util.TreeMap;

/**
 * Immutable date keyed lunar calendar, built once from the reference dataset. Rows have the columns
 * {@code date,weekday,lunar_year,lunar_month,lunar_day,leap_month,kanshi,rokuyo}; weekday and kanshi are ignored.
 * Lookups never extrapolate beyond the covered span.
 */
public final class LunarCalendarTable {

    private static final int COLUMNS = 8;
    private static final int DATE = 0;
    private static final int LUNAR_YEAR = 2;
    private static final int LUNAR_MONTH = 3;
    private static final int LUNAR_DAY = 4;
    private static final int LEAP_MONTH = 5;
    private static final int ROKUYO = 7;

    private final NavigableMap<LocalDate, LunarCalendarEntry> entries;

    private LunarCalendarTable(NavigableMap<LocalDate, LunarCalendarEntry> entries) {
        this.entries = Collections.unmodifiableNavigableMap(entries);
    }

    /**
     * @throws InvalidReferenceData if the dataset can't be read, a row is malformed, a date occurs twice or there are
     *                              no rows at all
     */
    public static LunarCalendarTable parse(Reader reader) {
        TreeMap<LocalDate, LunarCalendarEntry> entries = new TreeMap<>();
        BufferedReader lines = new BufferedReader(reader);
        int lineNumber = 0;
        try {
            String line;
            while ((line = lines.readLine()) != null) {
                lineNumber++;
                if (lineNumber == 1 && !line.isEmpty() && line.charAt(0) == '\uFEFF') {
                    line = line.substring(1);
                }
                if (line.isBlank()) {
                    continue;
                }
                String[] columns = line.split(",", -1);
                if (lineNumber == 1 && isHeader(columns[DATE])) {
                    continue;
                }
                LunarCalendarEntry entry = parseRow(columns, lineNumber);
                if (entries.put(entry.date(), entry) != null) {
                    throw new InvalidReferenceData("Duplicate date '" + entry.date() + "' in line " + lineNumber);
                }
            }
        } catch (IOException e) {
            throw new InvalidReferenceData("Failed to read lunar calendar data: " + e.getMessage(), e);
        }
        if (entries.isEmpty()) {
            throw new InvalidReferenceData("Lunar calendar data contains no rows");
        }
        return new LunarCalendarTable(entries);
    }

    private static boolean isHeader(String firstColumn) {
        try {
            LocalDate.parse(firstColumn.trim());
            return false;
        } catch (DateTimeParseException e) {
            return true;
        }
    }

    private static LunarCalendarEntry parseRow(String[] columns, int lineNumber) {
        if (columns.length < COLUMNS) {
            throw new InvalidReferenceData("Invalid lunar calendar row in line " + lineNumber + ": expected " +
                                           COLUMNS + " columns, got " + columns.length);
        }
        try {
            LocalDate date = LocalDate.parse(columns[DATE].trim());
            LunarDate lunarDate = new LunarDate(Integer.parseInt(columns[LUNAR_YEAR].trim()),
                    Integer.parseInt(columns[LUNAR_MONTH].trim()),
                    Integer.parseInt(columns[LUNAR_DAY].trim()),
                    parseLeapFlag(columns[LEAP_MONTH].trim()));
            return new LunarCalendarEntry(date, lunarDate, Rokuyo.parse(columns[ROKUYO]));
        } catch (IllegalArgumentException | DateTimeParseException e) {
            throw new InvalidReferenceData("Invalid lunar calendar row in line " + lineNumber + ": " + e.getMessage(), e);
        }
    }

    private static boolean parseLeapFlag(String token) {
        if ("true".equalsIgnoreCase(token)) {
            return true;
        }
        if ("false".equalsIgnoreCase(token)) {
            return false;
        }
        throw new IllegalArgumentException("Invalid leap month flag '" + token + "'");
    }

    /**
     * @param date civil date in the caller's zone
     */
    public LunarLookup lookup(LocalDate date) {
        LunarCalendarEntry entry = entries.get(date);
        if (entry != null) {
            return LunarLookup.found(entry);
        }
        if (date.isBefore(coveredFrom())) {
            return LunarLookup.failed(LookupFailure.Kind.DATE_OUT_OF_RANGE,
                    "Date " + date + " is before the lunar calendar data, which starts at " + coveredFrom());
        }
        if (date.isAfter(coveredTo())) {
            return LunarLookup.failed(LookupFailure.Kind.DATE_OUT_OF_RANGE,
                    "Date " + date + " is after the lunar calendar data, which ends at " + coveredTo());
        }
        return LunarLookup.failed(LookupFailure.Kind.DATE_NOT_FOUND,
                "No lunar calendar data for " + date + " within " + coveredFrom() + " to " + coveredTo());
    }

    /**
     * @param isoDate date key in {@code YYYY-MM-DD} form
     */
    public LunarLookup lookup(String isoDate) {
        LocalDate date;
        try {
            date = LocalDate.parse(isoDate);
        } catch (DateTimeParseException e) {
            return LunarLookup.failed(LookupFailure.Kind.DATE_NOT_FOUND, "Invalid date key '" + isoDate + "'");
        }
        return lookup(date);
    }

    public LocalDate coveredFrom() {
        return entries.firstKey();
    }

    public LocalDate coveredTo() {
        return entries.lastKey();
    }

    public int size() {
        return entries.size();
    }
}
