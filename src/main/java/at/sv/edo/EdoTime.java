package at.sv.edo;

import at.sv.edo.calendar.ReferenceData;
import at.sv.edo.calendar.ReferenceDataLoader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.io.PrintWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.DateTimeException;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.format.DateTimeParseException;

@Command(name = "EdoTime", version = "0.1.0", mixinStandardHelpOptions = true, sortOptions = false,
        description = "Prints the Edo-period temporal hour, solar term, lunar date and moon age for a time and place.")
public final class EdoTime implements Runnable {

    private static final Logger LOG = LoggerFactory.getLogger(EdoTime.class);

    @CommandLine.Spec
    CommandLine.Model.CommandSpec spec;

    @Option(names = "--lat",
            defaultValue = "${env:LAT:-35.6762}",
            description = "The latitude of the location in degrees [-90..90]. Default: ${DEFAULT-VALUE}")
    double latitude;
    @Option(names = "--long",
            defaultValue = "${env:LONG:-139.6503}",
            description = "The longitude of the location in degrees [-180..180]. Default: ${DEFAULT-VALUE}")
    double longitude;
    @Option(names = "--tz", paramLabel = "<zone>",
            defaultValue = "${env:TIME_ZONE:-Asia/Tokyo}",
            description = "The IANA time zone whose civil calendar is used for the location. Default: ${DEFAULT-VALUE}")
    String timeZone;
    @Option(names = "--time", paramLabel = "<time>",
            description = "The time to calculate for, as ISO-8601 instant (2026-06-21T03:00:00Z), offset or zoned " +
                          "date time, or a local date time in the --tz zone. Default: now")
    String time;
    @Option(names = "--lunar-data", paramLabel = "<file>",
            defaultValue = "${env:LUNAR_DATA_FILE}",
            description = "Optional lunar calendar CSV overriding the bundled 2026-2028 dataset.")
    Path lunarDataFile;
    @Option(names = "--new-moon-data", paramLabel = "<file>",
            defaultValue = "${env:NEW_MOON_DATA_FILE}",
            description = "Optional JSON array of new moon instants overriding the bundled dataset.")
    Path newMoonDataFile;
    @Option(names = "--json",
            description = "Print the result as JSON instead of the text report.")
    boolean json;
    @Option(names = "--schedule",
            description = "Also print all six day and six night koku. Ignored with --json, which always contains them.")
    boolean schedule;

    private final Clock clock;

    public EdoTime() {
        this(Clock.systemUTC());
    }

    EdoTime(Clock clock) {
        this.clock = clock;
    }

    public static void main(String[] args) {
        int execute = new CommandLine(new EdoTime()).execute(args);
        if (execute != 0) {
            System.exit(execute);
        }
    }

    @Override
    public void run() {
        MDC.put("context", "init");
        assertConfigurationParameters();
        ZoneId zone = parseZone();
        Location location = new Location(latitude, longitude, zone);
        Instant instant = parseTime(zone);

        ReferenceData referenceData = ReferenceDataLoader.load(lunarDataFile, newMoonDataFile);
        EdoTimeCalculator calculator = EdoTimeCalculator.create(referenceData);

        MDC.put("context", "calculate");
        LOG.debug("Calculating Edo time for {} at {}", instant, location);
        EdoTimeData data = calculator.calculate(instant, location);
        if (data.sunEvents().isDegraded()) {
            LOG.info("Sun does not reach the required altitudes on {} at {}, event times are approximated.",
                    data.calendarDate(), location);
        }

        EdoTimeFormatter formatter = new EdoTimeFormatter();
        PrintWriter out = spec.commandLine().getOut();
        out.println(json ? formatter.toJson(data) : formatter.toText(data, schedule));
        out.flush();
        MDC.remove("context");
    }

    private void assertConfigurationParameters() {
        assertGeographicConfigurations();
        assertReferenceDataIsReadable();
    }

    private void assertGeographicConfigurations() {
        if (Double.isNaN(latitude) || latitude < -90 || latitude > 90) {
            fail("--lat must be between -90 and 90 degrees");
        }
        if (Double.isNaN(longitude) || longitude < -180 || longitude > 180) {
            fail("--long must be between -180 and 180 degrees");
        }
        if (timeZone == null || timeZone.isBlank()) {
            fail("--tz must not be empty");
        }
    }

    private void assertReferenceDataIsReadable() {
        if (lunarDataFile != null && !Files.isReadable(lunarDataFile)) {
            fail("--lunar-data file '" + lunarDataFile + "' is not readable");
        }
        if (newMoonDataFile != null && !Files.isReadable(newMoonDataFile)) {
            fail("--new-moon-data file '" + newMoonDataFile + "' is not readable");
        }
    }

    private ZoneId parseZone() {
        try {
            return ZoneId.of(timeZone.trim());
        } catch (DateTimeException e) {
            fail("--tz '" + timeZone + "' is no valid time zone: " + e.getMessage());
            return null;
        }
    }

    private Instant parseTime(ZoneId zone) {
        if (time == null || time.isBlank()) {
            return clock.instant();
        }
        String value = time.trim();
        try {
            if (value.length() > 10 && value.matches(".*(Z|[+-]\\d{2}:\\d{2}|\\[.+])$")) {
                return ZonedDateTime.parse(value).toInstant();
            }
            return LocalDateTime.parse(value).atZone(zone).toInstant();
        } catch (DateTimeParseException e) {
            fail("--time '" + time + "' is no valid ISO-8601 date time: " + e.getMessage());
            return null;
        }
    }

    private void fail(String msg) {
        if (spec != null) {
            throw new CommandLine.ParameterException(spec.commandLine(), msg);
        }
        throw new IllegalArgumentException(msg);
    }
}
