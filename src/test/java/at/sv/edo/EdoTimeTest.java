package at.sv.edo;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import picocli.CommandLine;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;

class EdoTimeTest {

    private static final String[] TOKYO = {"--lat", "35.6762", "--long", "139.6503", "--tz", "Asia/Tokyo"};

    private StringWriter out;
    private StringWriter err;
    private CommandLine commandLine;

    private int execute(String... args) {
        String[] all = new String[TOKYO.length + args.length];
        System.arraycopy(TOKYO, 0, all, 0, TOKYO.length);
        System.arraycopy(args, 0, all, TOKYO.length, args.length);
        return commandLine.execute(all);
    }

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(Instant.parse("2026-06-21T03:00:00Z"), ZoneOffset.UTC);
        out = new StringWriter();
        err = new StringWriter();
        commandLine = new CommandLine(new EdoTime(clock));
        commandLine.setOverwrittenOptionsAllowed(true);
        commandLine.setOut(new PrintWriter(out));
        commandLine.setErr(new PrintWriter(err));
    }

    @Test
    void withoutTime_usesClock() {
        int exitCode = execute();

        assertThat(exitCode).isZero();
        assertThat(out.toString()).contains("time: 2026-06-21 12:00:00 +09:00")
                                  .contains("temporal_time: 昼九つ");
    }

    @Test
    void offsetTime() {
        int exitCode = execute("--time", "2026-06-21T23:00:00+09:00");

        assertThat(exitCode).isZero();
        assertThat(out.toString()).contains("temporal_time: 夜四つ (亥) 夜 3/6");
    }

    @Test
    void instantAndLocalTime_areEquivalent() {
        execute("--time", "2026-06-20T17:00:00Z");
        String fromInstant = out.toString();
        out.getBuffer().setLength(0);

        execute("--time", "2026-06-21T02:00:00");

        assertThat(out.toString()).isEqualTo(fromInstant).contains("暁八つ (丑) 夜 5/6");
    }

    @Test
    void zonedTime() {
        int exitCode = execute("--time", "2026-06-21T12:00:00+09:00[Asia/Tokyo]", "--schedule");

        assertThat(exitCode).isZero();
        assertThat(out.toString()).contains("\nday:\n").contains("\nnight:\n");
    }

    @Test
    void json() throws Exception {
        int exitCode = execute("--json");

        assertThat(exitCode).isZero();
        JsonNode json = new ObjectMapper().readTree(out.toString());
        assertThat(json.get("temporalTime").get("koku").asInt()).isEqualTo(4);
        assertThat(json.get("lunar").get("rokuyo").asText()).isEqualTo("大安");
    }

    @Test
    void invalidLatitude_usageError() {
        int exitCode = execute("--lat", "95");

        assertThat(exitCode).isEqualTo(2);
        assertThat(err.toString()).contains("--lat must be between -90 and 90 degrees");
    }

    @Test
    void invalidLongitude_usageError() {
        assertThat(execute("--long", "-181")).isEqualTo(2);
        assertThat(err.toString()).contains("--long must be between -180 and 180 degrees");
    }

    @Test
    void invalidTimeZone_usageError() {
        assertThat(execute("--tz", "Mars/Olympus")).isEqualTo(2);
        assertThat(err.toString()).contains("--tz 'Mars/Olympus'");
    }

    @Test
    void invalidTime_usageError() {
        assertThat(execute("--time", "yesterday")).isEqualTo(2);
        assertThat(err.toString()).contains("--time 'yesterday'");
    }

    @Test
    void unreadableLunarData_usageError() {
        assertThat(execute("--lunar-data", "does/not/exist.csv")).isEqualTo(2);
        assertThat(err.toString()).contains("--lunar-data");
    }
}
