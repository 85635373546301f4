package at.sv.edo.calendar;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.InputStreamReader;
import java.io.Reader;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.time.LocalDate;
import java.util.Objects;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class LunarCalendarTableTest {

    private LunarCalendarTable table;

    private static LunarCalendarTable parse(String csv) {
        return LunarCalendarTable.parse(new StringReader(csv));
    }

    @BeforeEach
    void setUp() throws Exception {
        try (Reader reader = new InputStreamReader(Objects.requireNonNull(
                getClass().getClassLoader().getResourceAsStream("data/lunar_fixture.csv")), StandardCharsets.UTF_8)) {
            table = LunarCalendarTable.parse(reader);
        }
    }

    @Test
    void parse_skipsHeaderAndBlankLines() {
        assertThat(table.size()).isEqualTo(7);
        assertThat(table.coveredFrom()).isEqualTo(LocalDate.of(2026, 2, 15));
        assertThat(table.coveredTo()).isEqualTo(LocalDate.of(2026, 2, 22));
    }

    @Test
    void lookup_found() {
        LunarLookup lookup = table.lookup(LocalDate.of(2026, 2, 17));

        assertThat(lookup.isFound()).isTrue();
        assertThat(lookup.failure()).isNull();
        assertThat(lookup.entry().lunarDate()).isEqualTo(new LunarDate(2026, 1, 1, false));
        assertThat(lookup.entry().rokuyo()).isEqualTo(Rokuyo.SENSHO);
        assertThat(lookup.entry().lunarDate().monthName()).isEqualTo(WafuMonthName.MUTSUKI);
    }

    @Test
    void lookup_byIsoString() {
        assertThat(table.lookup("2026-02-16").entry().lunarDate()).isEqualTo(new LunarDate(2025, 12, 29, false));
    }

    @Test
    void lookup_compatibilityGlyphsAreNormalized() {
        assertThat(table.lookup(LocalDate.of(2026, 2, 21)).entry().rokuyo()).isEqualTo(Rokuyo.TAIAN);
        assertThat(table.lookup(LocalDate.of(2026, 2, 22)).entry().rokuyo()).isEqualTo(Rokuyo.SHAKKO);
    }

    @Test
    void lookup_leapFlag_isCaseInsensitive() {
        assertThat(table.lookup(LocalDate.of(2026, 2, 19)).entry().lunarDate().leapMonth()).isFalse();
    }

    @Test
    void lookup_beforeCoveredSpan_outOfRange() {
        LunarLookup lookup = table.lookup(LocalDate.of(2026, 2, 14));

        assertThat(lookup.isFound()).isFalse();
        assertThat(lookup.entry()).isNull();
        assertThat(lookup.failure().kind()).isEqualTo(LookupFailure.Kind.DATE_OUT_OF_RANGE);
        assertThat(lookup.failure().reason()).contains("before", "2026-02-15");
    }

    @Test
    void lookup_afterCoveredSpan_outOfRange() {
        LunarLookup lookup = table.lookup(LocalDate.of(2026, 2, 23));

        assertThat(lookup.failure().kind()).isEqualTo(LookupFailure.Kind.DATE_OUT_OF_RANGE);
        assertThat(lookup.failure().reason()).contains("after", "2026-02-22");
    }

    @Test
    void lookup_gap_notFound() {
        LunarLookup lookup = table.lookup(LocalDate.of(2026, 2, 18));

        assertThat(lookup.failure().kind()).isEqualTo(LookupFailure.Kind.DATE_NOT_FOUND);
    }

    @Test
    void lookup_invalidIsoString_notFound() {
        assertThat(table.lookup("2026-2-18").failure().kind()).isEqualTo(LookupFailure.Kind.DATE_NOT_FOUND);
    }

    @Test
    void parse_withoutHeader() {
        LunarCalendarTable parsed = parse("2028-06-23,金,2028,5,1,TRUE,癸未,大安\n");

        assertThat(parsed.lookup(LocalDate.of(2028, 6, 23)).entry().lunarDate())
                .isEqualTo(new LunarDate(2028, 5, 1, true));
    }

    @Test
    void parse_tooFewColumns_exceptionWithLineNumber() {
        assertThatThrownBy(() -> parse("date,weekday,lunar_year,lunar_month,lunar_day,leap_month,kanshi,rokuyo\n" +
                                       "2026-01-01,木,2025,11,13,FALSE,乙亥,大安\n" +
                                       "2026-01-02,金,2025,11\n"))
                .isInstanceOf(InvalidReferenceData.class)
                .hasMessageContaining("line 3");
    }

    @Test
    void parse_invalidValues_exception() {
        assertThatThrownBy(() -> parse("2026-01-01,木,2025,11,13,maybe,乙亥,大安\n"))
                .isInstanceOf(InvalidReferenceData.class)
                .hasMessageContaining("maybe");
        assertThatThrownBy(() -> parse("2026-01-01,木,2025,13,13,FALSE,乙亥,大安\n"))
                .isInstanceOf(InvalidReferenceData.class);
        assertThatThrownBy(() -> parse("2026-01-01,木,2025,11,13,FALSE,乙亥,吉日\n"))
                .isInstanceOf(InvalidReferenceData.class)
                .hasMessageContaining("吉日");
        assertThatThrownBy(() -> parse("2026-01-01,木,2025,11,13,FALSE,乙亥,大安\nnot-a-date,木,2025,11,13,FALSE,乙亥,大安\n"))
                .isInstanceOf(InvalidReferenceData.class)
                .hasMessageContaining("line 2");
    }

    @Test
    void parse_duplicateDate_exception() {
        assertThatThrownBy(() -> parse("2026-01-01,木,2025,11,13,FALSE,乙亥,大安\n2026-01-01,木,2025,11,13,FALSE,乙亥,大安\n"))
                .isInstanceOf(InvalidReferenceData.class)
                .hasMessageContaining("Duplicate");
    }

    @Test
    void parse_empty_exception() {
        assertThatThrownBy(() -> parse("date,weekday,lunar_year,lunar_month,lunar_day,leap_month,kanshi,rokuyo\n"))
                .isInstanceOf(InvalidReferenceData.class);
    }

    @Test
    void lunarDate_toString_marksLeapMonth() {
        assertThat(new LunarDate(2028, 5, 1, true).toString()).isEqualTo("2028/閏5/1");
        assertThat(new LunarDate(2026, 9, 8, false).monthName().getLabel()).isEqualTo("長月");
    }
}
