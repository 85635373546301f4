package at.sv.edo.astronomy;

import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class SolarPositionCalculatorTest {

    @Test
    void atJ2000_matchesReferenceValues() {
        SolarPosition position = SolarPositionCalculator.calculate(AstronomyUtil.J2000);

        assertThat(position.daysSinceJ2000()).isEqualTo(0.0);
        assertThat(position.longitude()).isCloseTo(280.3822, within(1e-3));
        assertThat(position.obliquity()).isCloseTo(23.4393, within(1e-9));
        assertThat(position.declination()).isCloseTo(-23.0332, within(1e-3));
    }

    @Test
    void equinoxAndSolstice_2026() {
        assertThat(SolarPositionCalculator.solarLongitude(Instant.parse("2026-03-20T14:46:00Z")))
                .isCloseTo(0.0096, within(1e-3));
        assertThat(SolarPositionCalculator.solarLongitude(Instant.parse("2026-06-21T08:24:00Z")))
                .isCloseTo(90.0058, within(1e-3));
    }

    @Test
    void longitude_isAlwaysNormalized() {
        Instant instant = Instant.parse("2026-01-01T00:00:00Z");
        for (int day = 0; day < 3 * 365; day++) {
            double longitude = SolarPositionCalculator.solarLongitude(instant.plusSeconds(day * 86_400L));
            assertThat(longitude).isGreaterThanOrEqualTo(0.0).isLessThan(360.0);
        }
    }

    @Test
    void declination_followsSeasons() {
        assertThat(SolarPositionCalculator.calculate(Instant.parse("2026-06-21T03:00:00Z")).declination())
                .isCloseTo(23.44, within(0.05));
        assertThat(SolarPositionCalculator.calculate(Instant.parse("2026-12-21T03:00:00Z")).declination())
                .isCloseTo(-23.44, within(0.05));
        assertThat(SolarPositionCalculator.calculate(Instant.parse("2026-03-20T14:46:00Z")).declination())
                .isCloseTo(0.0, within(0.01));
    }

    @Test
    void normalizeDegrees_wrapsIntoRange() {
        assertThat(AstronomyUtil.normalizeDegrees(360.0)).isEqualTo(0.0);
        assertThat(AstronomyUtil.normalizeDegrees(-30.0)).isEqualTo(330.0);
        assertThat(AstronomyUtil.normalizeDegrees(725.5)).isEqualTo(5.5);
        assertThat(AstronomyUtil.normalizeDegrees(-1e-15)).isLessThan(360.0);
    }
}
