package at.sv.edo.calendar;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class MoonPhaseNameTest {

    @Test
    void forAge_bandBoundaries() {
        assertThat(MoonPhaseName.forAge(0)).isEqualTo(MoonPhaseName.SHINGETSU);
        assertThat(MoonPhaseName.forAge(1.49)).isEqualTo(MoonPhaseName.SHINGETSU);
        assertThat(MoonPhaseName.forAge(1.5)).isEqualTo(MoonPhaseName.FUTSUKAZUKI);
        assertThat(MoonPhaseName.forAge(3)).isEqualTo(MoonPhaseName.MIKAZUKI);
        assertThat(MoonPhaseName.forAge(7)).isEqualTo(MoonPhaseName.JOGEN);
        assertThat(MoonPhaseName.forAge(15)).isEqualTo(MoonPhaseName.MANGETSU);
        assertThat(MoonPhaseName.forAge(16)).isEqualTo(MoonPhaseName.IZAYOI);
        assertThat(MoonPhaseName.forAge(22)).isEqualTo(MoonPhaseName.KAGEN);
        assertThat(MoonPhaseName.forAge(29.5)).isEqualTo(MoonPhaseName.MISOKAZUKI);
    }

    @Test
    void forAge_wrapsAround() {
        assertThat(MoonPhaseName.forAge(MoonAgeCalculator.SYNODIC_MONTH)).isEqualTo(MoonPhaseName.SHINGETSU);
        assertThat(MoonPhaseName.forAge(-1)).isEqualTo(MoonPhaseName.MISOKAZUKI);
    }

    @Test
    void bandsAreContiguous() {
        MoonPhaseName[] names = MoonPhaseName.values();
        assertThat(names).hasSize(20);
        assertThat(names[0].getStartAge()).isEqualTo(0.0);
        for (int i = 1; i < names.length; i++) {
            assertThat(names[i].getStartAge()).isEqualTo(names[i - 1].getEndAge());
        }
        assertThat(names[names.length - 1].getEndAge()).isEqualTo(MoonAgeCalculator.SYNODIC_MONTH);
    }

    @Test
    void labels() {
        assertThat(MoonPhaseName.MANGETSU.getLabel()).isEqualTo("満月");
        assertThat(MoonPhaseName.IZAYOI.getReading()).isEqualTo("いざよい");
    }
}
