package at.sv.edo.temporal;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class KokuNameTest {

    @Test
    void of_returnsNameForPeriodAndKoku() {
        assertThat(KokuName.of(Period.DAY, 1)).isEqualTo(KokuName.AKE_MUTSU);
        assertThat(KokuName.of(Period.DAY, 4).getLabel()).isEqualTo("昼九つ");
        assertThat(KokuName.of(Period.NIGHT, 1).getLabel()).isEqualTo("暮れ六つ");
        assertThat(KokuName.of(Period.NIGHT, 6)).isEqualTo(KokuName.AKATSUKI_NANATSU);
    }

    @Test
    void branches_followTwelveHourCycle() {
        assertThat(KokuName.of(Period.DAY, 4).getBranch()).isEqualTo("午");
        assertThat(KokuName.of(Period.NIGHT, 4).getBranch()).isEqualTo("子");
        assertThat(KokuName.of(Period.DAY, 1).getBranch()).isEqualTo("卯");
        assertThat(KokuName.of(Period.NIGHT, 1).getBranch()).isEqualTo("酉");
    }

    @Test
    void everyKokuHasMatchingPeriodAndNumber() {
        for (KokuName name : KokuName.values()) {
            assertThat(KokuName.of(name.getPeriod(), name.getKoku())).isEqualTo(name);
        }
    }

    @Test
    void of_invalidKoku_exception() {
        assertThatThrownBy(() -> KokuName.of(Period.DAY, 0)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> KokuName.of(Period.NIGHT, 7)).isInstanceOf(IllegalArgumentException.class);
    }
}
