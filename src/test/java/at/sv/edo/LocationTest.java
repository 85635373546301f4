package at.sv.edo;

import org.junit.jupiter.api.Test;

import java.time.ZoneId;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class LocationTest {

    @Test
    void validLocation() {
        Location location = Location.of(35.6762, 139.6503, "Asia/Tokyo");

        assertThat(location).isEqualTo(Location.TOKYO);
        assertThat(location.toString()).isEqualTo("35.6762, 139.6503 (Asia/Tokyo)");
    }

    @Test
    void bounds_areInclusive() {
        new Location(90, 180, ZoneId.of("UTC"));
        new Location(-90, -180, ZoneId.of("UTC"));
    }

    @Test
    void invalidLatitude_exception() {
        assertThatThrownBy(() -> new Location(90.1, 0, ZoneId.of("UTC"))).isInstanceOf(InvalidLocation.class)
                                                                          .hasMessageContaining("latitude");
        assertThatThrownBy(() -> new Location(Double.NaN, 0, ZoneId.of("UTC"))).isInstanceOf(InvalidLocation.class);
    }

    @Test
    void invalidLongitude_exception() {
        assertThatThrownBy(() -> new Location(0, -180.5, ZoneId.of("UTC"))).isInstanceOf(InvalidLocation.class)
                                                                            .hasMessageContaining("longitude");
    }

    @Test
    void missingZone_exception() {
        assertThatThrownBy(() -> new Location(0, 0, null)).isInstanceOf(InvalidLocation.class);
    }
}
