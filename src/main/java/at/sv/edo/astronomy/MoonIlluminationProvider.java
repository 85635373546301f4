package at.sv.edo.astronomy;

import java.time.Instant;

public interface MoonIlluminationProvider {

    /**
     * @return the illuminated fraction of the moon's disk, [0,1]
     */
    double getFraction(Instant instant);

    /**
     * @return the phase angle in degrees: -180 new moon, 0 full moon, 180 next new moon
     */
    double getPhase(Instant instant);
}
