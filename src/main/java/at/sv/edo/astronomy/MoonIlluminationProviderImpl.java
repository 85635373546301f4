package at.sv.edo.astronomy;

import org.shredzone.commons.suncalc.MoonIllumination;

import java.time.Instant;
import java.time.ZoneOffset;

public final class MoonIlluminationProviderImpl implements MoonIlluminationProvider {

    @Override
    public double getFraction(Instant instant) {
        return illuminationAt(instant).getFraction();
    }

    @Override
    public double getPhase(Instant instant) {
        return illuminationAt(instant).getPhase();
    }

    private MoonIllumination illuminationAt(Instant instant) {
        return MoonIllumination.compute().on(instant.atZone(ZoneOffset.UTC)).execute();
    }
}
