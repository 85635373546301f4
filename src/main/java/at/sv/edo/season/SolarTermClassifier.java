package at.sv.edo.season;

import static at.sv.edo.astronomy.AstronomyUtil.normalizeDegrees;

/**
 * Maps a solar longitude onto its solar term and micro-season. Both tables are total over [0,360).
 */
public final class SolarTermClassifier {

    private static final SolarTerm[] SOLAR_TERMS = SolarTerm.values();
    private static final MicroSeason[] MICRO_SEASONS = MicroSeason.values();

    private SolarTermClassifier() {
    }

    public static SolarTerm solarTermFor(double solarLongitude) {
        double longitude = normalizeDegrees(solarLongitude);
        int index = (int) Math.floor(longitude / SolarTerm.BAND_WIDTH);
        return SOLAR_TERMS[index % SOLAR_TERMS.length];
    }

    public static MicroSeason microSeasonFor(double solarLongitude) {
        double sinceStartOfSpring = normalizeDegrees(solarLongitude - MicroSeason.ORIGIN_LONGITUDE);
        int index = (int) Math.floor(sinceStartOfSpring / MicroSeason.BAND_WIDTH);
        return MICRO_SEASONS[index % MICRO_SEASONS.length];
    }
}
