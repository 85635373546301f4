package at.sv.edo.astronomy;

/**
 * @param fraction illuminated fraction of the moon's disk, [0,1]
 * @param phase    phase angle in degrees, -180 (new) to 0 (full) to 180 (new)
 */
public record LunarIllumination(double fraction, double phase) {
}
