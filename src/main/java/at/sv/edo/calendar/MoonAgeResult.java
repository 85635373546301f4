package at.sv.edo.calendar;

/**
 * Moon age in days in {@code [0, 29.530588)}, or the failure why it is unavailable (age is then 0).
 */
public record MoonAgeResult(double moonAge, LookupFailure failure) {

    public static MoonAgeResult of(double moonAge) {
        return new MoonAgeResult(moonAge, null);
    }

    public static MoonAgeResult failed(String reason) {
        return new MoonAgeResult(0, new LookupFailure(LookupFailure.Kind.DATA_RANGE, reason));
    }

    public boolean isAvailable() {
        return failure == null;
    }

    /**
     * @return the traditional name for the age, null if the age is unavailable
     */
    public MoonPhaseName phaseName() {
        if (failure != null) {
            return null;
        }
        return MoonPhaseName.forAge(moonAge);
    }
}
