package at.sv.edo.calendar;

/**
 * Either the matching table entry or the reason there is none.
 */
public record LunarLookup(LunarCalendarEntry entry, LookupFailure failure) {

    public static LunarLookup found(LunarCalendarEntry entry) {
        return new LunarLookup(entry, null);
    }

    public static LunarLookup failed(LookupFailure.Kind kind, String reason) {
        return new LunarLookup(null, new LookupFailure(kind, reason));
    }

    public boolean isFound() {
        return entry != null;
    }
}
