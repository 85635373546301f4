package at.sv.edo.astronomy;

import java.time.Instant;

/**
 * The pair of instants at which the sun crosses a given altitude before and after solar noon.
 *
 * @param rise     the morning crossing
 * @param set      the evening crossing
 * @param fallback true if the sun never crossed the altitude on that day and both instants are the substituted
 *                 solar noon minus and plus six hours
 */
public record RiseAndSet(Instant rise, Instant set, boolean fallback) {
}
