package at.sv.edo.astronomy;

import java.time.Instant;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;

/**
 * Sun events of one civil day at one location. Under non-polar conditions {@code dawn <= sunrise <= solarNoon <=
 * sunset <= dusk} holds; the fallback flags mark pairs substituted by the polar approximation.
 */
public record SunEvents(Instant dawn, Instant sunrise, Instant solarNoon, Instant sunset, Instant dusk,
                        boolean sunFallback, boolean twilightFallback) {

    private static final DateTimeFormatter TIME_FORMATTER = DateTimeFormatter.ofPattern("HH:mm:ss");

    public static SunEvents of(Instant solarNoon, RiseAndSet sun, RiseAndSet twilight) {
        return new SunEvents(twilight.rise(), sun.rise(), solarNoon, sun.set(), twilight.set(),
                sun.fallback(), twilight.fallback());
    }

    public boolean isDegraded() {
        return sunFallback || twilightFallback;
    }

    public String toDebugString(ZoneId zone) {
        return "dawn: " + format(dawn, zone) + (twilightFallback ? " (approx.)" : "") +
               "\nsunrise: " + format(sunrise, zone) + (sunFallback ? " (approx.)" : "") +
               "\nsolar_noon: " + format(solarNoon, zone) +
               "\nsunset: " + format(sunset, zone) + (sunFallback ? " (approx.)" : "") +
               "\ndusk: " + format(dusk, zone) + (twilightFallback ? " (approx.)" : "");
    }

    private static String format(Instant instant, ZoneId zone) {
        return TIME_FORMATTER.format(instant.atZone(zone));
    }
}
