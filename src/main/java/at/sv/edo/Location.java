package at.sv.edo;

import java.time.ZoneId;

/**
 * An observation point: latitude and longitude in decimal degrees (north and east positive) and the zone whose civil
 * calendar is used for it.
 */
public record Location(double latitude, double longitude, ZoneId zone) {

    public static final Location TOKYO = new Location(35.6762, 139.6503, ZoneId.of("Asia/Tokyo"));

    public Location {
        if (Double.isNaN(latitude) || latitude < -90 || latitude > 90) {
            throw new InvalidLocation("Invalid latitude '" + latitude + "'. Allowed range: [-90,90]");
        }
        if (Double.isNaN(longitude) || longitude < -180 || longitude > 180) {
            throw new InvalidLocation("Invalid longitude '" + longitude + "'. Allowed range: [-180,180]");
        }
        if (zone == null) {
            throw new InvalidLocation("Missing time zone for location " + latitude + ", " + longitude);
        }
    }

    public static Location of(double latitude, double longitude, String zoneId) {
        return new Location(latitude, longitude, ZoneId.of(zoneId));
    }

    @Override
    public String toString() {
        return latitude + ", " + longitude + " (" + zone.getId() + ")";
    }
}
