package com.eainde.safepulse.capture;

/**
 * A place the user considers safe.
 *
 * @param radiusMeters non-positive means the default radius
 */
public record SafeZone(String name, double latitude, double longitude, double radiusMeters) {

    public static final double DEFAULT_RADIUS_METERS = 500;

    public SafeZone(String name, double latitude, double longitude) {
        this(name, latitude, longitude, DEFAULT_RADIUS_METERS);
    }

    public double effectiveRadius() {
        return radiusMeters > 0 ? radiusMeters : DEFAULT_RADIUS_METERS;
    }
}
